package com.koni.ems.infrastructure.web.controller;

import com.koni.ems.application.service.StorageAdministrationService;
import com.koni.ems.application.service.StorageReadiness;
import com.koni.ems.domain.exception.PermissionDeniedException;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DeviceStoreState;
import com.koni.ems.domain.model.ReclaimReport;
import com.koni.ems.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@UnitTest
@WebMvcTest(StorageAdminController.class)
class StorageAdminControllerTest {

    private static final Caller ADMIN = Caller.admin("u-admin");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StorageAdministrationService administrationService;

    @MockBean
    private StorageReadiness readiness;

    @Test
    void shouldRunOrphanSweep() throws Exception {
        when(administrationService.reclaimOrphans(ADMIN))
                .thenReturn(new ReclaimReport(2, List.of("device_b"), List.of()));

        mockMvc.perform(post("/api/v1/admin/storage/reclaim")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.examined").value(2))
                .andExpect(jsonPath("$.dropped[0]").value("device_b"));
    }

    @Test
    void shouldSetRetentionInDays() throws Exception {
        when(administrationService.setRetention(ADMIN, "pm-1", Duration.ofDays(30))).thenReturn(Duration.ofDays(30));

        mockMvc.perform(put("/api/v1/admin/storage/pm-1/retention")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"days\":30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceId").value("pm-1"))
                .andExpect(jsonPath("$.retentionDays").value(30));
    }

    @Test
    void shouldFallBackToConfiguredRetention() throws Exception {
        when(administrationService.setRetention(eq(ADMIN), eq("pm-1"), isNull())).thenReturn(Duration.ofDays(90));

        mockMvc.perform(put("/api/v1/admin/storage/pm-1/retention")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retentionDays").value(90));
    }

    @Test
    void shouldRejectNonPositiveRetention() throws Exception {
        mockMvc.perform(put("/api/v1/admin/storage/pm-1/retention")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"days\":0}"))
                .andExpect(status().isBadRequest());

        verify(administrationService, never()).setRetention(any(), any(), any());
    }

    @Test
    void shouldRemoveRetentionAndInspect() throws Exception {
        when(administrationService.removeRetention(ADMIN, "pm-1")).thenReturn(1);
        when(administrationService.inspect(ADMIN, "PM-1")).thenReturn(DeviceStoreState.COMPRESSED);

        mockMvc.perform(delete("/api/v1/admin/storage/pm-1/retention")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(1));

        mockMvc.perform(get("/api/v1/admin/storage/PM-1")
                        .header("X-User-Id", "u-admin")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relation").value("device_pm_1"))
                .andExpect(jsonPath("$.state").value("COMPRESSED"));
    }

    @Test
    void shouldRefuseNonAdministrators() throws Exception {
        when(administrationService.reclaimOrphans(any()))
                .thenThrow(new PermissionDeniedException("Administrator role required"));

        mockMvc.perform(post("/api/v1/admin/storage/reclaim").header("X-User-Id", "u-1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Administrator role required"));
    }
}
