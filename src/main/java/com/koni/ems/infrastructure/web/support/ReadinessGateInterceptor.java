package com.koni.ems.infrastructure.web.support;

import com.koni.ems.application.service.StorageReadiness;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Refuses API requests until storage initialization has finished.
 */
@RequiredArgsConstructor
public class ReadinessGateInterceptor implements HandlerInterceptor {

    private final StorageReadiness readiness;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        readiness.requireReady();
        return true;
    }
}
