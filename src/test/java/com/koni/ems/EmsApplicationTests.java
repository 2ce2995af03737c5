package com.koni.ems;

import com.koni.ems.application.service.StorageReadiness;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class EmsApplicationTests {

	@MockBean
	private KafkaTemplate<?, ?> kafkaTemplate;

	@Autowired
	private StorageReadiness readiness;

	@Test
	void contextLoads() {
		// Storage initialization runs as part of startup with H2 and no orphan sweep
		assertThat(readiness.isReady()).isTrue();
	}

}
