package com.example.reminder.cron.controller;

import com.example.reminder.cron.dto.CronRunSummary;
import com.example.reminder.cron.security.CronSecretVerifier;
import com.example.reminder.cron.service.CronOrchestratorService;
import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CronTriggerControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T01:00:00Z");

    @Mock
    private CronOrchestratorService cronOrchestratorService;

    private AppProperties appProperties;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getCron().setSecret("s3cret");
        CronTriggerController controller = new CronTriggerController(
                new CronSecretVerifier(appProperties), cronOrchestratorService, Clock.fixed(NOW, ZoneOffset.UTC));
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static CronRunSummary summary() {
        return CronRunSummary.builder().checked(2).sent(1).skipped(1).cacheHit(true).timestamp(NOW).build();
    }

    @Test
    @DisplayName("GET with the query secret runs a tick")
    void querySecret() {
        when(cronOrchestratorService.runOnce(NOW)).thenReturn(Mono.just(summary()));

        client.get().uri("/api/cron/send-reminders?secret=s3cret")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.checked").isEqualTo(2)
                .jsonPath("$.sent").isEqualTo(1)
                .jsonPath("$.cacheHit").isEqualTo(true);
    }

    @Test
    @DisplayName("POST with a bearer token runs a tick")
    void bearerToken() {
        when(cronOrchestratorService.runOnce(NOW)).thenReturn(Mono.just(summary()));

        client.post().uri("/api/cron/send-reminders")
                .header(HttpHeaders.AUTHORIZATION, "Bearer s3cret")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.skipped").isEqualTo(1);
    }

    @Test
    void wrongSecretIsUnauthorized() {
        client.get().uri("/api/cron/send-reminders?secret=wrong")
                .exchange()
                .expectStatus().isUnauthorized();

        verifyNoInteractions(cronOrchestratorService);
    }

    @Test
    @DisplayName("an unconfigured secret is a server error")
    void missingSecretIsServerError() {
        appProperties.getCron().setSecret(null);

        client.get().uri("/api/cron/send-reminders?secret=anything")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody().jsonPath("$.error").isEqualTo("Server Misconfigured");

        verifyNoInteractions(cronOrchestratorService);
    }

    @Test
    @DisplayName("an unexpected failure returns a summary with one error")
    void runFailure() {
        when(cronOrchestratorService.runOnce(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        client.get().uri("/api/cron/send-reminders?secret=s3cret")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.errors").isEqualTo(1)
                .jsonPath("$.message").isEqualTo("boom");
    }
}
