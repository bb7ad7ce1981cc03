package com.example.reminder.cron.controller;

import com.example.reminder.cron.dto.CronRunSummary;
import com.example.reminder.cron.security.CronSecretVerifier;
import com.example.reminder.cron.service.CronOrchestratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
@Slf4j
public class CronTriggerController {

    private final CronSecretVerifier cronSecretVerifier;
    private final CronOrchestratorService cronOrchestratorService;
    private final Clock clock;

    @RequestMapping(path = "/send-reminders", method = {RequestMethod.GET, RequestMethod.POST})
    public Mono<ResponseEntity<CronRunSummary>> sendReminders(
            @RequestParam(name = "secret", required = false) String secret,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        if (!cronSecretVerifier.verify(secret, authorization)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }

        Instant now = clock.instant();
        return cronOrchestratorService.runOnce(now)
                .map(ResponseEntity::ok)
                .onErrorResume(e -> {
                    log.error("Cron run failed", e);
                    CronRunSummary failed = CronRunSummary.builder()
                            .errors(1)
                            .timestamp(now)
                            .message(e.getMessage())
                            .build();
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(failed));
                });
    }
}
