package com.example.reminder.cron.security;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared trigger secret, taken from the {@code secret} query parameter or the
 * {@code Authorization} header (with or without the {@code Bearer } prefix).
 */
@Component
@RequiredArgsConstructor
public class CronSecretVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AppProperties appProperties;

    /**
     * @throws ConfigurationException if no secret is configured
     */
    public boolean verify(String querySecret, String authorizationHeader) {
        String secret = appProperties.getCron().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("Cron secret is not configured (reminder.cron.secret / CRON_SECRET)");
        }
        if (querySecret != null && matches(secret, querySecret)) {
            return true;
        }
        if (authorizationHeader == null) {
            return false;
        }
        String token = authorizationHeader.startsWith(BEARER_PREFIX)
                ? authorizationHeader.substring(BEARER_PREFIX.length())
                : authorizationHeader;
        return matches(secret, token);
    }

    private static boolean matches(String expected, String candidate) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }
}
