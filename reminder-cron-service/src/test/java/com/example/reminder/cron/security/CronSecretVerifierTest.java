package com.example.reminder.cron.security;

import com.example.reminder.shared.config.AppProperties;
import com.example.reminder.shared.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSecretVerifierTest {

    private AppProperties appProperties;
    private CronSecretVerifier verifier;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getCron().setSecret("s3cret");
        verifier = new CronSecretVerifier(appProperties);
    }

    @Test
    void acceptsQuerySecret() {
        assertThat(verifier.verify("s3cret", null)).isTrue();
    }

    @Test
    void acceptsBearerAndRawHeader() {
        assertThat(verifier.verify(null, "Bearer s3cret")).isTrue();
        assertThat(verifier.verify(null, "s3cret")).isTrue();
    }

    @Test
    @DisplayName("a wrong query secret still falls through to the header")
    void wrongQueryRightHeader() {
        assertThat(verifier.verify("nope", "Bearer s3cret")).isTrue();
    }

    @Test
    void rejectsWrongOrMissingCredentials() {
        assertThat(verifier.verify("nope", null)).isFalse();
        assertThat(verifier.verify(null, "Bearer nope")).isFalse();
        assertThat(verifier.verify(null, null)).isFalse();
    }

    @Test
    @DisplayName("a missing secret is a configuration error, not a rejection")
    void missingSecret() {
        appProperties.getCron().setSecret(" ");

        assertThatThrownBy(() -> verifier.verify("anything", null))
                .isInstanceOf(ConfigurationException.class);
    }
}
