package com.multila.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void acceptsCompleteConfiguration() {
        MockEnvironment environment = validEnvironment();

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingAndUnparsableSettings() {
        MockEnvironment environment = validEnvironment()
                .withProperty("multila.export.directory", " ")
                .withProperty("jwt.expiration", "soon")
                .withProperty("multila.time-zone", "Mars/Olympus")
                .withProperty("multila.export.retention", "7 days");

        assertThat(new EnvironmentValidator(environment).collectProblems()).containsExactlyInAnyOrder(
                "multila.export.directory is missing",
                "jwt.expiration must be a number of milliseconds",
                "multila.time-zone has an invalid value 'Mars/Olympus'",
                "multila.export.retention has an invalid value '7 days'");
    }

    @Test
    void developmentSecretIsOnlyAcceptedInDevAndTest() {
        MockEnvironment environment = validEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret still uses the development default");

        environment.setActiveProfiles("test");
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void refusesToStartWithProblems() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.expiration", "1000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be between");
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://db:5432/multila")
                .withProperty("jwt.secret", "a-production-secret-with-enough-entropy-123456")
                .withProperty("jwt.expiration", "900000")
                .withProperty("multila.export.directory", "/var/lib/multila/exports")
                .withProperty("multila.time-zone", "Europe/Berlin")
                .withProperty("multila.export.retention", "P7D")
                .withProperty("multila.export.cleanup-interval", "PT1H");
    }
}
