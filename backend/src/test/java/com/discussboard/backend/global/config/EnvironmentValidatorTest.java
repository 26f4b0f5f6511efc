package com.discussboard.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://db:5432/discussboard")
                .withProperty("jwt.secret", "production-secret-that-is-long-enough-0123456789")
                .withProperty("jwt.expiration", "3600000")
                .withProperty("app.cors.allowed-origins", "https://board.example.com");
    }

    @Test
    void acceptsCompleteConfiguration() {
        assertThat(new EnvironmentValidator(completeEnvironment()).collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingProperties() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "production-secret-that-is-long-enough-0123456789");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .contains("spring.datasource.url is missing", "app.cors.allowed-origins is missing");
    }

    @Test
    void rejectsDevelopmentSecretOutsideDevProfiles() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEVELOPMENT_JWT_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret still uses the development default");

        environment.setActiveProfiles("dev");
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void rejectsOutOfRangeAccessTokenLifetime() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.expiration", "1000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be between");
    }
}
