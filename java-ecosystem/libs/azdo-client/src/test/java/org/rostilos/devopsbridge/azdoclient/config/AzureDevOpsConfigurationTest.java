package org.rostilos.devopsbridge.azdoclient.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AzureDevOpsConfigurationTest {

    @Test
    @DisplayName("Should apply defaults and strip trailing slashes")
    void shouldApplyDefaults() {
        AzureDevOpsConfiguration config = new AzureDevOpsConfiguration("https://dev.azure.com/contoso/", "pat");

        assertThat(config.getOrganizationUrl()).isEqualTo("https://dev.azure.com/contoso");
        assertThat(config.getPersonalAccessToken()).isEqualTo("pat");
        assertThat(config.getTimeout()).isEqualTo(AzureDevOpsConfig.DEFAULT_TIMEOUT);
        assertThat(config.getUserAgent()).isEqualTo(AzureDevOpsConfig.DEFAULT_USER_AGENT);
        assertThat(config.hasCredential()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to default user agent when blank")
    void shouldDefaultBlankUserAgent() {
        AzureDevOpsConfiguration config = new AzureDevOpsConfiguration("https://dev.azure.com/contoso", "pat",
                Duration.ofSeconds(5), " ");

        assertThat(config.getUserAgent()).isEqualTo(AzureDevOpsConfig.DEFAULT_USER_AGENT);
        assertThat(config.getTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should reject missing or invalid organization url")
    void shouldRejectInvalidUrl() {
        assertThatThrownBy(() -> new AzureDevOpsConfiguration(null, "pat"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AzureDevOpsConfiguration("not a url", "pat"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a url");
    }

    @Test
    @DisplayName("Should reject non-positive timeout")
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(() -> new AzureDevOpsConfiguration("https://dev.azure.com/contoso", "pat",
                Duration.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should accept a missing token and report it")
    void shouldAcceptMissingToken() {
        AzureDevOpsConfiguration config = new AzureDevOpsConfiguration("https://dev.azure.com/contoso", null);

        assertThat(config.hasCredential()).isFalse();
        assertThat(config.toString()).contains("<none>");
    }

    @Test
    @DisplayName("Should mask token in toString")
    void shouldMaskToken() {
        AzureDevOpsConfiguration config = new AzureDevOpsConfiguration("https://dev.azure.com/contoso", "s3cr3t");

        assertThat(config.toString()).doesNotContain("s3cr3t").contains("****");
    }
}
