package org.rostilos.devopsbridge.azdoclient.config;

import okhttp3.HttpUrl;

import java.time.Duration;

/**
 * Connection settings for one Azure DevOps organization.
 * Passed explicitly to the client; nothing reads credentials from global state.
 */
public class AzureDevOpsConfiguration {

    private final String organizationUrl;
    private final String personalAccessToken;
    private final Duration timeout;
    private final String userAgent;

    public AzureDevOpsConfiguration(String organizationUrl, String personalAccessToken) {
        this(organizationUrl, personalAccessToken, AzureDevOpsConfig.DEFAULT_TIMEOUT, AzureDevOpsConfig.DEFAULT_USER_AGENT);
    }

    public AzureDevOpsConfiguration(String organizationUrl, String personalAccessToken, Duration timeout, String userAgent) {
        if (organizationUrl == null || organizationUrl.isBlank()) {
            throw new IllegalArgumentException("Organization URL cannot be null or empty");
        }
        String normalized = stripTrailingSlash(organizationUrl.trim());
        if (HttpUrl.parse(normalized) == null) {
            throw new IllegalArgumentException("Organization URL is not a valid http(s) URL: " + organizationUrl);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.organizationUrl = normalized;
        this.personalAccessToken = personalAccessToken;
        this.timeout = timeout;
        this.userAgent = userAgent == null || userAgent.isBlank() ? AzureDevOpsConfig.DEFAULT_USER_AGENT : userAgent;
    }

    public String getOrganizationUrl() {
        return organizationUrl;
    }

    public String getPersonalAccessToken() {
        return personalAccessToken;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public boolean hasCredential() {
        return personalAccessToken != null && !personalAccessToken.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "AzureDevOpsConfiguration{organizationUrl='" + organizationUrl + "', personalAccessToken="
                + (hasCredential() ? "****" : "<none>") + ", timeout=" + timeout + ", userAgent='" + userAgent + "'}";
    }
}
