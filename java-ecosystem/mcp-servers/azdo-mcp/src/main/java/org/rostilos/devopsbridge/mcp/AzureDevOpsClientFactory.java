package org.rostilos.devopsbridge.mcp;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfig;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Builds the Azure DevOps client from JVM system properties passed to the server process.
 */
public class AzureDevOpsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(AzureDevOpsClientFactory.class);

    public static final String ORG_URL_PROPERTY = "azdo.orgUrl";
    // Same property name as the other VCS servers
    public static final String ACCESS_TOKEN_PROPERTY = "accessToken";
    public static final String TIMEOUT_PROPERTY = "azdo.timeoutSeconds";
    public static final String USER_AGENT_PROPERTY = "azdo.userAgent";

    public AzureDevOpsClient createClient() {
        return createClient(System.getProperties());
    }

    public AzureDevOpsClient createClient(Properties properties) {
        AzureDevOpsConfiguration configuration = createConfiguration(properties);
        log.info("Created Azure DevOps client for {}", configuration.getOrganizationUrl());
        return new AzureDevOpsClient(configuration);
    }

    AzureDevOpsConfiguration createConfiguration(Properties properties) {
        String orgUrl = properties.getProperty(ORG_URL_PROPERTY);
        if (orgUrl == null || orgUrl.isEmpty()) {
            throw new IllegalStateException(ORG_URL_PROPERTY + " system property is required for Azure DevOps");
        }

        Duration timeout = AzureDevOpsConfig.DEFAULT_TIMEOUT;
        String timeoutSeconds = properties.getProperty(TIMEOUT_PROPERTY);
        if (timeoutSeconds != null && !timeoutSeconds.isBlank()) {
            try {
                timeout = Duration.ofSeconds(Long.parseLong(timeoutSeconds.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(TIMEOUT_PROPERTY + " must be a number of seconds: " + timeoutSeconds, e);
            }
        }

        return new AzureDevOpsConfiguration(
                orgUrl,
                properties.getProperty(ACCESS_TOKEN_PROPERTY),
                timeout,
                properties.getProperty(USER_AGENT_PROPERTY)
        );
    }
}
