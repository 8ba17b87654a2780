package org.rostilos.devopsbridge.azdoclient;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfiguration;
import org.rostilos.devopsbridge.azdoclient.exception.AuthenticationException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

public class AzureDevOpsHttpClientFactory {

    private static final long CONNECT_TIMEOUT_SECONDS = 30;

    /**
     * Create an OkHttpClient that authenticates every call with the configured personal access token.
     * Azure DevOps expects Basic auth with an empty user name and the PAT as password.
     *
     * @param configuration organization settings
     * @return configured OkHttpClient, safe to share between calls
     * @throws AuthenticationException when no token is configured
     */
    public OkHttpClient createClient(AzureDevOpsConfiguration configuration) {
        if (!configuration.hasCredential()) {
            throw new AuthenticationException("createClient", "Personal access token cannot be null or empty");
        }

        String authorization = Credentials.basic("", configuration.getPersonalAccessToken(), StandardCharsets.UTF_8);
        String userAgent = configuration.getUserAgent();
        long timeoutMillis = configuration.getTimeout().toMillis();

        return new OkHttpClient.Builder()
                .connectTimeout(Math.min(CONNECT_TIMEOUT_SECONDS * 1000, timeoutMillis), TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", authorization)
                            .header("Accept", "application/json")
                            .header("Content-Type", "application/json")
                            .header("User-Agent", userAgent)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
