package org.rostilos.devopsbridge.azdoclient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.rostilos.devopsbridge.azdoclient.exception.AuthenticationException;
import org.rostilos.devopsbridge.azdoclient.exception.MalformedResponseException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticated JSON request/response layer shared by every Azure DevOps action.
 * <p>
 * Status handling is limited to what holds for every endpoint: a rejected credential
 * (401, 403, or the 203 sign-in page Azure DevOps serves for a bad PAT) becomes an
 * {@link AuthenticationException}, any other non-2xx a {@link RemoteApiException}.
 * Actions translate statuses whose meaning depends on the endpoint.
 */
public class AzureDevOpsTransport {

    private static final Logger log = LoggerFactory.getLogger(AzureDevOpsTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final int NON_AUTHORITATIVE_INFORMATION = 203;

    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public AzureDevOpsTransport(OkHttpClient authorizedOkHttpClient, ObjectMapper objectMapper, Duration timeout) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    public Optional<JsonNode> get(String operation, String url) {
        return request(operation, "GET", url, Map.of(), null);
    }

    public Optional<JsonNode> post(String operation, String url, JsonNode body) {
        return request(operation, "POST", url, Map.of(), body);
    }

    /**
     * GET whose caller needs a body; an empty response is reported as malformed.
     */
    public JsonNode getRequired(String operation, String url) {
        return get(operation, url)
                .orElseThrow(() -> new MalformedResponseException(operation, url, "empty response body", ""));
    }

    public JsonNode postRequired(String operation, String url, JsonNode body) {
        return post(operation, url, body)
                .orElseThrow(() -> new MalformedResponseException(operation, url, "empty response body", ""));
    }

    /**
     * Execute one call.
     *
     * @param operation name of the logical operation, carried by any raised error
     * @param method    HTTP method
     * @param url       absolute URL including query string
     * @param headers   extra headers on top of the authorization/content headers
     * @param body      JSON payload, or {@code null} for none
     * @return parsed JSON body, empty when the server sent no content
     */
    public Optional<JsonNode> request(String operation, String method, String url,
                                      Map<String, String> headers, JsonNode body) {
        RequestBody requestBody = body == null ? null : RequestBody.create(serialize(operation, url, body), JSON);
        if (requestBody == null && requiresBody(method)) {
            requestBody = RequestBody.create(new byte[0], JSON);
        }

        Request.Builder builder = new Request.Builder().url(url).method(method, requestBody);
        headers.forEach(builder::header);
        Request req = builder.build();

        log.debug("{} {} ({})", method, url, operation);
        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            String respBody = resp.body() != null ? resp.body().string() : "";
            int code = resp.code();

            if (code == 401 || code == 403 || code == NON_AUTHORITATIVE_INFORMATION) {
                log.warn("Azure DevOps rejected the credential for {}: HTTP {}", url, code);
                throw new AuthenticationException(operation, code, url, respBody);
            }
            if (!resp.isSuccessful()) {
                log.warn("Azure DevOps returned non-success response {} for URL {}: {}", code, url, respBody);
                throw new RemoteApiException(operation, code, url, respBody);
            }
            if (respBody.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(parse(operation, url, respBody));
        } catch (InterruptedIOException e) {
            log.warn("Azure DevOps call {} timed out after {}: {}", url, timeout, e.getMessage());
            throw new RemoteTimeoutException(operation, url, timeout, e);
        } catch (IOException e) {
            log.warn("Azure DevOps call {} failed: {}", url, e.getMessage());
            throw new RemoteApiException(operation, url, e);
        }
    }

    private JsonNode parse(String operation, String url, String respBody) {
        try {
            return objectMapper.readTree(respBody);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(operation, url, "response is not JSON", respBody, e);
        }
    }

    private String serialize(String operation, String url, JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body for " + operation + " to " + url, e);
        }
    }

    private static boolean requiresBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }
}
