package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * A successful response whose body could not be read as the expected JSON.
 * The payload is kept truncated for diagnosis.
 */
public class MalformedResponseException extends AzureDevOpsException {

    public static final int MAX_PAYLOAD_LENGTH = 512;

    public MalformedResponseException(String operation, String url, String reason, String rawPayload) {
        this(operation, url, reason, rawPayload, null);
    }

    public MalformedResponseException(String operation, String url, String reason, String rawPayload, Throwable cause) {
        super(operation, String.format("Malformed Azure DevOps response during %s: %s", operation, reason),
                NO_STATUS, url, truncate(rawPayload), cause);
    }

    public static String truncate(String payload) {
        if (payload == null || payload.length() <= MAX_PAYLOAD_LENGTH) {
            return payload;
        }
        return payload.substring(0, MAX_PAYLOAD_LENGTH) + "...(truncated)";
    }

    @Override
    public String getKind() {
        return "MalformedResponseError";
    }
}
