package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * Base type of every failure raised by the Azure DevOps client.
 * Carries the operation that failed and, when a response was received, the raw status and body.
 */
public abstract class AzureDevOpsException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final String operation;
    private final int statusCode;
    private final String url;
    private final String responseBody;

    protected AzureDevOpsException(String operation, String message, int statusCode, String url,
                                   String responseBody, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
        this.url = url;
        this.responseBody = responseBody;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    /**
     * Short machine-readable name of the failure kind, used when rendering errors for callers.
     */
    public abstract String getKind();
}
