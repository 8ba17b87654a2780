package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * The expected object id of a ref no longer matches the server's current value.
 */
public class ConcurrencyConflictException extends AzureDevOpsException {

    private final String refName;
    private final String expectedObjectId;

    public ConcurrencyConflictException(String operation, String refName, String expectedObjectId,
                                        int statusCode, String url, String responseBody) {
        super(operation,
                String.format("Ref %s moved since it was read (expected %s) during %s",
                        refName, expectedObjectId, operation),
                statusCode, url, responseBody, null);
        this.refName = refName;
        this.expectedObjectId = expectedObjectId;
    }

    public String getRefName() {
        return refName;
    }

    public String getExpectedObjectId() {
        return expectedObjectId;
    }

    @Override
    public String getKind() {
        return "ConcurrencyConflictError";
    }
}
