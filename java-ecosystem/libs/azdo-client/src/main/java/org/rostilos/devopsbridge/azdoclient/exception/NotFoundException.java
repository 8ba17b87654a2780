package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * Repository or item absent on the remote side.
 */
public class NotFoundException extends AzureDevOpsException {

    public NotFoundException(String operation, String message) {
        super(operation, message, NO_STATUS, null, null, null);
    }

    public NotFoundException(String operation, String message, RemoteApiException cause) {
        super(operation, message, cause.getStatusCode(), cause.getUrl(), cause.getResponseBody(), cause);
    }

    @Override
    public String getKind() {
        return "NotFoundError";
    }
}
