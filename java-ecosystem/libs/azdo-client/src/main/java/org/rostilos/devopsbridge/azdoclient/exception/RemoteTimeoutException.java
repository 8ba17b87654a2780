package org.rostilos.devopsbridge.azdoclient.exception;

import java.time.Duration;

public class RemoteTimeoutException extends AzureDevOpsException {

    private final Duration timeout;

    public RemoteTimeoutException(String operation, String url, Duration timeout, Throwable cause) {
        super(operation, String.format("Azure DevOps call %s timed out after %d ms for %s",
                        operation, timeout.toMillis(), url),
                NO_STATUS, url, null, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getKind() {
        return "TimeoutError";
    }
}
