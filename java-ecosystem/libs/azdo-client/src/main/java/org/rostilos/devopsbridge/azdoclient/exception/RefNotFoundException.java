package org.rostilos.devopsbridge.azdoclient.exception;

public class RefNotFoundException extends NotFoundException {

    private final String refName;

    public RefNotFoundException(String operation, String refName) {
        super(operation, "Ref not found: " + refName);
        this.refName = refName;
    }

    public String getRefName() {
        return refName;
    }

    @Override
    public String getKind() {
        return "RefNotFoundError";
    }
}
