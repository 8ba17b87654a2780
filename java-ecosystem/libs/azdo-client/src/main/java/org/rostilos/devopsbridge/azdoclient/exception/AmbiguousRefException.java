package org.rostilos.devopsbridge.azdoclient.exception;

import java.util.List;

/**
 * The filtered refs listing returned more than one ref carrying exactly the requested name.
 */
public class AmbiguousRefException extends AzureDevOpsException {

    private final String refName;
    private final List<String> candidates;

    public AmbiguousRefException(String operation, String refName, List<String> candidates, String url) {
        super(operation,
                String.format("Ref %s is ambiguous, %d refs match exactly: %s", refName, candidates.size(), candidates),
                NO_STATUS, url, null, null);
        this.refName = refName;
        this.candidates = List.copyOf(candidates);
    }

    public String getRefName() {
        return refName;
    }

    public List<String> getCandidates() {
        return candidates;
    }

    @Override
    public String getKind() {
        return "AmbiguousRefError";
    }
}
