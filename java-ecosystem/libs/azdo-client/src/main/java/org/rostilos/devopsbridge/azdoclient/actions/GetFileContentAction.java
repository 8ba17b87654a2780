package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.exception.NotFoundException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.model.FileContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GetFileContentAction {

    private static final Logger log = LoggerFactory.getLogger(GetFileContentAction.class);
    private static final String OPERATION = "getFileContent";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public GetFileContentAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    /**
     * Fetch the text of {@code path} at the tip of {@code branch} (short or {@code refs/heads/} form).
     *
     * @throws NotFoundException when the file, branch or repository does not exist
     */
    public FileContent getFileContent(String project, String repository, String path, String branch) {
        GetRepositoryAction.requireNonBlank(path, "File path");
        GetRepositoryAction.requireNonBlank(branch, "Branch");

        String url = urls.item(project, repository, path, branch);
        JsonNode response;
        try {
            response = transport.getRequired(OPERATION, url);
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                log.debug("File not found: {} in branch {} ({}/{})", path, branch, project, repository);
                throw new NotFoundException(OPERATION,
                        String.format("File %s not found on branch %s of %s/%s", path, branch, project, repository), e);
            }
            throw e;
        }

        JsonNode content = response.path("content");
        return new FileContent(path, branch, content.isMissingNode() || content.isNull() ? "" : content.asText());
    }
}
