package org.rostilos.devopsbridge.azdoclient.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AzureDevOpsException hierarchy")
class AzureDevOpsExceptionTest {

    @Nested
    @DisplayName("RemoteApiException")
    class RemoteApiExceptionTests {

        @Test
        @DisplayName("should carry operation, status, url and body")
        void shouldCarryResponseDetails() {
            RemoteApiException exception = new RemoteApiException("getRepository", 500,
                    "https://dev.azure.com/org/p/_apis/git/repositories/r", "boom");

            assertThat(exception.getMessage()).contains("getRepository", "500", "boom");
            assertThat(exception.getOperation()).isEqualTo("getRepository");
            assertThat(exception.getStatusCode()).isEqualTo(500);
            assertThat(exception.getUrl()).endsWith("/repositories/r");
            assertThat(exception.getResponseBody()).isEqualTo("boom");
            assertThat(exception.hasStatus()).isTrue();
            assertThat(exception.getKind()).isEqualTo("RemoteApiError");
        }

        @Test
        @DisplayName("should classify 404 and 409")
        void shouldClassifyStatuses() {
            assertThat(new RemoteApiException("op", 404, "u", "").isNotFound()).isTrue();
            assertThat(new RemoteApiException("op", 409, "u", "").isConflict()).isTrue();
            assertThat(new RemoteApiException("op", 500, "u", "").isNotFound()).isFalse();
            assertThat(new RemoteApiException("op", 500, "u", "").isConflict()).isFalse();
        }

        @Test
        @DisplayName("should keep I/O cause without status")
        void shouldKeepIoCause() {
            IOException cause = new IOException("connection reset");
            RemoteApiException exception = new RemoteApiException("createPush", "u", cause);

            assertThat(exception.getCause()).isSameAs(cause);
            assertThat(exception.getStatusCode()).isEqualTo(AzureDevOpsException.NO_STATUS);
            assertThat(exception.hasStatus()).isFalse();
            assertThat(exception.getMessage()).contains("connection reset");
        }
    }

    @Test
    @DisplayName("NotFoundException should copy response details from its cause")
    void notFoundShouldCopyCauseDetails() {
        RemoteApiException cause = new RemoteApiException("getRepository", 404, "u", "TF401019");
        NotFoundException exception = new NotFoundException("getRepository", "Repository r not found", cause);

        assertThat(exception.getStatusCode()).isEqualTo(404);
        assertThat(exception.getUrl()).isEqualTo("u");
        assertThat(exception.getResponseBody()).isEqualTo("TF401019");
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.getKind()).isEqualTo("NotFoundError");
    }

    @Test
    @DisplayName("RefNotFoundException should be a NotFoundException naming the ref")
    void refNotFoundShouldNameRef() {
        RefNotFoundException exception = new RefNotFoundException("resolveRef", "refs/heads/main");

        assertThat(exception).isInstanceOf(NotFoundException.class);
        assertThat(exception.getRefName()).isEqualTo("refs/heads/main");
        assertThat(exception.getMessage()).isEqualTo("Ref not found: refs/heads/main");
        assertThat(exception.getKind()).isEqualTo("RefNotFoundError");
    }

    @Test
    @DisplayName("ConcurrencyConflictException should not be a RemoteApiException")
    void conflictShouldStandApart() {
        ConcurrencyConflictException exception = new ConcurrencyConflictException("createPush", "refs/heads/fix",
                "abc", 409, "u", "TF401028");

        assertThat(exception).isNotInstanceOf(RemoteApiException.class);
        assertThat(exception.getRefName()).isEqualTo("refs/heads/fix");
        assertThat(exception.getExpectedObjectId()).isEqualTo("abc");
        assertThat(exception.getStatusCode()).isEqualTo(409);
        assertThat(exception.getMessage()).contains("refs/heads/fix", "abc");
    }

    @Test
    @DisplayName("AmbiguousRefException should list candidates immutably")
    void ambiguousShouldListCandidates() {
        AmbiguousRefException exception = new AmbiguousRefException("resolveRef", "refs/heads/main",
                List.of("a1", "b2"), "u");

        assertThat(exception.getCandidates()).containsExactly("a1", "b2");
        assertThat(exception.getMessage()).contains("2 refs");
    }

    @Test
    @DisplayName("MalformedResponseException should truncate large payloads")
    void malformedShouldTruncate() {
        String payload = "x".repeat(2000);
        MalformedResponseException exception = new MalformedResponseException("getRepository", "u",
                "response is not JSON", payload);

        assertThat(exception.getResponseBody()).hasSize(MalformedResponseException.MAX_PAYLOAD_LENGTH
                + "...(truncated)".length());
        assertThat(exception.getResponseBody()).endsWith("...(truncated)");
        assertThat(MalformedResponseException.truncate("short")).isEqualTo("short");
        assertThat(MalformedResponseException.truncate(null)).isNull();
    }

    @Test
    @DisplayName("RemoteTimeoutException should report the configured timeout")
    void timeoutShouldReportDuration() {
        RemoteTimeoutException exception = new RemoteTimeoutException("createPush", "u", Duration.ofSeconds(60),
                new SocketTimeoutException("timeout"));

        assertThat(exception.getTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(exception.getMessage()).contains("60000 ms");
        assertThat(exception.getKind()).isEqualTo("TimeoutError");
    }

    @Test
    @DisplayName("AuthenticationException should be unchecked")
    void authenticationShouldBeUnchecked() {
        AuthenticationException exception = new AuthenticationException("getRepository", 401, "u", "");

        assertThat(exception).isInstanceOf(RuntimeException.class).isInstanceOf(AzureDevOpsException.class);
        assertThat(exception.getStatusCode()).isEqualTo(401);
        assertThat(exception.getKind()).isEqualTo("AuthenticationError");
    }
}
