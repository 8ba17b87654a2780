package org.rostilos.devopsbridge.azdoclient.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AzureDevOpsConfigTest {

    @Test
    void testZeroObjectId_IsFortyZeros() {
        assertThat(AzureDevOpsConfig.ZERO_OBJECT_ID).hasSize(40).matches("0+");
    }

    @Test
    void testToBranchRef_QualifiesShortNames() {
        assertThat(AzureDevOpsConfig.toBranchRef("main")).isEqualTo("refs/heads/main");
        assertThat(AzureDevOpsConfig.toBranchRef("mcp/update-file")).isEqualTo("refs/heads/mcp/update-file");
    }

    @Test
    void testToBranchRef_KeepsQualifiedNames() {
        assertThat(AzureDevOpsConfig.toBranchRef("refs/heads/main")).isEqualTo("refs/heads/main");
        assertThat(AzureDevOpsConfig.toBranchRef(" refs/heads/main ")).isEqualTo("refs/heads/main");
    }

    @Test
    void testToBranchRef_RejectsBlank() {
        assertThatThrownBy(() -> AzureDevOpsConfig.toBranchRef(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AzureDevOpsConfig.toBranchRef(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToShortBranchName() {
        assertThat(AzureDevOpsConfig.toShortBranchName("refs/heads/feature/x")).isEqualTo("feature/x");
        assertThat(AzureDevOpsConfig.toShortBranchName("main")).isEqualTo("main");
    }

    @Test
    void testIsQualifiedRef() {
        assertThat(AzureDevOpsConfig.isQualifiedRef("refs/heads/main")).isTrue();
        assertThat(AzureDevOpsConfig.isQualifiedRef("refs/")).isFalse();
        assertThat(AzureDevOpsConfig.isQualifiedRef("main")).isFalse();
        assertThat(AzureDevOpsConfig.isQualifiedRef(null)).isFalse();
    }
}
