package io.clusterautoscaler.cloudprovider.errors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CloudProviderExceptionTest {

    @Test
    void testKinds() {
        assertThat(new ConstructionException("x").getKind()).isEqualTo(ErrorKind.CONSTRUCTION);
        assertThat(new DataIntegrityException("x").getKind()).isEqualTo(ErrorKind.DATA_INTEGRITY);
        assertThat(new RefreshException("x").getKind()).isEqualTo(ErrorKind.REFRESH);
        assertThat(new BackendException("x").getKind()).isEqualTo(ErrorKind.BACKEND);
        assertThat(new CapabilityUnsupportedException("Pricing").getKind()).isEqualTo(ErrorKind.CAPABILITY_UNSUPPORTED);
    }

    @Test
    void testCapabilityUnsupported_IsDistinguishableWithoutMessageParsing() {
        CloudProviderException unsupported = new CapabilityUnsupportedException("NewNodeGroup");
        CloudProviderException failure = new BackendException("write failed", new RuntimeException("timeout"));

        assertThat(unsupported.isCapabilityUnsupported()).isTrue();
        assertThat(unsupported.getCause()).isNull();
        assertThat(unsupported).hasMessage("NewNodeGroup is not implemented by this cloud provider");
        assertThat(failure.isCapabilityUnsupported()).isFalse();
        assertThat(failure).hasCauseInstanceOf(RuntimeException.class);
    }
}
