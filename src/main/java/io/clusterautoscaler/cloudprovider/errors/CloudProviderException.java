package io.clusterautoscaler.cloudprovider.errors;

import lombok.Getter;

/**
 * Base of all errors raised across the cloud provider boundary.
 */
@Getter
public abstract class CloudProviderException extends Exception {

    private final ErrorKind kind;

    protected CloudProviderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CloudProviderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isCapabilityUnsupported() {
        return kind == ErrorKind.CAPABILITY_UNSUPPORTED;
    }
}
