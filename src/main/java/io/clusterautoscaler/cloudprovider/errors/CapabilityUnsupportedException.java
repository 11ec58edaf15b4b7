package io.clusterautoscaler.cloudprovider.errors;

/**
 * Signals that an optional operation is not offered by the backend.
 * Never carries a cause: it does not wrap real failures.
 */
public class CapabilityUnsupportedException extends CloudProviderException {

    private final String operation;

    public CapabilityUnsupportedException(String operation) {
        super(ErrorKind.CAPABILITY_UNSUPPORTED, operation + " is not implemented by this cloud provider");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
