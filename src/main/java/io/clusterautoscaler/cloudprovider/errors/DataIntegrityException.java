package io.clusterautoscaler.cloudprovider.errors;

/**
 * A cache entry violates an invariant the lookup depends on.
 */
public class DataIntegrityException extends CloudProviderException {

    public DataIntegrityException(String message) {
        super(ErrorKind.DATA_INTEGRITY, message);
    }
}
