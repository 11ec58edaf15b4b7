package io.clusterautoscaler.cloudprovider.errors;

/**
 * Thrown while building a cloud provider. Fatal for the hosting process.
 */
public class ConstructionException extends CloudProviderException {

    public ConstructionException(String message) {
        super(ErrorKind.CONSTRUCTION, message);
    }

    public ConstructionException(String message, Throwable cause) {
        super(ErrorKind.CONSTRUCTION, message, cause);
    }
}
