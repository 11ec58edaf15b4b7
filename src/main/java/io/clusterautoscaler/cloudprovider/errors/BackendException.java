package io.clusterautoscaler.cloudprovider.errors;

public class BackendException extends CloudProviderException {

    public BackendException(String message) {
        super(ErrorKind.BACKEND, message);
    }

    public BackendException(String message, Throwable cause) {
        super(ErrorKind.BACKEND, message, cause);
    }
}
