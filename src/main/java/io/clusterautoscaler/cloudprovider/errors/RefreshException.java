package io.clusterautoscaler.cloudprovider.errors;

/**
 * Pulling backend state failed. The previously installed snapshot remains authoritative.
 */
public class RefreshException extends CloudProviderException {

    public RefreshException(String message) {
        super(ErrorKind.REFRESH, message);
    }

    public RefreshException(String message, Throwable cause) {
        super(ErrorKind.REFRESH, message, cause);
    }
}
