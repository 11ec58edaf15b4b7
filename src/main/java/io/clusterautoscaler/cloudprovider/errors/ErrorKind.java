package io.clusterautoscaler.cloudprovider.errors;

/**
 * Classification of cloud provider failures. Callers branch on the kind, never on message text.
 */
public enum ErrorKind {
    /** Provider could not be built; the process must not start. */
    CONSTRUCTION,
    /** Optional operation not offered by this backend. Not a failure. */
    CAPABILITY_UNSUPPORTED,
    /** A cached record violates an invariant, e.g. a node without a pool id. */
    DATA_INTEGRITY,
    /** Backend state could not be pulled; the previous snapshot stays in use. */
    REFRESH,
    /** A backend write or resource release failed. */
    BACKEND
}
