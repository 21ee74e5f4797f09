package io.scanhive.docker;

/**
 * A service, network or config addressed by name or id does not exist on the cluster.
 */
public class ClusterResourceNotFoundException extends RuntimeException {

    public ClusterResourceNotFoundException(String message) {
        super(message);
    }

    public ClusterResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
