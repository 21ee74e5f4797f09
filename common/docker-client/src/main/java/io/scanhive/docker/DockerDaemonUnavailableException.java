package io.scanhive.docker;

/**
 * The Docker daemon could not be reached while performing a cluster action such as creating a
 * scan's network or removing its services.
 */
public class DockerDaemonUnavailableException extends RuntimeException {

    private final String action;

    public DockerDaemonUnavailableException(String action, String hint, Throwable cause) {
        super("Unable to " + action + " because the Docker daemon is unavailable. " + hint, cause);
        this.action = action;
    }

    /**
     * Cluster action that failed, e.g. {@code create network}.
     */
    public String action() {
        return action;
    }
}
