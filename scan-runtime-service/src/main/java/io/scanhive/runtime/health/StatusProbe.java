package io.scanhive.runtime.health;

/**
 * Single-shot check of the status endpoint exposed by a service task.
 */
@FunctionalInterface
public interface StatusProbe {

    /**
     * @return {@code true} when the address answers the status request with {@code 200 OK};
     *     connection failures are reported as {@code false}
     */
    boolean isUp(String address);
}
