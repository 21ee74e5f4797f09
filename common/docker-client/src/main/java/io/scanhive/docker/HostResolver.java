package io.scanhive.docker;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DNS lookup used to find the task addresses behind a service name.
 */
@FunctionalInterface
public interface HostResolver {

    Set<String> resolve(String host) throws UnknownHostException;

    static HostResolver system() {
        return host -> Arrays.stream(InetAddress.getAllByName(host))
            .map(InetAddress::getHostAddress)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
