package io.github.manjago.netscript.host;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Hosts by hostname, used by {@code exec} to find the target machine.
 */
public class HostDirectory {

    private final Map<String, Host> hosts = new LinkedHashMap<>();

    public HostDirectory add(Host host) {
        hosts.put(host.getHostname(), host);
        return this;
    }

    public Optional<Host> find(String hostname) {
        return Optional.ofNullable(hosts.get(hostname));
    }

    public Collection<Host> all() {
        return hosts.values();
    }
}
