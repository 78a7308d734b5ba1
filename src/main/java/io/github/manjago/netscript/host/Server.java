package io.github.manjago.netscript.host;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link Host}.
 */
public class Server implements Host {

    private final String hostname;
    private final String ip;
    private final CapacityPool ram;
    private final Map<String, Script> scripts = new LinkedHashMap<>();
    private final List<RunningScript> runningScripts = new ArrayList<>();
    private boolean adminRights;

    public Server(String hostname, String ip, double maxRam, boolean adminRights) {
        this(hostname, ip, new RamPool(maxRam), adminRights);
    }

    public Server(String hostname, String ip, CapacityPool ram, boolean adminRights) {
        this.hostname = Objects.requireNonNull(hostname, "hostname");
        this.ip = ip;
        this.ram = Objects.requireNonNull(ram, "ram");
        this.adminRights = adminRights;
    }

    @Override
    public String getHostname() {
        return hostname;
    }

    @Override
    public String getIp() {
        return ip;
    }

    @Override
    public boolean hasAdminRights() {
        return adminRights;
    }

    public void setAdminRights(boolean adminRights) {
        this.adminRights = adminRights;
    }

    @Override
    public CapacityPool getRam() {
        return ram;
    }

    @Override
    public Optional<Script> getScript(String filename) {
        return Optional.ofNullable(scripts.get(filename));
    }

    @Override
    public List<Script> getScripts() {
        return List.copyOf(scripts.values());
    }

    /**
     * Store a script, replacing one with the same file name.
     */
    public Server addScript(Script script) {
        scripts.put(script.filename(), script);
        return this;
    }

    public Server addScript(String filename, String code, double ramUsage) {
        return addScript(new Script(filename, code, ramUsage));
    }

    @Override
    public List<RunningScript> getRunningScripts() {
        return runningScripts;
    }

    @Override
    public String toString() {
        return "Server{" + hostname + ", " + ram + ", running=" + runningScripts.size() + '}';
    }
}
