package io.github.manjago.netscript.host;

import java.util.List;
import java.util.Optional;

/**
 * A machine scripts run on: its stored scripts, its RAM and the scripts
 * currently running on it.
 */
public interface Host {

    String getHostname();

    String getIp();

    /**
     * Whether scripts may be started here by other processes.
     */
    boolean hasAdminRights();

    CapacityPool getRam();

    Optional<Script> getScript(String filename);

    List<Script> getScripts();

    /**
     * Live list of running-script records on this host.
     */
    List<RunningScript> getRunningScripts();

    default void addRunningScript(RunningScript rs) {
        getRunningScripts().add(rs);
    }

    default boolean removeRunningScript(RunningScript rs) {
        return getRunningScripts().remove(rs);
    }

    /**
     * Find a running script by file name and argument list.
     */
    default Optional<RunningScript> getRunningScript(String filename, List<?> args) {
        return getRunningScripts().stream()
                .filter(rs -> rs.matches(filename, args))
                .findFirst();
    }
}
