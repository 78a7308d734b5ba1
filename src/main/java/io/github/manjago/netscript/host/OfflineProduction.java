package io.github.manjago.netscript.host;

/**
 * Computes what a script produced while the game was closed.
 */
@FunctionalInterface
public interface OfflineProduction {

    OfflineProduction NOOP = (rs, host) -> { };

    /**
     * Apply offline production to a script record that is being restarted.
     */
    void apply(RunningScript rs, Host host);
}
