package io.github.manjago.netscript.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Configuration of the script engine.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EngineConfig(
    // Scheduling
    long instructionTimeSliceMs,
    long idleSpeedMs,

    // Process ids
    int maxPidSearch,
    int maxPid,

    // Ports
    int portCount,
    int portCapacity,

    // Per-process log
    int logCapacity,

    // Startup
    boolean skipScriptLoad,

    // Persistence
    Path stateFile
) {

    public EngineConfig {
        if (maxPid < 1) {
            throw new IllegalArgumentException("processes.max-pid must be >= 1: " + maxPid);
        }
        if (maxPidSearch < 1) {
            throw new IllegalArgumentException("processes.max-pid-search must be >= 1: " + maxPidSearch);
        }
        if (logCapacity < 1) {
            throw new IllegalArgumentException("logs.capacity must be >= 1: " + logCapacity);
        }
    }

    /**
     * Load default configuration.
     */
    public static EngineConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static EngineConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static EngineConfig fromConfig(Config config) {
        Config c = config.getConfig("netscript");

        return new EngineConfig(
            c.getLong("scheduler.instruction-time-slice-ms"),
            c.getLong("scheduler.idle-speed-ms"),
            c.getInt("processes.max-pid-search"),
            c.getInt("processes.max-pid"),
            c.getInt("ports.count"),
            c.getInt("ports.capacity"),
            c.getInt("logs.capacity"),
            c.getBoolean("startup.skip-script-load"),
            Path.of(c.getString("persistence.file"))
        );
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long instructionTimeSliceMs = 50;
        private long idleSpeedMs = 200;
        private int maxPidSearch = 10_000;
        private int maxPid = Integer.MAX_VALUE - 1;
        private int portCount = 20;
        private int portCapacity = 50;
        private int logCapacity = 50;
        private boolean skipScriptLoad = false;
        private Path stateFile = Path.of("netscript-state.mv");

        public Builder instructionTimeSliceMs(long ms) { this.instructionTimeSliceMs = ms; return this; }
        public Builder idleSpeedMs(long ms) { this.idleSpeedMs = ms; return this; }
        public Builder maxPidSearch(int max) { this.maxPidSearch = max; return this; }
        public Builder maxPid(int max) { this.maxPid = max; return this; }
        public Builder portCount(int count) { this.portCount = count; return this; }
        public Builder portCapacity(int capacity) { this.portCapacity = capacity; return this; }
        public Builder logCapacity(int capacity) { this.logCapacity = capacity; return this; }
        public Builder skipScriptLoad(boolean skip) { this.skipScriptLoad = skip; return this; }
        public Builder stateFile(Path file) { this.stateFile = file; return this; }

        public EngineConfig build() {
            return new EngineConfig(
                instructionTimeSliceMs, idleSpeedMs, maxPidSearch, maxPid,
                portCount, portCapacity, logCapacity, skipScriptLoad, stateFile
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EngineConfig:
              scheduler.instruction-time-slice-ms: %d
              scheduler.idle-speed-ms:             %d
              processes.max-pid-search:            %,d
              processes.max-pid:                   %,d
              ports:                               %d x %d
              logs.capacity:                       %d
              startup.skip-script-load:            %s
              persistence.file:                    %s
            """,
            instructionTimeSliceMs,
            idleSpeedMs,
            maxPidSearch,
            maxPid,
            portCount, portCapacity,
            logCapacity,
            skipScriptLoad,
            stateFile
        );
    }
}
