package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.api.FunctionCatalog;
import io.github.manjago.netscript.api.ModuleRegistry;
import io.github.manjago.netscript.config.EngineConfig;
import io.github.manjago.netscript.engine.EngineListener;
import io.github.manjago.netscript.engine.EngineStats;
import io.github.manjago.netscript.engine.ExitStatus;
import io.github.manjago.netscript.engine.ScriptEngine;
import io.github.manjago.netscript.engine.WorkerScript;
import io.github.manjago.netscript.host.HostDirectory;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Server;
import io.github.manjago.netscript.loop.VirtualEventLoop;
import io.github.manjago.netscript.persistence.RunningScriptStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run a legacy script on a local host driven by a virtual clock.
 * 
 * Examples:
 *   netscript run -d scripts main.script               # Run until idle
 *   netscript run -d scripts main.script -t 2 -a foo   # 2 threads, one arg
 *   netscript run -d scripts main.script --for 60000   # 60 virtual seconds
 *   netscript run -d scripts main.script -o state.mv   # Save host afterwards
 */
@Command(
    name = "run",
    description = "Run a script on a local host",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Script file name inside the scripts directory")
    private String scriptName;

    @Option(names = {"-d", "--dir"}, description = "Directory with the host's scripts", required = true)
    private Path scriptDir;

    @Option(names = {"-a", "--arg"}, description = "Script argument (repeatable)")
    private List<String> args = new ArrayList<>();

    @Option(names = {"-t", "--threads"}, description = "Thread count", defaultValue = "1")
    private int threads;

    @Option(names = {"-r", "--ram"}, description = "Host RAM in GB", defaultValue = "64")
    private double hostRam;

    @Option(names = {"--script-ram"}, description = "RAM per thread of every script in GB", defaultValue = "1.6")
    private double scriptRam;

    @Option(names = {"--for"}, description = "Virtual milliseconds to run (0 = until idle)", defaultValue = "0")
    private long runFor;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Save the host to this state file afterwards")
    private Path outputFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            EngineConfig config = configFile != null ? EngineConfig.fromFile(configFile) : EngineConfig.defaults();

            Server home = new Server("home", "127.0.0.1", hostRam, true);
            int loaded = ScriptDirectory.loadInto(home, scriptDir, scriptRam);
            if (!quiet) {
                System.out.printf("Loaded %d script(s) from %s onto %s (%.2f GB)%n",
                        loaded, scriptDir, home.getHostname(), hostRam);
            }

            VirtualEventLoop loop = new VirtualEventLoop();
            ScriptEngine engine = new ScriptEngine(config, loop, new HostDirectory().add(home),
                    FunctionCatalog.EMPTY, new ModuleRegistry());
            engine.setListener(new ConsoleListener(quiet));

            RunningScript rs = new RunningScript(scriptName, new ArrayList<>(args), threads);
            int pid = engine.startProcess(rs, home);
            if (pid == 0) {
                System.err.println("✗ " + scriptName + " did not start");
                return 1;
            }

            if (runFor > 0) {
                loop.runFor(runFor);
            } else {
                loop.runUntilIdle();
            }

            EngineStats stats = engine.getStats();
            if (!quiet) {
                System.out.println();
                System.out.println(stats);
            }

            if (outputFile != null) {
                RunningScriptStore.save(List.of(home), outputFile);
                System.out.println("💾 Saved " + home.getHostname() + " to " + outputFile);
            }
            return stats.crashed() > 0 ? 2 : 0;

        } catch (Exception e) {
            System.err.println("✗ Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Prints process events and script logs to the console.
     */
    private static class ConsoleListener implements EngineListener {

        private final boolean quiet;

        ConsoleListener(boolean quiet) {
            this.quiet = quiet;
        }

        @Override
        public void onStart(WorkerScript ws) {
            if (!quiet) {
                System.out.printf("▶️  pid %d: %s %s%n", ws.getPid(), ws.getName(), ws.getArgs());
            }
        }

        @Override
        public void onExit(WorkerScript ws, ExitStatus status) {
            if (!quiet) {
                System.out.printf("⏹️  pid %d: %s %s (started at %d ms)%n",
                        ws.getPid(), ws.getName(), status, ws.getStartTime());
                for (String line : ws.getLogs()) {
                    System.out.println("   | " + line);
                }
            }
        }

        @Override
        public void onUserMessage(String message) {
            System.out.println();
            System.out.println(message);
            System.out.println();
        }

        @Override
        public void onTerminalOutput(String text) {
            System.out.println(text);
        }
    }
}
