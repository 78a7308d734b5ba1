package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.host.Server;
import io.github.manjago.netscript.persistence.RunningScriptStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: state
 * 
 * Shows the hosts and running scripts of a saved state file.
 * 
 * Usage:
 *   netscript state netscript-state.mv
 */
@Command(
    name = "state",
    description = "Show the contents of a saved state file",
    mixinStandardHelpOptions = true
)
public class StateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "State file (.mv)")
    private Path stateFile;

    @Override
    public Integer call() {
        if (!RunningScriptStore.isValidState(stateFile)) {
            System.err.println("✗ " + RunningScriptStore.getInfo(stateFile));
            return 1;
        }
        try {
            System.out.println("═".repeat(60));
            System.out.println("STATE: " + stateFile.getFileName());
            System.out.println(RunningScriptStore.getInfo(stateFile));
            System.out.println("═".repeat(60));

            List<Server> hosts = RunningScriptStore.load(stateFile);
            for (Server host : hosts) {
                System.out.println();
                System.out.printf("🖥️  %s (%s)  RAM %.2f GB  admin=%s%n", host.getHostname(),
                        host.getIp() != null ? host.getIp() : "-", host.getRam().getTotal(),
                        host.hasAdminRights());
                for (Script script : host.getScripts()) {
                    System.out.printf("   📄 %-24s %6.2f GB%n", script.filename(), script.ramUsage());
                }
                for (RunningScript rs : host.getRunningScripts()) {
                    System.out.printf("   ▶️  %-24s x%d %s  online %.0fs  offline %.0fs%n",
                            rs.getFilename(), rs.getThreads(), rs.getArgs(),
                            rs.getOnlineRunningTime(), rs.getOfflineRunningTime());
                }
            }
            return 0;

        } catch (Exception e) {
            System.err.println("✗ Error: " + e.getMessage());
            return 1;
        }
    }
}
