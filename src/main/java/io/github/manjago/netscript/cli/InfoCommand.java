package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.config.EngineConfig;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about the engine.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              NETSCRIPT                ║");
        System.out.println("║    Worker script engine               ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EngineConfig.defaults());
        return 0;
    }
}
