package io.github.manjago.netscript.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Netscript CLI - run and inspect scripts outside the game.
 * 
 * Usage:
 *   netscript run -d scripts/ main.script   - Run a script on a local host
 *   netscript imports scripts/ main.script  - Show code with imports inlined
 *   netscript compile file.script           - Show bytecode listing
 *   netscript state <file>                  - Inspect a saved state file
 *   netscript info                          - Show version and config
 */
@Command(
    name = "netscript",
    description = "Netscript engine - worker script lifecycle and scheduling",
    mixinStandardHelpOptions = true,
    version = "Netscript engine 1.0.0",
    subcommands = {
        RunCommand.class,
        ImportsCommand.class,
        CompileCommand.class,
        StateCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class NetscriptCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NetscriptCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
