package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.core.ImportResolutionException;
import io.github.manjago.netscript.core.ImportResolver;
import io.github.manjago.netscript.core.ImportResult;
import io.github.manjago.netscript.core.ScriptSyntaxException;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.host.Server;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: imports
 * 
 * Shows a script with its imports inlined and the resulting line offset.
 * 
 * Usage:
 *   netscript imports scripts/ main.script
 */
@Command(
    name = "imports",
    description = "Show a script with its imports inlined",
    mixinStandardHelpOptions = true
)
public class ImportsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Directory with the scripts")
    private Path scriptDir;

    @Parameters(index = "1", description = "Script file name")
    private String scriptName;

    @Override
    public Integer call() {
        try {
            Server server = new Server("local", null, Double.MAX_VALUE, true);
            ScriptDirectory.loadInto(server, scriptDir, 0);

            Optional<Script> script = server.getScript(scriptName);
            if (script.isEmpty()) {
                System.err.println("✗ No script " + scriptName + " in " + scriptDir);
                return 1;
            }

            ImportResolver resolver = new ImportResolver(
                    filename -> server.getScript(filename).map(Script::code));
            ImportResult result = resolver.resolve(script.get().code());

            System.out.println("Line offset: " + result.lineOffset());
            System.out.println("═".repeat(60));
            String[] lines = result.code().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                System.out.printf("%4d | %s%n", i + 1, lines[i]);
            }
            return 0;

        } catch (ImportResolutionException e) {
            System.err.println("✗ Error processing Imports in " + scriptName + ":\n" + e.getMessage());
            return 1;
        } catch (ScriptSyntaxException e) {
            System.err.println("✗ Syntax ERROR in " + scriptName + ":\n" + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("✗ Error: " + e.getMessage());
            return 1;
        }
    }
}
