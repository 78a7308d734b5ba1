package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.core.Compiler;
import io.github.manjago.netscript.core.Disassembler;
import io.github.manjago.netscript.core.FunctionCode;
import io.github.manjago.netscript.core.ScriptSyntaxException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: compile
 * 
 * Compiles a legacy script and prints the bytecode listing.
 * 
 * Usage:
 *   netscript compile hack.script
 */
@Command(
    name = "compile",
    description = "Compile a script and show its bytecode",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Script file")
    private Path inputFile;

    @Override
    public Integer call() {
        try {
            String source = Files.readString(inputFile, StandardCharsets.UTF_8);
            FunctionCode main = new Compiler().compile(source);

            System.out.println("=== " + inputFile.getFileName() + " ===");
            System.out.print(Disassembler.disassemble(main));
            return 0;

        } catch (ScriptSyntaxException e) {
            System.err.println("✗ Syntax ERROR in " + inputFile.getFileName() + ":\n" + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("✗ Error: " + e.getMessage());
            return 1;
        }
    }
}
