package io.github.manjago.netscript.cli;

import io.github.manjago.netscript.host.Server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every regular file of a directory onto a host as a script.
 */
final class ScriptDirectory {

    private ScriptDirectory() {
        // Utility class
    }

    static int loadInto(Server server, Path dir, double ramPerScript) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            String code = Files.readString(file, StandardCharsets.UTF_8);
            server.addScript(file.getFileName().toString(), code, ramPerScript);
        }
        return files.size();
    }
}
