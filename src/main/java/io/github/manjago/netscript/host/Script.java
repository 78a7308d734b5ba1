package io.github.manjago.netscript.host;

import java.util.Objects;

/**
 * A script file stored on a host.
 *
 * @param filename  file name, e.g. {@code hack.script} or {@code batch.js}
 * @param code      source text
 * @param ramUsage  RAM cost of one thread, 0 when unknown
 */
public record Script(String filename, String code, double ramUsage) {

    public Script {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(code, "code");
    }
}
