package io.github.manjago.netscript.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Inlines the functions a legacy script imports from other scripts.
 * <p>
 * Only top-level import declarations are processed. {@code import {a, b} from
 * "lib"} copies the declarations of {@code a} and {@code b} in front of the
 * script; {@code import * as ns from "lib"} copies every top-level function of
 * {@code lib} and binds them to the object {@code ns}. The import declarations
 * themselves are cut out of the text, everything else is kept byte for byte.
 */
public class ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private final ScriptLookup lookup;

    public ImportResolver(ScriptLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * Resolve the imports of a script.
     *
     * @param code script text
     * @return code with imports inlined; the original text and offset 0 when there are none
     * @throws ScriptSyntaxException      if the script itself does not parse
     * @throws ImportResolutionException  if a referenced script or function does not exist
     */
    public ImportResult resolve(String code) throws ScriptSyntaxException, ImportResolutionException {
        Program program = Parser.parse(code);
        List<Stmt.Import> imports = program.imports();
        if (imports.isEmpty()) {
            return new ImportResult(code, 0);
        }

        StringBuilder generated = new StringBuilder();
        for (Stmt.Import declaration : imports) {
            String scriptName = normalize(declaration.source());
            Program imported = parseImported(scriptName);
            if (declaration.isNamespace()) {
                appendNamespace(generated, declaration.namespace(), imported);
            } else {
                appendNamed(generated, declaration.names(), imported, scriptName);
            }
        }

        String remaining = removeImports(code, imports);
        int removedLines = countNewlines(code) - countNewlines(remaining);
        int lineOffset = countNewlines(generated) - removedLines;
        log.debug("Resolved {} import(s): {} generated line(s), {} removed, offset {}",
                imports.size(), countNewlines(generated), removedLines, lineOffset);
        return new ImportResult(generated + remaining, lineOffset);
    }

    private Program parseImported(String scriptName) throws ImportResolutionException {
        String source = lookup.findCode(scriptName)
                .orElseThrow(() -> new ImportResolutionException(
                        "'Import' failed due to invalid script: " + scriptName));
        try {
            return Parser.parse(source);
        } catch (ScriptSyntaxException e) {
            throw new ImportResolutionException(
                    "'Import' failed due to invalid script: " + scriptName + " (" + e.getMessage() + ")", e);
        }
    }

    // ========== Code generation ==========

    private static void appendNamed(StringBuilder out, List<String> names, Program imported, String scriptName)
            throws ImportResolutionException {
        List<Stmt.Function> selected = new ArrayList<>();
        for (Stmt.Function fn : imported.functions()) {
            if (names.contains(fn.name())) {
                selected.add(fn);
            }
        }
        for (String name : names) {
            if (selected.stream().noneMatch(fn -> fn.name().equals(name))) {
                throw new ImportResolutionException(
                        "'Import' failed: " + scriptName + " has no function named " + name);
            }
        }
        for (Stmt.Function fn : selected) {
            out.append(fn.span().slice(imported.source())).append('\n');
        }
    }

    private static void appendNamespace(StringBuilder out, String namespace, Program imported) {
        List<Stmt.Function> functions = imported.functions();
        out.append("var ").append(namespace).append(";\n");
        out.append("(function (namespace) {\n");
        for (Stmt.Function fn : functions) {
            out.append(fn.span().slice(imported.source())).append('\n');
        }
        for (Stmt.Function fn : functions) {
            out.append("namespace.").append(fn.name()).append(" = ").append(fn.name()).append('\n');
        }
        out.append("})(").append(namespace).append(" || (").append(namespace).append(" = {}));\n");
    }

    // ========== Import removal ==========

    /**
     * Cut every import declaration out of the text. When nothing but
     * whitespace follows a declaration on its line, the line break goes too.
     */
    static String removeImports(String code, List<Stmt.Import> imports) {
        List<Stmt.Import> ordered = new ArrayList<>(imports);
        ordered.sort(Comparator.comparingInt(i -> i.span().start()));

        StringBuilder out = new StringBuilder(code.length());
        int copied = 0;
        for (Stmt.Import declaration : ordered) {
            out.append(code, copied, declaration.span().start());
            int end = declaration.span().end();
            int scan = end;
            while (scan < code.length() && (code.charAt(scan) == ' ' || code.charAt(scan) == '\t'
                    || code.charAt(scan) == '\r')) {
                scan++;
            }
            if (scan >= code.length() || code.charAt(scan) == '\n') {
                end = Math.min(scan + 1, code.length());
            }
            copied = end;
        }
        out.append(code, copied, code.length());
        return out.toString();
    }

    static String normalize(String scriptName) {
        return scriptName.startsWith("./") ? scriptName.substring(2) : scriptName;
    }

    static int countNewlines(CharSequence text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }
}
