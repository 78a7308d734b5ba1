package io.github.manjago.netscript.core;

/**
 * Source range of a declaration: character offsets and the lines they fall on.
 */
public record Span(int start, int end, int startLine, int endLine) {

    /**
     * Text covered by this span.
     */
    public String slice(String source) {
        return source.substring(start, end);
    }
}
