package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.core.GuestValues;

import java.util.List;
import java.util.Optional;

/**
 * Runtime error messages in the {@code RUNTIME ERROR|host|script|message} format.
 *
 * @param host    hostname the script ran on
 * @param script  script file name
 * @param message error text
 */
public record RuntimeErrorMessage(String host, String script, String message) {

    public static final String TAG = "RUNTIME ERROR";
    private static final String SEPARATOR = "|";

    /**
     * Build the wire form. A '|' inside a field becomes '/'.
     */
    public static String build(String host, String script, String message) {
        return TAG + SEPARATOR + sanitize(host) + SEPARATOR + sanitize(script) + SEPARATOR + sanitize(message);
    }

    public static String build(WorkerScript ws, String message) {
        return build(ws.getHost().getHostname(), ws.getName(), message);
    }

    /**
     * Parse the wire form.
     *
     * @return empty unless the text has exactly four fields and the tag
     */
    public static Optional<RuntimeErrorMessage> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] fields = text.split("\\|", -1);
        if (fields.length != 4 || !TAG.equals(fields[0])) {
            return Optional.empty();
        }
        return Optional.of(new RuntimeErrorMessage(fields[1], fields[2], fields[3]));
    }

    public static boolean isValid(String text) {
        return parse(text).isPresent();
    }

    /**
     * Text shown to the user for a crashed script.
     */
    public String render(List<?> args) {
        StringBuilder sb = new StringBuilder();
        sb.append(TAG).append('\n');
        sb.append(script).append('@').append(host).append('\n');
        if (!args.isEmpty()) {
            sb.append("Args: ").append(formatArgs(args)).append('\n');
        }
        sb.append('\n').append(message);
        return sb.toString();
    }

    /**
     * Argument list as shown in messages: {@code ["a", 1, true]}.
     */
    public static String formatArgs(List<?> args) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            Object arg = args.get(i);
            if (arg instanceof String s) {
                sb.append('"').append(s).append('"');
            } else {
                sb.append(GuestValues.toDisplayString(GuestValues.toGuest(arg)));
            }
        }
        return sb.append(']').toString();
    }

    private static String sanitize(String field) {
        return field == null ? "" : field.replace('|', '/');
    }
}
