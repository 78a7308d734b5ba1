package io.github.manjago.netscript.core;

/**
 * An import that cannot be satisfied: the referenced script or function does
 * not exist, or a referenced script does not parse.
 */
public class ImportResolutionException extends Exception {

    public ImportResolutionException(String message) {
        super(message);
    }

    public ImportResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
