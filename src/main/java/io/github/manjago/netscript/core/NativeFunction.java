package io.github.manjago.netscript.core;

import java.util.List;

/**
 * A Java function callable from guest code.
 * <p>
 * Asynchronous functions return a {@link java.util.concurrent.CompletionStage};
 * the virtual machine suspends until it settles.
 */
public interface NativeFunction {

    String name();

    boolean isAsync();

    /**
     * @param args arguments already converted to plain Java values
     * @return result (a CompletionStage for asynchronous functions)
     */
    Object call(List<Object> args);
}
