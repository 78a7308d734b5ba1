package io.github.manjago.netscript.api;

import java.util.concurrent.CompletionStage;

/**
 * A script in the native (promise) format, loaded as Java code.
 */
@FunctionalInterface
public interface NativeScript {

    /**
     * Start the script.
     *
     * @return stage that completes when the script is done; null means "done already"
     * @throws Exception any failure of the script
     */
    CompletionStage<?> run(NetscriptApi ns) throws Exception;
}
