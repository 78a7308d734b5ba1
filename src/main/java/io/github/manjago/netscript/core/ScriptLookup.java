package io.github.manjago.netscript.core;

import java.util.Optional;

/**
 * Source of script text for import resolution, usually the scripts stored on
 * the host the importing script runs on.
 */
@FunctionalInterface
public interface ScriptLookup {

    /**
     * @param filename script file name without a leading "./"
     * @return the script text, or empty if no such script exists
     */
    Optional<String> findCode(String filename);
}
