package io.github.manjago.netscript.engine;

/**
 * Outcome of an admission request.
 */
public sealed interface Admission {

    /**
     * Capacity was reserved.
     *
     * @param cost amount reserved, to be released exactly at teardown
     */
    record Reserved(double cost) implements Admission {}

    /**
     * Nothing was reserved.
     */
    record Rejected(double cost, double available, String reason) implements Admission {}
}
