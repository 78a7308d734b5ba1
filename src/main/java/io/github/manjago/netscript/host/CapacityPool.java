package io.github.manjago.netscript.host;

/**
 * RAM budget of one host.
 * <p>
 * Invariant: {@code 0 <= getReserved() <= getTotal()}.
 */
public interface CapacityPool {

    /**
     * Total capacity.
     */
    double getTotal();

    /**
     * Capacity currently reserved by running processes.
     */
    double getReserved();

    /**
     * Reserve capacity.
     *
     * @param amount amount to reserve, already rounded by the caller
     * @return true if reserved, false if it does not fit (nothing changes)
     */
    boolean reserve(double amount);

    /**
     * Return previously reserved capacity. The reserved amount never drops below 0.
     */
    void release(double amount);

    /**
     * Drop every reservation, used when processes are rebuilt from persisted state.
     */
    void reset();

    /**
     * Free capacity, rounded like every reservation.
     */
    default double getAvailable() {
        return RamMath.roundToTwo(getTotal() - getReserved());
    }
}
