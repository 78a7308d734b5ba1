package io.github.manjago.netscript.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple counter-based {@link CapacityPool}.
 */
public class RamPool implements CapacityPool {

    private static final Logger log = LoggerFactory.getLogger(RamPool.class);

    private final double total;
    private double reserved;

    public RamPool(double total) {
        if (total < 0) {
            throw new IllegalArgumentException("RAM total must be >= 0: " + total);
        }
        this.total = total;
    }

    @Override
    public double getTotal() {
        return total;
    }

    @Override
    public double getReserved() {
        return reserved;
    }

    @Override
    public boolean reserve(double amount) {
        if (amount < 0 || amount > getAvailable()) {
            return false;
        }
        reserved = RamMath.roundToTwo(reserved + amount);
        return true;
    }

    @Override
    public void release(double amount) {
        double next = RamMath.roundToTwo(reserved - amount);
        if (next < 0) {
            log.warn("Releasing {} GB from a pool with {} GB reserved, clamping to 0", amount, reserved);
            next = 0;
        }
        reserved = next;
    }

    @Override
    public void reset() {
        reserved = 0;
    }

    @Override
    public String toString() {
        return String.format("RamPool{%.2f/%.2f GB}", reserved, total);
    }
}
