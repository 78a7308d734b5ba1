package io.github.manjago.netscript.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out process ids: increasing, wrapping back to 1, never one that is live.
 */
public final class PidAllocator {

    private static final Logger log = LoggerFactory.getLogger(PidAllocator.class);

    private final ProcessRegistry registry;
    private final int maxPid;
    private final int maxSearch;
    private int next = 1;

    /**
     * @param registry  registry of live processes
     * @param maxPid    largest pid; the counter wraps to 1 after it
     * @param maxSearch candidates one allocation may probe
     */
    public PidAllocator(ProcessRegistry registry, int maxPid, int maxSearch) {
        this.registry = registry;
        this.maxPid = maxPid;
        this.maxSearch = maxSearch;
    }

    /**
     * @return a free pid, or -1 if none was found within the search limit
     */
    public int allocate() {
        for (int i = 0; i < maxSearch; i++) {
            int candidate = next;
            next = next >= maxPid ? 1 : next + 1;
            if (!registry.contains(candidate)) {
                return candidate;
            }
        }
        log.warn("No free pid after probing {} candidates", maxSearch);
        return -1;
    }

    /**
     * Restart numbering at 1.
     */
    public void reset() {
        next = 1;
    }
}
