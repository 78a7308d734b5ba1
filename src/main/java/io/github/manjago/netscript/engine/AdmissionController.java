package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.host.CapacityPool;
import io.github.manjago.netscript.host.Host;
import io.github.manjago.netscript.host.RamMath;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RAM admission: all or nothing.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    /**
     * RAM one thread of the script needs: the record's own figure, else the
     * host script's, else 0.
     */
    public double perThreadCost(RunningScript rs, Host host) {
        if (rs.getRamUsage() > 0) {
            return rs.getRamUsage();
        }
        return host.getScript(rs.getFilename()).map(Script::ramUsage).orElse(0.0);
    }

    public double cost(RunningScript rs, Host host) {
        return RamMath.roundToTwo(perThreadCost(rs, host) * rs.getThreads());
    }

    /**
     * Reserve the script's cost on the host, or nothing.
     */
    public Admission admit(RunningScript rs, Host host) {
        double cost = cost(rs, host);
        CapacityPool ram = host.getRam();
        double available = ram.getAvailable();
        if (cost > available || !ram.reserve(cost)) {
            String reason = String.format("Not enough RAM to run script %s with args %s: needs %.2f GB, %.2f GB available",
                    rs.getFilename(), RuntimeErrorMessage.formatArgs(rs.getArgs()), cost, available);
            log.debug("Rejected {} on {}: cost {} > available {}", rs.getFilename(), host.getHostname(), cost, available);
            return new Admission.Rejected(cost, available, reason);
        }
        log.debug("Reserved {} GB on {} for {}", cost, host.getHostname(), rs.getFilename());
        return new Admission.Reserved(cost);
    }
}
