package io.github.manjago.netscript.host;

import java.util.List;
import java.util.Objects;

/**
 * Durable record of one script invocation.
 * <p>
 * It outlives the process backing it: it is persisted with the host and
 * turned into a new process when the game loads. The process id is assigned
 * once and never changes afterwards.
 */
public class RunningScript {

    /** Marker for "no pid assigned yet" */
    public static final int NO_PID = -1;

    private final String filename;
    private final List<Object> args;
    private final int threads;
    private String server;
    private double ramUsage;
    private int pid = NO_PID;

    // Accumulated stats
    private double onlineRunningTime;
    private double onlineMoneyMade;
    private double onlineExpGained;
    private double offlineRunningTime;
    private double offlineMoneyMade;
    private double offlineExpGained;

    /**
     * @param filename script file name
     * @param args     argument vector (copied)
     * @param threads  thread count, at least 1
     */
    public RunningScript(String filename, List<Object> args, int threads) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.args = List.copyOf(args);
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        this.threads = threads;
    }

    public RunningScript(Script script, List<Object> args, int threads) {
        this(script.filename(), args, threads);
        this.ramUsage = script.ramUsage();
    }

    // ========== Identity ==========

    public String getFilename() {
        return filename;
    }

    public List<Object> getArgs() {
        return args;
    }

    public int getThreads() {
        return threads;
    }

    public String getServer() {
        return server;
    }

    public void setServer(String server) {
        this.server = server;
    }

    public double getRamUsage() {
        return ramUsage;
    }

    public void setRamUsage(double ramUsage) {
        this.ramUsage = ramUsage;
    }

    public int getPid() {
        return pid;
    }

    public boolean hasPid() {
        return pid != NO_PID;
    }

    /**
     * Assign the process id.
     *
     * @throws IllegalStateException if a pid was already assigned
     */
    public void assignPid(int pid) {
        if (this.pid != NO_PID) {
            throw new IllegalStateException(filename + " already has pid " + this.pid);
        }
        this.pid = pid;
    }

    /**
     * Same file and equal arguments.
     */
    public boolean matches(String otherFilename, List<?> otherArgs) {
        return filename.equals(otherFilename) && args.equals(otherArgs);
    }

    // ========== Stats ==========

    public double getOnlineRunningTime() {
        return onlineRunningTime;
    }

    public void addOnlineRunningTime(double seconds) {
        this.onlineRunningTime += seconds;
    }

    public double getOnlineMoneyMade() {
        return onlineMoneyMade;
    }

    public void addOnlineMoneyMade(double money) {
        this.onlineMoneyMade += money;
    }

    public double getOnlineExpGained() {
        return onlineExpGained;
    }

    public void addOnlineExpGained(double exp) {
        this.onlineExpGained += exp;
    }

    public double getOfflineRunningTime() {
        return offlineRunningTime;
    }

    public double getOfflineMoneyMade() {
        return offlineMoneyMade;
    }

    public double getOfflineExpGained() {
        return offlineExpGained;
    }

    /**
     * Record production computed for the time the game was closed.
     */
    public void addOffline(double seconds, double money, double exp) {
        this.offlineRunningTime += seconds;
        this.offlineMoneyMade += money;
        this.offlineExpGained += exp;
    }

    /**
     * Restore persisted counters.
     */
    public void restoreStats(double onlineTime, double onlineMoney, double onlineExp,
                             double offlineTime, double offlineMoney, double offlineExp) {
        this.onlineRunningTime = onlineTime;
        this.onlineMoneyMade = onlineMoney;
        this.onlineExpGained = onlineExp;
        this.offlineRunningTime = offlineTime;
        this.offlineMoneyMade = offlineMoney;
        this.offlineExpGained = offlineExp;
    }

    @Override
    public String toString() {
        return "RunningScript{" + filename + " " + args + " t=" + threads
                + (server != null ? " @" + server : "") + (hasPid() ? " pid=" + pid : "") + '}';
    }
}
