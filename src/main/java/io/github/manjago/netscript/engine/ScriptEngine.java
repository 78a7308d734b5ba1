package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.api.FunctionCatalog;
import io.github.manjago.netscript.api.ModuleLoader;
import io.github.manjago.netscript.config.EngineConfig;
import io.github.manjago.netscript.core.GuestValues;
import io.github.manjago.netscript.core.VirtualMachine;
import io.github.manjago.netscript.host.Host;
import io.github.manjago.netscript.host.HostDirectory;
import io.github.manjago.netscript.host.OfflineProduction;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Starts, tracks and stops script processes.
 * <p>
 * All methods must be called on the event loop thread (or, with a
 * {@link io.github.manjago.netscript.loop.VirtualEventLoop}, on the thread
 * driving it).
 */
public class ScriptEngine {

    private static final Logger log = LoggerFactory.getLogger(ScriptEngine.class);

    private final EngineConfig config;
    private final EventLoop loop;
    private final HostDirectory hosts;
    private final FunctionCatalog catalog;
    private final ModuleLoader modules;
    private final EngineContext context;

    private final PidAllocator pids;
    private final AdmissionController admission = new AdmissionController();
    private final ProcessReaper reaper;
    private final CompletionPipeline pipeline;
    private final LegacyScriptRunner legacyRunner;
    private final NativeScriptRunner nativeRunner;
    private final CoreFunctions coreFunctions;

    // Event listener
    private EngineListener listener = EngineListener.NOOP;
    private OfflineProduction offlineProduction = OfflineProduction.NOOP;

    // Statistics
    private long started = 0;
    private long rejected = 0;
    private long finished = 0;
    private long killed = 0;
    private long crashed = 0;
    private long failedToStart = 0;
    private int peakLive = 0;

    public ScriptEngine(EngineConfig config, EventLoop loop, HostDirectory hosts,
                        FunctionCatalog catalog, ModuleLoader modules) {
        this.config = config;
        this.loop = loop;
        this.hosts = hosts;
        this.catalog = catalog;
        this.modules = modules;
        this.context = new EngineContext(config.portCount(), config.portCapacity());

        EngineListener events = new Dispatcher();
        ProcessRegistry registry = context.getRegistry();
        this.pids = new PidAllocator(registry, config.maxPid(), config.maxPidSearch());
        this.reaper = new ProcessReaper(registry, events);
        this.pipeline = new CompletionPipeline(registry, reaper, events);
        this.legacyRunner = new LegacyScriptRunner(loop, new VirtualMachine(),
                config.instructionTimeSliceMs(), reaper, events);
        this.nativeRunner = new NativeScriptRunner(loop, modules, new CallSerializer());
        this.coreFunctions = new CoreFunctions(this, loop, hosts);

        log.info("Script engine created (time slice: {} ms, ports: {})",
                config.instructionTimeSliceMs(), config.portCount());
    }

    /**
     * Set event listener for process events.
     */
    public void setListener(EngineListener listener) {
        this.listener = listener != null ? listener : EngineListener.NOOP;
    }

    public void setOfflineProduction(OfflineProduction offlineProduction) {
        this.offlineProduction = offlineProduction != null ? offlineProduction : OfflineProduction.NOOP;
    }

    // ========== Starting ==========

    /**
     * Turn a running-script record into a live process.
     *
     * @return the new pid, or 0 if the process could not start
     */
    public int startProcess(RunningScript rs, Host host) {
        return startProcess(rs, host, null);
    }

    /**
     * Turn a running-script record into a live process started by another one.
     *
     * @param parent starting process, null for none
     * @return the new pid, or 0 if the process could not start
     */
    public int startProcess(RunningScript rs, Host host, WorkerScript parent) {
        if (rs.hasPid()) {
            log.warn("{} already has pid {}, not starting it again", rs, rs.getPid());
            rejected++;
            return 0;
        }
        Optional<Script> script = host.getScript(rs.getFilename());
        if (script.isEmpty()) {
            log.warn("Cannot start {}: no such script on {}", rs.getFilename(), host.getHostname());
            rejected++;
            return 0;
        }

        int pid = pids.allocate();
        if (pid == -1) {
            rejected++;
            listener.onUserMessage("Failed to start script because could not find available PID. "
                    + "This is most because you have too many scripts running.");
            return 0;
        }

        Admission result = admission.admit(rs, host);
        if (result instanceof Admission.Rejected rejection) {
            rejected++;
            log.warn("Rejected {} on {}: {}", rs.getFilename(), host.getHostname(), rejection.reason());
            listener.onUserMessage(rejection.reason());
            return 0;
        }
        double cost = ((Admission.Reserved) result).cost();

        rs.assignPid(pid);
        rs.setServer(host.getHostname());
        WorkerScript ws = new WorkerScript(pid, rs, host, script.get().code(), cost,
                parent != null ? parent.getPid() : WorkerScript.NO_PARENT,
                config.logCapacity(), loop.now());
        for (Binding binding : coreFunctions.bindings()) {
            ws.getEnv().install(binding);
        }
        for (Binding binding : catalog.bindingsFor(ws)) {
            ws.getEnv().install(binding);
        }

        context.getRegistry().register(ws);
        if (!host.getRunningScripts().contains(rs)) {
            host.addRunningScript(rs);
        }
        started++;
        peakLive = Math.max(peakLive, context.getRegistry().size());
        listener.onStart(ws);
        log.info("Started {} on {} as pid {} ({} GB, {})", rs.getFilename(), host.getHostname(), pid, cost, ws.getMode());

        pipeline.attach(ws);
        if (ws.getMode() == ExecutionMode.LEGACY) {
            if (!legacyRunner.start(ws)) {
                return 0;
            }
        } else {
            nativeRunner.start(ws);
        }
        return pid;
    }

    /**
     * Start a script on behalf of a running script ({@code run}, {@code exec}).
     *
     * @return the new pid, or 0 after logging the reason to the caller's log
     */
    public int startNestedProcess(WorkerScript caller, Host host, Object scriptName, Object args, Number threads) {
        return startNestedProcess("run", caller, host, scriptName, args, threads);
    }

    public int startNestedProcess(WorkerScript caller, Host host, String scriptName, List<?> args) {
        return startNestedProcess(caller, host, scriptName, args, 1);
    }

    int startNestedProcess(String fn, WorkerScript caller, Host host, Object scriptName, Object args, Number threads) {
        if (caller == null) {
            return 0;
        }
        if (!(scriptName instanceof String name) || !(args instanceof List<?> argList)) {
            caller.log(fn, "Invalid arguments: scriptname='" + scriptName + "' args='" + args + "'");
            log.warn("Nested start from pid {} failed due to invalid arguments", caller.getPid());
            return 0;
        }
        List<Object> scriptArgs = new ArrayList<>(argList.size());
        for (Object arg : argList) {
            scriptArgs.add(GuestValues.toGuest(arg));
        }

        if (host.getRunningScript(name, scriptArgs).isPresent()) {
            caller.log(fn, "'" + name + "' is already running on '" + host.getHostname() + "'");
            return 0;
        }
        if (scriptArgs.contains(null)) {
            caller.log(fn, "Cannot execute a script with null/undefined as an argument");
            return 0;
        }
        Optional<Script> script = host.getScript(name);
        if (script.isEmpty()) {
            caller.log(fn, "Could not find script '" + name + "' on '" + host.getHostname() + "'");
            return 0;
        }
        long threadCount = Math.round(threads == null ? 1.0 : threads.doubleValue());
        if (threadCount < 1 || threadCount > Integer.MAX_VALUE) {
            caller.log(fn, "Invalid thread count " + threads + " for '" + name + "'");
            return 0;
        }
        if (!host.hasAdminRights()) {
            caller.log(fn, "You do not have root access on '" + host.getHostname() + "'");
            return 0;
        }
        RunningScript rs = new RunningScript(script.get(), scriptArgs, (int) threadCount);
        if (admission.cost(rs, host) > host.getRam().getAvailable()) {
            caller.log(fn, "Cannot run script '" + name + "' (t=" + threadCount + ") on '" + host.getHostname()
                    + "' because there is not enough available RAM!");
            return 0;
        }
        caller.log(fn, "'" + name + "' on '" + host.getHostname() + "' with " + threadCount
                + " threads and args: " + RuntimeErrorMessage.formatArgs(scriptArgs) + ".");
        return startProcess(rs, host, caller);
    }

    // ========== Stopping ==========

    /**
     * Stop a process.
     *
     * @return true if a live process was stopped
     */
    public boolean kill(int pid) {
        return context.getRegistry().lookup(pid).map(this::kill).orElse(false);
    }

    public boolean kill(WorkerScript ws) {
        ws.getEnv().requestStop();
        boolean stopped = reaper.teardown(ws, ExitStatus.KILLED);
        if (stopped) {
            log.info("Killed pid {} ({})", ws.getPid(), ws.getName());
        }
        return stopped;
    }

    /**
     * End a process as if its script had finished.
     */
    void exit(WorkerScript ws) {
        ws.setRunning(false);
        reaper.teardown(ws, ExitStatus.FINISHED);
    }

    /**
     * Stop every live process and clear the registry.
     *
     * @return number of processes stopped
     */
    public int killAll() {
        List<WorkerScript> live = context.getRegistry().allLive();
        for (WorkerScript ws : live) {
            ws.getEnv().requestStop();
            reaper.teardown(ws, ExitStatus.KILLED);
        }
        context.getRegistry().clear();
        log.info("Killed all processes ({})", live.size());
        return live.size();
    }

    /**
     * Full restart: stop everything, empty the ports and restart pid numbering.
     */
    public void reset() {
        killAll();
        context.reset();
        pids.reset();
    }

    // ========== Time and persistence ==========

    /**
     * Add online running time to every live process.
     *
     * @param cycles number of engine cycles that passed
     */
    public void updateOnlineScriptTimes(int cycles) {
        double seconds = cycles * config.idleSpeedMs() / 1000.0;
        for (WorkerScript ws : context.getRegistry().allLive()) {
            ws.getScriptRef().addOnlineRunningTime(seconds);
        }
    }

    /**
     * Start processes for every running-script record stored on the hosts,
     * as after loading a saved game.
     *
     * @return number of processes started
     */
    public int rehydrateFromPersisted(Collection<? extends Host> toLoad) {
        boolean skip = config.skipScriptLoad();
        if (skip) {
            log.info("Skipping the load of any scripts during startup");
        }
        int count = 0;
        int dropped = 0;
        for (Host host : toLoad) {
            host.getRam().reset();
            for (Script script : host.getScripts()) {
                modules.invalidate(script);
            }
            if (skip) {
                host.getRunningScripts().clear();
                continue;
            }
            for (RunningScript rs : new ArrayList<>(host.getRunningScripts())) {
                if (startProcess(rs, host) != 0) {
                    count++;
                    offlineProduction.apply(rs, host);
                } else {
                    host.removeRunningScript(rs);
                    dropped++;
                }
            }
        }
        log.info("Rehydrated {} process(es), dropped {}", count, dropped);
        return count;
    }

    // ========== Accessors ==========

    public EngineContext getContext() {
        return context;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public HostDirectory getHosts() {
        return hosts;
    }

    public Optional<WorkerScript> getProcess(int pid) {
        return context.getRegistry().lookup(pid);
    }

    public List<WorkerScript> getProcesses() {
        return context.getRegistry().allLive();
    }

    void terminal(String text) {
        listener.onTerminalOutput(text);
    }

    /**
     * Get current statistics snapshot.
     */
    public EngineStats getStats() {
        return new EngineStats(started, rejected, finished, killed, crashed, failedToStart,
                context.getRegistry().size(), peakLive);
    }

    /**
     * Counts exits and forwards every event to the current listener.
     */
    private final class Dispatcher implements EngineListener {

        @Override
        public void onStart(WorkerScript ws) {
            listener.onStart(ws);
        }

        @Override
        public void onExit(WorkerScript ws, ExitStatus status) {
            switch (status) {
                case FINISHED -> finished++;
                case KILLED -> killed++;
                case CRASHED -> crashed++;
                case FAILED_TO_START -> failedToStart++;
            }
            listener.onExit(ws, status);
        }

        @Override
        public void onUserMessage(String message) {
            listener.onUserMessage(message);
        }

        @Override
        public void onTerminalOutput(String text) {
            listener.onTerminalOutput(text);
        }
    }
}
