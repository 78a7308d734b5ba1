package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.api.Capability;
import io.github.manjago.netscript.api.HostFunction;
import io.github.manjago.netscript.core.GuestValues;
import io.github.manjago.netscript.core.ScriptRuntimeException;
import io.github.manjago.netscript.host.Host;
import io.github.manjago.netscript.host.HostDirectory;
import io.github.manjago.netscript.loop.EventLoop;
import io.github.manjago.netscript.port.MessagePort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Functions the engine itself provides to every script: sleeping, logging,
 * process control and message ports.
 */
public final class CoreFunctions {

    private final ScriptEngine engine;
    private final EventLoop loop;
    private final HostDirectory hosts;

    CoreFunctions(ScriptEngine engine, EventLoop loop, HostDirectory hosts) {
        this.engine = engine;
        this.loop = loop;
        this.hosts = hosts;
    }

    /**
     * All core bindings.
     */
    public List<Binding> bindings() {
        List<Binding> list = new ArrayList<>();
        list.add(new Binding(Capability.timer("sleep"), this::sleep));
        list.add(sync("print", (ws, args) -> {
            ws.log("", text(args, 0));
            return null;
        }));
        list.add(sync("tprint", (ws, args) -> {
            engine.terminal(ws.getName() + ": " + text(args, 0));
            return null;
        }));
        list.add(sync("exit", (ws, args) -> {
            ws.log("exit", "Exiting...");
            engine.exit(ws);
            return null;
        }));
        list.add(sync("kill", this::kill));
        list.add(sync("run", this::run));
        list.add(sync("exec", this::exec));
        list.add(sync("getScriptName", (ws, args) -> ws.getName()));
        list.add(sync("getHostname", (ws, args) -> ws.getHost().getHostname()));
        list.add(sync("getPid", (ws, args) -> ws.getPid()));
        list.add(sync("isRunning", this::isRunning));
        list.add(sync("writePort", (ws, args) -> port(args, "writePort").write(value(args, 1))));
        list.add(sync("tryWritePort", (ws, args) -> port(args, "tryWritePort").tryWrite(value(args, 1))));
        list.add(sync("readPort", (ws, args) -> port(args, "readPort").read()));
        list.add(sync("peekPort", (ws, args) -> port(args, "peekPort").peek()));
        list.add(sync("clearPort", (ws, args) -> {
            port(args, "clearPort").clear();
            return null;
        }));
        return list;
    }

    private static Binding sync(String name, HostFunction function) {
        return new Binding(Capability.sync(name), function);
    }

    // ========== Timers ==========

    private Object sleep(WorkerScript ws, List<Object> args) {
        long millis = (long) number(args, 0, "sleep");
        if (millis < 0) {
            throw new ScriptRuntimeException("sleep: Invalid time " + millis);
        }
        ws.log("sleep", "Sleeping for " + millis + " milliseconds");
        CompletableFuture<Object> future = new CompletableFuture<>();
        EventLoop.Timer timer = loop.schedule(() -> {
            ws.clearDelay(future);
            future.complete(true);
        }, millis);
        ws.setDelay(timer, future);
        return future;
    }

    // ========== Processes ==========

    private Object run(WorkerScript ws, List<Object> args) {
        if (args.isEmpty()) {
            throw new ScriptRuntimeException("run: Usage: run(scriptname, [numThreads], [arg1], [arg2]...)");
        }
        Object threads = args.size() > 1 ? args.get(1) : 1;
        List<Object> scriptArgs = args.size() > 2 ? new ArrayList<>(args.subList(2, args.size())) : List.of();
        return engine.startNestedProcess("run", ws, ws.getHost(), args.get(0), scriptArgs, asNumber(threads));
    }

    private Object exec(WorkerScript ws, List<Object> args) {
        if (args.size() < 2) {
            throw new ScriptRuntimeException("exec: Usage: exec(scriptname, server, [numThreads], [arg1], [arg2]...)");
        }
        Host target = hosts.find(GuestValues.toDisplayString(args.get(1)))
                .orElseThrow(() -> new ScriptRuntimeException("exec: Invalid hostname '" + args.get(1) + "'"));
        Object threads = args.size() > 2 ? args.get(2) : 1;
        List<Object> scriptArgs = args.size() > 3 ? new ArrayList<>(args.subList(3, args.size())) : List.of();
        return engine.startNestedProcess("exec", ws, target, args.get(0), scriptArgs, asNumber(threads));
    }

    private Object kill(WorkerScript ws, List<Object> args) {
        if (args.isEmpty()) {
            throw new ScriptRuntimeException("kill: Usage: kill(pid) or kill(scriptname, server, [arg1]...)");
        }
        if (args.size() == 1 && args.get(0) instanceof Number pid) {
            boolean killed = engine.kill(pid.intValue());
            ws.log("kill", killed ? "Killing process " + pid.intValue() : "No such process " + pid.intValue());
            return killed;
        }
        String filename = GuestValues.toDisplayString(args.get(0));
        Host host = args.size() > 1
                ? hosts.find(GuestValues.toDisplayString(args.get(1))).orElse(null)
                : ws.getHost();
        if (host == null) {
            ws.log("kill", "Invalid hostname '" + args.get(1) + "'");
            return false;
        }
        List<Object> scriptArgs = args.size() > 2 ? normalizeArgs(args.subList(2, args.size())) : List.of();
        boolean killed = host.getRunningScript(filename, scriptArgs)
                .filter(rs -> rs.hasPid())
                .map(rs -> engine.kill(rs.getPid()))
                .orElse(false);
        ws.log("kill", killed
                ? "Killing '" + filename + "' on '" + host.getHostname() + "'"
                : "No such script '" + filename + "' on '" + host.getHostname() + "'");
        return killed;
    }

    private Object isRunning(WorkerScript ws, List<Object> args) {
        if (args.isEmpty()) {
            throw new ScriptRuntimeException("isRunning: Usage: isRunning(scriptname, [server], [arg1]...)");
        }
        if (args.size() == 1 && args.get(0) instanceof Number pid) {
            return engine.getContext().getRegistry().contains(pid.intValue());
        }
        Host host = args.size() > 1
                ? hosts.find(GuestValues.toDisplayString(args.get(1))).orElse(null)
                : ws.getHost();
        if (host == null) {
            return false;
        }
        List<Object> scriptArgs = args.size() > 2 ? normalizeArgs(args.subList(2, args.size())) : List.of();
        return host.getRunningScript(GuestValues.toDisplayString(args.get(0)), scriptArgs).isPresent();
    }

    // ========== Ports ==========

    private MessagePort port(List<Object> args, String fn) {
        int number = (int) number(args, 0, fn);
        try {
            return engine.getContext().getPorts().get(number);
        } catch (IllegalArgumentException e) {
            throw new ScriptRuntimeException(fn + ": " + e.getMessage());
        }
    }

    // ========== Arguments ==========

    private static double number(List<Object> args, int index, String fn) {
        Object value = index < args.size() ? args.get(index) : null;
        if (!(value instanceof Number n)) {
            throw new ScriptRuntimeException(fn + ": Expected a number but got " + GuestValues.toDisplayString(value));
        }
        return n.doubleValue();
    }

    private static Number asNumber(Object value) {
        return value instanceof Number n ? n : GuestValues.toNumber(value);
    }

    private static Object value(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    private static String text(List<Object> args, int index) {
        return GuestValues.toDisplayString(GuestValues.toGuest(value(args, index)));
    }

    /**
     * Arguments compare equal to the ones a script was started with, which
     * went through the same guest number representation.
     */
    private static List<Object> normalizeArgs(List<Object> args) {
        List<Object> list = new ArrayList<>(args.size());
        for (Object arg : args) {
            list.add(GuestValues.toGuest(arg));
        }
        return list;
    }
}
