package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.core.Compiler;
import io.github.manjago.netscript.core.FunctionCode;
import io.github.manjago.netscript.core.GuestValues;
import io.github.manjago.netscript.core.ImportResolutionException;
import io.github.manjago.netscript.core.ImportResolver;
import io.github.manjago.netscript.core.ImportResult;
import io.github.manjago.netscript.core.NativeFunction;
import io.github.manjago.netscript.core.Scope;
import io.github.manjago.netscript.core.ScriptRuntimeException;
import io.github.manjago.netscript.core.ScriptSyntaxException;
import io.github.manjago.netscript.core.VirtualMachine;
import io.github.manjago.netscript.core.VmState;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs legacy scripts: resolve imports, compile, then step one instruction
 * per time slice on the event loop.
 */
public final class LegacyScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(LegacyScriptRunner.class);

    private final EventLoop loop;
    private final VirtualMachine vm;
    private final Compiler compiler = new Compiler();
    private final long timeSliceMs;
    private final ProcessReaper reaper;
    private final EngineListener listener;

    public LegacyScriptRunner(EventLoop loop, VirtualMachine vm, long timeSliceMs,
                              ProcessReaper reaper, EngineListener listener) {
        this.loop = loop;
        this.vm = vm;
        this.timeSliceMs = timeSliceMs;
        this.reaper = reaper;
        this.listener = listener;
    }

    /**
     * Prepare the script and schedule its first step.
     *
     * @return false if imports or syntax prevented the start; the process is torn down already
     */
    public boolean start(WorkerScript ws) {
        ImportResult resolved;
        FunctionCode main;
        try {
            resolved = new ImportResolver(filename -> ws.getHost().getScript(filename).map(Script::code))
                    .resolve(ws.getCode());
        } catch (ImportResolutionException e) {
            return failToStart(ws, "Error processing Imports in " + ws.getName() + ":\n" + e.getMessage());
        } catch (ScriptSyntaxException e) {
            return failToStart(ws, "Syntax ERROR in " + ws.getName() + ":\n" + e.getMessage());
        }
        try {
            main = compiler.compile(resolved.code());
        } catch (ScriptSyntaxException e) {
            return failToStart(ws, "Syntax ERROR in " + ws.getName() + ":\n" + e.getMessage());
        }

        VmState state = vm.load(main, globalsFor(ws));
        Stepper stepper = new Stepper(ws, state, resolved.lineOffset());
        loop.execute(stepper::tick);
        log.debug("Process {} ({}) compiled: {} instructions, line offset {}",
                ws.getPid(), ws.getName(), main.size(), resolved.lineOffset());
        return true;
    }

    private boolean failToStart(WorkerScript ws, String message) {
        log.warn("Process {} failed to start: {}", ws.getPid(), message);
        listener.onUserMessage(message);
        ws.getEnv().requestStop();
        reaper.teardown(ws, ExitStatus.FAILED_TO_START);
        return false;
    }

    private Scope globalsFor(WorkerScript ws) {
        Scope globals = new Scope(null);
        for (Binding binding : ws.getEnv().bindings()) {
            globals.define(binding.name(), new BoundFunction(ws, binding));
        }
        globals.define("args", GuestValues.toGuest(ws.getArgs()));
        return globals;
    }

    /**
     * Drives one process.
     */
    private final class Stepper {

        private final WorkerScript ws;
        private final VmState state;
        private final int lineOffset;

        Stepper(WorkerScript ws, VmState state, int lineOffset) {
            this.ws = ws;
            this.state = state;
            this.lineOffset = lineOffset;
        }

        void tick() {
            if (ws.getEnv().isStopRequested()) {
                ws.fail(new ProcessFailure.AlreadyTerminated(ws));
                return;
            }

            boolean more;
            try {
                more = vm.step(state);
            } catch (ScriptKilledException e) {
                ws.fail(new ProcessFailure.AlreadyTerminated(ws));
                return;
            } catch (ScriptRuntimeException e) {
                ws.fail(new ProcessFailure.RuntimeError(errorMessage(e.getMessage(), e.getLine())));
                return;
            } catch (RuntimeException e) {
                ws.fail(new ProcessFailure.RuntimeError(errorMessage(e.toString(), state.currentLine())));
                return;
            } catch (Error e) {
                ws.fail(new ProcessFailure.NativeFault(e));
                return;
            }

            if (!more) {
                ws.finish();
            } else if (state.isSuspended()) {
                state.getPending().whenComplete((value, error) -> loop.execute(this::tick));
            } else {
                loop.schedule(this::tick, timeSliceMs);
            }
        }

        private String errorMessage(String message, int executedLine) {
            if (RuntimeErrorMessage.isValid(message)) {
                return message;
            }
            String text = executedLine > 0
                    ? message + " (line " + (executedLine - lineOffset) + ")"
                    : message;
            return RuntimeErrorMessage.build(ws, text);
        }
    }

    /**
     * A binding exposed to guest code.
     */
    private record BoundFunction(WorkerScript ws, Binding binding) implements NativeFunction {

        @Override
        public String name() {
            return binding.name();
        }

        @Override
        public boolean isAsync() {
            return binding.kind().isAsync();
        }

        @Override
        public Object call(List<Object> args) {
            return binding.function().invoke(ws, args);
        }
    }
}
