package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.api.ModuleLoader;
import io.github.manjago.netscript.api.NativeScript;
import io.github.manjago.netscript.api.NetscriptApi;
import io.github.manjago.netscript.core.ScriptRuntimeException;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Runs native scripts with every host call going through the call serializer.
 */
public final class NativeScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(NativeScriptRunner.class);

    private final EventLoop loop;
    private final ModuleLoader modules;
    private final CallSerializer serializer;

    public NativeScriptRunner(EventLoop loop, ModuleLoader modules, CallSerializer serializer) {
        this.loop = loop;
        this.modules = modules;
        this.serializer = serializer;
    }

    /**
     * Wrap the process's bindings, load the module and schedule the script to start.
     */
    public void start(WorkerScript ws) {
        for (Binding binding : List.copyOf(ws.getEnv().bindings())) {
            ws.getEnv().install(new Binding(binding.capability(), serializer.wrap(binding)));
        }
        Script script = ws.getHost().getScript(ws.getName())
                .orElse(new Script(ws.getName(), ws.getCode(), ws.getScriptRef().getRamUsage()));
        NativeScript module;
        try {
            module = modules.load(script);
        } catch (RuntimeException e) {
            ws.fail(new ProcessFailure.NativeFault(e));
            return;
        }
        loop.execute(() -> run(ws, module));
    }

    private void run(WorkerScript ws, NativeScript module) {
        if (ws.getEnv().isStopRequested()) {
            ws.fail(new ProcessFailure.AlreadyTerminated(ws));
            return;
        }
        CompletionStage<?> stage;
        try {
            stage = module.run(new ProcessApi(ws));
        } catch (Throwable t) {
            settleFailure(ws, t);
            return;
        }
        if (stage == null) {
            ws.finish();
            return;
        }
        stage.whenComplete((value, error) -> loop.execute(() -> {
            if (error == null) {
                ws.finish();
            } else {
                settleFailure(ws, error);
            }
        }));
    }

    /**
     * Decide what an exception escaping the script means.
     */
    void settleFailure(WorkerScript ws, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ScriptKilledException) {
            ws.fail(new ProcessFailure.AlreadyTerminated(ws));
        } else if (cause instanceof ProcessFailedException pfe) {
            ws.fail(pfe.getFailure());
        } else if (RuntimeErrorMessage.isValid(cause.getMessage())) {
            ws.fail(new ProcessFailure.RuntimeError(cause.getMessage()));
        } else if (cause instanceof Exception) {
            ws.fail(new ProcessFailure.RuntimeError(
                    RuntimeErrorMessage.build(ws, cause.getMessage() + "\nstack:\n" + stackTrace(cause))));
        } else {
            ws.fail(new ProcessFailure.NativeFault(cause));
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /**
     * The API one native process sees.
     */
    private final class ProcessApi implements NetscriptApi {

        private final WorkerScript ws;

        ProcessApi(WorkerScript ws) {
            this.ws = ws;
        }

        @Override
        public List<Object> args() {
            return ws.getArgs();
        }

        @Override
        public int pid() {
            return ws.getPid();
        }

        @Override
        public Object call(String name, Object... args) {
            Binding binding = ws.getEnv().get(name)
                    .orElseThrow(() -> new ScriptRuntimeException(name + " is not a function"));
            return binding.function().invoke(ws, Arrays.asList(args));
        }

        @Override
        public CompletableFuture<Object> callAsync(String name, Object... args) {
            Object result = call(name, args);
            if (result instanceof CompletionStage<?> stage) {
                return stage.toCompletableFuture().thenApply(value -> (Object) value);
            }
            log.trace("{} returned synchronously from callAsync", name);
            return CompletableFuture.completedFuture(result);
        }

        @Override
        public CompletableFuture<Object> sleep(long millis) {
            return callAsync("sleep", millis);
        }
    }
}
