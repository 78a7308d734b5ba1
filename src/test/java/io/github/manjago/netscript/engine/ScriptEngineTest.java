package io.github.manjago.netscript.engine;

import io.github.manjago.netscript.api.Binding;
import io.github.manjago.netscript.api.Capability;
import io.github.manjago.netscript.api.FunctionCatalog;
import io.github.manjago.netscript.api.HostFunction;
import io.github.manjago.netscript.api.ModuleRegistry;
import io.github.manjago.netscript.config.EngineConfig;
import io.github.manjago.netscript.host.HostDirectory;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Server;
import io.github.manjago.netscript.loop.VirtualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ScriptEngineTest {

    private VirtualEventLoop loop;
    private Server home;
    private HostDirectory hosts;
    private ModuleRegistry modules;
    private RecordingListener listener;
    private ScriptEngine engine;

    @BeforeEach
    void setUp() {
        loop = new VirtualEventLoop();
        home = new Server("home", "127.0.0.1", 10, true);
        hosts = new HostDirectory().add(home);
        modules = new ModuleRegistry();
        listener = new RecordingListener();
        engine = newEngine(EngineConfig.builder().build(), FunctionCatalog.EMPTY);
    }

    private ScriptEngine newEngine(EngineConfig config, FunctionCatalog catalog) {
        ScriptEngine created = new ScriptEngine(config, loop, hosts, catalog, modules);
        created.setListener(listener);
        return created;
    }

    private int start(String filename, int threads, Object... args) {
        return engine.startProcess(new RunningScript(filename, new ArrayList<>(Arrays.asList(args)), threads), home);
    }

    // ========== Admission ==========

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("Two threads of a 4 GB script reserve 8 GB")
        void reservesThreadCost() {
            home.addScript("big.script", "sleep(100000)", 4);

            int pid = start("big.script", 2);

            assertTrue(pid > 0);
            assertEquals(8, home.getRam().getReserved());
            assertEquals(1, listener.started.size());
        }

        @Test
        @DisplayName("Start that does not fit is rejected and reserves nothing")
        void rejectedWhenFull() {
            home.addScript("big.script", "sleep(100000)", 4);
            start("big.script", 2);

            int pid = start("big.script", 1, "other");

            assertEquals(0, pid);
            assertEquals(8, home.getRam().getReserved());
            assertTrue(listener.messages.get(0).startsWith("Not enough RAM to run script big.script with args [\"other\"]"));
            assertEquals(1, engine.getStats().rejected());
        }

        @Test
        @DisplayName("Script missing from the host is rejected")
        void missingScript() {
            assertEquals(0, start("ghost.script", 1));
            assertEquals(0, engine.getProcesses().size());
        }

        @Test
        @DisplayName("Record that already has a pid is not started again")
        void alreadyStarted() {
            home.addScript("a.script", "sleep(100000)", 1);
            RunningScript rs = new RunningScript("a.script", List.of(), 1);
            assertTrue(engine.startProcess(rs, home) > 0);

            assertEquals(0, engine.startProcess(rs, home));
            assertEquals(1, home.getRam().getReserved());
        }

        @Test
        @DisplayName("Exhausted pid space is reported without reserving RAM")
        void pidsExhausted() {
            engine = newEngine(EngineConfig.builder().maxPid(1).maxPidSearch(1).build(), FunctionCatalog.EMPTY);
            home.addScript("a.script", "sleep(100000)", 1);
            start("a.script", 1);

            assertEquals(0, start("a.script", 1, "second"));

            assertEquals(1, home.getRam().getReserved());
            assertTrue(listener.messages.get(0).startsWith("Failed to start script because could not find available PID"));
        }
    }

    // ========== Legacy scripts ==========

    @Nested
    @DisplayName("Legacy scripts")
    class LegacyScripts {

        @Test
        @DisplayName("Script runs to the end and releases everything")
        void runsToEnd() {
            home.addScript("hello.script", "print('hello ' + args[0])", 2);
            int pid = start("hello.script", 1, "world");

            loop.runUntilIdle();

            WorkerScript ws = listener.exitedByName("hello.script");
            assertEquals(pid, ws.getPid());
            assertEquals(List.of(ExitStatus.FINISHED), listener.statuses);
            assertEquals(List.of("hello world", "Script finished running"), ws.getLogs());
            assertEquals(0, home.getRam().getReserved());
            assertTrue(home.getRunningScripts().isEmpty());
            assertTrue(engine.getProcess(pid).isEmpty());
            assertSame(ws, ws.getCompletion().join());
        }

        @Test
        @DisplayName("Steps are spaced by the time slice")
        void timeSlice() {
            home.addScript("a.script", "var a = 1\nvar b = 2", 1);
            start("a.script", 1);

            loop.runFor(0);
            assertTrue(listener.exited.isEmpty());

            loop.runUntilIdle();
            assertEquals(List.of(ExitStatus.FINISHED), listener.statuses);
            assertTrue(loop.now() >= 100, "at least three steps, 50 ms apart");
        }

        @Test
        @DisplayName("Runtime error crashes the script with its authored line")
        void runtimeError() {
            home.addScript("bad.script", "var a = 1\n\nundefinedFn()", 1);
            start("bad.script", 1);

            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.CRASHED), listener.statuses);
            String message = listener.messages.get(0);
            assertTrue(message.startsWith("RUNTIME ERROR\nbad.script@home\n"));
            assertTrue(message.contains("undefinedFn is not defined (line 3)"));
            assertEquals(0, home.getRam().getReserved());
            assertEquals(1, engine.getStats().crashed());
        }

        @Test
        @DisplayName("Error lines account for imported code")
        void errorLineAfterImports() {
            home.addScript("lib.script", "function twice(x) {\n    return x * 2\n}\n", 0);
            home.addScript("main.script", "import { twice } from 'lib.script'\nvar a = twice(2)\nboom()", 1);
            start("main.script", 1);

            loop.runUntilIdle();

            assertTrue(listener.messages.get(0).contains("(line 3)"), listener.messages.get(0));
        }

        @Test
        @DisplayName("Syntax error fails the start")
        void syntaxError() {
            home.addScript("broken.script", "var = 1", 1);

            assertEquals(0, start("broken.script", 1));

            assertEquals(List.of(ExitStatus.FAILED_TO_START), listener.statuses);
            assertTrue(listener.messages.get(0).startsWith("Syntax ERROR in broken.script"));
            assertEquals(0, home.getRam().getReserved());
            assertTrue(engine.getProcesses().isEmpty());
        }

        @Test
        @DisplayName("Bad import fails the start")
        void importError() {
            home.addScript("main.script", "import { x } from 'missing.script'\nprint(1)", 1);

            assertEquals(0, start("main.script", 1));

            assertTrue(listener.messages.get(0).startsWith("Error processing Imports in main.script"));
            assertEquals(1, engine.getStats().failedToStart());
        }

        @Test
        @DisplayName("exit ends the script as finished")
        void exit() {
            home.addScript("quit.script", "print('a')\nexit()\nprint('b')", 1);
            start("quit.script", 1);

            loop.runUntilIdle();

            WorkerScript ws = listener.exitedByName("quit.script");
            assertEquals(List.of(ExitStatus.FINISHED), listener.statuses);
            assertEquals(List.of("a", "exit: Exiting..."), ws.getLogs());
        }

        @Test
        @DisplayName("tprint goes to the terminal")
        void tprint() {
            home.addScript("t.script", "tprint('hi')", 1);
            start("t.script", 1);

            loop.runUntilIdle();

            assertEquals(List.of("t.script: hi"), listener.terminal);
        }

        @Test
        @DisplayName("Error thrown by a host function is an internal fault")
        void hostFunctionError() {
            engine = newEngine(EngineConfig.builder().build(), ws -> List.of(
                    new Binding(Capability.sync("explode"), (w, args) -> {
                        throw new AssertionError("deep");
                    })));
            home.addScript("x.script", "explode()", 1);
            start("x.script", 1);

            assertDoesNotThrow(() -> {
                loop.runUntilIdle();
            });

            assertEquals(List.of(ExitStatus.CRASHED), listener.statuses);
            assertEquals(List.of(CompletionPipeline.BUG_MESSAGE), listener.messages);
            assertEquals(0, home.getRam().getReserved());
            assertTrue(engine.getProcesses().isEmpty());
        }

        @Test
        @DisplayName("Failing exit listener does not leak the process")
        void exitListenerFails() {
            RecordingListener failing = new RecordingListener() {
                @Override
                public void onExit(WorkerScript ws, ExitStatus status) {
                    throw new IllegalStateException("listener broke");
                }
            };
            engine.setListener(failing);
            home.addScript("bad.script", "boom()", 1);
            start("bad.script", 1);

            assertDoesNotThrow(() -> {
                loop.runUntilIdle();
            });

            assertEquals(0, home.getRam().getReserved());
            assertTrue(home.getRunningScripts().isEmpty());
            assertTrue(engine.getProcesses().isEmpty());
            assertTrue(failing.messages.get(0).contains("boom is not defined"));
        }
    }

    // ========== Killing ==========

    @Nested
    @DisplayName("Killing")
    class Killing {

        @Test
        @DisplayName("Kill cancels a pending sleep")
        void killWhileSleeping() {
            home.addScript("nap.script", "sleep(100000)\nprint('woke')", 2);
            int pid = start("nap.script", 1);
            loop.runFor(500);
            WorkerScript ws = engine.getProcess(pid).orElseThrow();

            assertTrue(engine.kill(pid));
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.KILLED), listener.statuses);
            assertFalse(ws.getLogs().contains("woke"));
            assertTrue(ws.getLogs().contains("Script killed"));
            assertEquals(0, home.getRam().getReserved());
            assertEquals(0, loop.pendingTasks());
            assertFalse(engine.kill(pid));
        }

        @Test
        @DisplayName("Stop flag alone ends a busy script on its next step")
        void stopFlagOnly() {
            home.addScript("spin.script", "var n = 0\nwhile (true) {\n    n++\n}", 1);
            int pid = start("spin.script", 1);
            loop.runFor(500);
            WorkerScript ws = engine.getProcess(pid).orElseThrow();

            ws.getEnv().requestStop();
            long executed = loop.getExecutedCount();
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.KILLED), listener.statuses);
            assertTrue(ws.getLogs().contains("Script killed"));
            assertEquals(0, home.getRam().getReserved());
            assertTrue(engine.getProcesses().isEmpty());
            assertEquals(0, loop.pendingTasks());
            assertEquals(executed + 1, loop.getExecutedCount());
        }

        @Test
        @DisplayName("killAll stops everything and frees all RAM")
        void killAll() {
            home.addScript("a.script", "sleep(100000)", 2);
            start("a.script", 1, "x");
            start("a.script", 1, "y");
            start("a.script", 1, "z");
            assertEquals(6, home.getRam().getReserved());

            assertEquals(3, engine.killAll());
            loop.runUntilIdle();

            assertEquals(0, home.getRam().getReserved());
            assertEquals(3, listener.statuses.stream().filter(s -> s == ExitStatus.KILLED).count());
            assertTrue(engine.getProcesses().isEmpty());
            assertTrue(home.getRunningScripts().isEmpty());
            assertEquals(3, engine.getStats().killed());
        }

        @Test
        @DisplayName("Script kills another by pid")
        void killFromScript() {
            home.addScript("victim.script", "sleep(100000)", 1);
            home.addScript("killer.script", "kill(1)", 1);
            start("victim.script", 1);
            start("killer.script", 1);

            loop.runUntilIdle();

            assertEquals(ExitStatus.KILLED, listener.exitedByName("victim.script").getExitStatus());
            assertTrue(listener.exitedByName("killer.script").getLogs().contains("kill: Killing process 1"));
        }

        @Test
        @DisplayName("Reset empties ports and restarts pids")
        void reset() {
            home.addScript("a.script", "sleep(100000)", 1);
            start("a.script", 1);
            start("a.script", 1, "b");
            engine.getContext().getPorts().get(1).write("x");

            engine.reset();

            assertTrue(engine.getContext().getPorts().get(1).isEmpty());
            assertEquals(1, start("a.script", 1));
        }
    }

    // ========== Nested starts ==========

    @Nested
    @DisplayName("Nested starts")
    class NestedStarts {

        private WorkerScript caller;

        @BeforeEach
        void startCaller() {
            home.addScript("main.script", "sleep(100000)", 2);
            home.addScript("worker.script", "print(args[0])", 4);
            caller = engine.getProcess(start("main.script", 1)).orElseThrow();
        }

        @Test
        @DisplayName("Thread count that does not fit is rejected")
        void tooManyThreads() {
            int pid = engine.startNestedProcess(caller, home, "worker.script", List.of("x"), 3);

            assertEquals(0, pid);
            assertEquals(2, home.getRam().getReserved());
            assertTrue(caller.getLogs().get(caller.getLogs().size() - 1).contains("not enough available RAM"));
        }

        @Test
        @DisplayName("Null argument is rejected")
        void nullArgument() {
            int pid = engine.startNestedProcess(caller, home, "worker.script", Arrays.asList("x", null));

            assertEquals(0, pid);
            assertTrue(caller.getLogs().contains("run: Cannot execute a script with null/undefined as an argument"));
        }

        @Test
        @DisplayName("Script already running with the same args is rejected")
        void duplicate() {
            assertTrue(engine.startNestedProcess(caller, home, "worker.script", List.of("x")) > 0);
            assertEquals(0, engine.startNestedProcess(caller, home, "worker.script", List.of("x")));
            assertTrue(caller.getLogs().get(caller.getLogs().size() - 1).contains("is already running"));
        }

        @Test
        @DisplayName("Invalid argument types are rejected")
        void invalidTypes() {
            assertEquals(0, engine.startNestedProcess(caller, home, 42, List.of(), 1));
            assertEquals(0, engine.startNestedProcess(caller, home, "worker.script", "not a list", 1));
            assertEquals(0, engine.startNestedProcess(caller, home, "worker.script", List.of(), 0));
        }

        @Test
        @DisplayName("No root access is rejected")
        void noAdmin() {
            Server other = new Server("n00dles", "1.2.3.4", 64, false);
            other.addScript("worker.script", "print(1)", 1);

            assertEquals(0, engine.startNestedProcess(caller, other, "worker.script", List.of()));
            assertTrue(caller.getLogs().get(caller.getLogs().size() - 1).contains("root access"));
        }

        @Test
        @DisplayName("Child started from a script runs with its arguments")
        void runFromScript() {
            home.addScript("spawner.script", "var pid = run('worker.script', 1, 'hi')\nprint(pid)", 1);

            start("spawner.script", 1);
            loop.runUntilIdle();

            WorkerScript worker = listener.exitedByName("worker.script");
            WorkerScript spawner = listener.exitedByName("spawner.script");
            assertEquals(List.of("hi"), worker.getArgs());
            assertTrue(worker.getLogs().contains("hi"));
            assertEquals(spawner.getPid(), worker.getParentPid());
            assertTrue(spawner.getLogs().contains(String.valueOf(worker.getPid())));
        }
    }

    // ========== Ports ==========

    @Nested
    @DisplayName("Ports")
    class Ports {

        @Test
        @DisplayName("Scripts exchange data through a port")
        void exchange() {
            home.addScript("writer.script", "writePort(1, 'ping')", 1);
            home.addScript("reader.script", "sleep(1000)\nprint(readPort(1))\nprint(readPort(1))", 1);
            start("reader.script", 1);
            start("writer.script", 1);

            loop.runUntilIdle();

            List<String> logs = listener.exitedByName("reader.script").getLogs();
            assertEquals(List.of("sleep: Sleeping for 1000 milliseconds", "ping", "NULL PORT DATA"), logs.subList(0, 3));
        }

        @Test
        @DisplayName("Invalid port number crashes the script")
        void invalidPort() {
            home.addScript("p.script", "writePort(99, 1)", 1);
            start("p.script", 1);

            loop.runUntilIdle();

            assertTrue(listener.messages.get(0).contains("Invalid port number 99"));
        }
    }

    // ========== Native scripts ==========

    @Nested
    @DisplayName("Native scripts")
    class NativeScripts {

        @BeforeEach
        void withHackFunction() {
            FunctionCatalog catalog = ws -> List.of(new Binding(Capability.async("hack"), (w, args) -> {
                CompletableFuture<Object> result = new CompletableFuture<>();
                loop.schedule(() -> result.complete(5.0), 100);
                return result;
            }));
            engine = newEngine(EngineConfig.builder().build(), catalog);
        }

        @Test
        @DisplayName("Awaited calls complete normally")
        void awaited() {
            List<Object> results = new ArrayList<>();
            modules.register("n.js", ns -> ns.callAsync("hack")
                    .thenCompose(first -> {
                        results.add(first);
                        return ns.callAsync("hack");
                    })
                    .thenAccept(results::add));
            home.addScript("n.js", "", 1);

            start("n.js", 1);
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.FINISHED), listener.statuses);
            assertEquals(List.of(5.0, 5.0), results);
            assertTrue(modules.isLoaded("n.js"));
        }

        @Test
        @DisplayName("Unawaited second call crashes the process")
        void concurrentCall() {
            modules.register("n.js", ns -> {
                ns.call("hack");
                try {
                    ns.call("hack");
                } catch (RuntimeException swallowed) {
                    // The process fails even if the script carries on
                }
                return null;
            });
            home.addScript("n.js", "", 1);

            start("n.js", 1);
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.CRASHED), listener.statuses);
            assertTrue(listener.messages.get(0).contains("Concurrent calls to Netscript functions not allowed!"));
            assertEquals(0, home.getRam().getReserved());
        }

        @Test
        @DisplayName("Sleep may overlap an outstanding call")
        void sleepOverlaps() {
            modules.register("n.js", ns -> {
                CompletableFuture<Object> hack = ns.callAsync("hack");
                return ns.sleep(10).thenCompose(v -> hack);
            });
            home.addScript("n.js", "", 1);

            start("n.js", 1);
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.FINISHED), listener.statuses);
        }

        @Test
        @DisplayName("Thrown exception becomes a runtime error with a stack")
        void thrownException() {
            modules.register("n.js", ns -> {
                throw new IllegalStateException("kaput");
            });
            home.addScript("n.js", "", 1);

            start("n.js", 1);
            loop.runUntilIdle();

            WorkerScript ws = listener.exitedByName("n.js");
            assertEquals(ExitStatus.CRASHED, ws.getExitStatus());
            assertTrue(ws.getErrorMessage().startsWith("RUNTIME ERROR|home|n.js|kaput\nstack:\n"));
        }

        @Test
        @DisplayName("Killing a sleeping native script stops it")
        void killSleeping() {
            List<String> reached = new ArrayList<>();
            modules.register("n.js", ns -> ns.sleep(100000).thenRun(() -> reached.add("after")));
            home.addScript("n.js", "", 1);

            int pid = start("n.js", 1);
            loop.runFor(10);
            engine.kill(pid);
            loop.runUntilIdle();

            assertTrue(reached.isEmpty());
            assertEquals(List.of(ExitStatus.KILLED), listener.statuses);
        }

        @Test
        @DisplayName("Missing module is an internal fault")
        void missingModule() {
            home.addScript("ghost.js", "", 1);

            start("ghost.js", 1);
            loop.runUntilIdle();

            assertEquals(List.of(CompletionPipeline.BUG_MESSAGE), listener.messages);
            assertEquals(0, home.getRam().getReserved());
        }

        @Test
        @DisplayName("Error thrown by the module is an internal fault")
        void moduleError() {
            modules.register("n.js", ns -> {
                throw new StackOverflowError("deep");
            });
            home.addScript("n.js", "", 1);

            start("n.js", 1);
            assertDoesNotThrow(() -> {
                loop.runUntilIdle();
            });

            assertEquals(List.of(ExitStatus.CRASHED), listener.statuses);
            assertEquals(List.of(CompletionPipeline.BUG_MESSAGE), listener.messages);
            assertEquals(0, home.getRam().getReserved());
            assertTrue(engine.getProcesses().isEmpty());
        }

        @Test
        @DisplayName("Functions read from the environment are serialized too")
        void environmentBindingsSerialized() {
            modules.register("n.js", ns -> ns.sleep(100000));
            home.addScript("n.js", "", 1);

            int pid = start("n.js", 1);
            loop.runFor(10);
            WorkerScript ws = engine.getProcess(pid).orElseThrow();
            HostFunction hack = ws.getEnv().get("hack").orElseThrow().function();

            hack.invoke(ws, List.of());
            assertThrows(CallSerializer.ConcurrentCallException.class, () -> hack.invoke(ws, List.of()));
            loop.runUntilIdle();

            assertEquals(List.of(ExitStatus.CRASHED), listener.statuses);
            assertTrue(listener.messages.get(0).contains("Concurrent calls to Netscript functions not allowed!"));
            assertEquals(0, home.getRam().getReserved());
        }
    }

    // ========== Time and persistence ==========

    @Nested
    @DisplayName("Time and rehydration")
    class TimeAndRehydration {

        @Test
        @DisplayName("Online time grows by cycles times idle speed")
        void onlineTime() {
            home.addScript("a.script", "sleep(100000)", 1);
            int pid = start("a.script", 1);

            engine.updateOnlineScriptTimes(5);

            assertEquals(1.0, engine.getProcess(pid).orElseThrow().getScriptRef().getOnlineRunningTime(), 1e-9);
        }

        @Test
        @DisplayName("Persisted records are restarted with offline production")
        void rehydrate() {
            home.addScript("a.script", "sleep(100000)", 4);
            home.getRam().reserve(7);
            home.addRunningScript(new RunningScript("a.script", List.of("one"), 1));
            home.addRunningScript(new RunningScript("a.script", List.of("two"), 1));
            home.addRunningScript(new RunningScript("a.script", List.of("three"), 1));
            List<String> produced = new ArrayList<>();
            engine.setOfflineProduction((rs, host) -> produced.add((String) rs.getArgs().get(0)));

            int started = engine.rehydrateFromPersisted(List.of(home));

            assertEquals(2, started);
            assertEquals(List.of("one", "two"), produced);
            assertEquals(8, home.getRam().getReserved());
            assertEquals(2, home.getRunningScripts().size());
        }

        @Test
        @DisplayName("Skipping script load clears the records")
        void skipLoad() {
            engine = newEngine(EngineConfig.builder().skipScriptLoad(true).build(), FunctionCatalog.EMPTY);
            home.addScript("a.script", "sleep(100000)", 1);
            home.addRunningScript(new RunningScript("a.script", List.of(), 1));

            assertEquals(0, engine.rehydrateFromPersisted(List.of(home)));
            assertTrue(home.getRunningScripts().isEmpty());
            assertTrue(engine.getProcesses().isEmpty());
        }

        @Test
        @DisplayName("Rehydration invalidates loaded modules")
        void invalidatesModules() {
            modules.register("n.js", ns -> ns.sleep(100000));
            home.addScript("n.js", "", 1);
            start("n.js", 1);
            loop.runFor(10);
            engine.killAll();

            engine.rehydrateFromPersisted(List.of(home));

            assertEquals(1, modules.getInvalidations());
        }
    }
}
