package io.github.manjago.netscript.integration;

import io.github.manjago.netscript.api.FunctionCatalog;
import io.github.manjago.netscript.api.ModuleRegistry;
import io.github.manjago.netscript.config.EngineConfig;
import io.github.manjago.netscript.engine.EngineListener;
import io.github.manjago.netscript.engine.ExitStatus;
import io.github.manjago.netscript.engine.ScriptEngine;
import io.github.manjago.netscript.engine.WorkerScript;
import io.github.manjago.netscript.host.HostDirectory;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Server;
import io.github.manjago.netscript.loop.VirtualEventLoop;
import io.github.manjago.netscript.persistence.RunningScriptStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke tests for running scripts end to end and restarting them from a
 * saved state.
 */
@DisplayName("Smoke Tests")
class SmokeTest {

    @TempDir
    Path tempDir;

    private final List<WorkerScript> exited = new ArrayList<>();

    private static String resource(String name) throws IOException {
        try (InputStream is = SmokeTest.class.getResourceAsStream("/scripts/" + name)) {
            assertNotNull(is, name + " should be in test resources");
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Helper: home server holding every test script.
     */
    private static Server createHome() throws IOException {
        Server home = new Server("home", "127.0.0.1", 32, true);
        home.addScript("farm.script", resource("farm.script"), 2.5);
        home.addScript("lib.script", resource("lib.script"), 1.6);
        home.addScript("idle.script", resource("idle.script"), 1.6);
        return home;
    }

    private ScriptEngine createEngine(VirtualEventLoop loop, Server home) {
        ScriptEngine engine = new ScriptEngine(EngineConfig.builder().build(), loop,
                new HostDirectory().add(home), FunctionCatalog.EMPTY, new ModuleRegistry());
        engine.setListener(new EngineListener() {
            @Override
            public void onExit(WorkerScript ws, ExitStatus status) {
                exited.add(ws);
            }
        });
        return engine;
    }

    @Test
    @DisplayName("Script with imports runs to completion")
    void runToCompletion() throws Exception {
        VirtualEventLoop loop = new VirtualEventLoop();
        Server home = createHome();
        ScriptEngine engine = createEngine(loop, home);

        int pid = engine.startProcess(new RunningScript("farm.script", List.of(3.0), 1), home);
        assertTrue(pid > 0);
        loop.runUntilIdle();

        assertEquals(1, exited.size());
        WorkerScript ws = exited.get(0);
        assertEquals(ExitStatus.FINISHED, ws.getExitStatus());
        assertTrue(ws.getLogs().contains("total 6"), ws.getLogs().toString());
        assertTrue(loop.now() >= 300, "three sleeps of 100 ms");
        assertEquals(0, home.getRam().getReserved());
        assertEquals(1, engine.getStats().finished());
    }

    @Test
    @DisplayName("Saved processes restart after a load")
    void saveAndRehydrate() throws Exception {
        Path stateFile = tempDir.resolve("state.mv");

        // Run and save
        VirtualEventLoop loop1 = new VirtualEventLoop();
        Server home1 = createHome();
        ScriptEngine engine1 = createEngine(loop1, home1);
        engine1.startProcess(new RunningScript("idle.script", List.of(), 2), home1);
        engine1.startProcess(new RunningScript("farm.script", List.of(1000.0), 1), home1);
        loop1.runFor(5_000);
        engine1.updateOnlineScriptTimes(10);
        assertEquals(5.7, home1.getRam().getReserved(), 1e-9);

        RunningScriptStore.save(List.of(home1), stateFile);
        engine1.killAll();
        assertTrue(RunningScriptStore.isValidState(stateFile));

        // Load into a fresh engine
        List<Server> loaded = RunningScriptStore.load(stateFile);
        Server home2 = loaded.get(0);
        VirtualEventLoop loop2 = new VirtualEventLoop();
        ScriptEngine engine2 = createEngine(loop2, home2);

        assertEquals(2, engine2.rehydrateFromPersisted(loaded));
        assertEquals(5.7, home2.getRam().getReserved(), 1e-9);
        assertEquals(2, engine2.getProcesses().size());

        WorkerScript idle = engine2.getProcesses().stream()
                .filter(ws -> ws.getName().equals("idle.script")).findFirst().orElseThrow();
        assertEquals(2, idle.getScriptRef().getThreads());
        assertEquals(2.0, idle.getScriptRef().getOnlineRunningTime(), 1e-9);

        loop2.runFor(1_000);
        assertTrue(engine2.getProcesses().stream().allMatch(WorkerScript::isRunning));

        assertEquals(2, engine2.killAll());
        assertEquals(0, home2.getRam().getReserved());
    }

    @Test
    @DisplayName("Unlisted import function fails the start")
    void badImportFailsStart() throws Exception {
        VirtualEventLoop loop = new VirtualEventLoop();
        Server home = createHome();
        home.addScript("broken.script", "import { missing } from 'lib.script'\nprint(1)", 1);
        ScriptEngine engine = createEngine(loop, home);

        assertEquals(0, engine.startProcess(new RunningScript("broken.script", List.of(), 1), home));
        loop.runUntilIdle();

        assertEquals(ExitStatus.FAILED_TO_START, exited.get(0).getExitStatus());
        assertEquals(0, home.getRam().getReserved());
    }
}
