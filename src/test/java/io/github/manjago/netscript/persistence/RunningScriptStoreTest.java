package io.github.manjago.netscript.persistence;

import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Server;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Running script store")
class RunningScriptStoreTest {

    @TempDir
    Path tempDir;

    private static Server sampleHome() {
        Server home = new Server("home", "10.0.0.1", 64, true);
        home.addScript("farm.script", "print('farm')\nsleep(1000)", 2.4);
        home.addScript("lib.script", "function grow(x) { return x + 2 }", 1.6);

        RunningScript rs = new RunningScript("farm.script", List.of("n00dles", 3.0, true), 4);
        rs.setRamUsage(2.4);
        rs.restoreStats(12.5, 1000, 40, 3, 250, 10);
        home.addRunningScript(rs);
        return home;
    }

    @Test
    @DisplayName("Hosts, scripts and running scripts survive a save and load")
    void saveAndLoad() throws Exception {
        Path file = tempDir.resolve("state.mv");
        Server other = new Server("n00dles", null, 4, false);

        RunningScriptStore.save(List.of(sampleHome(), other), file);
        List<Server> loaded = RunningScriptStore.load(file);

        assertEquals(2, loaded.size());
        Server home = loaded.stream().filter(s -> s.getHostname().equals("home")).findFirst().orElseThrow();
        Server noodles = loaded.stream().filter(s -> s.getHostname().equals("n00dles")).findFirst().orElseThrow();

        assertEquals("10.0.0.1", home.getIp());
        assertEquals(64, home.getRam().getTotal());
        assertEquals(0, home.getRam().getReserved(), "reservations are rebuilt on rehydration");
        assertTrue(home.hasAdminRights());
        assertEquals("print('farm')\nsleep(1000)", home.getScript("farm.script").orElseThrow().code());
        assertEquals(1.6, home.getScript("lib.script").orElseThrow().ramUsage());

        assertNull(noodles.getIp());
        assertFalse(noodles.hasAdminRights());
        assertTrue(noodles.getRunningScripts().isEmpty());
    }

    @Test
    @DisplayName("Running script keeps its arguments, threads and counters")
    void runningScriptRecord() throws Exception {
        Path file = tempDir.resolve("state.mv");
        RunningScriptStore.save(List.of(sampleHome()), file);

        RunningScript rs = RunningScriptStore.load(file).get(0).getRunningScripts().get(0);

        assertEquals("farm.script", rs.getFilename());
        assertEquals(List.of("n00dles", 3.0, true), rs.getArgs());
        assertEquals(4, rs.getThreads());
        assertEquals(2.4, rs.getRamUsage());
        assertEquals("home", rs.getServer());
        assertFalse(rs.hasPid(), "pids are assigned again at restart");
        assertEquals(12.5, rs.getOnlineRunningTime());
        assertEquals(1000, rs.getOnlineMoneyMade());
        assertEquals(40, rs.getOnlineExpGained());
        assertEquals(3, rs.getOfflineRunningTime());
        assertEquals(250, rs.getOfflineMoneyMade());
        assertEquals(10, rs.getOfflineExpGained());
    }

    @Test
    @DisplayName("Saving again replaces the previous contents")
    void saveReplaces() throws Exception {
        Path file = tempDir.resolve("state.mv");
        RunningScriptStore.save(List.of(sampleHome(), new Server("n00dles", null, 4, false)), file);

        RunningScriptStore.save(List.of(new Server("foodnstuff", null, 16, true)), file);

        List<Server> loaded = RunningScriptStore.load(file);
        assertEquals(1, loaded.size());
        assertEquals("foodnstuff", loaded.get(0).getHostname());
    }

    @Test
    @DisplayName("State info summarizes the file")
    void info() throws Exception {
        Path file = tempDir.resolve("state.mv");
        RunningScriptStore.save(List.of(sampleHome(), new Server("n00dles", null, 4, false)), file);

        assertTrue(RunningScriptStore.isValidState(file));
        assertEquals("State v1: 2 host(s), 1 running script(s)", RunningScriptStore.getInfo(file));
    }

    @Test
    @DisplayName("A file that is not a state file is rejected")
    void notAState() throws Exception {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "this is not an MVStore file");

        assertFalse(RunningScriptStore.isValidState(file));
        assertTrue(RunningScriptStore.getInfo(file).startsWith("Invalid state file"));
    }
}
