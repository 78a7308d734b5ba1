package io.github.manjago.netscript.persistence;

import io.github.manjago.netscript.host.Host;
import io.github.manjago.netscript.host.RunningScript;
import io.github.manjago.netscript.host.Script;
import io.github.manjago.netscript.host.Server;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Saved-game storage of hosts and their running scripts, using H2 MVStore.
 * 
 * Structure:
 * - "meta" map: version, host count, running-script count
 * - "hosts" map: one serialized host per hostname (scripts and running scripts)
 * 
 * Only the durable records are stored. Processes are rebuilt from them by
 * {@code ScriptEngine.rehydrateFromPersisted}.
 */
public class RunningScriptStore {

    private static final Logger log = LoggerFactory.getLogger(RunningScriptStore.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_HOST_COUNT = "host_count";
    private static final String KEY_RUNNING_COUNT = "running_count";

    // Argument type tags
    private static final byte ARG_STRING = 1;
    private static final byte ARG_NUMBER = 2;
    private static final byte ARG_BOOLEAN = 3;

    private RunningScriptStore() {
        // Utility class
    }

    /**
     * Save hosts to an MVStore file, replacing what it held.
     */
    public static void save(Collection<? extends Host> hosts, Path path) throws IOException {
        log.info("Saving {} host(s) to {} (MVStore)", hosts.size(), path);
        long running = 0;

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {

            MVMap<String, byte[]> hostMap = store.openMap("hosts");
            hostMap.clear();
            for (Host host : hosts) {
                hostMap.put(host.getHostname(), serializeHost(host));
                running += host.getRunningScripts().size();
            }

            MVMap<String, Long> meta = store.openMap("meta");
            meta.put(KEY_VERSION, (long) VERSION);
            meta.put(KEY_HOST_COUNT, (long) hosts.size());
            meta.put(KEY_RUNNING_COUNT, running);

            store.commit();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        log.info("Saved {} host(s), {} running script(s)", hosts.size(), running);
    }

    /**
     * Load hosts from an MVStore file.
     *
     * @return hosts in hostname order, running scripts without pids
     * @throws IOException if the file has an unsupported version or is corrupt
     */
    public static List<Server> load(Path path) throws IOException {
        log.info("Loading state from {} (MVStore)", path);

        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported state version: " + version);
            }

            MVMap<String, byte[]> hostMap = store.openMap("hosts");
            List<Server> hosts = new ArrayList<>();
            for (String hostname : hostMap.keySet()) {
                hosts.add(deserializeHost(hostMap.get(hostname)));
            }

            log.info("Loaded {} host(s) (v{})", hosts.size(), version);
            return hosts;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Check if file is a valid state file.
     */
    public static boolean isValidState(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            return version >= 1 && version <= VERSION;
        } catch (Exception e) {
            log.debug("{} is not a valid state file: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Get state file info without a full load.
     */
    public static String getInfo(Path path) {
        try (MVStore store = MVStore.open(path.toString())) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            long hosts = meta.getOrDefault(KEY_HOST_COUNT, 0L);
            long running = meta.getOrDefault(KEY_RUNNING_COUNT, 0L);
            return String.format("State v%d: %d host(s), %d running script(s)", version, hosts, running);
        } catch (Exception e) {
            return "Invalid state file: " + e.getMessage();
        }
    }

    // ========== Private helpers ==========

    private static byte[] serializeHost(Host host) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            out.writeUTF(host.getHostname());
            out.writeUTF(host.getIp() != null ? host.getIp() : "");
            out.writeDouble(host.getRam().getTotal());
            out.writeBoolean(host.hasAdminRights());

            List<Script> scripts = host.getScripts();
            out.writeInt(scripts.size());
            for (Script script : scripts) {
                out.writeUTF(script.filename());
                writeLongString(out, script.code());
                out.writeDouble(script.ramUsage());
            }

            List<RunningScript> running = host.getRunningScripts();
            out.writeInt(running.size());
            for (RunningScript rs : running) {
                out.writeUTF(rs.getFilename());
                out.writeInt(rs.getThreads());
                out.writeDouble(rs.getRamUsage());
                out.writeInt(rs.getArgs().size());
                for (Object arg : rs.getArgs()) {
                    writeArg(out, arg);
                }
                out.writeDouble(rs.getOnlineRunningTime());
                out.writeDouble(rs.getOnlineMoneyMade());
                out.writeDouble(rs.getOnlineExpGained());
                out.writeDouble(rs.getOfflineRunningTime());
                out.writeDouble(rs.getOfflineMoneyMade());
                out.writeDouble(rs.getOfflineExpGained());
            }

            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Server deserializeHost(byte[] data) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(data);
             DataInputStream in = new DataInputStream(bais)) {

            String hostname = in.readUTF();
            String ip = in.readUTF();
            double maxRam = in.readDouble();
            boolean admin = in.readBoolean();
            Server server = new Server(hostname, ip.isEmpty() ? null : ip, maxRam, admin);

            int scriptCount = in.readInt();
            for (int i = 0; i < scriptCount; i++) {
                String filename = in.readUTF();
                String code = readLongString(in);
                double ram = in.readDouble();
                server.addScript(filename, code, ram);
            }

            int runningCount = in.readInt();
            for (int i = 0; i < runningCount; i++) {
                String filename = in.readUTF();
                int threads = in.readInt();
                double ram = in.readDouble();
                int argCount = in.readInt();
                List<Object> args = new ArrayList<>(argCount);
                for (int a = 0; a < argCount; a++) {
                    args.add(readArg(in));
                }
                RunningScript rs = new RunningScript(filename, args, threads);
                rs.setRamUsage(ram);
                rs.setServer(hostname);
                rs.restoreStats(in.readDouble(), in.readDouble(), in.readDouble(),
                        in.readDouble(), in.readDouble(), in.readDouble());
                server.addRunningScript(rs);
            }
            return server;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeArg(DataOutputStream out, Object arg) throws IOException {
        if (arg instanceof Number n) {
            out.writeByte(ARG_NUMBER);
            out.writeDouble(n.doubleValue());
        } else if (arg instanceof Boolean b) {
            out.writeByte(ARG_BOOLEAN);
            out.writeBoolean(b);
        } else {
            out.writeByte(ARG_STRING);
            out.writeUTF(String.valueOf(arg));
        }
    }

    private static Object readArg(DataInputStream in) throws IOException {
        byte tag = in.readByte();
        return switch (tag) {
            case ARG_NUMBER -> in.readDouble();
            case ARG_BOOLEAN -> in.readBoolean();
            case ARG_STRING -> in.readUTF();
            default -> throw new IOException("Unknown argument tag " + tag);
        };
    }

    // writeUTF is limited to 64K, script code is not
    private static void writeLongString(DataOutputStream out, String s) throws IOException {
        byte[] bytes = s.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readLongString(DataInputStream in) throws IOException {
        byte[] bytes = new byte[in.readInt()];
        in.readFully(bytes);
        return new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
    }
}
