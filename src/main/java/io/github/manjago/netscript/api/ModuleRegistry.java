package io.github.manjago.netscript.api;

import io.github.manjago.netscript.host.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link ModuleLoader}: native scripts registered by file name.
 */
public class ModuleRegistry implements ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final Map<String, NativeScript> modules = new HashMap<>();
    private final Set<String> loaded = new HashSet<>();
    private int invalidations;

    public ModuleRegistry register(String filename, NativeScript script) {
        modules.put(filename, script);
        return this;
    }

    @Override
    public NativeScript load(Script script) {
        NativeScript module = modules.get(script.filename());
        if (module == null) {
            throw new IllegalStateException("No module registered for " + script.filename());
        }
        if (loaded.add(script.filename())) {
            log.debug("Loaded module {}", script.filename());
        }
        return module;
    }

    @Override
    public void invalidate(Script script) {
        if (loaded.remove(script.filename())) {
            invalidations++;
        }
    }

    public boolean isLoaded(String filename) {
        return loaded.contains(filename);
    }

    public int getInvalidations() {
        return invalidations;
    }
}
