package com.vbwd.plugin.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.core.store.PluginConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Flat-file store: all rows in one JSON document, rewritten through a temporary file and an atomic move
 * on every change. Suited to single-process hosts; the file is re-read on every call so manual edits
 * between restarts are picked up.
 * <pre>
 * {"version":1,"plugins":[{"plugin_name":"mock_payment","status":"enabled","config":{...},
 *   "enabled_at":1718000000000,"disabled_at":null,"updated_at":1718000000000}]}
 * </pre>
 * A malformed row is logged and skipped; an unreadable document fails with {@link PluginPersistenceException}.
 */
public final class JsonFilePluginConfigStore implements PluginConfigStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePluginConfigStore.class);
    private static final int FORMAT_VERSION = 1;
    private static final String FIELD_VERSION = "version";
    private static final String FIELD_PLUGINS = "plugins";

    private final Path file;
    private final Clock clock;
    private final PersistedPluginConfigCodec codec;

    public JsonFilePluginConfigStore(Path file) {
        this(file, Clock.systemUTC(), new PersistedPluginConfigCodec());
    }

    public JsonFilePluginConfigStore(Path file, Clock clock, PersistedPluginConfigCodec codec) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(status, "status");
        TreeMap<String, PersistedPluginConfig> rows = read(pluginName);
        PersistedPluginConfig existing = rows.get(pluginName);
        PersistedPluginConfig row = existing == null
                ? PersistedPluginConfig.created(pluginName, status, config, clock.instant())
                : existing.updated(status, config, clock.instant());
        rows.put(pluginName, row);
        write(pluginName, rows);
        log.debug("Saved plugin state {}={} to {}", pluginName, status.getWireValue(), file);
    }

    @Override
    public synchronized List<PersistedPluginConfig> loadEnabled() {
        List<PersistedPluginConfig> out = new ArrayList<>();
        for (PersistedPluginConfig row : read(null).values()) {
            if (row.isEnabled()) out.add(row);
        }
        return out;
    }

    @Override
    public synchronized Optional<PersistedPluginConfig> find(String pluginName) {
        if (pluginName == null) return Optional.empty();
        return Optional.ofNullable(read(pluginName).get(pluginName));
    }

    @Override
    public synchronized List<PersistedPluginConfig> loadAll() {
        return new ArrayList<>(read(null).values());
    }

    @Override
    public synchronized boolean delete(String pluginName) {
        if (pluginName == null) return false;
        TreeMap<String, PersistedPluginConfig> rows = read(pluginName);
        if (rows.remove(pluginName) == null) {
            return false;
        }
        write(pluginName, rows);
        log.info("Deleted persisted state of plugin {} from {}", pluginName, file);
        return true;
    }

    private TreeMap<String, PersistedPluginConfig> read(String pluginName) {
        TreeMap<String, PersistedPluginConfig> rows = new TreeMap<>();
        if (!Files.exists(file)) {
            return rows;
        }
        JsonNode root;
        try {
            root = codec.getMapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new PluginPersistenceException(pluginName, "Failed to read plugin state file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return rows;
        }
        JsonNode plugins = root.path(FIELD_PLUGINS);
        if (!plugins.isArray()) {
            throw new PluginPersistenceException(pluginName, "Plugin state file " + file + " has no '" + FIELD_PLUGINS + "' array", null);
        }
        for (JsonNode node : plugins) {
            try {
                PersistedPluginConfig row = codec.fromNode(node);
                rows.put(row.pluginName(), row);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed row in plugin state file {}: {}", file, e.getMessage());
            }
        }
        return rows;
    }

    private void write(String pluginName, TreeMap<String, PersistedPluginConfig> rows) {
        ObjectNode root = codec.getMapper().createObjectNode();
        root.put(FIELD_VERSION, FORMAT_VERSION);
        ArrayNode plugins = root.putArray(FIELD_PLUGINS);
        for (PersistedPluginConfig row : rows.values()) {
            plugins.add(codec.toNode(row));
        }
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            codec.getMapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}; replacing in place", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new PluginPersistenceException(pluginName, "Failed to write plugin state file " + file + ": " + e.getMessage(), e);
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Failed to delete temporary state file {}: {}", tmp, e.getMessage());
        }
    }
}
