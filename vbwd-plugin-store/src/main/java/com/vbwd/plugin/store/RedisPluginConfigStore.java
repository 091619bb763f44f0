package com.vbwd.plugin.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.vbwd.config.VbwdConfig;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.core.store.PluginConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Redis-backed {@link PluginConfigStore}. Each row is one JSON string at {@code <prefix>:<pluginName>};
 * the set {@code <prefix>:index} lists the stored plugin names. Value and index are written in one
 * MULTI/EXEC transaction.
 */
public final class RedisPluginConfigStore implements PluginConfigStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisPluginConfigStore.class);
    static final String INDEX_SUFFIX = "index";

    private final JedisPool pool;
    private final String keyPrefix;
    private final Clock clock;
    private final PersistedPluginConfigCodec codec;

    public RedisPluginConfigStore(VbwdConfig config) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort()),
                config.getPluginKeyPrefix(), Clock.systemUTC(), new PersistedPluginConfigCodec());
        log.debug("RedisPluginConfigStore connected to {}:{} prefix={}", config.getCacheHost(), config.getCachePort(), keyPrefix);
    }

    public RedisPluginConfigStore(JedisPool pool, String keyPrefix, Clock clock, PersistedPluginConfigCodec codec) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /** Key holding the row of the plugin. */
    public String keyFor(String pluginName) {
        return keyPrefix + ":" + pluginName;
    }

    /** Key of the set of stored plugin names. */
    public String indexKey() {
        return keyPrefix + ":" + INDEX_SUFFIX;
    }

    /** Verifies the connection; used by the host before trusting this store. */
    public void ping() {
        try (Jedis jedis = pool.getResource()) {
            jedis.ping();
        } catch (JedisException e) {
            throw new PluginPersistenceException(null, "Redis plugin store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(status, "status");
        try (Jedis jedis = pool.getResource()) {
            PersistedPluginConfig existing = parse(pluginName, jedis.get(keyFor(pluginName)));
            PersistedPluginConfig row = existing != null
                    ? existing.updated(status, config, clock.instant())
                    : PersistedPluginConfig.created(pluginName, status, config, clock.instant());
            String json = codec.toJson(row);
            Transaction tx = jedis.multi();
            tx.set(keyFor(pluginName), json);
            tx.sadd(indexKey(), pluginName);
            tx.exec();
            log.debug("Saved plugin state {}={} to Redis key={}", pluginName, status.getWireValue(), keyFor(pluginName));
        } catch (JedisException | JsonProcessingException e) {
            throw new PluginPersistenceException(pluginName, "Failed to save state of plugin '" + pluginName + "' to Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PersistedPluginConfig> loadEnabled() {
        List<PersistedPluginConfig> out = new ArrayList<>();
        for (PersistedPluginConfig row : loadAll()) {
            if (row.isEnabled()) out.add(row);
        }
        return out;
    }

    @Override
    public Optional<PersistedPluginConfig> find(String pluginName) {
        if (pluginName == null) return Optional.empty();
        try (Jedis jedis = pool.getResource()) {
            return Optional.ofNullable(parse(pluginName, jedis.get(keyFor(pluginName))));
        } catch (JedisException e) {
            throw new PluginPersistenceException(pluginName, "Failed to read state of plugin '" + pluginName + "' from Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PersistedPluginConfig> loadAll() {
        try (Jedis jedis = pool.getResource()) {
            List<String> names = new ArrayList<>(new TreeSet<>(jedis.smembers(indexKey())));
            if (names.isEmpty()) {
                return List.of();
            }
            String[] keys = new String[names.size()];
            for (int i = 0; i < keys.length; i++) {
                keys[i] = keyFor(names.get(i));
            }
            List<String> values = jedis.mget(keys);
            List<PersistedPluginConfig> out = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                PersistedPluginConfig row = parse(names.get(i), values.get(i));
                if (row != null) out.add(row);
            }
            return out;
        } catch (JedisException e) {
            throw new PluginPersistenceException(null, "Failed to load plugin state from Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String pluginName) {
        if (pluginName == null) return false;
        try (Jedis jedis = pool.getResource()) {
            Transaction tx = jedis.multi();
            tx.del(keyFor(pluginName));
            tx.srem(indexKey(), pluginName);
            List<Object> results = tx.exec();
            boolean deleted = results != null && !results.isEmpty() && results.get(0) instanceof Long n && n > 0;
            if (deleted) {
                log.info("Deleted persisted state of plugin {} from Redis", pluginName);
            }
            return deleted;
        } catch (JedisException e) {
            throw new PluginPersistenceException(pluginName, "Failed to delete state of plugin '" + pluginName + "' from Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }

    /** Parses a stored value; missing values give null and unreadable ones are logged and give null. */
    private PersistedPluginConfig parse(String pluginName, String json) {
        if (json == null) {
            return null;
        }
        try {
            return codec.fromJson(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable Redis plugin state {}: {}", keyFor(pluginName), e.getMessage());
            return null;
        }
    }
}
