package com.webtestool.core.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.webtestool.core.error.CacheException;
import com.webtestool.core.util.TickClock;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/** RemoteCacheClient 위의 계층. 값은 디스크와 같은 JSON envelope 로 저장한다. */
public final class RemoteCache<V> implements CacheTier<V> {
    static final String TIER = "remote";
    static final String PREFIX = "wt:";

    private final RemoteCacheClient client;
    private final JavaType envelopeType;
    private final TickClock clock;

    public RemoteCache(RemoteCacheClient client, Class<V> valueType, TickClock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.envelopeType = CacheJson.envelopeOf(valueType);
        this.clock = clock;
    }

    @Override public String name() { return TIER; }

    @Override public Optional<CacheEntry<V>> read(String key) throws CacheException {
        try {
            String json = client.get(PREFIX + key);
            if (json == null) return Optional.empty();
            CacheEnvelope<V> env = CacheJson.MAPPER.readValue(json, envelopeType);
            if (env == null || !key.equals(env.key)) return Optional.empty();
            CacheEntry<V> e = env.toEntry();
            if (e.isExpired(clock.nowMillis())) {
                client.del(PREFIX + key);
                return Optional.empty();
            }
            return Optional.of(e);
        } catch (IOException e) {
            throw new CacheException(TIER, "get failed", e);
        }
    }

    @Override public void write(String key, CacheEntry<V> entry) throws CacheException {
        long ttlSec = Math.max(1, (entry.remainingMillis(clock.nowMillis()) + 999) / 1000);
        try {
            client.setex(PREFIX + key, ttlSec, CacheJson.MAPPER.writeValueAsString(new CacheEnvelope<>(key, entry)));
        } catch (IOException e) {
            throw new CacheException(TIER, "setex failed", e);
        }
    }

    @Override public void remove(String key) throws CacheException {
        try {
            client.del(PREFIX + key);
        } catch (IOException e) {
            throw new CacheException(TIER, "del failed", e);
        }
    }

    @Override public void clear() throws CacheException {
        try {
            client.delByPrefix(PREFIX);
        } catch (IOException e) {
            throw new CacheException(TIER, "clear failed", e);
        }
    }
}
