package com.webtestool.core.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.webtestool.core.error.CacheException;
import com.webtestool.core.util.TickClock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * 키마다 JSON 파일 하나(파일명 = sha256(key).json).
 * 쓰기는 임시 파일 → rename 으로 교체하므로 읽는 쪽은 이전 값 또는 새 값만 본다.
 */
public final class DiskCache<V> implements CacheTier<V> {
    static final String TIER = "disk";
    private static final String EXT = ".json";

    private final Path dir;
    private final JavaType envelopeType;
    private final TickClock clock;

    public DiskCache(Path dir, Class<V> valueType, TickClock clock) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.envelopeType = CacheJson.envelopeOf(Objects.requireNonNull(valueType, "valueType"));
        this.clock = clock;
    }

    @Override public String name() { return TIER; }

    private Path fileOf(String key) {
        return dir.resolve(CacheKeys.sha256Hex(key) + EXT);
    }

    @Override public Optional<CacheEntry<V>> read(String key) throws CacheException {
        Path f = fileOf(key);
        try {
            String json = Files.readString(f, StandardCharsets.UTF_8);
            CacheEnvelope<V> env = CacheJson.MAPPER.readValue(json, envelopeType);
            if (env == null || !key.equals(env.key)) return Optional.empty();
            CacheEntry<V> e = env.toEntry();
            if (e.isExpired(clock.nowMillis())) {
                Files.deleteIfExists(f);
                return Optional.empty();
            }
            return Optional.of(e);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheException(TIER, "read failed: " + f.getFileName(), e);
        }
    }

    @Override public void write(String key, CacheEntry<V> entry) throws CacheException {
        Path f = fileOf(key);
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "wt-", ".tmp");
            Files.writeString(tmp, CacheJson.MAPPER.writeValueAsString(new CacheEnvelope<>(key, entry)),
                    StandardCharsets.UTF_8);
            try {
                Files.move(tmp, f, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, f, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CacheException(TIER, "write failed: " + f.getFileName(), e);
        }
    }

    @Override public void remove(String key) throws CacheException {
        try {
            Files.deleteIfExists(fileOf(key));
        } catch (IOException e) {
            throw new CacheException(TIER, "delete failed", e);
        }
    }

    @Override public void clear() throws CacheException {
        if (!Files.isDirectory(dir)) return;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + EXT)) {
            for (Path p : ds) Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new CacheException(TIER, "clear failed: " + dir, e);
        }
    }
}
