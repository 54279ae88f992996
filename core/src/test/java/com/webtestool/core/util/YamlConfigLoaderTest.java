package com.webtestool.core.util;

import com.webtestool.core.model.CacheBackend;
import com.webtestool.core.model.ExecutionMode;
import com.webtestool.core.model.RateLimitStrategy;
import com.webtestool.core.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    @Test
    void full_file_maps_every_section() throws Exception {
        Path p = Path.of(getClass().getResource("/config/scan-full.yml").toURI());
        ScanConfig c = YamlConfigLoader.load(p);

        assertEquals("http://localhost:8080/app", c.getTarget());
        assertEquals(3, c.getMaxDepth());
        assertEquals(50, c.getMaxPages());
        assertEquals(Duration.ofMillis(2500), c.getTimeout());

        assertFalse(c.getCrawler().isRespectRobots());
        assertEquals(List.of("api.localhost"), c.getCrawler().getAllowedDomains());
        assertEquals(List.of("/logout", "/admin"), c.getCrawler().getExcludePaths());
        assertFalse(c.getCrawler().isRetainBodies());

        assertEquals(Map.of("X-Env", "test"), c.getSession().getHeaders());
        assertEquals(Map.of("sid", "abc123"), c.getSession().getCookies());
        assertEquals("t0ken", c.getSession().getAuthToken());

        assertEquals(CacheBackend.TIERED, c.getCache().getBackend());
        assertEquals(Duration.ofSeconds(120), c.getCache().getTtl());
        assertEquals(Path.of("target/test-cache"), c.getCache().getDir());

        assertEquals(RateLimitStrategy.SLIDING_WINDOW, c.getRateLimit().getStrategy());
        assertEquals(5, c.getRateLimit().getMaxRequests());
        assertEquals(Duration.ofSeconds(2), c.getRateLimit().getWindow());
        assertEquals(2, c.getRetry().getMaxAttempts());

        assertEquals(List.of("security_headers", "sql_injection"), c.getModules().getNames());
        assertEquals(ExecutionMode.SEQUENTIAL, c.getModules().getExecutionMode());
        assertEquals(Duration.ofSeconds(15), c.getModules().getModuleTimeout());
        assertEquals(1500, c.getModules().settingsFor("sql_injection").get("timeThresholdMs"));
    }

    @Test
    void minimal_yaml_keeps_defaults() {
        ScanConfig c = YamlConfigLoader.parse("target: https://ex.com\n");
        ScanConfig d = ScanConfig.defaults();
        assertEquals(d.getMaxDepth(), c.getMaxDepth());
        assertEquals(d.getMaxPages(), c.getMaxPages());
        assertEquals(d.getCache().getBackend(), c.getCache().getBackend());
        assertEquals("quick", c.getModules().getProfile());
        assertTrue(c.getCrawler().isRespectRobots());
        assertEquals(ScanConfig.DEFAULT_USER_AGENT, c.getUserAgent());
    }

    @Test
    void enum_values_are_forgiving_but_checked() {
        ScanConfig c = YamlConfigLoader.parse("target: https://ex.com\nrateLimit:\n  strategy: Token-Bucket\n");
        assertEquals(RateLimitStrategy.TOKEN_BUCKET, c.getRateLimit().getStrategy());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.parse("target: https://ex.com\nrateLimit:\n  strategy: leaky\n"));
        assertThat(e.getMessage()).contains("strategy").contains("leaky");
    }

    @Test
    void bad_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse("target: https://ex.com\nmaxDepth: deep\n"));
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse("target: https://ex.com\ncache: yes\n"));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.parse("target: https://ex.com\nmodules:\n  settings:\n    seo: 3\n"));
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse("target: ftp://ex.com\n"));
        assertThrows(NullPointerException.class, () -> YamlConfigLoader.parse(""));
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) throws IOException {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(dir.resolve("nope.yml")));

        Path f = dir.resolve("scan.yml");
        Files.writeString(f, "target: \"https://ex.com\"\nmaxPages: 7\n");
        assertEquals(7, YamlConfigLoader.load(f).getMaxPages());
    }
}
