package com.webtestool.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 스캔 설정 (scan.yml 매핑 대상).
 * 빌드 중에는 가변. 스캔은 validate() 후 copy().freeze() 한 스냅샷을 모듈에 넘긴다.
 */
public final class ScanConfig {

    public static final String DEFAULT_USER_AGENT = "webtestool/0.3 (+crawler)";

    /** YAML `crawler:` 섹션 */
    public static final class CrawlerCfg {
        private boolean respectRobots = true;
        /** robots.txt 성공 캐시 TTL(분). 실패는 별도(10분) */
        private int robotsTtlMinutes = 30;
        /** 같은 호스트 요청 간 최소 간격(ms). 0 = 제한 없음 */
        private long crawlDelayMs = 0;
        private List<String> allowedDomains = new ArrayList<>();
        /** prefix("/admin"), glob("/static/**"), 정규식("re:...") */
        private List<String> excludePaths = new ArrayList<>();
        /** 비어 있으면 전체 허용 */
        private List<String> includePatterns = new ArrayList<>();
        /** false 면 본문을 메모리에 두지 않고 캐시 경유로 다시 읽는다 */
        private boolean retainBodies = true;

        public boolean isRespectRobots() { return respectRobots; }
        public CrawlerCfg setRespectRobots(boolean v) { mutable(); this.respectRobots = v; return this; }
        public int getRobotsTtlMinutes() { return robotsTtlMinutes; }
        public CrawlerCfg setRobotsTtlMinutes(int v) { mutable(); this.robotsTtlMinutes = v; return this; }
        public long getCrawlDelayMs() { return crawlDelayMs; }
        public CrawlerCfg setCrawlDelayMs(long v) { mutable(); this.crawlDelayMs = v; return this; }
        public List<String> getAllowedDomains() { return allowedDomains; }
        public CrawlerCfg setAllowedDomains(List<String> v) { mutable(); this.allowedDomains = copy(v); return this; }
        public List<String> getExcludePaths() { return excludePaths; }
        public CrawlerCfg setExcludePaths(List<String> v) { mutable(); this.excludePaths = copy(v); return this; }
        public List<String> getIncludePatterns() { return includePatterns; }
        public CrawlerCfg setIncludePatterns(List<String> v) { mutable(); this.includePatterns = copy(v); return this; }
        public boolean isRetainBodies() { return retainBodies; }
        public CrawlerCfg setRetainBodies(boolean v) { mutable(); this.retainBodies = v; return this; }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        CrawlerCfg duplicate() {
            CrawlerCfg c = new CrawlerCfg();
            c.respectRobots = respectRobots;
            c.robotsTtlMinutes = robotsTtlMinutes;
            c.crawlDelayMs = crawlDelayMs;
            c.allowedDomains = copy(allowedDomains);
            c.excludePaths = copy(excludePaths);
            c.includePatterns = copy(includePatterns);
            c.retainBodies = retainBodies;
            return c;
        }

        void freeze() {
            allowedDomains = Collections.unmodifiableList(allowedDomains);
            excludePaths = Collections.unmodifiableList(excludePaths);
            includePatterns = Collections.unmodifiableList(includePatterns);
            frozen = true;
        }
    }

    /** 모든 요청에 붙는 세션 상태 */
    public static final class SessionCfg {
        private Map<String, String> headers = new LinkedHashMap<>();
        private Map<String, String> cookies = new LinkedHashMap<>();
        private String authToken;

        public Map<String, String> getHeaders() { return headers; }
        public SessionCfg setHeaders(Map<String, String> v) { mutable(); this.headers = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v); return this; }
        public Map<String, String> getCookies() { return cookies; }
        public SessionCfg setCookies(Map<String, String> v) { mutable(); this.cookies = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v); return this; }
        public String getAuthToken() { return authToken; }
        public SessionCfg setAuthToken(String v) { mutable(); this.authToken = v; return this; }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        SessionCfg duplicate() {
            SessionCfg c = new SessionCfg();
            c.headers = new LinkedHashMap<>(headers);
            c.cookies = new LinkedHashMap<>(cookies);
            c.authToken = authToken;
            return c;
        }

        void freeze() {
            headers = Collections.unmodifiableMap(headers);
            cookies = Collections.unmodifiableMap(cookies);
            frozen = true;
        }
    }

    public static final class CacheCfg {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private CacheBackend backend = CacheBackend.MEMORY;
        private Path dir = Path.of(".cache");
        private int memoryMaxEntries = 1000;

        public boolean isEnabled() { return enabled; }
        public CacheCfg setEnabled(boolean v) { mutable(); this.enabled = v; return this; }
        public Duration getTtl() { return ttl; }
        public CacheCfg setTtl(Duration v) { mutable(); this.ttl = v; return this; }
        public CacheBackend getBackend() { return backend; }
        public CacheCfg setBackend(CacheBackend v) { mutable(); this.backend = v; return this; }
        public Path getDir() { return dir; }
        public CacheCfg setDir(Path v) { mutable(); this.dir = v; return this; }
        public int getMemoryMaxEntries() { return memoryMaxEntries; }
        public CacheCfg setMemoryMaxEntries(int v) { mutable(); this.memoryMaxEntries = v; return this; }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        CacheCfg duplicate() {
            CacheCfg c = new CacheCfg();
            c.enabled = enabled;
            c.ttl = ttl;
            c.backend = backend;
            c.dir = dir;
            c.memoryMaxEntries = memoryMaxEntries;
            return c;
        }

        void freeze() {
            frozen = true;
        }
    }

    public static final class RateLimitCfg {
        private RateLimitStrategy strategy = RateLimitStrategy.TOKEN_BUCKET;
        private int maxRequests = 10;
        private Duration window = Duration.ofSeconds(1);
        private Duration maxQueueWait = Duration.ofSeconds(5);

        public RateLimitStrategy getStrategy() { return strategy; }
        public RateLimitCfg setStrategy(RateLimitStrategy v) { mutable(); this.strategy = v; return this; }
        public int getMaxRequests() { return maxRequests; }
        public RateLimitCfg setMaxRequests(int v) { mutable(); this.maxRequests = v; return this; }
        public Duration getWindow() { return window; }
        public RateLimitCfg setWindow(Duration v) { mutable(); this.window = v; return this; }
        public Duration getMaxQueueWait() { return maxQueueWait; }
        public RateLimitCfg setMaxQueueWait(Duration v) { mutable(); this.maxQueueWait = v; return this; }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        RateLimitCfg duplicate() {
            RateLimitCfg c = new RateLimitCfg();
            c.strategy = strategy;
            c.maxRequests = maxRequests;
            c.window = window;
            c.maxQueueWait = maxQueueWait;
            return c;
        }

        void freeze() {
            frozen = true;
        }
    }

    public static final class RetryCfg {
        private int maxAttempts = 3;
        private long baseDelayMs = 250;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { mutable(); this.maxAttempts = v; return this; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { mutable(); this.baseDelayMs = v; return this; }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        RetryCfg duplicate() {
            RetryCfg c = new RetryCfg();
            c.maxAttempts = maxAttempts;
            c.baseDelayMs = baseDelayMs;
            return c;
        }

        void freeze() {
            frozen = true;
        }
    }

    /** YAML `modules:` 섹션. names 가 있으면 profile 보다 우선 */
    public static final class ModulesCfg {
        private List<String> names = new ArrayList<>();
        private String profile = "quick";
        private ExecutionMode executionMode = ExecutionMode.PARALLEL;
        private int concurrency = 4;
        private Duration moduleTimeout = Duration.ofSeconds(60);
        private Map<String, Map<String, Object>> settings = new LinkedHashMap<>();

        public List<String> getNames() { return names; }
        public ModulesCfg setNames(List<String> v) { mutable(); this.names = copy(v); return this; }
        public String getProfile() { return profile; }
        public ModulesCfg setProfile(String v) { mutable(); this.profile = (v == null) ? null : v.trim().toLowerCase(Locale.ROOT); return this; }
        public ExecutionMode getExecutionMode() { return executionMode; }
        public ModulesCfg setExecutionMode(ExecutionMode v) { mutable(); this.executionMode = v; return this; }
        public int getConcurrency() { return concurrency; }
        public ModulesCfg setConcurrency(int v) { mutable(); this.concurrency = v; return this; }
        public Duration getModuleTimeout() { return moduleTimeout; }
        public ModulesCfg setModuleTimeout(Duration v) { mutable(); this.moduleTimeout = v; return this; }
        public Map<String, Map<String, Object>> getSettings() { return settings; }
        public ModulesCfg setSettings(Map<String, Map<String, Object>> v) {
            mutable();
            this.settings = new LinkedHashMap<>();
            if (v != null) v.forEach((k, m) -> this.settings.put(k, (m == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(m)));
            return this;
        }

        /** modules.settings.&lt;module&gt;.&lt;key&gt; = value */
        public ModulesCfg setting(String module, String key, Object value) {
            mutable();
            settings.computeIfAbsent(module, k -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        /** 없으면 빈 맵(읽기 전용) */
        public Map<String, Object> settingsFor(String module) {
            Map<String, Object> m = settings.get(module);
            return (m == null) ? Map.of() : Collections.unmodifiableMap(m);
        }

        private boolean frozen;
        private void mutable() { checkMutable(frozen); }

        ModulesCfg duplicate() {
            ModulesCfg c = new ModulesCfg();
            c.names = copy(names);
            c.profile = profile;
            c.executionMode = executionMode;
            c.concurrency = concurrency;
            c.moduleTimeout = moduleTimeout;
            c.setSettings(settings);
            return c;
        }

        void freeze() {
            names = Collections.unmodifiableList(names);
            Map<String, Map<String, Object>> ro = new LinkedHashMap<>();
            settings.forEach((k, m) -> ro.put(k, Collections.unmodifiableMap(m)));
            settings = Collections.unmodifiableMap(ro);
            frozen = true;
        }
    }

    // ---------- 기본 필드 ----------
    private String target;
    private int maxDepth = 2;
    private int maxPages = 100;
    private boolean sameDomainOnly = true;
    private Duration timeout = Duration.ofSeconds(10);     // 요청별
    private Duration scanTimeout = Duration.ofMinutes(10); // 스캔 전체
    private int concurrency = 4;                           // 크롤 워커 수
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;

    private CrawlerCfg crawler = new CrawlerCfg();
    private SessionCfg session = new SessionCfg();
    private CacheCfg cache = new CacheCfg();
    private RateLimitCfg rateLimit = new RateLimitCfg();
    private RetryCfg retry = new RetryCfg();
    private ModulesCfg modules = new ModulesCfg();
    private boolean frozen;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public Duration getTimeout() { return timeout; }
    public Duration getScanTimeout() { return scanTimeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public CrawlerCfg getCrawler() { return crawler; }
    public SessionCfg getSession() { return session; }
    public CacheCfg getCache() { return cache; }
    public RateLimitCfg getRateLimit() { return rateLimit; }
    public RetryCfg getRetry() { return retry; }
    public ModulesCfg getModules() { return modules; }

    /** validate() 이후 호출 */
    public URI targetUri() { return URI.create(target.trim()); }

    // ---------- fluent setters ----------
    public ScanConfig setTarget(String target) { mutable(); this.target = target; return this; }
    public ScanConfig setMaxDepth(int maxDepth) { mutable(); this.maxDepth = maxDepth; return this; }
    public ScanConfig setMaxPages(int maxPages) { mutable(); this.maxPages = maxPages; return this; }
    public ScanConfig setSameDomainOnly(boolean v) { mutable(); this.sameDomainOnly = v; return this; }
    public ScanConfig setTimeout(Duration timeout) { mutable(); this.timeout = timeout; return this; }
    public ScanConfig setScanTimeout(Duration scanTimeout) { mutable(); this.scanTimeout = scanTimeout; return this; }
    public ScanConfig setConcurrency(int concurrency) { mutable(); this.concurrency = concurrency; return this; }
    public ScanConfig setFollowRedirects(boolean v) { mutable(); this.followRedirects = v; return this; }
    public ScanConfig setUserAgent(String userAgent) { mutable(); this.userAgent = userAgent; return this; }
    public ScanConfig setCrawler(CrawlerCfg v) { mutable(); this.crawler = (v != null ? v : new CrawlerCfg()); return this; }
    public ScanConfig setSession(SessionCfg v) { mutable(); this.session = (v != null ? v : new SessionCfg()); return this; }
    public ScanConfig setCache(CacheCfg v) { mutable(); this.cache = (v != null ? v : new CacheCfg()); return this; }
    public ScanConfig setRateLimit(RateLimitCfg v) { mutable(); this.rateLimit = (v != null ? v : new RateLimitCfg()); return this; }
    public ScanConfig setRetry(RetryCfg v) { mutable(); this.retry = (v != null ? v : new RetryCfg()); return this; }
    public ScanConfig setModules(ModulesCfg v) { mutable(); this.modules = (v != null ? v : new ModulesCfg()); return this; }

    // ---------- snapshot ----------

    /** 깊은 복사(항상 가변) */
    public ScanConfig copy() {
        ScanConfig c = new ScanConfig();
        c.target = target;
        c.maxDepth = maxDepth;
        c.maxPages = maxPages;
        c.sameDomainOnly = sameDomainOnly;
        c.timeout = timeout;
        c.scanTimeout = scanTimeout;
        c.concurrency = concurrency;
        c.followRedirects = followRedirects;
        c.userAgent = userAgent;
        c.crawler = crawler.duplicate();
        c.session = session.duplicate();
        c.cache = cache.duplicate();
        c.rateLimit = rateLimit.duplicate();
        c.retry = retry.duplicate();
        c.modules = modules.duplicate();
        return c;
    }

    /** 이후 setter 는 IllegalStateException, 컬렉션은 읽기 전용. 모듈에 넘기는 스냅샷용. */
    public ScanConfig freeze() {
        crawler.freeze();
        session.freeze();
        cache.freeze();
        rateLimit.freeze();
        retry.freeze();
        modules.freeze();
        frozen = true;
        return this;
    }

    public boolean isFrozen() { return frozen; }

    private void mutable() { checkMutable(frozen); }

    private static void checkMutable(boolean frozen) {
        if (frozen) throw new IllegalStateException("configuration is frozen");
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        URI u;
        try {
            u = URI.create(target.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target is not a valid URL: " + target, e);
        }
        String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("target must be http(s): " + target);
        if (u.getHost() == null || u.getHost().isBlank())
            throw new IllegalArgumentException("target has no host: " + target);

        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        requirePositive(timeout, "timeout");
        requirePositive(scanTimeout, "scanTimeout");
        if ((userAgent == null || userAgent.isBlank()) && !frozen) userAgent = DEFAULT_USER_AGENT;

        Objects.requireNonNull(crawler, "crawler");
        if (crawler.getRobotsTtlMinutes() < 0) throw new IllegalArgumentException("crawler.robotsTtlMinutes must be >= 0");
        if (crawler.getCrawlDelayMs() < 0) throw new IllegalArgumentException("crawler.crawlDelayMs must be >= 0");

        Objects.requireNonNull(session, "session");

        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(cache.getBackend(), "cache.backend");
        requirePositive(cache.getTtl(), "cache.ttl");
        if (cache.getMemoryMaxEntries() < 1) throw new IllegalArgumentException("cache.memoryMaxEntries must be >= 1");
        if (cache.getBackend() != CacheBackend.MEMORY) Objects.requireNonNull(cache.getDir(), "cache.dir");

        Objects.requireNonNull(rateLimit, "rateLimit");
        Objects.requireNonNull(rateLimit.getStrategy(), "rateLimit.strategy");
        if (rateLimit.getMaxRequests() < 1) throw new IllegalArgumentException("rateLimit.maxRequests must be >= 1");
        requirePositive(rateLimit.getWindow(), "rateLimit.window");
        if (rateLimit.getMaxQueueWait() == null || rateLimit.getMaxQueueWait().isNegative())
            throw new IllegalArgumentException("rateLimit.maxQueueWait must be >= 0");

        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxAttempts() < 1) throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBaseDelayMs() < 0) throw new IllegalArgumentException("retry.baseDelayMs must be >= 0");

        Objects.requireNonNull(modules, "modules");
        if (modules.getExecutionMode() == null && !frozen) modules.setExecutionMode(ExecutionMode.PARALLEL);
        if (modules.getConcurrency() < 1) throw new IllegalArgumentException("modules.concurrency must be >= 1");
        requirePositive(modules.getModuleTimeout(), "modules.moduleTimeout");
        if (modules.getNames().isEmpty() && (modules.getProfile() == null || modules.getProfile().isBlank()))
            throw new IllegalArgumentException("modules.names or modules.profile is required");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    private static List<String> copy(List<String> v) {
        return (v == null) ? new ArrayList<>() : new ArrayList<>(v);
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
