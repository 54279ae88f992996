package com.webtestool.core.service;

import com.webtestool.core.api.IScanPlugin;
import com.webtestool.core.api.ITestModule;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.error.SetupException;
import com.webtestool.core.model.CrawlResult;
import com.webtestool.core.model.ExecutionMode;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.ScanResult;
import com.webtestool.core.model.ScanState;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.ModuleRegistry;
import com.webtestool.core.util.Deadline;
import com.webtestool.core.util.LoggingConfigurator;
import com.webtestool.core.util.NamedThreadFactory;
import com.webtestool.core.util.ProgressListener;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.SysProps;
import com.webtestool.core.util.TickClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 스캔 오케스트레이터:
 *  - validate → preScan 훅 → crawl → TestContext → 모듈 초기화/실행 → 집계 → postScan 훅
 *  - 설정 오류(SetupException)만 FAILED, 그 아래 오류는 모두 데이터(ERROR 결과, fetchError)로 남는다
 *  - 모듈은 conflictsWith 를 지키는 배치 단위로 module-worker 풀에서 실행
 *  - 각 모듈 실행은 min(moduleTimeout, 남은 스캔 시간)으로 제한
 *
 * 인스턴스 하나는 run() 1회용이 아니다. 호출마다 협력 객체를 새로 만든다.
 */
public final class ScanService {

    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    private final ScanConfig config;
    private final ModuleRegistry registry;
    private final PluginHooks hooks;
    private final ScanComponents.Factory components;
    private final ScanStateListener stateListener;
    private final TickClock clock;
    private final NamedThreadFactory moduleThreads = new NamedThreadFactory("module-worker");

    private volatile ScanState state = ScanState.CREATED;

    /** 기본 구현(내장 모듈 + 실제 HTTP) */
    public ScanService(ScanConfig config) {
        this(builder(config));
    }

    private ScanService(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.registry = (b.registry != null) ? b.registry : ModuleRegistry.withBuiltins();
        this.hooks = new PluginHooks(b.plugins);
        this.components = (b.components != null) ? b.components : ScanComponents.standard();
        this.stateListener = (b.stateListener != null) ? b.stateListener : ScanStateListener.NONE;
        this.clock = (b.clock != null) ? b.clock : TickClock.SYSTEM;
        if (SysProps.sysBool("wt.log.bootstrap", false)) {
            LoggingConfigurator.bootstrap();
        }
    }

    public ScanState state() { return state; }

    /* =========================
       실행 API
       ========================= */

    public ScanResult run() {
        return run(ProgressListener.NONE, null);
    }

    /**
     * @param cancelFlag true 가 되면 다음 확인 지점에서 CancellationException
     */
    public ScanResult run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant startedAt = now();
        state = ScanState.CREATED;

        // ---- 0) 설정 단계: 여기서의 오류만 FAILED ----
        final URI target;
        final Deadline deadline;
        final Map<String, Object> pluginContext;
        final List<ITestModule> modules;
        final ScanComponents comps;
        final ScanConfig snapshot;
        try {
            validateConfig();
            snapshot = config.copy().freeze();
            target = config.targetUri();
            deadline = Deadline.after(config.getScanTimeout(), clock);
            pluginContext = hooks.preScan(config);
            modules = registry.withPluginModules(hooks.customModules()).resolve(config.getModules());
            comps = components.create(config, pl, cancelFlag);
        } catch (SetupException e) {
            return failed(startedAt, e);
        }

        final int cc = moduleWorkers(config.getModules());
        LOG.info("Scan start: target={}, maxDepth={}, maxPages={}, modules={}, mode={}",
                target, config.getMaxDepth(), config.getMaxPages(), names(modules),
                config.getModules().getExecutionMode());
        SLOG.info("scan-start",
                "target", target,
                "maxDepth", config.getMaxDepth(),
                "maxPages", config.getMaxPages(),
                "modules", names(modules),
                "moduleConcurrency", cc);

        try {
            // ---- 1) crawl ----
            moveTo(ScanState.CRAWLING);
            checkCancel(cancelFlag);
            CrawlResult crawl = comps.crawler().crawl(deadline);
            if (crawl.timedOut()) {
                SLOG.warn("crawl-timeout", "pages", crawl.pages().size());
            }

            // ---- 2) test ----
            moveTo(ScanState.TESTING);
            TestContext ctx = TestContext.builder()
                    .targetUrl(target)
                    .pages(crawl.pages())
                    .endpoints(crawl.endpoints())
                    .config(snapshot)
                    .sessionHeaders(config.getSession().getHeaders())
                    .cookies(config.getSession().getCookies())
                    .authToken(config.getSession().getAuthToken())
                    .pluginContext(pluginContext)
                    .fetcher(comps.fetcher())
                    .build();
            List<ModuleResult> results = runModules(modules, ctx, deadline, pl, cancelFlag);

            // ---- 3) aggregate ----
            moveTo(ScanState.AGGREGATING);
            ScanResult result = ScanResult.builder()
                    .target(target)
                    .startedAt(startedAt)
                    .endedAt(now())
                    .pages(crawl.pages())
                    .endpoints(crawl.endpoints())
                    .moduleResults(results)
                    .crawlTimedOut(crawl.timedOut())
                    .stats(comps.stats().snapshot())
                    .state(ScanState.COMPLETED)
                    .build();
            moveTo(ScanState.COMPLETED);

            ScanResult.Summary s = result.getSummary();
            LOG.info("Scan done: pages={}, endpoints={}, findings={}, {}ms",
                    s.pagesCrawled(), s.endpointsFound(), s.totalFindings(), s.durationMs());
            SLOG.info("scan-done",
                    "pages", s.pagesCrawled(),
                    "endpoints", s.endpointsFound(),
                    "findings", s.totalFindings(),
                    "durationMs", s.durationMs(),
                    "requests", result.getStats().requestsTotal,
                    "cacheHits", result.getStats().cacheHits);
            pl.onProgress(1.0, "done", results.size(), results.size());

            hooks.postScan(result);
            return result;
        } finally {
            closeQuietly(comps);
        }
    }

    // ---------- 모듈 실행 ----------

    private List<ModuleResult> runModules(List<ITestModule> modules, TestContext ctx, Deadline deadline,
                                          ProgressListener pl, AtomicBoolean cancel) {
        final int n = modules.size();
        final ModuleResult[] results = new ModuleResult[n];

        // 초기화 실패 → ERROR 결과, 실행 대상에서 제외
        List<Integer> runnable = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ITestModule m = modules.get(i);
            Instant t0 = now();
            try {
                m.initialize(ctx.getConfig());
                runnable.add(i);
            } catch (ModuleException | RuntimeException e) {
                LOG.warn("module {} failed to initialize: {}", m.name(), e.getMessage());
                SLOG.warn("module-init-failed", e, "module", m.name());
                results[i] = ModuleResult.error(m.name(), m.category(), "initialize: " + message(e), t0, now());
                close(m);
            }
        }

        final int cc = moduleWorkers(config.getModules());
        List<List<Integer>> batches = batches(modules, runnable, cc);
        LOG.debug("module batches: {}", batches);

        int done = n - runnable.size();
        for (List<Integer> batch : batches) {
            checkCancel(cancel);
            if (deadline.isExpired()) {
                for (int i : batch) {
                    ITestModule m = modules.get(i);
                    LOG.warn("scan deadline reached, skipping module {}", m.name());
                    results[i] = ModuleResult.skipped(m.name(), m.category(), now());
                    close(m);
                }
                continue;
            }

            // 배치마다 새 풀: 인터럽트를 무시하고 버티는 모듈이 다음 배치의 워커를 잡지 못하게
            final ThreadPoolExecutor exec = newModulePool(batch.size());
            final Duration budget = deadline.cap(config.getModules().getModuleTimeout());
            boolean abandoned = false;
            try {
                List<Future<ModuleResult>> futures = new ArrayList<>(batch.size());
                List<AtomicLong> started = new ArrayList<>(batch.size());
                for (int i : batch) {
                    ITestModule m = modules.get(i);
                    AtomicLong st = new AtomicLong();
                    started.add(st);
                    futures.add(exec.submit(() -> {
                        st.set(System.nanoTime());
                        return m.run(ctx);
                    }));
                }

                for (int k = 0; k < batch.size(); k++) {
                    int i = batch.get(k);
                    ITestModule m = modules.get(i);
                    results[i] = await(m, futures.get(k), started.get(k), budget);
                    if (!futures.get(k).isDone() || isTimeout(results[i])) abandoned = true;
                    close(m);
                    done++;
                    pl.onProgress((double) done / Math.max(1, n), "test", done, n);
                }
            } finally {
                stop(exec, abandoned);
            }
        }

        List<ModuleResult> out = new ArrayList<>(n);
        for (ModuleResult r : results) out.add(r);
        return out;
    }

    private ThreadPoolExecutor newModulePool(int size) {
        return new ThreadPoolExecutor(
                size, size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(size),
                moduleThreads,
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                });
    }

    /** 시간 초과 모듈이 남은 풀은 기다리지 않고 버린다(데몬 스레드) */
    private static void stop(ThreadPoolExecutor exec, boolean abandoned) {
        exec.shutdownNow();
        if (abandoned) {
            LOG.warn("abandoning {} module worker(s) still running after timeout", exec.getActiveCount());
            return;
        }
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("module workers did not stop within 5s");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isTimeout(ModuleResult r) {
        return r.getErrorMessage() != null && r.getErrorMessage().startsWith("timed out");
    }

    /** 제한 시간은 모듈이 실제로 스레드를 얻은 시점부터 잰다 */
    private ModuleResult await(ITestModule m, Future<ModuleResult> f, AtomicLong startedNanos, Duration budget) {
        final Instant start = now();
        final long budgetNanos = budget.toNanos();
        final long submitted = System.nanoTime();
        try {
            while (true) {
                long st = startedNanos.get();
                long limit = ((st == 0) ? submitted : st) + budgetNanos;
                try {
                    ModuleResult r = f.get(Math.max(0, limit - System.nanoTime()), TimeUnit.NANOSECONDS);
                    if (r == null) {
                        return ModuleResult.error(m.name(), m.category(), "module returned no result", start, now());
                    }
                    SLOG.info("module-done", "module", m.name(), "status", r.getStatus(),
                            "findings", r.getFindings().size(), "durationMs", r.durationMs());
                    return r;
                } catch (TimeoutException te) {
                    // 대기 중에 늦게 시작했으면 그 시점부터 다시 잰다
                    if (st == 0 && startedNanos.get() != 0) continue;
                    f.cancel(true);
                    LOG.warn("module {} timed out after {}ms", m.name(), budget.toMillis());
                    SLOG.warn("module-timeout", "module", m.name(), "budgetMs", budget.toMillis());
                    return ModuleResult.error(m.name(), m.category(), "timed out after " + budget.toMillis() + "ms", start, now());
                }
            }
        } catch (ExecutionException ee) {
            Throwable cause = (ee.getCause() != null) ? ee.getCause() : ee;
            LOG.warn("module {} failed: {}", m.name(), cause.toString());
            SLOG.error("module-failed", cause, "module", m.name());
            return ModuleResult.error(m.name(), m.category(), message(cause), start, now());
        } catch (CancellationException ce) {
            return ModuleResult.error(m.name(), m.category(), "cancelled", start, now());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new CancellationException("Interrupted while waiting for module " + m.name());
        }
    }

    /**
     * 입력 순서를 지키며 배치를 채운다. 배치 크기 ≤ cc, 같은 배치 안에 충돌 쌍 없음.
     * 충돌로 밀린 모듈은 다음 배치 후보가 된다.
     */
    static List<List<Integer>> batches(List<ITestModule> modules, List<Integer> order, int cc) {
        List<List<Integer>> out = new ArrayList<>();
        List<Integer> pending = new ArrayList<>(order);
        while (!pending.isEmpty()) {
            List<Integer> batch = new ArrayList<>();
            List<Integer> deferred = new ArrayList<>();
            for (int i : pending) {
                if (batch.size() < cc && !conflicts(modules, batch, i)) batch.add(i);
                else deferred.add(i);
            }
            out.add(batch);
            pending = deferred;
        }
        return out;
    }

    /** SEQUENTIAL 이면 1, 아니면 concurrency (-Dwt.modules.maxWorkers 로 상한) */
    static int moduleWorkers(ScanConfig.ModulesCfg m) {
        if (m.getExecutionMode() == ExecutionMode.SEQUENTIAL) return 1;
        int n = Math.max(1, m.getConcurrency());
        int cap = SysProps.sysInt("wt.modules.maxWorkers", -1);
        return (cap > 0) ? Math.min(n, cap) : n;
    }

    private static boolean conflicts(List<ITestModule> modules, List<Integer> batch, int candidate) {
        ITestModule c = modules.get(candidate);
        for (int j : batch) {
            ITestModule o = modules.get(j);
            if (safeConflicts(c).contains(o.name()) || safeConflicts(o).contains(c.name())) return true;
        }
        return false;
    }

    private static Set<String> safeConflicts(ITestModule m) {
        Set<String> s = m.conflictsWith();
        return (s == null) ? Set.of() : s;
    }

    // ---------- 내부 헬퍼 ----------

    private void validateConfig() {
        try {
            config.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SetupException("invalid configuration: " + e.getMessage(), e);
        }
    }

    private ScanResult failed(Instant startedAt, SetupException e) {
        LOG.error("Scan setup failed: {}", e.getMessage());
        SLOG.error("scan-failed", e, "target", config.getTarget());
        moveTo(ScanState.FAILED);
        URI target = null;
        try {
            target = URI.create(config.getTarget().trim());
        } catch (RuntimeException invalid) {
            LOG.debug("target not representable as URI: {}", invalid.getMessage());
        }
        return ScanResult.builder()
                .target(target)
                .startedAt(startedAt)
                .endedAt(now())
                .state(ScanState.FAILED)
                .setupError(e.getMessage())
                .build();
    }

    private void moveTo(ScanState next) {
        ScanState prev = state;
        if (!prev.canMoveTo(next)) {
            throw new IllegalStateException("illegal scan state transition " + prev + " -> " + next);
        }
        state = next;
        LOG.debug("state {} -> {}", prev, next);
        try {
            stateListener.onStateChanged(prev, next);
        } catch (RuntimeException e) {
            LOG.warn("state listener failed on {} -> {}: {}", prev, next, e.toString());
        }
    }

    private static void checkCancel(AtomicBoolean cancel) {
        if (Thread.currentThread().isInterrupted() || (cancel != null && cancel.get())) {
            throw new CancellationException("Scan cancelled");
        }
    }

    private static void close(ITestModule m) {
        try {
            m.close();
        } catch (Exception e) {
            LOG.warn("module {} close failed: {}", m.name(), e.toString());
        }
    }

    private static void closeQuietly(ScanComponents comps) {
        try {
            comps.crawler().close();
        } catch (Exception e) {
            LOG.warn("crawler close failed: {}", e.toString());
        }
    }

    private static String message(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + m;
    }

    private static List<String> names(List<ITestModule> modules) {
        return modules.stream().map(ITestModule::name).toList();
    }

    private Instant now() { return Instant.ofEpochMilli(clock.nowMillis()); }

    /* =========================
       Builder (DI/테스트/플러그인용)
       ========================= */

    public static Builder builder(ScanConfig config) { return new Builder(config); }

    public static final class Builder {
        private final ScanConfig config;
        private ModuleRegistry registry;
        private final List<IScanPlugin> plugins = new ArrayList<>();
        private ScanComponents.Factory components;
        private ScanStateListener stateListener;
        private TickClock clock;

        private Builder(ScanConfig config) { this.config = config; }

        public Builder registry(ModuleRegistry registry) { this.registry = registry; return this; }
        public Builder plugin(IScanPlugin plugin) { if (plugin != null) plugins.add(plugin); return this; }
        public Builder components(ScanComponents.Factory f) { this.components = f; return this; }
        public Builder stateListener(ScanStateListener l) { this.stateListener = l; return this; }
        public Builder clock(TickClock clock) { this.clock = clock; return this; }

        public ScanService build() { return new ScanService(this); }
    }
}
