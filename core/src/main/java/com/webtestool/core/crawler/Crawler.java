package com.webtestool.core.crawler;

import com.webtestool.core.api.ICrawler;
import com.webtestool.core.api.IFetcher;
import com.webtestool.core.crawler.robots.RobotsPolicy;
import com.webtestool.core.crawler.robots.RobotsRepository;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.BodyHandle;
import com.webtestool.core.model.CrawlResult;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.ratelimit.MinIntervalLimiter;
import com.webtestool.core.util.Deadline;
import com.webtestool.core.util.NamedThreadFactory;
import com.webtestool.core.util.ProgressListener;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.SysProps;
import com.webtestool.core.util.UrlExclusion;
import com.webtestool.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * BFS 크롤러.
 * - 디스패처(호출 스레드)가 큐에서 꺼내 워커 풀(crawl-worker-N)에 넘긴다
 * - 페이지 슬롯은 디스패치 시점에 예약하므로 기록 페이지 수는 maxPages 를 넘지 않는다
 * - 스코프 밖 링크는 기록만 하고 가져오지 않는다
 * - robots 불허 주소는 큐에 넣기 전에 거른다(시드 포함)
 * - 결과 페이지는 (depth, 발견 순서) 정렬
 */
public final class Crawler implements ICrawler {
    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    /** 디스패처가 마감/취소를 확인하는 주기 */
    private static final long POLL_MS = 100;

    private final ScanConfig config;
    private final IFetcher fetcher;
    private final PageParser parser;
    private final RobotsRepository robots;          // null = robots 무시
    private final MinIntervalLimiter politeness;    // null = Crawl-delay 반영 안 함
    private ProgressListener progress = ProgressListener.NONE;
    private AtomicBoolean cancelFlag;

    public Crawler(ScanConfig config, IFetcher fetcher, PageParser parser,
                   RobotsRepository robots, MinIntervalLimiter politeness) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.robots = config.getCrawler().isRespectRobots() ? robots : null;
        this.politeness = politeness;
    }

    public Crawler progress(ProgressListener pl) {
        this.progress = (pl != null) ? pl : ProgressListener.NONE;
        return this;
    }

    public Crawler cancelFlag(AtomicBoolean flag) {
        this.cancelFlag = flag;
        return this;
    }

    @Override
    public CrawlResult crawl(Deadline deadline) {
        return new Run(deadline == null ? Deadline.none() : deadline).execute();
    }

    private record Node(URI url, int depth, URI parent, long seq) {}

    private record Recorded(int depth, long seq, CrawledPage page) {}

    /** 크롤 1회 상태 */
    private final class Run {
        final Deadline deadline;
        final URI seed = UrlUtils.normalize(config.targetUri());
        final int maxPages = config.getMaxPages();
        final int maxDepth = config.getMaxDepth();
        final int workers = workerCount(config.getConcurrency());

        final ReentrantLock lock = new ReentrantLock();
        final Condition changed = lock.newCondition();
        final Deque<Node> queue = new ArrayDeque<>();
        int inFlight;        // lock 보호
        int reserved;        // 예약된 페이지 슬롯(lock 보호)

        final Set<String> visited = ConcurrentHashMap.newKeySet();
        final AtomicLong seq = new AtomicLong();
        final List<Recorded> recorded = new ArrayList<>();                 // synchronized(recorded)
        final Map<String, ApiEndpoint> endpoints = new LinkedHashMap<>();  // synchronized(endpoints)
        final Set<String> outOfScope = ConcurrentHashMap.newKeySet();
        final Set<String> robotsBlocked = ConcurrentHashMap.newKeySet();

        Run(Deadline deadline) {
            this.deadline = deadline;
        }

        CrawlResult execute() {
            long t0 = System.nanoTime();
            LOG.info("Crawl start: seed={}, maxDepth={}, maxPages={}, workers={}", seed, maxDepth, maxPages, workers);
            SLOG.info("crawl-start", "seed", seed, "maxDepth", maxDepth, "maxPages", maxPages, "workers", workers);
            progress.onProgress(0.0, "crawl", 0, maxPages);

            visited.add(seed.toString());
            if (robotsAllows(seed)) {
                queue.add(new Node(seed, 0, null, seq.getAndIncrement()));
            } else {
                robotsBlocked.add(seed.toString());
                LOG.info("seed disallowed by robots.txt: {}", seed);
            }

            ThreadPoolExecutor exec = new ThreadPoolExecutor(
                    workers, workers,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(workers * 2),
                    new NamedThreadFactory("crawl-worker"),
                    (r, e) -> {
                        try { e.getQueue().put(r); }
                        catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                        }
                    });

            boolean timedOut = false;
            try {
                timedOut = dispatch(exec);
            } finally {
                exec.shutdownNow();
                try {
                    if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                        LOG.warn("crawl workers did not stop within 30s");
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }

            List<CrawledPage> pages;
            synchronized (recorded) {
                pages = recorded.stream()
                        .sorted(Comparator.comparingInt(Recorded::depth).thenComparingLong(Recorded::seq))
                        .map(Recorded::page)
                        .toList();
            }
            List<ApiEndpoint> eps;
            synchronized (endpoints) {
                eps = endpoints.values().stream()
                        .sorted(Comparator.comparing((ApiEndpoint e) -> e.url().toString()).thenComparing(ApiEndpoint::method))
                        .toList();
            }
            long ms = (System.nanoTime() - t0) / 1_000_000;
            CrawlResult result = new CrawlResult(pages, eps, sortedUris(outOfScope), sortedUris(robotsBlocked), timedOut, ms);

            LOG.info("Crawl done: pages={}, endpoints={}, outOfScope={}, robotsBlocked={}, timedOut={}, {}ms",
                    pages.size(), eps.size(), outOfScope.size(), robotsBlocked.size(), timedOut, ms);
            SLOG.info("crawl-done", "pages", pages.size(), "endpoints", eps.size(),
                    "timedOut", timedOut, "durationMs", ms);
            progress.onProgress(1.0, "crawl", pages.size(), pages.size());
            return result;
        }

        /** @return 마감으로 끊겼으면 true */
        private boolean dispatch(ThreadPoolExecutor exec) {
            lock.lock();
            try {
                while (true) {
                    checkCancel();
                    if (deadline.isExpired()) {
                        LOG.warn("crawl deadline reached: {} pages, {} in flight", reserved, inFlight);
                        return true;
                    }
                    boolean slotsLeft = reserved < maxPages;
                    if (!queue.isEmpty() && slotsLeft && inFlight < workers) {
                        Node n = queue.pollFirst();
                        reserved++;
                        inFlight++;
                        exec.execute(() -> work(n));
                        continue;
                    }
                    if (inFlight == 0 && (queue.isEmpty() || !slotsLeft)) {
                        return false;
                    }
                    long wait = Math.min(POLL_MS, Math.max(1, deadline.remaining().toMillis()));
                    changed.await(wait, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while crawling");
            } finally {
                lock.unlock();
            }
        }

        private void work(Node n) {
            try {
                CrawledPage page = visit(n);
                synchronized (recorded) {
                    recorded.add(new Recorded(n.depth(), n.seq(), page));
                }
                int done;
                synchronized (recorded) { done = recorded.size(); }
                progress.onProgress(Math.min(1.0, (double) done / maxPages), "crawl", done, maxPages);
            } catch (CancellationException ce) {
                LOG.debug("crawl worker cancelled at {}", n.url());
            } catch (RuntimeException e) {
                LOG.warn("crawl worker failed on {}: {}", n.url(), e.toString());
                SLOG.error("crawl-worker-failed", e, "url", n.url());
            } finally {
                lock.lock();
                try {
                    inFlight--;
                    changed.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        }

        /** 어떤 실패든 페이지는 기록한다(오류 + 링크 없음) */
        private CrawledPage visit(Node n) {
            long t0 = System.nanoTime();
            try {
                return fetchAndParse(n, t0);
            } catch (CancellationException ce) {
                throw ce;
            } catch (RuntimeException e) {
                LOG.warn("page failed {}: {}", n.url(), e.toString());
                SLOG.error("page-failed", e, "url", n.url());
                return CrawledPage.builder().url(n.url()).depth(n.depth()).parentUrl(n.parent())
                        .fetchDurationMs((System.nanoTime() - t0) / 1_000_000)
                        .fetchError(e.getClass().getSimpleName() + ": " + e.getMessage())
                        .build();
            }
        }

        private CrawledPage fetchAndParse(Node n, long t0) {
            CrawledPage.Builder b = CrawledPage.builder().url(n.url()).depth(n.depth()).parentUrl(n.parent());
            FetchResult r;
            try {
                r = fetcher.get(n.url());
            } catch (FetchException e) {
                LOG.info("fetch failed {}: {}", n.url(), e.summary());
                SLOG.warn("page-fetch-failed", "url", n.url(), "kind", e.getKind(), "status", e.getStatusCode());
                return b.statusCode(e.getStatusCode())
                        .fetchDurationMs((System.nanoTime() - t0) / 1_000_000)
                        .fetchError(e.summary())
                        .build();
            }
            long ms = (System.nanoTime() - t0) / 1_000_000;
            b.statusCode(r.getStatusCode())
                    .headers(r.getHeaders())
                    .contentType(r.getContentType())
                    .fetchDurationMs(r.isFromCache() ? r.getResponseTimeMs() : ms)
                    .fromCache(r.isFromCache());

            // 상대 링크는 리다이렉트 후 주소 기준
            URI base = (r.getFinalUrl() == null) ? n.url() : r.getFinalUrl();
            if (!base.equals(n.url())) {
                if (!hostInScope(base)) {
                    LOG.info("redirect left scope {} -> {}", n.url(), base);
                    SLOG.warn("redirect-out-of-scope", "url", n.url(), "finalUrl", base);
                    outOfScope.add(base.toString());
                    return b.fetchError("redirected out of scope: " + base).build();
                }
                URI nb = UrlUtils.normalize(base);
                if (nb != null) visited.add(nb.toString());
            }

            b.body(config.getCrawler().isRetainBodies()
                    ? BodyHandle.inMemory(r.getBody())
                    : new RefetchBodyHandle(fetcher, n.url()));

            String ct = (r.getContentType() == null) ? "" : r.getContentType().toLowerCase(Locale.ROOT);
            if (r.isHtml()) {
                PageParser.ParsedPage parsed = parser.parse(base, r.getBody());
                b.title(parsed.title()).forms(parsed.forms()).scripts(parsed.scripts());
                b.links(follow(n, parsed.links()));
                synchronized (endpoints) {
                    for (ApiEndpoint ep : parsed.scriptEndpoints()) {
                        if (inScope(ep.url())) endpoints.putIfAbsent(ep.key(), ep);
                    }
                }
            } else if (ct.contains("json") || ct.contains("xml")) {
                ApiEndpoint ep = new ApiEndpoint("GET", base, r.getContentType(),
                        JsoupPageParser.queryParamNames(base), n.parent(), ApiEndpoint.FROM_RESPONSE);
                synchronized (endpoints) {
                    endpoints.put(ep.key(), ep);
                }
            }
            return b.build();
        }

        /** 링크 정규화 → 스코프/깊이/중복/robots 거른 뒤 큐에 넣고, 페이지의 링크 목록을 돌려준다 */
        private List<URI> follow(Node from, List<URI> rawLinks) {
            List<URI> links = new ArrayList<>(rawLinks.size());
            for (URI raw : rawLinks) {
                URI u = UrlUtils.normalize(raw);
                if (u == null || links.contains(u)) continue;
                links.add(u);

                if (!inScope(u)) {
                    outOfScope.add(u.toString());
                    continue;
                }
                if (from.depth() + 1 > maxDepth) continue;
                if (!visited.add(u.toString())) continue;
                if (!robotsAllows(u)) {
                    robotsBlocked.add(u.toString());
                    continue;
                }
                enqueue(new Node(u, from.depth() + 1, from.url(), seq.getAndIncrement()));
            }
            return links;
        }

        private void enqueue(Node n) {
            lock.lock();
            try {
                if (reserved < maxPages) {
                    queue.addLast(n);
                    changed.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }

        private boolean hostInScope(URI u) {
            return !config.isSameDomainOnly()
                    || UrlUtils.hostInScope(u, seed, config.getCrawler().getAllowedDomains());
        }

        private boolean inScope(URI u) {
            ScanConfig.CrawlerCfg c = config.getCrawler();
            if (!hostInScope(u)) return false;
            if (!UrlExclusion.isIncluded(u, c.getIncludePatterns())) return false;
            return !UrlExclusion.isExcluded(u, c.getExcludePaths());
        }

        private boolean robotsAllows(URI u) {
            if (robots == null) return true;
            RobotsPolicy p = robots.policyFor(u);
            if (politeness != null && p.crawlDelayMs() > 0) {
                politeness.raiseInterval(UrlUtils.hostOf(u), p.crawlDelayMs());
            }
            return p.allow(u);
        }

        private void checkCancel() {
            if (Thread.currentThread().isInterrupted() || (cancelFlag != null && cancelFlag.get())) {
                throw new CancellationException("crawl cancelled");
            }
        }
    }

    private static List<URI> sortedUris(Set<String> s) {
        return new TreeSet<>(s).stream().map(URI::create).toList();
    }

    /** -Dwt.crawl.maxWorkers 로 상한(기본 꺼짐) */
    static int workerCount(int configured) {
        int n = Math.max(1, configured);
        int cap = SysProps.sysInt("wt.crawl.maxWorkers", -1);
        return (cap > 0) ? Math.min(n, cap) : n;
    }
}
