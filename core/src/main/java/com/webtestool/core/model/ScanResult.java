package com.webtestool.core.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 스캔 1회의 최종 결과. moduleResults 는 해석된 모듈 순서대로 정렬되어 있다. */
public final class ScanResult {

    /** 집계 요약 */
    public record Summary(Map<Severity, Integer> findingsBySeverity,
                          Map<TestStatus, Integer> modulesByStatus,
                          int totalFindings,
                          int pagesCrawled,
                          int endpointsFound,
                          long durationMs) {

        public Summary {
            findingsBySeverity = Collections.unmodifiableMap(new EnumMap<>(findingsBySeverity));
            modulesByStatus = Collections.unmodifiableMap(new EnumMap<>(modulesByStatus));
        }

        public int count(Severity s) { return findingsBySeverity.getOrDefault(s, 0); }
        public int count(TestStatus s) { return modulesByStatus.getOrDefault(s, 0); }

        /** 모든 심각도/상태 키를 0 으로 채운 뒤 누적 */
        public static Summary of(List<CrawledPage> pages, List<ApiEndpoint> endpoints,
                                 List<ModuleResult> results, Instant start, Instant end) {
            Map<Severity, Integer> bySev = new EnumMap<>(Severity.class);
            for (Severity s : Severity.values()) bySev.put(s, 0);
            Map<TestStatus, Integer> byStatus = new EnumMap<>(TestStatus.class);
            for (TestStatus s : TestStatus.values()) byStatus.put(s, 0);

            int total = 0;
            for (ModuleResult r : results) {
                byStatus.merge(r.getStatus(), 1, Integer::sum);
                for (Finding f : r.getFindings()) {
                    bySev.merge(f.getSeverity(), 1, Integer::sum);
                    total++;
                }
            }
            long ms = Math.max(0, Duration.between(start, end).toMillis());
            return new Summary(bySev, byStatus, total, pages.size(), endpoints.size(), ms);
        }
    }

    private final URI target;
    private final Instant startedAt;
    private final Instant endedAt;
    private final List<CrawledPage> pages;
    private final List<ApiEndpoint> endpoints;
    private final List<ModuleResult> moduleResults;
    private final Summary summary;
    private final ScanState state;
    private final String setupError;       // FAILED 일 때만
    private final boolean crawlTimedOut;
    private final ScanStats.Snapshot stats;

    private ScanResult(Builder b) {
        this.target = b.target;
        this.startedAt = b.startedAt;
        this.endedAt = (b.endedAt == null || b.endedAt.isBefore(b.startedAt)) ? b.startedAt : b.endedAt;
        this.pages = List.copyOf(b.pages);
        this.endpoints = List.copyOf(b.endpoints);
        this.moduleResults = List.copyOf(b.moduleResults);
        this.summary = Summary.of(pages, endpoints, moduleResults, startedAt, endedAt);
        this.state = b.state;
        this.setupError = b.setupError;
        this.crawlTimedOut = b.crawlTimedOut;
        this.stats = (b.stats == null) ? ScanStats.Snapshot.empty() : b.stats;
    }

    public URI getTarget() { return target; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public List<CrawledPage> getPages() { return pages; }
    public List<ApiEndpoint> getEndpoints() { return endpoints; }
    public List<ModuleResult> getModuleResults() { return moduleResults; }
    public Summary getSummary() { return summary; }
    public ScanState getState() { return state; }
    public String getSetupError() { return setupError; }
    public boolean isCrawlTimedOut() { return crawlTimedOut; }
    public ScanStats.Snapshot getStats() { return stats; }

    /** 모듈 순서대로 펼친 전체 발견 목록 */
    public List<Finding> allFindings() {
        return moduleResults.stream().flatMap(r -> r.getFindings().stream()).toList();
    }

    public ModuleResult resultOf(String moduleName) {
        for (ModuleResult r : moduleResults) {
            if (r.getModuleName().equals(moduleName)) return r;
        }
        return null;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI target;
        private Instant startedAt;
        private Instant endedAt;
        private List<CrawledPage> pages = List.of();
        private List<ApiEndpoint> endpoints = List.of();
        private List<ModuleResult> moduleResults = List.of();
        private ScanState state = ScanState.COMPLETED;
        private String setupError;
        private boolean crawlTimedOut;
        private ScanStats.Snapshot stats;

        public Builder target(URI target) { this.target = target; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder endedAt(Instant endedAt) { this.endedAt = endedAt; return this; }
        public Builder pages(List<CrawledPage> pages) { this.pages = pages; return this; }
        public Builder endpoints(List<ApiEndpoint> endpoints) { this.endpoints = endpoints; return this; }
        public Builder moduleResults(List<ModuleResult> moduleResults) { this.moduleResults = moduleResults; return this; }
        public Builder state(ScanState state) { this.state = state; return this; }
        public Builder setupError(String setupError) { this.setupError = setupError; return this; }
        public Builder crawlTimedOut(boolean crawlTimedOut) { this.crawlTimedOut = crawlTimedOut; return this; }
        public Builder stats(ScanStats.Snapshot stats) { this.stats = stats; return this; }

        public ScanResult build() {
            Objects.requireNonNull(startedAt, "startedAt");
            Objects.requireNonNull(state, "state");
            if (state == ScanState.FAILED && setupError == null) {
                throw new IllegalArgumentException("FAILED scan requires setupError");
            }
            return new ScanResult(this);
        }
    }
}
