package com.webtestool.core.model;

import java.net.URI;
import java.util.List;

/**
 * 크롤 결과. pages 는 (depth, 발견 순서) 정렬.
 * timedOut=true 면 스캔 마감으로 중단된 부분 결과.
 */
public record CrawlResult(List<CrawledPage> pages,
                          List<ApiEndpoint> endpoints,
                          List<URI> outOfScopeLinks,
                          List<URI> robotsBlocked,
                          boolean timedOut,
                          long durationMs) {

    public CrawlResult {
        pages = (pages == null) ? List.of() : List.copyOf(pages);
        endpoints = (endpoints == null) ? List.of() : List.copyOf(endpoints);
        outOfScopeLinks = (outOfScopeLinks == null) ? List.of() : List.copyOf(outOfScopeLinks);
        robotsBlocked = (robotsBlocked == null) ? List.of() : List.copyOf(robotsBlocked);
    }

    public static CrawlResult empty() {
        return new CrawlResult(List.of(), List.of(), List.of(), List.of(), false, 0L);
    }

    /** fetchError 없는 페이지 수 */
    public long successfulPages() {
        return pages.stream().filter(p -> !p.isFailed()).count();
    }
}
