package com.webtestool.core.api;

import com.webtestool.core.model.CrawlResult;
import com.webtestool.core.util.Deadline;

/** 크롤러 계약: 마감 안에서 도달 가능한 페이지/엔드포인트를 수집한다. */
public interface ICrawler extends AutoCloseable {
    /** 마감에 걸리면 timedOut=true 인 부분 결과 */
    CrawlResult crawl(Deadline deadline);

    @Override default void close() {}
}
