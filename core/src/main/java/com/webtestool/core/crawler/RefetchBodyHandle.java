package com.webtestool.core.crawler;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.model.BodyHandle;

import java.net.URI;

/** retainBodies=false 일 때: 본문을 들고 있지 않고 필요할 때 Fetcher(캐시 경유)로 다시 읽는다 */
final class RefetchBodyHandle implements BodyHandle {
    private final IFetcher fetcher;
    private final URI url;

    RefetchBodyHandle(IFetcher fetcher, URI url) {
        this.fetcher = fetcher;
        this.url = url;
    }

    @Override public String text() {
        try {
            return fetcher.get(url).getBody();
        } catch (FetchException e) {
            throw new IllegalStateException("body unavailable for " + url + ": " + e.summary(), e);
        }
    }

    @Override public boolean isRetained() { return false; }
}
