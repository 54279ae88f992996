package com.webtestool.core.crawler.robots;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/** robots.txt 도 일반 요청과 같은 캐시/리미터/재시도를 거치도록 IFetcher 위에 얹은 어댑터 */
public final class FetcherRobotsFetcher implements RobotsFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(FetcherRobotsFetcher.class);

    private final IFetcher fetcher;

    public FetcherRobotsFetcher(IFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            FetchResult r = fetcher.fetch(FetchRequest.builder(robotsTxtUri)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .build());
            int s = r.getStatusCode();
            if (s >= 300 && s < 400) {
                String loc = r.header("Location");
                return new Response(s, "", (loc == null) ? null : robotsTxtUri.resolve(loc.trim()));
            }
            return new Response(s, r.getBody(), r.getFinalUrl());
        } catch (FetchException e) {
            LOG.info("robots.txt unavailable {} ({}), allowing all", robotsTxtUri, e.summary());
            return Response.failed();
        } catch (IllegalArgumentException e) {
            LOG.info("robots.txt bad redirect from {}: {}", robotsTxtUri, e.getMessage());
            return Response.failed();
        }
    }
}
