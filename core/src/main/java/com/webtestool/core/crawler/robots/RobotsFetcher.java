package com.webtestool.core.crawler.robots;

import java.net.URI;

/** robots.txt 취득 훅. 예외를 던지지 않고 status 0 으로 실패를 알린다. */
@FunctionalInterface
public interface RobotsFetcher {

    /**
     * @param status   HTTP 상태(0 = 네트워크 오류)
     * @param location 3xx 의 Location(해석된 절대 주소) 또는 따라간 뒤의 최종 주소
     */
    record Response(int status, String body, URI location) {
        public static Response failed() { return new Response(0, "", null); }
    }

    Response fetch(URI robotsTxtUri);
}
