package com.webtestool.core.model;

/**
 * 페이지 본문 접근자. 메모리에 보관하거나(retainBodies=true),
 * 필요할 때 캐시를 거쳐 다시 가져온다(구현은 crawler 패키지).
 */
public interface BodyHandle {

    /** 본문 텍스트. 다시 가져오기에 실패하면 IllegalStateException */
    String text();

    /** 메모리에 이미 들고 있는지 */
    boolean isRetained();

    BodyHandle EMPTY = inMemory("");

    static BodyHandle inMemory(String body) {
        final String b = (body == null) ? "" : body;
        return new BodyHandle() {
            @Override public String text() { return b; }
            @Override public boolean isRetained() { return true; }
        };
    }
}
