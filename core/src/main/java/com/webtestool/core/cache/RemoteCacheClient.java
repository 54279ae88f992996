package com.webtestool.core.cache;

import java.io.IOException;

/**
 * 원격 키/값 저장소(예: Redis) 연결. 코어는 구현을 갖지 않고 주입받는다.
 * 명령 의미는 GET / SETEX / DEL 과 같다.
 */
public interface RemoteCacheClient {

    /** 없으면 null */
    String get(String key) throws IOException;

    void setex(String key, long ttlSeconds, String value) throws IOException;

    void del(String key) throws IOException;

    /** prefix 로 시작하는 키 전부 삭제 */
    void delByPrefix(String prefix) throws IOException;
}
