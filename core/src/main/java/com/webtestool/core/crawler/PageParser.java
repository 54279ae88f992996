package com.webtestool.core.crawler;

import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.FormInfo;

import java.net.URI;
import java.util.List;

/** HTML 본문에서 크롤에 필요한 정보를 뽑는 전략. 네트워크를 쓰지 않는다. */
public interface PageParser {

    /** 링크는 절대 http(s) 주소, fragment 제거(정규화/스코프 판단은 호출자 몫) */
    record ParsedPage(String title,
                      List<URI> links,
                      List<FormInfo> forms,
                      List<URI> scripts,
                      List<ApiEndpoint> scriptEndpoints) {
        public ParsedPage {
            links = List.copyOf(links);
            forms = List.copyOf(forms);
            scripts = List.copyOf(scripts);
            scriptEndpoints = List.copyOf(scriptEndpoints);
        }
    }

    ParsedPage parse(URI pageUrl, String html);
}
