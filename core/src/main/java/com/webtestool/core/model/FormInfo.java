package com.webtestool.core.model;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** 페이지에서 추출한 폼. action 은 페이지 기준으로 해석된 절대 URL. */
public record FormInfo(URI action, String method, List<FormField> fields) {

    public FormInfo {
        Objects.requireNonNull(action, "action");
        method = (method == null || method.isBlank()) ? "GET" : method.toUpperCase(Locale.ROOT);
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }

    /** POST/PUT/PATCH/DELETE → 상태 변경 폼 */
    public boolean isStateChanging() {
        return switch (method) {
            case "POST", "PUT", "PATCH", "DELETE" -> true;
            default -> false;
        };
    }

    /** 이름 대소문자 무시 */
    public boolean hasField(String name) {
        if (name == null) return false;
        for (FormField f : fields) {
            if (f.name() != null && f.name().equalsIgnoreCase(name)) return true;
        }
        return false;
    }
}
