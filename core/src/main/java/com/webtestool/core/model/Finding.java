package com.webtestool.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 모듈이 보고하는 단일 이슈. 생성 후 불변. */
public final class Finding {
    private final String title;
    private final Severity severity;
    private final String description;
    private final Map<String, String> evidence;   // 순서 유지
    private final String module;
    private final URI url;                        // nullable(사이트 전역 이슈)
    private final String cweId;                   // 예: CWE-89
    private final String owaspCategory;           // 예: A03:2021-Injection
    private final String recommendation;
    private final Instant detectedAt;

    private Finding(Builder b) {
        this.title = b.title;
        this.severity = b.severity;
        this.description = (b.description == null) ? "" : b.description;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(b.evidence));
        this.module = b.module;
        this.url = b.url;
        this.cweId = b.cweId;
        this.owaspCategory = b.owaspCategory;
        this.recommendation = b.recommendation;
        this.detectedAt = (b.detectedAt == null ? Instant.now() : b.detectedAt);
    }

    public String getTitle() { return title; }
    public Severity getSeverity() { return severity; }
    public String getDescription() { return description; }
    public Map<String, String> getEvidence() { return evidence; }
    public String getModule() { return module; }
    public URI getUrl() { return url; }
    public String getCweId() { return cweId; }
    public String getOwaspCategory() { return owaspCategory; }
    public String getRecommendation() { return recommendation; }
    public Instant getDetectedAt() { return detectedAt; }

    /** 분류 태그(CWE 우선, 없으면 OWASP). 없으면 null */
    public String classification() {
        return (cweId != null) ? cweId : owaspCategory;
    }

    /**
     * 시각을 제외한 동일성 키. 같은 입력에 대한 반복 실행 비교에 쓴다.
     * 측정값처럼 실행마다 달라지는 evidence 는 모듈이 "~Ms" 접미사 키로 둔다(비교 제외).
     */
    public String identity() {
        StringBuilder sb = new StringBuilder(96)
                .append(module).append('|').append(severity).append('|').append(title)
                .append('|').append(url == null ? "" : url);
        evidence.forEach((k, v) -> {
            if (!k.endsWith("Ms")) sb.append('|').append(k).append('=').append(v);
        });
        return sb.toString();
    }

    @Override public String toString() {
        return "Finding{" + severity.label() + ", " + module + ", " + title + (url == null ? "" : ", " + url) + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title;
        private Severity severity;
        private String description;
        private final Map<String, String> evidence = new LinkedHashMap<>();
        private String module;
        private URI url;
        private String cweId;
        private String owaspCategory;
        private String recommendation;
        private Instant detectedAt;

        public Builder title(String title) { this.title = title; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder evidence(String key, Object value) {
            if (key != null) evidence.put(key, String.valueOf(value));
            return this;
        }
        public Builder evidence(Map<String, String> all) {
            if (all != null) evidence.putAll(all);
            return this;
        }
        public Builder module(String module) { this.module = module; return this; }
        public Builder url(URI url) { this.url = url; return this; }
        public Builder cweId(String cweId) { this.cweId = cweId; return this; }
        public Builder owaspCategory(String owaspCategory) { this.owaspCategory = owaspCategory; return this; }
        public Builder recommendation(String recommendation) { this.recommendation = recommendation; return this; }
        public Builder detectedAt(Instant detectedAt) { this.detectedAt = detectedAt; return this; }

        public Finding build() {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(module, "module");
            return new Finding(this);
        }
    }
}
