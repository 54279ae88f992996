package com.webtestool.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 모듈 1회 실행 결과.
 * PASSED = 발견 없음, FAILED = 발견 1건 이상, ERROR = 실행 실패(errorMessage 필수).
 */
public final class ModuleResult {
    private final String moduleName;
    private final Category category;
    private final TestStatus status;
    private final List<Finding> findings;
    private final Instant startedAt;
    private final Instant endedAt;
    private final String errorMessage;

    private ModuleResult(String moduleName, Category category, TestStatus status, List<Finding> findings,
                         Instant startedAt, Instant endedAt, String errorMessage) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.category = Objects.requireNonNull(category, "category");
        this.status = Objects.requireNonNull(status, "status");
        this.findings = (findings == null) ? List.of() : List.copyOf(findings);
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        Instant end = (endedAt == null) ? startedAt : endedAt;
        this.endedAt = end.isBefore(startedAt) ? startedAt : end;
        if ((status == TestStatus.ERROR) != (errorMessage != null)) {
            throw new IllegalArgumentException("errorMessage must be set iff status is ERROR");
        }
        this.errorMessage = errorMessage;
    }

    /** 정상 종료: 발견 유무로 PASSED/FAILED 결정 */
    public static ModuleResult completed(String name, Category category, List<Finding> findings,
                                         Instant start, Instant end) {
        TestStatus st = (findings == null || findings.isEmpty()) ? TestStatus.PASSED : TestStatus.FAILED;
        return new ModuleResult(name, category, st, findings, start, end, null);
    }

    public static ModuleResult error(String name, Category category, String message, Instant start, Instant end) {
        String msg = (message == null || message.isBlank()) ? "unknown error" : message;
        return new ModuleResult(name, category, TestStatus.ERROR, List.of(), start, end, msg);
    }

    /** 취소 등으로 실행되지 않은 모듈 */
    public static ModuleResult skipped(String name, Category category, Instant at) {
        return new ModuleResult(name, category, TestStatus.SKIPPED, List.of(), at, at, null);
    }

    public String getModuleName() { return moduleName; }
    public Category getCategory() { return category; }
    public TestStatus getStatus() { return status; }
    public List<Finding> getFindings() { return findings; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public String getErrorMessage() { return errorMessage; }

    public long durationMs() {
        return endedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    @Override public String toString() {
        return "ModuleResult{" + moduleName + ", " + status + ", findings=" + findings.size()
                + (errorMessage == null ? "" : ", error=" + errorMessage) + "}";
    }
}
