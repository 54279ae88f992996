package com.webtestool.core.api;

import com.webtestool.core.error.ModuleException;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.TestContext;

import java.util.Set;

/**
 * 테스트 모듈 계약.
 * 모듈끼리 서로를 참조하지 않으며, 인스턴스는 스캔 1회 동안만 쓰인다.
 */
public interface ITestModule extends AutoCloseable {

    /** 레지스트리 키(소문자, 예: "sql_injection") */
    String name();

    Category category();

    default String description() { return ""; }

    /** 설정 검증/준비. 실패하면 이번 실행에서 제외되고 ERROR 결과가 남는다. */
    default void initialize(ScanConfig config) throws ModuleException {}

    ModuleResult run(TestContext context) throws ModuleException;

    /** 같은 배치에서 함께 돌면 안 되는 모듈 이름(예: 지연 측정과 부하 측정) */
    default Set<String> conflictsWith() { return Set.of(); }

    @Override default void close() {}
}
