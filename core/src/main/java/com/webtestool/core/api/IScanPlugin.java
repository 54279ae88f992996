package com.webtestool.core.api;

import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.ScanResult;

import java.util.List;
import java.util.Map;

/**
 * 스캔 전/후 훅과 사용자 정의 모듈 제공자. 명시적으로 등록한다.
 * 훅에서 던진 예외는 로그만 남고 스캔을 멈추지 않는다.
 */
public interface IScanPlugin {

    String name();

    /** 반환한 값은 TestContext.pluginContext 에 합쳐진다 */
    default Map<String, Object> preScan(ScanConfig config) { return Map.of(); }

    default void postScan(ScanResult result) {}

    /** 레지스트리에 먼저 등록될 모듈들 */
    default List<ITestModule> customModules() { return List.of(); }
}
