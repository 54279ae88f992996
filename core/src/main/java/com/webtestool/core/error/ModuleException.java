package com.webtestool.core.error;

/** 테스트 모듈의 initialize/run 실패. ModuleResult(status=ERROR)로 기록된다. */
public class ModuleException extends Exception {
    private final String moduleName;

    public ModuleException(String moduleName, String message) {
        super(message);
        this.moduleName = moduleName;
    }

    public ModuleException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    public String getModuleName() { return moduleName; }
}
