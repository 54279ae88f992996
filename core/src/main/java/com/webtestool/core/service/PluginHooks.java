package com.webtestool.core.service;

import com.webtestool.core.api.IScanPlugin;
import com.webtestool.core.api.ITestModule;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.ScanResult;
import com.webtestool.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 플러그인 훅 호출기. 훅 실패는 로그만 남기고 다음 플러그인으로 넘어간다.
 */
public final class PluginHooks {
    private static final Logger LOG = LoggerFactory.getLogger(PluginHooks.class);
    private static final StructuredLog SLOG = StructuredLog.get(PluginHooks.class);

    private final List<IScanPlugin> plugins;

    public PluginHooks(List<IScanPlugin> plugins) {
        this.plugins = (plugins == null) ? List.of() : List.copyOf(plugins);
    }

    public boolean isEmpty() { return plugins.isEmpty(); }

    /** 등록 순서대로 합친다(같은 키는 나중 플러그인이 덮어씀) */
    public Map<String, Object> preScan(ScanConfig config) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (IScanPlugin p : plugins) {
            try {
                Map<String, Object> add = p.preScan(config);
                if (add != null) merged.putAll(add);
            } catch (RuntimeException e) {
                hookFailed(p, "preScan", e);
            }
        }
        return merged;
    }

    public void postScan(ScanResult result) {
        for (IScanPlugin p : plugins) {
            try {
                p.postScan(result);
            } catch (RuntimeException e) {
                hookFailed(p, "postScan", e);
            }
        }
    }

    public List<ITestModule> customModules() {
        List<ITestModule> out = new ArrayList<>();
        for (IScanPlugin p : plugins) {
            try {
                List<ITestModule> ms = p.customModules();
                if (ms != null) out.addAll(ms);
            } catch (RuntimeException e) {
                hookFailed(p, "customModules", e);
            }
        }
        return out;
    }

    private static void hookFailed(IScanPlugin p, String hook, RuntimeException e) {
        String name = safeName(p);
        LOG.warn("plugin {} {} failed: {}", name, hook, e.toString());
        SLOG.warn("plugin-hook-failed", e, "plugin", name, "hook", hook);
    }

    private static String safeName(IScanPlugin p) {
        try {
            return p.name();
        } catch (RuntimeException e) {
            return p.getClass().getName();
        }
    }
}
