package com.webtestool.core.module;

import com.webtestool.core.api.ITestModule;
import com.webtestool.core.error.SetupException;
import com.webtestool.core.model.ScanConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 이름 → 모듈 팩토리 표. 클래스패스 스캔 없이 명시적으로 등록한다.
 * resolve() 는 스캔마다 새 인스턴스를 만든다.
 */
public final class ModuleRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ModuleRegistry.class);

    private final Map<String, Supplier<? extends ITestModule>> factories = new LinkedHashMap<>();

    /** 내장 모듈이 등록된 레지스트리 */
    public static ModuleRegistry withBuiltins() {
        ModuleRegistry r = new ModuleRegistry();
        BuiltinModules.registerAll(r);
        return r;
    }

    public synchronized ModuleRegistry register(String name, Supplier<? extends ITestModule> factory) {
        Objects.requireNonNull(factory, "factory");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("module name required");
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("module already registered: " + name);
        }
        return this;
    }

    /** 플러그인 모듈: 이미 만들어진 인스턴스를 그대로 쓴다 */
    public synchronized ModuleRegistry registerInstance(ITestModule module) {
        return register(module.name(), () -> module);
    }

    /**
     * 플러그인 모듈을 먼저 등록한 스캔 전용 사본.
     * 이름이 겹치면 SetupException.
     */
    public synchronized ModuleRegistry withPluginModules(List<ITestModule> pluginModules) {
        ModuleRegistry r = new ModuleRegistry();
        for (ITestModule m : pluginModules) {
            if (factories.containsKey(m.name()) || r.factories.containsKey(m.name())) {
                throw new SetupException("plugin module name clashes with a registered module: " + m.name());
            }
            r.registerInstance(m);
        }
        r.factories.putAll(factories);
        return r;
    }

    public synchronized boolean contains(String name) { return factories.containsKey(name); }

    public synchronized Set<String> names() { return Set.copyOf(factories.keySet()); }

    /** 등록 순서를 유지한 이름 목록 */
    public synchronized List<String> orderedNames() { return List.copyOf(factories.keySet()); }

    /**
     * 명시 목록이 있으면 그 순서대로, 없으면 프로필.
     * 알 수 없는 이름 → SetupException(스캔 FAILED).
     */
    public synchronized List<ITestModule> resolve(ScanConfig.ModulesCfg cfg) {
        List<String> wanted = (cfg.getNames() != null && !cfg.getNames().isEmpty())
                ? cfg.getNames()
                : ModuleProfiles.namesFor(cfg.getProfile());

        List<String> unknown = new ArrayList<>();
        for (String n : wanted) if (!factories.containsKey(n)) unknown.add(n);
        if (!unknown.isEmpty()) {
            throw new SetupException("unknown module(s): " + unknown + " (available: " + factories.keySet() + ")");
        }

        List<ITestModule> out = new ArrayList<>();
        for (String n : new LinkedHashSet<>(wanted)) {
            ITestModule m = factories.get(n).get();
            if (!n.equals(m.name())) {
                throw new SetupException("module factory '" + n + "' produced '" + m.name() + "'");
            }
            out.add(m);
        }
        LOG.debug("resolved modules: {}", wanted);
        return out;
    }
}
