package com.webtestool.core.module;

import com.webtestool.core.error.SetupException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 미리 정의된 모듈 묶음 */
public final class ModuleProfiles {
    private ModuleProfiles() {}

    public static final String QUICK = "quick";
    public static final String SECURITY = "security";
    public static final String FULL = "full";

    private static final Map<String, List<String>> PROFILES = new LinkedHashMap<>();
    static {
        PROFILES.put(QUICK, List.of(BuiltinModules.SECURITY_HEADERS, BuiltinModules.SEO, BuiltinModules.PERFORMANCE));
        PROFILES.put(SECURITY, List.of(BuiltinModules.SECURITY_HEADERS, BuiltinModules.SQL_INJECTION,
                BuiltinModules.XSS, BuiltinModules.CSRF, BuiltinModules.OPEN_REDIRECT, BuiltinModules.CORS));
        PROFILES.put(FULL, BuiltinModules.ALL);
    }

    public static List<String> namesFor(String profile) {
        List<String> names = (profile == null) ? null : PROFILES.get(profile);
        if (names == null) {
            throw new SetupException("unknown profile: " + profile + " (available: " + PROFILES.keySet() + ")");
        }
        return names;
    }

    public static boolean exists(String profile) { return profile != null && PROFILES.containsKey(profile); }
}
