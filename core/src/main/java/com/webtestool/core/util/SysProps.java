package com.webtestool.core.util;

import java.util.Locale;

/** -Dwt.* 시스템 프로퍼티 파싱 헬퍼. 파싱 실패 시 기본값. */
public final class SysProps {
    private SysProps() {}

    public static int sysInt(String key, int def) {
        try { return Integer.parseInt(System.getProperty(key, String.valueOf(def)).trim()); }
        catch (NumberFormatException e) { return def; }
    }

    public static long sysLong(String key, long def) {
        try { return Long.parseLong(System.getProperty(key, String.valueOf(def)).trim()); }
        catch (NumberFormatException e) { return def; }
    }

    public static boolean sysBool(String key, boolean def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        v = v.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "1", "true", "on", "yes", "y" -> true;
            case "0", "false", "off", "no", "n" -> false;
            default -> def;
        };
    }
}
