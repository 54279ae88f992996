package com.webtestool.core.util;

import java.time.Instant;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 위).
 * LoggingConfigurator 로 핸들러를 잡은 뒤 호출하면 한 줄 JSON 으로 찍힌다.
 * {@link #bind(Object...)} 로 scan/module 등 고정 키를 붙인 파생 로거를 만든다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Object[] bound; // 항상 앞에 붙는 key/value

    private StructuredLog(Logger jul, String comp, Object[] bound) {
        this.jul = jul;
        this.comp = comp;
        this.bound = bound;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), new Object[0]);
    }

    /** 고정 key/value 를 덧붙인 파생 로거 */
    public StructuredLog bind(Object... kvs) {
        if (kvs == null || kvs.length == 0) return this;
        Object[] merged = Arrays.copyOf(bound, bound.length + kvs.length);
        System.arraycopy(kvs, 0, merged, bound.length, kvs.length);
        return new StructuredLog(jul, comp, merged);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void warn (String event, Throwable t, Object... kvs) { log(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE,  event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160).append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.getName());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);
        pairs(sb, bound);
        pairs(sb, kvs);
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void pairs(StringBuilder sb, Object[] kvs) {
        if (kvs == null || kvs.length == 0) return;
        for (int i = 0; i + 1 < kvs.length; i += 2) {
            kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append("\":");
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> r.append("\\\"");
                case '\\' -> r.append("\\\\");
                case '\n' -> r.append("\\n");
                case '\r' -> r.append("\\r");
                case '\t' -> r.append("\\t");
                default -> {
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
                }
            }
        }
        return r.toString();
    }
}
