package com.httpretry.core.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 위).
 * 한 줄 = 이벤트 하나: {"ts":..,"lvl":..,"comp":..,"thread":..,"event":..,<kvs>}
 * kvs는 "key", value, "key", value ... 순서로 넘긴다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(fields(lvl, event, t, kvs));
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    Map<String, Object> fields(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl.getName());
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) m.put(String.valueOf(kvs[i]), kvs[i + 1]);
            if (kvs.length % 2 == 1) m.put("_kv_mismatch", true);
        }
        if (t != null) {
            m.put("error", t.getClass().getSimpleName());
            m.put("message", t.getMessage());
        }
        return m;
    }

    static String toJson(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(160).append('{');
        boolean first = true;
        for (var e : fields.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            quote(sb, e.getKey()).append(':');
            Object v = e.getValue();
            if (v == null) sb.append("null");
            else if (v instanceof Number || v instanceof Boolean) sb.append(v);
            else quote(sb, String.valueOf(v));
        }
        return sb.append('}').toString();
    }

    private static StringBuilder quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"');
    }
}
