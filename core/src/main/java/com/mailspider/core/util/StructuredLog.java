package com.mailspider.core.util;

import java.time.Clock;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트를 JSON 한 줄로 JUL 에 남긴다. 핸들러/레벨은 LogSetup 이 정한다.
 * 예: {"ts":"...","lvl":"FINE","comp":"Crawler","thread":"main","event":"visit","url":"...","depth":1}
 * kvs 는 key, value 를 번갈아 넘긴다. Iterable 값은 문자열 배열로 찍힌다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Clock clock;

    private StructuredLog(Class<?> owner, Clock clock) {
        this.jul = Logger.getLogger(owner.getName());
        this.comp = owner.getSimpleName();
        this.clock = clock;
    }

    public static StructuredLog get(Class<?> owner) {
        return new StructuredLog(owner, Clock.systemUTC());
    }

    static StructuredLog get(Class<?> owner, Clock clock) {
        return new StructuredLog(owner, clock);
    }

    /** 크롤 결정(방문/스킵/추출 등). FINE */
    public void debug(String event, Object... kvs) { emit(Level.FINE, event, kvs); }

    /** 실행 단위 요약(예산 소진, 추출 완료). INFO */
    public void info(String event, Object... kvs) { emit(Level.INFO, event, kvs); }

    private void emit(Level lvl, String event, Object... kvs) {
        if (jul.isLoggable(lvl)) jul.log(lvl, toJson(lvl, event, kvs));
    }

    String toJson(Level lvl, String event, Object... kvs) {
        JsonLine line = new JsonLine()
                .field("ts", Instant.now(clock))
                .field("lvl", lvl.getName())
                .field("comp", comp)
                .field("thread", Thread.currentThread().getName())
                .field("event", event);
        if (kvs != null) {
            int pairs = kvs.length / 2;
            for (int p = 0; p < pairs; p++) line.field(String.valueOf(kvs[2 * p]), kvs[2 * p + 1]);
            if (kvs.length % 2 != 0) line.field("_kv_mismatch", true);
        }
        return line.close();
    }

    /** "{k:v,k:v}" 누적기 */
    private static final class JsonLine {
        private final StringBuilder sb = new StringBuilder(160).append('{');
        private boolean first = true;

        JsonLine field(String key, Object value) {
            if (!first) sb.append(',');
            first = false;
            quoted(key);
            sb.append(':');
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Iterable<?> items) {
                sb.append('[');
                String sep = "";
                for (Object item : items) {
                    sb.append(sep);
                    quoted(String.valueOf(item));
                    sep = ",";
                }
                sb.append(']');
            } else {
                quoted(String.valueOf(value));
            }
            return this;
        }

        private void quoted(String s) {
            sb.append('"').append(esc(s)).append('"');
        }

        String close() {
            return sb.append('}').toString();
        }
    }

    static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (c == '"' || c == '\\') r.append('\\').append(c);
            else if (c == '\n') r.append("\\n");
            else if (c == '\r') r.append("\\r");
            else if (c == '\t') r.append("\\t");
            else if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
            else r.append(c);
        }
        return r.toString();
    }
}
