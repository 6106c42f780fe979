package com.httpretry.core.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    @Test
    void fields_keep_order_and_pair_up_key_values() {
        Map<String, Object> m = StructuredLog.get(StructuredLogTest.class)
                .fields(Level.INFO, "retry-attempt", null, "attempt", 2, "status", 503);

        assertThat(m.keySet()).containsExactly("ts", "lvl", "comp", "thread", "event", "attempt", "status");
        assertThat(m.get("comp")).isEqualTo("StructuredLogTest");
        assertThat(m.get("event")).isEqualTo("retry-attempt");
    }

    @Test
    void odd_key_values_are_flagged() {
        Map<String, Object> m = StructuredLog.get(StructuredLogTest.class)
                .fields(Level.FINE, "e", null, "dangling");
        assertThat(m).containsEntry("_kv_mismatch", true);
    }

    @Test
    void error_fields_carry_exception_type_and_message() {
        Map<String, Object> m = StructuredLog.get(StructuredLogTest.class)
                .fields(Level.SEVERE, "e", new IllegalStateException("bad"));
        assertThat(m).containsEntry("error", "IllegalStateException").containsEntry("message", "bad");
    }

    @Test
    void toJson_escapes_strings_and_keeps_numbers_raw() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("uri", "http://h/\"q\"\n");
        m.put("attempt", 3);
        m.put("retryable", true);
        m.put("status", null);

        assertThat(StructuredLog.toJson(m))
                .isEqualTo("{\"uri\":\"http://h/\\\"q\\\"\\n\",\"attempt\":3,\"retryable\":true,\"status\":null}");
    }
}
