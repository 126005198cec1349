package com.civic.realtime.service.transport;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowFilterTest {

    @Test
    void nullOrBlankMatchesEverything() {
        assertThat(RowFilter.parse(null).matches(Map.of("id", 1))).isTrue();
        assertThat(RowFilter.parse("  ").matches(Map.of())).isTrue();
    }

    @Test
    void equality() {
        RowFilter filter = RowFilter.parse("campaign_id=eq.42");

        assertThat(filter.matches(Map.of("campaign_id", 42))).isTrue();
        assertThat(filter.matches(Map.of("campaign_id", "42"))).isTrue();
        assertThat(filter.matches(Map.of("campaign_id", 7))).isFalse();
        assertThat(filter.matches(Map.of("other", 42))).isFalse();
    }

    @Test
    void inequalityMatchesMissingColumns() {
        RowFilter filter = RowFilter.parse("status=neq.closed");

        assertThat(filter.matches(Map.of("status", "open"))).isTrue();
        assertThat(filter.matches(Map.of("status", "closed"))).isFalse();

        Map<String, Object> nullStatus = new HashMap<>();
        nullStatus.put("status", null);
        assertThat(filter.matches(nullStatus)).isTrue();
    }

    @Test
    void membership() {
        RowFilter filter = RowFilter.parse("ward=in.(3, 5,8)");

        assertThat(filter.matches(Map.of("ward", 5))).isTrue();
        assertThat(filter.matches(Map.of("ward", "8"))).isTrue();
        assertThat(filter.matches(Map.of("ward", 4))).isFalse();
    }

    @Test
    void valuesMayContainDots() {
        assertThat(RowFilter.parse("email=eq.a.b@example.org").matches(Map.of("email", "a.b@example.org"))).isTrue();
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThatThrownBy(() -> RowFilter.parse("campaign_id")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RowFilter.parse("=eq.1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RowFilter.parse("a=gt.1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RowFilter.parse("a=in.1,2")).isInstanceOf(IllegalArgumentException.class);
    }
}
