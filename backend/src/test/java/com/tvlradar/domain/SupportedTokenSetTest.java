package com.tvlradar.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SupportedTokenSetTest {

    @Test
    @DisplayName("membership ignores case and blank entries are dropped")
    void caseInsensitiveMembership() {
        SupportedTokenSet set = SupportedTokenSet.of(Arrays.asList("0xAAA", " 0xbbb ", "", null));

        assertThat(set.contains("0xaaa")).isTrue();
        assertThat(set.contains("0xBBB")).isTrue();
        assertThat(set.contains("0xccc")).isFalse();
        assertThat(set.contains(null)).isFalse();
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("null or empty input is the empty set")
    void emptyInput() {
        assertThat(SupportedTokenSet.of(null).isEmpty()).isTrue();
        assertThat(SupportedTokenSet.of(List.of())).isSameAs(SupportedTokenSet.empty());
    }
}
