package com.levstrat.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressUtilTest {

    private static final String MIXED = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";

    @Test
    void normalize_lowercases() {
        assertThat(AddressUtil.normalize(MIXED)).isEqualTo("0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2");
    }

    @Test
    void normalize_rejectsMalformed() {
        assertThatThrownBy(() -> AddressUtil.normalize(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AddressUtil.normalize("c02aaa39b223fe8d0a0e5c4f27ead9083c756cc2"))
                .hasMessageContaining("0x");
        assertThatThrownBy(() -> AddressUtil.normalize("0x1234")).hasMessageContaining("length");
        assertThatThrownBy(() -> AddressUtil.normalize("0xg02aaa39b223fe8d0a0e5c4f27ead9083c756cc2"))
                .hasMessageContaining("hex");
    }

    @Test
    void isZero_treatsNullBlankAndZeroAddressAsAbsent() {
        assertThat(AddressUtil.isZero(null)).isTrue();
        assertThat(AddressUtil.isZero(" ")).isTrue();
        assertThat(AddressUtil.isZero(AddressUtil.ZERO)).isTrue();
        assertThat(AddressUtil.isZero(MIXED)).isFalse();
        assertThat(AddressUtil.normalizeOrZero("")).isEqualTo(AddressUtil.ZERO);
    }

    @Test
    void same_ignoresCaseButNeverMatchesZero() {
        assertThat(AddressUtil.same(MIXED, MIXED.toLowerCase())).isTrue();
        assertThat(AddressUtil.same(AddressUtil.ZERO, AddressUtil.ZERO)).isFalse();
        assertThat(AddressUtil.same(null, MIXED)).isFalse();
    }
}
