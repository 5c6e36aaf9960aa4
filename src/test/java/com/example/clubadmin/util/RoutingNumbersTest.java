package com.example.clubadmin.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingNumbersTest {

    @Test
    void knownRoutingNumbersPassTheChecksum() {
        assertThat(RoutingNumbers.isValidChecksum("011000015")).isTrue();
        assertThat(RoutingNumbers.isValidChecksum("021000021")).isTrue();
    }

    @Test
    void wrongCheckDigitFails() {
        assertThat(RoutingNumbers.isValidChecksum("011000016")).isFalse();
        assertThat(RoutingNumbers.isValidChecksum("123456789")).isFalse();
    }

    @Test
    void onlyNineDigitsQualify() {
        assertThat(RoutingNumbers.hasNineDigits("02100002")).isFalse();
        assertThat(RoutingNumbers.hasNineDigits("02100002A")).isFalse();
        assertThat(RoutingNumbers.hasNineDigits(null)).isFalse();
        assertThat(RoutingNumbers.isValidChecksum("0210000210")).isFalse();
    }
}
