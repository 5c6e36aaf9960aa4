package com.example.clubadmin.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyParserTest {

    @Test
    void acceptsDollarSignAndThousandsSeparators() {
        assertThat(MoneyParser.parse("$1,234.5")).isEqualByComparingTo("1234.50");
        assertThat(MoneyParser.parse(" 45 ")).isEqualTo(new BigDecimal("45.00"));
        assertThat(MoneyParser.parse(".75")).isEqualTo(new BigDecimal("0.75"));
    }

    @Test
    void rejectsGarbageAndSubCentPrecision() {
        for (String raw : new String[]{"", "abc", "12.345", "1.2.3", "$", null}) {
            assertThatThrownBy(() -> MoneyParser.parse(raw))
                    .as("input %s", raw)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid amount format");
        }
    }

    @Test
    void positiveRequiresMoreThanZero() {
        assertThat(MoneyParser.parsePositive("0.01")).isEqualByComparingTo("0.01");
        assertThatThrownBy(() -> MoneyParser.parsePositive("0")).hasMessage("must be positive");
        assertThatThrownBy(() -> MoneyParser.parsePositive("-5")).hasMessage("must be positive");
        assertThatThrownBy(() -> MoneyParser.parsePositive("five")).hasMessage("invalid amount format");
    }
}
