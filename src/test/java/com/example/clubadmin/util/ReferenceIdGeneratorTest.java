package com.example.clubadmin.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceIdGeneratorTest {

    private final ReferenceIdGenerator generator =
            new ReferenceIdGenerator(Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void generatedIdsCarryPrefixDateAndValidChecksum() {
        for (String prefix : ReferenceIdGenerator.PREFIXES) {
            String id = generator.generate(prefix);
            assertThat(id).startsWith(prefix + "-240115-").hasSize(16);
            assertThat(ReferenceIdGenerator.validate(id)).isEmpty();
        }
    }

    @Test
    void randomPartAvoidsLookAlikeCharacters() {
        for (int i = 0; i < 200; i++) {
            String random = generator.generate("PMT").substring(11, 15);
            assertThat(random).doesNotContain("O", "I", "0", "1");
        }
    }

    @Test
    void unknownPrefixIsRejected() {
        assertThatThrownBy(() -> generator.generate("ABC"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid prefix: ABC");
    }

    @Test
    void checksumIsCharacterSumModulo36() {
        // 808 % 36 = 16 -> 'G'
        assertThat(ReferenceIdGenerator.computeChecksum("PMT240115ABCD")).isEqualTo("G");
        assertThat(ReferenceIdGenerator.isValid("PMT-240115-ABCDG")).isTrue();
    }

    @Test
    void validationReportsTheFirstProblem() {
        assertThat(ReferenceIdGenerator.validate("pmt-240115-ABCDG")).contains("Invalid format");
        assertThat(ReferenceIdGenerator.validate("PMT-2401-ABCDG")).contains("Invalid format");
        assertThat(ReferenceIdGenerator.validate(null)).contains("Invalid format");
        assertThat(ReferenceIdGenerator.validate("XYZ-240115-ABCDG")).contains("Invalid prefix");
        assertThat(ReferenceIdGenerator.validate("PMT-240115-ABCOX")).contains("Invalid random part");
        assertThat(ReferenceIdGenerator.validate("PMT-240115-ABCDH")).contains("Checksum validation failed");
    }
}
