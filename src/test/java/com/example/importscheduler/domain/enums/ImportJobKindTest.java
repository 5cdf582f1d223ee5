package com.example.importscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImportJobKind Enum Tests")
class ImportJobKindTest {

    @Test
    @DisplayName("Should lookup by code")
    void shouldLookupByCode() {
        assertThat(ImportJobKind.fromCode("full")).isEqualTo(ImportJobKind.FULL);
        assertThat(ImportJobKind.fromCode("delta")).isEqualTo(ImportJobKind.DELTA);
    }

    @Test
    @DisplayName("Should reject unknown code")
    void shouldRejectUnknownCode() {
        assertThatThrownBy(() -> ImportJobKind.fromCode("partial"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
