package com.example.importscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImportJobStatus Enum Tests")
class ImportJobStatusTest {

    @Test
    @DisplayName("Terminal states should be identified correctly")
    void terminalStatesShouldBeIdentified() {
        assertThat(ImportJobStatus.SUCCESS.isTerminal()).isTrue();
        assertThat(ImportJobStatus.FAILED.isTerminal()).isTrue();

        assertThat(ImportJobStatus.QUEUED.isTerminal()).isFalse();
        assertThat(ImportJobStatus.RUNNING.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Only queued jobs should be claimable")
    void onlyQueuedShouldBeClaimable() {
        assertThat(ImportJobStatus.QUEUED.isClaimable()).isTrue();

        assertThat(ImportJobStatus.RUNNING.isClaimable()).isFalse();
        assertThat(ImportJobStatus.SUCCESS.isClaimable()).isFalse();
        assertThat(ImportJobStatus.FAILED.isClaimable()).isFalse();
    }

    @Test
    @DisplayName("Should lookup by code")
    void shouldLookupByCode() {
        assertThat(ImportJobStatus.fromCode("queued")).isEqualTo(ImportJobStatus.QUEUED);
        assertThat(ImportJobStatus.fromCode("running")).isEqualTo(ImportJobStatus.RUNNING);
        assertThat(ImportJobStatus.fromCode("failed")).isEqualTo(ImportJobStatus.FAILED);
    }

    @Test
    @DisplayName("Should reject unknown code")
    void shouldRejectUnknownCode() {
        assertThatThrownBy(() -> ImportJobStatus.fromCode("paused"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("paused");
    }
}
