package com.example.reelbot_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderStateTest {

    @Test
    void wireStringsAreCaseInsensitive() {
        assertThat(ProviderState.fromWire("IN_QUEUE")).isEqualTo(ProviderState.IN_QUEUE);
        assertThat(ProviderState.fromWire(" in_progress ")).isEqualTo(ProviderState.IN_PROGRESS);
        assertThat(ProviderState.fromWire("OK")).isEqualTo(ProviderState.COMPLETED);
        assertThat(ProviderState.fromWire("error")).isEqualTo(ProviderState.FAILED);
    }

    @Test
    void unknownStateIsRejected() {
        assertThatThrownBy(() -> ProviderState.fromWire("paused"))
                .isInstanceOf(UnknownProviderStateException.class)
                .hasMessageContaining("paused");
        assertThatThrownBy(() -> ProviderState.fromWire(null))
                .isInstanceOf(UnknownProviderStateException.class);
    }
}
