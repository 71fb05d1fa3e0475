package com.labelrun.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelTest {

    @Test
    @DisplayName("fromWire matches exact wire names only")
    void fromWireExactMatch() {
        assertThat(Label.fromWire("Hindu")).isEqualTo(Label.HINDU);
        assertThat(Label.fromWire("Christian")).isEqualTo(Label.CHRISTIAN);
        assertThat(Label.fromWire("Muslim")).isEqualTo(Label.MUSLIM);
        assertThat(Label.fromWire("hindu")).isEqualTo(Label.UNKNOWN);
        assertThat(Label.fromWire("Buddhist")).isEqualTo(Label.UNKNOWN);
        assertThat(Label.fromWire(null)).isEqualTo(Label.UNKNOWN);
    }

    @Test
    @DisplayName("whitelist excludes the UNKNOWN sentinel")
    void whitelistExcludesUnknown() {
        assertThat(Label.whitelist()).containsExactly(Label.HINDU, Label.CHRISTIAN, Label.MUSLIM);
        assertThat(Label.UNKNOWN.isValid()).isFalse();
    }
}
