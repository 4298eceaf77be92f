package com.bundleradar.domain;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class TxTypeTest {

    private final Locale original = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(original);
    }

    @Test
    @DisplayName("upstream side strings map case-insensitively, unknown sides map to null")
    void fromWire() {
        assertThat(TxType.fromWire("buy")).isEqualTo(TxType.BUY);
        assertThat(TxType.fromWire(" SELL ")).isEqualTo(TxType.SELL);
        assertThat(TxType.fromWire("add_liquidity")).isNull();
        assertThat(TxType.fromWire("")).isNull();
        assertThat(TxType.fromWire(null)).isNull();
    }

    @Test
    @DisplayName("mapping does not depend on the default locale")
    void fromWireUnderTurkishLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertThat(TxType.fromWire("BUY")).isEqualTo(TxType.BUY);
        assertThat(TxType.fromWire("Sell")).isEqualTo(TxType.SELL);
    }
}
