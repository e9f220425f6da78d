package org.sanchez.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TintColorTest {

    @Test
    void fromHexString_parsesSixDigitsWithOptionalHash() {
        assertThat(TintColor.fromHexString("5ebfff")).isEqualTo(new TintColor(0x5e, 0xbf, 0xff, 255));
        assertThat(TintColor.fromHexString("#5EBFFF")).isEqualTo(new TintColor(0x5e, 0xbf, 0xff, 255));
    }

    @Test
    void fromHexString_expandsShortForm() {
        assertThat(TintColor.fromHexString("#f80")).isEqualTo(new TintColor(0xff, 0x88, 0x00, 255));
    }

    @Test
    void fromHexString_readsAlphaFromEightDigits() {
        assertThat(TintColor.fromHexString("10203040")).isEqualTo(new TintColor(0x10, 0x20, 0x30, 0x40));
    }

    @Test
    void fromHexString_rejectsMalformedInput() {
        assertThatThrownBy(() -> TintColor.fromHexString("12345"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TintColor.fromHexString("zzzzzz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zzzzzz");
        assertThatThrownBy(() -> TintColor.fromHexString(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toHexString_writesLowercaseRgba() {
        assertThat(new TintColor(0x5e, 0xbf, 0xff, 255).toHexString()).isEqualTo("5ebfffff");
    }
}
