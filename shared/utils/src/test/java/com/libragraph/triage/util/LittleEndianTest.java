package com.libragraph.triage.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class LittleEndianTest {

    @Test
    void shouldReadUnsignedFields() {
        byte[] b = {(byte) 0xFE, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x01, 0, 0, 0};

        assertThat(LittleEndian.u16(b, 0)).isEqualTo(0xFFFE);
        assertThat(LittleEndian.u32(b, 0)).isEqualTo(0xFFFFFFFEL);
        assertThat(LittleEndian.i32(b, 0)).isEqualTo(-2);
        assertThat(LittleEndian.i64(b, 0)).isEqualTo(0x1FFFFFFFEL);
    }

    @Test
    void shouldSignExtendVariableWidthValues() {
        byte[] b = {(byte) 0xF0, (byte) 0xFF};

        assertThat(LittleEndian.signedN(b, 0, 2)).isEqualTo(-16);
        assertThat(LittleEndian.unsignedN(b, 0, 2)).isEqualTo(0xFFF0);
        assertThat(LittleEndian.signedN(new byte[]{0x10}, 0, 1)).isEqualTo(16);
    }

    @Test
    void shouldWriteWhatItReads() {
        byte[] b = new byte[16];
        LittleEndian.putU16(b, 0, 0xBEEF);
        LittleEndian.putU32(b, 2, 0xCAFEBABEL);
        LittleEndian.putI64(b, 6, -42L);

        assertThat(LittleEndian.u16(b, 0)).isEqualTo(0xBEEF);
        assertThat(LittleEndian.u32(b, 2)).isEqualTo(0xCAFEBABEL);
        assertThat(LittleEndian.i64(b, 6)).isEqualTo(-42L);
    }

    @Test
    void shouldDecodeUtf16UntilNul() {
        byte[] text = "Users\0junk".getBytes(StandardCharsets.UTF_16LE);

        assertThat(LittleEndian.utf16(text, 0, text.length)).isEqualTo("Users");
        assertThat(LittleEndian.utf16z(text, 0)).isEqualTo("Users");
    }

    @Test
    void shouldRejectOutOfBoundsFields() {
        assertThatThrownBy(() -> LittleEndian.u32(new byte[3], 0))
                .isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessageContaining("outside structure");
    }
}
