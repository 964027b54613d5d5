package com.libragraph.triage.util;

import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked little-endian field access over byte arrays, the layout of
 * every on-disk Windows structure the formats module decodes.
 * Out-of-bounds access throws {@link IndexOutOfBoundsException}.
 */
public final class LittleEndian {

    private LittleEndian() {
    }

    public static int u8(byte[] b, int off) {
        check(b, off, 1);
        return b[off] & 0xFF;
    }

    public static int u16(byte[] b, int off) {
        check(b, off, 2);
        return (b[off] & 0xFF) | (b[off + 1] & 0xFF) << 8;
    }

    public static int i32(byte[] b, int off) {
        check(b, off, 4);
        return (b[off] & 0xFF)
                | (b[off + 1] & 0xFF) << 8
                | (b[off + 2] & 0xFF) << 16
                | (b[off + 3] & 0xFF) << 24;
    }

    public static long u32(byte[] b, int off) {
        return i32(b, off) & 0xFFFFFFFFL;
    }

    public static long i64(byte[] b, int off) {
        check(b, off, 8);
        return (u32(b, off)) | (u32(b, off + 4) << 32);
    }

    /** Unsigned 48-bit value, as used by NTFS file references. */
    public static long u48(byte[] b, int off) {
        check(b, off, 6);
        return u32(b, off) | ((long) u16(b, off + 4) << 32);
    }

    /** Reads {@code len} bytes as a little-endian signed integer (1..8 bytes). */
    public static long signedN(byte[] b, int off, int len) {
        check(b, off, len);
        long v = 0;
        for (int i = len - 1; i >= 0; i--) {
            v = (v << 8) | (b[off + i] & 0xFF);
        }
        int shift = 64 - len * 8;
        return shift == 0 ? v : (v << shift) >> shift;
    }

    /** Reads {@code len} bytes as a little-endian unsigned integer (1..8 bytes). */
    public static long unsignedN(byte[] b, int off, int len) {
        check(b, off, len);
        long v = 0;
        for (int i = len - 1; i >= 0; i--) {
            v = (v << 8) | (b[off + i] & 0xFF);
        }
        return v;
    }

    public static void putU16(byte[] b, int off, int value) {
        check(b, off, 2);
        b[off] = (byte) value;
        b[off + 1] = (byte) (value >>> 8);
    }

    public static void putU32(byte[] b, int off, long value) {
        check(b, off, 4);
        for (int i = 0; i < 4; i++) b[off + i] = (byte) (value >>> (8 * i));
    }

    public static void putI64(byte[] b, int off, long value) {
        check(b, off, 8);
        for (int i = 0; i < 8; i++) b[off + i] = (byte) (value >>> (8 * i));
    }

    /** Decodes UTF-16LE text of {@code byteLen} bytes, stopping at the first NUL. */
    public static String utf16(byte[] b, int off, int byteLen) {
        check(b, off, byteLen);
        int end = off;
        while (end + 1 < off + byteLen && (b[end] != 0 || b[end + 1] != 0)) end += 2;
        return new String(b, off, end - off, StandardCharsets.UTF_16LE);
    }

    /** Decodes NUL-terminated UTF-16LE text starting at {@code off}. */
    public static String utf16z(byte[] b, int off) {
        int end = off;
        while (end + 1 < b.length && (b[end] != 0 || b[end + 1] != 0)) end += 2;
        return new String(b, off, end - off, StandardCharsets.UTF_16LE);
    }

    /** Decodes single-byte text of at most {@code byteLen} bytes, stopping at the first NUL. */
    public static String ascii(byte[] b, int off, int byteLen) {
        check(b, off, byteLen);
        int end = off;
        while (end < off + byteLen && b[end] != 0) end++;
        return new String(b, off, end - off, StandardCharsets.ISO_8859_1);
    }

    public static boolean startsWith(byte[] b, int off, byte[] magic) {
        if (off < 0 || off + magic.length > b.length) return false;
        for (int i = 0; i < magic.length; i++) {
            if (b[off + i] != magic[i]) return false;
        }
        return true;
    }

    private static void check(byte[] b, int off, int len) {
        if (off < 0 || len < 0 || off + len > b.length) {
            throw new IndexOutOfBoundsException(
                    "Field [" + off + ", " + (off + len) + ") outside structure of " + b.length + " bytes");
        }
    }
}
