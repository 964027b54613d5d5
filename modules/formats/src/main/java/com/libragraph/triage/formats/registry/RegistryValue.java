package com.libragraph.triage.formats.registry;

import com.libragraph.triage.util.LittleEndian;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * A named registry value with its raw data.
 */
public record RegistryValue(String name, int type, byte[] data) {

    public static final int REG_NONE = 0;
    public static final int REG_SZ = 1;
    public static final int REG_EXPAND_SZ = 2;
    public static final int REG_BINARY = 3;
    public static final int REG_DWORD = 4;
    public static final int REG_DWORD_BIG_ENDIAN = 5;
    public static final int REG_MULTI_SZ = 7;
    public static final int REG_QWORD = 11;

    public boolean isString() {
        return type == REG_SZ || type == REG_EXPAND_SZ;
    }

    /** UTF-16LE text up to the first NUL. Works for REG_SZ and REG_EXPAND_SZ. */
    public String asString() {
        return LittleEndian.utf16(data, 0, data.length & ~1);
    }

    public List<String> asMultiString() {
        List<String> out = new ArrayList<>();
        String all = new String(data, 0, data.length & ~1, StandardCharsets.UTF_16LE);
        for (String s : all.split("\0")) {
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    public Optional<Long> asDword() {
        if (data.length < 4) return Optional.empty();
        if (type == REG_DWORD_BIG_ENDIAN) {
            return Optional.of(((data[0] & 0xFFL) << 24) | ((data[1] & 0xFFL) << 16)
                    | ((data[2] & 0xFFL) << 8) | (data[3] & 0xFFL));
        }
        return Optional.of(LittleEndian.u32(data, 0));
    }

    public Optional<Long> asQword() {
        return data.length < 8 ? Optional.empty() : Optional.of(LittleEndian.i64(data, 0));
    }

    /** Renders the value the way a registry viewer would. */
    public String display() {
        return switch (type) {
            case REG_SZ, REG_EXPAND_SZ -> asString();
            case REG_MULTI_SZ -> String.join(", ", asMultiString());
            case REG_DWORD, REG_DWORD_BIG_ENDIAN -> asDword().map(String::valueOf).orElse("");
            case REG_QWORD -> asQword().map(String::valueOf).orElse("");
            default -> HexFormat.of().formatHex(data, 0, Math.min(data.length, 64));
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RegistryValue v && v.type == type && v.name.equals(name) && Arrays.equals(v.data, data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + type) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RegistryValue[" + name + "=" + display() + "]";
    }
}
