package com.libragraph.triage.formats.registry;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a Windows registry hive file (regf).
 *
 * <p>Cells are addressed relative to the first hive bin at 0x1000. Every
 * cell starts with a signed size, negative when allocated. Key nodes
 * ({@code nk}) point at a subkey index ({@code lf}, {@code lh}, {@code li}
 * or {@code ri}) and a value list of {@code vk} cells. Data of four bytes
 * or less lives inline in the value cell; data above 16344 bytes is split
 * through a {@code db} cell.
 */
public final class RegistryHive {

    private static final byte[] REGF = "regf".getBytes(StandardCharsets.US_ASCII);
    static final int HBIN_START = 0x1000;
    private static final int ROOT_CELL_OFFSET = 0x24;
    private static final int NAME_ASCII = 0x20;
    private static final int VALUE_NAME_ASCII = 0x01;
    private static final int BIG_DATA_THRESHOLD = 16344;
    private static final int MAX_RI_DEPTH = 8;

    private final byte[] data;
    private final RegistryKey root;

    private RegistryHive(byte[] data, int rootCell) {
        this.data = data;
        this.root = key(rootCell, "");
    }

    /**
     * @throws CorruptStructureException if the base block or root key cannot be read
     */
    public static RegistryHive parse(byte[] data) {
        if (data.length < HBIN_START + 32 || !LittleEndian.startsWith(data, 0, REGF)) {
            throw new CorruptStructureException("registry hive", "missing regf base block");
        }
        int rootCell = (int) LittleEndian.u32(data, ROOT_CELL_OFFSET);
        try {
            return new RegistryHive(data, rootCell);
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptStructureException("registry hive", "root key outside hive: " + e.getMessage(), e);
        }
    }

    public static boolean isHive(byte[] header) {
        return LittleEndian.startsWith(header, 0, REGF);
    }

    public RegistryKey root() {
        return root;
    }

    /** Looks up a backslash-separated key path below the root, case-insensitively. */
    public Optional<RegistryKey> key(String path) {
        RegistryKey k = root;
        for (String part : path.split("\\\\")) {
            if (part.isEmpty()) continue;
            Optional<RegistryKey> next = k.subkey(part);
            if (next.isEmpty()) return Optional.empty();
            k = next.get();
        }
        return Optional.of(k);
    }

    List<RegistryKey> subkeys(RegistryKey parent) {
        byte[] nk = cell(parent.cell(), "nk");
        long count = LittleEndian.u32(nk, 20);
        if (count == 0) return List.of();
        int listCell = (int) LittleEndian.u32(nk, 28);
        List<Integer> cells = new ArrayList<>();
        collectSubkeys(listCell, cells, 0);
        List<RegistryKey> keys = new ArrayList<>(cells.size());
        for (int c : cells) {
            keys.add(key(c, parent.path()));
        }
        return keys;
    }

    private void collectSubkeys(int listCell, List<Integer> out, int depth) {
        if (depth > MAX_RI_DEPTH) {
            throw new CorruptStructureException("registry hive", "subkey index nested too deep");
        }
        byte[] list = cell(listCell, null);
        String sig = new String(list, 0, 2, StandardCharsets.US_ASCII);
        int count = LittleEndian.u16(list, 2);
        switch (sig) {
            case "lf", "lh" -> {
                for (int i = 0; i < count; i++) out.add((int) LittleEndian.u32(list, 4 + i * 8));
            }
            case "li" -> {
                for (int i = 0; i < count; i++) out.add((int) LittleEndian.u32(list, 4 + i * 4));
            }
            case "ri" -> {
                for (int i = 0; i < count; i++) collectSubkeys((int) LittleEndian.u32(list, 4 + i * 4), out, depth + 1);
            }
            default -> throw new CorruptStructureException("registry hive",
                    "unknown subkey index '" + sig + "' at cell " + listCell);
        }
    }

    List<RegistryValue> values(RegistryKey key) {
        byte[] nk = cell(key.cell(), "nk");
        long count = LittleEndian.u32(nk, 36);
        if (count == 0) return List.of();
        byte[] list = cell((int) LittleEndian.u32(nk, 40), null);
        if (count * 4 > list.length) {
            throw new CorruptStructureException("registry hive", "value list of " + key.path() + " is truncated");
        }
        List<RegistryValue> values = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            values.add(value((int) LittleEndian.u32(list, i * 4)));
        }
        return values;
    }

    private RegistryKey key(int cellOffset, String parentPath) {
        byte[] nk = cell(cellOffset, "nk");
        int flags = LittleEndian.u16(nk, 2);
        int nameLength = LittleEndian.u16(nk, 72);
        String name = (flags & NAME_ASCII) != 0
                ? new String(nk, 76, checkLength(nk, 76, nameLength), StandardCharsets.ISO_8859_1)
                : new String(nk, 76, checkLength(nk, 76, nameLength), StandardCharsets.UTF_16LE);
        String path = parentPath.isEmpty() ? (cellOffset == rootCellOf() ? "" : name) : parentPath + "\\" + name;
        return new RegistryKey(this, cellOffset, name, path,
                WindowsTime.fromFiletime(LittleEndian.i64(nk, 4)).orElse(null));
    }

    private int rootCellOf() {
        return (int) LittleEndian.u32(data, ROOT_CELL_OFFSET);
    }

    private RegistryValue value(int cellOffset) {
        byte[] vk = cell(cellOffset, "vk");
        int nameLength = LittleEndian.u16(vk, 2);
        long rawSize = LittleEndian.u32(vk, 4);
        long dataField = LittleEndian.u32(vk, 8);
        int type = (int) LittleEndian.u32(vk, 12);
        int flags = LittleEndian.u16(vk, 16);
        String name = nameLength == 0 ? "" : (flags & VALUE_NAME_ASCII) != 0
                ? new String(vk, 20, checkLength(vk, 20, nameLength), StandardCharsets.ISO_8859_1)
                : new String(vk, 20, checkLength(vk, 20, nameLength), StandardCharsets.UTF_16LE);

        boolean inline = (rawSize & 0x80000000L) != 0;
        int size = (int) (rawSize & 0x7FFFFFFFL);
        byte[] value;
        if (inline) {
            value = Arrays.copyOfRange(vk, 8, 8 + Math.min(size, 4));
        } else if (size == 0) {
            value = new byte[0];
        } else {
            byte[] cell = cell((int) dataField, null);
            if (size > BIG_DATA_THRESHOLD && cell.length >= 8 && cell[0] == 'd' && cell[1] == 'b') {
                value = bigData(cell, size);
            } else {
                if (size > cell.length) {
                    throw new CorruptStructureException("registry hive", "value '" + name + "' data overruns its cell");
                }
                value = Arrays.copyOf(cell, size);
            }
        }
        return new RegistryValue(name, type, value);
    }

    private byte[] bigData(byte[] db, int size) {
        int segments = LittleEndian.u16(db, 2);
        byte[] list = cell((int) LittleEndian.u32(db, 4), null);
        byte[] out = new byte[size];
        int done = 0;
        for (int i = 0; i < segments && done < size; i++) {
            byte[] seg = cell((int) LittleEndian.u32(list, i * 4), null);
            int n = Math.min(Math.min(seg.length, BIG_DATA_THRESHOLD), size - done);
            System.arraycopy(seg, 0, out, done, n);
            done += n;
        }
        return out;
    }

    /** Content of the cell at {@code offset}, without its size field. */
    private byte[] cell(int offset, String expectedSignature) {
        long abs = HBIN_START + (offset & 0xFFFFFFFFL);
        if (abs + 4 > data.length) {
            throw new CorruptStructureException("registry hive", "cell offset " + offset + " outside hive");
        }
        int size = Math.abs(LittleEndian.i32(data, (int) abs));
        if (size < 8 || abs + size > data.length) {
            throw new CorruptStructureException("registry hive", "cell at " + offset + " has size " + size);
        }
        byte[] content = Arrays.copyOfRange(data, (int) abs + 4, (int) abs + size);
        if (expectedSignature != null && (content.length < 2 || content[0] != expectedSignature.charAt(0)
                || content[1] != expectedSignature.charAt(1))) {
            throw new CorruptStructureException("registry hive",
                    "expected " + expectedSignature + " cell at " + offset);
        }
        return content;
    }

    private static int checkLength(byte[] b, int off, int length) {
        if (off + length > b.length) {
            throw new CorruptStructureException("registry hive", "name overruns its cell");
        }
        return length;
    }
}
