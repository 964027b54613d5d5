package com.libragraph.triage.formats.filesystem;

import com.libragraph.triage.formats.error.FilesystemException;
import com.libragraph.triage.formats.filesystem.ntfs.NtfsBootSector;
import com.libragraph.triage.formats.image.ImageHandle;
import com.libragraph.triage.util.LittleEndian;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds partitions: a bare volume boot sector, an MBR with primary and
 * logical (extended) entries, or a GPT behind a protective MBR.
 */
final class PartitionTable {

    private static final Logger log = Logger.getLogger(PartitionTable.class);

    static final int SECTOR = 512;
    private static final int MBR_ENTRIES = 446;
    private static final int TYPE_GPT_PROTECTIVE = 0xEE;
    private static final byte[] GPT_SIGNATURE = "EFI PART".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_LOGICAL = 128;
    private static final int MAX_GPT_ENTRIES = 1024;

    private PartitionTable() {
    }

    static List<Partition> discover(ImageHandle image) {
        if (image.size() < SECTOR) {
            throw new FilesystemException("Image " + image.path() + " is smaller than one sector");
        }
        byte[] first = image.readAt(0, SECTOR);
        if (NtfsBootSector.isNtfs(first)) {
            return List.of(new Partition(0, image.size(), "volume (no partition table)"));
        }
        if ((first[510] & 0xFF) != 0x55 || (first[511] & 0xFF) != 0xAA) {
            throw new FilesystemException("No partition table or NTFS boot sector found in " + image.path());
        }
        for (int i = 0; i < 4; i++) {
            if (LittleEndian.u8(first, MBR_ENTRIES + i * 16 + 4) == TYPE_GPT_PROTECTIVE) {
                return gpt(image);
            }
        }
        return mbr(image, first);
    }

    private static List<Partition> mbr(ImageHandle image, byte[] mbr) {
        List<Partition> partitions = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            int entry = MBR_ENTRIES + i * 16;
            int type = LittleEndian.u8(mbr, entry + 4);
            long start = LittleEndian.u32(mbr, entry + 8);
            long count = LittleEndian.u32(mbr, entry + 12);
            if (type == 0 || count == 0) continue;
            if (type == 0x05 || type == 0x0F || type == 0x85) {
                logical(image, start, partitions);
                continue;
            }
            add(image, partitions, start * SECTOR, count * SECTOR, String.format("MBR type 0x%02X", type));
        }
        return partitions;
    }

    /** Follows the chain of extended boot records. Each link is relative to the extended partition start. */
    private static void logical(ImageHandle image, long extendedStart, List<Partition> partitions) {
        long ebr = extendedStart;
        for (int n = 0; n < MAX_LOGICAL; n++) {
            if ((ebr + 1) * SECTOR > image.size()) {
                log.warnf("Extended boot record at sector %d lies outside image %s", ebr, image.path());
                return;
            }
            byte[] b = image.readAt(ebr * SECTOR, SECTOR);
            if ((b[510] & 0xFF) != 0x55 || (b[511] & 0xFF) != 0xAA) {
                log.warnf("Extended boot record at sector %d has no signature", ebr);
                return;
            }
            int type = LittleEndian.u8(b, MBR_ENTRIES + 4);
            long start = LittleEndian.u32(b, MBR_ENTRIES + 8);
            long count = LittleEndian.u32(b, MBR_ENTRIES + 12);
            if (type != 0 && count > 0) {
                add(image, partitions, (ebr + start) * SECTOR, count * SECTOR,
                        String.format("MBR logical type 0x%02X", type));
            }
            long next = LittleEndian.u32(b, MBR_ENTRIES + 16 + 8);
            if (next == 0) return;
            ebr = extendedStart + next;
        }
    }

    private static List<Partition> gpt(ImageHandle image) {
        if (image.size() < 2L * SECTOR) {
            throw new FilesystemException("GPT header missing in " + image.path());
        }
        byte[] header = image.readAt(SECTOR, SECTOR);
        if (!LittleEndian.startsWith(header, 0, GPT_SIGNATURE)) {
            throw new FilesystemException("Protective MBR without EFI PART header in " + image.path());
        }
        long entriesLba = LittleEndian.i64(header, 72);
        long entryCount = LittleEndian.u32(header, 80);
        long entrySize = LittleEndian.u32(header, 84);
        if (entrySize < 128 || entrySize > 4096 || entryCount > MAX_GPT_ENTRIES) {
            throw new FilesystemException("Invalid GPT entry table (" + entryCount + " x " + entrySize
                    + ") in " + image.path());
        }
        long tableOffset = entriesLba * SECTOR;
        int tableSize = (int) (entryCount * entrySize);
        if (tableOffset < 0 || tableOffset > image.size() - tableSize) {
            throw new FilesystemException("GPT entry table lies outside " + image.path());
        }
        byte[] table = image.readAt(tableOffset, tableSize);
        List<Partition> partitions = new ArrayList<>();
        for (int i = 0; i < entryCount; i++) {
            int e = (int) (i * entrySize);
            if (LittleEndian.i64(table, e) == 0 && LittleEndian.i64(table, e + 8) == 0) continue;
            long firstLba = LittleEndian.i64(table, e + 32);
            long lastLba = LittleEndian.i64(table, e + 40);
            if (lastLba < firstLba) continue;
            String name = LittleEndian.utf16(table, e + 56, 72);
            add(image, partitions, firstLba * SECTOR, (lastLba - firstLba + 1) * SECTOR,
                    name.isEmpty() ? "GPT entry " + i : "GPT " + name);
        }
        return partitions;
    }

    private static void add(ImageHandle image, List<Partition> partitions, long offset, long length, String desc) {
        if (offset >= image.size()) {
            log.warnf("Partition %s at offset %d lies outside image %s", desc, offset, image.path());
            return;
        }
        long clamped = Math.min(length, image.size() - offset);
        if (clamped < length) {
            log.warnf("Partition %s truncated from %d to %d bytes by end of image", desc, length, clamped);
        }
        partitions.add(new Partition(offset, clamped, desc));
    }
}
