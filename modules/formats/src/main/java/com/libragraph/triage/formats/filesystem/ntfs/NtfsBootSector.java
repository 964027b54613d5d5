package com.libragraph.triage.formats.filesystem.ntfs;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;

import java.nio.charset.StandardCharsets;

/**
 * Geometry read from the NTFS volume boot record.
 */
public record NtfsBootSector(int bytesPerSector, int clusterSize, long totalSectors,
                             long mftCluster, int recordSize, String serialNumber) {

    public static final int SIZE = 512;
    private static final byte[] OEM_ID = "NTFS    ".getBytes(StandardCharsets.US_ASCII);

    public static boolean isNtfs(byte[] sector) {
        return LittleEndian.startsWith(sector, 3, OEM_ID);
    }

    public static NtfsBootSector parse(byte[] sector) {
        if (!isNtfs(sector)) {
            throw new CorruptStructureException("NTFS boot sector", "missing NTFS OEM id");
        }
        int bytesPerSector = LittleEndian.u16(sector, 0x0B);
        if (bytesPerSector < 256 || bytesPerSector > 4096 || Integer.bitCount(bytesPerSector) != 1) {
            throw new CorruptStructureException("NTFS boot sector", "invalid bytes per sector " + bytesPerSector);
        }
        int spc = LittleEndian.u8(sector, 0x0D);
        // Values above 0x80 encode 2^(256 - n) sectors per cluster
        int sectorsPerCluster = spc > 0x80 ? 1 << (256 - spc) : spc;
        if (sectorsPerCluster == 0 || Integer.bitCount(sectorsPerCluster) != 1) {
            throw new CorruptStructureException("NTFS boot sector", "invalid sectors per cluster " + spc);
        }
        int clusterSize = bytesPerSector * sectorsPerCluster;
        long totalSectors = LittleEndian.i64(sector, 0x28);
        long mftCluster = LittleEndian.i64(sector, 0x30);
        int recordSize = recordSize(sector[0x40], clusterSize);
        if (recordSize < 256 || recordSize > 65536 || mftCluster <= 0) {
            throw new CorruptStructureException("NTFS boot sector",
                    "invalid MFT location " + mftCluster + " or record size " + recordSize);
        }
        String serial = String.format("%016X", LittleEndian.i64(sector, 0x48));
        return new NtfsBootSector(bytesPerSector, clusterSize, totalSectors, mftCluster, recordSize, serial);
    }

    /** Positive values count clusters, negative values are a power-of-two byte size. */
    static int recordSize(byte encoded, int clusterSize) {
        return encoded < 0 ? 1 << -encoded : encoded * clusterSize;
    }

    public long mftOffset() {
        return mftCluster * clusterSize;
    }
}
