package com.libragraph.triage.formats.filesystem.ntfs;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;

import java.util.ArrayList;
import java.util.List;

/**
 * One extent of a non-resident attribute. A negative {@code cluster} marks a sparse run.
 */
public record DataRun(long cluster, long length) {

    public boolean sparse() {
        return cluster < 0;
    }

    /**
     * Decodes a runlist: each entry is a header byte (low nibble length size,
     * high nibble offset size), the run length, and a signed cluster delta
     * from the previous run. A zero header terminates the list.
     */
    public static List<DataRun> decode(byte[] b, int off, int end) {
        List<DataRun> runs = new ArrayList<>();
        long cluster = 0;
        int pos = off;
        while (pos < end) {
            int header = b[pos] & 0xFF;
            if (header == 0) break;
            int lengthBytes = header & 0x0F;
            int offsetBytes = header >>> 4;
            if (lengthBytes == 0 || lengthBytes > 8 || offsetBytes > 8 || pos + 1 + lengthBytes + offsetBytes > end) {
                throw new CorruptStructureException("NTFS runlist", "bad run header 0x"
                        + Integer.toHexString(header) + " at " + pos);
            }
            long length = LittleEndian.unsignedN(b, pos + 1, lengthBytes);
            if (offsetBytes == 0) {
                runs.add(new DataRun(-1, length));
            } else {
                cluster += LittleEndian.signedN(b, pos + 1 + lengthBytes, offsetBytes);
                if (cluster < 0) {
                    throw new CorruptStructureException("NTFS runlist", "negative cluster " + cluster);
                }
                runs.add(new DataRun(cluster, length));
            }
            pos += 1 + lengthBytes + offsetBytes;
        }
        return List.copyOf(runs);
    }

    public static boolean allSparse(List<DataRun> runs) {
        return runs.stream().allMatch(DataRun::sparse);
    }
}
