package com.libragraph.triage.formats.filesystem.ntfs;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.formats.error.OutOfRangeException;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.image.ImageHandle;
import com.libragraph.triage.util.buffer.BinaryData;
import com.libragraph.triage.util.buffer.Buffer;
import com.libragraph.triage.util.buffer.RamBuffer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An NTFS volume inside an image. The whole MFT is scanned once at load:
 * live records form the directory tree, unused records that still carry a
 * file name are kept as deleted entries. Damaged records are skipped with a
 * warning; a damaged directory keeps its name but lists as empty.
 */
public final class NtfsVolume {

    private static final Logger log = Logger.getLogger(NtfsVolume.class);

    public static final long ROOT_RECORD = 5;
    private static final int RECORDS_PER_READ = 256;
    private static final int COPY_SLICE = 1024 * 1024;

    private final ImageHandle image;
    private final Volume volume;
    private final NtfsBootSector boot;
    private final NtfsNode root;
    private final Map<Long, NtfsNode> nodes;
    private final List<MftRecord> deleted;

    private NtfsVolume(ImageHandle image, Volume volume, NtfsBootSector boot, NtfsNode root,
                       Map<Long, NtfsNode> nodes, List<MftRecord> deleted) {
        this.image = image;
        this.volume = volume;
        this.boot = boot;
        this.root = root;
        this.nodes = nodes;
        this.deleted = deleted;
    }

    /**
     * Reads the boot sector and the MFT of the volume at {@code offset}.
     *
     * @param warnings receives one message per skipped or damaged record
     * @throws CorruptStructureException if the boot sector, {@code $MFT} record or root directory is unusable
     */
    public static NtfsVolume load(ImageHandle image, int index, long offset, long length,
                                  String partition, Consumer<String> warnings) {
        NtfsBootSector boot = NtfsBootSector.parse(image.readAt(offset, NtfsBootSector.SIZE));
        Volume volume = new Volume(index, offset, length, "NTFS", boot.bytesPerSector(), boot.clusterSize(),
                boot.serialNumber(), partition);

        int recordSize = boot.recordSize();
        if (boot.mftOffset() + recordSize > length) {
            throw new CorruptStructureException("NTFS volume " + index, "MFT lies outside the volume");
        }
        MftRecord mft = MftRecord.parse(image.readAt(offset + boot.mftOffset(), recordSize), 0);
        if (!mft.fixupValid() || mft.runs() == null) {
            throw new CorruptStructureException("NTFS volume " + index, "$MFT record is unreadable");
        }
        List<DataRun> mftRuns = mft.runs();
        long recordCount = mft.size() / recordSize;

        Map<Long, NtfsNode> nodes = new HashMap<>();
        List<MftRecord> deleted = new ArrayList<>();
        int damaged = 0;
        for (long first = 0; first < recordCount; first += RECORDS_PER_READ) {
            int count = (int) Math.min(RECORDS_PER_READ, recordCount - first);
            byte[] batch = readRuns(image, offset, length, boot.clusterSize(), mftRuns, first * recordSize,
                    count * recordSize);
            for (int i = 0; i < count; i++) {
                long number = first + i;
                byte[] raw = Arrays.copyOfRange(batch, i * recordSize, (i + 1) * recordSize);
                if (MftRecord.isEmpty(raw)) continue;
                MftRecord record;
                try {
                    record = MftRecord.parse(raw, number);
                } catch (CorruptStructureException e) {
                    warnings.accept("Volume " + index + ": skipped " + e.getMessage());
                    damaged++;
                    continue;
                }
                if (record.name() == null || record.baseRecord() != 0) continue;
                if (!record.fixupValid()) {
                    damaged++;
                    if (record.inUse() && record.directory()) {
                        warnings.accept("Volume " + index + ": directory " + record.name() + " (MFT record "
                                + number + ") failed its update-sequence check; listing it as empty");
                        nodes.put(number, new NtfsNode(record, true));
                    } else {
                        warnings.accept("Volume " + index + ": skipped MFT record " + number
                                + ": update-sequence mismatch");
                    }
                    continue;
                }
                if (record.inUse()) {
                    nodes.put(number, new NtfsNode(record, false));
                } else {
                    deleted.add(record);
                }
            }
        }

        NtfsNode root = nodes.get(ROOT_RECORD);
        if (root == null || !root.directory()) {
            throw new CorruptStructureException("NTFS volume " + index, "root directory record is missing");
        }
        int orphans = 0;
        for (NtfsNode node : nodes.values()) {
            if (node == root) continue;
            NtfsNode parent = nodes.get(node.record().parent());
            if (parent == null || !parent.directory()) {
                orphans++;
                continue;
            }
            // Children of a damaged directory are not trusted
            if (!parent.damaged()) parent.attach(node);
        }
        log.infof("NTFS volume %d at offset %d: %d records, %d live, %d deleted, %d damaged, %d orphaned",
                index, offset, recordCount, nodes.size(), deleted.size(), damaged, orphans);
        return new NtfsVolume(image, volume, boot, root, nodes, List.copyOf(deleted));
    }

    /**
     * Reads {@code length} bytes at logical offset {@code pos} of a non-resident stream.
     *
     * @throws CorruptStructureException if a run reaches outside the volume
     */
    static byte[] readRuns(ImageHandle image, long volumeOffset, long volumeLength, int clusterSize,
                           List<DataRun> runs, long pos, int length) {
        byte[] out = new byte[length];
        long volumeClusters = volumeLength / clusterSize;
        long runStart = 0;
        int done = 0;
        for (DataRun run : runs) {
            if (run.length() > Long.MAX_VALUE / clusterSize) {
                throw new CorruptStructureException("NTFS runlist", "run of " + run.length() + " clusters");
            }
            long runBytes = run.length() * clusterSize;
            long runEnd = runStart + runBytes;
            long at = pos + done;
            if (done < length && at < runEnd && at >= runStart) {
                int n = (int) Math.min(length - done, runEnd - at);
                if (!run.sparse()) {
                    if (run.cluster() > volumeClusters
                            || run.cluster() * clusterSize + (at - runStart) > volumeLength - n) {
                        throw new CorruptStructureException("NTFS runlist", "run at cluster " + run.cluster()
                                + " extends past the end of the volume (" + volumeClusters + " clusters)");
                    }
                    byte[] chunk = image.readAt(volumeOffset + run.cluster() * clusterSize + (at - runStart), n);
                    System.arraycopy(chunk, 0, out, done, n);
                }
                done += n;
            }
            runStart = runEnd;
        }
        if (done < length) {
            throw new CorruptStructureException("NTFS runlist", "stream ends before offset " + (pos + length));
        }
        return out;
    }

    public Volume volume() {
        return volume;
    }

    public NtfsBootSector bootSector() {
        return boot;
    }

    public NtfsNode root() {
        return root;
    }

    /** Case-insensitive lookup. Paths below a damaged directory do not resolve. */
    public Optional<NtfsNode> lookup(String path) {
        NtfsNode node = root;
        for (String segment : NtfsNode.segments(path)) {
            if (!node.directory()) return Optional.empty();
            node = node.child(segment);
            if (node == null) return Optional.empty();
        }
        return Optional.of(node);
    }

    public Optional<NtfsNode> node(long recordNumber) {
        return Optional.ofNullable(nodes.get(recordNumber));
    }

    public List<MftRecord> deletedRecords() {
        return deleted;
    }

    /** Path of a deleted record's former parent, or {@code /$OrphanFiles}. */
    public String parentPathOf(MftRecord record) {
        NtfsNode parent = nodes.get(record.parent());
        return parent != null && parent.directory() && (parent == root || parent.parent() != null)
                ? parent.path() : "/$OrphanFiles";
    }

    /**
     * Materializes a file's unnamed data stream. Files of 4 MB or more go to a temp file.
     */
    public BinaryData open(NtfsNode node) {
        return content(node.record());
    }

    public BinaryData content(MftRecord record) {
        if (record.residentData() != null) {
            return new RamBuffer(record.residentData());
        }
        if (record.runs() == null) {
            return new RamBuffer(new byte[0]);
        }
        long size = record.size();
        Buffer buffer = Buffer.allocate(size);
        try {
            for (long pos = 0; pos < size; pos += COPY_SLICE) {
                int n = (int) Math.min(COPY_SLICE, size - pos);
                byte[] slice = readRuns(image, volume.offset(), volume.length(), boot.clusterSize(), record.runs(),
                        pos, n);
                ByteBuffer src = ByteBuffer.wrap(slice);
                while (src.hasRemaining()) buffer.write(src);
            }
            buffer.position(0);
            return buffer;
        } catch (IOException e) {
            closeQuietly(buffer, e);
            throw new UncheckedIOException("Failed to copy MFT record " + record.number(), e);
        } catch (RuntimeException e) {
            closeQuietly(buffer, e);
            throw e;
        }
    }

    private static void closeQuietly(Buffer buffer, Exception primary) {
        try {
            buffer.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    /** Whether any of the record's content is still addressable. */
    public static boolean recoverable(MftRecord record) {
        if (record.residentData() != null) return record.residentData().length > 0;
        return record.runs() != null && !DataRun.allSparse(record.runs());
    }

    /** Reads raw bytes relative to the volume start, bounded by the volume length. */
    public byte[] readVolume(long offset, int length) {
        if (offset < 0 || length < 0 || offset > volume.length() - length) {
            throw new OutOfRangeException(offset, length, volume.length());
        }
        return image.readAt(volume.offset() + offset, length);
    }
}
