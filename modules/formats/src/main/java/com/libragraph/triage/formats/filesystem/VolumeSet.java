package com.libragraph.triage.formats.filesystem;

import com.libragraph.triage.formats.error.FileNotFoundInImageException;
import com.libragraph.triage.formats.filesystem.ntfs.MftRecord;
import com.libragraph.triage.formats.filesystem.ntfs.NtfsNode;
import com.libragraph.triage.formats.filesystem.ntfs.NtfsVolume;
import com.libragraph.triage.formats.image.ImageHandle;
import com.libragraph.triage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The mounted volumes of one image. Safe for concurrent use by extractors;
 * paths use {@code /} or {@code \} and are matched case-insensitively.
 */
public final class VolumeSet {

    private static final Logger log = Logger.getLogger(VolumeSet.class);

    private final ImageHandle image;
    private final List<NtfsVolume> volumes;
    private final Warnings warnings;

    VolumeSet(ImageHandle image, List<NtfsVolume> volumes, Warnings warnings) {
        this.image = image;
        this.volumes = List.copyOf(volumes);
        this.warnings = warnings;
    }

    public ImageHandle image() {
        return image;
    }

    public List<Volume> listVolumes() {
        return volumes.stream().map(NtfsVolume::volume).toList();
    }

    public List<UserProfile> listUserProfiles(int volume) {
        NtfsVolume v = volume(volume);
        List<UserProfile> profiles = new ArrayList<>();
        for (String rootPath : SystemLocations.PROFILE_ROOTS) {
            Optional<NtfsNode> dir = v.lookup(rootPath);
            if (dir.isEmpty() || !dir.get().directory()) continue;
            for (NtfsNode child : children(dir.get(), volume)) {
                if (!child.directory()) continue;
                if (SystemLocations.NON_USER_PROFILES.contains(child.name().toLowerCase(Locale.ROOT))) continue;
                profiles.add(new UserProfile(volume, child.name(), child.path()));
            }
        }
        return profiles;
    }

    /**
     * Reads a file's content.
     *
     * @throws FileNotFoundInImageException if the path does not name a regular file
     */
    public BinaryData readFile(int volume, String path) {
        NtfsNode node = volume(volume).lookup(path)
                .filter(n -> !n.directory())
                .orElseThrow(() -> new FileNotFoundInImageException(volume, path));
        log.debugf("Reading %s (%d bytes) from volume %d", node.path(), node.size(), volume);
        return volume(volume).open(node);
    }

    /**
     * Lists a directory. A damaged directory lists as empty and records a warning.
     *
     * @throws FileNotFoundInImageException if the path does not name a directory
     */
    public List<FileEntry> listDirectory(int volume, String path) {
        NtfsNode dir = volume(volume).lookup(path)
                .filter(NtfsNode::directory)
                .orElseThrow(() -> new FileNotFoundInImageException(volume, path));
        return children(dir, volume).stream().map(n -> entry(volume, n)).toList();
    }

    public Optional<FileEntry> stat(int volume, String path) {
        return volume(volume).lookup(path).map(n -> entry(volume, n));
    }

    public boolean exists(int volume, String path) {
        return volume(volume).lookup(path).isPresent();
    }

    /** Records that are no longer in use but still carry a name. */
    public Stream<DeletedEntry> enumerateDeleted(int volume) {
        NtfsVolume v = volume(volume);
        return v.deletedRecords().stream().map(r -> new DeletedEntry(volume, r.number(), r.name(),
                v.parentPathOf(r), r.directory(), r.size(), r.times(), NtfsVolume.recoverable(r)));
    }

    /** Content of a deleted record as far as it can still be addressed. */
    public BinaryData readDeleted(int volume, long recordNumber) {
        NtfsVolume v = volume(volume);
        MftRecord record = v.deletedRecords().stream()
                .filter(r -> r.number() == recordNumber)
                .findFirst()
                .orElseThrow(() -> new FileNotFoundInImageException(volume, "MFT record " + recordNumber));
        return v.content(record);
    }

    /**
     * Reads whole sectors relative to the volume start.
     *
     * @throws com.libragraph.triage.formats.error.OutOfRangeException if the range leaves the volume
     */
    public byte[] readRawSectors(int volume, SectorRange range) {
        NtfsVolume v = volume(volume);
        int bps = v.volume().bytesPerSector();
        return v.readVolume(range.startSector() * bps, Math.multiplyExact(range.sectorCount(), bps));
    }

    /** Structural problems met while mounting and walking, in the order they were found. */
    public List<String> warnings() {
        return warnings.snapshot();
    }

    private List<NtfsNode> children(NtfsNode dir, int volume) {
        if (dir.damaged()) {
            String msg = "Volume " + volume + ": directory " + dir.path() + " is damaged; listed as empty";
            if (warnings.add(msg)) log.warn(msg);
            return List.of();
        }
        return List.copyOf(dir.children());
    }

    private FileEntry entry(int volume, NtfsNode n) {
        return new FileEntry(volume, n.path(), n.name(), n.directory(), n.size(), n.times(), n.recordNumber());
    }

    private NtfsVolume volume(int index) {
        if (index < 0 || index >= volumes.size()) {
            throw new IllegalArgumentException("No volume " + index + "; " + volumes.size() + " mounted");
        }
        return volumes.get(index);
    }

    /** Insertion-ordered, de-duplicated warning list shared by the volumes of one mount. */
    static final class Warnings {

        private final Set<String> messages = new LinkedHashSet<>();

        synchronized boolean add(String message) {
            return messages.add(message);
        }

        synchronized List<String> snapshot() {
            return List.copyOf(messages);
        }
    }
}
