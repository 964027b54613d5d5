package com.libragraph.triage.formats.filesystem;

import com.libragraph.triage.formats.error.FilesystemException;
import com.libragraph.triage.formats.error.TriageException;
import com.libragraph.triage.formats.filesystem.ntfs.NtfsBootSector;
import com.libragraph.triage.formats.filesystem.ntfs.NtfsVolume;
import com.libragraph.triage.formats.image.ImageHandle;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Interprets an opened image as a set of NTFS volumes.
 */
@ApplicationScoped
public class FilesystemWalker {

    private static final Logger log = Logger.getLogger(FilesystemWalker.class);

    /**
     * Discovers partitions and loads every NTFS volume among them. A partition
     * that cannot be read, whatever the reason, becomes a warning, as long as
     * at least one volume mounts.
     *
     * @throws FilesystemException if there is no partition table or no supported volume
     */
    public VolumeSet mount(ImageHandle image) {
        List<Partition> partitions = PartitionTable.discover(image);
        VolumeSet.Warnings warnings = new VolumeSet.Warnings();
        List<NtfsVolume> volumes = new ArrayList<>();
        for (Partition p : partitions) {
            if (p.length() < NtfsBootSector.SIZE) continue;
            try {
                byte[] boot = image.readAt(p.offset(), NtfsBootSector.SIZE);
                if (!NtfsBootSector.isNtfs(boot)) {
                    log.debugf("Skipping %s at offset %d: not NTFS", p.description(), p.offset());
                    continue;
                }
                volumes.add(NtfsVolume.load(image, volumes.size(), p.offset(), p.length(), p.description(),
                        warnings::add));
            } catch (TriageException e) {
                log.warnf("Cannot mount %s at offset %d: %s", p.description(), p.offset(), e.getMessage());
                warnings.add("Partition " + p.description() + " at offset " + p.offset() + ": " + e.getMessage());
            }
        }
        if (volumes.isEmpty()) {
            throw new FilesystemException("No supported filesystem found in " + image.path()
                    + " (" + partitions.size() + " partition(s) examined)");
        }
        log.infof("Mounted %d NTFS volume(s) from %s", volumes.size(), image.path());
        return new VolumeSet(image, volumes, warnings);
    }
}
