package com.libragraph.triage.formats.filesystem;

/**
 * A run of sectors relative to the start of a volume.
 */
public record SectorRange(long startSector, int sectorCount) {

    public SectorRange {
        if (startSector < 0) throw new IllegalArgumentException("Negative start sector: " + startSector);
        if (sectorCount < 0) throw new IllegalArgumentException("Negative sector count: " + sectorCount);
    }
}
