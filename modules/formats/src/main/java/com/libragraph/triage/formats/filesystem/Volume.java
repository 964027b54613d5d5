package com.libragraph.triage.formats.filesystem;

/**
 * A mounted volume: where it sits in the image and its filesystem geometry.
 *
 * @param index        position in {@link VolumeSet#listVolumes()}, used to address the volume
 * @param offset       byte offset of the volume within the image
 * @param length       volume length in bytes
 * @param partition    how the partition was found, e.g. {@code "MBR type 0x07"}
 */
public record Volume(int index, long offset, long length, String filesystem, int bytesPerSector,
                     int clusterSize, String serialNumber, String partition) {
}
