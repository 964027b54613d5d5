/**
 * Shared utilities for all triage modules.
 *
 * <p>Contains {@link com.libragraph.triage.util.ContentHash} (BLAKE3-128), the
 * little-endian and Windows-epoch helpers used by every binary decoder, and the
 * {@link com.libragraph.triage.util.buffer buffer layer} (BinaryData, Buffer,
 * RamBuffer, FileBuffer, SegmentedBinaryData).
 * No framework dependencies.
 */
package com.libragraph.triage.util;
