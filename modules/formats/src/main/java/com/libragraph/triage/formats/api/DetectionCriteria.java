package com.libragraph.triage.formats.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria for deciding which image format factory opens a container.
 *
 * @param extensions   File extensions without dot (e.g., "e01", "001"), or "*" for any
 * @param magicBytes   Signature to match, or null if the format has none
 * @param magicOffset  Offset in the header where the signature starts
 * @param priority     Higher priority wins when several factories match (EWF=200 beats raw=0)
 */
public record DetectionCriteria(
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
    }

    /**
     * Creates criteria that match every file (raw fallback).
     */
    public static DetectionCriteria catchAll(int priority) {
        return new DetectionCriteria(Set.of("*"), null, 0, priority);
    }

    /**
     * True when the header carries this format's signature.
     */
    public boolean matchesMagic(byte[] header) {
        if (magicBytes == null || header == null) return false;
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) return false;
        for (int i = 0; i < magicBytes.length; i++) {
            if (header[magicOffset + i] != magicBytes[i]) return false;
        }
        return true;
    }

    /**
     * True when the file name carries one of this format's extensions.
     */
    public boolean matchesExtension(String filename) {
        if (extensions.contains("*")) return true;
        if (filename == null) return false;
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex <= 0) return false;
        return extensions.contains(filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Checks the signature first (most reliable), then the extension.
     */
    public boolean matches(String filename, byte[] header) {
        return matchesMagic(header) || matchesExtension(filename);
    }
}
