package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.formats.error.FileNotFoundInImageException;
import com.libragraph.triage.formats.error.TriageException;
import com.libragraph.triage.formats.filesystem.FileEntry;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * File lookups shared by the extractors.
 */
final class ImageFiles {

    private static final Logger log = Logger.getLogger(ImageFiles.class);

    /** Largest single file an extractor loads into memory. */
    static final long MAX_ARTIFACT_FILE = 256L * 1024 * 1024;

    private ImageFiles() {
    }

    /** Provenance string for a file: {@code vol0:/Windows/...}. */
    static String source(int volume, String path) {
        return "vol" + volume + ":" + path;
    }

    /** Directory entries, or nothing when the directory does not exist. */
    static List<FileEntry> list(VolumeSet volumes, int volume, String dir) {
        if (!volumes.stat(volume, dir).map(FileEntry::directory).orElse(false)) {
            return List.of();
        }
        return volumes.listDirectory(volume, dir);
    }

    static List<FileEntry> files(VolumeSet volumes, int volume, String dir, Predicate<FileEntry> filter) {
        List<FileEntry> out = new ArrayList<>();
        for (FileEntry e : list(volumes, volume, dir)) {
            if (!e.directory() && filter.test(e)) out.add(e);
        }
        return out;
    }

    /** Files below {@code dir} at any depth, depth first. */
    static List<FileEntry> walk(VolumeSet volumes, int volume, String dir, Predicate<FileEntry> filter) {
        List<FileEntry> out = new ArrayList<>();
        for (FileEntry e : list(volumes, volume, dir)) {
            if (e.directory()) {
                out.addAll(walk(volumes, volume, e.path(), filter));
            } else if (filter.test(e)) {
                out.add(e);
            }
        }
        return out;
    }

    /**
     * Loads a whole file.
     *
     * @throws FileNotFoundInImageException if the file does not exist
     */
    static byte[] read(VolumeSet volumes, int volume, String path) {
        try (BinaryData data = volumes.readFile(volume, path)) {
            if (data.size() > MAX_ARTIFACT_FILE) {
                throw new TriageException("File " + path + " is too large to decode (" + data.size() + " bytes)");
            }
            return data.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot release buffer for " + path, e);
        }
    }

    /** Leading bytes of a file, for format detection. */
    static byte[] header(VolumeSet volumes, int volume, String path, int length) {
        try (BinaryData data = volumes.readFile(volume, path)) {
            return data.readHeader(length);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot release buffer for " + path, e);
        }
    }

    /**
     * Decodes one source lazily. Decoding problems become a warning and an
     * empty result so the remaining sources are still processed.
     */
    static Stream<Artifact> guarded(ExtractionContext ctx, String what, Supplier<Stream<Artifact>> decode) {
        try {
            return decode.get();
        } catch (FileNotFoundInImageException e) {
            log.debugf("%s: %s", what, e.getMessage());
            return Stream.empty();
        } catch (TriageException | IndexOutOfBoundsException | UncheckedIOException e) {
            ctx.warn(what + ": " + e.getMessage());
            return Stream.empty();
        }
    }
}
