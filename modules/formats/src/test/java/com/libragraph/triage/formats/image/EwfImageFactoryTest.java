package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.error.ImageFormatException;
import com.libragraph.triage.testing.EwfImageBuilder;
import com.libragraph.triage.types.ImageFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EwfImageFactoryTest {

    @TempDir
    Path tempDir;

    private final ImageIngestor ingestor = ImageIngestor.withDefaults();

    @Test
    void segmentExtensionsShouldFollowEnCaseNaming() {
        assertThat(EwfImageFactory.segmentExtension(1)).isEqualTo("E01");
        assertThat(EwfImageFactory.segmentExtension(99)).isEqualTo("E99");
        assertThat(EwfImageFactory.segmentExtension(100)).isEqualTo("EAA");
        assertThat(EwfImageFactory.segmentExtension(101)).isEqualTo("EAB");
        assertThat(EwfImageFactory.segmentExtension(126)).isEqualTo("EBA");
    }

    @Test
    void multiSegmentCompressedImageShouldReadAsOneAddressSpace() throws Exception {
        byte[] media = ImageIngestorTest.pattern(7, 40 * 8192);
        List<Path> segments = new EwfImageBuilder()
                .sectorsPerChunk(16)
                .chunksPerSegment(12)
                .write(media, tempDir, "case");

        assertThat(segments).hasSize(4);
        try (ImageHandle image = ingestor.open(segments.get(0))) {
            assertThat(image.format()).isEqualTo(ImageFormat.EWF);
            assertThat(image.segmentCount()).isEqualTo(4);
            assertThat(image.size()).isEqualTo(media.length);
            assertThat(image.metadata().details()).containsEntry("chunkSize", "8192");

            // spans the chunk boundary between segment 1 and 2
            long seam = 12L * 8192 - 10;
            assertThat(image.readAt(seam, 20)).isEqualTo(ImageIngestorTest.pattern(7 + seam, 20));
            assertThat(image.readAt(0, media.length)).isEqualTo(media);
        }
    }

    @Test
    void uncompressedChunksShouldVerifyTheirChecksum() throws Exception {
        byte[] media = ImageIngestorTest.pattern(0, 4 * 8192);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).compress(false).write(media, tempDir, "plain");

        try (ImageHandle image = ingestor.open(segments.get(0))) {
            assertThat(image.readAt(8000, 400)).isEqualTo(ImageIngestorTest.pattern(8000, 400));
        }
    }

    @Test
    void corruptChunkShouldFailTheRead() throws Exception {
        byte[] media = ImageIngestorTest.pattern(0, 2 * 8192);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).compress(false).corruptFirstChunk()
                .write(media, tempDir, "bad");

        try (ImageHandle image = ingestor.open(segments.get(0))) {
            assertThatThrownBy(() -> image.readAt(0, 16))
                    .isInstanceOf(ImageFormatException.class)
                    .hasMessageContaining("checksum mismatch");
            assertThat(image.readAt(8192, 16)).isEqualTo(ImageIngestorTest.pattern(8192, 16));
        }
    }

    @Test
    void shortMediaTailShouldBeReadable() throws Exception {
        byte[] media = ImageIngestorTest.pattern(3, 8192 + 1024);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).write(media, tempDir, "tail");

        try (ImageHandle image = ingestor.open(segments.get(0))) {
            assertThat(image.size()).isEqualTo(media.length);
            assertThat(image.readAt(8192, 1024)).isEqualTo(ImageIngestorTest.pattern(3 + 8192, 1024));
        }
    }

    @Test
    void missingLaterSegmentShouldFailIngestion() throws Exception {
        byte[] media = ImageIngestorTest.pattern(0, 8 * 8192);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).chunksPerSegment(4)
                .write(media, tempDir, "gap");
        Files.delete(segments.get(1));

        assertThatThrownBy(() -> ingestor.open(segments.get(0)))
                .isInstanceOf(ImageFormatException.class)
                .hasMessageContaining("chunk");
    }

    @Test
    void lowerCaseSegmentNamesShouldBeDiscovered() throws Exception {
        byte[] media = ImageIngestorTest.pattern(0, 4 * 8192);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).chunksPerSegment(2)
                .write(media, tempDir, "lower");
        Path first = Files.move(segments.get(0), tempDir.resolve("lower.e01"));
        Files.move(segments.get(1), tempDir.resolve("lower.e02"));

        try (ImageHandle image = ingestor.open(first)) {
            assertThat(image.segmentCount()).isEqualTo(2);
            assertThat(image.readAt(0, media.length)).isEqualTo(media);
        }
    }
}
