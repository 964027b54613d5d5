package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.error.ImageFormatException;
import com.libragraph.triage.formats.error.OutOfRangeException;
import com.libragraph.triage.testing.EwfImageBuilder;
import com.libragraph.triage.types.ImageFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ImageIngestorTest {

    private static final int TEN_MB = 10_000_000;

    @TempDir
    Path tempDir;

    private final ImageIngestor ingestor = ImageIngestor.withDefaults();

    @Test
    void readAcrossSplitSegmentSeamShouldBeByteExact() throws Exception {
        Files.write(tempDir.resolve("disk.001"), pattern(0, TEN_MB));
        Files.write(tempDir.resolve("disk.002"), pattern(TEN_MB, TEN_MB));

        try (ImageHandle image = ingestor.open(tempDir.resolve("disk.001"))) {
            assertThat(image.format()).isEqualTo(ImageFormat.SPLIT_RAW);
            assertThat(image.segmentCount()).isEqualTo(2);
            assertThat(image.size()).isEqualTo(2L * TEN_MB);

            byte[] seam = image.readAt(9_999_990, 20);

            assertThat(seam).hasSize(20).isEqualTo(pattern(9_999_990, 20));
        }
    }

    @Test
    void formatsShouldBeListedByDetectionPriority() {
        assertThat(ImageIngestor.withDefaults().formats())
                .extracting(f -> f.format())
                .containsExactly(ImageFormat.EWF, ImageFormat.SPLIT_RAW, ImageFormat.RAW);
    }

    @Test
    void singleFileShouldOpenAsRaw() throws Exception {
        Path raw = Files.write(tempDir.resolve("disk.dd"), pattern(0, 4096));

        try (ImageHandle image = ingestor.open(raw)) {
            assertThat(image.format()).isEqualTo(ImageFormat.RAW);
            assertThat(image.segmentCount()).isEqualTo(1);
            assertThat(image.readAt(4000, 96)).isEqualTo(pattern(4000, 96));
        }
    }

    @Test
    void ewfShouldBeDetectedByContentWhateverItsName() throws Exception {
        byte[] media = pattern(0, 64 * 1024);
        List<Path> segments = new EwfImageBuilder().sectorsPerChunk(16).write(media, tempDir, "evidence");
        Path renamed = Files.move(segments.get(0), tempDir.resolve("evidence.bin"));

        try (ImageHandle image = ingestor.open(renamed)) {
            assertThat(image.format()).isEqualTo(ImageFormat.EWF);
            assertThat(image.readAt(0, media.length)).isEqualTo(media);
        }
    }

    @Test
    void ewfExtensionWithoutSignatureShouldFail() throws Exception {
        Path fake = Files.write(tempDir.resolve("fake.E01"), pattern(0, 1024));

        assertThatThrownBy(() -> ingestor.open(fake))
                .isInstanceOf(ImageFormatException.class)
                .hasMessageContaining("Missing EWF signature");
    }

    @Test
    void emptyOrMissingFileShouldFail() throws Exception {
        Path empty = Files.createFile(tempDir.resolve("empty.dd"));

        assertThatThrownBy(() -> ingestor.open(empty))
                .isInstanceOf(ImageFormatException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> ingestor.open(tempDir.resolve("absent.dd")))
                .isInstanceOf(ImageFormatException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void readsOutsideTheImageShouldFailRatherThanComeBackShort() throws Exception {
        Path raw = Files.write(tempDir.resolve("small.dd"), pattern(0, 1000));

        try (ImageHandle image = ingestor.open(raw)) {
            assertThatThrownBy(() -> image.readAt(990, 20))
                    .isInstanceOf(OutOfRangeException.class)
                    .hasMessageContaining("outside image");
            assertThatThrownBy(() -> image.readAt(-1, 1)).isInstanceOf(OutOfRangeException.class);
            assertThatThrownBy(() -> image.readAt(0, -1)).isInstanceOf(OutOfRangeException.class);
        }
    }

    @Test
    void metadataShouldDescribeTheContainer() throws Exception {
        Files.write(tempDir.resolve("m.001"), pattern(0, 512));
        Files.write(tempDir.resolve("m.002"), pattern(512, 512));

        try (ImageHandle image = ingestor.open(tempDir.resolve("m.001"))) {
            ImageMetadata meta = image.metadata();
            assertThat(meta.format()).isEqualTo(ImageFormat.SPLIT_RAW);
            assertThat(meta.size()).isEqualTo(1024);
            assertThat(meta.segmentCount()).isEqualTo(2);
        }
    }

    static byte[] pattern(long start, int length) {
        byte[] b = new byte[length];
        for (int i = 0; i < length; i++) {
            b[i] = (byte) ((start + i) % 251);
        }
        return b;
    }
}
