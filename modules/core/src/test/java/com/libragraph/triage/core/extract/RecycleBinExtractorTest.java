package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.DeletedFile;
import com.libragraph.triage.testing.NtfsImageBuilder;
import com.libragraph.triage.testing.RecycleBinFixtures;
import com.libragraph.triage.testing.RecycleBinFixtures.Info2Entry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RecycleBinExtractorTest {

    private static final Instant DELETED = Instant.parse("2022-07-19T16:20:00Z");
    private static final String SID = "S-1-5-21-1004336348-1177238915-682003330-1001";

    @TempDir
    Path tempDir;

    private final RecycleBinExtractor extractor = new RecycleBinExtractor();

    @Test
    void indexFilesShouldReportOriginalPathAndRecoverability() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file("/$Recycle.Bin/" + SID + "/$IAB12CD.pdf",
                        RecycleBinFixtures.indexV2("C:\\Users\\bob\\Documents\\report.pdf", 93_211, DELETED))
                .file("/$Recycle.Bin/" + SID + "/$RAB12CD.pdf", "pdf bytes")
                .file("/$Recycle.Bin/" + SID + "/$IZZ99XY.txt",
                        RecycleBinFixtures.indexV2("C:\\Users\\bob\\todo.txt", 12, DELETED.plusSeconds(60)))
                .file("/$Recycle.Bin/" + SID + "/desktop.ini", "[.ShellClassInfo]");

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            List<Artifact> deleted = mounted.run(extractor);

            assertThat(deleted).hasSize(2);
            assertThat(deleted).filteredOn(a -> a.description().contains("report.pdf")).singleElement()
                    .satisfies(a -> {
                        DeletedFile f = (DeletedFile) a.payload();
                        assertThat(f.originalPath()).isEqualTo("C:\\Users\\bob\\Documents\\report.pdf");
                        assertThat(f.size()).isEqualTo(93_211);
                        assertThat(f.deletedAt()).isEqualTo(DELETED);
                        assertThat(f.source()).isEqualTo(DeletedFile.SOURCE_RECYCLE_BIN);
                        assertThat(f.contentRecoverable()).isTrue();
                        assertThat(f.recycledName()).isEqualTo("$RAB12CD.pdf");
                        assertThat(f.profile()).isEqualTo(SID);
                        assertThat(a.timestamp()).isEqualTo(DELETED);
                    });
            assertThat(deleted).filteredOn(a -> a.description().contains("todo.txt")).singleElement()
                    .satisfies(a -> assertThat(((DeletedFile) a.payload()).contentRecoverable()).isFalse());
        }
    }

    @Test
    void info2ShouldYieldOneArtifactPerRecord() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file("/RECYCLER/S-1-5-21-500/INFO2", RecycleBinFixtures.info2(
                        new Info2Entry("C:\\Documents and Settings\\carol\\secret.doc", 1, 2, DELETED, 4096, false),
                        new Info2Entry("C:\\temp\\tool.exe", 2, 2, DELETED.plusSeconds(5), 20_480, false)))
                .file("/RECYCLER/S-1-5-21-500/Dc1.doc", "doc");

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            List<Artifact> deleted = mounted.run(extractor);

            assertThat(deleted).extracting(a -> ((DeletedFile) a.payload()).originalPath())
                    .containsExactlyInAnyOrder("C:\\Documents and Settings\\carol\\secret.doc", "C:\\temp\\tool.exe");
            assertThat(deleted).filteredOn(a -> ((DeletedFile) a.payload()).contentRecoverable())
                    .extracting(a -> ((DeletedFile) a.payload()).recycledName())
                    .containsExactly("Dc1.doc");
        }
    }

    @Test
    void freedMftRecordsShouldBeReportedWithTheirChangeTime() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .directory("/Users/bob/Desktop")
                .deletedFile("/Users/bob/Desktop/plans.docx", "secret plans".getBytes(StandardCharsets.UTF_8), DELETED);

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            List<Artifact> deleted = mounted.run(extractor);

            assertThat(deleted).singleElement().satisfies(a -> {
                DeletedFile f = (DeletedFile) a.payload();
                assertThat(f.originalPath()).isEqualTo("/Users/bob/Desktop/plans.docx");
                assertThat(f.source()).isEqualTo(DeletedFile.SOURCE_MFT);
                assertThat(f.contentRecoverable()).isTrue();
                assertThat(a.timestamp()).isEqualTo(DELETED);
                assertThat(a.sourcePath()).startsWith("vol0:$MFT#");
            });
        }
    }

    @Test
    void truncatedIndexFileShouldWarnAndBeSkipped() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file("/$Recycle.Bin/" + SID + "/$IBROKEN.txt", new byte[]{2, 0, 0})
                .file("/$Recycle.Bin/" + SID + "/$IAB12CD.pdf",
                        RecycleBinFixtures.indexV2("C:\\Users\\bob\\Documents\\report.pdf", 93_211, DELETED));

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            ExtractionContext ctx = ExtractionContext.standalone(MountedImage.CASE, extractor.kind());

            assertThat(mounted.run(extractor, ctx)).hasSize(1);
            assertThat(ctx.warnings()).singleElement().asString().contains("$IBROKEN.txt");
        }
    }
}
