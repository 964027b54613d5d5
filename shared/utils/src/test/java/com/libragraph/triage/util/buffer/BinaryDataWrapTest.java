package com.libragraph.triage.util.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class BinaryDataWrapTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWrapByteChannel() throws Exception {
        Path tmp = tempDir.resolve("wrap.bin");
        Files.writeString(tmp, "Hello, BinaryData!");

        try (BinaryData bd = BinaryData.wrap(Files.newByteChannel(tmp))) {
            assertThat(bd.size()).isEqualTo(18);
        }
    }

    @Test
    void shouldReadHeaderAndRestorePosition() throws Exception {
        Path tmp = tempDir.resolve("header.bin");
        Files.writeString(tmp, "ABCDEFGHIJ");

        try (BinaryData bd = BinaryData.wrap(Files.newByteChannel(tmp))) {
            bd.position(3);
            byte[] header = bd.readHeader(4);

            assertThat(new String(header)).isEqualTo("ABCD");
            assertThat(bd.position()).isEqualTo(3);
        }
    }

    @Test
    void shouldReturnShortHeaderForSmallData() throws Exception {
        Path tmp = tempDir.resolve("small.bin");
        Files.writeString(tmp, "AB");

        try (BinaryData bd = BinaryData.wrap(Files.newByteChannel(tmp))) {
            assertThat(bd.readHeader(512)).hasSize(2);
        }
    }

    @Test
    void shouldProvideInputStream() throws Exception {
        Path tmp = tempDir.resolve("stream.bin");
        Files.writeString(tmp, "Stream content");

        try (BinaryData bd = BinaryData.wrap(Files.newByteChannel(tmp))) {
            InputStream is = bd.inputStream(7);
            assertThat(new String(is.readAllBytes())).isEqualTo("content");
        }
    }
}
