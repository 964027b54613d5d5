package com.libragraph.triage.util.buffer;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileBufferTest {

    @Test
    void shouldReadAndWrite() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("Hello".getBytes()));
            assertThat(buf.size()).isEqualTo(5);

            buf.position(0);
            ByteBuffer dst = ByteBuffer.allocate(5);
            buf.read(dst);
            dst.flip();
            assertThat(new String(dst.array(), 0, dst.remaining())).isEqualTo("Hello");
        }
    }

    @Test
    void positionalReadShouldNotMoveChannel() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("0123456789".getBytes()));
            buf.position(2);

            assertThat(new String(buf.read(5, 3))).isEqualTo("567");
            assertThat(buf.position()).isEqualTo(2);
        }
    }

    @Test
    void positionalReadPastEndShouldFail() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("abc".getBytes()));

            assertThatThrownBy(() -> buf.read(1, 5)).isInstanceOf(EOFException.class);
        }
    }

    @Test
    void shouldTruncate() throws Exception {
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("Hello, World!".getBytes()));
            assertThat(buf.size()).isEqualTo(13);

            buf.truncate(5);
            assertThat(buf.size()).isEqualTo(5);
            assertThat(new String(buf.readAll())).isEqualTo("Hello");
        }
    }

    @Test
    void shouldHandleLargeWrite() throws Exception {
        byte[] chunk = "A".repeat(1024).getBytes();
        int chunks = 5 * 1024; // 5 MB total

        try (FileBuffer buf = new FileBuffer()) {
            for (int i = 0; i < chunks; i++) {
                buf.write(ByteBuffer.wrap(chunk));
            }

            assertThat(buf.size()).isEqualTo((long) chunk.length * chunks);
            assertThat(buf.read(buf.size() - 1024, 1024)).isEqualTo(chunk);
        }
    }

    @Test
    void shouldDeleteTempFileOnClose() throws Exception {
        Path tempPath;
        try (FileBuffer buf = new FileBuffer()) {
            buf.write(ByteBuffer.wrap("temp".getBytes()));
            tempPath = buf.path();
            assertThat(Files.exists(tempPath)).isTrue();
        }
        assertThat(Files.exists(tempPath)).isFalse();
    }

    @Test
    void allocateShouldPickFileBufferForLargeSize() throws Exception {
        Buffer small = Buffer.allocate(1024);
        assertThat(small).isInstanceOf(RamBuffer.class);

        try (Buffer large = Buffer.allocate(Buffer.FILE_THRESHOLD)) {
            assertThat(large).isInstanceOf(FileBuffer.class);
        }
    }
}
