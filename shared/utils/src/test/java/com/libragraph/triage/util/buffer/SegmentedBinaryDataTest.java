package com.libragraph.triage.util.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SegmentedBinaryDataTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStitchSegmentsIntoOneAddressSpace() throws Exception {
        Path a = write("a.bin", "HELLO");
        Path b = write("b.bin", "WORLD");
        Path c = write("c.bin", "!");

        try (SegmentedBinaryData data = SegmentedBinaryData.open(List.of(a, b, c))) {
            assertThat(data.size()).isEqualTo(11);
            assertThat(data.segmentCount()).isEqualTo(3);
            assertThat(data.segmentStart(1)).isEqualTo(5);
            assertThat(new String(data.readAll())).isEqualTo("HELLOWORLD!");
        }
    }

    @Test
    void readAcrossSeamShouldMatchConcatenation() throws Exception {
        Path a = write("a.bin", "0123456789");
        Path b = write("b.bin", "abcdefghij");

        try (SegmentedBinaryData data = SegmentedBinaryData.open(List.of(a, b))) {
            assertThat(new String(data.read(7, 6))).isEqualTo("789abc");
            assertThat(new String(data.read(10, 1))).isEqualTo("a");
            assertThat(new String(data.read(9, 1))).isEqualTo("9");
        }
    }

    @Test
    void sequentialChannelReadsShouldCrossSeams() throws Exception {
        Path a = write("a.bin", "abc");
        Path b = write("b.bin", "def");

        try (SegmentedBinaryData data = SegmentedBinaryData.open(List.of(a, b))) {
            data.position(1);
            ByteBuffer dst = ByteBuffer.allocate(4);
            while (dst.hasRemaining() && data.read(dst) > 0) {
                // keep reading
            }
            assertThat(new String(dst.array())).isEqualTo("bcde");
            assertThat(data.position()).isEqualTo(5);
        }
    }

    @Test
    void shouldSkipEmptySegments() throws Exception {
        Path a = write("a.bin", "abc");
        Path empty = write("empty.bin", "");
        Path b = write("b.bin", "def");

        try (SegmentedBinaryData data = SegmentedBinaryData.open(List.of(a, empty, b))) {
            assertThat(new String(data.read(2, 3))).isEqualTo("cde");
        }
    }

    @Test
    void shouldRejectReadPastEnd() throws Exception {
        Path a = write("a.bin", "abc");

        try (SegmentedBinaryData data = SegmentedBinaryData.open(List.of(a))) {
            assertThatThrownBy(() -> data.read(2, 2)).isInstanceOf(EOFException.class);
        }
    }

    private Path write(String name, String content) throws Exception {
        Path p = tempDir.resolve(name);
        Files.writeString(p, content);
        return p;
    }
}
