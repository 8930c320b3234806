package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Blake3HasherTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyFile_hasKnownDigest() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty.csv"));

        assertEquals("af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262",
                Blake3Hasher.hashFile(file));
    }

    @Test
    void digest_tracksContent() throws IOException {
        Path a = Files.writeString(tempDir.resolve("a.csv"), "dataset_id\n1\n");
        Path b = Files.writeString(tempDir.resolve("b.csv"), "dataset_id\n1\n");
        Path c = Files.writeString(tempDir.resolve("c.csv"), "dataset_id\n2\n");

        assertEquals(Blake3Hasher.hashFile(a), Blake3Hasher.hashFile(b));
        assertNotEquals(Blake3Hasher.hashFile(a), Blake3Hasher.hashFile(c));
        assertEquals(64, Blake3Hasher.hashFile(a).length());
    }
}
