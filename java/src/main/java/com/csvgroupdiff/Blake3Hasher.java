package com.csvgroupdiff;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.Blake3;

/**
 * BLAKE3 digests of the input files, so a report can be traced back to the exact
 * bytes it was produced from.
 */
public final class Blake3Hasher {
    private static final int BUFFER_BYTES = 64 * 1024;
    private static final int HASH_BYTES = 32;

    private Blake3Hasher() {}

    public static String hashFile(Path file) throws IOException {
        Blake3 hasher = Blake3.initHash();
        byte[] buffer = new byte[BUFFER_BYTES];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                hasher.update(buffer, 0, read);
            }
        }
        return Hex.encodeHexString(hasher.doFinalize(HASH_BYTES));
    }
}
