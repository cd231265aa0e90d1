package com.fixcraft.encfile;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RandomAccessTest {
    private static final byte[] PASSPHRASE = "A great little thing whatever".getBytes(StandardCharsets.UTF_8);
    private static final int SECTOR_SIZE = 512;
    private static final int SECTORS = 20;

    @TempDir
    Path dir;

    @Test
    void randomReadsAndWritesMatchMirror() throws IOException {
        runAgainstMirror(EncryptedFileTest.fastOptions(SECTOR_SIZE), 20240611L);
    }

    @Test
    void randomAccessWithPerSectorNonces() throws IOException {
        FileOptions options = EncryptedFileTest.fastOptions(SECTOR_SIZE);
        options.noncePolicy = NoncePolicy.SECTOR_INDEX;
        options.backend = CryptoBackends.bouncyCastle();
        runAgainstMirror(options, 7L);
    }

    @Test
    void repeatedSpanningWritesReadBack() throws IOException {
        Random rnd = new Random(42L);
        try (EncryptedFile ef = EncryptedFile.create(dir.resolve("span.enc"), PASSPHRASE,
                EncryptedFileTest.fastOptions(SECTOR_SIZE))) {
            for (int i = 0; i < 200; i++) {
                int length = SECTOR_SIZE * 2 + 10;
                byte[] written = new byte[length];
                rnd.nextBytes(written);
                assertEquals(length, ef.writeAt(written, SECTOR_SIZE));
                byte[] back = new byte[length];
                assertEquals(length, ef.readAt(back, SECTOR_SIZE));
                assertArrayEquals(written, back);
            }
        }
    }

    @Test
    void growingFileThroughCursor() throws IOException {
        Random rnd = new Random(99L);
        byte[] mirror = new byte[SECTOR_SIZE * 6 + 77];
        rnd.nextBytes(mirror);
        try (EncryptedFile ef = EncryptedFile.create(dir.resolve("cursor.enc"), PASSPHRASE,
                EncryptedFileTest.fastOptions(SECTOR_SIZE))) {
            ef.seek(0);
            int pos = 0;
            while (pos < mirror.length) {
                int chunk = Math.min(mirror.length - pos, 1 + rnd.nextInt(700));
                assertEquals(chunk, ef.write(Arrays.copyOfRange(mirror, pos, pos + chunk)));
                pos += chunk;
            }
            ef.seek(0);
            byte[] back = new byte[mirror.length];
            assertEquals(mirror.length, ef.read(back));
            assertArrayEquals(mirror, back);
        }
    }

    private void runAgainstMirror(FileOptions options, long seed) throws IOException {
        Random rnd = new Random(seed);
        byte[] mirror = new byte[SECTOR_SIZE * SECTORS];
        rnd.nextBytes(mirror);
        try (EncryptedFile ef = EncryptedFile.create(dir.resolve("mirror.enc"), PASSPHRASE, options)) {
            assertEquals(mirror.length, ef.writeAt(mirror, 0));

            for (int i = 0; i < 1000; i++) {
                int[] span = randomSpan(rnd, mirror.length);
                byte[] read = new byte[span[1]];
                assertEquals(span[1], ef.readAt(read, span[0]));
                assertArrayEquals(Arrays.copyOfRange(mirror, span[0], span[0] + span[1]), read,
                    "read at " + span[0] + " length " + span[1]);

                span = randomSpan(rnd, mirror.length);
                byte[] write = new byte[span[1]];
                rnd.nextBytes(write);
                assertEquals(span[1], ef.writeAt(write, span[0]));
                System.arraycopy(write, 0, mirror, span[0], span[1]);
            }

            byte[] all = new byte[mirror.length];
            assertEquals(mirror.length, ef.readAt(all, 0));
            assertArrayEquals(mirror, all);
            assertEquals(SECTORS, ef.countSectors());
        }
    }

    // position and non-zero length inside the image, length at most half of it
    private static int[] randomSpan(Random rnd, int size) {
        int pos = rnd.nextInt(size - 1);
        int length = 1 + rnd.nextInt(Math.min(size / 2, size - pos));
        return new int[] {pos, length};
    }
}
