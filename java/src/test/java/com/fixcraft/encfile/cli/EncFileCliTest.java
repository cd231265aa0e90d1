package com.fixcraft.encfile.cli;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EncFileCliTest {
    @TempDir
    Path dir;

    private ByteArrayOutputStream captured;
    private PrintStream out;
    private Path file;

    @BeforeEach
    void setUp() {
        captured = new ByteArrayOutputStream();
        out = new PrintStream(captured, true);
        file = dir.resolve("cli.enc");
    }

    private int run(String... args) {
        captured.reset();
        return EncFileCli.run(args, out);
    }

    private String output() {
        return new String(captured.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void writeThenReadToStdout() throws Exception {
        assertEquals(0, run("--sector-size", "64", "create", file.toString(), "pw"));
        assertTrue(output().contains("sector size 64"));

        Path in = dir.resolve("in.bin");
        byte[] payload = "spans more than one sixty-four byte sector of the file".getBytes(StandardCharsets.UTF_8);
        Files.write(in, payload);
        assertEquals(0, run("--sector-size", "64", "write", file.toString(), "pw", "40", in.toString()));
        assertEquals("wrote " + payload.length + " bytes", output().trim());

        assertEquals(0, run("--sector-size", "64", "read", file.toString(), "pw", "40",
            String.valueOf(payload.length), "-"));
        assertArrayEquals(payload, captured.toByteArray());

        Path dump = dir.resolve("out.bin");
        assertEquals(0, run("--sector-size", "64", "read", file.toString(), "pw", "0", "40", dump.toString()));
        assertArrayEquals(new byte[40], Files.readAllBytes(dump));
    }

    @Test
    void infoReportsSectors() {
        assertEquals(0, run("--kdf", "pbkdf2", "create", file.toString(), "pw"));
        assertEquals(0, run("--kdf", "pbkdf2", "info", file.toString(), "pw"));
        String info = output();
        assertTrue(info.contains("size:        112"), info);
        assertTrue(info.contains("sectors:     0"), info);
    }

    @Test
    void passwdSwitchesPassphrase() {
        assertEquals(0, run("create", file.toString(), "old"));
        assertEquals(0, run("passwd", file.toString(), "old", "new"));
        assertEquals(1, run("info", file.toString(), "old"));
        assertEquals(0, run("info", file.toString(), "new"));
    }

    @Test
    void zeroMakesSectorUnreadable() throws Exception {
        Path in = dir.resolve("in.bin");
        byte[] payload = new byte[100];
        Arrays.fill(payload, (byte) 7);
        Files.write(in, payload);
        assertEquals(0, run("--nonce", "sector", "--crypto", "bc", "create", file.toString(), "pw"));
        assertEquals(0, run("--nonce", "sector", "write", file.toString(), "pw", "0", in.toString()));
        assertEquals(0, run("--nonce", "sector", "read", file.toString(), "pw", "0", "100", "-"));
        assertArrayEquals(payload, captured.toByteArray());
        assertEquals(0, run("zero", file.toString(), "pw", "0"));
        assertEquals(1, run("--nonce", "sector", "read", file.toString(), "pw", "0", "100", "-"));
    }

    @Test
    void deleteRemovesFile() {
        assertEquals(0, run("create", file.toString(), "pw"));
        assertEquals(0, run("delete", file.toString(), "pw"));
        assertFalse(Files.exists(file));
        assertEquals(1, run("info", file.toString(), "pw"));
    }

    @Test
    void usageErrors() {
        assertEquals(2, run());
        assertTrue(output().contains("create <file> <password>"));
        assertEquals(2, run("-v"));
        assertEquals(2, run("frobnicate", file.toString()));
        assertEquals(2, run("create", file.toString()));
        assertEquals(2, run("--sector-size"));
        assertEquals(2, run("--nonce", "random", "create", file.toString(), "pw"));
        assertEquals(1, run("--sector-size", "100", "create", file.toString(), "pw"));
        assertEquals(2, run("--sector-size", "4294967312", "create", file.toString(), "pw"));
        assertFalse(Files.exists(file));
    }

    @Test
    void oversizedReadLengthIsUsageError() {
        assertEquals(0, run("create", file.toString(), "pw"));
        assertEquals(2, run("read", file.toString(), "pw", "0", "4294967296", "-"));
        assertEquals(2, run("read", file.toString(), "pw", "0", "-1", "-"));
        assertEquals(0, captured.size());
    }
}
