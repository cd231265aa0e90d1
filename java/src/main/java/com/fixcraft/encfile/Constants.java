package com.fixcraft.encfile;

public final class Constants {
    private Constants() {}

    public static final int KEY_SIZE = 64;
    public static final int BLOCK_SIZE = 16;
    public static final int AES_KEY_LEN = 32;

    public static final int SALT_SIZE = 32;
    public static final int AEAD_NONCE_LEN = 12;
    public static final int AEAD_TAG_LEN = 16;

    public static final int WRAPPED_KEY_SIZE = KEY_SIZE + AEAD_TAG_LEN;
    public static final int HEADER_SIZE = SALT_SIZE + WRAPPED_KEY_SIZE;
    public static final int SECTOR_FOOTER = AEAD_TAG_LEN;

    // Offset of the sector key half inside the real key.
    public static final int SECTOR_KEY_OFFSET = 32;

    public static final String KDF_SCRYPT = "scrypt";
    public static final String KDF_PBKDF2 = "pbkdf2";

    private static final Integer TEST_KDF_ITERS = envInt("ENCFILE_TEST_KDF_ITERS");
    public static final boolean TEST_KDF_OVERRIDE = TEST_KDF_ITERS != null;

    public static final int SCRYPT_N = resolveScryptN();
    public static final int SCRYPT_R = envIntOr("ENCFILE_SCRYPT_R", 8);
    public static final int SCRYPT_P = envIntOr("ENCFILE_SCRYPT_P", 1);
    public static final int PBKDF2_ITERATIONS = resolvePbkdf2Iterations();

    public static final int DEFAULT_SECTOR_SIZE = envIntOr("ENCFILE_SECTOR_SIZE", 512);

    public static final String ENGINE_VERSION = "1.0.0";

    private static int resolveScryptN() {
        Integer env = envInt("ENCFILE_SCRYPT_N");
        if (env != null) {
            return env;
        }
        if (TEST_KDF_ITERS != null) {
            // scrypt wants a power of two
            return Math.max(2, Integer.highestOneBit(TEST_KDF_ITERS));
        }
        return 16384;
    }

    private static int resolvePbkdf2Iterations() {
        Integer env = envInt("ENCFILE_PBKDF2_ITERS");
        if (env != null) {
            return env;
        }
        if (TEST_KDF_ITERS != null) {
            return TEST_KDF_ITERS;
        }
        return 200000;
    }

    private static int envIntOr(String name, int fallback) {
        Integer env = envInt(name);
        return env != null ? env : fallback;
    }

    private static Integer envInt(String name) {
        String raw = System.getenv(name);
        if (raw == null) {
            return null;
        }
        raw = raw.trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException exc) {
            RuntimeLog.warn("ignoring non-numeric " + name + "=" + raw);
            return null;
        }
    }
}
