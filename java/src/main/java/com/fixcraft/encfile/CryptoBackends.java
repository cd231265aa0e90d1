package com.fixcraft.encfile;

import java.util.Locale;

public final class CryptoBackends {
    private static final CryptoBackend JAVA = new JavaCryptoBackend();
    private static final CryptoBackend BOUNCY_CASTLE = new BouncyCastleCryptoBackend();

    private CryptoBackends() {}

    public static CryptoBackend get() {
        return byName(System.getenv("ENCFILE_CRYPTO_BACKEND"));
    }

    public static CryptoBackend java() {
        return JAVA;
    }

    public static CryptoBackend bouncyCastle() {
        return BOUNCY_CASTLE;
    }

    public static CryptoBackend byName(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return JAVA;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("jce") || v.equals("java")) {
            return JAVA;
        }
        if (v.equals("bc") || v.equals("bouncycastle")) {
            return BOUNCY_CASTLE;
        }
        throw new IllegalArgumentException("Unknown crypto backend: " + raw);
    }
}
