package com.fixcraft.encfile;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Locale;
import javax.crypto.AEADBadTagException;

public final class KeyWrap {
    private KeyWrap() {}

    /**
     * Derives a {@link Constants#KEY_SIZE}-byte wrapping key. A passphrase that is exactly
     * {@code KEY_SIZE} bytes long is taken as a raw key and returned as a copy.
     */
    public static byte[] deriveWrappingKey(byte[] passphrase, byte[] salt, KdfOptions kdf) throws KeyDerivationException {
        if (passphrase == null) {
            throw new IllegalArgumentException("Passphrase required");
        }
        if (passphrase.length == Constants.KEY_SIZE) {
            return passphrase.clone();
        }
        String label = resolveKdfLabel(kdf.label);
        try {
            if (Constants.KDF_PBKDF2.equals(label)) {
                return Crypto.pbkdf2HmacSha256(passphrase, salt, kdf.pbkdf2Iterations, Constants.KEY_SIZE);
            }
            return Crypto.scrypt(passphrase, salt, kdf.scryptN, kdf.scryptR, kdf.scryptP, Constants.KEY_SIZE);
        } catch (IllegalArgumentException exc) {
            throw new KeyDerivationException(label + " rejected its parameters: " + exc.getMessage(), exc);
        }
    }

    public static byte[] newFileKey(SecureRandom random) {
        return Crypto.randomBytes(random, Constants.KEY_SIZE);
    }

    public static byte[] wrap(CryptoBackend backend, byte[] wrappingKey, byte[] salt, byte[] realKey) {
        try {
            return backend.seal(wrappingKey, salt, realKey);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("Key wrap failed", exc);
        }
    }

    public static byte[] unwrap(CryptoBackend backend, byte[] wrappingKey, byte[] salt, byte[] wrappedKey)
        throws AuthenticationException {
        try {
            return backend.open(wrappingKey, salt, wrappedKey);
        } catch (AEADBadTagException exc) {
            throw new AuthenticationException("Bad passphrase or corrupted header", exc);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("Key unwrap failed", exc);
        }
    }

    private static String resolveKdfLabel(String label) {
        if (label == null || label.isEmpty() || "auto".equalsIgnoreCase(label)) {
            return Constants.KDF_SCRYPT;
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        if (!Constants.KDF_SCRYPT.equals(normalized) && !Constants.KDF_PBKDF2.equals(normalized)) {
            throw new IllegalArgumentException("Unsupported KDF label: " + normalized);
        }
        return normalized;
    }

    public static final class KdfOptions {
        public String label = Constants.KDF_SCRYPT;
        public int scryptN = Constants.SCRYPT_N;
        public int scryptR = Constants.SCRYPT_R;
        public int scryptP = Constants.SCRYPT_P;
        public int pbkdf2Iterations = Constants.PBKDF2_ITERATIONS;

        public KdfOptions() {}

        public KdfOptions(int scryptN, int scryptR, int scryptP) {
            this.scryptN = scryptN;
            this.scryptR = scryptR;
            this.scryptP = scryptP;
        }

        public static KdfOptions pbkdf2(int iterations) {
            KdfOptions opts = new KdfOptions();
            opts.label = Constants.KDF_PBKDF2;
            opts.pbkdf2Iterations = iterations;
            return opts;
        }
    }
}
