package com.fixcraft.encfile;

import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.crypto.params.KeyParameter;

public final class Crypto {
    private static final SecureRandom RNG = new SecureRandom();

    private Crypto() {}

    public static SecureRandom defaultRandom() {
        return RNG;
    }

    public static byte[] randomBytes(int length) {
        return randomBytes(RNG, length);
    }

    public static byte[] randomBytes(SecureRandom random, int length) {
        byte[] out = new byte[length];
        if (length > 0) {
            random.nextBytes(out);
        }
        return out;
    }

    public static byte[] scrypt(byte[] password, byte[] salt, int n, int r, int p, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0");
        }
        return SCrypt.generate(password, salt, n, r, p, length);
    }

    public static byte[] pbkdf2HmacSha256(byte[] password, byte[] salt, int iterations, int length) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0");
        }
        PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
        gen.init(password, salt, iterations);
        return ((KeyParameter) gen.generateDerivedParameters(length * 8)).getKey();
    }

    public static void wipe(byte[] data) {
        if (data != null) {
            Arrays.fill(data, (byte) 0);
        }
    }

    static boolean isAllZero(byte[] data) {
        int acc = 0;
        for (byte b : data) {
            acc |= b;
        }
        return acc == 0;
    }
}
