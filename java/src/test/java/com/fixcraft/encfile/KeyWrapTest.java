package com.fixcraft.encfile;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class KeyWrapTest {
    private static final byte[] SALT = new byte[Constants.SALT_SIZE];
    private static final byte[] PASSPHRASE = "A great little thing whatever".getBytes(StandardCharsets.UTF_8);

    static {
        for (int i = 0; i < SALT.length; i++) {
            SALT[i] = (byte) (i * 7 + 1);
        }
    }

    private static KeyWrap.KdfOptions fast() {
        return new KeyWrap.KdfOptions(1024, 8, 1);
    }

    @Test
    void derivationIsDeterministicPerSalt() throws Exception {
        byte[] a = KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, fast());
        byte[] b = KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, fast());
        assertEquals(Constants.KEY_SIZE, a.length);
        assertArrayEquals(a, b);

        byte[] otherSalt = SALT.clone();
        otherSalt[0] ^= 1;
        assertFalse(Arrays.equals(a, KeyWrap.deriveWrappingKey(PASSPHRASE, otherSalt, fast())));
    }

    @Test
    void scryptMatchesBouncyCastleDirectly() throws Exception {
        byte[] expected = org.bouncycastle.crypto.generators.SCrypt.generate(PASSPHRASE, SALT, 1024, 8, 1, 64);
        assertArrayEquals(expected, KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, fast()));
    }

    @Test
    void rawKeyLengthPassphraseIsUsedAsIs() throws Exception {
        byte[] raw = Crypto.randomBytes(Constants.KEY_SIZE);
        byte[] derived = KeyWrap.deriveWrappingKey(raw, SALT, fast());
        assertArrayEquals(raw, derived);
        assertNotSame(raw, derived);
    }

    @Test
    void badCostParametersFailDerivation() {
        assertThrows(KeyDerivationException.class,
            () -> KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, new KeyWrap.KdfOptions(1000, 8, 1)));
        assertThrows(KeyDerivationException.class,
            () -> KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, KeyWrap.KdfOptions.pbkdf2(0)));
        KeyWrap.KdfOptions unknown = fast();
        unknown.label = "argon2id";
        assertThrows(IllegalArgumentException.class, () -> KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, unknown));
    }

    @Test
    void wrapThenUnwrap() throws Exception {
        for (CryptoBackend backend : new CryptoBackend[] {CryptoBackends.java(), CryptoBackends.bouncyCastle()}) {
            byte[] wrappingKey = KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, KeyWrap.KdfOptions.pbkdf2(1000));
            byte[] realKey = KeyWrap.newFileKey(Crypto.defaultRandom());
            byte[] wrapped = KeyWrap.wrap(backend, wrappingKey, SALT, realKey);
            assertEquals(Constants.WRAPPED_KEY_SIZE, wrapped.length);
            assertArrayEquals(realKey, KeyWrap.unwrap(backend, wrappingKey, SALT, wrapped));
        }
    }

    @Test
    void unwrapWithWrongKeyFailsAuthentication() throws Exception {
        CryptoBackend backend = CryptoBackends.java();
        byte[] wrappingKey = KeyWrap.deriveWrappingKey(PASSPHRASE, SALT, fast());
        byte[] wrapped = KeyWrap.wrap(backend, wrappingKey, SALT, KeyWrap.newFileKey(Crypto.defaultRandom()));
        byte[] wrongKey = KeyWrap.deriveWrappingKey("nope".getBytes(StandardCharsets.UTF_8), SALT, fast());
        assertThrows(AuthenticationException.class, () -> KeyWrap.unwrap(backend, wrongKey, SALT, wrapped));

        byte[] corrupted = wrapped.clone();
        corrupted[corrupted.length - 1] ^= 0x40;
        assertThrows(AuthenticationException.class, () -> KeyWrap.unwrap(backend, wrappingKey, SALT, corrupted));
    }

    @Test
    void headerLayout() throws Exception {
        byte[] wrapped = new byte[Constants.WRAPPED_KEY_SIZE];
        Arrays.fill(wrapped, (byte) 0x5a);
        FileHeader header = new FileHeader(SALT, wrapped);
        byte[] bytes = header.toBytes();
        assertEquals(112, bytes.length);
        assertArrayEquals(SALT, Arrays.copyOfRange(bytes, 0, 32));
        assertArrayEquals(wrapped, Arrays.copyOfRange(bytes, 32, 112));

        FileHeader parsed = FileHeader.parse(bytes, bytes.length);
        assertArrayEquals(SALT, parsed.salt());
        assertArrayEquals(wrapped, parsed.wrappedKey());
        assertThrows(AuthenticationException.class, () -> FileHeader.parse(bytes, 111));
    }
}
