package com.fixcraft.encfile;

import java.security.GeneralSecurityException;
import javax.crypto.AEADBadTagException;

public final class SectorCipher {
    private final CryptoBackend backend;
    private final byte[] sectorKey;
    private final byte[] salt;
    private final NoncePolicy noncePolicy;

    SectorCipher(CryptoBackend backend, byte[] realKey, byte[] salt, NoncePolicy noncePolicy) {
        this.backend = backend;
        this.sectorKey = new byte[Constants.AES_KEY_LEN];
        System.arraycopy(realKey, Constants.SECTOR_KEY_OFFSET, sectorKey, 0, Constants.AES_KEY_LEN);
        this.salt = salt.clone();
        this.noncePolicy = noncePolicy;
    }

    byte[] encryptSector(long sector, byte[] plaintext) {
        return encrypt(backend, sectorKey, noncePolicy.nonceFor(salt, sector, backend.nonceLength()), plaintext);
    }

    byte[] decryptSector(long sector, byte[] ciphertext) throws AuthenticationException {
        try {
            return decrypt(backend, sectorKey, noncePolicy.nonceFor(salt, sector, backend.nonceLength()), ciphertext);
        } catch (AuthenticationException exc) {
            throw new AuthenticationException("Sector " + sector + " failed authentication", exc.getCause());
        }
    }

    void destroy() {
        Crypto.wipe(sectorKey);
    }

    public static byte[] encrypt(CryptoBackend backend, byte[] key, byte[] nonce, byte[] plaintext) {
        try {
            return backend.seal(key, nonce, plaintext);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("AES-GCM encrypt failed", exc);
        }
    }

    public static byte[] decrypt(CryptoBackend backend, byte[] key, byte[] nonce, byte[] ciphertext)
        throws AuthenticationException {
        try {
            return backend.open(key, nonce, ciphertext);
        } catch (AEADBadTagException exc) {
            throw new AuthenticationException("AES-GCM auth failed", exc);
        } catch (GeneralSecurityException exc) {
            throw new IllegalStateException("AES-GCM decrypt failed", exc);
        }
    }
}
