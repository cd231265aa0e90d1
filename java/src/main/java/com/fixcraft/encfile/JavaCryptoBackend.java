package com.fixcraft.encfile;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

public final class JavaCryptoBackend implements CryptoBackend {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    @Override
    public String name() {
        return "jce";
    }

    @Override
    public int nonceLength() {
        return Constants.AEAD_NONCE_LEN;
    }

    @Override
    public byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException {
        return newCipher(Cipher.ENCRYPT_MODE, key, nonce).doFinal(plaintext);
    }

    @Override
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext) throws GeneralSecurityException {
        if (ciphertext.length < Constants.AEAD_TAG_LEN) {
            throw new AEADBadTagException("Ciphertext shorter than tag");
        }
        return newCipher(Cipher.DECRYPT_MODE, key, nonce).doFinal(ciphertext);
    }

    // A fresh Cipher per call: SunJCE refuses to re-init one instance for encryption with the same key and IV.
    private static Cipher newCipher(int mode, byte[] key, byte[] nonce) throws GeneralSecurityException {
        if (key.length < Constants.AES_KEY_LEN) {
            throw new InvalidKeyException("AES key too short: " + key.length);
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        GCMParameterSpec spec = new GCMParameterSpec(Constants.AEAD_TAG_LEN * 8, nonce, 0, Constants.AEAD_NONCE_LEN);
        cipher.init(mode, new SecretKeySpec(key, 0, Constants.AES_KEY_LEN, "AES"), spec);
        return cipher;
    }
}
