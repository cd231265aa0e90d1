package com.fixcraft.encfile;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import javax.crypto.AEADBadTagException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.AEADBlockCipher;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

public final class BouncyCastleCryptoBackend implements CryptoBackend {

    @Override
    public String name() {
        return "bc";
    }

    @Override
    public int nonceLength() {
        return Constants.AEAD_NONCE_LEN;
    }

    @Override
    public byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException {
        AEADBlockCipher cipher = newCipher(true, key, nonce);
        byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
        int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
        try {
            cipher.doFinal(out, len);
        } catch (InvalidCipherTextException exc) {
            throw new IllegalStateException("AES-GCM encrypt failed", exc);
        }
        return out;
    }

    @Override
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext) throws GeneralSecurityException {
        if (ciphertext.length < Constants.AEAD_TAG_LEN) {
            throw new AEADBadTagException("Ciphertext shorter than tag");
        }
        AEADBlockCipher cipher = newCipher(false, key, nonce);
        byte[] out = new byte[cipher.getOutputSize(ciphertext.length)];
        int len = cipher.processBytes(ciphertext, 0, ciphertext.length, out, 0);
        try {
            cipher.doFinal(out, len);
        } catch (InvalidCipherTextException exc) {
            AEADBadTagException bad = new AEADBadTagException(exc.getMessage());
            bad.initCause(exc);
            throw bad;
        }
        return out;
    }

    private static AEADBlockCipher newCipher(boolean encrypt, byte[] key, byte[] nonce) throws InvalidKeyException {
        if (key.length < Constants.AES_KEY_LEN) {
            throw new InvalidKeyException("AES key too short: " + key.length);
        }
        byte[] iv = new byte[Constants.AEAD_NONCE_LEN];
        System.arraycopy(nonce, 0, iv, 0, iv.length);
        AEADBlockCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
        cipher.init(encrypt, new AEADParameters(
            new KeyParameter(key, 0, Constants.AES_KEY_LEN), Constants.AEAD_TAG_LEN * 8, iv));
        return cipher;
    }
}
