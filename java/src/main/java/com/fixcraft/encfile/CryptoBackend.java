package com.fixcraft.encfile;

import java.security.GeneralSecurityException;
import javax.crypto.AEADBadTagException;

public interface CryptoBackend {
    String name();

    int nonceLength();

    byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException;

    byte[] open(byte[] key, byte[] nonce, byte[] ciphertext)
        throws AEADBadTagException, GeneralSecurityException;
}
