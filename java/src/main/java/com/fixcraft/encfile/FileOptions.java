package com.fixcraft.encfile;

import java.security.SecureRandom;

// Not persisted: reopen a file with the settings it was created with.
public final class FileOptions {
    public int sectorSize = Constants.DEFAULT_SECTOR_SIZE;
    public KeyWrap.KdfOptions kdf = new KeyWrap.KdfOptions();
    public NoncePolicy noncePolicy = NoncePolicy.FIXED;
    public SecureRandom random = Crypto.defaultRandom();
    public CryptoBackend backend = CryptoBackends.get();

    public FileOptions() {}

    public FileOptions(int sectorSize) {
        this.sectorSize = sectorSize;
    }

    void validate() {
        if (sectorSize <= 0 || sectorSize % Constants.BLOCK_SIZE != 0) {
            throw new IllegalArgumentException(
                "Sector size " + sectorSize + " is no positive multiple of " + Constants.BLOCK_SIZE);
        }
        if (kdf == null || noncePolicy == null || random == null || backend == null) {
            throw new IllegalArgumentException("Incomplete file options");
        }
    }
}
