package com.fixcraft.encfile;

public enum NoncePolicy {
    FIXED,
    // salt nonce XOR big-endian sector index; sector 0 matches FIXED
    SECTOR_INDEX;

    public byte[] nonceFor(byte[] salt, long sector, int nonceLength) {
        byte[] nonce = new byte[nonceLength];
        System.arraycopy(salt, 0, nonce, 0, nonceLength);
        if (this == SECTOR_INDEX) {
            for (int i = 0; i < 8; i++) {
                nonce[nonceLength - 1 - i] ^= (byte) (sector >>> (8 * i));
            }
        }
        return nonce;
    }
}
