package com.fixcraft.encfile;

import java.io.IOException;
import java.util.Arrays;

// [0, 32) salt, [32, 112) wrapped file key (64 key bytes + 16 tag bytes)
public final class FileHeader {
    private final byte[] salt;
    private final byte[] wrappedKey;

    public FileHeader(byte[] salt, byte[] wrappedKey) {
        if (salt.length != Constants.SALT_SIZE) {
            throw new IllegalArgumentException("salt must be " + Constants.SALT_SIZE + " bytes");
        }
        if (wrappedKey.length != Constants.WRAPPED_KEY_SIZE) {
            throw new IllegalArgumentException("wrapped key must be " + Constants.WRAPPED_KEY_SIZE + " bytes");
        }
        this.salt = salt.clone();
        this.wrappedKey = wrappedKey.clone();
    }

    public byte[] salt() {
        return salt.clone();
    }

    public byte[] wrappedKey() {
        return wrappedKey.clone();
    }

    public FileHeader withWrappedKey(byte[] newWrappedKey) {
        return new FileHeader(salt, newWrappedKey);
    }

    public byte[] toBytes() {
        byte[] out = new byte[Constants.HEADER_SIZE];
        System.arraycopy(salt, 0, out, 0, salt.length);
        System.arraycopy(wrappedKey, 0, out, Constants.SALT_SIZE, wrappedKey.length);
        return out;
    }

    public static FileHeader parse(byte[] data, int length) throws AuthenticationException {
        if (length < Constants.HEADER_SIZE) {
            throw new AuthenticationException("Header truncated: " + length + " of " + Constants.HEADER_SIZE + " bytes");
        }
        return new FileHeader(
            Arrays.copyOfRange(data, 0, Constants.SALT_SIZE),
            Arrays.copyOfRange(data, Constants.SALT_SIZE, Constants.HEADER_SIZE));
    }

    public static FileHeader readFrom(Storage storage) throws IOException {
        byte[] buf = new byte[Constants.HEADER_SIZE];
        storage.seek(0);
        int n = Storage.readFully(storage, buf, 0, buf.length);
        return parse(buf, Math.max(n, 0));
    }

    public void writeTo(Storage storage) throws IOException {
        storage.seek(0);
        Storage.writeFully(storage, toBytes(), 0, Constants.HEADER_SIZE);
    }
}
