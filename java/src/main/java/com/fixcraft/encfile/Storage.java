package com.fixcraft.encfile;

import java.io.Closeable;
import java.io.IOException;

public interface Storage extends Closeable {
    String name();

    void seek(long position) throws IOException;

    long position() throws IOException;

    /**
     * @return bytes read, or -1 at end of storage
     */
    int read(byte[] buf, int off, int len) throws IOException;

    int write(byte[] buf, int off, int len) throws IOException;

    StorageStat stat() throws IOException;

    void sync() throws IOException;

    void truncate(long size) throws IOException;

    @Override
    void close() throws IOException;

    static int readFully(Storage storage, byte[] buf, int off, int len) throws IOException {
        int total = 0;
        while (total < len) {
            int read = storage.read(buf, off + total, len - total);
            if (read < 0) {
                break;
            }
            total += read;
        }
        return total;
    }

    static void writeFully(Storage storage, byte[] buf, int off, int len) throws IOException {
        int total = 0;
        while (total < len) {
            int written = storage.write(buf, off + total, len - total);
            if (written <= 0) {
                throw new IOException("Short write to " + storage.name() + ": " + total + " of " + len + " bytes");
            }
            total += written;
        }
    }
}
