package com.fixcraft.encfile;

import java.io.IOException;

/**
 * Serializes every call on a shared {@link SectorFile}. Seek-then-transfer pairs issued through
 * separate calls are still not atomic; use {@link #readAt}/{@link #writeAt} when threads share
 * a handle.
 */
public final class SynchronizedSectorFile implements SectorFile {
    private final SectorFile delegate;
    private final Object lock = new Object();

    public SynchronizedSectorFile(SectorFile delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate == null");
        }
        this.delegate = delegate;
    }

    @Override
    public String name() {
        synchronized (lock) {
            return delegate.name();
        }
    }

    @Override
    public int sectorSize() {
        synchronized (lock) {
            return delegate.sectorSize();
        }
    }

    @Override
    public StorageStat stat() throws IOException {
        synchronized (lock) {
            return delegate.stat();
        }
    }

    @Override
    public void sync() throws IOException {
        synchronized (lock) {
            delegate.sync();
        }
    }

    @Override
    public void changePassphrase(byte[] newPassphrase) throws IOException {
        synchronized (lock) {
            delegate.changePassphrase(newPassphrase);
        }
    }

    @Override
    public byte[] readSector(long sector) throws IOException {
        synchronized (lock) {
            return delegate.readSector(sector);
        }
    }

    @Override
    public void writeSector(long sector, byte[] data) throws IOException {
        synchronized (lock) {
            delegate.writeSector(sector, data);
        }
    }

    @Override
    public void writeSectorSync(long sector, byte[] data) throws IOException {
        synchronized (lock) {
            delegate.writeSectorSync(sector, data);
        }
    }

    @Override
    public void writeSectorPadded(long sector, byte[] data) throws IOException {
        synchronized (lock) {
            delegate.writeSectorPadded(sector, data);
        }
    }

    @Override
    public byte[] padSector(byte[] data) {
        synchronized (lock) {
            return delegate.padSector(data);
        }
    }

    @Override
    public void zeroSector(long sector) throws IOException {
        synchronized (lock) {
            delegate.zeroSector(sector);
        }
    }

    @Override
    public long countSectors() throws IOException {
        synchronized (lock) {
            return delegate.countSectors();
        }
    }

    @Override
    public void delete() throws IOException {
        synchronized (lock) {
            delegate.delete();
        }
    }

    @Override
    public long seek(long offset) {
        synchronized (lock) {
            return delegate.seek(offset);
        }
    }

    @Override
    public int readAt(byte[] buf, long offset) throws IOException {
        synchronized (lock) {
            return delegate.readAt(buf, offset);
        }
    }

    @Override
    public int writeAt(byte[] buf, long offset) throws IOException {
        synchronized (lock) {
            return delegate.writeAt(buf, offset);
        }
    }

    @Override
    public int read(byte[] buf) throws IOException {
        synchronized (lock) {
            return delegate.read(buf);
        }
    }

    @Override
    public int write(byte[] buf) throws IOException {
        synchronized (lock) {
            return delegate.write(buf);
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (lock) {
            delegate.close();
        }
    }
}
