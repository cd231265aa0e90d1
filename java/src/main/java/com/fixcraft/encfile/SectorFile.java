package com.fixcraft.encfile;

import java.io.Closeable;
import java.io.IOException;

/**
 * Random-access view of an encrypted paged file. Calls on one handle must not overlap; see
 * {@link SynchronizedSectorFile}.
 */
public interface SectorFile extends Closeable {
    String name();

    int sectorSize();

    StorageStat stat() throws IOException;

    void sync() throws IOException;

    void changePassphrase(byte[] newPassphrase) throws IOException;

    /**
     * @throws java.io.EOFException if the sector lies past the end of the storage
     * @throws AuthenticationException if the sector was tampered with, erased or never written
     */
    byte[] readSector(long sector) throws IOException;

    void writeSector(long sector, byte[] data) throws IOException;

    void writeSectorSync(long sector, byte[] data) throws IOException;

    void writeSectorPadded(long sector, byte[] data) throws IOException;

    byte[] padSector(byte[] data);

    void zeroSector(long sector) throws IOException;

    long countSectors() throws IOException;

    void delete() throws IOException;

    long seek(long offset);

    int readAt(byte[] buf, long offset) throws IOException;

    int writeAt(byte[] buf, long offset) throws IOException;

    int read(byte[] buf) throws IOException;

    int write(byte[] buf) throws IOException;
}
