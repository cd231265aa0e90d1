package com.fixcraft.encfile;

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Encrypted paged file: every sector is sealed on its own with AES-256-GCM under a random file
 * key, stored wrapped under a passphrase-derived key. A never-written sector before a written one
 * is a hole and reads back as an authentication failure, not as zeros. Not thread-safe.
 */
public final class EncryptedFile implements SectorFile {
    private static final long UNSET = -1L;

    private final StorageProvider provider;
    private final String name;
    private final OpenMode mode;
    private final FileOptions options;
    private final SectorLayout layout;
    private final byte[] realKey;
    private final SectorCipher cipher;
    private final Storage storage;
    private final SecureErase eraser;
    private FileHeader header;
    private long cursor = UNSET;
    private boolean closed;

    private EncryptedFile(StorageProvider provider,
                          String name,
                          OpenMode mode,
                          FileOptions options,
                          FileHeader header,
                          byte[] realKey,
                          Storage storage) {
        this.provider = provider;
        this.name = name;
        this.mode = mode;
        this.options = options;
        this.layout = new SectorLayout(options.sectorSize);
        this.header = header;
        this.realKey = realKey;
        this.cipher = new SectorCipher(options.backend, realKey, header.salt(), options.noncePolicy);
        this.storage = storage;
        this.eraser = new SecureErase(storage, layout, options.random);
    }

    public static EncryptedFile create(Path path, byte[] passphrase, int sectorSize) throws IOException {
        return create(path, passphrase, new FileOptions(sectorSize));
    }

    public static EncryptedFile create(Path path, byte[] passphrase, FileOptions options) throws IOException {
        return open(FileStorageProvider.INSTANCE, path.toString(), passphrase, options, OpenMode.CREATE);
    }

    public static EncryptedFile open(Path path, byte[] passphrase, int sectorSize) throws IOException {
        return open(path, passphrase, new FileOptions(sectorSize));
    }

    public static EncryptedFile open(Path path, byte[] passphrase, FileOptions options) throws IOException {
        return open(FileStorageProvider.INSTANCE, path.toString(), passphrase, options, OpenMode.READ_WRITE);
    }

    public static EncryptedFile openAppend(Path path, byte[] passphrase, int sectorSize) throws IOException {
        return openAppend(path, passphrase, new FileOptions(sectorSize));
    }

    public static EncryptedFile openAppend(Path path, byte[] passphrase, FileOptions options) throws IOException {
        return open(FileStorageProvider.INSTANCE, path.toString(), passphrase, options, OpenMode.APPEND);
    }

    public static EncryptedFile openViewOnly(Path path, byte[] passphrase, int sectorSize) throws IOException {
        return openViewOnly(path, passphrase, new FileOptions(sectorSize));
    }

    public static EncryptedFile openViewOnly(Path path, byte[] passphrase, FileOptions options) throws IOException {
        return open(FileStorageProvider.INSTANCE, path.toString(), passphrase, options, OpenMode.READ_ONLY);
    }

    public static boolean exists(Path path) {
        return FileStorageProvider.INSTANCE.exists(path.toString());
    }

    public static void changePassphrase(Path path, byte[] oldPassphrase, byte[] newPassphrase, FileOptions options)
        throws IOException {
        try (EncryptedFile ef = open(path, oldPassphrase, options)) {
            ef.changePassphrase(newPassphrase);
        }
    }

    public static EncryptedFile open(StorageProvider provider,
                                     String name,
                                     byte[] passphrase,
                                     FileOptions options,
                                     OpenMode mode) throws IOException {
        options.validate();
        boolean exists = provider.exists(name);
        if (mode.mustExist() && !exists) {
            throw new NoSuchFileException(name);
        }
        if (!mode.mustExist() && exists) {
            throw new FileAlreadyExistsException(name);
        }

        FileHeader header;
        byte[] realKey;
        if (mode == OpenMode.CREATE) {
            byte[] salt = Crypto.randomBytes(options.random, Constants.SALT_SIZE);
            byte[] wrappingKey = KeyWrap.deriveWrappingKey(passphrase, salt, options.kdf);
            try {
                realKey = KeyWrap.newFileKey(options.random);
                header = new FileHeader(salt, KeyWrap.wrap(options.backend, wrappingKey, salt, realKey));
            } finally {
                Crypto.wipe(wrappingKey);
            }
        } else {
            header = readHeader(provider, name);
            byte[] salt = header.salt();
            byte[] wrappingKey = KeyWrap.deriveWrappingKey(passphrase, salt, options.kdf);
            try {
                realKey = KeyWrap.unwrap(options.backend, wrappingKey, salt, header.wrappedKey());
            } finally {
                Crypto.wipe(wrappingKey);
            }
        }

        Storage storage;
        try {
            storage = provider.open(name, mode);
        } catch (IOException exc) {
            Crypto.wipe(realKey);
            throw exc;
        }
        EncryptedFile ef = new EncryptedFile(provider, name, mode, options, header, realKey, storage);
        if (mode == OpenMode.CREATE) {
            try {
                header.writeTo(storage);
                storage.sync();
            } catch (IOException exc) {
                try {
                    ef.close();
                } catch (IOException suppressed) {
                    exc.addSuppressed(suppressed);
                }
                throw exc;
            }
        }
        RuntimeLog.debug("opened " + name + " mode=" + mode + " sector=" + options.sectorSize
            + " kdf=" + options.kdf.label + " crypto=" + options.backend.name() + " nonce=" + options.noncePolicy);
        return ef;
    }

    private static FileHeader readHeader(StorageProvider provider, String name) throws IOException {
        try (Storage reader = provider.open(name, OpenMode.READ_ONLY)) {
            return FileHeader.readFrom(reader);
        }
    }

    @Override
    public String name() {
        return name;
    }

    public OpenMode mode() {
        return mode;
    }

    @Override
    public int sectorSize() {
        return layout.sectorSize();
    }

    @Override
    public StorageStat stat() throws IOException {
        ensureOpen();
        return storage.stat();
    }

    @Override
    public void sync() throws IOException {
        ensureOpen();
        storage.sync();
    }

    @Override
    public void changePassphrase(byte[] newPassphrase) throws IOException {
        ensureOpen();
        requireInPlaceWrites("Passphrase change");
        byte[] salt = header.salt();
        byte[] wrappingKey = KeyWrap.deriveWrappingKey(newPassphrase, salt, options.kdf);
        FileHeader rewrapped;
        try {
            rewrapped = header.withWrappedKey(KeyWrap.wrap(options.backend, wrappingKey, salt, realKey));
        } finally {
            Crypto.wipe(wrappingKey);
        }
        rewrapped.writeTo(storage);
        storage.sync();
        header = rewrapped;
        RuntimeLog.debug("passphrase changed for " + name);
    }

    @Override
    public byte[] readSector(long sector) throws IOException {
        ensureOpen();
        cursor = UNSET;
        return loadSector(sector);
    }

    @Override
    public void writeSector(long sector, byte[] data) throws IOException {
        ensureOpen();
        cursor = UNSET;
        if (data.length != layout.sectorSize()) {
            throw new IllegalArgumentException(
                "Sector data must be " + layout.sectorSize() + " bytes, got " + data.length);
        }
        storeSector(sector, data);
    }

    @Override
    public void writeSectorSync(long sector, byte[] data) throws IOException {
        writeSector(sector, data);
        sync();
    }

    @Override
    public void writeSectorPadded(long sector, byte[] data) throws IOException {
        writeSector(sector, padSector(data));
    }

    @Override
    public byte[] padSector(byte[] data) {
        return Arrays.copyOf(data, layout.sectorSize());
    }

    @Override
    public void zeroSector(long sector) throws IOException {
        ensureOpen();
        requireInPlaceWrites("Zeroing a sector");
        cursor = UNSET;
        eraser.eraseSector(sector);
    }

    @Override
    public long countSectors() throws IOException {
        ensureOpen();
        return layout.countFor(storage.stat().size());
    }

    @Override
    public void delete() throws IOException {
        ensureOpen();
        requireInPlaceWrites("Delete");
        long total = countSectors();
        eraser.eraseSectors(total);
        eraser.eraseHeader();
        storage.sync();
        storage.truncate(0);
        storage.sync();
        close();
        provider.remove(name);
        RuntimeLog.debug("deleted " + name + " after erasing " + total + " sectors");
    }

    @Override
    public long seek(long offset) {
        ensureOpen();
        SectorLayout.checkOffset(offset);
        cursor = offset;
        return offset;
    }

    /**
     * Fills {@code buf} from {@code offset}.
     *
     * @throws PartialTransferException if a sector failed after some bytes were copied
     */
    @Override
    public int readAt(byte[] buf, long offset) throws IOException {
        ensureOpen();
        long sector = layout.sectorOf(offset);
        int skip = layout.skipOf(offset);
        int n = 0;
        while (n < buf.length) {
            byte[] plain;
            try {
                plain = loadSector(sector);
            } catch (IOException exc) {
                throw transferFailure(n, exc);
            }
            int take = Math.min(buf.length - n, layout.sectorSize() - skip);
            System.arraycopy(plain, skip, buf, n, take);
            n += take;
            sector++;
            skip = 0;
        }
        return n;
    }

    /**
     * Writes all of {@code buf} at {@code offset}. Sectors covered whole are encrypted directly;
     * partially covered ones are read, patched and rewritten. Sectors not stored yet start out as
     * zeros.
     *
     * @throws PartialTransferException if a sector failed after some bytes were written
     */
    @Override
    public int writeAt(byte[] buf, long offset) throws IOException {
        ensureOpen();
        long sector = layout.sectorOf(offset);
        int skip = layout.skipOf(offset);
        int n = 0;
        while (n < buf.length) {
            try {
                n += writePartial(sector, buf, skip, n);
            } catch (IOException exc) {
                throw transferFailure(n, exc);
            }
            sector++;
            skip = 0;
        }
        return n;
    }

    @Override
    public int read(byte[] buf) throws IOException {
        long pos = cursorPosition("read");
        try {
            int n = readAt(buf, pos);
            cursor = pos + n;
            return n;
        } catch (PartialTransferException exc) {
            cursor = pos + exc.bytesTransferred();
            throw exc;
        }
    }

    @Override
    public int write(byte[] buf) throws IOException {
        long pos = cursorPosition("write");
        try {
            int n = writeAt(buf, pos);
            cursor = pos + n;
            return n;
        } catch (PartialTransferException exc) {
            cursor = pos + exc.bytesTransferred();
            throw exc;
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        cursor = UNSET;
        cipher.destroy();
        Crypto.wipe(realKey);
        storage.close();
        RuntimeLog.debug("closed " + name);
    }

    private long cursorPosition(String op) {
        ensureOpen();
        if (cursor == UNSET) {
            throw new IllegalStateException("Cursor " + op + " on " + name + " before seek");
        }
        return cursor;
    }

    private int writePartial(long sector, byte[] buf, int sectorSkip, int bufSkip) throws IOException {
        int sectorSize = layout.sectorSize();
        if (buf.length - bufSkip >= sectorSize && sectorSkip == 0) {
            storeSector(sector, Arrays.copyOfRange(buf, bufSkip, bufSkip + sectorSize));
            return sectorSize;
        }
        byte[] plain = loadForUpdate(sector);
        int n = Math.min(sectorSize - sectorSkip, buf.length - bufSkip);
        System.arraycopy(buf, bufSkip, plain, sectorSkip, n);
        storeSector(sector, plain);
        return n;
    }

    // Past-the-end and hole sectors start from zeros; anything else must authenticate.
    private byte[] loadForUpdate(long sector) throws IOException {
        byte[] raw;
        try {
            raw = readStored(sector);
        } catch (EOFException exc) {
            return new byte[layout.sectorSize()];
        }
        if (Crypto.isAllZero(raw)) {
            return new byte[layout.sectorSize()];
        }
        return cipher.decryptSector(sector, raw);
    }

    private byte[] loadSector(long sector) throws IOException {
        return cipher.decryptSector(sector, readStored(sector));
    }

    private byte[] readStored(long sector) throws IOException {
        storage.seek(layout.physicalOffset(sector));
        byte[] raw = new byte[layout.physicalSectorSize()];
        int n = Storage.readFully(storage, raw, 0, raw.length);
        if (n == 0) {
            throw new EOFException("Sector " + sector + " lies past the end of " + name);
        }
        if (n < raw.length) {
            throw new TruncatedSectorException(sector, n, raw.length);
        }
        return raw;
    }

    private void storeSector(long sector, byte[] plain) throws IOException {
        byte[] sealed = cipher.encryptSector(sector, plain);
        storage.seek(layout.physicalOffset(sector));
        Storage.writeFully(storage, sealed, 0, sealed.length);
    }

    private static IOException transferFailure(int transferred, IOException exc) {
        return transferred == 0 ? exc : new PartialTransferException(transferred, exc);
    }

    // Append handles ignore seeks on write, so overwrites would land at the end instead.
    private void requireInPlaceWrites(String op) {
        if (mode != OpenMode.READ_WRITE && mode != OpenMode.CREATE) {
            throw new IllegalStateException(op + " needs a read-write handle, not " + mode);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(name + " is closed");
        }
    }
}
