package com.fixcraft.encfile;

import java.io.IOException;
import java.security.SecureRandom;

final class SecureErase {
    private final Storage storage;
    private final SectorLayout layout;
    private final SecureRandom random;

    SecureErase(Storage storage, SectorLayout layout, SecureRandom random) {
        this.storage = storage;
        this.layout = layout;
        this.random = random;
    }

    void eraseSector(long sector) throws IOException {
        byte[] noise = Crypto.randomBytes(random, layout.physicalSectorSize());
        storage.seek(layout.physicalOffset(sector));
        Storage.writeFully(storage, noise, 0, noise.length);
    }

    /**
     * Erases sectors {@code 0..count} inclusive. A failure at index {@code count}, one past the
     * last whole sector, is tolerated.
     */
    void eraseSectors(long count) throws IOException {
        for (long sector = 0; sector <= count; sector++) {
            try {
                eraseSector(sector);
            } catch (IOException exc) {
                if (sector != count) {
                    throw exc;
                }
                RuntimeLog.debug("erase past last sector " + count + " of " + storage.name() + " failed: " + exc.getMessage());
            }
        }
    }

    void eraseHeader() throws IOException {
        byte[] noise = Crypto.randomBytes(random, Constants.HEADER_SIZE);
        storage.seek(0);
        Storage.writeFully(storage, noise, 0, noise.length);
    }
}
