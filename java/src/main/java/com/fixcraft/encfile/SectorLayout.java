package com.fixcraft.encfile;

// Sector i is stored at HEADER_SIZE + i * (sectorSize + tag).
public final class SectorLayout {
    private final int sectorSize;
    private final int physicalSectorSize;

    public SectorLayout(int sectorSize) {
        if (sectorSize <= 0 || sectorSize % Constants.BLOCK_SIZE != 0) {
            throw new IllegalArgumentException(
                "Sector size " + sectorSize + " is no positive multiple of " + Constants.BLOCK_SIZE);
        }
        this.sectorSize = sectorSize;
        this.physicalSectorSize = sectorSize + Constants.SECTOR_FOOTER;
    }

    public int sectorSize() {
        return sectorSize;
    }

    public int physicalSectorSize() {
        return physicalSectorSize;
    }

    public long sectorOf(long offset) {
        checkOffset(offset);
        return offset / sectorSize;
    }

    public int skipOf(long offset) {
        checkOffset(offset);
        return (int) (offset % sectorSize);
    }

    public long physicalOffset(long sector) {
        if (sector < 0) {
            throw new IllegalArgumentException("negative sector: " + sector);
        }
        try {
            return Math.addExact(Constants.HEADER_SIZE, Math.multiplyExact(sector, (long) physicalSectorSize));
        } catch (ArithmeticException exc) {
            throw new IllegalArgumentException("sector out of range: " + sector, exc);
        }
    }

    public long countFor(long storageSize) {
        long count = (storageSize - Constants.HEADER_SIZE) / physicalSectorSize;
        return Math.max(0L, count);
    }

    static void checkOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("negative offset: " + offset);
        }
    }
}
