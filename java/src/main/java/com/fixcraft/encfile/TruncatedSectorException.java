package com.fixcraft.encfile;

import java.io.IOException;

public class TruncatedSectorException extends IOException {
    private static final long serialVersionUID = 1L;

    private final long sector;

    public TruncatedSectorException(long sector, int available, int expected) {
        super("Sector " + sector + " truncated: " + available + " of " + expected + " bytes");
        this.sector = sector;
    }

    public long sector() {
        return sector;
    }
}
