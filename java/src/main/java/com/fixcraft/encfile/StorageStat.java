package com.fixcraft.encfile;

import java.time.Instant;

public final class StorageStat {
    private final String name;
    private final long size;
    private final Instant lastModified;

    public StorageStat(String name, long size, Instant lastModified) {
        this.name = name;
        this.size = size;
        this.lastModified = lastModified;
    }

    public String name() {
        return name;
    }

    public long size() {
        return size;
    }

    public Instant lastModified() {
        return lastModified;
    }

    @Override
    public String toString() {
        return name + " (" + size + " bytes, modified " + lastModified + ")";
    }
}
