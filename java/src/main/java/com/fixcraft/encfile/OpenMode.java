package com.fixcraft.encfile;

public enum OpenMode {
    CREATE,
    READ_WRITE,
    // write-only, every write lands at the end
    APPEND,
    READ_ONLY;

    public boolean mustExist() {
        return this != CREATE;
    }
}
