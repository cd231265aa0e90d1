package com.fixcraft.encfile;

import java.io.IOException;

public interface StorageProvider {
    boolean exists(String name);

    Storage open(String name, OpenMode mode) throws IOException;

    void remove(String name) throws IOException;
}
