package com.fixcraft.encfile;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Set;

public final class FileStorageProvider implements StorageProvider {
    public static final FileStorageProvider INSTANCE = new FileStorageProvider();

    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    private FileStorageProvider() {}

    @Override
    public boolean exists(String name) {
        return Files.exists(Paths.get(name));
    }

    @Override
    public Storage open(String name, OpenMode mode) throws IOException {
        Path path = Paths.get(name);
        Set<StandardOpenOption> options = optionsFor(mode);
        FileChannel channel;
        if (mode == OpenMode.CREATE && POSIX) {
            FileAttribute<?> ownerOnly = PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"));
            channel = FileChannel.open(path, options, ownerOnly);
        } else {
            if (mode == OpenMode.CREATE) {
                RuntimeLog.warn("owner-only permissions unsupported here; " + name + " gets default permissions");
            }
            channel = FileChannel.open(path, options);
        }
        return new FileStorage(name, path, channel, mode);
    }

    @Override
    public void remove(String name) throws IOException {
        Files.delete(Paths.get(name));
    }

    private static Set<StandardOpenOption> optionsFor(OpenMode mode) {
        switch (mode) {
            case CREATE:
                return EnumSet.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
            case READ_WRITE:
                return EnumSet.of(StandardOpenOption.READ, StandardOpenOption.WRITE);
            case APPEND:
                return EnumSet.of(StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            case READ_ONLY:
                return EnumSet.of(StandardOpenOption.READ);
            default:
                throw new IllegalArgumentException("Unknown open mode: " + mode);
        }
    }
}
