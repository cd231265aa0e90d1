package com.fixcraft.encfile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.file.Files;
import java.nio.file.Path;

final class FileStorage implements Storage {
    private final String name;
    private final Path path;
    private final FileChannel channel;
    private final OpenMode mode;

    FileStorage(String name, Path path, FileChannel channel, OpenMode mode) {
        this.name = name;
        this.path = path;
        this.channel = channel;
        this.mode = mode;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void seek(long position) throws IOException {
        if (position < 0) {
            throw new IllegalArgumentException("negative position: " + position);
        }
        channel.position(position);
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        try {
            return channel.read(ByteBuffer.wrap(buf, off, len));
        } catch (NonReadableChannelException exc) {
            throw new IOException(name + " is not open for reading (" + mode + ")", exc);
        }
    }

    @Override
    public int write(byte[] buf, int off, int len) throws IOException {
        try {
            return channel.write(ByteBuffer.wrap(buf, off, len));
        } catch (NonWritableChannelException exc) {
            throw new IOException(name + " is not open for writing (" + mode + ")", exc);
        }
    }

    @Override
    public StorageStat stat() throws IOException {
        return new StorageStat(name, channel.size(), Files.getLastModifiedTime(path).toInstant());
    }

    @Override
    public void sync() throws IOException {
        channel.force(true);
    }

    @Override
    public void truncate(long size) throws IOException {
        try {
            channel.truncate(size);
        } catch (NonWritableChannelException exc) {
            throw new IOException(name + " is not open for writing (" + mode + ")", exc);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
