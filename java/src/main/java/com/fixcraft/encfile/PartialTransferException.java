package com.fixcraft.encfile;

import java.io.IOException;

/**
 * A multi-sector transfer failed after some bytes had already been transferred. The bytes
 * before the failing sector are in place; {@link #getCause()} is the first error.
 */
public class PartialTransferException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int bytesTransferred;

    public PartialTransferException(int bytesTransferred, IOException cause) {
        super("Transfer stopped after " + bytesTransferred + " bytes: " + cause.getMessage(), cause);
        this.bytesTransferred = bytesTransferred;
    }

    public int bytesTransferred() {
        return bytesTransferred;
    }
}
