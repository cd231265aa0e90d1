package com.fixcraft.encfile;

import java.io.IOException;

public class KeyDerivationException extends IOException {
    private static final long serialVersionUID = 1L;

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
