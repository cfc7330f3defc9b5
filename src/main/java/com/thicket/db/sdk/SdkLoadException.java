package com.thicket.db.sdk;

import java.io.IOException;

public class SdkLoadException extends IOException {

    private static final long serialVersionUID = 1L;

    public SdkLoadException(String message) {
        super(message);
    }

    public SdkLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
