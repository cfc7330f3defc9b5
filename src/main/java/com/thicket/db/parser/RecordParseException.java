package com.thicket.db.parser;

import java.nio.file.Path;

/**
 * Extraction of a single asset failed. During a build this only drops that asset.
 */
public class RecordParseException extends Exception {

    private static final long serialVersionUID = 1L;
    private final transient Path assetFile;

    public RecordParseException(Path assetFile, String message) {
        super(assetFile + ": " + message);
        this.assetFile = assetFile;
    }

    public RecordParseException(Path assetFile, String message, Throwable cause) {
        super(assetFile + ": " + message, cause);
        this.assetFile = assetFile;
    }

    public Path getAssetFile() {
        return assetFile;
    }
}
