package com.thicket.db.database;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Base type for problems with the database document itself: missing, stale or unreadable.
 * Callers typically respond by offering a rebuild.
 */
public class DatabaseException extends IOException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public DatabaseException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public DatabaseException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
