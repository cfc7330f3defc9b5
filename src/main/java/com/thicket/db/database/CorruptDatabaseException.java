package com.thicket.db.database;

import java.nio.file.Path;

public class CorruptDatabaseException extends DatabaseException {

    private static final long serialVersionUID = 1L;

    public CorruptDatabaseException(Path path, Throwable cause) {
        super(path, "Database is not valid JSON: " + path + ": " + cause.getMessage(), cause);
    }

    public CorruptDatabaseException(Path path, String reason) {
        super(path, "Database is corrupt: " + path + ": " + reason);
    }
}
