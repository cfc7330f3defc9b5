package com.thicket.db.database;

import java.nio.file.Path;

public class DatabaseNotFoundException extends DatabaseException {

    private static final long serialVersionUID = 1L;

    public DatabaseNotFoundException(Path path) {
        super(path, "Database not found: " + path);
    }
}
