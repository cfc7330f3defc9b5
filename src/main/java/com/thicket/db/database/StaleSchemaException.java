package com.thicket.db.database;

import java.nio.file.Path;

/**
 * The document was written with an older schema. There is no migration; rebuild instead.
 */
public class StaleSchemaException extends DatabaseException {

    private static final long serialVersionUID = 1L;
    private final int foundVersion;
    private final int expectedVersion;

    public StaleSchemaException(Path path, int foundVersion, int expectedVersion) {
        super(path, "Database " + path + " has schema version " + foundVersion
                + ", expected " + expectedVersion);
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }
}
