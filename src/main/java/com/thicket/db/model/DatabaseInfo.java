package com.thicket.db.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code info} block of a persisted database.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseInfo {
    private String sdkVersion;
    private int sdkMajor;
    private int sdkMinor;
    private int sdkMicro;
    private int schemaVersion;

    public static DatabaseInfo of(ExtractorVersion version, int schemaVersion) {
        return DatabaseInfo.builder()
                .sdkVersion(version.toString())
                .sdkMajor(version.getMajor())
                .sdkMinor(version.getMinor())
                .sdkMicro(version.getMicro())
                .schemaVersion(schemaVersion)
                .build();
    }
}
