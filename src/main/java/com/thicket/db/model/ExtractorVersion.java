package com.thicket.db.model;

import lombok.Value;

/**
 * Version of the vendor extractor that produced a database, as major.minor.micro.
 */
@Value
public class ExtractorVersion {

    public static final ExtractorVersion UNKNOWN = new ExtractorVersion(0, 0, 0);

    int major;
    int minor;
    int micro;

    @Override
    public String toString() {
        return major + "." + minor + "." + micro;
    }
}
