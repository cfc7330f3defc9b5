package com.thicket.db.parser;

import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.model.ParsedModel;

import java.nio.file.Path;

/**
 * Turns one asset file into a model record and its labels.
 *
 * Implementations must tolerate concurrent {@link #parse} calls; the build scheduler
 * runs several at once.
 */
public interface RecordParserAdapter {

    ParsedModel parse(Path assetFile) throws RecordParseException;

    /**
     * Version stamped into the info block of a database built with this adapter.
     */
    ExtractorVersion extractorVersion();
}
