package com.thicket.db.sdk;

import com.thicket.db.model.ExtractorVersion;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Service interface for the vendor library that reads native plant assets.
 *
 * Implementations ship in the vendor's jars and are found through
 * {@code META-INF/services/com.thicket.db.sdk.PlantSdk}. They are not assumed to be safe
 * for concurrent use, so a build only calls them from isolated worker processes.
 */
public interface PlantSdk {

    ExtractorVersion version();

    Plant load(Path assetFile) throws IOException;
}
