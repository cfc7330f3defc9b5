package com.thicket.db.build;

import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds asset files laid out as {@code <assets>/<Plant Dir>/<plant>.lbw[.gz]}.
 */
@NoArgsConstructor
public class AssetDiscoveryService {

    public List<Path> discoverAssetFiles(Path assetsDir) throws IOException {
        try (Stream<Path> stream = Files.walk(assetsDir, 2)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> assetsDir.relativize(path).getNameCount() == 2)
                    .filter(this::isAssetFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isAssetFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".lbw.gz") || name.endsWith(".lbw");
    }
}
