package com.thicket.db.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for writing database files with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content next to the target and moves it into place, so a reader never
     * sees a half-written document.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path absolute = filePath.toAbsolutePath();
        Path parentDir = absolute.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
