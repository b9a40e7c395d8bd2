package com.vedant.dataquery.format;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class TempFiles {

    private TempFiles() {}

    static void delete(Path path, Logger logger) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}", path, e);
        }
    }
}
