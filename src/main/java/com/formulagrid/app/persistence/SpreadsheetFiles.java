package com.formulagrid.app.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formulagrid.app.exceptions.SpreadsheetReadWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link SheetDocument}s as JSON files.
 */
public final class SpreadsheetFiles {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetFiles.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SpreadsheetFiles() {
    }

    public static void write(Path path, SheetDocument document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), document);
        } catch (IOException e) {
            log.warn("Could not write sheet to {}: {}", path, e.getMessage());
            throw new SpreadsheetReadWriteException("Could not write sheet to " + path, e);
        }
    }

    public static SheetDocument read(Path path) {
        SheetDocument document;
        try {
            document = MAPPER.readValue(path.toFile(), SheetDocument.class);
        } catch (IOException e) {
            log.warn("Could not read sheet from {}: {}", path, e.getMessage());
            throw new SpreadsheetReadWriteException("Could not read sheet from " + path, e);
        }
        if (document == null || document.getCells() == null) {
            throw new SpreadsheetReadWriteException("No sheet found in " + path);
        }
        return document;
    }
}
