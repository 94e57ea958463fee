package com.formulagrid.app.services;

import com.formulagrid.app.config.SpreadsheetProperties;
import com.formulagrid.app.engine.Spreadsheet;
import com.formulagrid.app.exceptions.SheetNotFoundException;
import com.formulagrid.app.exceptions.SpreadsheetReadWriteException;
import com.formulagrid.app.models.CellView;
import com.formulagrid.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps sheets in memory by ID and runs every engine call under the sheet's lock:
 * reads share the read lock, each assignment holds the write lock from parsing to the
 * last recalculated value.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; files are only touched on save/load
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final SpreadsheetProperties properties;

    public SheetService() {
        this(new SpreadsheetProperties());
    }

    @Autowired
    public SheetService(SpreadsheetProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty sheet and returns its ID. A null or blank version falls back
     * to the configured default.
     */
    public long createSheet(String version) {
        Spreadsheet spreadsheet = new Spreadsheet(properties.validator(), properties.normalizer(),
                resolveVersion(version));
        Sheet sheet = register(spreadsheet);
        log.info("Created sheet {} (version {})", sheet.getId(), spreadsheet.getVersion());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's contents (number, "=formula" or text; empty clears it) and
     * returns the recalculated cells in evaluation order.
     * A rejected assignment (bad name, bad formula, cycle) leaves the sheet untouched.
     */
    public List<String> setCellContents(long sheetId, String cellName, String content) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            return sheet.getSpreadsheet().setContentsOfCell(cellName, content);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns name, contents and value of a single cell; empty cells have empty text for both.
     */
    public CellView getCell(long sheetId, String cellName) {
        return read(sheetId, spreadsheet -> new CellView(
                spreadsheet.normalizedName(cellName),
                spreadsheet.getCellContents(cellName).toStringForm(),
                spreadsheet.getCellValue(cellName).toObject()));
    }

    /**
     * Returns a map of cell name -> value for all non-empty cells.
     * Values are precomputed on every assignment, so this only copies them out.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        return read(sheetId, spreadsheet -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (String name : spreadsheet.getNamesOfAllNonemptyCells()) {
                data.put(name, spreadsheet.getCellValue(name).toObject());
            }
            return data;
        });
    }

    public Set<String> getNonEmptyCellNames(long sheetId) {
        return read(sheetId, Spreadsheet::getNamesOfAllNonemptyCells);
    }

    public boolean isChanged(long sheetId) {
        return read(sheetId, Spreadsheet::isChanged);
    }

    /**
     * For each cell => the cells its formula references.
     */
    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        return read(sheetId, Spreadsheet::getForwardDependencies);
    }

    /**
     * For each cell => the cells whose formulas reference it.
     */
    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        return read(sheetId, Spreadsheet::getReverseDependencies);
    }

    /**
     * Writes the sheet to a file inside the storage directory and clears its changed flag.
     */
    public void saveSheet(long sheetId, String fileName) {
        Sheet sheet = getSheet(sheetId);
        Path file = resolveStorageFile(fileName);
        // Saving resets the changed flag, hence the write lock
        sheet.getLock().writeLock().lock();
        try {
            sheet.getSpreadsheet().save(file);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
        log.info("Saved sheet {} to {}", sheetId, file);
    }

    /**
     * Loads a file from the storage directory as a new sheet and returns its ID.
     * Fails without registering anything if the file's version differs from the
     * requested one (or the configured default).
     */
    public long loadSheet(String fileName, String version) {
        Path file = resolveStorageFile(fileName);
        Spreadsheet spreadsheet = Spreadsheet.load(file, properties.validator(), properties.normalizer(),
                resolveVersion(version));
        Sheet sheet = register(spreadsheet);
        log.info("Loaded {} as sheet {}", file, sheet.getId());
        return sheet.getId();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private Sheet register(Spreadsheet spreadsheet) {
        Sheet sheet = new Sheet(spreadsheet);
        sheets.put(sheet.getId(), sheet);
        return sheet;
    }

    private <T> T read(long sheetId, Function<Spreadsheet, T> query) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return query.apply(sheet.getSpreadsheet());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    private String resolveVersion(String version) {
        return version == null || version.trim().isEmpty() ? properties.getDefaultVersion() : version;
    }

    /**
     * Resolves a bare file name against the storage directory; anything pointing
     * outside of it is rejected.
     */
    private Path resolveStorageFile(String fileName) {
        if (fileName == null || fileName.trim().isEmpty()) {
            throw new SpreadsheetReadWriteException("A file name is required");
        }
        Path dir = Paths.get(properties.getStorageDir()).toAbsolutePath().normalize();
        Path file = dir.resolve(fileName).normalize();
        if (!dir.equals(file.getParent())) {
            throw new SpreadsheetReadWriteException("File name must not leave the storage directory: " + fileName);
        }
        return file;
    }
}
