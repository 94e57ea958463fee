package com.formulagrid.app.engine;

import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.exceptions.FormulaFormatException;
import com.formulagrid.app.exceptions.InvalidNameException;
import com.formulagrid.app.exceptions.SpreadsheetReadWriteException;
import com.formulagrid.app.formula.EvaluationResult;
import com.formulagrid.app.formula.Formula;
import com.formulagrid.app.formula.UndefinedVariableException;
import com.formulagrid.app.graph.DependencyGraph;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellContent;
import com.formulagrid.app.models.CellValue;
import com.formulagrid.app.persistence.CellDocument;
import com.formulagrid.app.persistence.SheetDocument;
import com.formulagrid.app.persistence.SpreadsheetFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * A grid of named cells holding text, numbers or formulas, with values kept up to date
 * on every change.
 * <p>
 * A cell name is one or more letters followed by one or more digits, checked after
 * {@code normalize} has been applied and further restricted by {@code isValid}. Names not
 * present in the sheet are empty: their contents and values are empty text.
 * <p>
 * Each assignment is applied as a unit. The new content is parsed and the recalculation
 * order is worked out against the prospective dependency edges first; only when that
 * succeeds does anything in the sheet change. A rejected assignment leaves no trace.
 * <p>
 * Not thread-safe. Concurrent callers must hold one lock around each call
 * (see {@code models.Sheet}).
 */
public class Spreadsheet {

    private static final Logger log = LoggerFactory.getLogger(Spreadsheet.class);

    public static final String DEFAULT_VERSION = "default";

    private static final Pattern CELL_NAME = Pattern.compile("[a-zA-Z]+[0-9]+");

    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final Predicate<String> isValid;
    private final UnaryOperator<String> normalize;
    private final String version;
    private boolean changed;

    /**
     * An empty sheet accepting every cell-shaped name as is, with version "default".
     */
    public Spreadsheet() {
        this(s -> true, s -> s, DEFAULT_VERSION);
    }

    public Spreadsheet(Predicate<String> isValid, UnaryOperator<String> normalize, String version) {
        this.isValid = Objects.requireNonNull(isValid);
        this.normalize = Objects.requireNonNull(normalize);
        this.version = Objects.requireNonNull(version);
    }

    /**
     * Reads a saved sheet into a new instance by replaying each stored cell through
     * {@link #setContentsOfCell}.
     *
     * @throws SpreadsheetReadWriteException if the file cannot be read, its version differs from
     *                                       {@code version}, or any stored cell is rejected
     */
    public static Spreadsheet load(Path path, Predicate<String> isValid, UnaryOperator<String> normalize,
                                   String version) {
        SheetDocument document = SpreadsheetFiles.read(path);
        if (!version.equals(document.getVersion())) {
            throw new SpreadsheetReadWriteException("Version mismatch in " + path + ": expected '" + version
                    + "', found '" + document.getVersion() + "'");
        }

        Spreadsheet sheet = new Spreadsheet(isValid, normalize, version);
        for (Map.Entry<String, CellDocument> entry : document.getCells().entrySet()) {
            CellDocument cell = entry.getValue();
            if (cell == null || cell.getStringForm() == null) {
                throw new SpreadsheetReadWriteException("Cell " + entry.getKey() + " in " + path + " has no contents");
            }
            try {
                sheet.setContentsOfCell(entry.getKey(), cell.getStringForm());
            } catch (InvalidNameException | FormulaFormatException | CircularReferenceException e) {
                throw new SpreadsheetReadWriteException(
                        "Cell " + entry.getKey() + " in " + path + " cannot be loaded: " + e.getMessage(), e);
            }
        }
        sheet.changed = false;
        log.info("Loaded {} cells from {}", sheet.cells.size(), path);
        return sheet;
    }

    /**
     * Writes every non-empty cell in its string form, then clears {@link #isChanged()}.
     *
     * @throws SpreadsheetReadWriteException if the file cannot be written
     */
    public void save(Path path) {
        Map<String, CellDocument> stored = new TreeMap<>();
        for (Cell cell : cells.values()) {
            stored.put(cell.getName(), new CellDocument(cell.getContent().toStringForm()));
        }
        SpreadsheetFiles.write(path, new SheetDocument(stored, version));
        changed = false;
        log.info("Saved {} cells to {}", stored.size(), path);
    }

    public String getVersion() {
        return version;
    }

    /**
     * True if the sheet was modified since it was created, loaded or last saved.
     */
    public boolean isChanged() {
        return changed;
    }

    /**
     * Normalized names of all cells with non-empty contents, in creation order.
     */
    public Set<String> getNamesOfAllNonemptyCells() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(cells.keySet()));
    }

    /**
     * The name as the sheet stores it.
     *
     * @throws InvalidNameException if the name is not a valid cell name
     */
    public String normalizedName(String name) {
        return checkName(name);
    }

    /**
     * @throws InvalidNameException if the name is not a valid cell name
     */
    public CellContent getCellContents(String name) {
        Cell cell = cells.get(checkName(name));
        return cell == null ? CellContent.EMPTY : cell.getContent();
    }

    /**
     * @throws InvalidNameException if the name is not a valid cell name
     */
    public CellValue getCellValue(String name) {
        Cell cell = cells.get(checkName(name));
        return cell == null ? CellValue.EMPTY : cell.getValue();
    }

    /**
     * Sets the contents of a cell and recomputes every value that may have changed.
     * <p>
     * A string that parses as a number becomes a number; one starting with '=' is parsed as
     * a formula from the second character on; anything else is text. Empty text empties
     * the cell.
     *
     * @return the changed cell followed by every cell depending on it, directly or
     * indirectly, ordered so that each cell comes after the cells it reads
     * @throws InvalidNameException       if the name is not a valid cell name
     * @throws FormulaFormatException     if the content is a malformed formula
     * @throws CircularReferenceException if the formula would make the cell depend on itself
     */
    public List<String> setContentsOfCell(String name, String content) {
        String cellName = checkName(name);
        CellContent newContent = ContentClassifier.classify(Objects.requireNonNull(content), normalize, isValid);
        Set<String> newDependees = dependeesOf(newContent);

        // Everything that can fail happens before the first write
        List<String> order = RecalculationOrder.compute(cellName, dependentsAfterReplacing(cellName, newDependees));

        graph.replaceDependees(cellName, newDependees);
        if (newContent.isEmpty()) {
            cells.remove(cellName);
        } else {
            Cell cell = cells.get(cellName);
            if (cell == null) {
                cells.put(cellName, new Cell(cellName, newContent));
            } else {
                cell.setContent(newContent);
            }
        }
        recalculate(order);
        changed = true;

        log.debug("Set {} to '{}', recalculated {}", cellName, content, order);
        return order;
    }

    /**
     * Cells whose formulas read the given cell.
     */
    public Set<String> getDirectDependents(String name) {
        return graph.getDependents(checkName(name));
    }

    /**
     * Every cell taking part in a reference, mapped to the cells its formula reads.
     */
    public Map<String, Set<String>> getForwardDependencies() {
        return graph.toDependeeMap();
    }

    /**
     * Every cell taking part in a reference, mapped to the cells whose formulas read it.
     */
    public Map<String, Set<String>> getReverseDependencies() {
        return graph.toDependentMap();
    }

    /**
     * Numeric value of a cell, for formula evaluation.
     *
     * @throws UndefinedVariableException if the name is not a cell name, the cell is empty,
     *                                    or its value is not a number
     */
    public double lookup(String name) {
        String cellName = normalize.apply(name);
        if (cellName == null || !isCellName(cellName)) {
            throw new UndefinedVariableException("Not a cell name: " + name);
        }
        Cell cell = cells.get(cellName);
        if (cell == null || !cell.getValue().isNumber()) {
            throw new UndefinedVariableException("Cell " + cellName + " has no numeric value");
        }
        return cell.getValue().getNumber();
    }

    private String checkName(String name) {
        String cellName = name == null ? null : normalize.apply(name);
        if (cellName == null || !isCellName(cellName)) {
            throw new InvalidNameException("Invalid cell name: " + name);
        }
        return cellName;
    }

    private boolean isCellName(String normalized) {
        return CELL_NAME.matcher(normalized).matches() && isValid.test(normalized);
    }

    /**
     * Dependents as they would be once {@code cellName}'s dependees became {@code newDependees}.
     */
    private Function<String, Collection<String>> dependentsAfterReplacing(String cellName, Set<String> newDependees) {
        return cell -> {
            Set<String> dependents = new LinkedHashSet<>(graph.getDependents(cell));
            if (newDependees.contains(cell)) {
                dependents.add(cellName);
            } else {
                dependents.remove(cellName);
            }
            return dependents;
        };
    }

    private void recalculate(List<String> order) {
        for (String cellName : order) {
            Cell cell = cells.get(cellName);
            if (cell != null && cell.getContent().isFormula()) {
                cell.setValue(evaluate(cell.getContent()));
            }
        }
    }

    private CellValue evaluate(CellContent content) {
        return content.accept(new CellContent.Visitor<CellValue>() {
            @Override
            public CellValue visitText(String text) {
                return CellValue.text(text);
            }

            @Override
            public CellValue visitNumber(double number) {
                return CellValue.number(number);
            }

            @Override
            public CellValue visitFormula(Formula formula) {
                EvaluationResult result = formula.evaluate(Spreadsheet.this::lookup);
                return result.isError() ? CellValue.error(result.getError()) : CellValue.number(result.getValue());
            }
        });
    }

    private static Set<String> dependeesOf(CellContent content) {
        return content.accept(new CellContent.Visitor<Set<String>>() {
            @Override
            public Set<String> visitText(String text) {
                return Collections.emptySet();
            }

            @Override
            public Set<String> visitNumber(double number) {
                return Collections.emptySet();
            }

            @Override
            public Set<String> visitFormula(Formula formula) {
                return formula.getVariables();
            }
        });
    }
}
