package com.formulagrid.app.models;

import com.formulagrid.app.formula.Formula;
import com.formulagrid.app.formula.FormulaError;

/**
 * Represents a single non-empty spreadsheet cell.
 * Stores:
 * - its normalized name (e.g. "A1")
 * - content (text, number or formula, as typed)
 * - value (the computed result: text, number or error)
 */
public class Cell {
    private final String name;
    private CellContent content;
    private CellValue value;

    public Cell(String name, CellContent content) {
        this.name = name;
        this.content = content;
        this.value = literalValue(content);
    }

    public String getName() {
        return name;
    }

    public CellContent getContent() {
        return content;
    }

    // Formula cells keep their old value until the next recalculation
    public void setContent(CellContent content) {
        this.content = content;
        if (!content.isFormula()) {
            this.value = literalValue(content);
        }
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value;
    }

    /**
     * Value of a text or number content; formulas start out as an undefined error
     * until evaluated.
     */
    static CellValue literalValue(CellContent content) {
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
                return CellValue.error(FormulaError.undefinedVariable());
            }
        });
    }
}
