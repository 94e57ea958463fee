package com.formulagrid.app.models;

/**
 * One cell as returned over HTTP: its name, contents in string form
 * (e.g. "=A1+2") and current value (String, Double or FormulaError).
 */
public class CellView {
    private final String name;
    private final String contents;
    private final Object value;

    public CellView(String name, String contents, Object value) {
        this.name = name;
        this.contents = contents;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getContents() {
        return contents;
    }

    public Object getValue() {
        return value;
    }
}
