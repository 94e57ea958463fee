package com.formulagrid.app.persistence;

/**
 * One stored cell: {"stringForm": "..."}.
 */
public class CellDocument {
    private String stringForm;

    // Default constructor needed for JSON (de)serialization
    public CellDocument() {
    }

    public CellDocument(String stringForm) {
        this.stringForm = stringForm;
    }

    public String getStringForm() {
        return stringForm;
    }

    public void setStringForm(String stringForm) {
        this.stringForm = stringForm;
    }
}
