package com.formulagrid.app.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk shape of a sheet:
 * <pre>
 * {
 *   "cells": { "A1": { "stringForm": "5" }, "B1": { "stringForm": "=A1+2" } },
 *   "Version": "default"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SheetDocument {
    private Map<String, CellDocument> cells = new TreeMap<>();
    private String version;

    public SheetDocument() {
    }

    public SheetDocument(Map<String, CellDocument> cells, String version) {
        this.cells = new TreeMap<>(cells);
        this.version = version;
    }

    @JsonProperty("cells")
    public Map<String, CellDocument> getCells() {
        return cells;
    }

    @JsonProperty("cells")
    public void setCells(Map<String, CellDocument> cells) {
        this.cells = cells;
    }

    @JsonProperty("Version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("Version")
    public void setVersion(String version) {
        this.version = version;
    }
}
