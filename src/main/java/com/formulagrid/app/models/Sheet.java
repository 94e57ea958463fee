package com.formulagrid.app.models;

import com.formulagrid.app.engine.Spreadsheet;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents a spreadsheet held by the service:
 * - Has a unique ID
 * - The calculation engine with its cells and dependency graph
 * - A read/write lock for concurrency
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Spreadsheet spreadsheet;

    // Every mutate-and-recalculate runs under the write lock, so a rejected
    // assignment is never visible half-applied to readers
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(Spreadsheet spreadsheet) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.spreadsheet = spreadsheet;
    }

    public long getId() {
        return id;
    }

    public Spreadsheet getSpreadsheet() {
        return spreadsheet;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
