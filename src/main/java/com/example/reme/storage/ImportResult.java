package com.example.reme.storage;

import java.util.ArrayList;
import java.util.List;

/** Written-record count plus one message per skipped record. */
public class ImportResult {
    public int success;
    public List<String> errors = new ArrayList<>();
    public List<ValidationFailure> failures = new ArrayList<>();
    public boolean cancelled;

    public static ImportResult cancelled() {
        ImportResult r = new ImportResult();
        r.cancelled = true;
        return r;
    }

    @Override public String toString() {
        return (cancelled ? "cancelled, " : "") + success + " imported, " + errors.size() + " errors";
    }
}
