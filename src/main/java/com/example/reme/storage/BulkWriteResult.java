package com.example.reme.storage;

import java.util.List;

/** Outcome of a best-effort bulk write: items that failed do not undo the ones written, unless the batch itself could not be saved. */
public class BulkWriteResult {
    public static class Failure {
        public final int index;
        public final String id;     // nullable, when the item had no usable key
        public final String message;
        public Failure(int index, String id, String message) { this.index = index; this.id = id; this.message = message; }
        @Override public String toString() { return "#" + index + (id == null ? "" : " (" + id + ")") + ": " + message; }
    }

    public final int written;
    public final List<Failure> failures;

    public BulkWriteResult(int written, List<Failure> failures) {
        this.written = written; this.failures = List.copyOf(failures);
    }

    public boolean isComplete() { return failures.isEmpty(); }
}
