package com.example.reme.storage;

/** One reason why an imported record was rejected. */
public class ValidationFailure {
    public enum Reason { NOT_AN_OBJECT, MISSING_FIELD, NOT_AN_ARRAY, NOT_A_NUMBER, WRONG_TYPE }

    public final int index;
    public final String field;   // null for NOT_AN_OBJECT, may be null for WRONG_TYPE
    public final Reason reason;

    public ValidationFailure(int index, String field, Reason reason) {
        this.index = index; this.field = field; this.reason = reason;
    }

    public String describe() {
        switch (reason) {
            case NOT_AN_OBJECT: return "not an object";
            case MISSING_FIELD: return "missing '" + field + "'";
            case NOT_AN_ARRAY: return "'" + field + "' must be an array";
            case NOT_A_NUMBER: return "'" + field + "' must be a number";
            case WRONG_TYPE: return field == null ? "cannot be read as a record" : "'" + field + "' has the wrong type";
            default: return reason.name();
        }
    }

    @Override public String toString() { return "#" + index + " " + describe(); }
}
