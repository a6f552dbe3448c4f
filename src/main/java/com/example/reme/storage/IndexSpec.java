package com.example.reme.storage;

import java.util.Objects;

/** A secondary index over one (optionally dotted) field of the records in a collection. */
public class IndexSpec {
    public String name;
    public String field;
    public boolean unique;

    public IndexSpec() {}
    public IndexSpec(String name, String field, boolean unique) {
        this.name = name; this.field = field; this.unique = unique;
    }

    public static IndexSpec on(String field) { return new IndexSpec(field, field, false); }
    public static IndexSpec uniqueOn(String field) { return new IndexSpec(field, field, true); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexSpec)) return false;
        IndexSpec other = (IndexSpec) o;
        return unique == other.unique && Objects.equals(name, other.name) && Objects.equals(field, other.field);
    }
    @Override public int hashCode() { return Objects.hash(name, field, unique); }
    @Override public String toString() { return name + (unique ? "(unique)" : ""); }
}
