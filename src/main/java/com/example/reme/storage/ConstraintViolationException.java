package com.example.reme.storage;

/**
 * A write was refused because it would break a constraint: a duplicate value on a unique
 * index, an insert over an existing key, or a protected record such as a default location.
 */
public class ConstraintViolationException extends StoreException {
    public ConstraintViolationException(String message) { super(message); }
}
