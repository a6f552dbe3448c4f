package com.example.reme.storage;

import java.io.IOException;

/** Import input is not JSON, or matches none of the accepted envelope shapes. Nothing was written. */
public class ImportParseException extends IOException {
    public ImportParseException(String message) { super(message); }
    public ImportParseException(String message, Throwable cause) { super(message, cause); }
}
