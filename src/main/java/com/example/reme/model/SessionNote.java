package com.example.reme.model;

import java.time.Instant;

public class SessionNote {
    public static final String MODIFICATION = "modification";

    public String content;
    public String type = MODIFICATION;   // tip | warning | modification | clarification
    public Instant timestamp;

    public SessionNote() {}
    public SessionNote(String content, String type, Instant timestamp) {
        this.content = content; this.type = type; this.timestamp = timestamp;
    }
}
