package com.example.reme.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** One cooking session: created when it starts, finalized once when it completes. */
public class RecipeHistory {
    public String id;
    public String recipeId;
    public String variantId;
    public Instant startedAt;
    public Instant completedAt;
    public boolean completed;
    public int servingsMade;
    public Integer rating;            // 1..5
    public Boolean wouldMakeAgain;
    public List<SessionNote> notes = new ArrayList<>();
    public Instant createdAt;
    public Instant updatedAt;

    public RecipeHistory() {}
    public RecipeHistory(String id, String recipeId, Instant startedAt) {
        this.id = id; this.recipeId = recipeId; this.startedAt = startedAt;
    }

    /** Completion time when known, otherwise start time. */
    public Instant lastActivity() { return completedAt != null ? completedAt : startedAt; }
}
