package com.example.reme.services;

import com.example.reme.model.Recipe;
import com.example.reme.model.RecipeHistory;
import com.example.reme.model.SessionNote;
import com.example.reme.storage.RecordNotFoundException;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/** Cooking sessions: started, then completed once with an optional rating. */
public class RecipeHistoryService {
    private static final Logger log = LoggerFactory.getLogger(RecipeHistoryService.class);

    public static class Statistics {
        public int totalCooked;
        public int inProgress;
        public double averageRating;              // 0 when nothing is rated
        public List<Map.Entry<String, Integer>> mostCooked = new ArrayList<>();   // top 5 recipe id -> count
        public List<RecipeHistory> recentlyCooked = new ArrayList<>();            // up to 10
    }

    private static final Comparator<RecipeHistory> MOST_RECENT_FIRST =
            Comparator.comparing(RecipeHistory::lastActivity, Comparator.nullsLast(Comparator.reverseOrder()));

    private final RecordStore store;
    private final RecipeService recipes;
    private final Clock clock;

    public RecipeHistoryService(RecordStore store, RecipeService recipes, Clock clock) {
        this.store = store;
        this.recipes = recipes;
        this.clock = clock;
    }

    /**
     * Opens a session for an existing recipe. Servings default to the recipe's.
     *
     * @throws RecordNotFoundException when the recipe does not exist
     */
    public RecipeHistory start(String recipeId, String variantId, Integer servings, String note) {
        Recipe recipe = recipes.getById(recipeId).orElseThrow(() ->
                new RecordNotFoundException(Stores.RECIPES, recipeId, "Recipe not found: " + recipeId));
        Instant now = clock.instant();
        RecipeHistory entry = new RecipeHistory(Stores.newId("history"), recipeId, now);
        entry.variantId = variantId;
        entry.servingsMade = servings != null ? servings : recipe.servings;
        if (note != null && !note.isBlank()) entry.notes.add(new SessionNote(note, SessionNote.MODIFICATION, now));
        entry.createdAt = now;
        entry.updatedAt = now;
        store.add(Stores.RECIPE_HISTORY, entry);
        log.info("Started cooking {} ({})", recipe.name, entry.id);
        return entry;
    }

    public RecipeHistory start(String recipeId) { return start(recipeId, null, null, null); }

    /**
     * Finalizes a session exactly once.
     *
     * @throws RecordNotFoundException when there is no such session
     * @throws IllegalStateException when it is already completed
     * @throws IllegalArgumentException when the rating is outside 1..5
     */
    public RecipeHistory complete(String id, Integer rating, Boolean wouldMakeAgain, String note) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + rating);
        }
        RecipeHistory entry = getById(id).orElseThrow(() ->
                new RecordNotFoundException(Stores.RECIPE_HISTORY, id, "Recipe history entry not found: " + id));
        if (entry.completed) throw new IllegalStateException("Recipe history entry already completed: " + id);
        Instant now = clock.instant();
        entry.completed = true;
        entry.completedAt = now;
        entry.rating = rating;
        entry.wouldMakeAgain = wouldMakeAgain;
        if (note != null && !note.isBlank()) entry.notes.add(new SessionNote(note, SessionNote.MODIFICATION, now));
        entry.updatedAt = now;
        store.put(Stores.RECIPE_HISTORY, entry);
        log.info("Completed cooking session {} (rating {})", id, rating);
        return entry;
    }

    public RecipeHistory complete(String id, Integer rating) { return complete(id, rating, null, null); }

    public Optional<RecipeHistory> getById(String id) {
        return store.get(Stores.RECIPE_HISTORY, id, RecipeHistory.class);
    }

    /** Every session, most recent activity first. */
    public List<RecipeHistory> getAll() {
        List<RecipeHistory> all = store.getAll(Stores.RECIPE_HISTORY, RecipeHistory.class);
        all.sort(MOST_RECENT_FIRST);
        return all;
    }

    public List<RecipeHistory> getForRecipe(String recipeId) {
        List<RecipeHistory> out = store.getByIndex(Stores.RECIPE_HISTORY, "recipeId", recipeId, RecipeHistory.class);
        out.sort(MOST_RECENT_FIRST);
        return out;
    }

    public List<RecipeHistory> getCompleted() {
        List<RecipeHistory> out = store.getByIndex(Stores.RECIPE_HISTORY, "completed", true, RecipeHistory.class);
        out.sort(MOST_RECENT_FIRST);
        return out;
    }

    public List<RecipeHistory> getInProgress() {
        List<RecipeHistory> out = store.getByIndex(Stores.RECIPE_HISTORY, "completed", false, RecipeHistory.class);
        out.sort(MOST_RECENT_FIRST);
        return out;
    }

    public boolean delete(String id) {
        return store.delete(Stores.RECIPE_HISTORY, id);
    }

    public Statistics getStatistics() {
        List<RecipeHistory> all = getAll();
        List<RecipeHistory> completed = all.stream().filter(h -> h.completed).collect(Collectors.toList());
        Statistics stats = new Statistics();
        stats.totalCooked = completed.size();
        stats.inProgress = all.size() - completed.size();
        stats.averageRating = average(completed).orElse(0.0);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RecipeHistory h : completed) counts.merge(h.recipeId, 1, Integer::sum);
        stats.mostCooked = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(5)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        stats.recentlyCooked = completed.stream().limit(10).collect(Collectors.toList());
        return stats;
    }

    public int getCookCount(String recipeId) {
        int n = 0;
        for (RecipeHistory h : getForRecipe(recipeId)) if (h.completed) n++;
        return n;
    }

    /** Mean rating of the recipe's completed, rated sessions; empty when none is rated. */
    public OptionalDouble getAverageRating(String recipeId) {
        List<RecipeHistory> done = new ArrayList<>();
        for (RecipeHistory h : getForRecipe(recipeId)) if (h.completed) done.add(h);
        Optional<Double> avg = average(done);
        return avg.isPresent() ? OptionalDouble.of(avg.get()) : OptionalDouble.empty();
    }

    private static Optional<Double> average(List<RecipeHistory> entries) {
        int sum = 0;
        int count = 0;
        for (RecipeHistory h : entries) {
            if (h.rating != null) {
                sum += h.rating;
                count++;
            }
        }
        return count == 0 ? Optional.empty() : Optional.of((double) sum / count);
    }
}
