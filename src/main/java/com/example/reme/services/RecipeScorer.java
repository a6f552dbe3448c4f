package com.example.reme.services;

import com.example.reme.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Scoring math shared by the daily pick and the cooking search. Everything here is a pure
 * function of its arguments; callers load the catalog, inventory and history once and pass
 * them in.
 */
public class RecipeScorer {
    public static final String UNKNOWN_INGREDIENT = "Ingrediente desconocido";

    // daily pick
    static final double DAILY_INVENTORY_WEIGHT = 0.5;
    static final double DAILY_RATING_WEIGHT = 0.3;
    static final double DAILY_FREQUENCY_WEIGHT = 0.2;

    // ingredient search
    static final double SEARCH_SPECIFIC_WEIGHT = 0.7;
    static final double SEARCH_INVENTORY_WEIGHT = 0.15;
    static final double SEARCH_HISTORY_WEIGHT = 0.1;
    static final double SEARCH_FRESHNESS_WEIGHT = 0.05;
    static final double EXACT_MATCH_BONUS = 0.2;
    static final double MAX_SPECIFIC_MATCH = 1.5;
    static final double MATCH_PERCENTAGE_SCALE = 1.2;

    // top list
    static final double TOP_INVENTORY_WEIGHT = 0.5;
    static final double TOP_HISTORY_WEIGHT = 0.3;
    static final double TOP_FRESHNESS_WEIGHT = 0.2;

    static final double NEUTRAL = 0.5;
    static final int FRESHNESS_DAYS = 7;
    static final int HISTORY_SATURATION = 10;

    // graded term matches
    static final double ID_MATCH = 1.5;
    static final double NAME_MATCH = 1.2;
    static final double SYNONYM_MATCH = 1.0;
    static final double DISPLAY_NAME_MATCH = 1.0;
    static final double PARTIAL_NAME = 0.6;
    static final double PARTIAL_NORMALIZED = 0.5;
    static final double PARTIAL_SYNONYM = 0.4;
    static final double PARTIAL_DISPLAY_NAME = 0.4;

    /** How often and how well a recipe has gone. {@code avgRating} is 0 when no session is rated. */
    public static class HistoryStats {
        public int count;
        public double avgRating;
        int rated;
        double ratingSum;
    }

    /** A daily pick with its breakdown. */
    public static class Ranked {
        public final Recipe recipe;
        public final RecommendationFactors factors;
        public Ranked(Recipe recipe, RecommendationFactors factors) { this.recipe = recipe; this.factors = factors; }
    }

    // ------------------------------------------------------------------ daily pick

    /**
     * Every recipe with its weighted daily score, best first. Ties keep recipe order.
     * {@code completed} holds only finished sessions.
     */
    public List<Ranked> rankDaily(List<Recipe> recipes, Set<String> inventoryIds, List<RecipeHistory> completed) {
        Map<String, HistoryStats> stats = buildHistoryMap(completed);
        int maxCookCount = 1;
        for (Recipe r : recipes) maxCookCount = Math.max(maxCookCount, countOf(stats, r.id));

        List<Ranked> out = new ArrayList<>(recipes.size());
        for (Recipe recipe : recipes) {
            double inventory = inventoryMatch(recipe, inventoryIds);
            HistoryStats h = stats.get(recipe.id);
            double rating = h != null && h.rated > 0 ? h.avgRating / 5.0 : NEUTRAL;
            double frequency = 1.0 - (double) countOf(stats, recipe.id) / maxCookCount;
            double finalScore = DAILY_INVENTORY_WEIGHT * inventory + DAILY_RATING_WEIGHT * rating + DAILY_FREQUENCY_WEIGHT * frequency;
            out.add(new Ranked(recipe, new RecommendationFactors(inventory, rating, frequency, finalScore)));
        }
        out.sort(Comparator.comparingDouble((Ranked r) -> r.factors.finalScore).reversed());
        return out;
    }

    // ------------------------------------------------------------------ ingredient search

    /**
     * Catalog ids each search term points at, by loose containment against name, normalized
     * name and synonyms in either direction. Terms are lowercased and trimmed; blank terms
     * are dropped.
     */
    public Map<String, Set<String>> resolveTerms(List<String> terms, Collection<CatalogIngredient> catalog) {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (String term : cleanTerms(terms)) {
            Set<String> ids = new LinkedHashSet<>();
            for (CatalogIngredient ing : catalog) {
                if (overlaps(lower(ing.name), term) || overlaps(lower(ing.normalizedName), term)) {
                    ids.add(ing.id);
                    continue;
                }
                if (ing.synonyms != null) {
                    for (String syn : ing.synonyms) {
                        if (overlaps(lower(syn), term)) {
                            ids.add(ing.id);
                            break;
                        }
                    }
                }
            }
            out.put(term, ids);
        }
        return out;
    }

    /**
     * Scores one recipe against resolved search terms. With no terms the match percentage is
     * the inventory match.
     */
    public RecipeScore scoreForSearch(Recipe recipe, Map<String, Set<String>> resolvedTerms, Map<String, CatalogIngredient> catalog,
                                      Set<String> inventoryIds, Map<String, HistoryStats> history,
                                      List<RecipeHistory> allHistory, Instant now) {
        RecipeScore s = new RecipeScore();
        s.recipe = recipe;
        s.inventoryMatch = inventoryMatch(recipe, inventoryIds);
        s.userHistory = historyScore(history.get(recipe.id));
        s.freshness = freshness(recipe.id, allHistory, now);
        s.missingIngredients = missingIngredients(recipe, inventoryIds, catalog);

        int termCount = resolvedTerms.size();
        if (termCount == 0) {
            s.score = SEARCH_INVENTORY_WEIGHT * s.inventoryMatch + SEARCH_HISTORY_WEIGHT * s.userHistory
                    + SEARCH_FRESHNESS_WEIGHT * s.freshness;
            s.matchPercentage = s.inventoryMatch;
            return s;
        }

        List<RecipeIngredient> required = requiredIngredients(recipe);
        double sum = 0;
        int matchedRequired = 0;
        Set<String> exactTerms = new HashSet<>();
        for (RecipeIngredient line : required) {
            double best = 0;
            for (Map.Entry<String, Set<String>> term : resolvedTerms.entrySet()) {
                double grade = grade(line, catalog.get(line.ingredientId), term.getKey(), term.getValue());
                if (grade >= SYNONYM_MATCH) exactTerms.add(term.getKey());
                best = Math.max(best, grade);
            }
            if (best > 0) matchedRequired++;
            sum += best;
        }
        s.exactMatches = exactTerms.size();
        s.specificMatch = Math.min(MAX_SPECIFIC_MATCH, sum / termCount);
        double exactBonus = EXACT_MATCH_BONUS * exactTerms.size() / termCount;
        s.score = SEARCH_SPECIFIC_WEIGHT * s.specificMatch + SEARCH_INVENTORY_WEIGHT * s.inventoryMatch
                + SEARCH_HISTORY_WEIGHT * s.userHistory + SEARCH_FRESHNESS_WEIGHT * s.freshness + exactBonus;
        double termCoverage = Math.min(1.0, sum / (termCount * MATCH_PERCENTAGE_SCALE));
        double requiredCoverage = required.isEmpty() ? 0 : (double) matchedRequired / required.size();
        s.matchPercentage = Math.min(termCoverage, requiredCoverage);
        return s;
    }

    /** General cooking score used by the top list: inventory, history and freshness only. */
    public RecipeScore scoreForCooking(Recipe recipe, Map<String, CatalogIngredient> catalog, Set<String> inventoryIds,
                                       Map<String, HistoryStats> history, List<RecipeHistory> allHistory, Instant now) {
        RecipeScore s = new RecipeScore();
        s.recipe = recipe;
        s.inventoryMatch = inventoryMatch(recipe, inventoryIds);
        s.userHistory = historyScore(history.get(recipe.id));
        s.freshness = freshness(recipe.id, allHistory, now);
        s.missingIngredients = missingIngredients(recipe, inventoryIds, catalog);
        s.matchPercentage = s.inventoryMatch;
        s.score = TOP_INVENTORY_WEIGHT * s.inventoryMatch + TOP_HISTORY_WEIGHT * s.userHistory + TOP_FRESHNESS_WEIGHT * s.freshness;
        return s;
    }

    /**
     * Best grade one search term earns against one recipe line. Exact hits score 1.0 and
     * above, partial containment hits below.
     */
    double grade(RecipeIngredient line, CatalogIngredient ing, String term, Set<String> resolvedIds) {
        String display = lower(line.displayName);
        if (ing != null) {
            String name = lower(ing.name);
            String normalized = lower(ing.normalizedName);
            List<String> synonyms = new ArrayList<>();
            if (ing.synonyms != null) for (String syn : ing.synonyms) synonyms.add(lower(syn));

            if (resolvedIds.contains(line.ingredientId)) return ID_MATCH;
            if (term.equals(name) || term.equals(normalized)) return NAME_MATCH;
            if (synonyms.contains(term)) return SYNONYM_MATCH;
            if (term.equals(display)) return DISPLAY_NAME_MATCH;
            if (overlaps(name, term)) return PARTIAL_NAME;
            if (overlaps(normalized, term)) return PARTIAL_NORMALIZED;
            for (String syn : synonyms) if (overlaps(syn, term)) return PARTIAL_SYNONYM;
            if (overlaps(display, term)) return PARTIAL_DISPLAY_NAME;
            return 0;
        }
        // dangling reference: only the line's own display name is known
        if (term.equals(display)) return DISPLAY_NAME_MATCH;
        if (overlaps(display, term)) return PARTIAL_DISPLAY_NAME;
        return 0;
    }

    // ------------------------------------------------------------------ shared factors

    /** Fraction of the recipe's ingredient lines whose ingredient is in stock; 0 for an empty list. */
    public static double inventoryMatch(Recipe recipe, Set<String> inventoryIds) {
        if (recipe.ingredients == null || recipe.ingredients.isEmpty()) return 0;
        int matched = 0;
        for (RecipeIngredient line : recipe.ingredients) if (inventoryIds.contains(line.ingredientId)) matched++;
        return (double) matched / recipe.ingredients.size();
    }

    /** Session count and mean rating per recipe id. */
    public static Map<String, HistoryStats> buildHistoryMap(List<RecipeHistory> history) {
        Map<String, HistoryStats> map = new HashMap<>();
        for (RecipeHistory h : history) {
            HistoryStats s = map.computeIfAbsent(h.recipeId, k -> new HistoryStats());
            s.count++;
            if (h.rating != null) {
                s.rated++;
                s.ratingSum += h.rating;
                s.avgRating = s.ratingSum / s.rated;
            }
        }
        return map;
    }

    /** Rating over 5 damped by how often it was made; neutral for a recipe never cooked. */
    public static double historyScore(HistoryStats stats) {
        if (stats == null) return NEUTRAL;
        double frequencyPenalty = Math.max(0, 1.0 - (double) stats.count / HISTORY_SATURATION);
        return stats.avgRating / 5.0 * frequencyPenalty;
    }

    /** 1 unless the recipe was started within the last week, scaled by days since the latest start. */
    public static double freshness(String recipeId, List<RecipeHistory> history, Instant now) {
        Instant latest = null;
        for (RecipeHistory h : history) {
            if (!Objects.equals(recipeId, h.recipeId) || h.startedAt == null) continue;
            if (latest == null || h.startedAt.isAfter(latest)) latest = h.startedAt;
        }
        if (latest == null) return 1.0;
        double daysSince = Duration.between(latest, now).toMillis() / (double) Duration.ofDays(1).toMillis();
        return Math.max(0, Math.min(1.0, daysSince / FRESHNESS_DAYS));
    }

    /** Recipes with activity strictly after {@code now - days}. */
    public static Set<String> recentRecipeIds(List<RecipeHistory> history, int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        Set<String> out = new HashSet<>();
        for (RecipeHistory h : history) {
            Instant last = h.lastActivity();
            if (last != null && last.isAfter(cutoff)) out.add(h.recipeId);
        }
        return out;
    }

    /** Display names of lines not in stock: catalog name, then the line's own name, then a placeholder. */
    public static List<String> missingIngredients(Recipe recipe, Set<String> inventoryIds, Map<String, CatalogIngredient> catalog) {
        List<String> out = new ArrayList<>();
        if (recipe.ingredients == null) return out;
        for (RecipeIngredient line : recipe.ingredients) {
            if (inventoryIds.contains(line.ingredientId)) continue;
            CatalogIngredient ing = catalog.get(line.ingredientId);
            if (ing != null && ing.name != null) out.add(ing.name);
            else if (line.displayName != null && !line.displayName.isBlank()) out.add(line.displayName);
            else out.add(UNKNOWN_INGREDIENT);
        }
        return out;
    }

    /** Non-optional lines; all lines when every one is optional. */
    static List<RecipeIngredient> requiredIngredients(Recipe recipe) {
        List<RecipeIngredient> out = new ArrayList<>();
        if (recipe.ingredients == null) return out;
        for (RecipeIngredient line : recipe.ingredients) if (!line.optional) out.add(line);
        return out.isEmpty() ? new ArrayList<>(recipe.ingredients) : out;
    }

    static List<String> cleanTerms(List<String> terms) {
        Set<String> out = new LinkedHashSet<>();
        if (terms != null) {
            for (String t : terms) {
                if (t == null) continue;
                String c = t.trim().toLowerCase(Locale.ROOT);
                if (!c.isEmpty()) out.add(c);
            }
        }
        return new ArrayList<>(out);
    }

    private static int countOf(Map<String, HistoryStats> stats, String recipeId) {
        HistoryStats s = stats.get(recipeId);
        return s == null ? 0 : s.count;
    }

    /** Containment in either direction, never on an empty side. */
    private static boolean overlaps(String candidate, String term) {
        if (candidate.isEmpty() || term.isEmpty()) return false;
        return candidate.contains(term) || term.contains(candidate);
    }

    private static String lower(String s) { return s == null ? "" : s.toLowerCase(Locale.ROOT); }
}
