package com.example.reme.services;

import com.example.reme.model.*;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;

import static com.example.reme.TestKitchen.*;
import static org.junit.jupiter.api.Assertions.*;

public class RecipeScorerTests {
    private final RecipeScorer scorer = new RecipeScorer();

    private static CatalogIngredient tomate() {
        return ingredient("ing_tomate", "Tomate", "jitomate");
    }

    @Test
    void grades_follow_match_strength() {
        CatalogIngredient ing = tomate();
        RecipeIngredient line = new RecipeIngredient("ing_tomate", "Jitomate rojo", 2, "pieza");

        assertEquals(1.5, scorer.grade(line, ing, "x", Set.of("ing_tomate")), 1e-9);
        assertEquals(1.2, scorer.grade(line, ing, "tomate", Set.of()), 1e-9);
        assertEquals(1.0, scorer.grade(line, ing, "jitomate", Set.of()), 1e-9);
        assertEquals(1.0, scorer.grade(line, ing, "jitomate rojo", Set.of()), 1e-9);
        assertEquals(0.6, scorer.grade(line, ing, "toma", Set.of()), 1e-9);
        assertEquals(0.4, scorer.grade(line, ing, "rojo", Set.of()), 1e-9);
        assertEquals(0.0, scorer.grade(line, ing, "arroz", Set.of()), 1e-9);
    }

    @Test
    void dangling_lines_match_on_display_name_only() {
        RecipeIngredient line = new RecipeIngredient("ing_gone", "Azafrán", 1, "pizca");
        assertEquals(1.0, scorer.grade(line, null, "azafrán", Set.of("ing_gone")), 1e-9);
        assertEquals(0.4, scorer.grade(line, null, "azaf", Set.of()), 1e-9);
        assertEquals(0.0, scorer.grade(line, null, "sal", Set.of()), 1e-9);
    }

    @Test
    void terms_are_cleaned_and_resolved_by_containment() {
        Map<String, Set<String>> resolved = scorer.resolveTerms(
                Arrays.asList("  Jitomate ", "jitomate", "", null, "CEBOLLA"),
                List.of(tomate(), ingredient("ing_cebolla", "Cebolla morada")));

        assertEquals(List.of("jitomate", "cebolla"), List.copyOf(resolved.keySet()));
        assertEquals(Set.of("ing_tomate"), resolved.get("jitomate"));
        assertEquals(Set.of("ing_cebolla"), resolved.get("cebolla"));
    }

    @Test
    void search_score_combines_specific_match_and_exact_bonus() {
        Recipe salsa = recipe("salsa", "Salsa", "ing_tomate", "ing_cebolla");
        Map<String, CatalogIngredient> catalog = Map.of("ing_tomate", tomate());

        RecipeScore s = scorer.scoreForSearch(salsa, Map.of("jitomate", Set.of("ing_tomate")), catalog,
                Set.of("ing_cebolla"), Map.of(), List.of(), NOW);

        assertEquals(1.5, s.specificMatch, 1e-9);
        assertEquals(0.5, s.inventoryMatch, 1e-9);
        assertEquals(0.5, s.userHistory, 1e-9);
        assertEquals(1.0, s.freshness, 1e-9);
        assertEquals(0.7 * 1.5 + 0.15 * 0.5 + 0.1 * 0.5 + 0.05 + 0.2, s.score, 1e-9);
        assertEquals(0.5, s.matchPercentage, 1e-9);
        assertEquals(List.of("Tomate"), s.missingIngredients);
    }

    @Test
    void optional_lines_do_not_count_as_required() {
        Recipe r = recipe("r", "R", "ing_tomate", "ing_limon");
        r.ingredients.get(1).optional = true;
        assertEquals(1, RecipeScorer.requiredIngredients(r).size());

        r.ingredients.get(0).optional = true;
        assertEquals(2, RecipeScorer.requiredIngredients(r).size());

        RecipeScore s = scorer.scoreForSearch(recipe("only", "Only", "ing_tomate"),
                Map.of("tomate", Set.of("ing_tomate")), Map.of("ing_tomate", tomate()), Set.of(), Map.of(), List.of(), NOW);
        assertEquals(1.0, s.matchPercentage, 1e-9);
    }

    @Test
    void history_map_averages_rated_sessions_only() {
        List<RecipeHistory> history = List.of(
                cooked("h1", "r1", NOW, 5),
                cooked("h2", "r1", NOW, null),
                cooked("h3", "r1", NOW, 3),
                cooked("h4", "r2", NOW, null));
        Map<String, RecipeScorer.HistoryStats> map = RecipeScorer.buildHistoryMap(history);

        assertEquals(3, map.get("r1").count);
        assertEquals(4.0, map.get("r1").avgRating, 1e-9);
        assertEquals(0.0, map.get("r2").avgRating, 1e-9);
        assertEquals(4.0 / 5 * 0.7, RecipeScorer.historyScore(map.get("r1")), 1e-9);
        assertEquals(0.5, RecipeScorer.historyScore(null), 1e-9);
    }

    @Test
    void history_score_vanishes_for_very_frequent_recipes() {
        List<RecipeHistory> history = new ArrayList<>();
        for (int i = 0; i < 12; i++) history.add(cooked("h" + i, "r1", NOW, 5));
        assertEquals(0.0, RecipeScorer.historyScore(RecipeScorer.buildHistoryMap(history).get("r1")), 1e-9);
    }

    @Test
    void freshness_grows_over_a_week() {
        RecipeHistory h = new RecipeHistory("h", "r1", NOW.minus(Duration.ofHours(84)));
        assertEquals(1.0, RecipeScorer.freshness("r2", List.of(h), NOW), 1e-9);
        assertEquals(0.5, RecipeScorer.freshness("r1", List.of(h), NOW), 1e-9);
        assertEquals(1.0, RecipeScorer.freshness("r1", List.of(new RecipeHistory("h", "r1", NOW.minus(Duration.ofDays(30)))), NOW), 1e-9);
        assertEquals(0.0, RecipeScorer.freshness("r1", List.of(new RecipeHistory("h", "r1", NOW.plus(Duration.ofHours(1)))), NOW), 1e-9);
    }

    @Test
    void recent_means_strictly_inside_the_window() {
        List<RecipeHistory> history = List.of(
                cooked("h1", "edge", NOW.minus(Duration.ofDays(7)), null),
                cooked("h2", "inside", NOW.minus(Duration.ofDays(6)), null),
                new RecipeHistory("h3", "started", NOW.minus(Duration.ofDays(1))));
        assertEquals(Set.of("inside", "started"), RecipeScorer.recentRecipeIds(history, 7, NOW));
    }

    @Test
    void missing_names_fall_back_to_line_name_then_placeholder() {
        Recipe r = new Recipe("r", "R", List.of(
                new RecipeIngredient("ing_tomate", "jitomate", 1, "pieza"),
                new RecipeIngredient("ing_gone", "Azafrán", 1, "pizca"),
                new RecipeIngredient("ing_gone2", " ", 1, "pizca"),
                new RecipeIngredient("ing_sal", "Sal", 1, "pizca")), 10, "Fácil");

        List<String> missing = RecipeScorer.missingIngredients(r, Set.of("ing_sal"), Map.of("ing_tomate", tomate()));

        assertEquals(List.of("Tomate", "Azafrán", RecipeScorer.UNKNOWN_INGREDIENT), missing);
    }

    @Test
    void daily_ranking_is_stable_on_ties() {
        List<Recipe> recipes = List.of(recipe("x", "X", "ing_a"), recipe("y", "Y", "ing_b"), recipe("z", "Z", "ing_c"));
        List<RecipeScorer.Ranked> ranked = scorer.rankDaily(recipes, Set.of("ing_c"), List.of());

        assertEquals("z", ranked.get(0).recipe.id);
        assertEquals("x", ranked.get(1).recipe.id);
        assertEquals("y", ranked.get(2).recipe.id);
        assertEquals(0.5 + 0.15 + 0.2, ranked.get(0).factors.finalScore, 1e-9);
        assertEquals(0.0, RecipeScorer.inventoryMatch(new Recipe("e", "E", List.of(), 5, "Fácil"), Set.of("ing_a")), 1e-9);
    }
}
