package com.example.reme.services;

import com.example.reme.TestKitchen;
import com.example.reme.engine.KitchenCore;
import com.example.reme.model.Recipe;
import com.example.reme.storage.Stores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static com.example.reme.TestKitchen.*;
import static org.junit.jupiter.api.Assertions.*;

public class CookSearchServiceTests {
    private KitchenCore core;
    private CookSearchService search;

    @BeforeEach
    void setUp() {
        core = kitchen(new TestKitchen.MutableClock(NOW));
        search = core.cookSearch();
        core.store().put(Stores.INGREDIENTS, ingredient("ing_tomate", "Tomate", "jitomate"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_cebolla", "Cebolla"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_papa", "Papa"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_zanahoria", "Zanahoria"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_ajo", "Ajo"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_pollo", "Pollo"));
    }

    private void put(Recipe r) { core.store().put(Stores.RECIPES, r); }

    private static List<String> ids(List<RecipeScore> scores) {
        return scores.stream().map(s -> s.recipe.id).collect(Collectors.toList());
    }

    @Test
    void synonym_term_keeps_recipes_it_mostly_covers() {
        put(recipe("salsa", "Salsa", "ing_tomate", "ing_cebolla"));
        put(recipe("guiso", "Guiso", "ing_tomate", "ing_papa", "ing_zanahoria", "ing_ajo", "ing_pollo"));

        List<RecipeScore> results = search.getRecipesByIngredients(List.of("Jitomate"));

        assertEquals(List.of("salsa"), ids(results));
        RecipeScore salsa = results.get(0);
        assertEquals(0.5, salsa.matchPercentage, 1e-9);
        assertEquals(1.5, salsa.specificMatch, 1e-9);
        assertEquals(1, salsa.exactMatches);
        assertEquals(List.of("Tomate", "Cebolla"), salsa.missingIngredients);
    }

    @Test
    void full_coverage_ranks_first() {
        put(recipe("salsa", "Salsa", "ing_tomate", "ing_cebolla"));
        put(recipe("guiso", "Guiso", "ing_tomate", "ing_papa", "ing_zanahoria", "ing_ajo", "ing_pollo"));
        put(recipe("papas", "Papas con cebolla", "ing_papa", "ing_cebolla"));

        List<RecipeScore> results = search.getRecipesByIngredients(List.of("cebolla", "papa", " papa "));

        assertEquals(List.of("papas", "salsa"), ids(results));
        assertEquals(1.0, results.get(0).matchPercentage, 1e-9);
        assertEquals(0.5, results.get(1).matchPercentage, 1e-9);
    }

    @Test
    void equal_coverage_is_ordered_by_score() {
        put(recipe("curtida", "Cebolla curtida", "ing_cebolla"));
        put(recipe("asada", "Cebolla asada", "ing_cebolla"));
        core.store().put(Stores.RECIPE_HISTORY, cooked("h1", "curtida", NOW.minus(Duration.ofDays(1)), 1));

        List<RecipeScore> results = search.getRecipesByIngredients(List.of("cebolla"));

        assertEquals(List.of("asada", "curtida"), ids(results));
        assertTrue(results.get(0).score > results.get(1).score);
        assertEquals(1.35, results.get(0).score, 1e-9);
    }

    @Test
    void filters_apply_before_scoring() {
        Recipe quick = recipe("rapida", "Salsa rápida", "ing_tomate");
        quick.time = 10;
        put(quick);
        Recipe slow = recipe("lenta", "Salsa lenta", "ing_tomate");
        slow.time = 60;
        slow.difficulty = "Avanzado";
        put(slow);

        assertEquals(List.of("rapida"), ids(search.getRecipesByIngredients(List.of("tomate"), new CookSearchService.Filters(15, null))));
        assertEquals(List.of("lenta"), ids(search.getRecipesByIngredients(List.of("tomate"), new CookSearchService.Filters(null, "Avanzado"))));
        assertTrue(search.getRecipesByIngredients(List.of("tomate"), new CookSearchService.Filters(5, null)).isEmpty());
        assertEquals(2, search.getRecipesByIngredients(List.of("tomate"), CookSearchService.Filters.none()).size());
    }

    @Test
    void no_terms_fall_back_to_inventory_coverage() {
        put(recipe("salsa", "Salsa", "ing_tomate", "ing_cebolla"));
        put(recipe("guiso", "Guiso", "ing_papa", "ing_pollo"));
        core.store().put(Stores.INVENTORY, stock("i1", "ing_cebolla", 1, "pieza", "Alacena", null));

        List<RecipeScore> results = search.getRecipesByIngredients(List.of(" ", ""));

        assertEquals(List.of("salsa"), ids(results));
        assertEquals(0.5, results.get(0).matchPercentage, 1e-9);
        assertEquals(List.of("Tomate"), results.get(0).missingIngredients);
    }

    @Test
    void top_list_skips_recipes_cooked_in_the_last_three_days_when_it_can() {
        put(recipe("a", "A", "ing_tomate"));
        put(recipe("b", "B", "ing_papa"));
        put(recipe("c", "C", "ing_cebolla"));
        core.store().put(Stores.INVENTORY, stock("i1", "ing_cebolla", 1, "pieza", "Alacena", null));
        core.store().put(Stores.RECIPE_HISTORY, cooked("h1", "a", NOW.minus(Duration.ofDays(1)), 5));

        assertEquals(List.of("c", "b"), ids(search.getTopRecommendedRecipes(2)));
        assertEquals(List.of("c", "b", "a"), ids(search.getTopRecommendedRecipes(3)));
        assertEquals(0.85, search.getTopRecommendedRecipes(1).get(0).score, 1e-9);
        assertTrue(search.getTopRecommendedRecipes(0).isEmpty());
        assertEquals(3, search.getTopRecommendedRecipes().size());
    }

    @Test
    void nothing_to_search_without_recipes() {
        assertTrue(search.getRecipesByIngredients(List.of("tomate")).isEmpty());
        assertTrue(search.getTopRecommendedRecipes().isEmpty());
    }
}
