package com.example.reme.services;

import com.example.reme.model.CatalogIngredient;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.reme.TestKitchen.ingredient;
import static org.junit.jupiter.api.Assertions.*;

public class IngredientMatcherTests {
    private RecordStore store;
    private IngredientMatcher matcher;

    @BeforeEach
    void setUp() {
        store = RecordStore.inMemory(Stores.schemas());
        store.put(Stores.INGREDIENTS, ingredient("ing_tomate", "Tomate", "jitomate"));
        store.put(Stores.INGREDIENTS, ingredient("ing_cebolla", "Cebolla"));
        store.put(Stores.INGREDIENTS, ingredient("ing_papa", "Papa"));
        store.put(Stores.INGREDIENTS, ingredient("ing_limon", "Limón"));
        AliasResolver aliases = new AliasResolver(List.of(
                List.of("tomate", "jitomate"),
                List.of("papa", "patata")));
        matcher = new IngredientMatcher(store, aliases, 0.6);
    }

    @Test
    void exact_normalized_name_matches() {
        assertEquals("ing_cebolla", matcher.findExisting("Cebollas").orElseThrow().id);
        assertEquals("ing_limon", matcher.findExisting("limon").orElseThrow().id);
        assertEquals("ing_limon", matcher.findExisting("LIMÓN").orElseThrow().id);
    }

    @Test
    void synonym_group_matches() {
        assertEquals("ing_tomate", matcher.findExisting("Jitomate").orElseThrow().id);
        assertEquals("ing_papa", matcher.findExisting("patata").orElseThrow().id);
    }

    @Test
    void unknown_or_blank_names_have_no_match() {
        assertTrue(matcher.findExisting("zanahoria").isEmpty());
        assertTrue(matcher.findExisting("  ").isEmpty());
        assertTrue(matcher.findSimilar(null).isEmpty());
    }

    @Test
    void exact_tier_wins_over_synonym_tier() {
        store.put(Stores.INGREDIENTS, ingredient("ing_jitomate", "Jitomate"));
        List<CatalogIngredient> similar = matcher.findSimilar("jitomate");
        assertEquals("ing_jitomate", similar.get(0).id);
        assertEquals("ing_tomate", similar.get(1).id);
    }

    @Test
    void results_are_copies() {
        CatalogIngredient found = matcher.findExisting("cebolla").orElseThrow();
        found.name = "changed";
        assertEquals("Cebolla", matcher.findExisting("cebolla").orElseThrow().name);
    }

    @Test
    void fuzzy_search_tolerates_typos() {
        List<IngredientMatcher.Match> hits = matcher.fuzzySearch("cebola");
        assertEquals("ing_cebolla", hits.get(0).ingredient.id);
        assertEquals(1 - 1.0 / 7, hits.get(0).similarity, 1e-9);
        assertTrue(matcher.fuzzySearch("xyz").isEmpty());
    }

    @Test
    void fuzzy_search_checks_synonyms_too() {
        List<IngredientMatcher.Match> hits = matcher.fuzzySearch("jitomate", 0.9);
        assertEquals(1, hits.size());
        assertEquals("ing_tomate", hits.get(0).ingredient.id);
        assertEquals(1.0, hits.get(0).similarity, 1e-9);
    }

    @Test
    void fuzzy_ties_keep_catalog_order() {
        store.put(Stores.INGREDIENTS, ingredient("ing_sal_b", "Sal"));
        store.put(Stores.INGREDIENTS, ingredient("ing_sal_a", "Sal"));
        List<IngredientMatcher.Match> hits = matcher.fuzzySearch("sal", 0.9);
        assertEquals(List.of("ing_sal_b", "ing_sal_a"), List.of(hits.get(0).ingredient.id, hits.get(1).ingredient.id));
    }

    @Test
    void catalog_changes_are_picked_up() {
        assertTrue(matcher.fuzzySearch("pepino").isEmpty());
        store.put(Stores.INGREDIENTS, ingredient("ing_pepino", "Pepino"));
        assertEquals("ing_pepino", matcher.fuzzySearch("pepino").get(0).ingredient.id);
        store.delete(Stores.INGREDIENTS, "ing_pepino");
        assertTrue(matcher.findExisting("pepino").isEmpty());
    }

    @Test
    void similarity_is_bounded_reflexive_and_symmetric() {
        assertEquals(1.0, IngredientMatcher.similarity("Tomate", "tomate"), 1e-9);
        assertEquals(1.0, IngredientMatcher.similarity("", ""), 1e-9);
        assertEquals(0.0, IngredientMatcher.similarity("", "ajo"), 1e-9);
        assertEquals(0.75, IngredientMatcher.similarity("tomate", "jitomate"), 1e-9);
        for (String[] pair : new String[][] {{"cebolla", "cebollín"}, {"ajo", "zanahoria"}, {"pollo", "pavo"}}) {
            double ab = IngredientMatcher.similarity(pair[0], pair[1]);
            assertEquals(ab, IngredientMatcher.similarity(pair[1], pair[0]), 1e-12);
            assertTrue(ab >= 0.0 && ab <= 1.0);
        }
    }

    @Test
    void levenshtein_counts_edits() {
        assertEquals(3, IngredientMatcher.levenshtein("kitten", "sitting"));
        assertEquals(0, IngredientMatcher.levenshtein("ajo", "ajo"));
        assertEquals(3, IngredientMatcher.levenshtein("", "ajo"));
    }

    @Test
    void automatic_synonyms_include_the_group() {
        assertEquals(List.of("jitomate", "tomate"), matcher.generateAutomaticSynonyms("Jitomate"));
        assertEquals(List.of("pepino"), matcher.generateAutomaticSynonyms("Pepinos"));
    }
}
