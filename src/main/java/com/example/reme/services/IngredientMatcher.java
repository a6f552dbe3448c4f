package com.example.reme.services;

import com.example.reme.model.CatalogIngredient;
import com.example.reme.storage.JsonStorage;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import com.example.reme.storage.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves free-text ingredient references (typed, spoken or recognised from a photo) to
 * catalog entries: duplicate detection through normalization and synonym groups, and
 * edit-distance ranked fuzzy search.
 *
 * <p>Normalized forms of the catalog are computed once and kept until the ingredients
 * collection changes.
 */
public class IngredientMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngredientMatcher.class);

    public static class Match {
        public final CatalogIngredient ingredient;
        public final double similarity;
        public Match(CatalogIngredient ingredient, double similarity) { this.ingredient = ingredient; this.similarity = similarity; }
        @Override public String toString() { return String.format("%s (%.2f)", ingredient.name, similarity); }
    }

    private static final class Prepared {
        final int position;
        final CatalogIngredient ingredient;
        final String normalizedName;
        final String normalizedDisplay;
        final List<String> normalizedSynonyms;

        Prepared(int position, CatalogIngredient ingredient) {
            this.position = position;
            this.ingredient = ingredient;
            this.normalizedName = NameNormalizer.normalize(ingredient.normalizedName != null ? ingredient.normalizedName : ingredient.name);
            this.normalizedDisplay = NameNormalizer.normalize(ingredient.name);
            List<String> syns = new ArrayList<>();
            if (ingredient.synonyms != null) for (String syn : ingredient.synonyms) syns.add(NameNormalizer.normalize(syn));
            this.normalizedSynonyms = syns;
        }
    }

    private final RecordStore store;
    private final AliasResolver aliases;
    private final double defaultThreshold;
    private final Subscription subscription;
    private volatile List<Prepared> prepared;

    public IngredientMatcher(RecordStore store, AliasResolver aliases, double defaultThreshold) {
        this.store = store;
        this.aliases = aliases.normalized();
        this.defaultThreshold = defaultThreshold;
        this.subscription = store.subscribe(event -> {
            if (Stores.INGREDIENTS.equals(event.collection)) prepared = null;
        });
    }

    // ------------------------------------------------------------------ duplicate detection

    /**
     * The catalog entry {@code name} refers to, if any. Checked in priority order across the
     * whole catalog: exact normalized name, synonym-group equivalence with the entry's
     * normalized name, then overlap with one of the entry's synonyms.
     */
    public Optional<CatalogIngredient> findExisting(String name) {
        List<CatalogIngredient> similar = findSimilar(name);
        return similar.isEmpty() ? Optional.empty() : Optional.of(similar.get(0));
    }

    /** Every entry {@link #findExisting} would accept, best tier first, catalog order within a tier. */
    public List<CatalogIngredient> findSimilar(String name) {
        String n = NameNormalizer.normalize(name);
        List<CatalogIngredient> out = new ArrayList<>();
        if (n.isEmpty()) return out;
        List<Prepared> catalog = catalog();
        Set<Integer> taken = new HashSet<>();
        for (Prepared p : catalog) {
            if (p.normalizedName.equals(n) && taken.add(p.position)) out.add(copy(p.ingredient));
        }
        for (Prepared p : catalog) {
            if (!taken.contains(p.position) && aliases.areSynonyms(n, p.normalizedName) && taken.add(p.position)) {
                out.add(copy(p.ingredient));
            }
        }
        for (Prepared p : catalog) {
            if (taken.contains(p.position)) continue;
            for (String syn : p.normalizedSynonyms) {
                if (aliases.areSynonyms(n, syn)) {
                    taken.add(p.position);
                    out.add(copy(p.ingredient));
                    break;
                }
            }
        }
        return out;
    }

    /** Normalized name plus its known synonym group, for seeding a new catalog entry. */
    public List<String> generateAutomaticSynonyms(String name) {
        String n = NameNormalizer.normalize(name);
        Set<String> out = new LinkedHashSet<>();
        out.add(n);
        out.addAll(aliases.synonymsOf(n));
        return new ArrayList<>(out);
    }

    // ------------------------------------------------------------------ fuzzy search

    public List<Match> fuzzySearch(String term) { return fuzzySearch(term, defaultThreshold); }

    /**
     * Entries whose display name or any synonym is at least {@code threshold} similar to
     * {@code term}, most similar first. Equal similarities keep catalog order.
     */
    public List<Match> fuzzySearch(String term, double threshold) {
        String n = NameNormalizer.normalize(term);
        List<Prepared> catalog = catalog();
        List<Prepared> hits = new ArrayList<>();
        Map<Prepared, Double> scores = new HashMap<>();
        for (Prepared p : catalog) {
            double best = similarityOfNormalized(n, p.normalizedDisplay);
            for (String syn : p.normalizedSynonyms) best = Math.max(best, similarityOfNormalized(n, syn));
            if (best >= threshold) {
                hits.add(p);
                scores.put(p, best);
            }
        }
        hits.sort(Comparator.<Prepared>comparingDouble(scores::get).reversed()
                .thenComparingInt(p -> p.position));
        List<Match> out = new ArrayList<>(hits.size());
        for (Prepared p : hits) out.add(new Match(copy(p.ingredient), scores.get(p)));
        log.debug("Fuzzy search '{}' matched {} of {} entries", term, out.size(), catalog.size());
        return out;
    }

    /**
     * Similarity in [0, 1] of two names after normalization: 1 when equal, the length ratio
     * when one contains the other, otherwise one minus the edit distance over the longer length.
     */
    public static double similarity(String a, String b) {
        return similarityOfNormalized(NameNormalizer.normalize(a), NameNormalizer.normalize(b));
    }

    static double similarityOfNormalized(String s1, String s2) {
        if (s1.equals(s2)) return 1.0;
        String longer = s1.length() >= s2.length() ? s1 : s2;
        String shorter = s1.length() >= s2.length() ? s2 : s1;
        if (longer.isEmpty()) return 1.0;
        if (longer.contains(shorter)) return (double) shorter.length() / longer.length();
        double score = 1.0 - (double) levenshtein(s1, s2) / longer.length();
        return Math.max(0.0, Math.min(1.0, score));
    }

    /** Classic edit distance with unit cost for insertion, deletion and substitution. */
    public static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev; prev = cur; cur = t;
        }
        return prev[b.length()];
    }

    @Override
    public void close() { subscription.close(); }

    private List<Prepared> catalog() {
        List<Prepared> current = prepared;
        if (current == null) {
            List<CatalogIngredient> all = store.getAll(Stores.INGREDIENTS, CatalogIngredient.class);
            List<Prepared> built = new ArrayList<>(all.size());
            for (int i = 0; i < all.size(); i++) built.add(new Prepared(i, all.get(i)));
            current = Collections.unmodifiableList(built);
            prepared = current;
            log.debug("Prepared {} catalog entries for matching", built.size());
        }
        return current;
    }

    private static CatalogIngredient copy(CatalogIngredient ingredient) {
        return JsonStorage.copy(ingredient, CatalogIngredient.class);
    }
}
