package com.example.reme.services;

import com.example.reme.storage.JsonStorage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Static synonym groups: many informal names mapped to one canonical key (the first entry of
 * each group). Lookups are case-insensitive; a word may belong to several groups.
 */
public class AliasResolver {
    public static final String DEFAULT_RESOURCE = "/sample-data/synonyms.json";

    private final List<List<String>> groups = new ArrayList<>();
    private final Map<String, Set<String>> synonyms = new HashMap<>();
    private final Map<String, String> aliasToCanonical = new HashMap<>();

    public AliasResolver(List<List<String>> groups) {
        if (groups == null) return;
        for (List<String> group : groups) {
            if (group == null || group.isEmpty()) continue;
            this.groups.add(List.copyOf(group));
            String canon = group.get(0).toLowerCase(Locale.ROOT);
            Set<String> members = new LinkedHashSet<>();
            for (String g : group) members.add(g.toLowerCase(Locale.ROOT));
            for (String member : members) {
                synonyms.computeIfAbsent(member, k -> new LinkedHashSet<>()).addAll(members);
                aliasToCanonical.putIfAbsent(member, canon);
            }
        }
    }

    /** Groups bundled with the application. */
    public static AliasResolver defaults() {
        try (InputStream in = JsonStorage.resource(DEFAULT_RESOURCE)) {
            return new AliasResolver(new JsonStorage().loadSynonymGroups(in));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot load synonym groups from " + DEFAULT_RESOURCE, ex);
        }
    }

    /** Same groups with every member passed through {@link NameNormalizer#normalize}. */
    public AliasResolver normalized() {
        List<List<String>> out = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            List<String> g = new ArrayList<>(group.size());
            for (String member : group) g.add(NameNormalizer.normalize(member));
            out.add(g);
        }
        return new AliasResolver(out);
    }

    /** Every member of the word's groups, the word included; just the word when it is unknown. */
    public Set<String> synonymsOf(String word) {
        if (word == null) return Set.of();
        String w = word.toLowerCase(Locale.ROOT);
        Set<String> found = synonyms.get(w);
        return found == null ? Set.of(w) : Collections.unmodifiableSet(found);
    }

    public boolean areSynonyms(String a, String b) {
        if (a == null || b == null) return false;
        return synonymsOf(a).contains(b.toLowerCase(Locale.ROOT));
    }

    public String canonical(String name) {
        return name == null ? null : aliasToCanonical.getOrDefault(name.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
    }

    public int size() { return aliasToCanonical.size(); }
}
