package com.example.reme.services;

import com.example.reme.model.Location;
import com.example.reme.storage.ConstraintViolationException;
import com.example.reme.storage.RecordNotFoundException;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Storage places for inventory. The three defaults are seeded on first use and cannot be deleted. */
public class LocationService {
    private static final Logger log = LoggerFactory.getLogger(LocationService.class);

    public static final List<String> DEFAULT_LOCATIONS = List.of("Refrigerador", "Congelador", "Alacena");
    public static final String DEFAULT_ICON = "📦";
    private static final Map<String, String> DEFAULT_ICONS = Map.of(
            "Refrigerador", "🧊",
            "Congelador", "❄️",
            "Alacena", "🗄️");

    private final RecordStore store;

    public LocationService(RecordStore store) {
        this.store = store;
    }

    /** Adds whichever default locations are missing, after the current highest order. */
    public void initializeDefaults() {
        List<Location> existing = store.getAll(Stores.LOCATIONS, Location.class);
        Set<String> names = new HashSet<>();
        for (Location l : existing) names.add(l.name);
        int order = maxOrder(existing);
        for (String name : DEFAULT_LOCATIONS) {
            if (names.contains(name)) continue;
            Location loc = new Location(Stores.newId("loc"), name, DEFAULT_ICONS.getOrDefault(name, DEFAULT_ICON), ++order, true);
            try {
                store.add(Stores.LOCATIONS, loc);
            } catch (ConstraintViolationException ex) {
                log.warn("Failed to add default location '{}': {}", name, ex.getMessage());
            }
        }
    }

    /** Every location sorted by order; seeds the defaults when there are none. */
    public List<Location> getAll() {
        if (store.count(Stores.LOCATIONS) == 0) initializeDefaults();
        List<Location> all = store.getAll(Stores.LOCATIONS, Location.class);
        all.sort(Comparator.comparingInt(l -> l.order));
        return all;
    }

    public Optional<Location> getById(String id) {
        return store.get(Stores.LOCATIONS, id, Location.class);
    }

    public Optional<Location> getByName(String name) {
        if (name == null) return Optional.empty();
        List<Location> hits = store.getByIndex(Stores.LOCATIONS, "name", name.trim(), Location.class);
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }

    public Location add(String name) { return add(name, DEFAULT_ICON); }

    /** @throws ConstraintViolationException when the name is taken */
    public Location add(String name, String icon) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Location name is required");
        String trimmed = name.trim();
        if (getByName(trimmed).isPresent()) {
            throw new ConstraintViolationException("Ya existe una ubicación con el nombre \"" + trimmed + "\"");
        }
        Location loc = new Location(Stores.newId("loc"), trimmed, icon == null ? DEFAULT_ICON : icon, maxOrder(getAll()) + 1, false);
        store.add(Stores.LOCATIONS, loc);
        log.info("Added location '{}'", trimmed);
        return loc;
    }

    /**
     * Applies the non-null arguments.
     *
     * @throws RecordNotFoundException when there is no such location
     * @throws ConstraintViolationException when the new name is taken
     */
    public Location update(String id, String name, String icon, Integer order) {
        Location existing = getById(id).orElseThrow(() ->
                new RecordNotFoundException(Stores.LOCATIONS, id, "No se encontró la ubicación con ID \"" + id + "\""));
        if (name != null && !name.isBlank() && !name.trim().equals(existing.name)) {
            if (getByName(name.trim()).isPresent()) {
                throw new ConstraintViolationException("Ya existe una ubicación con el nombre \"" + name.trim() + "\"");
            }
            existing.name = name.trim();
        }
        if (icon != null) existing.icon = icon;
        if (order != null) existing.order = order;
        return store.put(Stores.LOCATIONS, existing);
    }

    /**
     * @throws RecordNotFoundException when there is no such location
     * @throws ConstraintViolationException for a default location
     */
    public void delete(String id) {
        Location existing = getById(id).orElseThrow(() ->
                new RecordNotFoundException(Stores.LOCATIONS, id, "No se encontró la ubicación con ID \"" + id + "\""));
        if (existing.isDefault) {
            throw new ConstraintViolationException("No se pueden eliminar ubicaciones predeterminadas");
        }
        store.delete(Stores.LOCATIONS, id);
        log.info("Deleted location '{}'", existing.name);
    }

    /** Sets each listed location's order to its position in {@code orderedIds}; unknown ids are ignored. */
    public void reorder(List<String> orderedIds) {
        Map<String, Location> byId = new HashMap<>();
        for (Location l : getAll()) byId.put(l.id, l);
        for (int i = 0; i < orderedIds.size(); i++) {
            Location loc = byId.get(orderedIds.get(i));
            if (loc != null && loc.order != i) {
                loc.order = i;
                store.put(Stores.LOCATIONS, loc);
            }
        }
    }

    public List<String> getNames() {
        List<String> out = new ArrayList<>();
        for (Location l : getAll()) out.add(l.name);
        return out;
    }

    private static int maxOrder(List<Location> locations) {
        int max = -1;
        for (Location l : locations) max = Math.max(max, l.order);
        return max;
    }
}
