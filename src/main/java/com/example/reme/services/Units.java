package com.example.reme.services;

import com.example.reme.storage.JsonStorage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Unit conversion over a table of anchors: each unit maps an anchor ({@code to_g},
 * {@code to_ml}, {@code to_pieza}) to its factor. Two units convert when they share an anchor.
 */
public class Units {
    public static final String DEFAULT_RESOURCE = "/sample-data/units.json";

    private final Map<String, Map<String, Double>> units;

    public Units(Map<String, Map<String, Double>> unitMap) {
        this.units = (unitMap == null) ? new HashMap<>() : new HashMap<>(unitMap);
        // weight
        if (units.containsKey("g") && !units.containsKey("kg")) units.put("kg", Map.of("to_g", 1000.0));
        // volume, kitchen measures relative to ml
        if (units.containsKey("ml")) {
            if (!units.containsKey("l")) units.put("l", Map.of("to_ml", 1000.0));
            if (!units.containsKey("cucharadita")) units.put("cucharadita", Map.of("to_ml", 5.0));
            if (!units.containsKey("cucharada")) units.put("cucharada", Map.of("to_ml", 15.0));
            if (!units.containsKey("taza")) units.put("taza", Map.of("to_ml", 240.0));
        }
        // count-style units aggregate as pieces
        if (units.containsKey("pieza")) {
            for (String countUnit : new String[] {"unidad", "diente", "lata", "rebanada", "hoja"}) {
                units.putIfAbsent(countUnit, Map.of("to_pieza", 1.0));
            }
        }
    }

    /** Table bundled with the application. */
    public static Units defaults() {
        try (InputStream in = JsonStorage.resource(DEFAULT_RESOURCE)) {
            return new Units(new JsonStorage().loadUnits(in));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot load unit table from " + DEFAULT_RESOURCE, ex);
        }
    }

    /** Converts between units sharing an anchor; otherwise returns {@code amount} unchanged. */
    public double convert(double amount, String from, String to) {
        String nf = normalizeUnit(from);
        String nt = normalizeUnit(to);
        if (nf == null || nt == null || nf.equals(nt)) return amount;
        var f = units.get(nf);
        var t = units.get(nt);
        if (f == null || t == null) return amount;
        for (var k : f.keySet()) if (t.containsKey(k)) return amount * f.get(k) / t.get(k);
        return amount;
    }

    /** True when both units are the same or share a conversion anchor. */
    public boolean areCompatible(String a, String b) {
        String na = normalizeUnit(a);
        String nb = normalizeUnit(b);
        if (na == null || nb == null) return false;
        if (na.equals(nb)) return true;
        var fa = units.get(na);
        var fb = units.get(nb);
        if (fa == null || fb == null) return false;
        for (String anchor : fa.keySet()) if (fb.containsKey(anchor)) return true;
        return false;
    }

    public boolean isKnownUnit(String unit) {
        String u = normalizeUnit(unit);
        return u != null && units.containsKey(u);
    }

    /**
     * Maps spellings and plurals to the short forms of the table: "gramos" to "g",
     * "kilos" to "kg", "litros" to "l", "tazas" to "taza", "piezas" to "pieza".
     */
    public String normalizeUnit(String unit) {
        if (unit == null) return null;
        String u = NameNormalizer.stripAccents(unit.trim().toLowerCase(Locale.ROOT));
        switch (u) {
            case "gramo": case "gramos": case "gr": case "grs": case "gram": case "grams": return "g";
            case "kilo": case "kilos": case "kilogramo": case "kilogramos": case "kgs": return "kg";
            case "mililitro": case "mililitros": case "millilitre": case "milliliter": return "ml";
            case "litro": case "litros": case "lt": case "lts": case "liter": case "litre": return "l";
            case "cucharaditas": case "cdita": case "cditas": case "tsp": return "cucharadita";
            case "cucharadas": case "cda": case "cdas": case "tbsp": return "cucharada";
            case "tazas": case "cup": case "cups": return "taza";
            case "piezas": case "pz": case "pza": case "pzas": case "piece": case "pieces": return "pieza";
            case "unidades": case "u": return "unidad";
            case "dientes": return "diente";
            case "latas": return "lata";
            case "rebanadas": return "rebanada";
            case "hojas": return "hoja";
            default: return u;
        }
    }
}
