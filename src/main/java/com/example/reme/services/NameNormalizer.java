package com.example.reme.services;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Canonical form of ingredient names: lowercase, accent-free, singular, single-spaced.
 * All methods are pure.
 */
public final class NameNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    // Shortest stem the plural rules may leave behind
    private static final int MIN_STEM = 2;

    private static final Set<String> STOP_WORDS = Set.of(
        "el", "la", "los", "las", "un", "una", "unos", "unas",
        "de", "del", "al", "a", "en", "con", "sin", "por", "para",
        "y", "o", "pero", "que", "es", "son", "está", "están",
        "su", "sus", "mi", "mis", "tu", "tus");

    private NameNormalizer() {}

    /**
     * "Tomates  Cherry" -> "tomat cherry", "Papás" -> "papa". Singularization is repeated until
     * the token stops changing, which makes the result a fixed point of this method.
     */
    public static String normalize(String text) {
        if (text == null) return "";
        String s = stripAccents(text.toLowerCase(Locale.ROOT)).trim();
        if (s.isEmpty()) return "";
        StringJoiner out = new StringJoiner(" ");
        for (String word : WHITESPACE.split(s)) out.add(singularize(word));
        return out.toString();
    }

    public static String stripAccents(String text) {
        return COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
    }

    /** Strips a plural "es", else a plural "s" (never from "ss"), until neither applies. */
    static String singularize(String word) {
        String current = word;
        while (true) {
            String next = current;
            if (current.endsWith("es") && current.length() - 2 >= MIN_STEM) {
                next = current.substring(0, current.length() - 2);
            } else if (current.endsWith("s") && !current.endsWith("ss") && current.length() - 1 >= MIN_STEM) {
                next = current.substring(0, current.length() - 1);
            }
            if (next.equals(current)) return current;
            current = next;
        }
    }

    /** Collapses whitespace, drops punctuation (accented letters survive) and lowercases. */
    public static String cleanInput(String text) {
        if (text == null) return "";
        String s = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        return NOT_WORD.matcher(s).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /** Words longer than two letters that are not Spanish stop words, in input order. */
    public static List<String> extractKeywords(String text) {
        String cleaned = cleanInput(text);
        List<String> out = new ArrayList<>();
        if (cleaned.isBlank()) return out;
        for (String word : WHITESPACE.split(cleaned.trim())) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) out.add(word);
        }
        return out;
    }
}
