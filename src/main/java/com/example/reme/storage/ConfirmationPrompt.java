package com.example.reme.storage;

/**
 * Asks the user to confirm a destructive step. Supplied by the presentation layer; the core
 * only awaits the answer.
 */
@FunctionalInterface
public interface ConfirmationPrompt {
    ConfirmationPrompt ALWAYS = message -> true;

    boolean confirm(String message);
}
