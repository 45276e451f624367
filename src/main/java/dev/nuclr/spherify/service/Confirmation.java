package dev.nuclr.spherify.service;

/**
 * Asks the user a yes/no question.
 */
@FunctionalInterface
public interface Confirmation {

    Confirmation ALWAYS = question -> true;
    Confirmation NEVER = question -> false;

    boolean confirm(String question);
}
