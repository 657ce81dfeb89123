package com.nsscout.core.model;

/**
 * A character literal such as {@code \a} or {@code \newline}.
 *
 * @param value the character
 */
public record CharacterForm(char value) implements Form {

    @Override
    public String toString() {
        return switch (value) {
            case '\n' -> "\\newline";
            case ' ' -> "\\space";
            case '\t' -> "\\tab";
            case '\b' -> "\\backspace";
            case '\f' -> "\\formfeed";
            case '\r' -> "\\return";
            default -> "\\" + value;
        };
    }
}
