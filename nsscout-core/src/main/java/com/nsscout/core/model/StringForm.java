package com.nsscout.core.model;

import java.util.Objects;

/**
 * A string literal, holding the unescaped value.
 *
 * @param value string contents
 */
public record StringForm(String value) implements Form {

    public StringForm {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
