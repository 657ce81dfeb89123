package com.nsscout.core.model;

/**
 * A single syntax form produced by the {@link com.nsscout.core.reader.FormReader}.
 *
 * <p>Forms are plain immutable data. Nothing in this package evaluates them: a
 * {@code (ns ...)} form is just a {@link ListForm} whose first element is the
 * symbol {@code ns}.
 *
 * <p>Every implementation renders itself in reader syntax from {@code toString()},
 * so a form printed and read again yields an equal form.
 */
public interface Form {
}
