package com.healthtwin.model.progression;

/**
 * A single cell of a weekly row after parsing.
 */
public sealed interface RowValue permits RowValue.Absolute, RowValue.Relative, RowValue.Label, RowValue.Toggle {

    /** Replaces the current value. */
    record Absolute(double value) implements RowValue {}

    /** Added to the current value ("+2", "-0.5"). */
    record Relative(double delta) implements RowValue {}

    /** Replaces a categorical value ("current", "moderate"). */
    record Label(String text) implements RowValue {}

    /** "true"/"false" cells; carried through but never applied to a parameter. */
    record Toggle(boolean value) implements RowValue {}

    static RowValue absolute(double value) {
        return new Absolute(value);
    }

    static RowValue relative(double delta) {
        return new Relative(delta);
    }

    static RowValue label(String text) {
        return new Label(text);
    }
}
