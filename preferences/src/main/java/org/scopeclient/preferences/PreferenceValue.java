package org.scopeclient.preferences;

/**
 * Active payload of a {@link Preference}. The kind tag is derived from the case, never stored.
 */
sealed interface PreferenceValue {

    PreferenceType type();

    String render();

    record Bool(boolean value) implements PreferenceValue {
        public PreferenceType type() {
            return PreferenceType.BOOLEAN;
        }

        public String render() {
            return Boolean.toString(value);
        }
    }

    record Text(String value) implements PreferenceValue {
        public PreferenceType type() {
            return PreferenceType.STRING;
        }

        public String render() {
            return value;
        }
    }

    record Real(double value) implements PreferenceValue {
        public PreferenceType type() {
            return PreferenceType.REAL;
        }

        public String render() {
            return Double.toString(value);
        }
    }

    record Rgb(ColorValue value) implements PreferenceValue {
        public PreferenceType type() {
            return PreferenceType.COLOR;
        }

        public String render() {
            return value.toHex();
        }
    }

    record None() implements PreferenceValue {
        static final None INSTANCE = new None();

        public PreferenceType type() {
            return PreferenceType.NONE;
        }

        public String render() {
            return "<moved>";
        }
    }
}
