package org.scopeclient.units;

import lombok.Data;

import java.util.Locale;

/**
 * A unit of measurement attached to a value, with SI-prefixed rendering.
 */
@Data
public class Unit {
    private static final String[] SI_PREFIXES = {"f", "p", "n", "μ", "m", "", "k", "M", "G", "T"};
    private static final int MIN_EXPONENT = -15;
    private static final int MAX_EXPONENT = 12;

    private final UnitType type;

    public enum UnitType {
        FS("s", true),
        HZ("Hz", true),
        VOLTS("V", true),
        AMPS("A", true),
        OHMS("Ω", true),
        WATTS("W", true),
        BITRATE("bps", true),
        SAMPLERATE("S/s", true),
        SAMPLEDEPTH("S", true),
        PERCENT("%", false),
        DB("dB", false),
        DBM("dBm", false),
        DEGREES("°", false),
        CELSIUS("°C", false),
        COUNTS("", false);

        private final String suffix;
        private final boolean siScaled;

        UnitType(String suffix, boolean siScaled) {
            this.suffix = suffix;
            this.siScaled = siScaled;
        }

        public String getSuffix() {
            return suffix;
        }

        public boolean isSiScaled() {
            return siScaled;
        }
    }

    public String prettyPrint(double value) {
        return switch (type) {
            case COUNTS -> formatCount(value);
            case PERCENT -> String.format(Locale.ROOT, "%.3f %s", value * 100, type.getSuffix());
            case FS -> formatScaled(value * 1e-15);
            default -> type.isSiScaled()
                    ? formatScaled(value)
                    : String.format(Locale.ROOT, "%.3f %s", value, type.getSuffix());
        };
    }

    /**
     * Parses text as produced by {@link #prettyPrint(double)}. The SI prefix and the suffix are optional.
     * FS values come back in femtoseconds, PERCENT values as a ratio.
     */
    public double parseString(String text) {
        String body = text.trim();
        String suffix = type.getSuffix();
        if (!suffix.isEmpty() && body.endsWith(suffix)) {
            body = body.substring(0, body.length() - suffix.length()).trim();
        }

        double multiplier = 1;
        if (type.isSiScaled() && !body.isEmpty()) {
            int exponent = prefixExponent(body.substring(body.length() - 1));
            if (exponent != 0) {
                multiplier = Math.pow(10, exponent);
                body = body.substring(0, body.length() - 1).trim();
            }
        }

        double parsed;
        try {
            parsed = Double.parseDouble(body) * multiplier;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid " + type + " value: '" + text + "'", e);
        }

        return switch (type) {
            case FS -> parsed * 1e15;
            case PERCENT -> parsed / 100;
            default -> parsed;
        };
    }

    private String formatScaled(double value) {
        int exponent = 0;
        double magnitude = Math.abs(value);
        if (magnitude != 0 && Double.isFinite(magnitude)) {
            exponent = (int) Math.floor(Math.log10(magnitude) / 3) * 3;
            exponent = Math.max(MIN_EXPONENT, Math.min(MAX_EXPONENT, exponent));
        }
        double scaled = value / Math.pow(10, exponent);
        // 999.9996 k rounds to 1000.000 k, which belongs to the next prefix
        if (Math.abs(Math.round(scaled * 1000) / 1000.0) >= 1000 && exponent < MAX_EXPONENT) {
            exponent += 3;
            scaled = value / Math.pow(10, exponent);
        }
        String prefix = SI_PREFIXES[(exponent - MIN_EXPONENT) / 3];
        return String.format(Locale.ROOT, "%.3f %s%s", scaled, prefix, type.getSuffix());
    }

    private static String formatCount(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    // "u" is accepted as an ASCII stand-in for micro
    private static int prefixExponent(String symbol) {
        if ("u".equals(symbol)) {
            return -6;
        }
        for (int i = 0; i < SI_PREFIXES.length; i++) {
            if (!SI_PREFIXES[i].isEmpty() && SI_PREFIXES[i].equals(symbol)) {
                return MIN_EXPONENT + i * 3;
            }
        }
        return 0;
    }
}
