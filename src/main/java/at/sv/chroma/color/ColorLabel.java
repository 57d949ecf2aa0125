package at.sv.chroma.color;

import java.util.Locale;

public enum ColorLabel {
    SKY_BLUE("sky blue"),
    YELLOW("yellow"),
    ORANGE("orange"),
    RED("red"),
    PURPLE("purple"),
    UNKNOWN("unknown");

    private final String displayName;

    ColorLabel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    /**
     * Resolves a label by its enum name or display name, ignoring case. Dashes and spaces are treated like
     * underscores, so "sky-blue", "sky blue" and "SKY_BLUE" are equivalent.
     *
     * @return the matching label, or null if nothing matches
     */
    public static ColorLabel parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = normalize(value.trim());
        for (ColorLabel label : values()) {
            if (label.name().equals(normalized) || normalize(label.displayName).equals(normalized)) {
                return label;
            }
        }
        return null;
    }

    private static String normalize(String value) {
        return value.toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
