package at.sv.chroma.color;

/**
 * A reference hue of a {@link Palette}. Multiple entries may share the same label.
 *
 * @param label a chromatic label, never {@link ColorLabel#UNKNOWN}
 * @param hue   the reference hue in degrees [0, 360)
 */
public record PaletteEntry(ColorLabel label, double hue) {

    public PaletteEntry {
        if (label == null || label.isUnknown()) {
            throw new IllegalArgumentException("Palette entries require a chromatic label, got: " + label);
        }
        if (Double.isNaN(hue) || hue < 0 || hue >= 360) {
            throw new IllegalArgumentException("Reference hue must be within [0,360), got: " + hue);
        }
    }

    public static PaletteEntry of(ColorLabel label, double hue) {
        return new PaletteEntry(label, hue);
    }
}
