package at.sv.chroma.color;

import java.util.Locale;

/**
 * A color in the HSV color space, derived from an {@link Rgb} value via {@link ColorSpaceConverter}.
 *
 * @param hue        [0, 360), 0 for achromatic colors
 * @param saturation [0, 100]
 * @param value      [0, 100]
 */
public record Hsv(double hue, double saturation, double value) {

    public static final Hsv BLACK = new Hsv(0, 0, 0);

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "hsv(%.1f,%.1f%%,%.1f%%)", hue, saturation, value);
    }
}
