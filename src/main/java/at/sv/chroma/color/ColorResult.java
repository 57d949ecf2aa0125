package at.sv.chroma.color;

import java.util.Locale;

/**
 * The classification of a single sampled color.
 *
 * @param label      the matched label, {@link ColorLabel#UNKNOWN} if no chromatic label applies
 * @param confidence [0, 1]; 0 for empty regions
 * @param rgb        the sampled color
 * @param hsv        the sampled color converted to HSV
 */
public record ColorResult(ColorLabel label, double confidence, Rgb rgb, Hsv hsv) {

    private static final ColorResult EMPTY = new ColorResult(ColorLabel.UNKNOWN, 0, Rgb.BLACK, Hsv.BLACK);

    /**
     * The result for a region that did not contain a single sampled pixel.
     */
    public static ColorResult empty() {
        return EMPTY;
    }

    public static ColorResult of(Rgb rgb, Hsv hsv, Classification classification) {
        return new ColorResult(classification.label(), classification.confidence(), rgb, hsv);
    }

    public boolean isUnknown() {
        return label.isUnknown();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.2f) %s %s", label.getDisplayName(), confidence, rgb, hsv);
    }
}
