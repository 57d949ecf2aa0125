package at.sv.chroma.color;

/**
 * Maps HSV colors to the label of the nearest reference hue of a {@link Palette}. The hue distance is
 * circular, i.e. 350° and 10° are 20° apart.
 */
public final class PaletteClassifier {

    private final Palette palette;
    private final ClassifierSettings settings;

    public PaletteClassifier() {
        this(Palette.standard(), ClassifierSettings.DEFAULTS);
    }

    public PaletteClassifier(Palette palette, ClassifierSettings settings) {
        if (palette == null || settings == null) {
            throw new IllegalArgumentException("palette and settings are required");
        }
        settings.validate();
        this.palette = palette;
        this.settings = settings;
    }

    public ClassifierSettings getSettings() {
        return settings;
    }

    public Classification classify(Hsv hsv) {
        return classify(hsv.hue(), hsv.saturation(), hsv.value());
    }

    /**
     * Classifies the given color against the palette.
     * <p>
     * Achromatic colors (saturation or value below their thresholds) are reported as {@link ColorLabel#UNKNOWN}
     * with the configured achromatic confidence. Otherwise, the confidence falls off linearly with the distance
     * to the nearest reference hue and reaches zero at the confidence radius. If rejection is enabled, matches
     * below the confidence floor are reported as unknown, keeping their confidence.
     *
     * @param hue        in degrees, any value; normalized into [0, 360)
     * @param saturation [0, 100]
     * @param value      [0, 100]
     */
    public Classification classify(double hue, double saturation, double value) {
        if (isAchromatic(saturation, value)) {
            return new Classification(ColorLabel.UNKNOWN, settings.getAchromaticConfidence());
        }
        Match match = findNearest(hue);
        double confidence = Math.max(0, 1 - match.distance / settings.getConfidenceRadius());
        if (isRejected(confidence)) {
            return new Classification(ColorLabel.UNKNOWN, confidence);
        }
        return new Classification(match.label, confidence);
    }

    /**
     * Returns the label of the nearest reference hue, ignoring the achromatic thresholds and the confidence
     * floor. Only returns {@link ColorLabel#UNKNOWN} if the palette is empty.
     */
    public ColorLabel forceClassify(double hue) {
        return findNearest(hue).label;
    }

    private boolean isAchromatic(double saturation, double value) {
        return saturation < settings.getSaturationThreshold() || value < settings.getValueThreshold();
    }

    private boolean isRejected(double confidence) {
        return settings.isRejectBelowFloor() && confidence < settings.getConfidenceFloor();
    }

    private Match findNearest(double hue) {
        double h = ColorSpaceConverter.normalizeHue(hue);
        double minDistance = Double.POSITIVE_INFINITY;
        ColorLabel closest = ColorLabel.UNKNOWN;
        for (PaletteEntry entry : palette.getEntries()) {
            double distance = circularDistance(h, entry.hue());
            if (entry.label() == ColorLabel.RED) {
                // 0° and 360° both denote red
                distance = Math.min(distance, Math.abs(h - (entry.hue() + 360)));
            }
            if (distance < minDistance) {
                minDistance = distance;
                closest = entry.label();
            }
        }
        return new Match(closest, minDistance);
    }

    static double circularDistance(double hue1, double hue2) {
        double distance = Math.abs(hue1 - hue2);
        return Math.min(distance, 360 - distance);
    }

    private record Match(ColorLabel label, double distance) {
    }
}
