package at.sv.chroma.color;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class ClassifierSettings {

    public static final ClassifierSettings DEFAULTS = ClassifierSettings.builder().build();

    /**
     * Colors with a saturation (percent) below this value are treated as achromatic.
     */
    @Builder.Default
    private final double saturationThreshold = 8;
    /**
     * Colors with a value (percent) below this value are treated as achromatic.
     */
    @Builder.Default
    private final double valueThreshold = 15;
    /**
     * The confidence reported for achromatic colors. Not zero, as these are real but indeterminate colors.
     */
    @Builder.Default
    private final double achromaticConfidence = 0.5;
    /**
     * The hue distance in degrees at which the confidence reaches zero.
     */
    @Builder.Default
    private final double confidenceRadius = 60;
    @Builder.Default
    private final double confidenceFloor = 0.0;
    /**
     * If matches with a confidence below {@link #confidenceFloor} should be reported as unknown, instead of
     * always returning the nearest label.
     */
    @Builder.Default
    private final boolean rejectBelowFloor = false;

    void validate() {
        if (saturationThreshold < 0 || saturationThreshold > 100) {
            throw new IllegalArgumentException("saturationThreshold must be within [0,100], got: " + saturationThreshold);
        }
        if (valueThreshold < 0 || valueThreshold > 100) {
            throw new IllegalArgumentException("valueThreshold must be within [0,100], got: " + valueThreshold);
        }
        if (achromaticConfidence < 0 || achromaticConfidence > 1) {
            throw new IllegalArgumentException("achromaticConfidence must be within [0,1], got: " + achromaticConfidence);
        }
        if (!(confidenceRadius > 0)) {
            throw new IllegalArgumentException("confidenceRadius must be > 0, got: " + confidenceRadius);
        }
        if (confidenceFloor < 0 || confidenceFloor > 1) {
            throw new IllegalArgumentException("confidenceFloor must be within [0,1], got: " + confidenceFloor);
        }
    }
}
