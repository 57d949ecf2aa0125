package at.sv.chroma.color;

/**
 * @param label      the matched label
 * @param confidence [0, 1]
 */
public record Classification(ColorLabel label, double confidence) {
}
