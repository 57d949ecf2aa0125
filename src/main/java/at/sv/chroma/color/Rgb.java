package at.sv.chroma.color;

/**
 * An sRGB color with 8 bit channels.
 *
 * @param red   [0, 255]
 * @param green [0, 255]
 * @param blue  [0, 255]
 */
public record Rgb(int red, int green, int blue) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);

    public Rgb {
        assertChannel("red", red);
        assertChannel("green", green);
        assertChannel("blue", blue);
    }

    /**
     * Rounds the given channel values to the nearest integer and clamps them into [0, 255].
     */
    public static Rgb round(double red, double green, double blue) {
        return new Rgb(roundChannel(red), roundChannel(green), roundChannel(blue));
    }

    private static int roundChannel(double value) {
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }

    private static void assertChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be within [0,255], got: " + value);
        }
    }

    @Override
    public String toString() {
        return "rgb(" + red + "," + green + "," + blue + ")";
    }
}
