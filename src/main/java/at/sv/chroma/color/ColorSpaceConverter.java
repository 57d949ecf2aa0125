package at.sv.chroma.color;

public final class ColorSpaceConverter {

    private ColorSpaceConverter() {
    }

    public static Hsv rgbToHsv(Rgb rgb) {
        return rgbToHsv(rgb.red(), rgb.green(), rgb.blue());
    }

    /**
     * Converts the given rgb values to HSV. If more than one channel holds the maximum, the hue sector is
     * selected in the order red, green, blue.
     *
     * @return hue [0, 360), saturation [0, 100], value [0, 100]
     */
    public static Hsv rgbToHsv(int red, int green, int blue) {
        double r = red / 255.0;
        double g = green / 255.0;
        double b = blue / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double diff = max - min;

        double saturation = max == 0 ? 0 : diff / max;
        return new Hsv(hue(r, g, b, max, diff), saturation * 100, max * 100);
    }

    private static double hue(double r, double g, double b, double max, double diff) {
        if (diff == 0) {
            return 0;
        }
        double hue;
        if (max == r) {
            hue = 60 * (((g - b) / diff) % 6);
        } else if (max == g) {
            hue = 60 * ((b - r) / diff + 2);
        } else {
            hue = 60 * ((r - g) / diff + 4);
        }
        return normalizeHue(hue);
    }

    /**
     * Converts the given HSV value back to RGB, rounding each channel to the nearest integer.
     */
    public static Rgb hsvToRgb(Hsv hsv) {
        double s = hsv.saturation() / 100.0;
        double v = hsv.value() / 100.0;
        double c = v * s;
        double h = normalizeHue(hsv.hue()) / 60.0;
        double x = c * (1 - Math.abs(h % 2 - 1));
        double m = v - c;

        double r, g, b;
        switch ((int) h) {
            case 0 -> { r = c; g = x; b = 0; }
            case 1 -> { r = x; g = c; b = 0; }
            case 2 -> { r = 0; g = c; b = x; }
            case 3 -> { r = 0; g = x; b = c; }
            case 4 -> { r = x; g = 0; b = c; }
            default -> { r = c; g = 0; b = x; }
        }
        return Rgb.round((r + m) * 255, (g + m) * 255, (b + m) * 255);
    }

    /**
     * Maps any hue angle in degrees into [0, 360).
     */
    public static double normalizeHue(double hue) {
        double normalized = hue % 360;
        if (normalized < 0) {
            normalized += 360;
        }
        if (normalized >= 360) {
            normalized -= 360;
        }
        return normalized + 0.0; // -0.0 to 0.0
    }
}
