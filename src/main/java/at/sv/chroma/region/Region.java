package at.sv.chroma.region;

/**
 * A rectangular sub-region of a {@link PixelBuffer}. The region may lie partially or completely outside the
 * buffer and may have negative dimensions; {@link #clip(PixelBuffer)} reduces it to the valid intersection.
 */
public record Region(int x, int y, int width, int height) {

    public static Region of(int x, int y, int width, int height) {
        return new Region(x, y, width, height);
    }

    public static Region whole(PixelBuffer buffer) {
        return new Region(0, 0, buffer.getWidth(), buffer.getHeight());
    }

    /**
     * @return the intersection with the bounds of the given buffer, with a width and height of zero if they
     * do not overlap
     */
    public Region clip(PixelBuffer buffer) {
        int startX = (int) clamp(x, buffer.getWidth());
        int startY = (int) clamp(y, buffer.getHeight());
        int endX = (int) clamp((long) x + Math.max(0, width), buffer.getWidth());
        int endY = (int) clamp((long) y + Math.max(0, height), buffer.getHeight());
        return new Region(startX, startY, Math.max(0, endX - startX), Math.max(0, endY - startY));
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    private static long clamp(long value, int max) {
        return Math.max(0, Math.min(max, value));
    }

    @Override
    public String toString() {
        return x + "," + y + " " + width + "x" + height;
    }
}
