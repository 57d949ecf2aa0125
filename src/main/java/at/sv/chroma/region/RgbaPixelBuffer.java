package at.sv.chroma.region;

/**
 * A {@link PixelBuffer} over a row-major byte array with three (RGB) or four (RGBA) channels per pixel, as
 * delivered by canvas and video frame grabbers. The alpha channel is ignored. The array is not copied.
 */
public final class RgbaPixelBuffer implements PixelBuffer {

    private final byte[] data;
    private final int width;
    private final int height;
    private final int channels;

    public RgbaPixelBuffer(byte[] data, int width, int height, int channels) {
        if (data == null) {
            throw new IllegalArgumentException("Pixel data is required");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid dimensions: " + width + "x" + height);
        }
        if (channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Only 3 (RGB) or 4 (RGBA) channels are supported, got: " + channels);
        }
        if ((long) width * height * channels != data.length) {
            throw new IllegalArgumentException("Expected " + ((long) width * height * channels) + " bytes for " +
                                               width + "x" + height + "x" + channels + ", got: " + data.length);
        }
        this.data = data;
        this.width = width;
        this.height = height;
        this.channels = channels;
    }

    public static RgbaPixelBuffer rgba(byte[] data, int width, int height) {
        return new RgbaPixelBuffer(data, width, height, 4);
    }

    public static RgbaPixelBuffer rgb(byte[] data, int width, int height) {
        return new RgbaPixelBuffer(data, width, height, 3);
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getChannel(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xFF;
    }
}
