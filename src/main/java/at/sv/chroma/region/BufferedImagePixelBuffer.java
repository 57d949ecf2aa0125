package at.sv.chroma.region;

import at.sv.chroma.color.Rgb;

import java.awt.image.BufferedImage;

/**
 * Adapts a {@link BufferedImage} to a {@link PixelBuffer}, e.g. for images read via {@code ImageIO}.
 */
public final class BufferedImagePixelBuffer implements PixelBuffer {

    private final BufferedImage image;

    public BufferedImagePixelBuffer(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image is required");
        }
        this.image = image;
    }

    @Override
    public int getWidth() {
        return image.getWidth();
    }

    @Override
    public int getHeight() {
        return image.getHeight();
    }

    @Override
    public int getChannel(int x, int y, int channel) {
        int shift = 16 - channel * 8;
        return (image.getRGB(x, y) >> shift) & 0xFF;
    }

    @Override
    public Rgb getRgb(int x, int y) {
        int argb = image.getRGB(x, y);
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }
}
