package at.sv.chroma.region;

import at.sv.chroma.color.Rgb;

/**
 * Read-only access to the pixels of an image or video frame. Implementations are not expected to be
 * thread-safe; callers sampling a frame that is concurrently overwritten have to pass a snapshot.
 */
public interface PixelBuffer {

    int RED = 0;
    int GREEN = 1;
    int BLUE = 2;

    int getWidth();

    int getHeight();

    /**
     * @param x       [0, width)
     * @param y       [0, height)
     * @param channel {@link #RED}, {@link #GREEN} or {@link #BLUE}
     * @return the channel value [0, 255]
     */
    int getChannel(int x, int y, int channel);

    default Rgb getRgb(int x, int y) {
        return new Rgb(getChannel(x, y, RED), getChannel(x, y, GREEN), getChannel(x, y, BLUE));
    }
}
