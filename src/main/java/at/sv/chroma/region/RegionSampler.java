package at.sv.chroma.region;

import at.sv.chroma.color.Classification;
import at.sv.chroma.color.ColorResult;
import at.sv.chroma.color.ColorSpaceConverter;
import at.sv.chroma.color.Hsv;
import at.sv.chroma.color.PaletteClassifier;
import at.sv.chroma.color.Rgb;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Samples the pixels of a rectangular region of a {@link PixelBuffer}. Regions are clipped to the buffer
 * bounds and sampled on a grid anchored at the top left corner of the clipped region.
 */
@Slf4j
public final class RegionSampler {

    /**
     * Every second row and column is sampled when averaging a region.
     */
    public static final int MEAN_STRIDE = 2;

    private final PaletteClassifier classifier;

    public RegionSampler(PaletteClassifier classifier) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier is required");
        }
        this.classifier = classifier;
    }

    /**
     * Returns the rounded mean color of the region, or black if the clipped region is empty.
     */
    public Rgb sampleMean(PixelBuffer buffer, int x, int y, int width, int height) {
        MeanAccumulator mean = accumulate(buffer, Region.of(x, y, width, height));
        return mean.isEmpty() ? Rgb.BLACK : mean.toRgb();
    }

    /**
     * Averages and classifies the region. An empty region results in {@link ColorResult#empty()}.
     */
    public ColorResult analyzeRegion(PixelBuffer buffer, int x, int y, int width, int height) {
        return analyzeRegion(buffer, Region.of(x, y, width, height));
    }

    public ColorResult analyzeRegion(PixelBuffer buffer, Region region) {
        MeanAccumulator mean = accumulate(buffer, region);
        if (mean.isEmpty()) {
            log.debug("Region {} contains no pixels", region);
            return ColorResult.empty();
        }
        Rgb rgb = mean.toRgb();
        Hsv hsv = ColorSpaceConverter.rgbToHsv(rgb);
        log.debug("Region HSV: H={}, S={}, V={}", Math.round(hsv.hue()), Math.round(hsv.saturation()),
                Math.round(hsv.value()));
        Classification classification = classifier.classify(hsv);
        return ColorResult.of(rgb, hsv, classification);
    }

    /**
     * Collects every {@code stride}-th pixel of every {@code stride}-th row of the clipped region.
     *
     * @return the sampled pixels in row-major order
     */
    public List<Rgb> samplePixels(PixelBuffer buffer, int x, int y, int width, int height, int stride) {
        return samplePixels(buffer, Region.of(x, y, width, height), stride);
    }

    public List<Rgb> samplePixels(PixelBuffer buffer, Region region, int stride) {
        assertBuffer(buffer);
        assertStride(stride);
        Region clipped = region.clip(buffer);
        if (clipped.isEmpty()) {
            return List.of();
        }
        List<Rgb> pixels = new ArrayList<>(sampleCount(clipped, stride));
        int endX = clipped.x() + clipped.width();
        int endY = clipped.y() + clipped.height();
        for (long py = clipped.y(); py < endY; py += stride) {
            for (long px = clipped.x(); px < endX; px += stride) {
                pixels.add(buffer.getRgb((int) px, (int) py));
            }
        }
        return Collections.unmodifiableList(pixels);
    }

    private MeanAccumulator accumulate(PixelBuffer buffer, Region region) {
        assertBuffer(buffer);
        Region clipped = region.clip(buffer);
        MeanAccumulator mean = new MeanAccumulator();
        int endX = clipped.x() + clipped.width();
        int endY = clipped.y() + clipped.height();
        for (int py = clipped.y(); py < endY; py += MEAN_STRIDE) {
            for (int px = clipped.x(); px < endX; px += MEAN_STRIDE) {
                mean.add(buffer.getRgb(px, py));
            }
        }
        return mean;
    }

    private static int sampleCount(Region clipped, int stride) {
        long columns = (clipped.width() + stride - 1L) / stride;
        long rows = (clipped.height() + stride - 1L) / stride;
        return (int) Math.min(Integer.MAX_VALUE - 8, columns * rows);
    }

    private static void assertBuffer(PixelBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("Pixel buffer is required");
        }
    }

    private static void assertStride(int stride) {
        if (stride < 1) {
            throw new IllegalArgumentException("stride must be >= 1, got: " + stride);
        }
    }

    private static final class MeanAccumulator {
        private long red;
        private long green;
        private long blue;
        private long count;

        void add(Rgb rgb) {
            red += rgb.red();
            green += rgb.green();
            blue += rgb.blue();
            count++;
        }

        boolean isEmpty() {
            return count == 0;
        }

        Rgb toRgb() {
            return Rgb.round((double) red / count, (double) green / count, (double) blue / count);
        }
    }
}
