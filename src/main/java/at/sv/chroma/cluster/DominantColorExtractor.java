package at.sv.chroma.cluster;

import at.sv.chroma.color.Classification;
import at.sv.chroma.color.ColorResult;
import at.sv.chroma.color.ColorSpaceConverter;
import at.sv.chroma.color.Hsv;
import at.sv.chroma.color.PaletteClassifier;
import at.sv.chroma.color.Rgb;
import at.sv.chroma.region.PixelBuffer;
import at.sv.chroma.region.Region;
import at.sv.chroma.region.RegionSampler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Extracts the dominant colors of a region that is not uniformly colored, by clustering its sampled pixels
 * with k-means and classifying each centroid.
 */
@Slf4j
public final class DominantColorExtractor {

    private static final Random SHARED_RANDOM = new Random();

    private final PaletteClassifier classifier;
    private final RegionSampler sampler;
    private final ExtractorSettings settings;
    private final Random random;

    public DominantColorExtractor(PaletteClassifier classifier) {
        this(classifier, ExtractorSettings.DEFAULTS);
    }

    public DominantColorExtractor(PaletteClassifier classifier, ExtractorSettings settings) {
        this(classifier, settings, SHARED_RANDOM);
    }

    /**
     * @param random the source used to seed the centroids; pass a seeded instance for reproducible results
     */
    public DominantColorExtractor(PaletteClassifier classifier, ExtractorSettings settings, Random random) {
        if (settings == null || random == null) {
            throw new IllegalArgumentException("settings and random are required");
        }
        settings.validate();
        this.sampler = new RegionSampler(classifier);
        this.classifier = classifier;
        this.settings = settings;
        this.random = random;
    }

    public List<ColorResult> extract(PixelBuffer buffer, int x, int y, int width, int height) {
        return extract(buffer, Region.of(x, y, width, height), settings.getClusterCount());
    }

    public List<ColorResult> extract(PixelBuffer buffer, int x, int y, int width, int height, int k) {
        return extract(buffer, Region.of(x, y, width, height), k);
    }

    public List<ColorResult> extract(PixelBuffer buffer, Region region) {
        return extract(buffer, region, settings.getClusterCount());
    }

    /**
     * Returns up to {@code k} dominant colors of the region.
     * <p>
     * If fewer than {@code k} pixels are sampled, the mean color of the region is classified instead and
     * returned as the only element, even if it is unknown. Otherwise, centroids classified as unknown are
     * dropped, so the result may be empty.
     *
     * @param k the number of clusters, at least 1
     */
    public List<ColorResult> extract(PixelBuffer buffer, Region region, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, got: " + k);
        }
        List<Rgb> pixels = sampler.samplePixels(buffer, region, settings.getStride());
        if (pixels.size() < k) {
            log.debug("Only {} pixels sampled for k={}: Fall back to region mean", pixels.size(), k);
            return List.of(sampler.analyzeRegion(buffer, region));
        }
        List<Rgb> centroids = new KMeansClustering(random, settings.getIterations()).cluster(pixels, k);
        List<ColorResult> results = new ArrayList<>(centroids.size());
        for (Rgb centroid : centroids) {
            ColorResult result = classify(centroid);
            if (!result.isUnknown()) {
                results.add(result);
            }
        }
        return results;
    }

    private ColorResult classify(Rgb centroid) {
        Hsv hsv = ColorSpaceConverter.rgbToHsv(centroid);
        Classification classification = classifier.classify(hsv);
        log.debug("Dominant HSV: H={} => {}", Math.round(hsv.hue()), classification.label());
        return ColorResult.of(centroid, hsv, classification);
    }
}
