package at.sv.chroma.cluster;

import at.sv.chroma.color.ColorLabel;
import at.sv.chroma.color.ColorResult;
import at.sv.chroma.color.Palette;
import at.sv.chroma.color.PaletteClassifier;
import at.sv.chroma.color.Rgb;
import at.sv.chroma.region.PixelBuffer;
import at.sv.chroma.region.PixelBufferFixtures;
import at.sv.chroma.region.Region;
import at.sv.chroma.region.RegionSampler;
import at.sv.chroma.region.RgbaPixelBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DominantColorExtractorTest {

    private static final Rgb RED = new Rgb(255, 0, 0);
    private static final Rgb SKY_BLUE = new Rgb(135, 206, 235);
    private static final Rgb WHITE = new Rgb(255, 255, 255);
    private static final Rgb GRAY = new Rgb(200, 200, 200);

    private PaletteClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PaletteClassifier();
    }

    @Test
    void extract_populationSmallerThanK_regionMean() {
        PixelBuffer buffer = PixelBufferFixtures.split(2, 2, RED, SKY_BLUE);

        List<ColorResult> results = create(new Random(1)).extract(buffer, 0, 0, 2, 2, 3);

        assertThat(results).containsExactly(new RegionSampler(classifier).analyzeRegion(buffer, 0, 0, 2, 2));
    }

    @Test
    void extract_populationSmallerThanK_unknownMeanIsKept() {
        PixelBuffer buffer = PixelBufferFixtures.filled(2, 2, WHITE);

        List<ColorResult> results = create(new Random(1)).extract(buffer, 0, 0, 2, 2, 3);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).label()).isEqualTo(ColorLabel.UNKNOWN);
    }

    @Test
    void extract_emptyRegion_singleEmptyResult() {
        PixelBuffer buffer = PixelBufferFixtures.filled(30, 30, RED);

        assertThat(create(new Random(1)).extract(buffer, 0, 0, 0, 0, 3)).containsExactly(ColorResult.empty());
    }

    @Test
    void extract_twoColoredRegion_bothColors() {
        PixelBuffer buffer = PixelBufferFixtures.split(30, 30, RED, SKY_BLUE);

        // sampled columns 0..12 are red, 15..27 sky blue; seed with the first red and the first sky blue pixel
        List<ColorResult> results = create(new ScriptedRandom(0, 5)).extract(buffer, 0, 0, 30, 30, 2);

        assertThat(results).extracting(ColorResult::label).containsExactly(ColorLabel.RED, ColorLabel.SKY_BLUE);
        assertThat(results).extracting(ColorResult::rgb).containsExactly(RED, SKY_BLUE);
        assertThat(results.get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    void extract_achromaticCluster_filtered() {
        PixelBuffer buffer = PixelBufferFixtures.split(30, 30, WHITE, RED);

        List<ColorResult> results = create(new ScriptedRandom(0, 5)).extract(buffer, 0, 0, 30, 30, 2);

        assertThat(results).extracting(ColorResult::rgb).containsExactly(RED);
    }

    @Test
    void extract_onlyAchromaticPixels_emptyResult() {
        PixelBuffer buffer = PixelBufferFixtures.filled(30, 30, GRAY);

        assertThat(create(new Random(7)).extract(buffer, 0, 0, 30, 30, 3)).isEmpty();
    }

    @Test
    void extract_greenRegion_rejectBelowFloor_emptyResult() {
        PixelBuffer buffer = PixelBufferFixtures.filled(30, 30, new Rgb(0, 200, 0));
        classifier = new PaletteClassifier(Palette.standard(), classifier.getSettings().toBuilder()
                                                                         .confidenceFloor(0.2)
                                                                         .rejectBelowFloor(true)
                                                                         .build());

        assertThat(create(new Random(7)).extract(buffer, 0, 0, 30, 30, 2)).isEmpty();
    }

    @Test
    void extract_emptyClusterKeepsCentroid() {
        PixelBuffer buffer = PixelBufferFixtures.split(30, 30, RED, SKY_BLUE);
        ExtractorSettings settings = ExtractorSettings.builder().iterations(1).build();
        DominantColorExtractor extractor = new DominantColorExtractor(classifier, settings, new ScriptedRandom(0, 0));

        List<ColorResult> results = extractor.extract(buffer, 0, 0, 30, 30, 2);

        // first centroid becomes the mean of all pixels, the second keeps the red seed
        assertThat(results).extracting(ColorResult::rgb).containsExactly(new Rgb(195, 103, 118), RED);
    }

    @Test
    void extract_defaultClusterCount() {
        PixelBuffer buffer = PixelBufferFixtures.filled(30, 30, RED);

        List<ColorResult> results = create(new Random(3)).extract(buffer, Region.whole(buffer));

        assertThat(results).hasSize(3).allSatisfy(result -> assertThat(result.rgb()).isEqualTo(RED));
    }

    @Test
    void extract_sameSeed_sameResult() {
        PixelBuffer buffer = noise(40, 40, 99);

        List<ColorResult> first = create(new Random(42)).extract(buffer, 0, 0, 40, 40, 4);
        List<ColorResult> second = create(new Random(42)).extract(buffer, 0, 0, 40, 40, 4);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void extract_defaultRandom_returnsAtMostKResults() {
        PixelBuffer buffer = noise(40, 40, 5);

        assertThat(new DominantColorExtractor(classifier).extract(buffer, 0, 0, 40, 40, 3)).hasSizeLessThanOrEqualTo(3);
    }

    @Test
    void extract_invalidK_exception() {
        PixelBuffer buffer = PixelBufferFixtures.filled(30, 30, RED);

        assertThatThrownBy(() -> create(new Random(1)).extract(buffer, 0, 0, 30, 30, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void extract_nullBuffer_exception() {
        assertThatThrownBy(() -> create(new Random(1)).extract(null, 0, 0, 30, 30, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidSettings_exception() {
        assertThatThrownBy(() -> new DominantColorExtractor(classifier, ExtractorSettings.builder().stride(0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stride");
        assertThatThrownBy(() -> new DominantColorExtractor(classifier, ExtractorSettings.builder().clusterCount(0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clusterCount");
        assertThatThrownBy(() -> new DominantColorExtractor(classifier, ExtractorSettings.builder().iterations(-1).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("iterations");
    }

    private DominantColorExtractor create(Random random) {
        return new DominantColorExtractor(classifier, ExtractorSettings.DEFAULTS, random);
    }

    private static PixelBuffer noise(int width, int height, long seed) {
        Random random = new Random(seed);
        byte[] data = new byte[width * height * 4];
        random.nextBytes(data);
        return RgbaPixelBuffer.rgba(data, width, height);
    }
}
