package at.sv.chroma;

import at.sv.chroma.cluster.DominantColorExtractor;
import at.sv.chroma.cluster.ExtractorSettings;
import at.sv.chroma.color.ClassifierSettings;
import at.sv.chroma.color.ColorLabel;
import at.sv.chroma.color.ColorResult;
import at.sv.chroma.color.ColorSpaceConverter;
import at.sv.chroma.color.Hsv;
import at.sv.chroma.color.InvalidPaletteException;
import at.sv.chroma.color.Palette;
import at.sv.chroma.color.PaletteClassifier;
import at.sv.chroma.color.PaletteEntry;
import at.sv.chroma.color.PaletteLoader;
import at.sv.chroma.color.Rgb;
import at.sv.chroma.region.BufferedImagePixelBuffer;
import at.sv.chroma.region.PixelBuffer;
import at.sv.chroma.region.Region;
import at.sv.chroma.region.RegionSampler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Callable;

@Command(name = "ChromaClassifier", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Classifies the color of a region of an image into a small set of color labels.")
public final class ChromaClassifier implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ChromaClassifier.class);

    enum Mode {
        MEAN,
        DOMINANT
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "IMAGE",
            description = "The image file to analyse (any format supported by ImageIO, e.g. PNG or JPEG).")
    Path image;
    @Option(names = "--x", defaultValue = "0",
            description = "The left edge of the region in pixels. Default: ${DEFAULT-VALUE}")
    int x;
    @Option(names = "--y", defaultValue = "0",
            description = "The top edge of the region in pixels. Default: ${DEFAULT-VALUE}")
    int y;
    @Option(names = "--width",
            description = "The width of the region in pixels. Regions exceeding the image are clipped. " +
                          "Default: the image width")
    Integer width;
    @Option(names = "--height",
            description = "The height of the region in pixels. Default: the image height")
    Integer height;
    @Option(names = "--mode", defaultValue = "${env:MODE:-MEAN}",
            description = "MEAN classifies the average color of the region, DOMINANT extracts up to " +
                          "--clusters dominant colors via k-means. Default: ${DEFAULT-VALUE}")
    Mode mode;
    @Option(names = "--clusters", paramLabel = "<k>", defaultValue = "${env:CLUSTERS:-3}",
            description = "The number of dominant colors to extract. Default: ${DEFAULT-VALUE}")
    int clusters;
    @Option(names = "--stride", paramLabel = "<pixels>", defaultValue = "${env:STRIDE:-3}",
            description = "The sampling stride used to collect the clustered pixels. Default: ${DEFAULT-VALUE}")
    int stride;
    @Option(names = "--iterations", defaultValue = "${env:ITERATIONS:-10}",
            description = "The number of k-means refinement rounds. Default: ${DEFAULT-VALUE}")
    int iterations;
    @Option(names = "--seed", defaultValue = "${env:SEED}",
            description = "Seed for the k-means initialization, for reproducible results.")
    Long seed;
    @Option(names = "--palette", defaultValue = "${env:PALETTE:-standard}",
            description = "The built-in palette: 'standard' or 'purple-merged'. Default: ${DEFAULT-VALUE}")
    String paletteName;
    @Option(names = "--palette-file", defaultValue = "${env:PALETTE_FILE}",
            description = "A JSON palette definition, overrides --palette.")
    Path paletteFile;
    @Option(names = "--saturation-threshold", paramLabel = "<percent>",
            defaultValue = "${env:SATURATION_THRESHOLD:-8}",
            description = "Colors with a lower saturation are achromatic. Default: ${DEFAULT-VALUE}")
    double saturationThreshold;
    @Option(names = "--value-threshold", paramLabel = "<percent>",
            defaultValue = "${env:VALUE_THRESHOLD:-15}",
            description = "Colors with a lower value are achromatic. Default: ${DEFAULT-VALUE}")
    double valueThreshold;
    @Option(names = "--confidence-radius", paramLabel = "<degrees>",
            defaultValue = "${env:CONFIDENCE_RADIUS:-60}",
            description = "The hue distance at which the confidence reaches zero. Default: ${DEFAULT-VALUE}")
    double confidenceRadius;
    @Option(names = "--confidence-floor", defaultValue = "${env:CONFIDENCE_FLOOR:-0.0}",
            description = "Matches below this confidence are reported as unknown, if --reject-below-floor is set." +
                          " Default: ${DEFAULT-VALUE}")
    double confidenceFloor;
    @Option(names = "--reject-below-floor", defaultValue = "${env:REJECT_BELOW_FLOOR:-false}",
            description = "Report matches below --confidence-floor as unknown instead of returning the nearest " +
                          "label. Default: ${DEFAULT-VALUE}")
    boolean rejectBelowFloor;
    @Option(names = "--force-fallback", defaultValue = "${env:FORCE_FALLBACK:-false}",
            description = "Replace unknown results with the nearest palette label, regardless of confidence." +
                          " Default: ${DEFAULT-VALUE}")
    boolean forceFallback;
    @Option(names = "--json", description = "Print the results as JSON.")
    boolean json;
    @Option(names = "--list-palette",
            description = "Print the reference swatches of the palette instead of analysing an image.")
    boolean listPalette;

    public static void main(String[] args) {
        int execute = createCommandLine().execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new ChromaClassifier()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        assertConfigurationParameters();
        Palette palette = loadPalette();
        if (listPalette) {
            printSwatches(palette);
            return 0;
        }
        if (image == null) {
            fail("Missing required parameter: 'IMAGE'");
        }
        PaletteClassifier classifier = new PaletteClassifier(palette, createClassifierSettings());
        BufferedImage bufferedImage = readImage();
        if (bufferedImage == null) {
            return 1;
        }
        PixelBuffer buffer = new BufferedImagePixelBuffer(bufferedImage);
        Region region = Region.of(x, y, width != null ? width : buffer.getWidth(),
                height != null ? height : buffer.getHeight());
        MDC.put("context", "region " + region);
        try {
            List<ColorResult> results = analyse(classifier, buffer, region);
            print(results);
        } finally {
            MDC.remove("context");
        }
        return 0;
    }

    private List<ColorResult> analyse(PaletteClassifier classifier, PixelBuffer buffer, Region region) {
        LOG.debug("Analyse {} of {}x{} image in {} mode", region, buffer.getWidth(), buffer.getHeight(), mode);
        RegionSampler sampler = new RegionSampler(classifier);
        List<ColorResult> results;
        if (mode == Mode.DOMINANT) {
            results = createExtractor(classifier).extract(buffer, region, clusters);
            if (results.isEmpty() && forceFallback) {
                LOG.debug("No dominant colors found: Fall back to region mean");
                results = List.of(sampler.analyzeRegion(buffer, region));
            }
        } else {
            results = List.of(sampler.analyzeRegion(buffer, region));
        }
        if (!forceFallback) {
            return results;
        }
        List<ColorResult> forced = new ArrayList<>(results.size());
        for (ColorResult result : results) {
            forced.add(forceClassifyIfUnknown(classifier, result));
        }
        return forced;
    }

    private static ColorResult forceClassifyIfUnknown(PaletteClassifier classifier, ColorResult result) {
        if (!result.isUnknown() || result.equals(ColorResult.empty())) {
            return result;
        }
        ColorLabel label = classifier.forceClassify(result.hsv().hue());
        LOG.debug("Forced {} to {}", result, label);
        return new ColorResult(label, result.confidence(), result.rgb(), result.hsv());
    }

    private DominantColorExtractor createExtractor(PaletteClassifier classifier) {
        ExtractorSettings settings = ExtractorSettings.builder()
                                                      .clusterCount(clusters)
                                                      .stride(stride)
                                                      .iterations(iterations)
                                                      .build();
        if (seed != null) {
            return new DominantColorExtractor(classifier, settings, new Random(seed));
        }
        return new DominantColorExtractor(classifier, settings);
    }

    private ClassifierSettings createClassifierSettings() {
        return ClassifierSettings.builder()
                                 .saturationThreshold(saturationThreshold)
                                 .valueThreshold(valueThreshold)
                                 .confidenceRadius(confidenceRadius)
                                 .confidenceFloor(confidenceFloor)
                                 .rejectBelowFloor(rejectBelowFloor)
                                 .build();
    }

    private Palette loadPalette() {
        if (paletteFile != null) {
            try {
                return new PaletteLoader().load(paletteFile);
            } catch (InvalidPaletteException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }
        return switch (paletteName.toLowerCase(Locale.ROOT)) {
            case "standard" -> Palette.standard();
            case "purple-merged" -> Palette.purpleMerged();
            default -> {
                fail("--palette must be 'standard' or 'purple-merged', got: " + paletteName);
                yield null;
            }
        };
    }

    private BufferedImage readImage() {
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.isReadable(image)) {
            err.println("Given image '" + image.toAbsolutePath() + "' does not exist or is not readable!");
            return null;
        }
        try {
            BufferedImage bufferedImage = ImageIO.read(image.toFile());
            if (bufferedImage == null) {
                err.println("Unsupported image format: '" + image.toAbsolutePath() + "'");
            }
            return bufferedImage;
        } catch (IOException e) {
            LOG.error("Failed to read image '{}': {}", image, e.getLocalizedMessage(), e);
            err.println("Failed to read image '" + image.toAbsolutePath() + "': " + e.getLocalizedMessage());
            return null;
        }
    }

    private void print(List<ColorResult> results) {
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(results));
        } else {
            results.forEach(out::println);
        }
        out.flush();
    }

    /**
     * Prints one line per palette entry with the fully saturated, full value color of its hue.
     */
    private void printSwatches(Palette palette) {
        PrintWriter out = spec.commandLine().getOut();
        for (PaletteEntry entry : palette.getEntries()) {
            Rgb swatch = ColorSpaceConverter.hsvToRgb(new Hsv(entry.hue(), 100, 100));
            out.println(String.format(Locale.ROOT, "%s %.1f %s", entry.label().getDisplayName(), entry.hue(), swatch));
        }
        out.flush();
    }

    private static String toJson(List<ColorResult> results) {
        List<JsonResult> jsonResults = new ArrayList<>(results.size());
        for (ColorResult result : results) {
            jsonResults.add(JsonResult.of(result));
        }
        try {
            return new ObjectMapper().writeValueAsString(jsonResults);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize results: " + e.getMessage(), e);
        }
    }

    private void assertConfigurationParameters() {
        if (clusters < 1) {
            fail("--clusters must be >= 1");
        }
        if (stride < 1) {
            fail("--stride must be >= 1");
        }
        if (iterations < 0) {
            fail("--iterations must be >= 0");
        }
        if (saturationThreshold < 0 || saturationThreshold > 100) {
            fail("--saturation-threshold must be within [0,100]");
        }
        if (valueThreshold < 0 || valueThreshold > 100) {
            fail("--value-threshold must be within [0,100]");
        }
        if (confidenceRadius <= 0) {
            fail("--confidence-radius must be > 0");
        }
        if (confidenceFloor < 0 || confidenceFloor > 1) {
            fail("--confidence-floor must be within [0,1]");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    record JsonResult(String label, double confidence, int[] rgb, double[] hsv) {
        static JsonResult of(ColorResult result) {
            return new JsonResult(result.label().name(), result.confidence(),
                    new int[]{result.rgb().red(), result.rgb().green(), result.rgb().blue()},
                    new double[]{result.hsv().hue(), result.hsv().saturation(), result.hsv().value()});
        }
    }
}
