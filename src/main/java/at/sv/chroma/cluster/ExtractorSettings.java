package at.sv.chroma.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class ExtractorSettings {

    public static final ExtractorSettings DEFAULTS = ExtractorSettings.builder().build();

    /**
     * The number of clusters used if the caller does not request a specific count.
     */
    @Builder.Default
    private final int clusterCount = 3;
    /**
     * Every n-th row and column of a region is added to the clustered population.
     */
    @Builder.Default
    private final int stride = 3;
    /**
     * The fixed number of k-means refinement rounds. There is no convergence check.
     */
    @Builder.Default
    private final int iterations = 10;

    void validate() {
        if (clusterCount < 1) {
            throw new IllegalArgumentException("clusterCount must be >= 1, got: " + clusterCount);
        }
        if (stride < 1) {
            throw new IllegalArgumentException("stride must be >= 1, got: " + stride);
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0, got: " + iterations);
        }
    }
}
