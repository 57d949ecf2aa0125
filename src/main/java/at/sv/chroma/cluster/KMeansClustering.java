package at.sv.chroma.cluster;

import at.sv.chroma.color.Rgb;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Plain k-means over RGB pixels using the Euclidean distance.
 * <p>
 * The centroids are seeded with randomly drawn pixels (with replacement) and refined for a fixed number of
 * rounds. Each pixel is assigned to its nearest centroid, ties going to the lower index. A cluster without
 * members keeps its previous centroid.
 */
final class KMeansClustering {

    private final Random random;
    private final int iterations;

    KMeansClustering(Random random, int iterations) {
        this.random = random;
        this.iterations = iterations;
    }

    /**
     * @return k centroids, rounded to integer channel values, or an empty list for an empty population
     */
    List<Rgb> cluster(List<Rgb> pixels, int k) {
        if (pixels.isEmpty()) {
            return List.of();
        }
        double[][] centroids = initialCentroids(pixels, k);
        int[] assignment = new int[pixels.size()];
        for (int iteration = 0; iteration < iterations; iteration++) {
            assign(pixels, centroids, assignment);
            update(pixels, centroids, assignment);
        }
        List<Rgb> result = new ArrayList<>(k);
        for (double[] centroid : centroids) {
            result.add(Rgb.round(centroid[0], centroid[1], centroid[2]));
        }
        return result;
    }

    private double[][] initialCentroids(List<Rgb> pixels, int k) {
        double[][] centroids = new double[k][];
        for (int i = 0; i < k; i++) {
            centroids[i] = toVector(pixels.get(random.nextInt(pixels.size())));
        }
        return centroids;
    }

    private static void assign(List<Rgb> pixels, double[][] centroids, int[] assignment) {
        for (int p = 0; p < pixels.size(); p++) {
            Rgb pixel = pixels.get(p);
            double minDistance = Double.POSITIVE_INFINITY;
            int best = 0;
            for (int i = 0; i < centroids.length; i++) {
                double distance = squaredDistance(pixel, centroids[i]);
                if (distance < minDistance) {
                    minDistance = distance;
                    best = i;
                }
            }
            assignment[p] = best;
        }
    }

    private static void update(List<Rgb> pixels, double[][] centroids, int[] assignment) {
        double[][] sums = new double[centroids.length][3];
        int[] counts = new int[centroids.length];
        for (int p = 0; p < pixels.size(); p++) {
            Rgb pixel = pixels.get(p);
            int cluster = assignment[p];
            sums[cluster][0] += pixel.red();
            sums[cluster][1] += pixel.green();
            sums[cluster][2] += pixel.blue();
            counts[cluster]++;
        }
        for (int i = 0; i < centroids.length; i++) {
            if (counts[i] > 0) {
                centroids[i] = new double[]{sums[i][0] / counts[i], sums[i][1] / counts[i], sums[i][2] / counts[i]};
            }
        }
    }

    static double squaredDistance(Rgb pixel, double[] centroid) {
        double dr = pixel.red() - centroid[0];
        double dg = pixel.green() - centroid[1];
        double db = pixel.blue() - centroid[2];
        return dr * dr + dg * dg + db * db;
    }

    private static double[] toVector(Rgb rgb) {
        return new double[]{rgb.red(), rgb.green(), rgb.blue()};
    }
}
