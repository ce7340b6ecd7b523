package org.janelia.colorcast.transfer;

import java.util.Arrays;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageAccessUtils;

/**
 * Per channel histogram matching.
 *
 * Each distinct content value is mapped to the style value that has the same cumulative probability,
 * interpolating linearly between the neighbouring points of the style's cumulative distribution.
 */
public class HistogramMatching {

    /**
     * Sorted distinct values of a channel together with their cumulative probabilities.
     */
    static class CumulativeDistribution {
        final float[] values;
        final double[] quantiles;
        final int size;

        private CumulativeDistribution(float[] values, double[] quantiles, int size) {
            this.values = values;
            this.quantiles = quantiles;
            this.size = size;
        }

        static CumulativeDistribution of(float[] samples) {
            float[] sortedSamples = Arrays.copyOf(samples, samples.length);
            Arrays.sort(sortedSamples);
            float[] values = new float[sortedSamples.length];
            double[] quantiles = new double[sortedSamples.length];
            int n = 0;
            for (int i = 0; i < sortedSamples.length; i++) {
                if (n == 0 || Float.compare(values[n - 1], sortedSamples[i]) != 0) {
                    values[n++] = sortedSamples[i];
                }
                // i + 1 samples are less or equal to the current value
                quantiles[n - 1] = (double) (i + 1) / sortedSamples.length;
            }
            return new CumulativeDistribution(values, quantiles, n);
        }

        int indexOf(float value) {
            return Arrays.binarySearch(values, 0, size, value);
        }

        /**
         * Piecewise linear interpolation of the value at the given cumulative probability.
         */
        double valueAt(double quantile) {
            if (quantile <= quantiles[0]) {
                return values[0];
            }
            if (quantile >= quantiles[size - 1]) {
                return values[size - 1];
            }
            // find the last point whose quantile is not greater than the requested one
            int lo = 0;
            int hi = size - 1;
            while (hi - lo > 1) {
                int mid = (lo + hi) >>> 1;
                if (quantiles[mid] <= quantile) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            double slope = (values[hi] - values[lo]) / (quantiles[hi] - quantiles[lo]);
            return values[lo] + slope * (quantile - quantiles[lo]);
        }
    }

    public static ColorImage matchHistograms(ColorImage content, ColorImage style) {
        Img<FloatType> matched = ArrayImgs.floats(content.getImageShape());
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            float[] matchedValues = matchCumulativeDistribution(
                    ImageAccessUtils.getValues(content.getChannel(c)),
                    ImageAccessUtils.getValues(style.getChannel(c)));
            ImageAccessUtils.setValues(Views.hyperSlice(matched, 2, c), matchedValues);
        }
        return ColorImage.fromImg(matched);
    }

    /**
     * Match the distribution of the source samples to the distribution of the template samples.
     *
     * @param source samples to be remapped
     * @param template samples with the target distribution
     * @return remapped samples in the same order as the source
     */
    static float[] matchCumulativeDistribution(float[] source, float[] template) {
        CumulativeDistribution sourceDistribution = CumulativeDistribution.of(source);
        CumulativeDistribution templateDistribution = CumulativeDistribution.of(template);

        float[] lookupTable = new float[sourceDistribution.size];
        for (int i = 0; i < sourceDistribution.size; i++) {
            lookupTable[i] = (float) ImageAccessUtils.clip(templateDistribution.valueAt(sourceDistribution.quantiles[i]));
        }
        float[] matched = new float[source.length];
        for (int i = 0; i < source.length; i++) {
            matched[i] = lookupTable[sourceDistribution.indexOf(source[i])];
        }
        return matched;
    }
}
