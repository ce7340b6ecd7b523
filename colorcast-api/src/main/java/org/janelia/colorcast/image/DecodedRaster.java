package org.janelia.colorcast.image;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Pixel data as it comes out of a decoder.
 *
 * The samples have the dimensions [width, height] for single channel images
 * or [width, height, channels] otherwise.
 *
 * @param <T> sample type
 */
public class DecodedRaster<T extends RealType<T>> {

    private final RandomAccessibleInterval<T> samples;
    private final double[] maxSampleValues;

    /**
     * @param samples decoded samples
     * @param maxSampleValue value of a fully saturated sample in every channel, e.g. 255 for 8 bit or 65535 for 16 bit data
     */
    public DecodedRaster(RandomAccessibleInterval<T> samples, double maxSampleValue) {
        this.samples = samples;
        this.maxSampleValues = new double[(int) getChannels()];
        Arrays.fill(this.maxSampleValues, maxSampleValue);
        checkMaxSampleValues();
    }

    /**
     * @param samples decoded samples
     * @param maxSampleValues value of a fully saturated sample for each channel, e.g. 31, 63, 31 for 5-6-5 packed RGB
     */
    public DecodedRaster(RandomAccessibleInterval<T> samples, double[] maxSampleValues) {
        if (maxSampleValues.length != getChannels(samples)) {
            throw new IllegalArgumentException("Expected " + getChannels(samples) + " max sample values but got " + maxSampleValues.length);
        }
        this.samples = samples;
        this.maxSampleValues = Arrays.copyOf(maxSampleValues, maxSampleValues.length);
        checkMaxSampleValues();
    }

    private void checkMaxSampleValues() {
        for (double maxSampleValue : maxSampleValues) {
            if (maxSampleValue <= 0) {
                throw new IllegalArgumentException("Max sample value must be positive - current values are " + Arrays.toString(maxSampleValues));
            }
        }
    }

    public RandomAccessibleInterval<T> getSamples() {
        return samples;
    }

    public double getMaxSampleValue(int channel) {
        return maxSampleValues[channel];
    }

    public long getWidth() {
        return samples.numDimensions() > 0 ? samples.dimension(0) : 0;
    }

    public long getHeight() {
        return samples.numDimensions() > 1 ? samples.dimension(1) : 0;
    }

    public long getChannels() {
        return getChannels(samples);
    }

    private static long getChannels(RandomAccessibleInterval<?> samples) {
        return samples.numDimensions() == 3 ? samples.dimension(2) : 1;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("width", getWidth())
                .append("height", getHeight())
                .append("channels", getChannels())
                .append("maxSampleValues", maxSampleValues)
                .toString();
    }
}
