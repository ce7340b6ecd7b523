package org.janelia.colorcast.image;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Canonical RGB image used by all color transfer operations.
 *
 * The samples are stored in an imglib2 float image with the dimensions [width, height, 3], so the
 * logical (height, width, 3) array is accessed as (x, y, channel). Every sample is in [0, 1].
 * Each instance gets a unique id which is used as the image identity by the transfer result cache,
 * therefore an image must not be modified once it was handed to a processing session.
 * Images returned by the transfer result cache are shared with the cache and are read-only as
 * well; use {@link #copy()} to get a writable image.
 */
public class ColorImage {

    public static final int NUM_CHANNELS = 3;
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;

    private static final AtomicLong IMAGE_ID_GENERATOR = new AtomicLong(0);

    private final long imageId;
    private final Img<FloatType> pixels;
    private final int sourceChannels;

    private ColorImage(Img<FloatType> pixels, int sourceChannels) {
        if (pixels.numDimensions() != 3 || pixels.dimension(2) != NUM_CHANNELS) {
            throw new IllegalArgumentException("Invalid color image shape: " + Arrays.toString(pixels.dimensionsAsLongArray())
                    + " - expected [width, height, " + NUM_CHANNELS + "]");
        }
        this.imageId = IMAGE_ID_GENERATOR.incrementAndGet();
        this.pixels = pixels;
        this.sourceChannels = sourceChannels;
    }

    /**
     * Create an image with all pixels set to the given color.
     */
    public static ColorImage filled(int width, int height, float r, float g, float b) {
        Img<FloatType> img = ArrayImgs.floats(width, height, NUM_CHANNELS);
        float[] rgb = new float[] {r, g, b};
        for (int c = 0; c < NUM_CHANNELS; c++) {
            float value = rgb[c];
            Views.hyperSlice(img, 2, c).forEach(px -> px.set(value));
        }
        return new ColorImage(img, NUM_CHANNELS);
    }

    /**
     * Wrap planar samples: all red samples in row major order, followed by the green and the blue samples.
     */
    public static ColorImage fromPlanarSamples(int width, int height, float[] samples) {
        if (samples.length != width * height * NUM_CHANNELS) {
            throw new IllegalArgumentException("Expected " + (width * height * NUM_CHANNELS) + " samples but got " + samples.length);
        }
        return new ColorImage(ArrayImgs.floats(samples, width, height, NUM_CHANNELS), NUM_CHANNELS);
    }

    public static ColorImage fromImg(Img<FloatType> pixels) {
        return new ColorImage(pixels, NUM_CHANNELS);
    }

    static ColorImage fromImg(Img<FloatType> pixels, int sourceChannels) {
        return new ColorImage(pixels, sourceChannels);
    }

    public long getImageId() {
        return imageId;
    }

    public int getWidth() {
        return (int) pixels.dimension(0);
    }

    public int getHeight() {
        return (int) pixels.dimension(1);
    }

    /**
     * @return the number of channels of the raster this image was normalized from.
     */
    public int getSourceChannels() {
        return sourceChannels;
    }

    public long[] getImageShape() {
        return pixels.dimensionsAsLongArray();
    }

    public boolean hasSameShape(ColorImage img) {
        return ImageAccessUtils.sameShape(pixels, img.pixels);
    }

    public boolean hasDifferentShape(ColorImage img) {
        return !hasSameShape(img);
    }

    public RandomAccessibleInterval<FloatType> getPixels() {
        return pixels;
    }

    public RandomAccessibleInterval<FloatType> getChannel(int channel) {
        return Views.hyperSlice(pixels, 2, channel);
    }

    public float getSample(int x, int y, int channel) {
        RandomAccess<FloatType> pixelAccess = pixels.randomAccess();
        return pixelAccess.setPositionAndGet(x, y, channel).get();
    }

    public ColorImage copy() {
        return new ColorImage(pixels.copy(), sourceChannels);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("imageId", imageId)
                .append("width", getWidth())
                .append("height", getHeight())
                .append("sourceChannels", sourceChannels)
                .toString();
    }
}
