package org.janelia.colorcast.image;

import java.util.Random;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestImages {

    public static ColorImage randomImage(int width, int height, long seed, float minValue, float maxValue) {
        Random random = new Random(seed);
        float[] samples = new float[width * height * ColorImage.NUM_CHANNELS];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = minValue + random.nextFloat() * (maxValue - minValue);
        }
        return ColorImage.fromPlanarSamples(width, height, samples);
    }

    public static ColorImage randomImage(int width, int height, long seed) {
        return randomImage(width, height, seed, 0f, 1f);
    }

    public static void assertInUnitRange(ColorImage img) {
        for (FloatType px : Views.flatIterable(img.getPixels())) {
            assertTrue("Sample out of range: " + px.get(), px.get() >= 0 && px.get() <= 1);
        }
    }

    public static void assertUniform(RandomAccessibleInterval<FloatType> img, float expected, double delta) {
        for (FloatType px : Views.flatIterable(img)) {
            assertEquals(expected, px.get(), delta);
        }
    }

    public static void assertSameSamples(ColorImage expected, ColorImage actual, double delta) {
        assertTrue(expected.hasSameShape(actual));
        float[] expectedValues = ImageAccessUtils.getValues(expected.getPixels());
        float[] actualValues = ImageAccessUtils.getValues(actual.getPixels());
        for (int i = 0; i < expectedValues.length; i++) {
            assertEquals("Sample " + i, expectedValues[i], actualValues[i], delta);
        }
    }
}
