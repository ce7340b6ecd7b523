package org.janelia.colorcast.image.algorithms;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ImageScalerTest {

    @Test
    public void upscaleReplicatesBorders() {
        Img<FloatType> img = ArrayImgs.floats(new float[] {0, 1}, 2, 1);
        Img<FloatType> scaled = ImageScaler.scaleImage(img, 4, 2);
        assertArrayEquals(new long[] {4, 2}, scaled.dimensionsAsLongArray());
        RandomAccess<FloatType> ra = scaled.randomAccess();
        // target centers map to -0.25, 0.25, 0.75, 1.25 on the source grid
        assertEquals(0f, ra.setPositionAndGet(0, 0).get(), 1e-6);
        assertEquals(0.25f, ra.setPositionAndGet(1, 0).get(), 1e-6);
        assertEquals(0.75f, ra.setPositionAndGet(2, 1).get(), 1e-6);
        assertEquals(1f, ra.setPositionAndGet(3, 1).get(), 1e-6);
    }

    @Test
    public void downscaleSmoothsHighFrequencies() {
        // checkerboard averages out to gray when down-sampled
        int size = 32;
        float[] values = new float[size * size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                values[y * size + x] = (x + y) % 2;
            }
        }
        Img<FloatType> scaled = ImageScaler.scaleImage(ArrayImgs.floats(values, size, size), 4, 4);
        RandomAccess<FloatType> ra = scaled.randomAccess();
        // pixels away from the borders
        for (int y = 1; y < 3; y++) {
            for (int x = 1; x < 3; x++) {
                float v = ra.setPositionAndGet(x, y).get();
                assertTrue("Unexpected value " + v + " at " + x + "," + y, Math.abs(v - 0.5f) < 0.05);
            }
        }
    }

    @Test
    public void axisThatKeepsItsSizeIsNotSmoothed() {
        // alternating columns, constant along y; only y is down-sampled
        int width = 4;
        int height = 8;
        float[] values = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                values[y * width + x] = x % 2;
            }
        }
        Img<FloatType> scaled = ImageScaler.scaleImage(ArrayImgs.floats(values, width, height), width, 2);
        RandomAccess<FloatType> ra = scaled.randomAccess();
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < width; x++) {
                assertEquals(x % 2, ra.setPositionAndGet(x, y).get(), 1e-5);
            }
        }
    }

    @Test
    public void channelsAreScaledIndependently() {
        Img<FloatType> img = ArrayImgs.floats(5, 5, 3);
        float[] channelValues = new float[] {0.1f, 0.5f, 0.9f};
        for (int c = 0; c < 3; c++) {
            float v = channelValues[c];
            Views.hyperSlice(img, 2, c).forEach(px -> px.set(v));
        }
        Img<FloatType> scaled = ImageScaler.scaleImage(img, 3, 2);
        assertArrayEquals(new long[] {3, 2, 3}, scaled.dimensionsAsLongArray());
        RandomAccess<FloatType> ra = scaled.randomAccess();
        for (int c = 0; c < 3; c++) {
            assertEquals(channelValues[c], ra.setPositionAndGet(1, 1, c).get(), 1e-5);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidTargetSize() {
        ImageScaler.scaleImage(ArrayImgs.floats(2, 2), 0, 2);
    }
}
