package org.janelia.colorcast.image;

import net.imglib2.img.array.ArrayImgs;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ColorImageTest {

    @Test
    public void planarSamplesLayout() {
        // 2x1 image: red plane, green plane, blue plane
        ColorImage img = ColorImage.fromPlanarSamples(2, 1, new float[] {
                0.1f, 0.2f,
                0.3f, 0.4f,
                0.5f, 0.6f
        });
        assertEquals(2, img.getWidth());
        assertEquals(1, img.getHeight());
        assertEquals(0.2f, img.getSample(1, 0, ColorImage.RED), 0);
        assertEquals(0.3f, img.getSample(0, 0, ColorImage.GREEN), 0);
        assertEquals(0.6f, img.getSample(1, 0, ColorImage.BLUE), 0);
        assertArrayEquals(new long[] {2, 1, 3}, img.getImageShape());
    }

    @Test
    public void everyImageHasADistinctIdentity() {
        ColorImage img = ColorImage.filled(2, 2, 0.5f, 0.5f, 0.5f);
        ColorImage copy = img.copy();
        assertNotEquals(img.getImageId(), copy.getImageId());
        assertTrue(img.hasSameShape(copy));
        TestImages.assertSameSamples(img, copy, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectNonRGBImages() {
        ColorImage.fromImg(ArrayImgs.floats(4, 4, 4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectWrongNumberOfSamples() {
        ColorImage.fromPlanarSamples(2, 2, new float[5]);
    }
}
