package org.janelia.colorcast.image;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ImageTransformsTest {

    /**
     * Source image (3x2):
     * <pre>
     *     0 1 2
     *     3 4 5
     * </pre>
     */
    private Img<FloatType> createTestImage() {
        return ArrayImgs.floats(new float[] {0, 1, 2, 3, 4, 5}, 3, 2);
    }

    @Test
    public void applyOrientation() {
        class TestData {
            final ImageOrientation orientation;
            final long[] expectedShape;
            final float[][] expectedRows;

            TestData(ImageOrientation orientation, long[] expectedShape, float[][] expectedRows) {
                this.orientation = orientation;
                this.expectedShape = expectedShape;
                this.expectedRows = expectedRows;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(ImageOrientation.NORMAL, new long[] {3, 2}, new float[][] {{0, 1, 2}, {3, 4, 5}}),
                new TestData(ImageOrientation.MIRROR_HORIZONTAL, new long[] {3, 2}, new float[][] {{2, 1, 0}, {5, 4, 3}}),
                new TestData(ImageOrientation.ROTATE_180, new long[] {3, 2}, new float[][] {{5, 4, 3}, {2, 1, 0}}),
                new TestData(ImageOrientation.MIRROR_VERTICAL, new long[] {3, 2}, new float[][] {{3, 4, 5}, {0, 1, 2}}),
                new TestData(ImageOrientation.TRANSPOSE, new long[] {2, 3}, new float[][] {{0, 3}, {1, 4}, {2, 5}}),
                new TestData(ImageOrientation.ROTATE_90_CW, new long[] {2, 3}, new float[][] {{3, 0}, {4, 1}, {5, 2}}),
                new TestData(ImageOrientation.TRANSVERSE, new long[] {2, 3}, new float[][] {{5, 2}, {4, 1}, {3, 0}}),
                new TestData(ImageOrientation.ROTATE_270_CW, new long[] {2, 3}, new float[][] {{2, 5}, {1, 4}, {0, 3}}),
        };
        for (TestData td : testData) {
            RandomAccessibleInterval<FloatType> oriented = ImageTransforms.applyOrientation(createTestImage(), td.orientation);
            assertArrayEquals(td.orientation.name(), td.expectedShape, oriented.dimensionsAsLongArray());
            RandomAccess<FloatType> ra = oriented.randomAccess();
            for (int y = 0; y < td.expectedRows.length; y++) {
                for (int x = 0; x < td.expectedRows[y].length; x++) {
                    assertEquals(td.orientation + " at " + x + "," + y,
                            td.expectedRows[y][x], ra.setPositionAndGet(x, y).get(), 0);
                }
            }
        }
    }

    @Test
    public void orientationFromExifCode() {
        for (ImageOrientation orientation : ImageOrientation.values()) {
            assertEquals(orientation, ImageOrientation.fromExifCode(orientation.getExifCode()));
        }
        assertEquals(ImageOrientation.NORMAL, ImageOrientation.fromExifCode(0));
        assertEquals(ImageOrientation.NORMAL, ImageOrientation.fromExifCode(9));
    }
}
