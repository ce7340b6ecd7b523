package org.janelia.colorcast.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.ImgFactory;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static long getMaxSize(long[] shape) {
        return Arrays.stream(shape).reduce(1, (a, d) -> a * d);
    }

    public static boolean sameShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        long[] refShape = ref.dimensionsAsLongArray();
        long[] imgShape = img.dimensionsAsLongArray();
        if (refShape.length != imgShape.length)
            return false;
        for (int d = 0; d < refShape.length; d++) {
            if (refShape[d] != imgShape[d])
                return false;
        }
        return true;
    }

    public static <T extends NativeType<T>> Img<T> materializeAsNativeImg(RandomAccessibleInterval<T> source, T pxType) {
        ImgFactory<T> imgFactory = new ArrayImgFactory<>(pxType);
        Img<T> img = imgFactory.create(source);
        final IterableInterval<T> sourceIterable = Views.flatIterable(Views.zeroMin(source));
        final IterableInterval<T> targetIterable = Views.flatIterable(img);
        final Cursor<T> sourceCursor = sourceIterable.cursor();
        final Cursor<T> targetCursor = targetIterable.cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
        return img;
    }

    /**
     * Copy the values in flat iteration order (x first, then y).
     */
    public static <T extends RealType<T>> float[] getValues(RandomAccessibleInterval<T> image) {
        long size = getMaxSize(image.dimensionsAsLongArray());
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image is too large: " + size + " pixels");
        }
        float[] values = new float[(int) size];
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            values[i++] = cursor.next().getRealFloat();
        }
        return values;
    }

    /**
     * Write the values in flat iteration order - the reverse of {@link #getValues(RandomAccessibleInterval)}.
     */
    public static void setValues(RandomAccessibleInterval<FloatType> image, float[] values) {
        Cursor<FloatType> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            cursor.next().set(values[i++]);
        }
    }

    public static double clip(double value) {
        if (value < 0) {
            return 0;
        } else if (value > 1) {
            return 1;
        } else {
            return value;
        }
    }

    public static void clipImage(RandomAccessibleInterval<FloatType> image) {
        Views.flatIterable(image).forEach(px -> px.setReal(clip(px.getRealDouble())));
    }
}
