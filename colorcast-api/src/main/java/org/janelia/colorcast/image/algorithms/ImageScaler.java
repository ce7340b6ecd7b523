package org.janelia.colorcast.image.algorithms;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.gauss3.Gauss3;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.colorcast.image.ImageAccessUtils;

/**
 * Resizes multi-channel float images with [width, height, channels] dimensions.
 *
 * When an axis is down-sampled the channel is first smoothed with {@link Gauss3}
 * (sigma = (scale - 1) / 2, border extended) to avoid aliasing, then every target pixel
 * is bilinearly interpolated from the pixel centers of the source. Borders are replicated.
 */
public class ImageScaler {

    public static Img<FloatType> scaleImage(RandomAccessibleInterval<FloatType> img, int dstWidth, int dstHeight) {
        if (dstWidth <= 0 || dstHeight <= 0) {
            throw new IllegalArgumentException("Invalid target size: " + dstWidth + "x" + dstHeight);
        }
        int srcWidth = (int) img.dimension(0);
        int srcHeight = (int) img.dimension(1);
        int nChannels = img.numDimensions() > 2 ? (int) img.dimension(2) : 1;

        double xScale = (double) srcWidth / dstWidth;
        double yScale = (double) srcHeight / dstHeight;
        double xSigma = Math.max(0, (xScale - 1) / 2);
        double ySigma = Math.max(0, (yScale - 1) / 2);

        Img<FloatType> scaledImg = nChannels > 1
                ? ArrayImgs.floats(dstWidth, dstHeight, nChannels)
                : ArrayImgs.floats(dstWidth, dstHeight);
        for (int c = 0; c < nChannels; c++) {
            RandomAccessibleInterval<FloatType> srcChannel = nChannels > 1 ? Views.hyperSlice(img, 2, c) : img;
            RandomAccessibleInterval<FloatType> dstChannel = nChannels > 1 ? Views.hyperSlice(scaledImg, 2, c) : scaledImg;

            RandomAccessibleInterval<FloatType> smoothedChannel = smooth(Views.zeroMin(srcChannel), xSigma, ySigma);
            float[] smoothedValues = ImageAccessUtils.getValues(smoothedChannel);
            float[] dstValues = resample(smoothedValues, srcWidth, srcHeight, dstWidth, dstHeight, xScale, yScale);
            ImageAccessUtils.setValues(dstChannel, dstValues);
        }
        return scaledImg;
    }

    private static RandomAccessibleInterval<FloatType> smooth(RandomAccessibleInterval<FloatType> channel, double xSigma, double ySigma) {
        if (xSigma <= 0 && ySigma <= 0) {
            return channel;
        }
        Img<FloatType> smoothed = ArrayImgs.floats(channel.dimension(0), channel.dimension(1));
        try {
            Gauss3.gauss(new double[] {xSigma, ySigma}, Views.extendBorder(channel), smoothed);
        } catch (Exception e) {
            throw new IllegalStateException("Error smoothing " + channel.dimension(0) + "x" + channel.dimension(1) + " channel", e);
        }
        return smoothed;
    }

    private static float[] resample(float[] values,
                                    int srcWidth, int srcHeight,
                                    int dstWidth, int dstHeight,
                                    double xScale, double yScale) {
        float[] resampled = new float[dstWidth * dstHeight];
        for (int y = 0; y < dstHeight; y++) {
            // map the target pixel center onto the source grid
            double ys = clampCoord((y + 0.5) * yScale - 0.5, srcHeight);
            int y0 = (int) Math.floor(ys);
            int y1 = Math.min(y0 + 1, srcHeight - 1);
            double dy = ys - y0;
            for (int x = 0; x < dstWidth; x++) {
                double xs = clampCoord((x + 0.5) * xScale - 0.5, srcWidth);
                int x0 = (int) Math.floor(xs);
                int x1 = Math.min(x0 + 1, srcWidth - 1);
                double dx = xs - x0;

                double c00 = values[y0 * srcWidth + x0];
                double c10 = values[y0 * srcWidth + x1];
                double c01 = values[y1 * srcWidth + x0];
                double c11 = values[y1 * srcWidth + x1];
                double top = c00 * (1 - dx) + c10 * dx;
                double bottom = c01 * (1 - dx) + c11 * dx;
                resampled[y * dstWidth + x] = (float) (top * (1 - dy) + bottom * dy);
            }
        }
        return resampled;
    }

    private static double clampCoord(double pos, int size) {
        if (pos < 0) {
            return 0;
        } else if (pos > size - 1) {
            return size - 1;
        } else {
            return pos;
        }
    }
}
