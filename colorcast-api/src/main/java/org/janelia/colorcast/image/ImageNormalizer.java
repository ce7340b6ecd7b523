package org.janelia.colorcast.image;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.janelia.colorcast.image.algorithms.ImageScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings decoded rasters into the canonical {@link ColorImage} form and makes
 * the style image comparable with the content image.
 */
public class ImageNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ImageNormalizer.class);

    /**
     * Convert a decoded raster into an RGB float image.
     *
     * Single channel rasters are replicated across R, G and B, the alpha channel of RGBA rasters
     * is dropped without compositing, and every sample is divided by the max sample value of its channel.
     * The orientation is applied before anything else.
     *
     * @param raster decoded raster
     * @param orientation orientation read from the image metadata
     * @return normalized image
     * @throws InvalidImageException if the raster has no pixels or an unsupported channel layout
     */
    public static <T extends RealType<T>> ColorImage normalize(DecodedRaster<T> raster, ImageOrientation orientation) {
        RandomAccessibleInterval<T> samples = raster.getSamples();
        int ndims = samples.numDimensions();
        if (ndims != 2 && ndims != 3) {
            throw new InvalidImageException(InvalidImageException.ErrorKind.UNSUPPORTED_FORMAT,
                    "Unsupported image dimensions: " + Arrays.toString(samples.dimensionsAsLongArray()));
        }
        if (raster.getWidth() == 0 || raster.getHeight() == 0) {
            throw new InvalidImageException(InvalidImageException.ErrorKind.EMPTY_IMAGE,
                    "Image has no pixels: " + Arrays.toString(samples.dimensionsAsLongArray()));
        }
        int nChannels = (int) raster.getChannels();
        if (nChannels != 1 && nChannels != 3 && nChannels != 4) {
            throw new InvalidImageException(InvalidImageException.ErrorKind.UNSUPPORTED_FORMAT,
                    "Unsupported number of channels: " + nChannels);
        }
        RandomAccessibleInterval<T> orientedSamples = ImageTransforms.applyOrientation(samples, orientation);
        long width = orientedSamples.dimension(0);
        long height = orientedSamples.dimension(1);

        Img<FloatType> rgbImg = ArrayImgs.floats(width, height, ColorImage.NUM_CHANNELS);
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            RandomAccessibleInterval<T> sourceChannel;
            int sourceChannelIndex = nChannels == 1 ? 0 : c;
            if (ndims == 2) {
                sourceChannel = orientedSamples;
            } else {
                sourceChannel = Views.hyperSlice(orientedSamples, 2, sourceChannelIndex);
            }
            double maxSampleValue = raster.getMaxSampleValue(sourceChannelIndex);
            LoopBuilder.setImages(sourceChannel, Views.hyperSlice(rgbImg, 2, c))
                    .forEachPixel((s, t) -> t.setReal(ImageAccessUtils.clip(s.getRealDouble() / maxSampleValue)));
        }
        if (nChannels == 1) {
            LOG.info("Grayscale image {}x{} converted to RGB", width, height);
        } else if (nChannels == 4) {
            LOG.info("Alpha channel removed from {}x{} image", width, height);
        }
        if (orientation != ImageOrientation.NORMAL) {
            LOG.debug("Applied {} orientation to {}", orientation, raster);
        }
        return ColorImage.fromImg(rgbImg, nChannels);
    }

    /**
     * Make the style image the same size as the content image. The content is never modified.
     *
     * The style is resized with its aspect ratio preserved to the smallest size that covers the content
     * and then it is center-cropped to the exact content size.
     *
     * @return a pair with the content on the left and the style, possibly resized, on the right.
     */
    public static Pair<ColorImage, ColorImage> reconcileDimensions(ColorImage content, ColorImage style) {
        if (content.hasSameShape(style)) {
            return ImmutablePair.of(content, style);
        }
        long startTime = System.currentTimeMillis();
        int contentWidth = content.getWidth();
        int contentHeight = content.getHeight();
        double scale = Math.max(
                (double) contentWidth / style.getWidth(),
                (double) contentHeight / style.getHeight());
        int scaledWidth = Math.max(contentWidth, (int) Math.round(style.getWidth() * scale));
        int scaledHeight = Math.max(contentHeight, (int) Math.round(style.getHeight() * scale));
        Img<FloatType> scaledStyle = ImageScaler.scaleImage(style.getPixels(), scaledWidth, scaledHeight);

        long xOffset = (scaledWidth - contentWidth) / 2;
        long yOffset = (scaledHeight - contentHeight) / 2;
        RandomAccessibleInterval<FloatType> croppedStyle = Views.interval(
                Views.extendBorder(scaledStyle),
                new long[] {xOffset, yOffset, 0},
                new long[] {xOffset + contentWidth - 1, yOffset + contentHeight - 1, ColorImage.NUM_CHANNELS - 1});
        Img<FloatType> reconciledStyle = ImageAccessUtils.materializeAsNativeImg(croppedStyle, new FloatType());
        LOG.info("Resized style image from {}x{} to {}x{} (cropped from {}x{}) in {}ms",
                style.getWidth(), style.getHeight(),
                contentWidth, contentHeight,
                scaledWidth, scaledHeight,
                System.currentTimeMillis() - startTime);
        return ImmutablePair.of(content, ColorImage.fromImg(reconciledStyle, style.getSourceChannels()));
    }
}
