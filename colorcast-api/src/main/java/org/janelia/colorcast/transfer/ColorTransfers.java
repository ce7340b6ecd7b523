package org.janelia.colorcast.transfer;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for all color transfer methods.
 */
public class ColorTransfers {

    private static final Logger LOG = LoggerFactory.getLogger(ColorTransfers.class);

    public static ColorImage transfer(ColorImage content, ColorImage style, TransferMethod method) {
        return transfer(content, style, method, LuminanceThresholds.DEFAULT);
    }

    /**
     * Transfer the colors of the style image to the content image.
     *
     * @param content content image
     * @param style style image - it must have the same shape as the content
     * @param method transfer method
     * @param thresholds luminance thresholds used by the selective methods
     * @return a new image with the content's shape and all samples in [0, 1]
     */
    public static ColorImage transfer(ColorImage content, ColorImage style, TransferMethod method, LuminanceThresholds thresholds) {
        if (content.hasDifferentShape(style)) {
            throw new IllegalStateException(String.format(
                    "Invalid image size - style image shape %s must match content image shape: %s",
                    Arrays.toString(style.getImageShape()), Arrays.toString(content.getImageShape())));
        }
        long startTime = System.currentTimeMillis();
        ColorImage result;
        switch (method) {
            case HISTOGRAM:
                result = HistogramMatching.matchHistograms(content, style);
                break;
            case MEAN_STD:
                result = MeanStdTransfer.transfer(content, style);
                break;
            case LUT_LINEAR:
                result = applyToneCurve(HistogramMatching.matchHistograms(content, style), ToneCurve.LINEAR);
                break;
            case LUT_SCURVE:
                result = applyToneCurve(HistogramMatching.matchHistograms(content, style), ToneCurve.S_CURVE);
                break;
            case LUT_CONTRAST:
                result = applyToneCurve(HistogramMatching.matchHistograms(content, style), ToneCurve.CONTRAST);
                break;
            case SELECTIVE_SHADOWS:
                result = selectiveTransfer(content, style, LuminanceBand.SHADOWS, thresholds);
                break;
            case SELECTIVE_MIDTONES:
                result = selectiveTransfer(content, style, LuminanceBand.MIDTONES, thresholds);
                break;
            case SELECTIVE_HIGHLIGHTS:
                result = selectiveTransfer(content, style, LuminanceBand.HIGHLIGHTS, thresholds);
                break;
            default:
                throw new IllegalArgumentException("Unsupported transfer method: " + method);
        }
        LOG.info("Applied {} to {}x{} image in {}ms",
                method.getDisplayName(), content.getWidth(), content.getHeight(), System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Apply the curve in place. The samples are clipped to [0, 1] afterwards.
     */
    static ColorImage applyToneCurve(ColorImage img, ToneCurve curve) {
        RandomAccessibleInterval<FloatType> pixels = img.getPixels();
        if (curve != ToneCurve.LINEAR) {
            LoopBuilder.setImages(pixels).forEachPixel(px -> px.setReal(curve.apply(px.getRealDouble())));
        }
        ImageAccessUtils.clipImage(pixels);
        return img;
    }

    /**
     * Histogram match the whole image and keep the matched values only for the pixels
     * of the content whose luminance falls inside the band.
     */
    static ColorImage selectiveTransfer(ColorImage content, ColorImage style, LuminanceBand band, LuminanceThresholds thresholds) {
        RandomAccessibleInterval<BitType> mask = LuminanceMasker.createMask(content, band, thresholds);
        ColorImage result = HistogramMatching.matchHistograms(content, style);
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            LoopBuilder.setImages(mask, content.getChannel(c), result.getChannel(c))
                    .forEachPixel((m, s, r) -> {
                        if (!m.get()) {
                            r.set(s);
                        }
                    });
        }
        return result;
    }
}
