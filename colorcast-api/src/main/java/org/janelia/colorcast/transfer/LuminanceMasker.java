package org.janelia.colorcast.transfer;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import org.janelia.colorcast.image.ColorImage;

public class LuminanceMasker {

    static final double RED_WEIGHT = 0.299;
    static final double GREEN_WEIGHT = 0.587;
    static final double BLUE_WEIGHT = 0.114;

    public static double luminance(double r, double g, double b) {
        return RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b;
    }

    /**
     * Create a [width, height] mask that is set where the pixel's luminance falls inside the band.
     * The mask is hard - there is no transition between selected and unselected pixels.
     */
    public static RandomAccessibleInterval<BitType> createMask(ColorImage img, LuminanceBand band, LuminanceThresholds thresholds) {
        Img<BitType> mask = ArrayImgs.bits(img.getWidth(), img.getHeight());
        LoopBuilder.setImages(
                img.getChannel(ColorImage.RED),
                img.getChannel(ColorImage.GREEN),
                img.getChannel(ColorImage.BLUE),
                mask
        ).forEachPixel((r, g, b, m) -> m.set(band.contains(luminance(r.getRealDouble(), g.getRealDouble(), b.getRealDouble()), thresholds)));
        return mask;
    }
}
