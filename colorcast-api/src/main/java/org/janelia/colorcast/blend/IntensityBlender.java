package org.janelia.colorcast.blend;

import java.util.Arrays;

import com.google.common.base.Preconditions;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageAccessUtils;
import org.janelia.colorcast.image.ImageTransforms;

/**
 * Linear interpolation between the content image and the full strength transfer result.
 */
public class IntensityBlender {

    /**
     * Blend the two images as content * (1 - t) + transferred * t.
     *
     * @param content original content image
     * @param transferred full strength transfer result
     * @param intensity blend factor - values outside [0, 1] are clamped
     * @return a new blended image; t = 0 yields the content samples and t = 1 the transferred samples
     */
    public static ColorImage blend(ColorImage content, ColorImage transferred, double intensity) {
        Preconditions.checkArgument(!Double.isNaN(intensity), "Intensity must be a number");
        if (content.hasDifferentShape(transferred)) {
            throw new IllegalArgumentException(String.format(
                    "Cannot blend images with different shapes: %s and %s",
                    Arrays.toString(content.getImageShape()), Arrays.toString(transferred.getImageShape())));
        }
        double t = ImageAccessUtils.clip(intensity);
        RandomAccessibleInterval<FloatType> blendedPixels = ImageTransforms.createBinaryPixelOperation(
                content.getPixels(),
                transferred.getPixels(),
                (c, s, r) -> r.set((float) (c.getRealDouble() * (1 - t) + s.getRealDouble() * t)),
                new FloatType()
        );
        return ColorImage.fromImg(ImageAccessUtils.materializeAsNativeImg(blendedPixels, new FloatType()));
    }
}
