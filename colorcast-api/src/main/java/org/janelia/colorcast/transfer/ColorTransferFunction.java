package org.janelia.colorcast.transfer;

import org.janelia.colorcast.image.ColorImage;

/**
 * Computes the full strength transfer result for a content and a style image of the same shape.
 */
@FunctionalInterface
public interface ColorTransferFunction {
    ColorImage transfer(ColorImage content, ColorImage style, TransferMethod method);
}
