package org.janelia.colorcast.image;

import java.util.function.Supplier;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.BiConverter;
import net.imglib2.converter.read.BiConvertedRandomAccessibleInterval;
import net.imglib2.type.Type;
import net.imglib2.view.Views;

public class ImageTransforms {

    /**
     * Re-arrange the first two axes so that the pixel order matches the visual orientation.
     * Any other axis, such as the channel axis, is left alone.
     */
    public static <T> RandomAccessibleInterval<T> applyOrientation(RandomAccessibleInterval<T> img, ImageOrientation orientation) {
        RandomAccessibleInterval<T> orientedImg;
        switch (orientation) {
            case MIRROR_HORIZONTAL:
                orientedImg = Views.invertAxis(img, 0);
                break;
            case ROTATE_180:
                orientedImg = Views.invertAxis(Views.invertAxis(img, 0), 1);
                break;
            case MIRROR_VERTICAL:
                orientedImg = Views.invertAxis(img, 1);
                break;
            case TRANSPOSE:
                orientedImg = Views.permute(img, 0, 1);
                break;
            case ROTATE_90_CW:
                orientedImg = Views.invertAxis(Views.permute(img, 0, 1), 0);
                break;
            case TRANSVERSE:
                orientedImg = Views.invertAxis(Views.invertAxis(Views.permute(img, 0, 1), 0), 1);
                break;
            case ROTATE_270_CW:
                orientedImg = Views.invertAxis(Views.permute(img, 0, 1), 1);
                break;
            default:
                orientedImg = img;
                break;
        }
        return Views.zeroMin(orientedImg);
    }

    public static <R extends Type<R>, S extends Type<S>, T extends Type<T>>
    RandomAccessibleInterval<T> createBinaryPixelOperation(RandomAccessibleInterval<R> img1,
                                                           RandomAccessibleInterval<S> img2,
                                                           BiConverter<? super R, ? super S, ? super T> op,
                                                           T resultPxType
    ) {
        Supplier<BiConverter<? super R, ? super S, ? super T>> pixelConverterSupplier = () -> op;
        Supplier<T> resultPxTypeSupplier = () -> resultPxType.createVariable();

        return new BiConvertedRandomAccessibleInterval<R, S, T>(
                img1,
                img2,
                pixelConverterSupplier,
                resultPxTypeSupplier
        );
    }

}
