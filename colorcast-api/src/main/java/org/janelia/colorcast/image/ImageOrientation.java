package org.janelia.colorcast.image;

/**
 * Orientation of the stored pixels relative to the visual image, using the EXIF orientation codes.
 */
public enum ImageOrientation {
    NORMAL(1),
    MIRROR_HORIZONTAL(2),
    ROTATE_180(3),
    MIRROR_VERTICAL(4),
    TRANSPOSE(5),
    ROTATE_90_CW(6),
    TRANSVERSE(7),
    ROTATE_270_CW(8);

    private final int exifCode;

    ImageOrientation(int exifCode) {
        this.exifCode = exifCode;
    }

    public int getExifCode() {
        return exifCode;
    }

    /**
     * Unknown codes are treated as {@link #NORMAL}.
     */
    public static ImageOrientation fromExifCode(int exifCode) {
        for (ImageOrientation orientation : values()) {
            if (orientation.exifCode == exifCode) {
                return orientation;
            }
        }
        return NORMAL;
    }
}
