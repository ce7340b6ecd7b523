package org.janelia.colorcast.image;

/**
 * Raised when a decoded raster cannot be turned into a color image.
 */
public class InvalidImageException extends IllegalArgumentException {

    public enum ErrorKind {
        UNSUPPORTED_FORMAT,
        EMPTY_IMAGE
    }

    private final ErrorKind errorKind;

    public InvalidImageException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
