package org.janelia.colorcast.image.io;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.DecodedRaster;
import org.janelia.colorcast.image.ImageNormalizer;
import org.janelia.colorcast.image.ImageOrientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageReader {

    private static final Logger LOG = LoggerFactory.getLogger(ImageReader.class);

    /**
     * Decode the image file, apply its EXIF orientation and normalize it to an RGB image.
     *
     * @param source image file
     * @return normalized image
     * @throws IOException if the file cannot be read or its format is not recognized
     * @throws org.janelia.colorcast.image.InvalidImageException if the decoded image cannot be normalized
     */
    public static ColorImage readImage(Path source) throws IOException {
        long startTime = System.currentTimeMillis();
        DecodedRaster<FloatType> raster = readRaster(source);
        ImageOrientation orientation = readOrientation(source);
        ColorImage image = ImageNormalizer.normalize(raster, orientation);
        LOG.debug("Read {} from {} in {}ms", image, source, System.currentTimeMillis() - startTime);
        return image;
    }

    /**
     * Decode the image file into a [width, height, channels] raster without any normalization.
     */
    public static DecodedRaster<FloatType> readRaster(Path source) throws IOException {
        try (InputStream imageStream = Files.newInputStream(source)) {
            BufferedImage bufferedImage = ImageIO.read(imageStream);
            if (bufferedImage == null) {
                throw new IOException("Unsupported image format: " + source);
            }
            return fromBufferedImage(bufferedImage);
        }
    }

    public static DecodedRaster<FloatType> fromBufferedImage(BufferedImage bufferedImage) {
        Raster raster;
        if (bufferedImage.getColorModel() instanceof IndexColorModel) {
            // expand palette indexes to the actual colors
            IndexColorModel colorModel = (IndexColorModel) bufferedImage.getColorModel();
            raster = colorModel.convertToIntDiscrete(bufferedImage.getRaster(), colorModel.hasAlpha()).getRaster();
        } else {
            raster = bufferedImage.getRaster();
        }
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = raster.getNumBands();
        int planeSize = width * height;

        float[] samples = new float[planeSize * bands];
        float[] bandSamples = new float[planeSize];
        for (int b = 0; b < bands; b++) {
            raster.getSamples(0, 0, width, height, b, bandSamples);
            System.arraycopy(bandSamples, 0, samples, b * planeSize, planeSize);
        }
        Img<FloatType> img = ArrayImgs.floats(samples, width, height, bands);
        return new DecodedRaster<>(img, getMaxSampleValues(raster));
    }

    /**
     * Packed layouts such as 5-6-5 RGB use a different bit depth for every band.
     */
    private static double[] getMaxSampleValues(Raster raster) {
        int bands = raster.getNumBands();
        double[] maxSampleValues = new double[bands];
        int dataType = raster.getDataBuffer().getDataType();
        for (int b = 0; b < bands; b++) {
            if (dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE) {
                maxSampleValues[b] = 1.;
            } else {
                int bits = raster.getSampleModel().getSampleSize(b);
                maxSampleValues[b] = (double) ((1L << bits) - 1);
            }
        }
        return maxSampleValues;
    }

    /**
     * Read the orientation tag from the image metadata. Files without a readable tag are treated as not rotated.
     */
    public static ImageOrientation readOrientation(Path source) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(source.toFile());
            ExifIFD0Directory exifDirectory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (exifDirectory == null || !exifDirectory.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return ImageOrientation.NORMAL;
            }
            return ImageOrientation.fromExifCode(exifDirectory.getInt(ExifIFD0Directory.TAG_ORIENTATION));
        } catch (ImageProcessingException | MetadataException | IOException e) {
            LOG.debug("Could not read orientation from {}: {}", source, e.getMessage());
            return ImageOrientation.NORMAL;
        }
    }
}
