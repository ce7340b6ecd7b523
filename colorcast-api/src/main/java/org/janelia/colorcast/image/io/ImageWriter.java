package org.janelia.colorcast.image.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import net.imglib2.RandomAccess;
import net.imglib2.type.numeric.real.FloatType;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ImageWriter.class);

    /**
     * Write the image as 8 bit RGB. The format is derived from the file extension.
     *
     * @throws IllegalArgumentException if the extension does not name a supported format
     */
    public static void writeImage(ColorImage image, Path target) throws IOException {
        String formatName = getFormatName(target.getFileName().toString());
        Path parentDir = target.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        BufferedImage bufferedImage = toBufferedImage(image);
        try (OutputStream outputStream = Files.newOutputStream(target)) {
            if (!ImageIO.write(bufferedImage, formatName, outputStream)) {
                throw new IOException("No writer available for " + formatName + " images");
            }
        }
        LOG.info("Saved {}x{} image to {}", image.getWidth(), image.getHeight(), target);
    }

    static String getFormatName(String fileName) {
        String extension = StringUtils.lowerCase(FilenameUtils.getExtension(fileName));
        if (StringUtils.isBlank(extension)) {
            throw new IllegalArgumentException("Cannot determine the image format of " + fileName);
        }
        switch (extension) {
            case "png":
                return "png";
            case "jpg":
            case "jpeg":
                return "jpg";
            case "bmp":
                return "bmp";
            case "tif":
            case "tiff":
                return "tiff";
            default:
                throw new IllegalArgumentException("Unsupported image format: " + extension);
        }
    }

    public static BufferedImage toBufferedImage(ColorImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage bufferedImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        RandomAccess<FloatType> pixelAccess = image.getPixels().randomAccess();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = 0;
                for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
                    float v = pixelAccess.setPositionAndGet(x, y, c).get();
                    rgb = (rgb << 8) | to8Bit(v);
                }
                bufferedImage.setRGB(x, y, rgb);
            }
        }
        return bufferedImage;
    }

    static int to8Bit(double v) {
        return (int) (ImageAccessUtils.clip(v) * 255);
    }
}
