package org.janelia.colorcast.image.io;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import net.imglib2.type.numeric.real.FloatType;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.DecodedRaster;
import org.janelia.colorcast.image.ImageNormalizer;
import org.janelia.colorcast.image.ImageOrientation;
import org.janelia.colorcast.image.TestImages;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ImageReaderTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void writeAndReadBackPNG() throws IOException {
        ColorImage img = TestImages.randomImage(13, 7, 1);
        Path imagePath = testFolder.getRoot().toPath().resolve("out/test.png");
        ImageWriter.writeImage(img, imagePath);
        assertTrue(Files.exists(imagePath));

        ColorImage readImg = ImageReader.readImage(imagePath);
        assertArrayEquals(img.getImageShape(), readImg.getImageShape());
        assertEquals(3, readImg.getSourceChannels());
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            for (int y = 0; y < 7; y++) {
                for (int x = 0; x < 13; x++) {
                    float expected = ImageWriter.to8Bit(img.getSample(x, y, c)) / 255f;
                    assertEquals(expected, readImg.getSample(x, y, c), 1e-6);
                }
            }
        }
    }

    @Test
    public void readGrayscaleImage() throws IOException {
        BufferedImage grayImage = new BufferedImage(4, 3, BufferedImage.TYPE_BYTE_GRAY);
        grayImage.getRaster().setSample(1, 2, 0, 51);
        File imageFile = testFolder.newFile("gray.png");
        ImageIO.write(grayImage, "png", imageFile);

        ColorImage img = ImageReader.readImage(imageFile.toPath());
        assertEquals(4, img.getWidth());
        assertEquals(3, img.getHeight());
        assertEquals(1, img.getSourceChannels());
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            assertEquals(0.2f, img.getSample(1, 2, c), 1e-6);
            assertEquals(0f, img.getSample(0, 0, c), 0);
        }
    }

    @Test
    public void sixteenBitSamplesAreScaledByTheirDepth() {
        BufferedImage grayImage = new BufferedImage(2, 1, BufferedImage.TYPE_USHORT_GRAY);
        grayImage.getRaster().setSample(0, 0, 0, 65535);
        grayImage.getRaster().setSample(1, 0, 0, 13107);
        DecodedRaster<FloatType> raster = ImageReader.fromBufferedImage(grayImage);
        assertEquals(65535, raster.getMaxSampleValue(0), 0);
        ColorImage img = ImageNormalizer.normalize(raster, ImageOrientation.NORMAL);
        assertEquals(1f, img.getSample(0, 0, ColorImage.RED), 1e-6);
        assertEquals(0.2f, img.getSample(1, 0, ColorImage.BLUE), 1e-6);
    }

    @Test
    public void packedSamplesAreScaledByTheDepthOfTheirBand() {
        BufferedImage packedImage = new BufferedImage(1, 1, BufferedImage.TYPE_USHORT_565_RGB);
        packedImage.getRaster().setSample(0, 0, 0, 16);
        packedImage.getRaster().setSample(0, 0, 1, 32);
        packedImage.getRaster().setSample(0, 0, 2, 16);
        DecodedRaster<FloatType> raster = ImageReader.fromBufferedImage(packedImage);
        assertEquals(31, raster.getMaxSampleValue(0), 0);
        assertEquals(63, raster.getMaxSampleValue(1), 0);
        assertEquals(31, raster.getMaxSampleValue(2), 0);
        ColorImage img = ImageNormalizer.normalize(raster, ImageOrientation.NORMAL);
        assertEquals(16f / 31, img.getSample(0, 0, ColorImage.RED), 1e-6);
        assertEquals(32f / 63, img.getSample(0, 0, ColorImage.GREEN), 1e-6);
        assertEquals(16f / 31, img.getSample(0, 0, ColorImage.BLUE), 1e-6);
    }

    @Test
    public void alphaIsDroppedWhenReading() {
        BufferedImage argbImage = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        argbImage.setRGB(0, 0, 0x00FF3300);
        DecodedRaster<FloatType> raster = ImageReader.fromBufferedImage(argbImage);
        assertEquals(4, raster.getChannels());
        ColorImage img = ImageNormalizer.normalize(raster, ImageOrientation.NORMAL);
        assertEquals(4, img.getSourceChannels());
        assertEquals(1f, img.getSample(0, 0, ColorImage.RED), 1e-6);
        assertEquals(0.2f, img.getSample(0, 0, ColorImage.GREEN), 1e-6);
        assertEquals(0f, img.getSample(0, 0, ColorImage.BLUE), 1e-6);
    }

    @Test
    public void imagesWithoutMetadataAreNotRotated() throws IOException {
        Path imagePath = testFolder.getRoot().toPath().resolve("plain.png");
        ImageWriter.writeImage(ColorImage.filled(3, 2, 0.1f, 0.2f, 0.3f), imagePath);
        assertEquals(ImageOrientation.NORMAL, ImageReader.readOrientation(imagePath));
    }

    @Test(expected = IOException.class)
    public void unknownFormat() throws IOException {
        File textFile = testFolder.newFile("not-an-image.png");
        Files.write(textFile.toPath(), "not an image".getBytes(StandardCharsets.UTF_8));
        ImageReader.readImage(textFile.toPath());
    }

    @Test
    public void outputFormatFromExtension() {
        assertEquals("png", ImageWriter.getFormatName("result.PNG"));
        assertEquals("jpg", ImageWriter.getFormatName("result.jpeg"));
        assertEquals("jpg", ImageWriter.getFormatName("result.jpg"));
        assertEquals("bmp", ImageWriter.getFormatName("result.bmp"));
        assertEquals("tiff", ImageWriter.getFormatName("result.tif"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedOutputFormat() {
        ImageWriter.getFormatName("result.gif");
    }

    @Test
    public void eightBitConversionTruncates() {
        assertEquals(255, ImageWriter.to8Bit(1.0));
        assertEquals(127, ImageWriter.to8Bit(0.5));
        assertEquals(0, ImageWriter.to8Bit(-0.2));
        assertEquals(255, ImageWriter.to8Bit(1.7));
    }
}
