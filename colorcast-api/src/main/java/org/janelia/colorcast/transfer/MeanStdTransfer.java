package org.janelia.colorcast.transfer;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageAccessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per channel statistics transfer: the content channel is shifted and scaled so that it gets
 * the mean and the standard deviation of the style channel.
 */
public class MeanStdTransfer {

    private static final Logger LOG = LoggerFactory.getLogger(MeanStdTransfer.class);

    static class ChannelStats {
        final double mean;
        final double std;

        ChannelStats(double mean, double std) {
            this.mean = mean;
            this.std = std;
        }

        static ChannelStats of(RandomAccessibleInterval<FloatType> channel) {
            long n = 0;
            double sum = 0;
            for (FloatType px : Views.flatIterable(channel)) {
                sum += px.getRealDouble();
                n++;
            }
            double mean = n > 0 ? sum / n : 0;
            double sumSqDiff = 0;
            for (FloatType px : Views.flatIterable(channel)) {
                double diff = px.getRealDouble() - mean;
                sumSqDiff += diff * diff;
            }
            double std = n > 0 ? Math.sqrt(sumSqDiff / n) : 0;
            return new ChannelStats(mean, std);
        }
    }

    public static ColorImage transfer(ColorImage content, ColorImage style) {
        Img<FloatType> result = ArrayImgs.floats(content.getImageShape());
        for (int c = 0; c < ColorImage.NUM_CHANNELS; c++) {
            RandomAccessibleInterval<FloatType> contentChannel = content.getChannel(c);
            ChannelStats contentStats = ChannelStats.of(contentChannel);
            ChannelStats styleStats = ChannelStats.of(style.getChannel(c));
            double scale;
            if (contentStats.std == 0) {
                // flat channel - only shift it to the style mean
                LOG.debug("Channel {} of {} has no variance", c, content);
                scale = 1.;
            } else {
                scale = styleStats.std / contentStats.std;
            }
            Cursor<FloatType> contentCursor = Views.flatIterable(contentChannel).cursor();
            Cursor<FloatType> resultCursor = Views.flatIterable(Views.hyperSlice(result, 2, c)).cursor();
            while (contentCursor.hasNext()) {
                double v = (contentCursor.next().getRealDouble() - contentStats.mean) * scale + styleStats.mean;
                resultCursor.next().setReal(ImageAccessUtils.clip(v));
            }
        }
        return ColorImage.fromImg(result);
    }
}
