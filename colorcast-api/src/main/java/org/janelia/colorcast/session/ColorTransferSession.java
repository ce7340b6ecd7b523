package org.janelia.colorcast.session;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import org.janelia.colorcast.blend.IntensityBlender;
import org.janelia.colorcast.cache.TransferResultCache;
import org.janelia.colorcast.config.Config;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.transfer.ColorTransferFunction;
import org.janelia.colorcast.transfer.ColorTransfers;
import org.janelia.colorcast.transfer.LuminanceThresholds;
import org.janelia.colorcast.transfer.TransferMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the state of one interactive color transfer: the source images, the selected method,
 * the intensity and the cached full strength result. Sessions are independent from each other
 * and they are not thread safe.
 */
public class ColorTransferSession {

    private static final Logger LOG = LoggerFactory.getLogger(ColorTransferSession.class);

    public static final double DEFAULT_INTENSITY = 0.85;

    private final TransferResultCache resultCache;
    private ColorImage contentImage;
    private ColorImage styleImage;
    private TransferMethod transferMethod;
    private double intensity;
    private ColorImage resultImage;

    public ColorTransferSession() {
        this(TransferMethod.HISTOGRAM, DEFAULT_INTENSITY, LuminanceThresholds.DEFAULT);
    }

    public ColorTransferSession(TransferMethod transferMethod, double intensity, LuminanceThresholds thresholds) {
        this(transferMethod, intensity,
                (content, style, method) -> ColorTransfers.transfer(content, style, method, thresholds));
    }

    public ColorTransferSession(TransferMethod transferMethod, double intensity, ColorTransferFunction transferFunction) {
        this.resultCache = new TransferResultCache(transferFunction);
        setTransferMethod(transferMethod);
        setIntensity(intensity);
    }

    /**
     * Create a session using the configured default method, intensity and luminance thresholds.
     */
    public static ColorTransferSession fromConfig(Config config) {
        TransferMethod method = TransferMethod.fromId(
                config.getStringPropertyValue("Transfer.DefaultMethod", TransferMethod.HISTOGRAM.getId()));
        double intensity = config.getDoublePropertyValue("Transfer.DefaultIntensity", DEFAULT_INTENSITY);
        LuminanceThresholds thresholds = new LuminanceThresholds(
                config.getDoublePropertyValue("Transfer.ShadowThreshold", LuminanceThresholds.DEFAULT.getShadowThreshold()),
                config.getDoublePropertyValue("Transfer.HighlightThreshold", LuminanceThresholds.DEFAULT.getHighlightThreshold()));
        return new ColorTransferSession(method, intensity, thresholds);
    }

    public ColorImage getContentImage() {
        return contentImage;
    }

    public void setContentImage(ColorImage contentImage) {
        Preconditions.checkArgument(contentImage != null, "Content image cannot be null");
        this.contentImage = contentImage;
        this.resultImage = null;
        resultCache.invalidate();
        LOG.debug("Set content image {}", contentImage);
    }

    public ColorImage getStyleImage() {
        return styleImage;
    }

    public void setStyleImage(ColorImage styleImage) {
        Preconditions.checkArgument(styleImage != null, "Style image cannot be null");
        this.styleImage = styleImage;
        this.resultImage = null;
        resultCache.invalidate();
        LOG.debug("Set style image {}", styleImage);
    }

    public TransferMethod getTransferMethod() {
        return transferMethod;
    }

    public void setTransferMethod(TransferMethod transferMethod) {
        Preconditions.checkArgument(transferMethod != null, "Transfer method cannot be null");
        if (this.transferMethod != transferMethod) {
            this.transferMethod = transferMethod;
            this.resultImage = null;
            resultCache.invalidate();
        }
    }

    public double getIntensity() {
        return intensity;
    }

    public void setIntensity(double intensity) {
        Preconditions.checkArgument(!Double.isNaN(intensity), "Intensity must be a number");
        this.intensity = Math.max(0., Math.min(1., intensity));
    }

    public boolean hasContentImage() {
        return contentImage != null;
    }

    public boolean hasStyleImage() {
        return styleImage != null;
    }

    /**
     * Compute the transfer, or reuse the cached one, and blend it with the content at the current intensity.
     *
     * @return the blended result
     * @throws IllegalStateException if the content or the style image is missing
     */
    public ColorImage applyTransfer() {
        Preconditions.checkState(contentImage != null, "No content image has been set");
        Preconditions.checkState(styleImage != null, "No style image has been set");
        ColorImage transferred = resultCache.getOrCompute(contentImage, styleImage, transferMethod);
        resultImage = IntensityBlender.blend(contentImage, transferred, intensity);
        return resultImage;
    }

    /**
     * @return the last blended result or null if there is none for the current images and method
     */
    @Nullable
    public ColorImage getResultImage() {
        return resultImage;
    }

    public boolean hasTransferResult() {
        return resultCache.hasCachedResult();
    }

    public void clear() {
        contentImage = null;
        styleImage = null;
        resultImage = null;
        resultCache.invalidate();
        LOG.debug("Session cleared");
    }
}
