package org.janelia.colorcast.cache;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.tuple.Pair;
import org.janelia.colorcast.image.ColorImage;
import org.janelia.colorcast.image.ImageNormalizer;
import org.janelia.colorcast.transfer.ColorTransferFunction;
import org.janelia.colorcast.transfer.ColorTransfers;
import org.janelia.colorcast.transfer.TransferMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the last full strength transfer result so that only the blend has to be recomputed
 * when the intensity changes. The cache has a single slot and it is not thread safe.
 */
public class TransferResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(TransferResultCache.class);

    private static class TransferResultKey {
        private final long contentId;
        private final long styleId;
        private final TransferMethod method;

        private TransferResultKey(long contentId, long styleId, TransferMethod method) {
            this.contentId = contentId;
            this.styleId = styleId;
            this.method = method;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;

            if (o == null || getClass() != o.getClass()) return false;

            TransferResultKey that = (TransferResultKey) o;

            return new EqualsBuilder()
                    .append(contentId, that.contentId)
                    .append(styleId, that.styleId)
                    .append(method, that.method)
                    .isEquals();
        }

        @Override
        public int hashCode() {
            return new HashCodeBuilder(17, 37)
                    .append(contentId)
                    .append(styleId)
                    .append(method)
                    .toHashCode();
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("contentId", contentId)
                    .append("styleId", styleId)
                    .append("method", method)
                    .toString();
        }
    }

    private final ColorTransferFunction transferFunction;
    private TransferResultKey cachedKey;
    private ColorImage cachedResult;

    public TransferResultCache() {
        this(ColorTransfers::transfer);
    }

    public TransferResultCache(ColorTransferFunction transferFunction) {
        this.transferFunction = transferFunction;
    }

    /**
     * Return the transfer result for the given images and method, computing it only if the
     * stored result was produced from a different combination.
     *
     * @param content content image
     * @param style style image - it is resized to the content size before the transfer if needed
     * @param method transfer method
     * @return full strength transfer result with the content's shape. On a hit this is the stored
     * instance itself, so it must be treated as read-only; {@link ColorImage#copy()} it before writing.
     */
    public ColorImage getOrCompute(ColorImage content, ColorImage style, TransferMethod method) {
        TransferResultKey key = new TransferResultKey(content.getImageId(), style.getImageId(), method);
        if (cachedResult != null && key.equals(cachedKey)) {
            LOG.debug("Transfer result cache hit for {}", key);
            return cachedResult;
        }
        LOG.debug("Transfer result cache miss for {}", key);
        Pair<ColorImage, ColorImage> reconciledImages = ImageNormalizer.reconcileDimensions(content, style);
        ColorImage result = transferFunction.transfer(reconciledImages.getLeft(), reconciledImages.getRight(), method);
        cachedKey = key;
        cachedResult = result;
        return result;
    }

    public boolean hasCachedResult() {
        return cachedResult != null;
    }

    public void invalidate() {
        if (cachedResult != null) {
            LOG.debug("Invalidate cached transfer result for {}", cachedKey);
        }
        cachedKey = null;
        cachedResult = null;
    }
}
