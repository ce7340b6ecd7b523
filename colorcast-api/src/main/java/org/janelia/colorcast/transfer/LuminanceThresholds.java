package org.janelia.colorcast.transfer;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Luminance limits that separate shadows, midtones and highlights.
 */
public class LuminanceThresholds {

    public static final LuminanceThresholds DEFAULT = new LuminanceThresholds(0.3, 0.7);

    private final double shadowThreshold;
    private final double highlightThreshold;

    public LuminanceThresholds(double shadowThreshold, double highlightThreshold) {
        Preconditions.checkArgument(shadowThreshold >= 0 && shadowThreshold <= 1,
                "Shadow threshold must be in [0, 1]: %s", shadowThreshold);
        Preconditions.checkArgument(highlightThreshold >= shadowThreshold && highlightThreshold <= 1,
                "Highlight threshold must be in [%s, 1]: %s", shadowThreshold, highlightThreshold);
        this.shadowThreshold = shadowThreshold;
        this.highlightThreshold = highlightThreshold;
    }

    public double getShadowThreshold() {
        return shadowThreshold;
    }

    public double getHighlightThreshold() {
        return highlightThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        LuminanceThresholds that = (LuminanceThresholds) o;

        return new EqualsBuilder()
                .append(shadowThreshold, that.shadowThreshold)
                .append(highlightThreshold, that.highlightThreshold)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(shadowThreshold)
                .append(highlightThreshold)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("shadows", shadowThreshold)
                .append("highlights", highlightThreshold)
                .toString();
    }
}
