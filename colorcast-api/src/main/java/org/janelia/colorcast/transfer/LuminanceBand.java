package org.janelia.colorcast.transfer;

/**
 * Tonal regions selected by luminance.
 */
public enum LuminanceBand {
    SHADOWS,
    MIDTONES,
    HIGHLIGHTS,
    FULL;

    public boolean contains(double luminance, LuminanceThresholds thresholds) {
        switch (this) {
            case SHADOWS:
                return luminance < thresholds.getShadowThreshold();
            case MIDTONES:
                return luminance >= thresholds.getShadowThreshold() && luminance <= thresholds.getHighlightThreshold();
            case HIGHLIGHTS:
                return luminance > thresholds.getHighlightThreshold();
            default:
                return true;
        }
    }
}
