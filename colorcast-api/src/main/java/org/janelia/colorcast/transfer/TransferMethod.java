package org.janelia.colorcast.transfer;

import org.apache.commons.lang3.StringUtils;

/**
 * The available color transfer methods.
 */
public enum TransferMethod {
    HISTOGRAM("histogram", "Histogram Matching"),
    MEAN_STD("meanstd", "Mean/Std Transfer"),
    LUT_LINEAR("lut_linear", "LUT + Linear Curve"),
    LUT_SCURVE("lut_scurve", "LUT + S-Curve"),
    LUT_CONTRAST("lut_contrast", "LUT + Contrast"),
    SELECTIVE_SHADOWS("selective_shadows", "Selective: Shadows"),
    SELECTIVE_MIDTONES("selective_midtones", "Selective: Midtones"),
    SELECTIVE_HIGHLIGHTS("selective_highlights", "Selective: Highlights");

    private final String id;
    private final String displayName;

    TransferMethod(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static TransferMethod fromId(String id) {
        for (TransferMethod method : values()) {
            if (StringUtils.equalsIgnoreCase(method.id, StringUtils.trim(id))) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown transfer method: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
