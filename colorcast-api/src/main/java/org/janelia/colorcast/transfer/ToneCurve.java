package org.janelia.colorcast.transfer;

/**
 * Monotonic [0, 1] to [0, 1] curves applied on top of a histogram matched image.
 * All curves map 0 to 0 and 1 to 1.
 */
public enum ToneCurve {
    LINEAR {
        @Override
        public double apply(double x) {
            return x;
        }
    },
    S_CURVE {
        @Override
        public double apply(double x) {
            return 0.5 + 0.5 * Math.sin(Math.PI * (x - 0.5));
        }
    },
    CONTRAST {
        @Override
        public double apply(double x) {
            return Math.pow(x, CONTRAST_EXPONENT);
        }
    };

    static final double CONTRAST_EXPONENT = 0.8;

    public abstract double apply(double x);
}
