package com.rerag.index;

public enum DistanceMetric {

    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            double dot = 0d;
            double aNorm = 0d;
            double bNorm = 0d;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
                aNorm += (double) a[i] * a[i];
                bNorm += (double) b[i] * b[i];
            }
            if (aNorm == 0d || bNorm == 0d) {
                return 1d;
            }
            return 1d - (dot / Math.sqrt(aNorm * bNorm));
        }
    },

    EUCLIDEAN {
        @Override
        public double distance(float[] a, float[] b) {
            double sum = 0d;
            for (int i = 0; i < a.length; i++) {
                double diff = (double) a[i] - b[i];
                sum += diff * diff;
            }
            return Math.sqrt(sum);
        }
    },

    INNER_PRODUCT {
        @Override
        public double distance(float[] a, float[] b) {
            double dot = 0d;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
            }
            return -dot;
        }
    };

    public abstract double distance(float[] a, float[] b);
}
