package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

/**
 * In place pixel arithmetic shared by the correction stages.
 */
class PixelOperations {

    static void checkSameSize(final FloatProcessor image,
                              final FloatProcessor other,
                              final String otherName)
            throws IllegalArgumentException {
        if ((image.getWidth() != other.getWidth()) || (image.getHeight() != other.getHeight())) {
            throw new IllegalArgumentException(otherName + " is " + other.getWidth() + "x" + other.getHeight() +
                                               " but image is " + image.getWidth() + "x" + image.getHeight());
        }
    }

    /**
     * @return number of replaced pixels.
     */
    static int replaceNonFinite(final FloatProcessor image,
                                final float value) {
        final float[] pixels = (float[]) image.getPixels();
        int count = 0;
        for (int i = 0; i < pixels.length; i++) {
            if (! Float.isFinite(pixels[i])) {
                pixels[i] = value;
                count++;
            }
        }
        return count;
    }

    static float max(final FloatProcessor image) {
        final float[] pixels = (float[]) image.getPixels();
        float max = -Float.MAX_VALUE;
        for (final float p : pixels) {
            if (p > max) {
                max = p;
            }
        }
        return max;
    }

    static void multiply(final FloatProcessor image,
                         final double factor) {
        final float[] pixels = (float[]) image.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (float) (pixels[i] * factor);
        }
    }

}
