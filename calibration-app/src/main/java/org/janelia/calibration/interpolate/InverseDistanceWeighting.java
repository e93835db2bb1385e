package org.janelia.calibration.interpolate;

import ij.process.FloatProcessor;

/**
 * Inverse distance weighted interpolation, with weights {@code 1 / distance^power}.
 *
 * @author Eric Trautman
 */
public class InverseDistanceWeighting {

    public static final int DEFAULT_KERNEL = 15;
    public static final double DEFAULT_POWER = 2.0;

    private final double power;

    public InverseDistanceWeighting() {
        this(DEFAULT_POWER);
    }

    public InverseDistanceWeighting(final double power) {
        this.power = power;
    }

    /**
     * Replaces every masked pixel with the weighted mean of the unmasked pixels within
     * {@code +-kernel} pixels (in place).
     * Masked pixels without unmasked neighbors keep their value.
     *
     * @param  grid    values to fill.
     * @param  mask    true for pixels to replace (row major, same size as the grid).
     * @param  kernel  neighborhood radius.
     * @param  fx      distance scale in x.
     * @param  fy      distance scale in y.
     *
     * @return number of replaced pixels.
     */
    public int fillMasked(final FloatProcessor grid,
                          final boolean[] mask,
                          final int kernel,
                          final double fx,
                          final double fy)
            throws IllegalArgumentException {

        final int width = grid.getWidth();
        final int height = grid.getHeight();
        if (mask.length != width * height) {
            throw new IllegalArgumentException("mask has " + mask.length + " values but grid has " +
                                               (width * height) + " pixels");
        }

        final int kernelSize = (2 * kernel) + 1;
        final double[] weights = new double[kernelSize * kernelSize];
        for (int yi = -kernel; yi <= kernel; yi++) {
            for (int xi = -kernel; xi <= kernel; xi++) {
                final double distanceSquared = (fx * xi) * (fx * xi) + (fy * yi) * (fy * yi);
                if (distanceSquared > 0) {
                    weights[((yi + kernel) * kernelSize) + xi + kernel] = 1.0 / Math.pow(distanceSquared, 0.5 * power);
                }
            }
        }

        // read neighbors from the unmodified values
        final float[] source = ((float[]) grid.getPixels()).clone();
        int replacedCount = 0;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (mask[(y * width) + x]) {
                    double weightSum = 0;
                    double valueSum = 0;
                    for (int ny = Math.max(0, y - kernel); ny <= Math.min(height - 1, y + kernel); ny++) {
                        for (int nx = Math.max(0, x - kernel); nx <= Math.min(width - 1, x + kernel); nx++) {
                            if (! mask[(ny * width) + nx]) {
                                final double w = weights[((ny - y + kernel) * kernelSize) + nx - x + kernel];
                                weightSum += w;
                                valueSum += w * source[(ny * width) + nx];
                            }
                        }
                    }
                    if (weightSum > 0) {
                        grid.setf(x, y, (float) (valueSum / weightSum));
                        replacedCount++;
                    }
                }
            }
        }

        return replacedCount;
    }

    /**
     * Interpolates scattered points onto every pixel of a grid.
     * Pixels located exactly on a point take that point's value.
     *
     * @param  xs      point x coordinates.
     * @param  ys      point y coordinates.
     * @param  values  point values.
     * @param  width   grid width.
     * @param  height  grid height.
     *
     * @return interpolated grid.
     */
    public FloatProcessor interpolateScattered(final double[] xs,
                                               final double[] ys,
                                               final double[] values,
                                               final int width,
                                               final int height)
            throws IllegalArgumentException {

        if ((xs.length != ys.length) || (xs.length != values.length) || (xs.length == 0)) {
            throw new IllegalArgumentException("x, y and value arrays must be non-empty and of equal length");
        }

        final FloatProcessor grid = new FloatProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double weightSum = 0;
                double valueSum = 0;
                boolean onPoint = false;
                for (int k = 0; k < values.length; k++) {
                    final double dx = xs[k] - x;
                    final double dy = ys[k] - y;
                    final double distanceSquared = (dx * dx) + (dy * dy);
                    if (distanceSquared == 0) {
                        grid.setf(x, y, (float) values[k]);
                        onPoint = true;
                        break;
                    }
                    final double w = 1.0 / Math.pow(distanceSquared, 0.5 * power);
                    weightSum += w;
                    valueSum += w * values[k];
                }
                if (! onPoint) {
                    grid.setf(x, y, (float) (valueSum / weightSum));
                }
            }
        }
        return grid;
    }

}
