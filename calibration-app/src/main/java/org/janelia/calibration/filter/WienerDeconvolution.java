package org.janelia.calibration.filter;

import ij.process.FloatProcessor;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.janelia.calibration.noise.NoiseEstimation;
import org.janelia.calibration.spec.CoefficientArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wiener-Hunt deconvolution with a Laplacian regularization operator.
 *
 * <pre>
 *     X = conj(H) * Y / (|H|^2 + balance * |L|^2)
 * </pre>
 *
 * Images are edge padded to power of two dimensions for the FFT and cropped back afterwards.
 * The point spread function is centered on the origin by circular shifting.
 *
 * @author Eric Trautman
 */
public class WienerDeconvolution {

    private static final double[][] LAPLACIAN = {
            { 0, -1,  0},
            {-1,  4, -1},
            { 0, -1,  0}
    };

    private final FastFourierTransformer transformer;

    public WienerDeconvolution() {
        this.transformer = new FastFourierTransformer(DftNormalization.STANDARD);
    }

    /**
     * @param  image    image to deconvolve (not modified).
     * @param  psf      two dimensional point spread function (rows x columns).
     * @param  balance  regularization weight (larger values give smoother results).
     *
     * @return deconvolved image with the original dimensions.
     */
    public FloatProcessor deconvolve(final FloatProcessor image,
                                     final CoefficientArray psf,
                                     final double balance)
            throws IllegalArgumentException {

        if (psf.getNumberOfDimensions() != 2) {
            throw new IllegalArgumentException("point spread function must be two dimensional but has shape " +
                                               psf.describe());
        }
        if (balance < 0) {
            throw new IllegalArgumentException("balance must not be negative but is " + balance);
        }

        final int width = image.getWidth();
        final int height = image.getHeight();
        final int paddedWidth = nextPowerOfTwo(Math.max(width, psf.getColumns()));
        final int paddedHeight = nextPowerOfTwo(Math.max(height, psf.getRows()));

        final Complex[][] y = fft2(padImage(image, paddedWidth, paddedHeight), TransformType.FORWARD);
        final Complex[][] h = fft2(centeredKernel(psf.getData(), psf.getRows(), psf.getColumns(),
                                                  paddedWidth, paddedHeight, true),
                                   TransformType.FORWARD);
        final Complex[][] l = fft2(centeredKernel(flatten(LAPLACIAN), 3, 3, paddedWidth, paddedHeight, false),
                                   TransformType.FORWARD);

        for (int r = 0; r < paddedHeight; r++) {
            for (int c = 0; c < paddedWidth; c++) {
                final Complex hrc = h[r][c];
                final double lAbs = l[r][c].abs();
                final double hAbs = hrc.abs();
                final double denominator = (hAbs * hAbs) + (balance * lAbs * lAbs);
                if (denominator == 0) {
                    y[r][c] = Complex.ZERO;
                } else {
                    y[r][c] = hrc.conjugate().multiply(y[r][c]).divide(denominator);
                }
            }
        }

        final Complex[][] x = fft2(y, TransformType.INVERSE);

        final FloatProcessor result = new FloatProcessor(width, height);
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                result.setf(c, r, (float) x[r][c].getReal());
            }
        }
        return result;
    }

    /**
     * Deconvolves with a balance estimated from the ratio of noise variance to signal variance.
     */
    public FloatProcessor deconvolveUnsupervised(final FloatProcessor image,
                                                 final CoefficientArray psf) {
        final double balance = estimateBalance(image);
        LOG.debug("deconvolveUnsupervised: using estimated balance {}", balance);
        return deconvolve(image, psf, balance);
    }

    static double estimateBalance(final FloatProcessor image) {
        final float[] pixels = (float[]) image.getPixels();
        final double[] values = new double[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            values[i] = pixels[i];
        }
        final double signalVariance = StatUtils.populationVariance(values);
        final double sigma = NoiseEstimation.estimateSigma(image);
        if (signalVariance <= 0) {
            return 1.0;
        }
        return (sigma * sigma) / signalVariance;
    }

    private Complex[][] fft2(final Complex[][] data,
                             final TransformType type) {
        final int rows = data.length;
        final int columns = data[0].length;

        final Complex[][] rowTransformed = new Complex[rows][];
        for (int r = 0; r < rows; r++) {
            rowTransformed[r] = transformer.transform(data[r], type);
        }

        final Complex[][] result = new Complex[rows][columns];
        final Complex[] column = new Complex[rows];
        for (int c = 0; c < columns; c++) {
            for (int r = 0; r < rows; r++) {
                column[r] = rowTransformed[r][c];
            }
            final Complex[] transformedColumn = transformer.transform(column, type);
            for (int r = 0; r < rows; r++) {
                result[r][c] = transformedColumn[r];
            }
        }
        return result;
    }

    private static Complex[][] padImage(final FloatProcessor image,
                                        final int paddedWidth,
                                        final int paddedHeight) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final Complex[][] padded = new Complex[paddedHeight][paddedWidth];
        for (int r = 0; r < paddedHeight; r++) {
            final int sourceRow = Math.min(r, height - 1);
            for (int c = 0; c < paddedWidth; c++) {
                final int sourceColumn = Math.min(c, width - 1);
                padded[r][c] = new Complex(image.getf(sourceColumn, sourceRow), 0);
            }
        }
        return padded;
    }

    private static Complex[][] centeredKernel(final double[] kernel,
                                              final int kernelRows,
                                              final int kernelColumns,
                                              final int paddedWidth,
                                              final int paddedHeight,
                                              final boolean normalize) {
        double sum = 0;
        for (final double k : kernel) {
            sum += k;
        }
        final double scale = (normalize && (sum != 0)) ? 1.0 / sum : 1.0;

        final double[][] shifted = new double[paddedHeight][paddedWidth];
        final int centerRow = kernelRows / 2;
        final int centerColumn = kernelColumns / 2;
        for (int r = 0; r < kernelRows; r++) {
            final int targetRow = Math.floorMod(r - centerRow, paddedHeight);
            for (int c = 0; c < kernelColumns; c++) {
                final int targetColumn = Math.floorMod(c - centerColumn, paddedWidth);
                shifted[targetRow][targetColumn] += kernel[(r * kernelColumns) + c] * scale;
            }
        }

        final Complex[][] result = new Complex[paddedHeight][paddedWidth];
        for (int r = 0; r < paddedHeight; r++) {
            for (int c = 0; c < paddedWidth; c++) {
                result[r][c] = new Complex(shifted[r][c], 0);
            }
        }
        return result;
    }

    private static double[] flatten(final double[][] kernel) {
        final int rows = kernel.length;
        final int columns = kernel[0].length;
        final double[] flat = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(kernel[r], 0, flat, r * columns, columns);
        }
        return flat;
    }

    static int nextPowerOfTwo(final int value) {
        int power = 1;
        while (power < value) {
            power <<= 1;
        }
        return power;
    }

    private static final Logger LOG = LoggerFactory.getLogger(WienerDeconvolution.class);
}
