/**
 *
 *	Copyright (C) 2008 Verena Kaynig.
 *
 *	This program is free software; you can redistribute it and/or
 *	modify it under the terms of the GNU General Public License
 *	as published by the Free Software Foundation (http://www.gnu.org/licenses/gpl.txt )
 *
 *	This program is distributed in the hope that it will be useful,
 *	but WITHOUT ANY WARRANTY; without even the implied warranty of
 *	MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *	GNU General Public License for more details.
 *
 *	You should have received a copy of the GNU General Public License
 *	along with this program; if not, write to the Free Software
 *	Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.calibration.lens;

import Jama.Matrix;
import ij.process.FloatProcessor;

import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Path;

import org.janelia.calibration.json.JsonUtils;
import org.janelia.calibration.spec.LensCoefficients;
import org.janelia.calibration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lens distortion represented by an explicit polynomial kernel expansion.
 * The transform maps a position in the corrected image to the position in the captured (distorted) image
 * where its intensity was recorded, so correction only needs forward evaluation.
 *
 * @author Verena Kaynig
 */
public class PolynomialLensDistortion {

    private double[][] beta;
    private double[] normMean;
    private double[] normVar;
    private final int dimension;
    private final int length;
    private final int width;
    private final int height;
    private Double rmsError;

    public PolynomialLensDistortion(final int dimension,
                                    final int width,
                                    final int height) {
        this.dimension = dimension;
        this.length = (dimension + 1) * (dimension + 2) / 2;
        this.width = width;
        this.height = height;
        this.rmsError = null;

        this.beta = new double[length][2];
        resetNormalization();
    }

    public PolynomialLensDistortion(final LensCoefficients coefficients) {
        this.dimension = coefficients.getDimension();
        this.length = (dimension + 1) * (dimension + 2) / 2;
        this.width = coefficients.getWidth();
        this.height = coefficients.getHeight();
        this.rmsError = coefficients.getRmsError();

        if ((coefficients.getBeta() == null) || (coefficients.getBeta().length != length)) {
            throw new IllegalArgumentException("order " + dimension + " lens model requires " + length +
                                               " coefficient pairs");
        }

        this.beta = new double[length][];
        for (int i = 0; i < length; i++) {
            this.beta[i] = coefficients.getBeta()[i].clone();
        }
        this.normMean = coefficients.getNormMean().clone();
        this.normVar = coefficients.getNormVar().clone();
    }

    /**
     * @return model that leaves every position unchanged.
     */
    public static PolynomialLensDistortion identity(final int dimension,
                                                    final int width,
                                                    final int height) {
        final PolynomialLensDistortion lens = new PolynomialLensDistortion(dimension, width, height);
        lens.beta[0][0] = 1.0; // x term
        lens.beta[1][1] = 1.0; // y term
        return lens;
    }

    public static PolynomialLensDistortion load(final Path path)
            throws IOException {
        final String json = FileUtil.readText(path);
        try {
            return new PolynomialLensDistortion(JSON_HELPER.fromJson(json));
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse lens model from " + path, e);
        }
    }

    public void save(final Path path)
            throws IOException {
        FileUtil.saveJsonFile(path, getCoefficients());
    }

    public LensCoefficients getCoefficients() {
        final double[][] betaCopy = new double[length][];
        for (int i = 0; i < length; i++) {
            betaCopy[i] = beta[i].clone();
        }
        return new LensCoefficients(dimension, betaCopy, normMean.clone(), normVar.clone(), width, height, rmsError);
    }

    public int getDimension() {
        return dimension;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Double getRmsError() {
        return rmsError;
    }

    /**
     * Fits this model with ridge regularized least squares.
     *
     * @param  corrected  undistorted positions ([n][2]).
     * @param  distorted  corresponding positions in the captured image ([n][2]).
     * @param  lambda     regularization weight.
     */
    public void fit(final double[][] corrected,
                    final double[][] distorted,
                    final double lambda) {

        if (corrected.length != distorted.length) {
            throw new IllegalArgumentException("position lists differ in length");
        }
        if (corrected.length < length) {
            throw new IllegalArgumentException("at least " + length + " positions are required to fit an order " +
                                               dimension + " model");
        }

        final double[][] expandedX = kernelExpandMatrixNormalize(corrected);

        final Matrix phiX = new Matrix(expandedX, expandedX.length, length);
        final Matrix phiXTransp = phiX.transpose();

        final Matrix phiXProduct = phiXTransp.times(phiX);

        final int l = phiXProduct.getRowDimension();
        final double lambda2 = 2 * lambda;

        for (int i = 0; i < l; ++i) {
            phiXProduct.set(i, i, phiXProduct.get(i, i) + lambda2);
        }

        final Matrix phiXPseudoInverse = phiXProduct.inverse();
        final Matrix phiXProduct2 = phiXPseudoInverse.times(phiXTransp);
        final Matrix betaMatrix = phiXProduct2.times(new Matrix(distorted, distorted.length, 2));

        beta = betaMatrix.getArray();

        double sumOfSquares = 0;
        for (int i = 0; i < corrected.length; i++) {
            final double[] p = apply(corrected[i][0], corrected[i][1]);
            final double dx = p[0] - distorted[i][0];
            final double dy = p[1] - distorted[i][1];
            sumOfSquares += dx * dx + dy * dy;
        }
        rmsError = Math.sqrt(sumOfSquares / corrected.length);

        LOG.debug("fit: fitted order {} model to {} positions, rms error is {}",
                  dimension, corrected.length, rmsError);
    }

    /**
     * @return position in the distorted image for the specified position in model (width x height) coordinates.
     */
    public double[] apply(final double x,
                          final double y) {
        final double[] featureVector = kernelExpand(new double[] {x, y});
        final double[] result = {0.0, 0.0};
        for (int i = 0; i < featureVector.length; i++) {
            result[0] = result[0] + featureVector[i] * beta[i][0];
            result[1] = result[1] + featureVector[i] * beta[i][1];
        }
        return result;
    }

    /**
     * Resamples the image so that the lens distortion is removed.
     *
     * @param  image     distorted image (not modified).
     * @param  keepSize  if true, the result has the size of the input and pixels without source data are zero;
     *                   otherwise the result is cropped to the largest rectangle fully covered by source data.
     *
     * @return the corrected image.
     */
    public FloatProcessor correct(final FloatProcessor image,
                                  final boolean keepSize) {

        final int imageWidth = image.getWidth();
        final int imageHeight = image.getHeight();
        final double scaleX = (double) width / imageWidth;
        final double scaleY = (double) height / imageHeight;

        final FloatProcessor corrected = new FloatProcessor(imageWidth, imageHeight);
        final boolean[] valid = new boolean[imageWidth * imageHeight];

        for (int y = 0; y < imageHeight; y++) {
            for (int x = 0; x < imageWidth; x++) {
                final double[] p = apply(x * scaleX, y * scaleY);
                final double sourceX = p[0] / scaleX;
                final double sourceY = p[1] / scaleY;
                if ((sourceX >= 0) && (sourceX <= imageWidth - 1) && (sourceY >= 0) && (sourceY <= imageHeight - 1)) {
                    corrected.setf(x, y, (float) image.getInterpolatedValue(sourceX, sourceY));
                    valid[y * imageWidth + x] = true;
                }
            }
        }

        if (keepSize) {
            return corrected;
        }

        final Rectangle validBounds = findFullyValidRectangle(valid, imageWidth, imageHeight);
        corrected.setRoi(validBounds);
        return (FloatProcessor) corrected.crop();
    }

    /**
     * @return map of position uncertainty (in pixels) for an image of the specified size:
     *         the model's rms error scaled by the local magnification of the transform
     *         (zero everywhere when the error is unknown).
     */
    public FloatProcessor uncertainty(final int imageWidth,
                                      final int imageHeight) {
        final FloatProcessor map = new FloatProcessor(imageWidth, imageHeight);
        if (rmsError == null) {
            return map;
        }

        final double scaleX = (double) width / imageWidth;
        final double scaleY = (double) height / imageHeight;
        for (int y = 0; y < imageHeight; y++) {
            for (int x = 0; x < imageWidth; x++) {
                final double mx = x * scaleX;
                final double my = y * scaleY;
                final double[] p = apply(mx, my);
                final double[] px = apply(mx + 1, my);
                final double[] py = apply(mx, my + 1);
                final double determinant = (px[0] - p[0]) * (py[1] - p[1]) - (px[1] - p[1]) * (py[0] - p[0]);
                map.setf(x, y, (float) (rmsError * Math.sqrt(Math.abs(determinant))));
            }
        }
        return map;
    }

    double[] kernelExpand(final double[] position) {
        final double[] expanded = new double[length];

        int counter = 0;
        for (int i = 1; i <= dimension; i++) {
            for (double j = i; j >= 0; j--) {
                final double val = Math.pow(position[0], j) * Math.pow(position[1], i - j);
                expanded[counter] = val;
                ++counter;
            }
        }

        for (int i = 0; i < length - 1; i++) {
            expanded[i] = expanded[i] - normMean[i];
            expanded[i] = expanded[i] / normVar[i];
        }

        expanded[length - 1] = 100;

        return expanded;
    }

    private double[][] kernelExpandMatrixNormalize(final double[][] positions) {
        resetNormalization();

        final double[][] expanded = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) {
            expanded[i] = kernelExpand(positions[i]);
        }

        // the constant last term is not normalized
        for (int i = 0; i < length - 1; i++) {
            double mean = 0;
            double var = 0;
            for (final double[] row : expanded) {
                mean += row[i];
            }

            mean /= expanded.length;

            for (final double[] row : expanded) {
                var += (row[i] - mean) * (row[i] - mean);
            }
            var /= (expanded.length - 1);
            var = Math.sqrt(var);

            normMean[i] = mean;
            normVar[i] = var == 0 ? 1 : var;
        }

        final double[][] normalized = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) {
            normalized[i] = kernelExpand(positions[i]);
        }
        return normalized;
    }

    private void resetNormalization() {
        normMean = new double[length];
        normVar = new double[length];
        for (int i = 0; i < length; i++) {
            normMean[i] = 0;
            normVar[i] = 1;
        }
    }

    /**
     * Shrinks the image bounds until every enclosed pixel is valid,
     * always removing the border line with the largest fraction of invalid pixels.
     *
     * @throws IllegalStateException
     *   if no valid pixel remains.
     */
    static Rectangle findFullyValidRectangle(final boolean[] valid,
                                             final int imageWidth,
                                             final int imageHeight)
            throws IllegalStateException {
        int left = 0;
        int top = 0;
        int right = imageWidth - 1;
        int bottom = imageHeight - 1;

        while ((left <= right) && (top <= bottom)) {
            final double rowLength = right - left + 1;
            final double columnLength = bottom - top + 1;
            final double topInvalid = countInvalidInRow(valid, imageWidth, top, left, right) / rowLength;
            final double bottomInvalid = countInvalidInRow(valid, imageWidth, bottom, left, right) / rowLength;
            final double leftInvalid = countInvalidInColumn(valid, imageWidth, left, top, bottom) / columnLength;
            final double rightInvalid = countInvalidInColumn(valid, imageWidth, right, top, bottom) / columnLength;

            final double worst = Math.max(Math.max(topInvalid, bottomInvalid), Math.max(leftInvalid, rightInvalid));
            if (worst == 0) {
                return new Rectangle(left, top, right - left + 1, bottom - top + 1);
            } else if (worst == topInvalid) {
                top++;
            } else if (worst == bottomInvalid) {
                bottom--;
            } else if (worst == leftInvalid) {
                left++;
            } else {
                right--;
            }
        }

        throw new IllegalStateException("lens correction leaves no region covered by source data");
    }

    private static int countInvalidInRow(final boolean[] valid,
                                         final int imageWidth,
                                         final int row,
                                         final int fromColumn,
                                         final int toColumn) {
        int count = 0;
        for (int x = fromColumn; x <= toColumn; x++) {
            if (! valid[row * imageWidth + x]) {
                count++;
            }
        }
        return count;
    }

    private static int countInvalidInColumn(final boolean[] valid,
                                            final int imageWidth,
                                            final int column,
                                            final int fromRow,
                                            final int toRow) {
        int count = 0;
        for (int y = fromRow; y <= toRow; y++) {
            if (! valid[y * imageWidth + column]) {
                count++;
            }
        }
        return count;
    }

    private static final JsonUtils.Helper<LensCoefficients> JSON_HELPER =
            new JsonUtils.Helper<>(LensCoefficients.class);

    private static final Logger LOG = LoggerFactory.getLogger(PolynomialLensDistortion.class);
}
