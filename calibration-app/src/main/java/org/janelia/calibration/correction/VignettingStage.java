package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationRecord;
import org.janelia.calibration.spec.CoefficientArray;

/**
 * Divides the image by the flat field (relative sensitivity) calibration.
 * Pixels with a zero flat field coefficient are left unchanged.
 *
 * @author Eric Trautman
 */
public class VignettingStage
        implements CorrectionStage {

    public static final String NAME = "vignetting";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isBestEffort() {
        return true;
    }

    @Override
    public Outcome process(final FloatProcessor image,
                           final CorrectionContext context)
            throws IllegalArgumentException {

        final CalibrationRecord<CoefficientArray> record =
                context.getStore().getFlatField(context.getLightSpectrum(),
                                                context.getDate(CalibrationCategory.FLAT_FIELD));
        if (record == null) {
            return Outcome.skipped("no flat field calibration found", false);
        }

        final CoefficientArray flatField = record.getPayload();
        if (flatField.getChannels() > 1) {
            throw new IllegalArgumentException("flat field with shape " + flatField.describe() +
                                               " cannot be applied to a single channel image");
        }

        final FloatProcessor coefficients = flatField.toFloatProcessor();
        PixelOperations.checkSameSize(image, coefficients, "flat field");

        final float[] pixels = (float[]) image.getPixels();
        final float[] coefficientPixels = (float[]) coefficients.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            if (coefficientPixels[i] != 0) {
                pixels[i] /= coefficientPixels[i];
            }
        }

        return Outcome.applied(image, context.getSpectrumFallbackWarnings(CalibrationCategory.FLAT_FIELD));
    }

}
