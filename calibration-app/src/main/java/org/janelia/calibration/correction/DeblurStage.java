package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.List;

import org.janelia.calibration.filter.WienerDeconvolution;
import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationRecord;
import org.janelia.calibration.spec.CoefficientArray;
import org.janelia.calibration.spec.DeconvolutionBalance;

/**
 * Deconvolves the image with the point spread function calibration.
 * The image is normalized by its maximum for the deconvolution, negative results are clipped to zero,
 * and the result is scaled back.
 * Without a balance calibration, the balance is estimated from the image.
 *
 * @author Eric Trautman
 */
public class DeblurStage
        implements CorrectionStage {

    public static final String NAME = "deblur";

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

        if (! context.getParameters().isDeblur()) {
            return Outcome.skipped("deblurring not requested", false);
        }

        final CalibrationRecord<CoefficientArray> psfRecord =
                context.getStore().getPsf(context.getLightSpectrum(), context.getDate(CalibrationCategory.PSF));
        if (psfRecord == null) {
            return Outcome.skipped("no point spread function found, cannot deblur", true);
        }

        final List<String> warnings = new ArrayList<>(context.getSpectrumFallbackWarnings(CalibrationCategory.PSF));

        final float max = PixelOperations.max(image);
        if (! (max > 0)) {
            return Outcome.skipped("image maximum is " + max + ", cannot normalize for deblurring", true);
        }
        PixelOperations.multiply(image, 1.0 / max);

        final WienerDeconvolution deconvolution = context.getCollaborators().getDeconvolution();
        final CalibrationRecord<DeconvolutionBalance> balanceRecord =
                context.getStore().getBalance(context.getLightSpectrum(), context.getDate(CalibrationCategory.BALANCE));

        final FloatProcessor deconvolved;
        if (balanceRecord == null) {
            warnings.add("no balance value for wiener deconvolution found, using unsupervised deconvolution");
            deconvolved = deconvolution.deconvolveUnsupervised(image, psfRecord.getPayload());
        } else {
            deconvolved = deconvolution.deconvolve(image, psfRecord.getPayload(), balanceRecord.getPayload().getBalance());
        }

        final float[] pixels = (float[]) deconvolved.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = pixels[i] < 0 ? 0f : pixels[i] * max;
        }

        return Outcome.applied(deconvolved, warnings);
    }

}
