package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

/**
 * Non-local means denoising.
 * Failures of this stage are not recorded but propagate to the caller.
 */
public class DenoiseStage
        implements CorrectionStage {

    public static final String NAME = "denoise";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isBestEffort() {
        return false;
    }

    @Override
    public Outcome process(final FloatProcessor image,
                           final CorrectionContext context) {

        if (! context.getParameters().isDenoise()) {
            return Outcome.skipped("denoising not requested", false);
        }

        PixelOperations.replaceNonFinite(image, 0f);

        return Outcome.applied(context.getCollaborators().getDenoiser().denoise(image));
    }

}
