package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.util.List;

import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationRecord;
import org.janelia.calibration.spec.DarkCurrentCoefficients;

/**
 * Subtracts the sensor background, taken from background images when they are provided
 * or synthesized from the dark current calibration otherwise.
 *
 * @author Eric Trautman
 */
public class DarkCurrentStage
        implements CorrectionStage {

    public static final String NAME = "dark current";

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

        final List<FloatProcessor> backgroundImages = context.getParameters().getBackgroundImages();
        final FloatProcessor background;

        if (backgroundImages.size() > 1) {
            background = context.getCollaborators().getSingleTimeEffectDetection()
                    .detect(backgroundImages, context.getNoiseLevelFunction()).getImage();
        } else if (backgroundImages.size() == 1) {
            background = backgroundImages.get(0);
        } else {
            final CalibrationRecord<DarkCurrentCoefficients> record =
                    context.getStore().getDarkCurrent(context.getDate(CalibrationCategory.DARK_CURRENT));
            if (record == null) {
                return Outcome.skipped("no dark current calibration found", true);
            }
            background = record.getPayload()
                    .backgroundFor(context.getParameters().getExposureTime(),
                                   context.getStore().getProfile().getMaximumValue())
                    .toFloatProcessor();
        }

        PixelOperations.checkSameSize(image, background, "background");

        final float[] pixels = (float[]) image.getPixels();
        final float[] backgroundPixels = (float[]) background.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] -= backgroundPixels[i];
        }

        return Outcome.applied(image);
    }

}
