package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zeroes non-finite pixels and replaces pixels that deviate strongly from their local median.
 */
public class ArtefactStage
        implements CorrectionStage {

    public static final String NAME = "artefacts";

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
                           final CorrectionContext context) {

        final double threshold = context.getParameters().getArtefactThreshold();
        if (threshold <= 0) {
            return Outcome.skipped("artefact removal disabled", false);
        }

        final int nonFiniteCount = PixelOperations.replaceNonFinite(image, 0f);
        final int replacedCount = context.getCollaborators().getMedianThreshold().apply(image, threshold);

        LOG.debug("process: zeroed {} non-finite pixels, replaced {} pixels with threshold {}",
                  nonFiniteCount, replacedCount, threshold);

        return Outcome.applied(image);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArtefactStage.class);
}
