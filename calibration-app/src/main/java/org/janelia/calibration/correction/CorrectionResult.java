package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Corrected image along with the results of every stage that was considered.
 *
 * @author Eric Trautman
 */
public class CorrectionResult {

    private final FloatProcessor image;
    private final String lightSpectrum;
    private final List<String> pipelineWarnings;
    private final List<StageResult> stageResults;

    public CorrectionResult(final FloatProcessor image,
                            final String lightSpectrum,
                            final List<String> pipelineWarnings,
                            final List<StageResult> stageResults) {
        this.image = image;
        this.lightSpectrum = lightSpectrum;
        this.pipelineWarnings = new ArrayList<>(pipelineWarnings);
        this.stageResults = new ArrayList<>(stageResults);
    }

    public FloatProcessor getImage() {
        return image;
    }

    /**
     * @return light spectrum used for the correction (null if the store has none).
     */
    public String getLightSpectrum() {
        return lightSpectrum;
    }

    public List<StageResult> getStageResults() {
        return Collections.unmodifiableList(stageResults);
    }

    /**
     * @return result for the named stage, or null if the stage was not part of the correction.
     */
    public StageResult getStageResult(final String stageName) {
        for (final StageResult stageResult : stageResults) {
            if (stageResult.getStageName().equals(stageName)) {
                return stageResult;
            }
        }
        return null;
    }

    /**
     * @return pipeline level warnings followed by the warnings of every stage, in stage order.
     */
    public List<String> getWarnings() {
        final List<String> warnings = new ArrayList<>(pipelineWarnings);
        for (final StageResult stageResult : stageResults) {
            warnings.addAll(stageResult.getWarnings());
        }
        return warnings;
    }

    public List<String> getFailedStageNames() {
        final List<String> names = new ArrayList<>();
        for (final StageResult stageResult : stageResults) {
            if (stageResult.getStatus() == StageResult.Status.FAILED) {
                names.add(stageResult.getStageName());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return "CorrectionResult{lightSpectrum: " + lightSpectrum + ", stages: " + stageResults + '}';
    }
}
