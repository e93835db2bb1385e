package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Common interface for all correction stage implementations.
 */
public interface CorrectionStage {

    /**
     * @return name reported in stage results.
     */
    String getName();

    /**
     * @return true if failures of this stage are recorded and the pipeline continues with the pre-stage image,
     *         false if failures propagate to the caller.
     */
    boolean isBestEffort();

    /**
     * Apply this stage.
     *
     * @param  image    working image copy owned by this stage (may be modified and returned).
     * @param  context  calibration data and parameters for the current correction.
     *
     * @return outcome with the corrected image, or a skipped outcome.
     *
     * @throws Exception
     *   if the stage fails.
     */
    Outcome process(final FloatProcessor image,
                    final CorrectionContext context)
            throws Exception;

    /**
     * Stage output: the corrected image (null if skipped) and any diagnostic warnings.
     */
    class Outcome {

        private final FloatProcessor image;
        private final String skipReason;
        private final List<String> warnings;

        private Outcome(final FloatProcessor image,
                        final String skipReason,
                        final List<String> warnings) {
            this.image = image;
            this.skipReason = skipReason;
            this.warnings = warnings;
        }

        public static Outcome applied(final FloatProcessor image,
                                      final List<String> warnings) {
            return new Outcome(image, null, new ArrayList<>(warnings));
        }

        public static Outcome applied(final FloatProcessor image) {
            return applied(image, Collections.emptyList());
        }

        /**
         * @param  reason  why the stage did not run.
         * @param  warn    true if the reason should also be reported as a warning.
         */
        public static Outcome skipped(final String reason,
                                      final boolean warn) {
            return new Outcome(null, reason, warn ? Arrays.asList(reason) : Collections.emptyList());
        }

        public boolean isSkipped() {
            return image == null;
        }

        public FloatProcessor getImage() {
            return image;
        }

        public String getSkipReason() {
            return skipReason;
        }

        public List<String> getWarnings() {
            return Collections.unmodifiableList(warnings);
        }
    }
}
