package org.janelia.calibration.correction;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome summary for one correction stage.
 *
 * @author Eric Trautman
 */
public class StageResult
        implements Serializable {

    public enum Status {
        APPLIED, SKIPPED, FAILED
    }

    private final String stageName;
    private final Status status;
    private final String message;
    private final List<String> warnings;

    public StageResult(final String stageName,
                       final Status status,
                       final String message,
                       final List<String> warnings) {
        this.stageName = stageName;
        this.status = status;
        this.message = message;
        this.warnings = new ArrayList<>(warnings);
    }

    public static StageResult failed(final String stageName,
                                     final Throwable failure) {
        final String message = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        return new StageResult(stageName, Status.FAILED, message,
                               Collections.singletonList(stageName + " failed: " + message));
    }

    public String getStageName() {
        return stageName;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return skip reason or failure description (null for applied stages).
     */
    public String getMessage() {
        return message;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return stageName + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
