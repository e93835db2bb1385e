package org.janelia.calibration.correction;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import org.janelia.calibration.noise.NoiseLevelFunction;
import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.store.CalibrationStore;

/**
 * Read-only view of everything a stage needs for one correction.
 *
 * @author Eric Trautman
 */
public class CorrectionContext {

    private final CalibrationStore store;
    private final CorrectionParameters parameters;
    private final String lightSpectrum;
    private final Date correctionTime;
    private final Collaborators collaborators;
    private final NoiseLevelFunction noiseLevelFunction;

    public CorrectionContext(final CalibrationStore store,
                             final CorrectionParameters parameters,
                             final String lightSpectrum,
                             final Date correctionTime,
                             final Collaborators collaborators,
                             final NoiseLevelFunction noiseLevelFunction) {
        this.store = store;
        this.parameters = parameters;
        this.lightSpectrum = lightSpectrum;
        this.correctionTime = new Date(correctionTime.getTime());
        this.collaborators = collaborators;
        this.noiseLevelFunction = noiseLevelFunction;
    }

    public CalibrationStore getStore() {
        return store;
    }

    public CorrectionParameters getParameters() {
        return parameters;
    }

    public String getLightSpectrum() {
        return lightSpectrum;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    /**
     * @return cached noise level function (null if none is known yet).
     */
    public NoiseLevelFunction getNoiseLevelFunction() {
        return noiseLevelFunction;
    }

    public Date getDate(final CalibrationCategory category) {
        return parameters.getDates().resolve(category, correctionTime);
    }

    /**
     * @return warnings describing a spectrum fallback for the category (empty if the light spectrum has records).
     */
    public List<String> getSpectrumFallbackWarnings(final CalibrationCategory category) {
        final List<String> warnings = new ArrayList<>();
        final String resolved = store.resolveSpectrum(category, lightSpectrum);
        if ((lightSpectrum != null) && (resolved != null) && (! lightSpectrum.equals(resolved))) {
            warnings.add("no " + category + " calibration found for [" + lightSpectrum +
                         "], using [" + resolved + "] instead");
        }
        return warnings;
    }
}
