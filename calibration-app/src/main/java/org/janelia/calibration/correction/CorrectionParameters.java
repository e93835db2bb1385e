package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.calibration.filter.MedianThreshold;

/**
 * Options for a camera correction.
 * Defaults: no exposure time, store's first light spectrum, artefact threshold 0.1,
 * lens correction keeps the image size, correction time for all dates, no deblurring, no denoising.
 *
 * @author Eric Trautman
 */
public class CorrectionParameters {

    private Double exposureTime;
    private String lightSpectrum;
    private double artefactThreshold;
    private boolean keepSize;
    private CorrectionDates dates;
    private boolean deblur;
    private boolean denoise;
    private List<FloatProcessor> backgroundImages;

    public CorrectionParameters() {
        this.exposureTime = null;
        this.lightSpectrum = null;
        this.artefactThreshold = MedianThreshold.DEFAULT_THRESHOLD;
        this.keepSize = true;
        this.dates = CorrectionDates.unset();
        this.deblur = false;
        this.denoise = false;
        this.backgroundImages = Collections.emptyList();
    }

    public Double getExposureTime() {
        return exposureTime;
    }

    public CorrectionParameters withExposureTime(final Double exposureTime) {
        this.exposureTime = exposureTime;
        return this;
    }

    public String getLightSpectrum() {
        return lightSpectrum;
    }

    public CorrectionParameters withLightSpectrum(final String lightSpectrum) {
        this.lightSpectrum = lightSpectrum;
        return this;
    }

    public double getArtefactThreshold() {
        return artefactThreshold;
    }

    /**
     * @param  artefactThreshold  relative median deviation threshold (values <= 0 disable artefact removal).
     */
    public CorrectionParameters withArtefactThreshold(final double artefactThreshold) {
        this.artefactThreshold = artefactThreshold;
        return this;
    }

    public boolean isKeepSize() {
        return keepSize;
    }

    public CorrectionParameters withKeepSize(final boolean keepSize) {
        this.keepSize = keepSize;
        return this;
    }

    public CorrectionDates getDates() {
        return dates;
    }

    public CorrectionParameters withDates(final CorrectionDates dates) {
        this.dates = dates == null ? CorrectionDates.unset() : dates;
        return this;
    }

    public boolean isDeblur() {
        return deblur;
    }

    public CorrectionParameters withDeblur(final boolean deblur) {
        this.deblur = deblur;
        return this;
    }

    public boolean isDenoise() {
        return denoise;
    }

    public CorrectionParameters withDenoise(final boolean denoise) {
        this.denoise = denoise;
        return this;
    }

    public List<FloatProcessor> getBackgroundImages() {
        return Collections.unmodifiableList(backgroundImages);
    }

    /**
     * @param  backgroundImages  dark images taken with the same exposure (replace the dark current calibration).
     */
    public CorrectionParameters withBackgroundImages(final List<FloatProcessor> backgroundImages) {
        this.backgroundImages = backgroundImages == null ? Collections.emptyList() : new ArrayList<>(backgroundImages);
        return this;
    }

    @Override
    public String toString() {
        return "CorrectionParameters{exposureTime: " + exposureTime +
               ", lightSpectrum: " + lightSpectrum +
               ", artefactThreshold: " + artefactThreshold +
               ", keepSize: " + keepSize +
               ", dates: " + dates +
               ", deblur: " + deblur +
               ", denoise: " + denoise +
               ", backgroundImageCount: " + backgroundImages.size() + '}';
    }
}
