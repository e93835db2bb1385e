package org.janelia.calibration.correction;

import org.janelia.calibration.filter.MedianThreshold;
import org.janelia.calibration.filter.NonLocalMeansDenoiser;
import org.janelia.calibration.filter.WienerDeconvolution;
import org.janelia.calibration.loader.ImageLoader;
import org.janelia.calibration.noise.SingleTimeEffectDetection;

/**
 * Numeric implementations used by the correction stages.
 *
 * @author Eric Trautman
 */
public class Collaborators {

    private final ImageLoader imageLoader;
    private final SingleTimeEffectDetection singleTimeEffectDetection;
    private final MedianThreshold medianThreshold;
    private final WienerDeconvolution deconvolution;
    private final NonLocalMeansDenoiser denoiser;

    public Collaborators() {
        this(new ImageLoader(),
             new SingleTimeEffectDetection(),
             new MedianThreshold(),
             new WienerDeconvolution(),
             new NonLocalMeansDenoiser());
    }

    public Collaborators(final ImageLoader imageLoader,
                         final SingleTimeEffectDetection singleTimeEffectDetection,
                         final MedianThreshold medianThreshold,
                         final WienerDeconvolution deconvolution,
                         final NonLocalMeansDenoiser denoiser) {
        this.imageLoader = imageLoader;
        this.singleTimeEffectDetection = singleTimeEffectDetection;
        this.medianThreshold = medianThreshold;
        this.deconvolution = deconvolution;
        this.denoiser = denoiser;
    }

    public ImageLoader getImageLoader() {
        return imageLoader;
    }

    public SingleTimeEffectDetection getSingleTimeEffectDetection() {
        return singleTimeEffectDetection;
    }

    public MedianThreshold getMedianThreshold() {
        return medianThreshold;
    }

    public WienerDeconvolution getDeconvolution() {
        return deconvolution;
    }

    public NonLocalMeansDenoiser getDenoiser() {
        return denoiser;
    }

    public Collaborators withMedianThreshold(final MedianThreshold medianThreshold) {
        return new Collaborators(imageLoader, singleTimeEffectDetection, medianThreshold, deconvolution, denoiser);
    }

    public Collaborators withDeconvolution(final WienerDeconvolution deconvolution) {
        return new Collaborators(imageLoader, singleTimeEffectDetection, medianThreshold, deconvolution, denoiser);
    }

    public Collaborators withDenoiser(final NonLocalMeansDenoiser denoiser) {
        return new Collaborators(imageLoader, singleTimeEffectDetection, medianThreshold, deconvolution, denoiser);
    }
}
