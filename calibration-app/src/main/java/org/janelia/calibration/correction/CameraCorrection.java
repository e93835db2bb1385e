package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.janelia.calibration.lens.PolynomialLensDistortion;
import org.janelia.calibration.noise.NoiseLevelFunction;
import org.janelia.calibration.noise.SingleTimeEffectDetection;
import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationRecord;
import org.janelia.calibration.spec.CameraProfile;
import org.janelia.calibration.spec.NoiseLevelCoefficients;
import org.janelia.calibration.store.CalibrationStore;
import org.janelia.calibration.store.ShapeMismatchException;
import org.janelia.calibration.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects raw camera images with the calibration data of a {@link CalibrationStore}.
 *
 * Stages run in a fixed order: dark current, vignetting, artefacts, deblur, lens, denoise.
 * Every stage works on its own copy of the working image,
 * so a failing best effort stage leaves the image as it was before the stage.
 * Shape validation failures and denoise failures abort the correction.
 *
 * The noise level function derived from the first multi-image correction,
 * the last working image, and the last light spectrum are kept for later calls
 * (see {@link #uncertainty}).
 *
 * Instances are not thread safe.
 *
 * @author Eric Trautman
 */
public class CameraCorrection {

    private final CalibrationStore store;
    private final Collaborators collaborators;
    private final Clock clock;
    private final List<CorrectionStage> stages;

    private NoiseLevelFunction noiseLevelFunction;
    private FloatProcessor lastImage;
    private String lastLightSpectrum;

    public CameraCorrection(final CalibrationStore store) {
        this(store, new Collaborators(), Clock.systemDefaultZone());
    }

    public CameraCorrection(final CalibrationStore store,
                            final Collaborators collaborators,
                            final Clock clock) {
        this.store = store;
        this.collaborators = collaborators;
        this.clock = clock;
        this.stages = Arrays.asList(new DarkCurrentStage(),
                                    new VignettingStage(),
                                    new ArtefactStage(),
                                    new DeblurStage(),
                                    new LensStage(),
                                    new DenoiseStage());
        this.noiseLevelFunction = null;
        this.lastImage = null;
        this.lastLightSpectrum = null;
    }

    public CalibrationStore getStore() {
        return store;
    }

    public NoiseLevelFunction getNoiseLevelFunction() {
        return noiseLevelFunction;
    }

    /**
     * @return copy of the working image of the last correction (before any stage was applied), or null.
     */
    public FloatProcessor getLastImage() {
        return lastImage == null ? null : (FloatProcessor) lastImage.duplicate();
    }

    public String getLastLightSpectrum() {
        return lastLightSpectrum;
    }

    /**
     * Loads the images at the specified paths and corrects them.
     *
     * @throws IllegalArgumentException
     *   if an image cannot be loaded.
     */
    public CorrectionResult correctPaths(final List<String> imagePaths,
                                         final CorrectionParameters parameters)
            throws IllegalArgumentException, ShapeMismatchException {
        final List<FloatProcessor> images = new ArrayList<>(imagePaths.size());
        for (final String imagePath : imagePaths) {
            images.add(collaborators.getImageLoader().load(imagePath));
        }
        return correct(images, parameters);
    }

    public CorrectionResult correct(final FloatProcessor image,
                                    final CorrectionParameters parameters)
            throws ShapeMismatchException {
        return correct(Collections.singletonList(image), parameters);
    }

    /**
     * Corrects one image, or a stack of exposures of the same scene
     * (which are first merged with single time effect detection).
     *
     * @param  images      one or more raw images (not modified).
     * @param  parameters  correction options.
     *
     * @return corrected image and stage results.
     *
     * @throws IllegalArgumentException
     *   if no images are given.
     *
     * @throws ShapeMismatchException
     *   if the image dimensions differ from the store's reference shape.
     */
    public CorrectionResult correct(final List<FloatProcessor> images,
                                    final CorrectionParameters parameters)
            throws IllegalArgumentException, ShapeMismatchException {

        if ((images == null) || images.isEmpty()) {
            throw new IllegalArgumentException("at least one image must be specified");
        }

        final ProcessTimer timer = new ProcessTimer();
        final Date correctionTime = Date.from(clock.instant());
        final List<String> pipelineWarnings = new ArrayList<>();

        final String lightSpectrum = resolveLightSpectrum(parameters.getLightSpectrum());
        if ((lightSpectrum != null) && (! store.getLightSpectra().contains(lightSpectrum))) {
            pipelineWarnings.add("light spectrum [" + lightSpectrum + "] is not registered for camera '" +
                                 store.getName() + "'");
        }

        LOG.info("correct: entry, correcting {} image(s) with light spectrum {} and {}",
                 images.size(), lightSpectrum, parameters);

        FloatProcessor image = acquireWorkingImage(images, correctionTime, parameters);

        store.checkShape(image.getHeight(), image.getWidth());

        lastLightSpectrum = lightSpectrum;
        lastImage = (FloatProcessor) image.duplicate();

        final CorrectionContext context = new CorrectionContext(store,
                                                                parameters,
                                                                lightSpectrum,
                                                                correctionTime,
                                                                collaborators,
                                                                noiseLevelFunction);

        final List<StageResult> stageResults = new ArrayList<>();
        for (final CorrectionStage stage : stages) {
            final FloatProcessor stageInput = (FloatProcessor) image.duplicate();
            final CorrectionStage.Outcome outcome;
            if (stage.isBestEffort()) {
                try {
                    outcome = stage.process(stageInput, context);
                } catch (final Exception e) {
                    LOG.warn("correct: {} stage failed, continuing with uncorrected image", stage.getName(), e);
                    stageResults.add(StageResult.failed(stage.getName(), e));
                    continue;
                }
            } else {
                outcome = processOrPropagate(stage, stageInput, context);
            }

            if (outcome.isSkipped()) {
                LOG.info("correct: skipped {} stage, {}", stage.getName(), outcome.getSkipReason());
                stageResults.add(new StageResult(stage.getName(), StageResult.Status.SKIPPED,
                                                 outcome.getSkipReason(), outcome.getWarnings()));
            } else {
                LOG.info("correct: applied {} stage", stage.getName());
                image = outcome.getImage();
                stageResults.add(new StageResult(stage.getName(), StageResult.Status.APPLIED,
                                                 null, outcome.getWarnings()));
            }
            for (final String warning : outcome.getWarnings()) {
                LOG.warn("correct: {}", warning);
            }
        }

        final CorrectionResult result = new CorrectionResult(image, lightSpectrum, pipelineWarnings, stageResults);

        LOG.info("correct: exit, {} stage(s) failed, elapsed time {}", result.getFailedStageNames().size(), timer);

        return result;
    }

    /**
     * Estimates the uncertainty of a corrected image.
     * Dark current RMSE, relative vignetting uncertainty and sensitivity RMSE are combined in quadrature
     * and normalized by the image values (zero values count as one).
     * Missing inputs count as zero.
     * Without a lens calibration the intensity map is not distorted and the position map is null.
     *
     * @param  image          corrected image (null for the last working image).
     * @param  lightSpectrum  light spectrum (null for the last light spectrum).
     *
     * @throws IllegalStateException
     *   if no image is given and no correction has been run.
     */
    public UncertaintyResult uncertainty(final FloatProcessor image,
                                         final String lightSpectrum)
            throws IllegalStateException {

        final FloatProcessor source = image == null ? lastImage : image;
        if (source == null) {
            throw new IllegalStateException("no image specified and no image has been corrected yet");
        }
        final String light = lightSpectrum == null ? lastLightSpectrum : lightSpectrum;

        final CameraProfile profile = store.getProfile();
        final double darkRmse = valueOrZero(profile.getDarkRmse());
        final double sensitivityRmse = valueOrZero(profile.getSensitivityRmse());
        final double relativeVignetting = light == null ? 0.0 : valueOrZero(profile.getVignettingRelativeUncertainty(light));

        final int width = source.getWidth();
        final int height = source.getHeight();
        final float[] pixels = (float[]) source.getPixels();
        final float[] intensityPixels = new float[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            final double value = pixels[i];
            final double vignetting = relativeVignetting * value;
            final double combined = Math.sqrt((darkRmse * darkRmse) +
                                              (vignetting * vignetting) +
                                              (sensitivityRmse * sensitivityRmse));
            intensityPixels[i] = (float) (combined / (value == 0 ? 1.0 : value));
        }

        FloatProcessor intensity = new FloatProcessor(width, height, intensityPixels);
        FloatProcessor position = null;

        final PolynomialLensDistortion lens = store.getLens(light, Date.from(clock.instant()));
        if (lens != null) {
            position = lens.uncertainty(width, height);
            intensity = lens.correct(intensity, true);
        }

        return new UncertaintyResult(intensity, position);
    }

    private String resolveLightSpectrum(final String requested) {
        String lightSpectrum = requested;
        if (lightSpectrum == null) {
            final List<String> registered = store.getLightSpectra();
            lightSpectrum = registered.isEmpty() ? null : registered.get(0);
        }
        return lightSpectrum;
    }

    private FloatProcessor acquireWorkingImage(final List<FloatProcessor> images,
                                               final Date correctionTime,
                                               final CorrectionParameters parameters) {
        final FloatProcessor image;
        if (images.size() > 1) {
            NoiseLevelFunction nlf = noiseLevelFunction;
            if (nlf == null) {
                final CalibrationRecord<NoiseLevelCoefficients> noiseRecord =
                        store.getNoise(parameters.getDates().resolve(CalibrationCategory.NOISE, correctionTime));
                if (noiseRecord != null) {
                    nlf = NoiseLevelFunction.fromCoefficients(noiseRecord.getPayload().getCoefficients());
                }
            }

            final SingleTimeEffectDetection.Result steResult =
                    collaborators.getSingleTimeEffectDetection().detect(images, nlf);
            image = steResult.getImage();

            if (noiseLevelFunction == null) {
                noiseLevelFunction = steResult.getNoiseLevelFunction();
                LOG.info("acquireWorkingImage: cached {}", noiseLevelFunction);
            }
        } else {
            image = (FloatProcessor) images.get(0).duplicate();
        }
        return image;
    }

    private static CorrectionStage.Outcome processOrPropagate(final CorrectionStage stage,
                                                              final FloatProcessor stageInput,
                                                              final CorrectionContext context) {
        try {
            return stage.process(stageInput, context);
        } catch (final RuntimeException e) {
            throw e;
        } catch (final Exception e) {
            throw new IllegalStateException(stage.getName() + " stage failed", e);
        }
    }

    private static double valueOrZero(final Double value) {
        return value == null ? 0.0 : value;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CameraCorrection.class);
}
