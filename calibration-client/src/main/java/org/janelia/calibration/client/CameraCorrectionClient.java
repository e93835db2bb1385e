package org.janelia.calibration.client;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.calibration.client.parameter.CommandLineParameters;
import org.janelia.calibration.correction.CameraCorrection;
import org.janelia.calibration.correction.CorrectionDates;
import org.janelia.calibration.correction.CorrectionParameters;
import org.janelia.calibration.correction.CorrectionResult;
import org.janelia.calibration.correction.StageResult;
import org.janelia.calibration.filter.MedianThreshold;
import org.janelia.calibration.loader.ImageLoader;
import org.janelia.calibration.store.CalibrationStore;
import org.janelia.calibration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for correcting raw camera images with a calibration file.
 *
 * @author Eric Trautman
 */
public class CameraCorrectionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--calibrationFile",
                description = "Calibration file",
                required = true)
        public String calibrationFile;

        @Parameter(
                names = "--image",
                description = "Raw image(s) of one scene, multiple exposures are merged with single time effect removal",
                variableArity = true,
                required = true)
        public List<String> images;

        @Parameter(
                names = "--background",
                description = "Background image(s) to subtract instead of the dark current calibration",
                variableArity = true)
        public List<String> backgroundImages;

        @Parameter(
                names = "--exposureTime",
                description = "Exposure time in seconds (needed for linear dark current calibrations)")
        public Double exposureTime;

        @Parameter(
                names = "--lightSpectrum",
                description = "Light spectrum, omit for the first registered spectrum")
        public String lightSpectrum;

        @Parameter(
                names = "--artefactThreshold",
                description = "Relative median deviation threshold for artefact removal (0 to disable)")
        public Double artefactThreshold = MedianThreshold.DEFAULT_THRESHOLD;

        @Parameter(
                names = "--cropLens",
                description = "Crop the lens corrected image to the area with source data",
                arity = 0)
        public boolean cropLens = false;

        @Parameter(
                names = "--date",
                description = "Calibration date to use for all categories, omit for now")
        public String date;

        @DynamicParameter(
                names = "--categoryDate",
                description = "Calibration date for one category, e.g. --categoryDate \"flat field=30 Nov 15 - 13:20\"")
        public Map<String, String> categoryDates = new HashMap<>();

        @Parameter(
                names = "--deblur",
                description = "Deconvolve with the point spread function calibration",
                arity = 0)
        public boolean deblur = false;

        @Parameter(
                names = "--denoise",
                description = "Apply non-local means denoising",
                arity = 0)
        public boolean denoise = false;

        @Parameter(
                names = "--output",
                description = "Path of corrected TIFF image",
                required = true)
        public String output;

        public CorrectionParameters toCorrectionParameters(final List<FloatProcessor> backgrounds) {
            return new CorrectionParameters()
                    .withExposureTime(exposureTime)
                    .withLightSpectrum(lightSpectrum)
                    .withArtefactThreshold(artefactThreshold)
                    .withKeepSize(! cropLens)
                    .withDates(CorrectionDates.parse(date, categoryDates))
                    .withDeblur(deblur)
                    .withDenoise(denoise)
                    .withBackgroundImages(backgrounds);
        }

        @Override
        protected void validate() throws ParameterException {
            try {
                CorrectionDates.parse(date, categoryDates);
            } catch (final IllegalArgumentException e) {
                throw new ParameterException("invalid --categoryDate: " + e.getMessage());
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws IOException {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final CameraCorrectionClient client = new CameraCorrectionClient(parameters);
                client.correctImages();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final ImageLoader imageLoader;

    public CameraCorrectionClient(final Parameters parameters) {
        this.parameters = parameters;
        this.imageLoader = new ImageLoader();
    }

    /**
     * Corrects the images and writes the result.
     *
     * @throws IOException
     *   if the calibration file cannot be read or the result cannot be written.
     */
    public CorrectionResult correctImages()
            throws IOException {

        final CalibrationStore store = CalibrationStore.load(Path.of(parameters.calibrationFile));

        final List<FloatProcessor> backgrounds = new ArrayList<>();
        if (parameters.backgroundImages != null) {
            for (final String backgroundImage : parameters.backgroundImages) {
                backgrounds.add(imageLoader.load(backgroundImage));
            }
        }

        final CameraCorrection correction = new CameraCorrection(store);
        final CorrectionResult result =
                correction.correctPaths(parameters.images, parameters.toCorrectionParameters(backgrounds));

        for (final StageResult stageResult : result.getStageResults()) {
            LOG.info("correctImages: {}", stageResult);
        }

        saveTiff(result.getImage(), parameters.output);

        return result;
    }

    static void saveTiff(final FloatProcessor image,
                         final String outputPath)
            throws IOException {

        final File outputFile = new File(outputPath).getAbsoluteFile();
        final File parentDirectory = outputFile.getParentFile();
        if (parentDirectory != null) {
            FileUtil.ensureWritableDirectory(parentDirectory);
        }

        final ImagePlus imagePlus = new ImagePlus(outputFile.getName(), image);
        if (! new FileSaver(imagePlus).saveAsTiff(outputFile.getAbsolutePath())) {
            throw new IOException("failed to save " + outputFile);
        }

        LOG.info("saveTiff: saved {}", outputFile);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CameraCorrectionClient.class);
}
