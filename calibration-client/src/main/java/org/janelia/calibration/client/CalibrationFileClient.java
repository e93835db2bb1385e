package org.janelia.calibration.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.List;

import org.janelia.calibration.client.parameter.CommandLineParameters;
import org.janelia.calibration.loader.ImageLoader;
import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationDates;
import org.janelia.calibration.spec.CoefficientArray;
import org.janelia.calibration.store.CalibrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for creating, updating and inspecting camera calibration (.cal) files.
 *
 * @author Eric Trautman
 */
public class CalibrationFileClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--calibrationFile",
                description = "Calibration file to create or update (.cal extension is appended if missing)",
                required = true)
        public String calibrationFile;

        @Parameter(
                names = "--cameraName",
                description = "Camera name")
        public String cameraName;

        @Parameter(
                names = "--bitDepth",
                description = "Camera bit depth (used with --cameraName)")
        public Integer bitDepth = 16;

        @Parameter(
                names = "--date",
                description = "Calibration date for added records (e.g. '13 Nov 15 - 14:00' or '2015-11-13'), omit for now")
        public String date;

        @Parameter(
                names = "--info",
                description = "Description of added records")
        public String info = "";

        @Parameter(
                names = "--lightSpectrum",
                description = "Light spectrum of added spectrum dependent records")
        public String lightSpectrum = CalibrationStore.DEFAULT_LIGHT_SPECTRUM;

        @Parameter(
                names = "--darkCurrent",
                description = "Image with dark current slope (or constant background if no intercept is given)")
        public String darkCurrent;

        @Parameter(
                names = "--darkCurrentIntercept",
                description = "Image with dark current intercept")
        public String darkCurrentIntercept;

        @Parameter(
                names = "--flatField",
                description = "Flat field image")
        public String flatField;

        @Parameter(
                names = "--psf",
                description = "Point spread function image")
        public String psf;

        @Parameter(
                names = "--balance",
                description = "Wiener deconvolution balance")
        public Double balance;

        @Parameter(
                names = "--lens",
                description = "Lens model JSON file")
        public String lens;

        @Parameter(
                names = "--noise",
                description = "Noise level function coefficients (minY ax ay)",
                variableArity = true)
        public List<Double> noise;

        @Parameter(
                names = "--deleteCategory",
                description = "Category of record to delete (deletes the record selected by --date)")
        public String deleteCategory;

        @Parameter(
                names = "--clearOld",
                description = "Remove all but the newest record of every category",
                arity = 0)
        public boolean clearOld = false;

        @Parameter(
                names = "--transpose",
                description = "Transpose all stored arrays",
                arity = 0)
        public boolean transpose = false;

        @Parameter(
                names = "--overview",
                description = "Print overview of calibration file",
                arity = 0)
        public boolean overview = false;

        public Date getDate() {
            return date == null ? null : CalibrationDates.parse(date);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws IOException {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final CalibrationFileClient client = new CalibrationFileClient(parameters);
                client.updateCalibrationFile();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final ImageLoader imageLoader;

    public CalibrationFileClient(final Parameters parameters) {
        this.parameters = parameters;
        this.imageLoader = new ImageLoader();
    }

    /**
     * Applies all requested changes and saves the calibration file if anything changed.
     *
     * @return the updated store.
     *
     * @throws IOException
     *   if the calibration file cannot be read or written.
     */
    public CalibrationStore updateCalibrationFile()
            throws IOException {

        final Path calibrationPath = CalibrationStore.withFileExtension(Path.of(parameters.calibrationFile));

        final CalibrationStore store;
        if (Files.exists(calibrationPath)) {
            store = CalibrationStore.load(calibrationPath);
        } else {
            LOG.info("updateCalibrationFile: {} does not exist, creating new calibration", calibrationPath);
            store = new CalibrationStore();
        }

        final Date date = parameters.getDate();
        boolean modified = false;

        if (parameters.cameraName != null) {
            store.setCamera(parameters.cameraName, parameters.bitDepth);
            modified = true;
        }

        if (parameters.darkCurrent != null) {
            final CoefficientArray intercept = parameters.darkCurrentIntercept == null ?
                                               null : loadArray(parameters.darkCurrentIntercept);
            store.addDarkCurrent(loadArray(parameters.darkCurrent), intercept, date, parameters.info, null);
            modified = true;
        }

        if (parameters.flatField != null) {
            store.addFlatField(loadArray(parameters.flatField), date, parameters.info, parameters.lightSpectrum, null);
            modified = true;
        }

        if (parameters.psf != null) {
            store.addPSF(loadArray(parameters.psf), date, parameters.info, parameters.lightSpectrum);
            modified = true;
        }

        if (parameters.balance != null) {
            store.addDeconvolutionBalance(parameters.balance, date, parameters.info, parameters.lightSpectrum);
            modified = true;
        }

        if (parameters.lens != null) {
            store.addLens(Path.of(parameters.lens), date, parameters.info, parameters.lightSpectrum);
            modified = true;
        }

        if ((parameters.noise != null) && (! parameters.noise.isEmpty())) {
            final double[] coefficients = parameters.noise.stream().mapToDouble(Double::doubleValue).toArray();
            store.addNoise(coefficients, date, parameters.info, null);
            modified = true;
        }

        if (parameters.deleteCategory != null) {
            store.deleteCoeff(CalibrationCategory.fromName(parameters.deleteCategory), date, parameters.lightSpectrum);
            modified = true;
        }

        if (parameters.clearOld) {
            store.clearOldCalibrations();
            modified = true;
        }

        if (parameters.transpose) {
            store.transpose();
            modified = true;
        }

        if (modified) {
            final Path savedPath = store.save(calibrationPath);
            LOG.info("updateCalibrationFile: saved {}", savedPath);
        }

        if (parameters.overview) {
            System.out.println(store.overview());
        }

        return store;
    }

    private CoefficientArray loadArray(final String imagePath) {
        return CoefficientArray.fromProcessor(imageLoader.load(imagePath));
    }

    private static final Logger LOG = LoggerFactory.getLogger(CalibrationFileClient.class);
}
