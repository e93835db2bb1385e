package org.janelia.calibration.store;

import ij.process.FloatProcessor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.janelia.calibration.json.JsonUtils;
import org.janelia.calibration.lens.PolynomialLensDistortion;
import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationDates;
import org.janelia.calibration.spec.CalibrationPayload;
import org.janelia.calibration.spec.CalibrationRecord;
import org.janelia.calibration.spec.CameraProfile;
import org.janelia.calibration.spec.CategoryTable;
import org.janelia.calibration.spec.CoefficientArray;
import org.janelia.calibration.spec.DarkCurrentCoefficients;
import org.janelia.calibration.spec.DeconvolutionBalance;
import org.janelia.calibration.spec.LensCoefficients;
import org.janelia.calibration.spec.NoiseLevelCoefficients;
import org.janelia.calibration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time indexed repository of calibration coefficients for one camera.
 *
 * Every category keeps its records in descending date order (newest first).
 * Lookups select the newest record that is not after the requested date
 * (see {@link DateIndex#indexOf} for the complete rule).
 * Spectrum dependent lookups fall back to the first spectrum stored for the category
 * when the requested spectrum has no records.
 *
 * Instances are not thread safe.
 *
 * @author Eric Trautman
 */
public class CalibrationStore {

    public static final String FILE_EXTENSION = ".cal";
    public static final String DEFAULT_LIGHT_SPECTRUM = "visible";

    private CameraProfile profile;
    private final Clock clock;

    public CalibrationStore() {
        this(new CameraProfile(), Clock.systemDefaultZone());
    }

    /**
     * @param  profile  calibration data to manage.
     * @param  clock    source of the current time for records added without a date.
     */
    public CalibrationStore(final CameraProfile profile,
                            final Clock clock) {
        this.profile = profile;
        this.clock = clock;
    }

    public CameraProfile getProfile() {
        return profile;
    }

    public String getName() {
        return profile.getName();
    }

    public int getBitDepth() {
        return profile.getBitDepth();
    }

    public int[] getReferenceShape() {
        return profile.getReferenceShape();
    }

    public List<String> getLightSpectra() {
        return profile.getLightSpectra();
    }

    public void setCamera(final String name,
                          final int bitDepth) {
        profile.setBitDepth(bitDepth);
        profile.setName(name);
    }

    // ------------------------------------------------------------------------------------------
    // add operations

    /**
     * Adds dark current data.
     *
     * @param  slope      background increase per second of exposure,
     *                    or the constant background if no intercept is specified.
     * @param  intercept  background at zero exposure time (null for constant backgrounds).
     * @param  date       calibration date (null for now).
     * @param  info       description of the calibration.
     * @param  error      absolute error (null if unknown).
     *
     * @throws ShapeMismatchException
     *   if either array's rows and columns differ from the reference shape.
     */
    public void addDarkCurrent(final CoefficientArray slope,
                               final CoefficientArray intercept,
                               final Date date,
                               final String info,
                               final CoefficientArray error)
            throws ShapeMismatchException {

        checkShape(slope);
        if (intercept != null) {
            checkShape(intercept);
        }

        final DarkCurrentCoefficients coefficients = intercept == null ?
                                                     DarkCurrentCoefficients.constant(slope) :
                                                     DarkCurrentCoefficients.linear(intercept, slope);

        insert(CalibrationCategory.DARK_CURRENT, profile.getDarkCurrentTable(), null,
               new CalibrationRecord<>(dateOrNow(date), info, coefficients, error));
    }

    public void addNoise(final double[] noiseLevelCoefficients,
                         final Date date,
                         final String info,
                         final CoefficientArray error) {
        insert(CalibrationCategory.NOISE, profile.getNoiseTable(), null,
               new CalibrationRecord<>(dateOrNow(date), info, new NoiseLevelCoefficients(noiseLevelCoefficients), error));
    }

    public void addFlatField(final CoefficientArray flatField,
                             final Date date,
                             final String info,
                             final String lightSpectrum,
                             final CoefficientArray error)
            throws ShapeMismatchException {

        final String light = registerLight(lightSpectrum);
        checkShape(flatField);

        insert(CalibrationCategory.FLAT_FIELD, profile.getFlatFieldTable(), light,
               new CalibrationRecord<>(dateOrNow(date), info, flatField, error));
    }

    public void addPSF(final CoefficientArray psf,
                       final Date date,
                       final String info,
                       final String lightSpectrum) {
        final String light = registerLight(lightSpectrum);
        insert(CalibrationCategory.PSF, profile.getPsfTable(), light,
               new CalibrationRecord<>(dateOrNow(date), info, psf, null));
    }

    public void addDeconvolutionBalance(final double balance,
                                        final Date date,
                                        final String info,
                                        final String lightSpectrum) {
        final String light = registerLight(lightSpectrum);
        insert(CalibrationCategory.BALANCE, profile.getBalanceTable(), light,
               new CalibrationRecord<>(dateOrNow(date), info, new DeconvolutionBalance(balance), null));
    }

    public void addLens(final PolynomialLensDistortion lens,
                        final Date date,
                        final String info,
                        final String lightSpectrum) {
        final String light = registerLight(lightSpectrum);
        insert(CalibrationCategory.LENS, profile.getLensTable(), light,
               new CalibrationRecord<>(dateOrNow(date), info, lens.getCoefficients(), null));
    }

    /**
     * Loads a serialized lens model and adds its coefficients.
     *
     * @throws IOException
     *   if the lens model cannot be loaded.
     */
    public void addLens(final Path lensModelPath,
                        final Date date,
                        final String info,
                        final String lightSpectrum)
            throws IOException {
        addLens(PolynomialLensDistortion.load(lensModelPath), date, info, lightSpectrum);
    }

    // ------------------------------------------------------------------------------------------
    // query operations

    /**
     * @return formatted dates of all records for the category and spectrum (newest first),
     *         or an empty list if none exist.
     */
    public List<String> dates(final CalibrationCategory category,
                              final String lightSpectrum) {
        final List<String> dates = new ArrayList<>();
        final List<? extends CalibrationRecord<?>> records = profile.getTable(category).getRecords(lightSpectrum);
        if (records != null) {
            for (final CalibrationRecord<?> record : records) {
                dates.add(CalibrationDates.format(record.getDate()));
            }
        }
        return dates;
    }

    /**
     * @return infos of all records for the category and spectrum (newest first).
     */
    public List<String> infos(final CalibrationCategory category,
                              final String lightSpectrum) {
        final List<String> infos = new ArrayList<>();
        final List<? extends CalibrationRecord<?>> records = profile.getTable(category).getRecords(lightSpectrum);
        if (records != null) {
            for (final CalibrationRecord<?> record : records) {
                infos.add(record.getInfo());
            }
        }
        return infos;
    }

    /**
     * @return info of the record selected for the date, or null if no record exists.
     */
    public String info(final CalibrationCategory category,
                       final String lightSpectrum,
                       final Date date) {
        final CalibrationRecord<?> record = getCoeff(category, lightSpectrum, date);
        return record == null ? null : record.getInfo();
    }

    public CalibrationRecord<? extends CalibrationPayload> getCoeff(final CalibrationCategory category,
                                                                    final String lightSpectrum,
                                                                    final String date) {
        return getCoeff(category, lightSpectrum, CalibrationDates.parseOrNull(date));
    }

    /**
     * @return the record that applies for the spectrum and date, or null if the category has no records.
     */
    public CalibrationRecord<? extends CalibrationPayload> getCoeff(final CalibrationCategory category,
                                                                    final String lightSpectrum,
                                                                    final Date date) {
        return lookup(category, profile.getTable(category), lightSpectrum, date);
    }

    public CalibrationRecord<DarkCurrentCoefficients> getDarkCurrent(final Date date) {
        return lookup(CalibrationCategory.DARK_CURRENT, profile.getDarkCurrentTable(), null, date);
    }

    public CalibrationRecord<NoiseLevelCoefficients> getNoise(final Date date) {
        return lookup(CalibrationCategory.NOISE, profile.getNoiseTable(), null, date);
    }

    public CalibrationRecord<CoefficientArray> getFlatField(final String lightSpectrum,
                                                            final Date date) {
        return lookup(CalibrationCategory.FLAT_FIELD, profile.getFlatFieldTable(), lightSpectrum, date);
    }

    public CalibrationRecord<LensCoefficients> getLensCoefficients(final String lightSpectrum,
                                                                   final Date date) {
        return lookup(CalibrationCategory.LENS, profile.getLensTable(), lightSpectrum, date);
    }

    public CalibrationRecord<CoefficientArray> getPsf(final String lightSpectrum,
                                                      final Date date) {
        return lookup(CalibrationCategory.PSF, profile.getPsfTable(), lightSpectrum, date);
    }

    public CalibrationRecord<DeconvolutionBalance> getBalance(final String lightSpectrum,
                                                              final Date date) {
        return lookup(CalibrationCategory.BALANCE, profile.getBalanceTable(), lightSpectrum, date);
    }

    /**
     * @return lens model for the spectrum and date, or null if no lens calibration exists.
     */
    public PolynomialLensDistortion getLens(final String lightSpectrum,
                                            final Date date) {
        final CalibrationRecord<LensCoefficients> record = getLensCoefficients(lightSpectrum, date);
        return record == null ? null : new PolynomialLensDistortion(record.getPayload());
    }

    /**
     * @return spectrum whose records are used for lookups of the requested spectrum:
     *         the requested spectrum itself, the first spectrum stored for the category,
     *         or null if the category has no spectrum sequences (always null for spectrum independent categories).
     */
    public String resolveSpectrum(final CalibrationCategory category,
                                  final String lightSpectrum) {
        final CategoryTable<? extends CalibrationPayload> table = profile.getTable(category);
        if (! table.isSpectrumKeyed()) {
            return null;
        }
        if ((lightSpectrum != null) && (table.getRecords(lightSpectrum) != null)) {
            return lightSpectrum;
        }
        final Iterator<String> spectra = table.getSpectra().iterator();
        return spectra.hasNext() ? spectra.next() : null;
    }

    /**
     * Builds a background image from the dark current calibration.
     *
     * @param  exposureTime  exposure time in seconds (required for linear dark current calibrations).
     * @param  date          calibration date (null for newest).
     *
     * @return background image.
     *
     * @throws MissingCalibrationException
     *   if no dark current calibration exists.
     */
    public FloatProcessor calcDarkCurrent(final Double exposureTime,
                                          final Date date)
            throws MissingCalibrationException {
        final CalibrationRecord<DarkCurrentCoefficients> record = getDarkCurrent(date);
        if (record == null) {
            throw new MissingCalibrationException(CalibrationCategory.DARK_CURRENT, "no dark current calibration found");
        }
        return record.getPayload().backgroundFor(exposureTime, profile.getMaximumValue()).toFloatProcessor();
    }

    // ------------------------------------------------------------------------------------------
    // maintenance operations

    public void deleteCoeff(final CalibrationCategory category,
                            final String date,
                            final String lightSpectrum)
            throws MissingCalibrationException {
        deleteCoeff(category, date == null ? null : CalibrationDates.parse(date), lightSpectrum);
    }

    /**
     * Removes the record selected for the specified date.
     *
     * @throws MissingCalibrationException
     *   if the category has no records for the spectrum.
     */
    public void deleteCoeff(final CalibrationCategory category,
                            final Date date,
                            final String lightSpectrum)
            throws MissingCalibrationException {

        final CategoryTable<? extends CalibrationPayload> table = profile.getTable(category);
        final List<? extends CalibrationRecord<?>> records = table.getRecords(lightSpectrum);
        final int index = records == null ? -1 : DateIndex.indexOf(records, date);

        if (index < 0) {
            throw new MissingCalibrationException(category,
                                                  "no " + category + " calibration for date " +
                                                  CalibrationDates.format(date) +
                                                  (table.isSpectrumKeyed() ? " and light spectrum " + lightSpectrum : ""));
        }

        final CalibrationRecord<?> removed = records.remove(index);

        LOG.info("deleteCoeff: removed {} record {}", category, removed);
    }

    /**
     * Removes all but the newest record of every category and spectrum.
     */
    public void clearOldCalibrations() {
        for (final CalibrationCategory category : CalibrationCategory.values()) {
            profile.getTable(category).retainNewest();
        }
        LOG.info("clearOldCalibrations: retained newest records only");
    }

    /**
     * Swaps the first two axes of every stored array whose rows and columns match the reference shape
     * and flips the reference shape itself.
     */
    public void transpose() {
        final int[] referenceShape = profile.getReferenceShape();
        if (referenceShape == null) {
            LOG.info("transpose: no reference shape set, nothing to transpose");
            return;
        }

        for (final CalibrationCategory category : CalibrationCategory.values()) {
            transposeTable(profile.getTable(category), referenceShape);
        }

        profile.setReferenceShape(new int[] {referenceShape[1], referenceShape[0]});

        LOG.info("transpose: reference shape changed from {} to {}",
                 CoefficientArray.shapeString(referenceShape),
                 CoefficientArray.shapeString(profile.getReferenceShape()));
    }

    public void setUncertaintyInputs(final Double darkRmse,
                                     final Double sensitivityRmse) {
        profile.setDarkRmse(darkRmse);
        profile.setSensitivityRmse(sensitivityRmse);
    }

    public void setVignettingRelativeUncertainty(final String lightSpectrum,
                                                 final double relativeUncertainty) {
        profile.setVignettingRelativeUncertainty(lightSpectrum, relativeUncertainty);
    }

    /**
     * Validates the rows and columns of an array against the reference shape,
     * setting the reference shape if none exists yet.
     *
     * @throws ShapeMismatchException
     *   if the array's rows and columns differ from the reference shape.
     */
    public void checkShape(final CoefficientArray array)
            throws ShapeMismatchException {
        if (array != null) {
            checkShape(array.getRows(), array.getColumns());
        }
    }

    public void checkShape(final int rows,
                           final int columns)
            throws ShapeMismatchException {
        final int[] referenceShape = profile.getReferenceShape();
        final int[] shape = {rows, columns};
        if (referenceShape == null) {
            profile.setReferenceShape(shape);
            LOG.debug("checkShape: reference shape set to {}", CoefficientArray.shapeString(shape));
        } else if ((referenceShape[0] != rows) || (referenceShape[1] != columns)) {
            throw new ShapeMismatchException(referenceShape, shape);
        }
    }

    // ------------------------------------------------------------------------------------------
    // persistence and reporting

    /**
     * Saves this store's profile (the .cal extension is appended if missing).
     *
     * @return path of the saved file.
     *
     * @throws IOException
     *   if the file cannot be written.
     */
    public Path save(final Path path)
            throws IOException {
        final Path calibrationPath = withFileExtension(path);
        profile.updateFormatVersion();
        FileUtil.saveJsonFile(calibrationPath, profile, JsonUtils.FAST_MAPPER);
        return calibrationPath;
    }

    public static CalibrationStore load(final Path path)
            throws IOException {
        return load(path, Clock.systemDefaultZone());
    }

    /**
     * Loads a saved profile (the .cal extension is appended if missing).
     * Loaded values are merged onto a new default profile,
     * so categories missing from older files are empty rather than undefined.
     *
     * @throws IOException
     *   if the file cannot be read or parsed.
     */
    public static CalibrationStore load(final Path path,
                                        final Clock clock)
            throws IOException {

        final Path calibrationPath = withFileExtension(path);
        final String json = FileUtil.readText(calibrationPath);

        final CameraProfile profile;
        try {
            profile = PROFILE_JSON_HELPER.updateFromJson(json, new CameraProfile());
        } catch (final IOException | RuntimeException e) {
            throw new IOException("failed to read " + calibrationPath, e);
        }

        LOG.info("load: loaded calibration for camera '{}' from {}", profile.getName(), calibrationPath);

        return new CalibrationStore(profile, clock);
    }

    public static Path withFileExtension(final Path path) {
        final String pathString = path.toString();
        return pathString.endsWith(FILE_EXTENSION) ? path : Path.of(pathString + FILE_EXTENSION);
    }

    /**
     * @return readable summary of camera metadata and all records (dates, infos, and shapes).
     */
    public String overview() {
        final StringBuilder sb = new StringBuilder();
        sb.append("camera name: ").append(profile.getName());
        sb.append("\nbit depth: ").append(profile.getBitDepth());
        sb.append(" (max value ").append((long) profile.getMaximumValue()).append(')');
        sb.append("\nreference shape: ").append(CoefficientArray.shapeString(profile.getReferenceShape()));
        sb.append("\nlight spectra: ").append(profile.getLightSpectra());

        for (final CalibrationCategory category : CalibrationCategory.values()) {
            sb.append('\n').append(category).append(':');
            final CategoryTable<? extends CalibrationPayload> table = profile.getTable(category);
            if (table.isSpectrumKeyed()) {
                for (final String light : table.getSpectra()) {
                    sb.append("\n\tlight: ").append(light);
                    appendRecords(sb, table.getRecords(light), "\t\t");
                }
            } else {
                appendRecords(sb, table.getRecords(null), "\t");
            }
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return "CalibrationStore{camera: '" + profile.getName() + "'}";
    }

    // ------------------------------------------------------------------------------------------
    // helpers

    private Date dateOrNow(final Date date) {
        return date == null ? Date.from(clock.instant()) : date;
    }

    private String registerLight(final String lightSpectrum) {
        final String light = lightSpectrum == null ? DEFAULT_LIGHT_SPECTRUM : lightSpectrum;
        if (profile.registerLightSpectrum(light)) {
            LOG.info("registerLight: registered light spectrum '{}'", light);
        }
        return light;
    }

    private <T extends CalibrationPayload> void insert(final CalibrationCategory category,
                                                       final CategoryTable<T> table,
                                                       final String lightSpectrum,
                                                       final CalibrationRecord<T> record) {
        final List<CalibrationRecord<T>> records = table.getOrCreateRecords(lightSpectrum);
        final int index = DateIndex.insertionIndex(record.getDate(), records);
        records.add(index, record);

        LOG.debug("insert: added {} record {} at index {}", category, record, index);
    }

    private <T extends CalibrationPayload> CalibrationRecord<T> lookup(final CalibrationCategory category,
                                                                       final CategoryTable<T> table,
                                                                       final String lightSpectrum,
                                                                       final Date date) {
        final List<CalibrationRecord<T>> records;
        if (table.isSpectrumKeyed()) {
            final String resolvedSpectrum = resolveSpectrum(category, lightSpectrum);
            if (resolvedSpectrum == null) {
                return null;
            }
            if ((lightSpectrum != null) && (! lightSpectrum.equals(resolvedSpectrum))) {
                LOG.warn("lookup: no {} calibration found for [{}] - using [{}] instead",
                         category, lightSpectrum, resolvedSpectrum);
            }
            records = table.getRecords(resolvedSpectrum);
        } else {
            records = table.getRecords(null);
        }
        return DateIndex.find(records, date);
    }

    private static <T extends CalibrationPayload> void transposeTable(final CategoryTable<T> table,
                                                                      final int[] referenceShape) {
        table.replaceAll(record -> record.withMappedArrays(
                array -> array.hasSpatialShape(referenceShape) ? array.transposed() : array));
    }

    private static void appendRecords(final StringBuilder sb,
                                      final List<? extends CalibrationRecord<?>> records,
                                      final String indent) {
        for (final CalibrationRecord<?> record : records) {
            sb.append('\n').append(indent).append("date: ").append(CalibrationDates.format(record.getDate()));
            sb.append('\n').append(indent).append("\tinfo: ").append(record.getInfo());
            sb.append("; ").append(record.getPayload().describe());
            if (record.getError() != null) {
                sb.append("; error:").append(record.getError().describe());
            }
        }
    }

    private static final JsonUtils.Helper<CameraProfile> PROFILE_JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, CameraProfile.class);

    private static final Logger LOG = LoggerFactory.getLogger(CalibrationStore.class);
}
