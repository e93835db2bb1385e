package org.janelia.calibration.spec;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All calibration data for one camera.
 * Newly constructed profiles have default metadata and no records,
 * loaded profiles are parsed into a new instance so that fields missing from older files keep these defaults.
 *
 * @author Eric Trautman
 */
public class CameraProfile
        implements Serializable {

    public static final String DEFAULT_NAME = "no camera";
    public static final int DEFAULT_BIT_DEPTH = 16;
    public static final int MAX_BIT_DEPTH = 32;
    public static final int CURRENT_FORMAT_VERSION = 2;

    private int formatVersion;
    private String name;
    private int bitDepth;
    private int[] referenceShape;
    private List<String> lightSpectra;

    private List<CalibrationRecord<DarkCurrentCoefficients>> darkCurrent;
    private Map<String, List<CalibrationRecord<CoefficientArray>>> flatField;
    private Map<String, List<CalibrationRecord<LensCoefficients>>> lens;
    private List<CalibrationRecord<NoiseLevelCoefficients>> noise;
    private Map<String, List<CalibrationRecord<CoefficientArray>>> psf;
    private Map<String, List<CalibrationRecord<DeconvolutionBalance>>> balance;

    private Double darkRmse;
    private Double sensitivityRmse;
    private Map<String, Double> vignettingRelativeUncertainty;

    public CameraProfile() {
        this.formatVersion = CURRENT_FORMAT_VERSION;
        this.name = DEFAULT_NAME;
        this.bitDepth = DEFAULT_BIT_DEPTH;
        this.referenceShape = null;
        this.lightSpectra = new ArrayList<>();
        this.darkCurrent = new ArrayList<>();
        this.flatField = new LinkedHashMap<>();
        this.lens = new LinkedHashMap<>();
        this.noise = new ArrayList<>();
        this.psf = new LinkedHashMap<>();
        this.balance = new LinkedHashMap<>();
        this.darkRmse = null;
        this.sensitivityRmse = null;
        this.vignettingRelativeUncertainty = new LinkedHashMap<>();
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    /**
     * @throws IllegalArgumentException
     *   if the bit depth is not between 1 and {@link #MAX_BIT_DEPTH}.
     */
    public void setBitDepth(final int bitDepth)
            throws IllegalArgumentException {
        if ((bitDepth < 1) || (bitDepth > MAX_BIT_DEPTH)) {
            throw new IllegalArgumentException("bit depth must be between 1 and " + MAX_BIT_DEPTH +
                                               ", specified value is " + bitDepth);
        }
        this.bitDepth = bitDepth;
    }

    /**
     * @return largest value the camera sensor can represent (2^bitDepth - 1).
     */
    public double getMaximumValue() {
        return Math.pow(2, bitDepth) - 1;
    }

    /**
     * @return rows and columns of the first array added to (or processed with) this profile, or null.
     */
    public int[] getReferenceShape() {
        return referenceShape == null ? null : referenceShape.clone();
    }

    public void setReferenceShape(final int[] referenceShape) {
        this.referenceShape = referenceShape == null ? null : referenceShape.clone();
    }

    public List<String> getLightSpectra() {
        return Collections.unmodifiableList(lightSpectra);
    }

    /**
     * Adds the specified spectrum to the end of the registered list if it is not already registered.
     *
     * @return true if the spectrum was newly registered.
     */
    public boolean registerLightSpectrum(final String lightSpectrum) {
        if (lightSpectrum == null) {
            throw new IllegalArgumentException("light spectrum must be specified");
        }
        boolean added = false;
        if (! lightSpectra.contains(lightSpectrum)) {
            lightSpectra.add(lightSpectrum);
            added = true;
        }
        return added;
    }

    public CategoryTable<DarkCurrentCoefficients> getDarkCurrentTable() {
        return CategoryTable.flat(darkCurrent);
    }

    public CategoryTable<CoefficientArray> getFlatFieldTable() {
        return CategoryTable.bySpectrum(flatField);
    }

    public CategoryTable<LensCoefficients> getLensTable() {
        return CategoryTable.bySpectrum(lens);
    }

    public CategoryTable<NoiseLevelCoefficients> getNoiseTable() {
        return CategoryTable.flat(noise);
    }

    public CategoryTable<CoefficientArray> getPsfTable() {
        return CategoryTable.bySpectrum(psf);
    }

    public CategoryTable<DeconvolutionBalance> getBalanceTable() {
        return CategoryTable.bySpectrum(balance);
    }

    public CategoryTable<? extends CalibrationPayload> getTable(final CalibrationCategory category) {
        final CategoryTable<? extends CalibrationPayload> table;
        switch (category) {
            case DARK_CURRENT: table = getDarkCurrentTable(); break;
            case FLAT_FIELD:   table = getFlatFieldTable(); break;
            case LENS:         table = getLensTable(); break;
            case NOISE:        table = getNoiseTable(); break;
            case PSF:          table = getPsfTable(); break;
            case BALANCE:      table = getBalanceTable(); break;
            default: throw new IllegalArgumentException("unsupported category " + category);
        }
        return table;
    }

    public Double getDarkRmse() {
        return darkRmse;
    }

    public void setDarkRmse(final Double darkRmse) {
        this.darkRmse = darkRmse;
    }

    public Double getSensitivityRmse() {
        return sensitivityRmse;
    }

    public void setSensitivityRmse(final Double sensitivityRmse) {
        this.sensitivityRmse = sensitivityRmse;
    }

    public Double getVignettingRelativeUncertainty(final String lightSpectrum) {
        return vignettingRelativeUncertainty.get(lightSpectrum);
    }

    public void setVignettingRelativeUncertainty(final String lightSpectrum,
                                                 final double relativeUncertainty) {
        vignettingRelativeUncertainty.put(lightSpectrum, relativeUncertainty);
    }

    /**
     * Marks this profile as written by the current format version (called before saving).
     */
    public void updateFormatVersion() {
        this.formatVersion = CURRENT_FORMAT_VERSION;
    }
}
