package org.janelia.calibration.correction;

import java.util.Collections;
import java.util.Date;
import java.util.EnumMap;
import java.util.Map;

import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationDates;

/**
 * Calibration dates to use for a correction: one date for every category,
 * a date per category, or neither (in which case the correction time is used).
 *
 * @author Eric Trautman
 */
public class CorrectionDates {

    private final Date commonDate;
    private final Map<CalibrationCategory, Date> categoryDates;

    private CorrectionDates(final Date commonDate,
                            final Map<CalibrationCategory, Date> categoryDates) {
        this.commonDate = commonDate == null ? null : new Date(commonDate.getTime());
        this.categoryDates = categoryDates;
    }

    public static CorrectionDates unset() {
        return new CorrectionDates(null, Collections.emptyMap());
    }

    public static CorrectionDates forAll(final Date date) {
        return new CorrectionDates(date, Collections.emptyMap());
    }

    public static CorrectionDates forCategories(final Map<CalibrationCategory, Date> dates) {
        final Map<CalibrationCategory, Date> copy = new EnumMap<>(CalibrationCategory.class);
        for (final Map.Entry<CalibrationCategory, Date> entry : dates.entrySet()) {
            if (entry.getValue() != null) {
                copy.put(entry.getKey(), new Date(entry.getValue().getTime()));
            }
        }
        return new CorrectionDates(null, copy);
    }

    /**
     * @param  date  formatted date for every category (null or invalid values select the newest records).
     */
    public static CorrectionDates parse(final String date) {
        return forAll(CalibrationDates.parseOrNull(date));
    }

    /**
     * @param  dates  formatted dates keyed by category name.
     *
     * @throws IllegalArgumentException
     *   if a key is not a category name.
     */
    public static CorrectionDates parse(final Map<String, String> dates)
            throws IllegalArgumentException {
        return parse(null, dates);
    }

    /**
     * @param  date   formatted date for categories without their own date (null to use the correction time).
     * @param  dates  formatted dates keyed by category name.
     *
     * @throws IllegalArgumentException
     *   if a key is not a category name.
     */
    public static CorrectionDates parse(final String date,
                                        final Map<String, String> dates)
            throws IllegalArgumentException {
        final Map<CalibrationCategory, Date> parsed = new EnumMap<>(CalibrationCategory.class);
        for (final Map.Entry<String, String> entry : dates.entrySet()) {
            final CalibrationCategory category = CalibrationCategory.fromName(entry.getKey());
            final Date categoryDate = CalibrationDates.parseOrNull(entry.getValue());
            if (categoryDate != null) {
                parsed.put(category, categoryDate);
            }
        }
        return new CorrectionDates(CalibrationDates.parseOrNull(date), parsed);
    }

    /**
     * @param  category  calibration category.
     * @param  now       correction time, used when no date was specified for the category.
     *
     * @return date to use for the category.
     */
    public Date resolve(final CalibrationCategory category,
                        final Date now) {
        Date date = categoryDates.get(category);
        if (date == null) {
            date = commonDate == null ? now : commonDate;
        }
        return date == null ? null : new Date(date.getTime());
    }

    @Override
    public String toString() {
        return commonDate == null ?
               "CorrectionDates{" + categoryDates + '}' :
               "CorrectionDates{all: " + CalibrationDates.format(commonDate) + '}';
    }
}
