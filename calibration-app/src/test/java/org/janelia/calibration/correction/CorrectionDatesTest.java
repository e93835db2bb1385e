package org.janelia.calibration.correction;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;

import org.janelia.calibration.spec.CalibrationCategory;
import org.janelia.calibration.spec.CalibrationDates;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CorrectionDates} class.
 *
 * @author Eric Trautman
 */
public class CorrectionDatesTest {

    @Test
    public void testResolve() {

        final Date now = CalibrationDates.parse("01 Jun 21 - 12:00");
        final Date flatFieldDate = CalibrationDates.parse("2015-11-13");

        Assert.assertEquals("unset dates should resolve to now",
                            now, CorrectionDates.unset().resolve(CalibrationCategory.LENS, now));
        Assert.assertEquals("invalid common date",
                            flatFieldDate,
                            CorrectionDates.parse("13 Nov 15").resolve(CalibrationCategory.PSF, now));
        Assert.assertEquals("invalid text should resolve to now",
                            now, CorrectionDates.parse("not a date").resolve(CalibrationCategory.PSF, now));

        final Map<String, String> dates = new HashMap<>();
        dates.put("flat field", "2015-11-13");
        final CorrectionDates categoryDates = CorrectionDates.parse(dates);

        Assert.assertEquals("invalid category date",
                            flatFieldDate, categoryDates.resolve(CalibrationCategory.FLAT_FIELD, now));
        Assert.assertEquals("other categories should resolve to now",
                            now, categoryDates.resolve(CalibrationCategory.DARK_CURRENT, now));
    }

    @Test
    public void testCommonAndCategoryDates() {
        final Date now = CalibrationDates.parse("01 Jun 21 - 12:00");
        final Map<String, String> dates = new HashMap<>();
        dates.put("lens", "2015-11-13");
        dates.put("psf", "not a date");

        final CorrectionDates correctionDates = CorrectionDates.parse("30 Nov 15 - 13:20", dates);

        Assert.assertEquals("invalid lens date",
                            CalibrationDates.parse("2015-11-13"),
                            correctionDates.resolve(CalibrationCategory.LENS, now));
        Assert.assertEquals("invalid date should fall back to the common date",
                            CalibrationDates.parse("30 Nov 15 - 13:20"),
                            correctionDates.resolve(CalibrationCategory.PSF, now));
        Assert.assertEquals("invalid noise date",
                            CalibrationDates.parse("30 Nov 15 - 13:20"),
                            correctionDates.resolve(CalibrationCategory.NOISE, now));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCategory() {
        final Map<String, String> dates = new HashMap<>();
        dates.put("sharpness", "2015-11-13");
        CorrectionDates.parse(dates);
    }

}
