package org.janelia.calibration.spec;

import java.text.ParsePosition;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion between calibration dates and their text representation (e.g. "30 Nov 15 - 13:20").
 *
 * @author Eric Trautman
 */
public class CalibrationDates {

    public static final String DATE_FORMAT_STRING = "dd MMM yy - HH:mm";

    /** Patterns accepted when parsing, in order of preference. */
    private static final String[] PARSE_FORMAT_STRINGS = {
            DATE_FORMAT_STRING,
            "dd. MMM yy - HH:mm",
            "dd MMM yy",
            "dd. MMM yy",
            "yyyy-MM-dd HH:mm",
            "yyyy-MM-dd"
    };

    public static SimpleDateFormat getDateFormat() {
        return buildFormat(DATE_FORMAT_STRING);
    }

    /**
     * @return text representation of the specified date ("None" for null dates).
     */
    public static String format(final Date date) {
        return date == null ? "None" : getDateFormat().format(date);
    }

    /**
     * @param  text  date text in one of the supported formats.
     *
     * @return the parsed date.
     *
     * @throws IllegalArgumentException
     *   if the text is null or cannot be parsed.
     */
    public static Date parse(final String text)
            throws IllegalArgumentException {

        if (text == null) {
            throw new IllegalArgumentException("date text is null");
        }

        final String trimmedText = text.trim();
        for (final String formatString : PARSE_FORMAT_STRINGS) {
            final ParsePosition position = new ParsePosition(0);
            final Date date = buildFormat(formatString).parse(trimmedText, position);
            if ((date != null) && (position.getIndex() == trimmedText.length())) {
                return date;
            }
        }

        throw new IllegalArgumentException("invalid date '" + text + "', expected format is '" +
                                           DATE_FORMAT_STRING + "' (e.g. '30 Nov 15 - 13:20')");
    }

    /**
     * @return the parsed date, or null if the text is null, blank, or invalid (invalid text is logged).
     */
    public static Date parseOrNull(final String text) {
        Date date = null;
        if ((text != null) && (! text.isBlank())) {
            try {
                date = parse(text);
            } catch (final IllegalArgumentException e) {
                LOG.warn("parseOrNull: {}", e.getMessage());
            }
        }
        return date;
    }

    private static SimpleDateFormat buildFormat(final String formatString) {
        final SimpleDateFormat dateFormat = new SimpleDateFormat(formatString, Locale.ENGLISH);
        dateFormat.setLenient(false);
        return dateFormat;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CalibrationDates.class);
}
