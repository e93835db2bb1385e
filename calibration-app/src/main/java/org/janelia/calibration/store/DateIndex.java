package org.janelia.calibration.store;

import java.util.Date;
import java.util.List;

import org.janelia.calibration.spec.CalibrationRecord;

/**
 * Ordering and lookup helpers for record lists sorted by descending date (newest first).
 *
 * @author Eric Trautman
 */
public class DateIndex {

    /**
     * @return index at which a record with the specified date should be inserted to keep descending order
     *         (before the first strictly older record, records with equal dates stay in front).
     */
    public static int insertionIndex(final Date date,
                                     final List<? extends CalibrationRecord<?>> records) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getDate().before(date)) {
                return i;
            }
        }
        return records.size();
    }

    /**
     * Applies the date lookup rule:
     * a null date selects the newest record,
     * otherwise the first record not after the date is selected,
     * and the oldest record is selected when every record is after the date.
     *
     * @return index of the selected record, or -1 if the list is empty.
     */
    public static int indexOf(final List<? extends CalibrationRecord<?>> records,
                              final Date date) {
        if (records.isEmpty()) {
            return -1;
        }
        if (date == null) {
            return 0;
        }
        for (int i = 0; i < records.size(); i++) {
            if (! records.get(i).getDate().after(date)) {
                return i;
            }
        }
        return records.size() - 1;
    }

    /**
     * @return record selected by {@link #indexOf}, or null if the list is empty.
     */
    public static <R extends CalibrationRecord<?>> R find(final List<R> records,
                                                          final Date date) {
        final int index = indexOf(records, date);
        return index < 0 ? null : records.get(index);
    }

}
