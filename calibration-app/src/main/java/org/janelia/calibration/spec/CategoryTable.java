package org.janelia.calibration.spec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * View of one category's records within a {@link CameraProfile}.
 * Spectrum independent categories hold a single {@link Flat} sequence,
 * spectrum dependent categories hold one sequence per light spectrum ({@link BySpectrum}).
 * Every sequence is kept in descending date order (newest first).
 *
 * @author Eric Trautman
 */
public abstract class CategoryTable<T extends CalibrationPayload> {

    public static <T extends CalibrationPayload> CategoryTable<T> flat(final List<CalibrationRecord<T>> records) {
        return new Flat<>(records);
    }

    public static <T extends CalibrationPayload> CategoryTable<T> bySpectrum(final Map<String, List<CalibrationRecord<T>>> map) {
        return new BySpectrum<>(map);
    }

    public abstract boolean isSpectrumKeyed();

    /**
     * @param  lightSpectrum  spectrum to look up (ignored for flat tables).
     *
     * @return records for the spectrum, or null if no sequence exists for it.
     */
    public abstract List<CalibrationRecord<T>> getRecords(final String lightSpectrum);

    /**
     * @return records for the spectrum, creating an empty sequence if none exists yet.
     */
    public abstract List<CalibrationRecord<T>> getOrCreateRecords(final String lightSpectrum);

    /**
     * @return spectra with sequences in this table in insertion order (empty for flat tables).
     */
    public abstract Set<String> getSpectra();

    /**
     * @return every sequence in this table.
     */
    public abstract Collection<List<CalibrationRecord<T>>> getAllRecordLists();

    public boolean isEmpty() {
        for (final List<CalibrationRecord<T>> records : getAllRecordLists()) {
            if (! records.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Replaces every record in every sequence with the operator's result.
     */
    public void replaceAll(final UnaryOperator<CalibrationRecord<T>> operator) {
        for (final List<CalibrationRecord<T>> records : getAllRecordLists()) {
            records.replaceAll(operator);
        }
    }

    /**
     * Removes all but the first (newest) record of every sequence.
     */
    public void retainNewest() {
        for (final List<CalibrationRecord<T>> records : getAllRecordLists()) {
            if (records.size() > 1) {
                records.subList(1, records.size()).clear();
            }
        }
    }

    public static class Flat<T extends CalibrationPayload>
            extends CategoryTable<T> {

        private final List<CalibrationRecord<T>> records;

        private Flat(final List<CalibrationRecord<T>> records) {
            this.records = records;
        }

        @Override
        public boolean isSpectrumKeyed() {
            return false;
        }

        @Override
        public List<CalibrationRecord<T>> getRecords(final String lightSpectrum) {
            return records;
        }

        @Override
        public List<CalibrationRecord<T>> getOrCreateRecords(final String lightSpectrum) {
            return records;
        }

        @Override
        public Set<String> getSpectra() {
            return Collections.emptySet();
        }

        @Override
        public Collection<List<CalibrationRecord<T>>> getAllRecordLists() {
            return Collections.singletonList(records);
        }
    }

    public static class BySpectrum<T extends CalibrationPayload>
            extends CategoryTable<T> {

        private final Map<String, List<CalibrationRecord<T>>> map;

        private BySpectrum(final Map<String, List<CalibrationRecord<T>>> map) {
            this.map = map;
        }

        @Override
        public boolean isSpectrumKeyed() {
            return true;
        }

        @Override
        public List<CalibrationRecord<T>> getRecords(final String lightSpectrum) {
            return map.get(lightSpectrum);
        }

        @Override
        public List<CalibrationRecord<T>> getOrCreateRecords(final String lightSpectrum) {
            return map.computeIfAbsent(lightSpectrum, k -> new ArrayList<>());
        }

        @Override
        public Set<String> getSpectra() {
            return Collections.unmodifiableSet(map.keySet());
        }

        @Override
        public Collection<List<CalibrationRecord<T>>> getAllRecordLists() {
            return map.values();
        }
    }
}
