package com.company.anomaly.repository;

import com.company.anomaly.domain.BaselineRecord;
import com.company.anomaly.domain.BaselineSample;
import com.company.anomaly.domain.TimeSlot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-slot rolling statistics.
 * <p>
 * {@link #upsert} must be a single atomic read-modify-write per slot so that overlapping
 * cycles never lose an update. Callers never read a record and write it back themselves.
 */
public interface BaselineStore {

    Optional<BaselineRecord> get(TimeSlot slot);

    List<BaselineRecord> findAll(Collection<TimeSlot> slots);

    List<BaselineRecord> findByCategory(String categoryKey);

    List<BaselineRecord> findUpdatedBetween(Instant from, Instant to);

    /**
     * Fold {@code value} into the slot's mean and stddev with the given weight.
     * Creates the record on first observation; replaces a placeholder outright.
     */
    void upsert(TimeSlot slot, double value, int sampleWeight, Instant at);

    /**
     * Remember the value written for the slot in one window
     */
    void appendSample(TimeSlot slot, Instant windowStart, double value);

    List<BaselineSample> findSamples(Collection<TimeSlot> slots, Instant since);

    /**
     * Insert zero-valued placeholders for every slot of {@link GridCompletion#expectedSlots}
     * that does not exist yet. Running it again inserts nothing.
     *
     * @return number of placeholders inserted
     */
    int ensureGridComplete(Collection<TimeSlot> slotsSeen, int sameDayWindowCount, Instant at);

    Set<String> knownCategories();

    /**
     * Records present as a percentage of the full week grid of every known category
     */
    double gridCompleteness();

    int purgeSamplesBefore(Instant cutoff);

    int purgeRecordsNotUpdatedSince(Instant cutoff);
}
