package com.company.anomaly.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only view of the baseline taken before any write of a cycle.
 * Every observation of the cycle is judged against the same snapshot.
 */
public class BaselineSnapshot {

    private final Map<TimeSlot, BaselineRecord> records;
    private final Map<TimeSlot, List<BaselineSample>> samplesBySlot;
    @Getter
    private final Set<String> knownCategories;
    @Getter
    private final Instant takenAt;

    public BaselineSnapshot(Collection<BaselineRecord> records,
                            Collection<BaselineSample> samples,
                            Set<String> knownCategories,
                            Instant takenAt) {
        Map<TimeSlot, BaselineRecord> bySlot = new HashMap<>();
        for (BaselineRecord record : records) {
            bySlot.put(record.getSlot(), copyOf(record));
        }
        this.records = Collections.unmodifiableMap(bySlot);

        // newest first
        this.samplesBySlot = Collections.unmodifiableMap(samples.stream()
                .map(BaselineSnapshot::copyOf)
                .collect(Collectors.groupingBy(BaselineSample::getSlot,
                        Collectors.collectingAndThen(Collectors.toList(), list -> {
                            list.sort(Comparator.comparing(BaselineSample::getWindowStart).reversed());
                            return Collections.unmodifiableList(list);
                        }))));
        this.knownCategories = Set.copyOf(knownCategories);
        this.takenAt = takenAt;
    }

    public static BaselineSnapshot empty(Instant takenAt) {
        return new BaselineSnapshot(List.of(), List.of(), Set.of(), takenAt);
    }

    public Optional<BaselineRecord> record(TimeSlot slot) {
        return Optional.ofNullable(records.get(slot)).map(BaselineSnapshot::copyOf);
    }

    /**
     * Value written for the slot in exactly the given window, if any
     */
    public Optional<Double> sampleAt(TimeSlot slot, Instant windowStart) {
        return samplesBySlot.getOrDefault(slot, List.of()).stream()
                .filter(s -> s.getWindowStart().equals(windowStart))
                .map(BaselineSample::getValue)
                .findFirst();
    }

    /**
     * Same-slot values strictly before {@code before}, newest first
     */
    public List<Double> history(TimeSlot slot, Instant before, int limit) {
        return samplesBySlot.getOrDefault(slot, List.of()).stream()
                .filter(s -> s.getWindowStart().isBefore(before))
                .limit(limit)
                .map(BaselineSample::getValue)
                .collect(Collectors.toList());
    }

    public int recordCount() {
        return records.size();
    }

    private static BaselineRecord copyOf(BaselineRecord record) {
        return record.toBuilder().build();
    }

    private static BaselineSample copyOf(BaselineSample sample) {
        return BaselineSample.builder()
                .slot(sample.getSlot())
                .windowStart(sample.getWindowStart())
                .value(sample.getValue())
                .build();
    }
}
