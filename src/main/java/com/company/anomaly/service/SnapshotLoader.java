package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.Observation;
import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.repository.BaselineStore;
import com.company.anomaly.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads everything a cycle needs from the baseline in one go, before any write
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotLoader {

    private final BaselineStore baselineStore;

    public BaselineSnapshot load(Collection<Observation> observations, Instant windowStart, DetectionConfig config) {
        Collection<PeriodOfWeek> earlier = TimeUtils.sameDayWindowsBefore(
                windowStart, config.getSameDayWindowCount(), config.getZoneId()).values();

        Set<TimeSlot> slots = new LinkedHashSet<>();
        for (Observation observation : observations) {
            TimeSlot slot = observation.getSlot();
            slots.add(slot);
            for (PeriodOfWeek predecessor : earlier) {
                slots.add(slot.withPeriod(predecessor));
            }
        }

        Instant historySince = windowStart.minus(TimeUtils.WEEK.multipliedBy(config.getBurstHistorySize()));

        BaselineSnapshot snapshot = new BaselineSnapshot(
                baselineStore.findAll(slots),
                baselineStore.findSamples(slots, historySince),
                baselineStore.knownCategories(),
                Instant.now());

        log.debug("Loaded snapshot for window {}: {} slots requested, {} records found",
                windowStart, slots.size(), snapshot.recordCount());
        return snapshot;
    }
}
