package com.company.anomaly.service;

import com.company.anomaly.config.DetectionConfig;
import com.company.anomaly.domain.BaselineRecord;
import com.company.anomaly.domain.BaselineSnapshot;
import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.Reference;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference value of a slot: the same-day trend averaged with the long-run baseline.
 * Reads only the cycle's snapshot.
 */
@Component
public class ReferenceResolver {

    /**
     * @return empty when neither a same-day value nor a baseline record exists
     */
    public Optional<Reference> resolve(TimeSlot slot, Instant windowStart,
                                       BaselineSnapshot snapshot, DetectionConfig config) {
        List<Double> sameDay = sameDayValues(slot, windowStart, snapshot, config);
        Optional<BaselineRecord> own = snapshot.record(slot);

        if (sameDay.isEmpty() && own.isEmpty()) {
            return Optional.empty();
        }

        Double sameDayValue = sameDay.isEmpty()
                ? null
                : sameDay.stream().mapToDouble(Double::doubleValue).average().orElseThrow();

        return Optional.of(Reference.builder()
                .sameDayValue(sameDayValue)
                .sameDayCount(sameDay.size())
                .historicalValue(own.map(r -> r.flooredMean(config.getFloorValue())).orElse(null))
                .historicalMean(own.map(BaselineRecord::getMean).orElse(null))
                .build());
    }

    /**
     * Floored values of the preceding slots of the same day, nearest first. The value
     * written in the exact preceding window wins over the slot's long-run mean.
     */
    List<Double> sameDayValues(TimeSlot slot, Instant windowStart,
                               BaselineSnapshot snapshot, DetectionConfig config) {
        Map<Instant, PeriodOfWeek> earlier = TimeUtils.sameDayWindowsBefore(
                windowStart, config.getSameDayWindowCount(), config.getZoneId());
        List<Double> values = new ArrayList<>(earlier.size());

        earlier.forEach((window, period) -> {
            TimeSlot predecessor = slot.withPeriod(period);
            Optional<Double> value = snapshot.sampleAt(predecessor, window);
            if (value.isEmpty()) {
                value = snapshot.record(predecessor).map(BaselineRecord::getMean);
            }
            value.ifPresent(v -> values.add(config.floor(v)));
        });
        return values;
    }
}
