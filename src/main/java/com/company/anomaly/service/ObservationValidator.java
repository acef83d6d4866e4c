package com.company.anomaly.service;

import com.company.anomaly.domain.Observation;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.domain.ValidatedBatch;
import com.company.anomaly.exception.DataQualityException;
import com.company.anomaly.source.CategoryCount;
import com.company.anomaly.source.CountBatch;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns raw upstream counts into typed observations. A category with any bad entry
 * is skipped as a whole; the rest of the batch is unaffected.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ObservationValidator {

    static final Pattern CATEGORY_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:/-]{0,254}");

    private static final String MISSING_KEY = "<missing>";

    private final MeterRegistry meterRegistry;

    public ValidatedBatch validate(CountBatch batch, Instant windowStart, ZoneId zone) {
        Map<String, Long> totals = new TreeMap<>();
        Map<String, String> skipped = new TreeMap<>();

        for (CategoryCount count : batch.getCounts()) {
            try {
                String categoryKey = checkedKey(count.getCategoryKey());
                long value = checkedCount(categoryKey, count.getCount());
                totals.merge(categoryKey, value, Long::sum);
            } catch (DataQualityException e) {
                log.warn("Skipping category {} for window {}: {}", e.getCategoryKey(), windowStart, e.getMessage());
                skipped.putIfAbsent(e.getCategoryKey(), e.getMessage());
                meterRegistry.counter("anomaly.categories.skipped").increment();
            }
        }

        skipped.keySet().forEach(totals::remove);

        List<Observation> observations = new ArrayList<>(totals.size());
        totals.forEach((categoryKey, value) -> observations.add(Observation.builder()
                .slot(TimeSlot.at(categoryKey, windowStart, zone))
                .rawCount(value)
                .windowStart(windowStart)
                .build()));

        return new ValidatedBatch(Collections.unmodifiableList(observations), Collections.unmodifiableMap(skipped));
    }

    private static String checkedKey(String categoryKey) {
        if (categoryKey == null || categoryKey.isBlank()) {
            throw new DataQualityException(MISSING_KEY, "category key is missing");
        }
        if (!CATEGORY_KEY.matcher(categoryKey).matches()) {
            throw new DataQualityException(categoryKey, "malformed category key");
        }
        return categoryKey;
    }

    private static long checkedCount(String categoryKey, Number count) {
        if (count == null) {
            throw new DataQualityException(categoryKey, "count is missing");
        }
        if (count instanceof Long || count instanceof Integer || count instanceof Short || count instanceof Byte) {
            long value = count.longValue();
            if (value < 0) {
                throw new DataQualityException(categoryKey, "negative count " + value);
            }
            return value;
        }
        if (count instanceof BigInteger || count instanceof BigDecimal) {
            BigDecimal decimal = count instanceof BigInteger ? new BigDecimal((BigInteger) count) : (BigDecimal) count;
            if (decimal.signum() < 0) {
                throw new DataQualityException(categoryKey, "negative count " + decimal);
            }
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                throw new DataQualityException(categoryKey, "count is not a 64-bit integer: " + decimal);
            }
        }

        double value = count.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new DataQualityException(categoryKey, "count is not a finite number");
        }
        if (value < 0) {
            throw new DataQualityException(categoryKey, "negative count " + value);
        }
        if (value != Math.rint(value) || value > Long.MAX_VALUE) {
            throw new DataQualityException(categoryKey, "non-integral count " + value);
        }
        return (long) value;
    }
}
