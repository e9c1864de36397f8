package com.iotwatch.anomaly.rule;

import com.iotwatch.anomaly.model.TelemetryRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * {@code field comparator threshold}, e.g. {@code temperature > 100}.
 */
@Value
@Builder
@Jacksonized
public class RulePredicate {

    TelemetryField field;
    ComparisonOperator comparator;
    Double threshold;

    public boolean matches(TelemetryRecord record) {
        return comparator.test(field.extract(record), threshold);
    }

    public double valueOf(TelemetryRecord record) {
        return field.extract(record);
    }

    @Override
    public String toString() {
        return field.getKey() + " " + comparator.getSymbol() + " " + threshold;
    }
}
