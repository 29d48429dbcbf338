package org.kvplane.dao.routing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request overrides of the scoring knobs. A null field keeps the configured value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouterConfigOverride {

    private Double overlapScoreWeight;

    private Double temperature;

    public double overlapScoreWeightOr(double defaultValue) {
        return overlapScoreWeight != null ? overlapScoreWeight : defaultValue;
    }

    public double temperatureOr(double defaultValue) {
        return temperature != null ? temperature : defaultValue;
    }
}
