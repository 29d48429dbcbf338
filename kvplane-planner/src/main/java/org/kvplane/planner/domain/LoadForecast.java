package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Predicted traffic of the next interval. Every field is non-negative.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadForecast {

    private double requestCount;

    private double inputLen;

    private double outputLen;

    public static LoadForecast zero() {
        return new LoadForecast(0, 0, 0);
    }
}
