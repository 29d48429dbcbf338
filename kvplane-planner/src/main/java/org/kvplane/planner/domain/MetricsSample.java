package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Traffic and latency observed over one adjustment interval
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSample {

    private Instant timestamp;

    private double requestCount;

    private double inputLen;

    private double outputLen;

    private double ttftMs;

    private double itlMs;

    public boolean hasTraffic() {
        return requestCount > 0;
    }
}
