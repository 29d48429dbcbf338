package org.kvplane.dao.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the routing endpoints
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {

    /**
     * Reservation key, not needed for query-only calls
     */
    private String requestId;

    private List<Integer> tokens;

    private Double overlapScoreWeight;

    private Double temperature;

    public RouterConfigOverride override() {
        if (overlapScoreWeight == null && temperature == null) {
            return null;
        }
        return new RouterConfigOverride(overlapScoreWeight, temperature);
    }
}
