package org.kvplane.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observed-versus-target ratios applied to the profile. 1.0 means the profile is accurate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionFactors {

    private double prefill = 1.0;

    private double decode = 1.0;

    public static CorrectionFactors identity() {
        return new CorrectionFactors(1.0, 1.0);
    }
}
