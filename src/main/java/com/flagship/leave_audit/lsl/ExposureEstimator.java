package com.flagship.leave_audit.lsl;

import com.flagship.leave_audit.rules.AuditParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Prices a heuristic LSL exposure band.
 *
 * Per employee with a known hourly rate, the expected hours band is:
 * <ul>
 *   <li>below eligibility: none</li>
 *   <li>at or above full tenure: 3 to 5 weeks</li>
 *   <li>in between: 1 to 3 weeks, scaled linearly from eligibility to full tenure</li>
 * </ul>
 * Any stated LSL balance is deducted from both bounds before multiplying by the hourly
 * rate. The result is indicative only; see {@link ExposureBand#NOTE}.
 */
@Service
@Slf4j
public class ExposureEstimator {

    static final int DAYS_PER_WEEK = 5;

    /**
     * Heuristic expected-hours band for a tenure.
     */
    public GapHours heuristicGapHours(double serviceYears, AuditParameters parameters) {
        double eligibilityYears = parameters.getLslEligibilityYears();
        double fullYears = parameters.getLslFullYears();
        double hoursPerWeek = parameters.getHoursPerDay() * DAYS_PER_WEEK;

        if (serviceYears < eligibilityYears) {
            return GapHours.NONE;
        }
        if (serviceYears >= fullYears) {
            return new GapHours(hoursPerWeek * 3, hoursPerWeek * 5);
        }

        if (!parameters.hasPartialServiceBand()) {
            return GapHours.NONE;
        }
        double factor = (serviceYears - eligibilityYears) / (fullYears - eligibilityYears);
        return new GapHours(hoursPerWeek * 1 * factor, hoursPerWeek * 3 * factor);
    }

    /**
     * Sums the priced band across employees that have an hourly rate. Unknown tenure
     * counts as zero years.
     */
    public ExposureBand estimate(List<LslState> states, AuditParameters parameters) {
        double totalLow = 0.0;
        double totalHigh = 0.0;
        int counted = 0;

        for (LslState state : states) {
            if (state.getHourlyRate() == null || state.getHourlyRate().isNaN()) {
                continue;
            }
            double serviceYears = state.getServiceYears() != null ? state.getServiceYears() : 0.0;
            GapHours gap = heuristicGapHours(serviceYears, parameters);
            if (state.hasLslBalance()) {
                gap = gap.minusBalance(state.getLslBalanceUnits());
            }

            totalLow += gap.getLow() * state.getHourlyRate();
            totalHigh += gap.getHigh() * state.getHourlyRate();
            counted++;
        }

        log.info("LSL exposure band (indicative only) across {} priced employees: {} - {} {}",
                counted, String.format("%.2f", totalLow), String.format("%.2f", totalHigh), ExposureBand.CURRENCY);
        return new ExposureBand(totalLow, totalHigh, counted);
    }
}
