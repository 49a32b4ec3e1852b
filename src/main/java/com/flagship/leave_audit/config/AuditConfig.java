package com.flagship.leave_audit.config;

import com.flagship.leave_audit.rules.AuditParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds rule thresholds from application properties.
 */
@Configuration
@Slf4j
public class AuditConfig {

    @Value("${audit.leakage.balance-tolerance:0.01}")
    private double balanceTolerance;

    @Value("${audit.leakage.risk-tolerance:0.25}")
    private double riskTolerance;

    @Value("${audit.lsl.eligibility-years:7.0}")
    private double eligibilityYears;

    @Value("${audit.lsl.full-years:10.0}")
    private double fullYears;

    @Value("${audit.lsl.hours-per-day:7.6}")
    private double hoursPerDay;

    @Value("${audit.lsl.hours-per-week:38.0}")
    private double hoursPerWeek;

    @Value("${audit.lsl.low-floor-units:20.0}")
    private double lowFloorUnits;

    @Bean
    public AuditParameters auditParameters() {
        AuditParameters parameters = AuditParameters.builder()
            .balanceTolerance(balanceTolerance)
            .riskTolerance(riskTolerance)
            .lslEligibilityYears(eligibilityYears)
            .lslFullYears(fullYears)
            .hoursPerDay(hoursPerDay)
            .hoursPerWeek(hoursPerWeek)
            .lslLowFloorUnits(lowFloorUnits)
            .build();
        if (!parameters.hasPartialServiceBand()) {
            log.warn("audit.lsl.full-years ({}) is not above audit.lsl.eligibility-years ({}); the partial service band is empty",
                fullYears, eligibilityYears);
        }
        log.debug("Audit parameters: {}", parameters);
        return parameters;
    }
}
