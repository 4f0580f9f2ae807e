package com.vaultledger.schedule;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Loan pricing and missed-payment policy.
 */
@ConfigurationProperties(prefix = "vaultledger.schedule")
@NoArgsConstructor
@Getter
@Setter
public class ScheduleProperties {

    /** Fixed annual interest rate in bps; the periodic rate is pro-rated by installment interval. */
    private int annualInterestBps = 500;
    /** Time after the due date before an unpaid installment is marked MISSED. */
    private long gracePeriodSeconds = 86_400L;
    /** Missed installments after which the position is flagged defaulted. */
    private int maxMissedPayments = 3;
    /** Shortest accepted installment interval. */
    private long minIntervalSeconds = 60L;
    /** Cron of the missed-installment check. */
    private String missedCheckCron = "0 0 * * * *";
}
