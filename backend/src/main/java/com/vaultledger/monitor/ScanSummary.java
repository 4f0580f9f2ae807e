package com.vaultledger.monitor;

/**
 * Counts of one health scan, by live status after the scan.
 */
public record ScanSummary(int scanned, int healthy, int warning, int liquidatable, int failed) {

    public static ScanSummary empty() {
        return new ScanSummary(0, 0, 0, 0, 0);
    }
}
