package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.domain.rule.SigmaRule;

import java.util.Set;

/**
 * Known coherent logsource (category, product) combinations.
 * Shared by the structural validator and the huntability scorer.
 */
public final class TelemetryCatalog {

    private static final Set<String> COMBINATIONS = Set.of(
            "process_creation/windows",
            "process_creation/linux",
            "process_creation/macos",
            "network_connection/windows",
            "network_connection/linux",
            "network_connection/macos",
            "file_access/windows",
            "file_access/linux",
            "file_access/macos",
            "registry_access/windows",
            "registry_change/windows",
            "dns_query/windows",
            "dns_query/linux",
            "dns_query/macos",
            "powershell/windows",
            "wmi/windows");

    private TelemetryCatalog() {
    }

    public static boolean isKnown(String category, String product) {
        return category != null && product != null && COMBINATIONS.contains(category + "/" + product);
    }

    /**
     * Categories that only exist in Windows telemetry.
     */
    public static boolean isWindowsOnly(String category) {
        return category != null
                && (category.startsWith("registry_") || category.equals("powershell") || category.startsWith("wmi"));
    }

    /**
     * Feasibility sub-score: 1.0 known, 0.7 unlisted pair, 0.5 one side only, 0.3 neither.
     */
    public static double feasibility(SigmaRule.LogSource logsource) {
        String category = logsource.normalizedCategory();
        String product = logsource.normalizedProduct();
        if (isKnown(category, product)) {
            return 1.0;
        }
        if (category != null && product != null) {
            return 0.7;
        }
        if (category != null || product != null) {
            return 0.5;
        }
        return 0.3;
    }
}
