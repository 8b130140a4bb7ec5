package com.di.flightwarehouse.dimension;

import java.util.Map;

/**
 * Display names for reporting carrier codes seen in BTS data.
 */
public final class KnownCarriers {

    private static final Map<String, String> NAMES = Map.ofEntries(
            Map.entry("AA", "American Airlines"),
            Map.entry("DL", "Delta Air Lines"),
            Map.entry("UA", "United Airlines"),
            Map.entry("WN", "Southwest Airlines"),
            Map.entry("B6", "JetBlue Airways"),
            Map.entry("AS", "Alaska Airlines"),
            Map.entry("NK", "Spirit Airlines"),
            Map.entry("F9", "Frontier Airlines"),
            Map.entry("G4", "Allegiant Air"),
            Map.entry("HA", "Hawaiian Airlines"),
            Map.entry("SY", "Sun Country Airlines"),
            Map.entry("MX", "MexicanaLink"),
            Map.entry("OH", "PSA Airlines"),
            Map.entry("OO", "SkyWest Airlines"),
            Map.entry("YV", "Mesa Airlines"),
            Map.entry("YX", "Republic Airways"),
            Map.entry("QX", "Horizon Air"),
            Map.entry("MQ", "Envoy Air"),
            Map.entry("9E", "Endeavor Air"),
            Map.entry("EV", "ExpressJet Airlines"),
            Map.entry("PT", "Piedmont Airlines"),
            Map.entry("ZW", "Air Wisconsin"),
            Map.entry("CP", "Compass Airlines"),
            Map.entry("C5", "CommutAir"),
            Map.entry("G7", "GoJet Airlines"),
            Map.entry("KS", "Penair"));

    private KnownCarriers() {
    }

    /** Known display name, or the placeholder {@code "Carrier <code>"}. */
    public static String nameOf(String code) {
        return NAMES.getOrDefault(code, "Carrier " + code);
    }

    public static boolean isKnown(String code) {
        return NAMES.containsKey(code);
    }
}
