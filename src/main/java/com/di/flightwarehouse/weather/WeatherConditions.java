package com.di.flightwarehouse.weather;

/**
 * Coarse conditions label derived from precipitation, temperature and visibility.
 * Missing precipitation counts as none; missing visibility counts as clear (10 miles).
 */
public final class WeatherConditions {

    public static final String SNOW = "Snow";
    public static final String RAIN = "Rain";
    public static final String LIGHT_RAIN = "Light Rain";
    public static final String FOG = "Fog/Low Visibility";
    public static final String COLD_CLEAR = "Cold/Clear";
    public static final String CLEAR = "Clear";

    private static final double FREEZING_F = 32.0;

    private WeatherConditions() {
    }

    public static String determine(Double precipitation, Double temperature, Double visibility) {
        double precip = precipitation == null ? 0.0 : precipitation;
        double vis = visibility == null ? 10.0 : visibility;
        boolean freezing = temperature != null && temperature < FREEZING_F;

        if (precip > 0 && freezing) {
            return SNOW;
        } else if (precip > 0.1) {
            return RAIN;
        } else if (precip > 0) {
            return LIGHT_RAIN;
        } else if (vis < 3) {
            return FOG;
        } else if (freezing) {
            return COLD_CLEAR;
        }
        return CLEAR;
    }
}
