package com.di.flightwarehouse.dimension;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Derives calendar attributes for the date dimension.
 */
public final class DateDimensions {

    private DateDimensions() {
    }

    public static DateDim derive(LocalDate date) {
        int month = date.getMonthValue();
        int dayOfWeek = date.getDayOfWeek().getValue() - 1;
        return DateDim.builder()
                .date(date)
                .year(date.getYear())
                .quarter((month - 1) / 3 + 1)
                .month(month)
                .dayOfMonth(date.getDayOfMonth())
                .dayOfWeek(dayOfWeek)
                .dayName(date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .monthName(date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .weekend(dayOfWeek >= 5)
                .season(seasonOf(month))
                .build();
    }

    /** Meteorological (northern hemisphere) season for a month 1-12. */
    public static String seasonOf(int month) {
        switch (month) {
            case 12, 1, 2:
                return "Winter";
            case 3, 4, 5:
                return "Spring";
            case 6, 7, 8:
                return "Summer";
            default:
                return "Fall";
        }
    }
}
