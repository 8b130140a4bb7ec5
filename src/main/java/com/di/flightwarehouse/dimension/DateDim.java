package com.di.flightwarehouse.dimension;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Calendar dimension row. Every attribute is a pure function of {@link #date}; see {@link DateDimensions#derive}.
 */
@Value
@Builder
public class DateDim {
    LocalDate date;
    int year;
    int quarter;
    int month;
    int dayOfMonth;
    /** 0 = Monday .. 6 = Sunday. */
    int dayOfWeek;
    String dayName;
    String monthName;
    boolean weekend;
    String season;
}
