package com.di.flightwarehouse.dimension;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Airport dimension row, keyed by 3-letter IATA code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Airport {
    private String code;
    private String name;
    private String city;
    private String state;
    private String country;
    private Double latitude;
    private Double longitude;
    private Integer altitude;
    private String timezone;
}
