package com.di.flightwarehouse.dimension;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Carrier dimension row. {@code dotId} is the DOT numeric airline id from the first file that mentioned the carrier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Carrier {
    private String code;
    private String name;
    private Integer dotId;
}
