package com.di.flightwarehouse.fact;

import org.apache.commons.csv.CSVRecord;

import static com.di.flightwarehouse.storage.FactFileReader.field;
import static com.di.flightwarehouse.util.TypeCoercion.toDouble;
import static com.di.flightwarehouse.util.TypeCoercion.toFlag;
import static com.di.flightwarehouse.util.TypeCoercion.toInteger;
import static com.di.flightwarehouse.util.TypeCoercion.toStr;

/**
 * Maps an accepted BTS on-time record to a {@link FlightRecord}. Optional columns that are absent
 * from the file map to null.
 */
final class FlightRowMapper {

    private FlightRowMapper() {
    }

    static FlightRecord map(CSVRecord r, FlightKeyFields key) {
        return FlightRecord.builder()
                .flightDate(key.date().orElseThrow())
                .carrierCode(key.carrier())
                .tailNumber(toStr(field(r, "Tail_Number")))
                .flightNumber(toInteger(field(r, "Flight_Number_Reporting_Airline")))
                .originAirport(key.origin())
                .originCity(toStr(field(r, "OriginCityName")))
                .originState(toStr(field(r, "OriginState")))
                .destAirport(key.dest())
                .destCity(toStr(field(r, "DestCityName")))
                .destState(toStr(field(r, "DestState")))
                .scheduledDep(toStr(field(r, "CRSDepTime")))
                .actualDep(toStr(field(r, "DepTime")))
                .depDelay(toDouble(field(r, "DepDelay")))
                .depDelayMinutes(toDouble(field(r, "DepDelayMinutes")))
                .depDelay15(toFlag(field(r, "DepDel15")))
                .scheduledArr(toStr(field(r, "CRSArrTime")))
                .actualArr(toStr(field(r, "ArrTime")))
                .arrDelay(toDouble(field(r, "ArrDelay")))
                .arrDelayMinutes(toDouble(field(r, "ArrDelayMinutes")))
                .arrDelay15(toFlag(field(r, "ArrDel15")))
                .cancelled(toFlag(field(r, "Cancelled")))
                .cancellationCode(toStr(field(r, "CancellationCode")))
                .diverted(toFlag(field(r, "Diverted")))
                .distance(toDouble(field(r, "Distance")))
                .airTime(toDouble(field(r, "AirTime")))
                .scheduledElapsed(toDouble(field(r, "CRSElapsedTime")))
                .actualElapsed(toDouble(field(r, "ActualElapsedTime")))
                .carrierDelay(toDouble(field(r, "CarrierDelay")))
                .weatherDelay(toDouble(field(r, "WeatherDelay")))
                .nasDelay(toDouble(field(r, "NASDelay")))
                .securityDelay(toDouble(field(r, "SecurityDelay")))
                .lateAircraftDelay(toDouble(field(r, "LateAircraftDelay")))
                .build();
    }
}
