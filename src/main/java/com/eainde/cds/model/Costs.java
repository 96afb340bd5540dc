package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Annual cost of attendance in whole currency units.
 * {@code totalCOA} is exactly {@code tuition + fees + roomAndBoard}.
 */
public record Costs(
        @JsonProperty("tuition")      int tuition,
        @JsonProperty("fees")         int fees,
        @JsonProperty("roomAndBoard") int roomAndBoard,
        @JsonProperty("totalCOA")     int totalCOA
) {

    public static Costs of(int tuition, int fees, int roomAndBoard) {
        return new Costs(tuition, fees, roomAndBoard, tuition + fees + roomAndBoard);
    }
}
