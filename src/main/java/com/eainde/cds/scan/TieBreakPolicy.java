package com.eainde.cds.scan;

/**
 * How the scanner picks one value when several claimed rows carry in-range candidates.
 */
public enum TieBreakPolicy {

    /** Largest surviving candidate across every claimed row. */
    MAX_WINS,

    /**
     * First surviving candidate of the first claimed row that has one; later claims are
     * ignored once the field is populated.
     */
    FIRST_NON_ZERO_WINS,

    /** Largest surviving candidate of the first claimed row that has one. */
    FIRST_ROW_MAX,

    /**
     * Minimum and maximum survivors of a row become a percentile pair; a row needs at least
     * two survivors. The last such row wins.
     */
    MIN_MAX_PAIR
}
