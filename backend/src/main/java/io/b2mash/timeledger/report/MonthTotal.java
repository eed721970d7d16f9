package io.b2mash.timeledger.report;

/**
 * Minutes attributed to one calendar month of the display timezone. Derived on demand, never
 * stored.
 *
 * @param month bucket key in {@code YYYY-MM} form
 * @param minutes finished-session minutes plus adjustment minutes; may be negative
 */
public record MonthTotal(String month, long minutes) {}
