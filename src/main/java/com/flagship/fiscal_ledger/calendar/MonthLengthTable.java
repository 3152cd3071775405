package com.flagship.fiscal_ledger.calendar;

import java.util.Map;

/**
 * Month lengths of the Bikram Sambat calendar for the years this service supports.
 *
 * BS month lengths are published per year and cannot be derived by formula.
 * Years outside [{@value #FIRST_YEAR}, {@value #LAST_YEAR}] are not covered.
 */
final class MonthLengthTable {

    static final int FIRST_YEAR = 2080;
    static final int LAST_YEAR = 2090;

    private static final Map<Integer, int[]> MONTH_DAYS = Map.ofEntries(
        Map.entry(2080, new int[] {31, 32, 31, 32, 31, 30, 30, 29, 30, 29, 30, 30}),
        Map.entry(2081, new int[] {31, 31, 32, 31, 31, 31, 30, 29, 30, 29, 30, 30}),
        Map.entry(2082, new int[] {31, 32, 31, 32, 31, 30, 30, 30, 29, 29, 30, 31}),
        Map.entry(2083, new int[] {30, 32, 31, 32, 31, 30, 30, 30, 29, 30, 29, 31}),
        Map.entry(2084, new int[] {31, 31, 32, 31, 31, 31, 30, 29, 30, 29, 30, 30}),
        Map.entry(2085, new int[] {31, 31, 32, 32, 31, 30, 30, 29, 30, 29, 30, 30}),
        Map.entry(2086, new int[] {31, 32, 31, 32, 31, 30, 30, 30, 29, 29, 30, 31}),
        Map.entry(2087, new int[] {30, 32, 31, 32, 31, 30, 30, 30, 29, 30, 29, 31}),
        Map.entry(2088, new int[] {31, 31, 32, 31, 31, 31, 30, 29, 30, 29, 30, 30}),
        Map.entry(2089, new int[] {31, 31, 32, 32, 31, 30, 30, 29, 30, 29, 30, 30}),
        Map.entry(2090, new int[] {31, 32, 31, 32, 31, 30, 30, 30, 29, 29, 30, 31})
    );

    private MonthLengthTable() {
    }

    static boolean covers(int year) {
        return MONTH_DAYS.containsKey(year);
    }

    /**
     * @throws IllegalArgumentException if the year is not covered; callers decide the policy
     */
    static int daysIn(int year, int month) {
        int[] months = MONTH_DAYS.get(year);
        if (months == null) {
            throw new IllegalArgumentException("No month table for year " + year);
        }
        return months[month - 1];
    }
}
