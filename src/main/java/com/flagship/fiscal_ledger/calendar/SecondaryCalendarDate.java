package com.flagship.fiscal_ledger.calendar;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.util.Locale;

/**
 * A date in the Bikram Sambat calendar.
 *
 * Month lengths vary per year (29 to 32 days) and come from {@link MonthLengthTable},
 * so this value only checks the shape of its components. Whether the day actually
 * exists in that month is checked by {@link CalendarConverter}.
 *
 * Day {@value #TERMINAL_DAY} doubles as the "last day of the month" marker used for
 * fiscal period end boundaries.
 */
@Value
public class SecondaryCalendarDate implements Comparable<SecondaryCalendarDate> {

    public static final int TERMINAL_DAY = 32;

    private static final String[] MONTH_NAMES = {
        "Baishakh", "Jestha", "Ashad", "Shrawan",
        "Bhadra", "Ashwin", "Kartik", "Mangsir",
        "Poush", "Magh", "Falgun", "Chaitra"
    };

    int year;
    int month;
    int day;

    private SecondaryCalendarDate(int year, int month, int day) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Invalid month: " + month);
        }
        if (day < 1 || day > TERMINAL_DAY) {
            throw new ValidationException("Invalid day: " + day);
        }
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static SecondaryCalendarDate of(int year, int month, int day) {
        return new SecondaryCalendarDate(year, month, day);
    }

    /**
     * The end-of-month marker for the given month, e.g. {@code 2083-03-32}.
     */
    public static SecondaryCalendarDate endOfMonth(int year, int month) {
        return new SecondaryCalendarDate(year, month, TERMINAL_DAY);
    }

    /**
     * Parses {@code YYYY-MM-DD}. Only the shape is validated here.
     */
    public static SecondaryCalendarDate parse(String text) {
        if (text == null) {
            throw new ValidationException("Calendar date is required");
        }
        String[] parts = text.trim().split("-");
        if (parts.length != 3) {
            throw new ValidationException("Invalid date format: " + text + " (expected YYYY-MM-DD)");
        }
        try {
            return new SecondaryCalendarDate(
                Integer.parseInt(parts[0]),
                Integer.parseInt(parts[1]),
                Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid date format: " + text + " (expected YYYY-MM-DD)", e);
        }
    }

    public boolean isTerminal() {
        return day == TERMINAL_DAY;
    }

    public String monthName() {
        return MONTH_NAMES[month - 1];
    }

    /**
     * Formats the date. Supported patterns are {@code YYYY-MM-DD},
     * {@code DD MMM YYYY} and {@code DD MMMM YYYY}; anything else falls back to ISO form.
     */
    public String format(String pattern) {
        if (pattern == null) {
            return toString();
        }
        return switch (pattern) {
            case "DD MMM YYYY" -> day + " " + monthName().substring(0, 3) + " " + year;
            case "DD MMMM YYYY" -> day + " " + monthName() + " " + year;
            default -> toString();
        };
    }

    @Override
    public int compareTo(SecondaryCalendarDate other) {
        if (year != other.year) {
            return Integer.compare(year, other.year);
        }
        if (month != other.month) {
            return Integer.compare(month, other.month);
        }
        return Integer.compare(day, other.day);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day);
    }
}
