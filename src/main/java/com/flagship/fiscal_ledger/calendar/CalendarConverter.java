package com.flagship.fiscal_ledger.calendar;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts dates between the Gregorian and Bikram Sambat calendars.
 *
 * Conversion walks month by month from a fixed anchor pair
 * (BS 2080-01-01 = AD 2023-04-14) using the month lengths in {@link MonthLengthTable}.
 *
 * Years outside the table are rejected with a {@link ValidationException} unless
 * {@code ledger.calendar.strict-year-range} is false, in which case the converter
 * falls back to 30-day months. That fallback produces wrong dates and is only kept
 * for compatibility with data created before the strict check existed.
 */
@Component
@Slf4j
public class CalendarConverter {

    static final SecondaryCalendarDate ANCHOR_SECONDARY = SecondaryCalendarDate.of(2080, 1, 1);
    static final LocalDate ANCHOR_GREGORIAN = LocalDate.of(2023, 4, 14);

    private static final int FALLBACK_MONTH_LENGTH = 30;
    private static final int FISCAL_START_MONTH = 4;
    private static final int FISCAL_END_MONTH = 3;
    private static final Pattern PERIOD_NAME = Pattern.compile("^(\\d{4})/(\\d{2})$");

    private final boolean strictYearRange;
    private final Clock clock;

    public CalendarConverter(@Value("${ledger.calendar.strict-year-range:true}") boolean strictYearRange,
                             Clock clock) {
        this.strictYearRange = strictYearRange;
        this.clock = clock;
    }

    /**
     * Converts a Gregorian date to its Bikram Sambat equivalent.
     */
    public SecondaryCalendarDate toSecondary(LocalDate gregorian) {
        if (gregorian == null) {
            throw new ValidationException("Gregorian date is required");
        }
        long offset = ChronoUnit.DAYS.between(ANCHOR_GREGORIAN, gregorian);

        int year = ANCHOR_SECONDARY.getYear();
        int month = ANCHOR_SECONDARY.getMonth();
        long day = ANCHOR_SECONDARY.getDay() + offset;

        while (day > 0) {
            int monthDays = daysInMonth(year, month);
            if (day <= monthDays) {
                break;
            }
            day -= monthDays;
            month++;
            if (month > 12) {
                month = 1;
                year++;
            }
        }

        while (day <= 0) {
            month--;
            if (month < 1) {
                month = 12;
                year--;
            }
            day += daysInMonth(year, month);
        }

        return SecondaryCalendarDate.of(year, month, (int) day);
    }

    /**
     * Converts a Bikram Sambat date to Gregorian.
     * Day {@value SecondaryCalendarDate#TERMINAL_DAY} resolves to the last day of the month.
     */
    public LocalDate toGregorian(SecondaryCalendarDate secondary) {
        if (secondary == null) {
            throw new ValidationException("Calendar date is required");
        }
        int monthDays = daysInMonth(secondary.getYear(), secondary.getMonth());
        int day = secondary.isTerminal() ? monthDays : secondary.getDay();
        if (day > monthDays) {
            throw new ValidationException(String.format(Locale.ROOT, "Invalid day: %d (max: %d) for %04d-%02d",
                secondary.getDay(), monthDays, secondary.getYear(), secondary.getMonth()));
        }

        int anchorYear = ANCHOR_SECONDARY.getYear();
        int anchorMonth = ANCHOR_SECONDARY.getMonth();
        long totalDays = 0;

        if (secondary.getYear() > anchorYear) {
            for (int y = anchorYear; y < secondary.getYear(); y++) {
                totalDays += daysInYear(y);
            }
        } else if (secondary.getYear() < anchorYear) {
            for (int y = secondary.getYear(); y < anchorYear; y++) {
                totalDays -= daysInYear(y);
            }
        }

        if (secondary.getMonth() > anchorMonth) {
            for (int m = anchorMonth; m < secondary.getMonth(); m++) {
                totalDays += daysInMonth(secondary.getYear(), m);
            }
        } else if (secondary.getMonth() < anchorMonth) {
            for (int m = secondary.getMonth(); m < anchorMonth; m++) {
                totalDays -= daysInMonth(secondary.getYear(), m);
            }
        }

        totalDays += day - ANCHOR_SECONDARY.getDay();

        return ANCHOR_GREGORIAN.plusDays(totalDays);
    }

    /**
     * Number of days in a Bikram Sambat month.
     *
     * @throws ValidationException for years outside the table when strict mode is on
     */
    public int daysInMonth(int year, int month) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Invalid month: " + month);
        }
        if (MonthLengthTable.covers(year)) {
            return MonthLengthTable.daysIn(year, month);
        }
        if (strictYearRange) {
            throw new ValidationException("Unsupported calendar year: " + year
                + " (supported: " + MonthLengthTable.FIRST_YEAR + "-" + MonthLengthTable.LAST_YEAR + ")");
        }
        log.warn("Calendar year {} is outside the month table, assuming {}-day month {}",
            year, FALLBACK_MONTH_LENGTH, month);
        return FALLBACK_MONTH_LENGTH;
    }

    public int daysInYear(int year) {
        int total = 0;
        for (int month = 1; month <= 12; month++) {
            total += daysInMonth(year, month);
        }
        return total;
    }

    /**
     * Parses {@code YYYY-MM-DD} and checks the day exists in that month.
     * The terminal marker (day 32) is accepted for every month.
     */
    public SecondaryCalendarDate parse(String text) {
        SecondaryCalendarDate date = SecondaryCalendarDate.parse(text);
        int maxDays = daysInMonth(date.getYear(), date.getMonth());
        if (!date.isTerminal() && date.getDay() > maxDays) {
            throw new ValidationException(String.format(Locale.ROOT, "Invalid day: %d (max: %d)", date.getDay(), maxDays));
        }
        return date;
    }

    /**
     * Derives period boundaries from a {@code YYYY/YY} name such as {@code 2082/83}.
     *
     * The period runs from Shrawan 1 of the first year ({@code Y-04-01}) to the last day
     * of Ashad of the next year, recorded as {@code (Y+1)-03-32}.
     */
    public PeriodBounds periodBoundsFromName(String periodName) {
        int year = parseStartYear(periodName);

        SecondaryCalendarDate startSecondary = SecondaryCalendarDate.of(year, FISCAL_START_MONTH, 1);
        SecondaryCalendarDate endSecondary = SecondaryCalendarDate.endOfMonth(year + 1, FISCAL_END_MONTH);

        return new PeriodBounds(
            startSecondary,
            endSecondary,
            toGregorian(startSecondary),
            toGregorian(endSecondary)
        );
    }

    /**
     * Name of the fiscal period a date falls in, e.g. {@code 2082-04-01 -> "2082/83"}.
     */
    public String fiscalYearNameOf(SecondaryCalendarDate date) {
        int startYear = date.getMonth() >= FISCAL_START_MONTH ? date.getYear() : date.getYear() - 1;
        return String.format(Locale.ROOT, "%d/%02d", startYear, (startYear + 1) % 100);
    }

    public int firstSupportedYear() {
        return MonthLengthTable.FIRST_YEAR;
    }

    public int lastSupportedYear() {
        return MonthLengthTable.LAST_YEAR;
    }

    public SecondaryCalendarDate today() {
        return toSecondary(LocalDate.now(clock));
    }

    /**
     * Extracts the first year from a {@code YYYY/YY} period name.
     *
     * @throws ValidationException if the name is not of that shape or the years are not adjacent
     */
    public static int parseStartYear(String periodName) {
        if (periodName == null) {
            throw new ValidationException("Period name is required");
        }
        Matcher matcher = PERIOD_NAME.matcher(periodName.trim());
        if (!matcher.matches()) {
            throw new ValidationException("Period name must look like YYYY/YY: " + periodName);
        }
        int year = Integer.parseInt(matcher.group(1));
        int next = Integer.parseInt(matcher.group(2));
        if ((year + 1) % 100 != next) {
            throw new ValidationException("Period name must denote two adjacent years: " + periodName);
        }
        return year;
    }
}
