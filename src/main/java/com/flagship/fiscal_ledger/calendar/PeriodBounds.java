package com.flagship.fiscal_ledger.calendar;

import lombok.Value;

import java.time.LocalDate;

/**
 * Start and end of a fiscal period in both calendars.
 * The secondary end keeps the terminal marker (day 32); the Gregorian end is the
 * actual last day it resolves to.
 */
@Value
public class PeriodBounds {
    SecondaryCalendarDate startSecondary;
    SecondaryCalendarDate endSecondary;
    LocalDate startGregorian;
    LocalDate endGregorian;
}
