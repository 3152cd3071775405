package com.flagship.fiscal_ledger.calendar;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Date conversion endpoints.
 */
@RestController
@RequestMapping("/api/calendar")
@RequiredArgsConstructor
public class CalendarController {

    private final CalendarConverter calendarConverter;

    @GetMapping("/to-secondary")
    public ResponseEntity<Map<String, Object>> toSecondary(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        SecondaryCalendarDate secondary = calendarConverter.toSecondary(date);
        return ResponseEntity.ok(describe(date, secondary));
    }

    @GetMapping("/to-gregorian")
    public ResponseEntity<Map<String, Object>> toGregorian(@RequestParam("date") String date) {
        SecondaryCalendarDate secondary = calendarConverter.parse(date);
        return ResponseEntity.ok(describe(calendarConverter.toGregorian(secondary), secondary));
    }

    private Map<String, Object> describe(LocalDate gregorian, SecondaryCalendarDate secondary) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("gregorian", gregorian.toString());
        body.put("secondary", secondary.toString());
        body.put("secondaryFormatted", secondary.format("DD MMMM YYYY"));
        body.put("fiscalYear", calendarConverter.fiscalYearNameOf(secondary));
        return body;
    }
}
