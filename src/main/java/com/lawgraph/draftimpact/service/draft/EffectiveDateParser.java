package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.dto.finding.EffectiveDateInfo;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads effective-date language from bill text. Forms are tried in a fixed order and the first
 * one that matches wins.
 */
@Component
public class EffectiveDateParser {

    private static final String MONTHS =
            "(january|february|march|april|may|june|july|august|september|october|november|december)";

    private static final Pattern DATE_OF_ENACTMENT = Pattern.compile(
            "(?i)(?:shall|will)\\s+(?:take\\s+effect|become\\s+effective)\\s+(?:on\\s+)?(?:the\\s+)?date\\s+of\\s+(?:the\\s+)?enactment");

    private static final Pattern DAYS_AFTER_ENACTMENT = Pattern.compile(
            "(?i)(?:effective|take\\s+effect)\\s+(\\d+)\\s+days?\\s+after\\s+(?:the\\s+)?date\\s+of\\s+(?:the\\s+)?enactment");

    private static final Pattern SPECIFIC_DATE = Pattern.compile(
            "(?i)(?:shall|will)\\s+(?:take\\s+effect|become\\s+effective)\\s+(?:on\\s+)?" + MONTHS
                    + "\\s+(\\d{1,2}),?\\s+(\\d{4})");

    private static final Pattern FISCAL_YEAR = Pattern.compile(
            "(?i)shall\\s+apply\\s+to\\s+fiscal\\s+years?\\s+beginning\\s+after\\s+" + MONTHS
                    + "\\s+(\\d{1,2}),?\\s+(\\d{4})");

    private static final Pattern NOT_UNTIL = Pattern.compile(
            "(?i)shall\\s+not\\s+take\\s+effect\\s+until\\s+" + MONTHS + "\\s+(\\d{1,2}),?\\s+(\\d{4})");

    /**
     * @return the first effective-date form found, or empty when the text names none
     */
    public Optional<EffectiveDateInfo> parse(String billText) {
        String text = normalizeLower(billText);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        Matcher m = DATE_OF_ENACTMENT.matcher(text);
        if (m.find()) {
            return Optional.of(EffectiveDateInfo.builder()
                    .dateOfEnactment(true)
                    .rawText(m.group())
                    .build());
        }

        m = DAYS_AFTER_ENACTMENT.matcher(text);
        if (m.find()) {
            try {
                return Optional.of(EffectiveDateInfo.builder()
                        .daysAfterEnactment(Integer.parseInt(m.group(1)))
                        .rawText(m.group())
                        .build());
            } catch (NumberFormatException e) {
                // digit run too long for an int; fall through to the date forms
            }
        }

        for (Pattern pattern : new Pattern[] {SPECIFIC_DATE, FISCAL_YEAR, NOT_UNTIL}) {
            m = pattern.matcher(text);
            if (m.find()) {
                Optional<LocalDate> date = toDate(m.group(1), m.group(2), m.group(3));
                if (date.isPresent()) {
                    return Optional.of(EffectiveDateInfo.builder()
                            .date(date.get())
                            .rawText(m.group())
                            .build());
                }
            }
        }
        return Optional.empty();
    }

    static Optional<LocalDate> toDate(String monthName, String day, String year) {
        Month month;
        try {
            month = Month.valueOf(monthName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int dayNum = Integer.parseInt(day);
        int yearNum = Integer.parseInt(year);
        if (dayNum < 1 || dayNum > 31 || yearNum < 1900 || yearNum > 2100) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(yearNum, month, dayNum));
        } catch (DateTimeException e) {
            // February 30 and the like
            return Optional.empty();
        }
    }

    static String normalizeLower(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return String.join(" ", text.trim().split("\\s+")).toLowerCase(Locale.ROOT);
    }
}
