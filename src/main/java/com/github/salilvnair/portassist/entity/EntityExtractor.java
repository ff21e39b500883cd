package com.github.salilvnair.portassist.entity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.github.salilvnair.portassist.entity.EntityKeyConstants.*;

/**
 * Pulls domain values out of a message, English and French alike. Extraction
 * is conservative: a key is only set when a pattern matched, nothing is
 * guessed and the intent of the message is not consulted.
 */
@Slf4j
@Component
public class EntityExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE
            | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> BOOKING_REF_PATTERNS = List.of(
            Pattern.compile("\\b(?<prefix>REF)[-\\s]?(?<value>\\d{3,})\\b", FLAGS),
            Pattern.compile("\\b(?<prefix>BK|BOOK|BOOKING|RÉSERVATION)[-\\s]?(?<value>\\d{4,})\\b", FLAGS),
            Pattern.compile("\\b(?<prefix>booking|reference|réservation|référence)\\s+(?<value>\\d{5,})\\b", FLAGS)
    );
    private static final Set<String> KEPT_BOOKING_PREFIXES = Set.of("REF", "BK", "BOOK");

    private static final List<Pattern> CARRIER_ID_PATTERNS = List.of(
            Pattern.compile("\\b(carrier|transporteur|chauffeur|driver|company|société|entreprise)\\s+(?:id\\s+)?(?<value>\\d+)\\b", FLAGS),
            Pattern.compile("\\bID\\s+(?<value>\\d+)\\b", FLAGS),
            Pattern.compile("\\b(for|rate|score|pour|noter)\\s+(?<value>\\d{2,})\\b", FLAGS)
    );

    private static final Pattern TERMINAL_PATTERN =
            Pattern.compile("\\bterminale?\\s+(?<value>[A-Z0-9])\\b", FLAGS);

    private static final List<Pattern> GATE_PATTERNS = List.of(
            Pattern.compile("\\bgate\\s+(?<value>G?\\d+)\\b", FLAGS),
            Pattern.compile("\\bporte\\s+(?<value>\\d+)\\b", FLAGS),
            Pattern.compile("\\bG(?<value>\\d+)\\b", FLAGS)
    );

    private static final Pattern TODAY = Pattern.compile(
            "\\b(today|now|current|aujourd['’]hui|maintenant)\\b", FLAGS);
    private static final Pattern TOMORROW = Pattern.compile(
            "\\b(tomorrow|next day|demain|lendemain)\\b", FLAGS);
    private static final Pattern YESTERDAY = Pattern.compile(
            "\\b(yesterday|last day|hier)\\b", FLAGS);

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("\\b(?<year>\\d{4})(?<sep>[-/])(?<month>\\d{2})\\k<sep>(?<day>\\d{2})\\b"),
            Pattern.compile("\\b(?<day>\\d{2})(?<sep>[-/])(?<month>\\d{2})\\k<sep>(?<year>\\d{4})\\b")
    );

    private static final Pattern CLOCK_TIME = Pattern.compile(
            "\\b(?<hour>\\d{1,2}):(?<minute>\\d{2})(?::\\d{2})?\\b");
    private static final List<Pattern> HOUR_TIME_PATTERNS = List.of(
            Pattern.compile("\\bat\\s+(?<hour>\\d{1,2})\\s*(?<modifier>am|pm|h)\\b", FLAGS),
            Pattern.compile("\\bà\\s+(?<hour>\\d{1,2})\\s*(?<modifier>h)\\b", FLAGS)
    );

    // case-sensitive on purpose, plates are written upper-case
    private static final Pattern PLATE_PATTERN = Pattern.compile(
            "\\b(?<value>[A-Z]{1,3}[-\\s]?\\d{3,4}[-\\s]?[A-Z]{0,3})\\b");
    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[-\\s]+$");

    public EntityBag extract(String userText) {
        return extract(userText, null);
    }

    /**
     * @param referenceDate the caller's "today", used to anchor a requested
     *                      time to a relative date; may be null
     */
    public EntityBag extract(String userText, LocalDate referenceDate) {
        if (userText == null || userText.isBlank()) {
            return EntityBag.empty();
        }

        Map<String, Object> entities = new LinkedHashMap<>();
        List<int[]> reservedSpans = new ArrayList<>();

        List<String> bookingRefs = extractBookingRefs(userText, reservedSpans);
        if (!bookingRefs.isEmpty()) {
            entities.put(BOOKING_REF, bookingRefs.size() == 1 ? bookingRefs.get(0) : List.copyOf(bookingRefs));
        }

        putIfPresent(entities, CARRIER_ID, extractCarrierId(userText));
        putIfPresent(entities, TERMINAL, extractTerminal(userText));
        putIfPresent(entities, GATE, extractGate(userText));

        if (TODAY.matcher(userText).find()) {
            entities.put(DATE_TODAY, Boolean.TRUE);
        }
        if (TOMORROW.matcher(userText).find()) {
            entities.put(DATE_TOMORROW, Boolean.TRUE);
        }
        if (YESTERDAY.matcher(userText).find()) {
            entities.put(DATE_YESTERDAY, Boolean.TRUE);
        }
        LocalDate explicitDate = extractDate(userText, reservedSpans);
        if (explicitDate != null) {
            entities.put(DATE, explicitDate.toString());
        }

        String time = extractTime(userText);
        if (time != null) {
            entities.put(REQUESTED_TIME, anchorTime(time, explicitDate, entities, referenceDate));
        }

        putIfPresent(entities, PLATE, extractPlate(userText, reservedSpans));

        log.debug("Extracted {} entities from message", entities.size());
        return new EntityBag(entities);
    }

    private List<String> extractBookingRefs(String text, List<int[]> reservedSpans) {
        Set<String> refs = new LinkedHashSet<>();
        for (Pattern pattern : BOOKING_REF_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String prefix = m.group("prefix").toUpperCase(Locale.ROOT);
                String digits = m.group("value");
                refs.add((KEPT_BOOKING_PREFIXES.contains(prefix) ? prefix : "REF") + digits);
                reservedSpans.add(new int[]{m.start(), m.end()});
            }
        }
        return new ArrayList<>(refs);
    }

    private String extractCarrierId(String text) {
        for (Pattern pattern : CARRIER_ID_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                String id = m.group("value");
                if (id.length() <= 10) {
                    return id;
                }
            }
        }
        return null;
    }

    private String extractTerminal(String text) {
        Matcher m = TERMINAL_PATTERN.matcher(text);
        return m.find() ? m.group("value").toUpperCase(Locale.ROOT) : null;
    }

    private String extractGate(String text) {
        for (Pattern pattern : GATE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                String digits = m.group("value").replaceAll("\\D", "");
                if (!digits.isEmpty()) {
                    return "G" + digits;
                }
            }
        }
        return null;
    }

    private LocalDate extractDate(String text, List<int[]> reservedSpans) {
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                LocalDate date = toCalendarDate(m.group("year"), m.group("month"), m.group("day"));
                if (date != null) {
                    reservedSpans.add(new int[]{m.start(), m.end()});
                    return date;
                }
            }
        }
        return null;
    }

    private LocalDate toCalendarDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        }
        catch (DateTimeException e) {
            log.debug("Skipping non-calendar date {}-{}-{}", year, month, day);
            return null;
        }
    }

    private String extractTime(String text) {
        Matcher clock = CLOCK_TIME.matcher(text);
        while (clock.find()) {
            int hour = Integer.parseInt(clock.group("hour"));
            int minute = Integer.parseInt(clock.group("minute"));
            if (hour <= 23 && minute <= 59) {
                return formatTime(hour, minute);
            }
        }
        for (Pattern pattern : HOUR_TIME_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                int hour = Integer.parseInt(m.group("hour"));
                String modifier = m.group("modifier").toLowerCase(Locale.ROOT);
                if ("pm".equals(modifier) && hour < 12) {
                    hour += 12;
                }
                else if ("am".equals(modifier) && hour == 12) {
                    hour = 0;
                }
                if (hour <= 23) {
                    return formatTime(hour, 0);
                }
            }
        }
        return null;
    }

    private String formatTime(int hour, int minute) {
        return String.format(Locale.ROOT, "%02d:%02d:00", hour, minute);
    }

    /**
     * Explicit date first, then today, tomorrow and yesterday against the
     * reference date; without either the bare time is kept.
     */
    private String anchorTime(String time, LocalDate explicitDate, Map<String, Object> entities, LocalDate referenceDate) {
        if (explicitDate != null) {
            return explicitDate + " " + time;
        }
        if (referenceDate == null) {
            return time;
        }
        if (entities.containsKey(DATE_TODAY)) {
            return referenceDate + " " + time;
        }
        if (entities.containsKey(DATE_TOMORROW)) {
            return referenceDate.plusDays(1) + " " + time;
        }
        if (entities.containsKey(DATE_YESTERDAY)) {
            return referenceDate.minusDays(1) + " " + time;
        }
        return time;
    }

    private String extractPlate(String text, List<int[]> reservedSpans) {
        Matcher m = PLATE_PATTERN.matcher(text);
        while (m.find()) {
            if (overlapsAny(m.start(), m.end(), reservedSpans)) {
                continue;
            }
            String plate = TRAILING_SEPARATORS.matcher(m.group("value")).replaceAll("");
            if (!plate.isEmpty()) {
                return plate;
            }
        }
        return null;
    }

    private boolean overlapsAny(int start, int end, List<int[]> spans) {
        for (int[] span : spans) {
            if (start < span[1] && span[0] < end) {
                return true;
            }
        }
        return false;
    }

    private void putIfPresent(Map<String, Object> entities, String key, String value) {
        if (value != null) {
            entities.put(key, value);
        }
    }
}
