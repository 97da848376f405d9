package dev.aparikh.emailtriage.search;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the date phrases users and agents type ("yesterday", "past 3 weeks") into {@code yyyy-MM-dd}.
 * <p>
 * Never throws: null or blank input yields null, unrecognised input is returned as given so the
 * caller can decide what to do with it.
 */
@Component
public class RelativeDateNormalizer {

    private static final Pattern CANONICAL = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern LAST_N_DAYS = Pattern.compile("(?:last|past)\\s+(\\d+)\\s+days?");
    private static final Pattern N_DAYS_AGO = Pattern.compile("(\\d+)\\s+days?\\s+ago");
    private static final Pattern LAST_N_WEEKS = Pattern.compile("(?:last|past)\\s+(\\d+)\\s+weeks?");
    private static final Pattern WEEK = Pattern.compile("(?:last|past|this)\\s+week");
    private static final Pattern MONTH = Pattern.compile("(?:last|past|this)\\s+month");

    private final Clock clock;

    public RelativeDateNormalizer(Clock clock) {
        this.clock = clock;
    }

    public String normalize(String input) {
        if (input == null || input.isBlank()) return null;

        String phrase = input.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (CANONICAL.matcher(phrase).matches()) return input.trim();

        LocalDate today = LocalDate.now(clock);
        LocalDate resolved = switch (phrase) {
            case "today" -> today;
            case "yesterday" -> today.minusDays(1);
            default -> resolvePattern(phrase, today);
        };
        return resolved == null ? input : resolved.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private static LocalDate resolvePattern(String phrase, LocalDate today) {
        if (WEEK.matcher(phrase).matches()) return today.minusDays(7);
        if (MONTH.matcher(phrase).matches()) return today.minusDays(30);

        Matcher m = LAST_N_DAYS.matcher(phrase);
        if (m.matches()) return minusDays(today, m.group(1), 1);
        m = N_DAYS_AGO.matcher(phrase);
        if (m.matches()) return minusDays(today, m.group(1), 1);
        m = LAST_N_WEEKS.matcher(phrase);
        if (m.matches()) return minusDays(today, m.group(1), 7);
        return null;
    }

    private static LocalDate minusDays(LocalDate today, String count, long unit) {
        try {
            return today.minusDays(Math.multiplyExact(Long.parseLong(count), unit));
        } catch (ArithmeticException | NumberFormatException | java.time.DateTimeException e) {
            // absurd counts are treated like any other unrecognised phrase
            return null;
        }
    }
}
