package io.dispatch4j.utils;

import org.quartz.CronExpression;

import java.math.BigDecimal;
import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses six-field, seconds-granularity cron specs into {@link Schedule}s backed by Quartz
 * {@link CronExpression}s.
 * <p>
 * Accepted input:
 * <ul>
 *   <li>{@code second minute hour day-of-month month day-of-week}, e.g. {@code "*&#47;30 * * * * *"}</li>
 *   <li>Descriptors: {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly},
 *       {@code @daily}, {@code @midnight}, {@code @hourly}</li>
 *   <li>{@code @every <duration>} with Go-style durations such as {@code 90s} or {@code 1h30m}</li>
 *   <li>An optional {@code CRON_TZ=<zone>} (or {@code TZ=<zone>}) prefix overriding the zone</li>
 * </ul>
 * <p>
 * Day-of-week numbers use the classic 0-6 range with 0 (or 7) = Sunday and are shifted to
 * Quartz's 1-7 range. When both day fields are restricted the schedule fires on days matching
 * either of them; when one of them starts with {@code *} (e.g. {@code *&#47;2}) it fires only on
 * days matching both.
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    private static final Map<String, String> DESCRIPTORS = Map.of(
            "@yearly", "0 0 0 1 1 *",
            "@annually", "0 0 0 1 1 *",
            "@monthly", "0 0 0 1 * *",
            "@weekly", "0 0 0 * * 0",
            "@daily", "0 0 0 * * *",
            "@midnight", "0 0 0 * * *",
            "@hourly", "0 0 * * * *"
    );

    private static final String EVERY = "@every ";

    private static final Pattern DURATION_PART =
            Pattern.compile("(\\d*(?:\\.\\d*)?)(ns|us|µs|μs|ms|h|m|s)");

    // Upper bound on days skipped while looking for a day matching both day fields.
    private static final int MAX_DAYS_SEARCHED = 366 * 8;

    /**
     * A parsed spec bound to a time zone.
     */
    public interface Schedule {
        String spec();

        /**
         * First fire time strictly after {@code after}, or {@code null} if the schedule never fires again.
         */
        Instant nextFireAfter(Instant after);
    }

    /**
     * Parse a spec into a schedule evaluated in {@code zone}, unless the spec names its own zone.
     *
     * @throws IllegalArgumentException if the spec is not a valid expression
     */
    public static Schedule parse(String spec, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        String s = requireText(spec);

        if (s.startsWith("CRON_TZ=") || s.startsWith("TZ=")) {
            int end = indexOfWhitespace(s);
            if (end < 0) {
                throw new IllegalArgumentException("Missing expression after time zone: " + spec);
            }
            String tz = s.substring(s.indexOf('=') + 1, end);
            try {
                zone = ZoneId.of(tz);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid time zone in cron spec: " + tz);
            }
            s = s.substring(end).trim();
        }

        if (s.toLowerCase(Locale.ROOT).startsWith(EVERY)) {
            return new FixedRate(spec, every(parseDuration(s.substring(EVERY.length()))));
        }

        List<String> quartz = normalizeCron(s);
        if (quartz.size() == 1) {
            return new Single(spec, compile(quartz.get(0), zone, spec));
        }
        CronExpression byDayOfMonth = compile(quartz.get(0), zone, spec);
        CronExpression byDayOfWeek = compile(quartz.get(1), zone, spec);
        if (bothDaysRequired(s)) {
            return new BothDays(spec, byDayOfMonth, compile("* * * ? * " + dayOfWeekField(quartz.get(1)), zone, spec), zone);
        }
        return new EitherDay(spec, byDayOfMonth, byDayOfWeek);
    }

    /**
     * Returns true if the spec can be parsed by {@link #parse(String, ZoneId)}.
     */
    public static boolean isValid(String spec) {
        try {
            parse(spec, ZoneId.of("UTC"));
            return true;
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Normalize a six-field spec (or descriptor) into Quartz syntax.
     *
     * <p>Returns one expression, or two when both day fields are restricted: the first keyed on
     * day-of-month, the second on day-of-week.
     */
    public static List<String> normalizeCron(String spec) {
        String s = requireText(spec);

        if (s.startsWith("@")) {
            String expanded = DESCRIPTORS.get(s.toLowerCase(Locale.ROOT));
            if (expanded == null) {
                throw new IllegalArgumentException("Unsupported cron descriptor: " + spec);
            }
            s = expanded;
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 6) {
            throw new IllegalArgumentException(
                    "Expected 6 fields (second minute hour day-of-month month day-of-week): " + spec);
        }
        return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month,
                                             String dayOfWeek) {
        String dom = "?".equals(dayOfMonth) ? "*" : dayOfMonth;
        String dow = "?".equals(dayOfWeek) ? "*" : shiftDaysOfWeek(dayOfWeek);

        if ("*".equals(dow)) {
            return List.of(String.join(" ", sec, min, hour, dom, month, "?"));
        }
        if ("*".equals(dom)) {
            return List.of(String.join(" ", sec, min, hour, "?", month, dow));
        }
        return List.of(
                String.join(" ", sec, min, hour, dom, month, "?"),
                String.join(" ", sec, min, hour, "?", month, dow));
    }

    private static boolean bothDaysRequired(String sixFields) {
        String[] parts = sixFields.split("\\s+");
        return startsWithWildcard(parts[3]) || startsWithWildcard(parts[5]);
    }

    private static boolean startsWithWildcard(String field) {
        return field.startsWith("*") || field.startsWith("?");
    }

    private static String dayOfWeekField(String quartz) {
        String[] parts = quartz.split(" ");
        return parts[5];
    }

    /**
     * 0-6 (Sunday first) to Quartz 1-7. Names and step values are left alone.
     */
    static String shiftDaysOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        String[] items = field.split(",", -1);
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String range = slash >= 0 ? item.substring(0, slash) : item;
            String step = slash >= 0 ? item.substring(slash) : "";

            String[] bounds = range.split("-", -1);
            for (int j = 0; j < bounds.length; j++) {
                if (j > 0) {
                    out.append('-');
                }
                out.append(shiftDay(bounds[j]));
            }
            out.append(step);
        }
        return out.toString();
    }

    private static String shiftDay(String token) {
        if (!token.matches("^\\d+$")) {
            return token;
        }
        int day = Integer.parseInt(token);
        if (day < 0 || day > 7) {
            throw new IllegalArgumentException("Day-of-week out of range (0-7): " + token);
        }
        return String.valueOf(day == 7 ? 1 : day + 1);
    }

    /**
     * Parse a Go-style duration: an optional sign followed by one or more decimal numbers, each
     * with a unit ({@code ns}, {@code us}, {@code ms}, {@code s}, {@code m}, {@code h}).
     * {@code "0"} is accepted on its own.
     */
    static Duration parseDuration(String text) {
        String s = text.trim();
        String original = s;
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if ("0".equals(s)) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Invalid duration: " + original);
        }

        BigDecimal nanos = BigDecimal.ZERO;
        Matcher m = DURATION_PART.matcher(s);
        int pos = 0;
        while (pos < s.length()) {
            m.region(pos, s.length());
            if (!m.lookingAt()) {
                throw new IllegalArgumentException("Invalid duration: " + original);
            }
            String number = m.group(1);
            if (number.isEmpty() || ".".equals(number)) {
                throw new IllegalArgumentException("Invalid duration: " + original);
            }
            nanos = nanos.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unitNanos(m.group(2)))));
            pos = m.end();
        }

        try {
            long total = nanos.toBigInteger().longValueExact();
            return Duration.ofNanos(negative ? -total : total);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration out of range: " + original);
        }
    }

    private static long unitNanos(String unit) {
        switch (unit) {
            case "ns":
                return 1L;
            case "us":
            case "µs":
            case "μs":
                return 1_000L;
            case "ms":
                return 1_000_000L;
            case "s":
                return 1_000_000_000L;
            case "m":
                return 60_000_000_000L;
            case "h":
                return 3_600_000_000_000L;
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
    }

    /**
     * Whole seconds, at least one.
     */
    private static Duration every(Duration d) {
        Duration seconds = d.truncatedTo(ChronoUnit.SECONDS);
        return seconds.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : seconds;
    }

    private static CronExpression compile(String quartz, ZoneId zone, String spec) {
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec + " (" + ex.getMessage() + ")");
        }
    }

    private static String requireText(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        return s;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static Instant next(CronExpression exp, Instant after) {
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    private static final class Single implements Schedule {
        private final String spec;
        private final CronExpression expression;

        Single(String spec, CronExpression expression) {
            this.spec = spec;
            this.expression = expression;
        }

        @Override
        public String spec() {
            return spec;
        }

        @Override
        public synchronized Instant nextFireAfter(Instant after) {
            Objects.requireNonNull(after, "after must not be null");
            return next(expression, after);
        }
    }

    /**
     * Fires when either the day-of-month or the day-of-week matches.
     */
    private static final class EitherDay implements Schedule {
        private final String spec;
        private final CronExpression byDayOfMonth;
        private final CronExpression byDayOfWeek;

        EitherDay(String spec, CronExpression byDayOfMonth, CronExpression byDayOfWeek) {
            this.spec = spec;
            this.byDayOfMonth = byDayOfMonth;
            this.byDayOfWeek = byDayOfWeek;
        }

        @Override
        public String spec() {
            return spec;
        }

        @Override
        public synchronized Instant nextFireAfter(Instant after) {
            Objects.requireNonNull(after, "after must not be null");
            Instant a = next(byDayOfMonth, after);
            Instant b = next(byDayOfWeek, after);
            if (a == null) {
                return b;
            }
            if (b == null) {
                return a;
            }
            return a.isBefore(b) ? a : b;
        }
    }

    /**
     * Fires only on days matching both day fields.
     */
    private static final class BothDays implements Schedule {
        private final String spec;
        private final CronExpression byDayOfMonth;
        private final CronExpression anyTimeOnDayOfWeek;
        private final ZoneId zone;

        BothDays(String spec, CronExpression byDayOfMonth, CronExpression anyTimeOnDayOfWeek, ZoneId zone) {
            this.spec = spec;
            this.byDayOfMonth = byDayOfMonth;
            this.anyTimeOnDayOfWeek = anyTimeOnDayOfWeek;
            this.zone = zone;
        }

        @Override
        public String spec() {
            return spec;
        }

        @Override
        public synchronized Instant nextFireAfter(Instant after) {
            Objects.requireNonNull(after, "after must not be null");
            Instant cursor = after;
            for (int i = 0; i < MAX_DAYS_SEARCHED; i++) {
                Instant candidate = next(byDayOfMonth, cursor);
                if (candidate == null) {
                    return null;
                }
                if (anyTimeOnDayOfWeek.isSatisfiedBy(Date.from(candidate))) {
                    return candidate;
                }
                LocalDate day = candidate.atZone(zone).toLocalDate();
                // Quartz searches from the next whole second.
                cursor = day.plusDays(1).atStartOfDay(zone).toInstant().minusSeconds(1);
            }
            return null;
        }
    }

    /**
     * {@code @every}: fixed rate aligned to whole seconds.
     */
    private static final class FixedRate implements Schedule {
        private final String spec;
        private final Duration interval;

        FixedRate(String spec, Duration interval) {
            this.spec = spec;
            this.interval = interval;
        }

        @Override
        public String spec() {
            return spec;
        }

        @Override
        public Instant nextFireAfter(Instant after) {
            Objects.requireNonNull(after, "after must not be null");
            return after.truncatedTo(ChronoUnit.SECONDS).plus(interval);
        }
    }
}
