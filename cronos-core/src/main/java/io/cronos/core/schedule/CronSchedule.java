package io.cronos.core.schedule;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CronSchedule {
    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
        .withSeconds().withStrictRange().and()
        .withMinutes().withStrictRange().and()
        .withHours().withStrictRange().and()
        .withDayOfMonth().supportsL().supportsW().supportsQuestionMark().withStrictRange().and()
        .withMonth().withStrictRange().and()
        .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).supportsHash().supportsL().supportsQuestionMark()
            .withIntMapping(7, 0).withStrictRange().and()
        .instance();
    private static final CronParser PARSER = new CronParser(DEFINITION);

    private static final Map<String, String> MACROS = Map.of(
        "@yearly", "0 0 0 1 1 *",
        "@annually", "0 0 0 1 1 *",
        "@monthly", "0 0 0 1 * *",
        "@weekly", "0 0 0 * * 0",
        "@daily", "0 0 0 * * *",
        "@midnight", "0 0 0 * * *",
        "@hourly", "0 0 * * * *"
    );

    private static final String EVERY_PREFIX = "@every ";
    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|\u00b5s|\u03bcs|ms|s|m|h)");
    private static final Map<String, Long> UNIT_NANOS = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "\u00b5s", 1_000L,
        "\u03bcs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private final String expression;
    private final Cron cron;
    private final List<ExecutionTime> executionTimes;
    private final Duration interval;
    private final String intervalText;

    private CronSchedule(String expression, Cron cron, List<ExecutionTime> executionTimes) {
        this.expression = expression;
        this.cron = cron;
        this.executionTimes = executionTimes;
        this.interval = null;
        this.intervalText = null;
    }

    private CronSchedule(String expression, Duration interval, String intervalText) {
        this.expression = expression;
        this.cron = null;
        this.executionTimes = List.of();
        this.interval = interval;
        this.intervalText = intervalText;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException(expression, "schedule cannot be empty");
        }
        String trimmed = expression.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(EVERY_PREFIX)) {
            String text = trimmed.substring(EVERY_PREFIX.length()).trim();
            return new CronSchedule(trimmed, everyInterval(expression, text), text);
        }
        String expanded = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
        try {
            Cron parsed = PARSER.parse(expanded);
            parsed.validate();
            return new CronSchedule(trimmed, parsed, executionTimes(parsed, expanded));
        } catch (IllegalArgumentException e) {
            throw new ScheduleException(expression, "invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static String describe(String expression) {
        return parse(expression).description();
    }

    public String expression() {
        return expression;
    }

    public String description() {
        if (interval != null) {
            return "every " + intervalText;
        }
        return CronDescriptor.instance(Locale.ENGLISH).describe(cron);
    }

    public Optional<Instant> nextAfter(Instant instant, ZoneId zone) {
        if (interval != null) {
            return Optional.of(instant.truncatedTo(ChronoUnit.SECONDS).plus(interval));
        }
        ZonedDateTime start = ZonedDateTime.ofInstant(instant, zone);
        Optional<ZonedDateTime> earliest = Optional.empty();
        for (ExecutionTime executionTime : executionTimes) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(start);
            if (next.isPresent() && (earliest.isEmpty() || next.get().isBefore(earliest.get()))) {
                earliest = next;
            }
        }
        return earliest.map(ZonedDateTime::toInstant);
    }

    @Override
    public String toString() {
        return expression;
    }

    // Restricted day-of-month and day-of-week fields match either day, so each is evaluated on its own.
    private static List<ExecutionTime> executionTimes(Cron parsed, String expanded) {
        String[] fields = expanded.split("\\s+");
        if (fields.length != 6 || unrestricted(fields[DAY_OF_MONTH]) || unrestricted(fields[DAY_OF_WEEK])) {
            return List.of(ExecutionTime.forCron(parsed));
        }
        return List.of(
            ExecutionTime.forCron(PARSER.parse(withField(fields, DAY_OF_WEEK, "?"))),
            ExecutionTime.forCron(PARSER.parse(withField(fields, DAY_OF_MONTH, "?")))
        );
    }

    private static boolean unrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String withField(String[] fields, int index, String value) {
        String[] copy = fields.clone();
        copy[index] = value;
        return String.join(" ", copy);
    }

    // Intervals run on whole seconds, at least one.
    private static Duration everyInterval(String expression, String text) {
        Duration parsed = parseDuration(expression, text);
        if (parsed.isZero() || parsed.isNegative()) {
            throw new ScheduleException(expression, "interval must be positive: '" + expression + "'");
        }
        Duration seconds = Duration.ofSeconds(parsed.getSeconds());
        return seconds.isZero() ? Duration.ofSeconds(1) : seconds;
    }

    static Duration parseDuration(String expression, String text) {
        Matcher matcher = DURATION_PART.matcher(text);
        BigDecimal nanos = BigDecimal.ZERO;
        int end = 0;
        while (matcher.find() && matcher.start() == end) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(UNIT_NANOS.get(matcher.group(2)))));
            end = matcher.end();
        }
        if (end == 0 || end != text.length()) {
            throw new ScheduleException(expression, "invalid duration '" + text + "' in '" + expression + "'");
        }
        return Duration.ofNanos(nanos.longValue());
    }
}
