package io.schedlens.utils;

import org.quartz.CalendarIntervalTrigger;
import org.quartz.CronTrigger;
import org.quartz.DailyTimeIntervalTrigger;
import org.quartz.SimpleTrigger;
import org.quartz.TimeOfDay;
import org.quartz.Trigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps a trigger's concrete variant to a short display tag.
 * <p>
 * Built-in tags:
 * <ul>
 *   <li>{@link SimpleTrigger}: "simple"</li>
 *   <li>{@link CronTrigger}: "cron"</li>
 *   <li>{@link CalendarIntervalTrigger}: "calendar"</li>
 *   <li>{@link DailyTimeIntervalTrigger}: "daily"</li>
 * </ul>
 * Any other trigger is tagged with its class name, so classification never fails.
 * <p>
 * Instances are immutable and safe to share. Rules added through {@link Builder#register} are
 * checked before the built-ins, most recent first.
 */
public final class TriggerTypeClassifier {

    public static final String SIMPLE = "simple";
    public static final String CRON = "cron";
    public static final String CALENDAR = "calendar";
    public static final String DAILY = "daily";

    private static final TriggerTypeClassifier DEFAULTS = builder().build();

    private record Rule(Class<? extends Trigger> type, String tag) {
    }

    private final List<Rule> rules;

    private TriggerTypeClassifier(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static TriggerTypeClassifier defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String classify(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        for (Rule rule : rules) {
            if (rule.type().isInstance(trigger)) {
                return rule.tag();
            }
        }
        return fallbackTag(trigger);
    }

    /**
     * Short schedule summary, e.g. "every 5000 ms, repeat 3" or "0 0/5 * * * ? (UTC)".
     * Falls back to the tag for unknown variants.
     */
    public String describe(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (trigger instanceof SimpleTrigger st) {
            String repeat = st.getRepeatCount() == SimpleTrigger.REPEAT_INDEFINITELY
                    ? "forever"
                    : String.valueOf(st.getRepeatCount());
            return "every " + st.getRepeatInterval() + " ms, repeat " + repeat;
        }
        if (trigger instanceof CronTrigger ct) {
            String zone = ct.getTimeZone() == null ? "" : " (" + ct.getTimeZone().getID() + ")";
            return ct.getCronExpression() + zone;
        }
        if (trigger instanceof CalendarIntervalTrigger cit) {
            return "every " + cit.getRepeatInterval() + " " + unitName(cit.getRepeatIntervalUnit());
        }
        if (trigger instanceof DailyTimeIntervalTrigger dit) {
            return "every " + dit.getRepeatInterval() + " " + unitName(dit.getRepeatIntervalUnit())
                    + " from " + timeOfDay(dit.getStartTimeOfDay())
                    + " to " + timeOfDay(dit.getEndTimeOfDay());
        }
        return classify(trigger);
    }

    private static String unitName(Object unit) {
        return unit == null ? "?" : unit.toString().toLowerCase();
    }

    private static String timeOfDay(TimeOfDay t) {
        if (t == null) {
            return "?";
        }
        return String.format("%02d:%02d:%02d", t.getHour(), t.getMinute(), t.getSecond());
    }

    private static String fallbackTag(Trigger trigger) {
        String simple = trigger.getClass().getSimpleName();
        return simple.isEmpty() ? trigger.getClass().getName() : simple;
    }

    public static final class Builder {
        private final List<Rule> custom = new ArrayList<>();

        private Builder() {
        }

        /**
         * Tag triggers that are instances of {@code type}. Later registrations win over earlier
         * ones and over the built-ins.
         */
        public Builder register(Class<? extends Trigger> type, String tag) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(tag, "tag must not be null");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be blank");
            }
            custom.add(0, new Rule(type, tag));
            return this;
        }

        public TriggerTypeClassifier build() {
            List<Rule> all = new ArrayList<>(custom);
            all.add(new Rule(SimpleTrigger.class, SIMPLE));
            all.add(new Rule(CronTrigger.class, CRON));
            all.add(new Rule(CalendarIntervalTrigger.class, CALENDAR));
            all.add(new Rule(DailyTimeIntervalTrigger.class, DAILY));
            return new TriggerTypeClassifier(all);
        }
    }
}
