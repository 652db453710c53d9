package com.eainde.nsgx.merge;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Total order over range bounds as the service writes them.
 *
 * <p>Recognized forms, each compared by value: full dates ({@code 2024-03-01},
 * {@code 01.03.2024}), times ({@code 22:00}, {@code 6.30 Uhr}), day-month dates
 * ({@code 01.03.}, {@code 1.3}, {@code --03-01}) and plain numbers ({@code 5},
 * {@code 2,5}). A short dotted pair reads as day-month only if it is a valid day
 * (1 to 31) and month (1 to 12); {@code 6.30} is the number 6.3.
 * Anything else compares lexically. Bounds of different forms order by form so the
 * comparison stays total.</p>
 *
 * <p>Day-month dates and times have no year or day, so the order is within one
 * calendar year or one day. A range that wraps around ({@code 01.11.} to
 * {@code 28.02.}) has its start after its end under this order;
 * {@link ConditionMerger} keeps such ranges unmerged.</p>
 */
final class RangeBound {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?");
    private static final Pattern TIME = Pattern.compile("(\\d{1,2})[:.](\\d{2})(?:\\s*uhr)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern GERMAN_DATE = Pattern.compile("(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})");
    private static final Pattern DAY_MONTH =
            Pattern.compile("(0?[1-9]|[12]\\d|3[01])\\.(0?[1-9]|1[0-2])\\.?");
    private static final Pattern ISO_MONTH_DAY = Pattern.compile("--?(\\d{1,2})-(\\d{1,2})");

    static final Comparator<String> ORDER = Comparator.nullsFirst(
            Comparator.comparing(RangeBound::parse, RangeBound::compareKeys));

    private RangeBound() {
    }

    static String max(String a, String b) {
        return ORDER.compare(a, b) >= 0 ? a : b;
    }

    private enum Form { NUMBER, TIME, DATE, DAY_MONTH, TEXT }

    private record Key(Form form, double value, String text) {}

    private static Key parse(String raw) {
        String s = raw.trim();
        Matcher m;
        if ((m = ISO_DATE.matcher(s)).matches()) {
            return date(m.group(1), m.group(2), m.group(3), s);
        }
        if ((m = GERMAN_DATE.matcher(s)).matches()) {
            return date(m.group(3), m.group(2), m.group(1), s);
        }
        if ((m = TIME.matcher(s)).matches()
                && (s.contains(":") || s.toLowerCase(Locale.ROOT).endsWith("uhr"))) {
            return new Key(Form.TIME, Integer.parseInt(m.group(1)) * 60 + Integer.parseInt(m.group(2)), s);
        }
        if ((m = DAY_MONTH.matcher(s)).matches()) {
            return new Key(Form.DAY_MONTH, Integer.parseInt(m.group(2)) * 100 + Integer.parseInt(m.group(1)), s);
        }
        if ((m = ISO_MONTH_DAY.matcher(s)).matches()) {
            return new Key(Form.DAY_MONTH, Integer.parseInt(m.group(1)) * 100 + Integer.parseInt(m.group(2)), s);
        }
        if (NUMBER.matcher(s).matches()) {
            return new Key(Form.NUMBER, Double.parseDouble(s.replace(',', '.')), s);
        }
        return new Key(Form.TEXT, 0, s);
    }

    private static Key date(String year, String month, String day, String text) {
        return new Key(Form.DATE,
                Integer.parseInt(year) * 10_000 + Integer.parseInt(month) * 100 + Integer.parseInt(day), text);
    }

    private static int compareKeys(Key a, Key b) {
        int byForm = a.form().compareTo(b.form());
        if (byForm != 0) {
            return byForm;
        }
        int byValue = Double.compare(a.value(), b.value());
        return byValue != 0 ? byValue : a.text().compareTo(b.text());
    }
}
