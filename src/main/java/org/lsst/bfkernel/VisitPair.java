package org.lsst.bfkernel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two flat field visits taken at the same illumination level.
 */
public class VisitPair {

    private static final Pattern PAIR_PATTERN = Pattern.compile("\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");
    private static final Pattern LIST_PATTERN = Pattern.compile("\\s*" + PAIR_PATTERN.pattern() + "(\\s*,\\s*" + PAIR_PATTERN.pattern() + ")*\\s*");

    private final int first;
    private final int second;

    public VisitPair(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Parse a list of visit pairs written as {@code (123,456),(789,987)}.
     *
     * @param text The list of pairs
     * @return The pairs, in the order given
     * @throws IllegalArgumentException if the text is not a list of pairs
     */
    public static List<VisitPair> parseList(String text) {
        if (!LIST_PATTERN.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid visit pair list: " + text);
        }
        List<VisitPair> result = new ArrayList<>();
        Matcher matcher = PAIR_PATTERN.matcher(text);
        while (matcher.find()) {
            result.add(new VisitPair(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
        }
        return result;
    }

    /**
     * Summarise a set of visit numbers, merging consecutive values into
     * ranges and dropping the digits a range end shares with its start, e.g.
     * {@code 1234, 1235, 1236, 1240} becomes {@code "1234-6, 1240"}.
     *
     * @param visits The visit numbers
     * @return The summary
     */
    public static String describe(Collection<Integer> visits) {
        List<String> parts = new ArrayList<>();
        Integer start = null;
        Integer end = null;
        for (Integer visit : new TreeSet<>(visits)) {
            if (end != null && visit == end + 1) {
                end = visit;
            } else {
                if (start != null) {
                    parts.add(range(start, end));
                }
                start = visit;
                end = visit;
            }
        }
        if (start != null) {
            parts.add(range(start, end));
        }
        return String.join(", ", parts);
    }

    private static String range(int start, int end) {
        if (start == end) {
            return String.valueOf(start);
        }
        String s0 = String.valueOf(start);
        String s1 = String.valueOf(end);
        int common = 0;
        while (common < s0.length() && common < s1.length() && s0.charAt(common) == s1.charAt(common)) {
            common++;
        }
        return s0 + "-" + s1.substring(common);
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final VisitPair other = (VisitPair) obj;
        return first == other.first && second == other.second;
    }
}
