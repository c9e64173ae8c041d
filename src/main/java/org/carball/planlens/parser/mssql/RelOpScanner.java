package org.carball.planlens.parser.mssql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits ShowPlan text into RelOp segments and recovers nesting from the
 * order of opening and closing tags. Unbalanced or truncated input leaves the
 * remaining segments attached to whatever was still open.
 */
final class RelOpScanner {

    private static final Pattern RELOP_TAG = Pattern.compile("<RelOp\\b[^>]*>|</RelOp\\s*>");

    private RelOpScanner() {
    }

    static List<RelOpSegment> scan(String xml) {
        List<String> openTags = new ArrayList<>();
        List<Integer> parents = new ArrayList<>();
        List<StringBuilder> bodies = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();

        Matcher matcher = RELOP_TAG.matcher(xml);
        List<int[]> tags = new ArrayList<>();
        while (matcher.find()) {
            tags.add(new int[]{matcher.start(), matcher.end()});
        }

        for (int t = 0; t < tags.size(); t++) {
            int start = tags.get(t)[0];
            int end = tags.get(t)[1];
            String tag = xml.substring(start, end);

            if (tag.startsWith("</")) {
                if (!open.isEmpty()) {
                    open.pop();
                }
            } else {
                int index = openTags.size();
                openTags.add(tag);
                parents.add(open.isEmpty() ? -1 : open.peek());
                bodies.add(new StringBuilder());
                if (!tag.endsWith("/>")) {
                    open.push(index);
                }
            }

            // Text up to the next RelOp tag belongs to the innermost open operator,
            // including elements written after a child closes (a Filter's Predicate).
            int textEnd = t + 1 < tags.size() ? tags.get(t + 1)[0] : xml.length();
            if (!open.isEmpty()) {
                bodies.get(open.peek()).append(xml, end, textEnd);
            }
        }

        List<RelOpSegment> segments = new ArrayList<>(openTags.size());
        for (int i = 0; i < openTags.size(); i++) {
            segments.add(new RelOpSegment(i, parents.get(i), openTags.get(i), bodies.get(i).toString()));
        }
        return segments;
    }
}
