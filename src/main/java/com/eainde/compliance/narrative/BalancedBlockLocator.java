package com.eainde.compliance.narrative;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Finds the first balanced {@code {...}} span in free text. Braces inside JSON string
 * literals, including escaped quotes, do not count toward the balance.
 *
 * <pre>
 *   "Here you go: {\"a\": \"}\"} trailing"  ->  {"a": "}"}
 *   "{ unclosed { \"b\": 1 }"                  ->  { "b": 1 }
 * </pre>
 */
public final class BalancedBlockLocator {

    private BalancedBlockLocator() {}

    /**
     * Single pass over {@code text}. When the outermost brace closes its span is returned at
     * once; otherwise the earliest brace that did close wins.
     */
    public static Optional<String> firstObject(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        Deque<Integer> open = new ArrayDeque<>();
        int bestStart = -1;
        int bestEnd = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = text.indexOf('{'); i >= 0 && i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                int start = open.pop();
                if (open.isEmpty()) {
                    return Optional.of(text.substring(start, i + 1));
                }
                if (bestStart < 0 || start < bestStart) {
                    bestStart = start;
                    bestEnd = i;
                }
            }
        }
        return bestStart < 0 ? Optional.empty() : Optional.of(text.substring(bestStart, bestEnd + 1));
    }
}
