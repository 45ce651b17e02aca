package com.deepagent.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers shared by every backend so windowing and replacement behave identically
 * on the host and inside the sandbox.
 */
public final class TextEdits {

    private TextEdits() {}

    /**
     * Returns the lines {@code [offset, offset + limit)} of {@code content}, keeping the
     * original line terminators. A file with at most {@code limit} lines read from offset 0
     * comes back byte-for-byte.
     */
    public static ReadResult window(String content, int offset, int limit) {
        if (content.isEmpty()) {
            return ReadResult.ok("");
        }
        int start = Math.max(offset, 0);
        int max = limit <= 0 ? ExecutionBackend.DEFAULT_READ_LIMIT : limit;
        List<Integer> lineStarts = lineStarts(content);
        if (start >= lineStarts.size()) {
            return ReadResult.error("Line offset " + start + " exceeds file length ("
                    + lineStarts.size() + " lines)");
        }
        int end = start + max;
        int from = lineStarts.get(start);
        int to = end >= lineStarts.size() ? content.length() : lineStarts.get(end);
        return ReadResult.ok(content.substring(from, to));
    }

    public static int countOccurrences(String content, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int idx = content.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = content.indexOf(needle, idx + needle.length());
        }
        return count;
    }

    public static String replace(String content, String oldString, String newString, boolean replaceAll) {
        if (replaceAll) {
            return content.replace(oldString, newString);
        }
        int idx = content.indexOf(oldString);
        if (idx < 0) {
            return content;
        }
        return content.substring(0, idx) + newString + content.substring(idx + oldString.length());
    }

    private static List<Integer> lineStarts(String content) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i + 1 < content.length()) {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}
