package com.nei10u.taxmusr.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析扩展调用的逐行输出。只识别 "Story Fact:" 与 "Rule:" 两种前缀，其余行直接丢弃。
 */
public class ExpansionResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ExpansionResponseParser.class);

    public static final String STORY_FACT_PREFIX = "Story Fact:";
    public static final String RULE_PREFIX = "Rule:";

    private static final String QUOTES = "\"“”";

    public record ExpansionLine(boolean rule, String statement) {
    }

    public List<ExpansionLine> parse(String response) {
        List<ExpansionLine> lines = new ArrayList<>();
        if (response == null) {
            return lines;
        }
        for (String rawLine : response.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(STORY_FACT_PREFIX)) {
                add(lines, false, line.substring(STORY_FACT_PREFIX.length()));
            } else if (line.startsWith(RULE_PREFIX)) {
                add(lines, true, line.substring(RULE_PREFIX.length()));
            } else {
                log.debug("discarded line: {}", line);
            }
        }
        return lines;
    }

    private void add(List<ExpansionLine> lines, boolean rule, String remainder) {
        String statement = unquote(remainder.strip());
        if (statement.isEmpty()) {
            return;
        }
        lines.add(new ExpansionLine(rule, statement));
    }

    static String unquote(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && QUOTES.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTES.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end).strip();
    }
}
