package com.purchasingpower.toolagent.agent.tools;

import com.purchasingpower.toolagent.agent.Tool;
import com.purchasingpower.toolagent.agent.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Extracts regex matches, or match positions and capture groups, from text.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class RegexExtractorTool implements Tool {

    public static final String NAME = "regex_extractor";

    static final String MODE_MATCHES = "matches";
    static final String MODE_GROUPS = "groups";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Extract all matches of a regular expression from content, optionally with capture groups.";
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        Object content = parameters.get("content");
        Object patternText = parameters.get("pattern");
        if (!(content instanceof String) || !(patternText instanceof String)) {
            return ToolResult.failure("content and pattern parameters are required");
        }

        String mode = String.valueOf(parameters.getOrDefault("extraction_mode", MODE_MATCHES));
        int maxMatches = parameters.get("max_matches") instanceof Number n ? n.intValue() : 0;
        boolean caseInsensitive = Boolean.TRUE.equals(parameters.get("case_insensitive"));

        Pattern pattern;
        try {
            pattern = Pattern.compile((String) patternText, caseInsensitive ? Pattern.CASE_INSENSITIVE : 0);
        } catch (PatternSyntaxException e) {
            return ToolResult.failure("Invalid pattern: " + e.getDescription());
        }

        List<Object> extracted = new ArrayList<>();
        Matcher matcher = pattern.matcher((String) content);
        while (matcher.find()) {
            if (maxMatches > 0 && extracted.size() >= maxMatches) {
                break;
            }
            if (MODE_GROUPS.equals(mode)) {
                extracted.add(describeMatch(matcher));
            } else {
                extracted.add(matcher.group());
            }
        }

        log.debug("Extracted {} matches for pattern {}", extracted.size(), patternText);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("matches", extracted);
        data.put("total_matches", extracted.size());
        data.put("extraction_mode", mode);
        return ToolResult.success(data, "Extracted " + extracted.size() + " matches");
    }

    private Map<String, Object> describeMatch(Matcher matcher) {
        List<String> groups = new ArrayList<>();
        for (int i = 1; i <= matcher.groupCount(); i++) {
            groups.add(matcher.group(i));
        }
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("match", matcher.group());
        match.put("start", matcher.start());
        match.put("end", matcher.end());
        match.put("groups", groups);
        return match;
    }
}
