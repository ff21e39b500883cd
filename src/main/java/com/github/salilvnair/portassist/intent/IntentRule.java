package com.github.salilvnair.portassist.intent;

import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One classification rule. Text handed to {@link #matches(String)} is expected
 * to be trimmed and lower-cased already.
 */
@Getter
public final class IntentRule {

    static final int REGEX_FLAGS = Pattern.CASE_INSENSITIVE
            | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    private final String ruleId;
    private final Intent intent;
    private final MatchType matchType;
    private final List<String> patterns;
    private final double confidence;
    private final Pattern compiled;

    private IntentRule(String ruleId, Intent intent, MatchType matchType, List<String> patterns, double confidence) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be blank");
        }
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("rule " + ruleId + " has no pattern");
        }
        if (confidence <= 0.0d || confidence > 1.0d) {
            throw new IllegalArgumentException("rule " + ruleId + " confidence out of range: " + confidence);
        }
        this.ruleId = ruleId;
        this.intent = intent;
        this.matchType = matchType;
        this.patterns = patterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
        this.confidence = confidence;
        this.compiled = matchType == MatchType.REGEX ? Pattern.compile(patterns.get(0), REGEX_FLAGS) : null;
    }

    public static IntentRule regex(String ruleId, Intent intent, String regex, double confidence) {
        return new IntentRule(ruleId, intent, MatchType.REGEX, List.of(regex), confidence);
    }

    public static IntentRule contains(String ruleId, Intent intent, List<String> literals, double confidence) {
        return new IntentRule(ruleId, intent, MatchType.CONTAINS, literals, confidence);
    }

    public static IntentRule startsWith(String ruleId, Intent intent, List<String> prefixes, double confidence) {
        return new IntentRule(ruleId, intent, MatchType.STARTS_WITH, prefixes, confidence);
    }

    public boolean matches(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return false;
        }
        return switch (matchType) {
            case REGEX -> compiled.matcher(normalizedText).find();
            case CONTAINS -> patterns.stream().anyMatch(normalizedText::contains);
            case STARTS_WITH -> patterns.stream().anyMatch(normalizedText::startsWith);
        };
    }
}
