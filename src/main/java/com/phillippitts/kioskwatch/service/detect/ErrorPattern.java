package com.phillippitts.kioskwatch.service.detect;

import com.phillippitts.kioskwatch.domain.ErrorKind;
import com.phillippitts.kioskwatch.domain.Severity;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named log rule: a case-insensitive, multi-line regular expression, the severity of what
 * it detects and how to pull details out of a match.
 *
 * @param kind      error kind emitted on match
 * @param pattern   compiled rule
 * @param severity  fixed severity for the kind
 * @param extractor builds the details map from the match and the classified text
 */
record ErrorPattern(
        ErrorKind kind,
        Pattern pattern,
        Severity severity,
        Extractor extractor
) {

    ErrorPattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(extractor, "extractor");
    }

    static ErrorPattern of(ErrorKind kind, String regex, Severity severity) {
        return of(kind, regex, severity, ErrorPattern::matchedText);
    }

    static ErrorPattern of(ErrorKind kind, String regex, Severity severity,
                           Extractor extractor) {
        Pattern compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
        return new ErrorPattern(kind, compiled, severity, extractor);
    }

    /**
     * Searches {@code text} for the rule.
     *
     * @return extracted details, or empty if the rule does not match
     */
    Optional<Map<String, Object>> match(String text) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(extractor.extract(matcher, text));
        }
        return Optional.empty();
    }

    static Map<String, Object> matchedText(Matcher matcher, String text) {
        return Map.of("matched_text", matcher.group());
    }

    /** Builds the details of a match; {@code text} is the whole classified input. */
    @FunctionalInterface
    interface Extractor {
        Map<String, Object> extract(Matcher match, String text);
    }
}
