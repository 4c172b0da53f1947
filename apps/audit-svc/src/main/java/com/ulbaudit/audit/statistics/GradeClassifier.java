package com.ulbaudit.audit.statistics;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Best-effort municipality grade from a display name. Patterns are tried in order and the first
 * match wins; names matching none fall into {@link #UNCLASSIFIED}.
 */
@Component
public class GradeClassifier {

    public static final String UNCLASSIFIED = "Municipality (Unclassified)";

    public record GradePattern(String name, Pattern pattern, Function<Matcher, String> label) {

        public Optional<String> match(String upperCaseName) {
            Matcher matcher = pattern.matcher(upperCaseName);
            return matcher.find() ? Optional.of(label.apply(matcher)) : Optional.empty();
        }
    }

    private static final List<GradePattern> PATTERNS = List.of(
            new GradePattern("ordinal-grade", Pattern.compile("\\bGRADE\\s+([IVX]+)\\b"),
                    matcher -> "Grade " + matcher.group(1)),
            new GradePattern("named-grade", Pattern.compile("\\b(SELECTION|SPECIAL)\\s+GRADE\\b"),
                    matcher -> capitalize(matcher.group(1)) + " Grade"),
            new GradePattern("corporation", Pattern.compile("CORPORATION"),
                    matcher -> "Municipal Corporation")
    );

    public String extractGrade(String name) {
        if (name == null || name.isBlank()) {
            return UNCLASSIFIED;
        }
        String upper = name.toUpperCase(Locale.ROOT);
        for (GradePattern pattern : PATTERNS) {
            Optional<String> label = pattern.match(upper);
            if (label.isPresent()) {
                return label.get();
            }
        }
        return UNCLASSIFIED;
    }

    public List<GradePattern> patterns() {
        return PATTERNS;
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
