package dev.grafcet.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scan of guard text for variable references.
 *
 * <p>This is a heuristic, not an expression parser. Identifier-like tokens are kept unless
 * they are boolean keywords, the bare prefixes {@code T} and {@code X}, or look like a timer or
 * step-activity reference ({@code T3}, {@code X12}). Known imprecisions: a real variable named
 * like {@code T1} is never reported, qualifier words inside comparisons are reported as
 * variables, and string literals are scanned like identifiers.
 */
public final class GuardScanner {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TIMER_OR_STEP_REFERENCE = Pattern.compile("[TtXx][0-9]+");
    private static final Set<String> KEYWORDS = Set.of("AND", "OR", "NOT", "TRUE", "FALSE", "T", "X");

    private GuardScanner() {}

    /**
     * Candidate variable names referenced by a guard, first occurrence order, no duplicates.
     */
    public static List<String> variableReferences(String guard) {
        if (guard == null || guard.isBlank()) {
            return List.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(guard);
        while (matcher.find()) {
            String token = matcher.group();
            if (KEYWORDS.contains(token.toUpperCase(Locale.ROOT))) {
                continue;
            }
            if (TIMER_OR_STEP_REFERENCE.matcher(token).matches()) {
                continue;
            }
            tokens.add(token);
        }
        return new ArrayList<>(tokens);
    }
}
