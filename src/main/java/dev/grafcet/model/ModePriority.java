package dev.grafcet.model;

import java.util.Comparator;
import java.util.Map;

/**
 * Total order over mode ids used to number conduct steps.
 *
 * <p>Tier first ({@code A}, then {@code F}, then {@code D}, then anything else), then the
 * numeric suffix ascending. Ids whose suffix is not a number come last in their tier.
 * Note the tier order puts failure procedures ({@code D}) after production ({@code F}).
 */
public final class ModePriority {

    private static final Map<Character, Integer> TIERS = Map.of('A', 0, 'F', 1, 'D', 2);
    private static final int UNKNOWN_TIER = 9;

    public static final Comparator<String> COMPARATOR = Comparator
        .comparingInt(ModePriority::tier)
        .thenComparing(ModePriority::hasNumericSuffix, Comparator.reverseOrder())
        .thenComparingLong(ModePriority::numericSuffix)
        .thenComparing(Comparator.naturalOrder());

    private ModePriority() {}

    static int tier(String modeId) {
        if (modeId.isEmpty()) {
            return UNKNOWN_TIER;
        }
        return TIERS.getOrDefault(modeId.charAt(0), UNKNOWN_TIER);
    }

    static boolean hasNumericSuffix(String modeId) {
        if (modeId.length() < 2) {
            return false;
        }
        // suffixes that do not fit a long are treated as non-numeric
        return modeId.length() <= 19
            && modeId.substring(1).chars().allMatch(c -> c >= '0' && c <= '9');
    }

    static long numericSuffix(String modeId) {
        return hasNumericSuffix(modeId) ? Long.parseLong(modeId.substring(1)) : Long.MAX_VALUE;
    }
}
