package utils;

/**
 * Builds the string key a grouped view is keyed by.
 * <p>
 * Composite keys are concatenated with a length prefix per part, so ("ab", "c") and
 * ("a", "bc") never collide, and a {@code null} part gets its own marker so that rows with a
 * missing key value still form a group of their own.
 */
public final class GroupKey {

    private static final String NULL_PART = "~";

    private GroupKey() {
    }

    public static String of(Object... parts) {
        StringBuilder key = new StringBuilder();
        for (Object part : parts) {
            if (part == null) {
                key.append(NULL_PART);
            } else {
                String text = part.toString();
                key.append(text.length()).append(':').append(text);
            }
            key.append('|');
        }
        return key.toString();
    }
}
