package guraa.formcompare.comparison;

import java.util.Locale;
import java.util.Objects;

/**
 * How near-label texts of a matched pair are compared.
 */
public enum NearTextMatching {

    /** Identical strings, both-null counts as equal. */
    EXACT,

    /** Leading and trailing whitespace ignored, inner runs collapsed to one space. */
    NORMALIZE_WHITESPACE,

    /** As {@link #NORMALIZE_WHITESPACE}, also ignoring case. */
    IGNORE_CASE_AND_WHITESPACE;

    public boolean matches(String source, String target) {
        return Objects.equals(normalize(source), normalize(target));
    }

    private String normalize(String text) {
        if (text == null || this == EXACT) {
            return text;
        }
        String collapsed = text.trim().replaceAll("\\s+", " ");
        return this == IGNORE_CASE_AND_WHITESPACE ? collapsed.toLowerCase(Locale.ROOT) : collapsed;
    }
}
