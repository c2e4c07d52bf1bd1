package guraa.formcompare.extraction;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns field ids for one extraction and keeps them unique.
 * A resolver instance must not be shared between extractions.
 */
class FieldIdResolver {

    // Letter, digits, then letters or digits: "form1[0].#subform[0].A0101[0]" -> "A0101"
    private static final Pattern SHORT_ID = Pattern.compile("([a-z]\\d+[a-z0-9]*)", Pattern.CASE_INSENSITIVE);

    private final boolean shortenIds;
    private final Set<String> used = new HashSet<>();

    FieldIdResolver(boolean shortenIds) {
        this.shortenIds = shortenIds;
    }

    /**
     * Resolve the id of a control.
     *
     * @param nativeName The decoder's field name, may be null or blank
     * @param pageNumber 1-based page number, used for the fallback id
     * @param pageOrder 0-based page order, used for the fallback id
     * @return The resolved id and whether a fallback or suffix had to be applied
     */
    Resolution resolve(String nativeName, int pageNumber, int pageOrder) {
        String name = nativeName == null ? "" : nativeName.trim();
        boolean missing = name.isEmpty();

        String candidate;
        if (missing) {
            candidate = String.format(Locale.ROOT, "field_%d_%03d", pageNumber, pageOrder);
        } else if (shortenIds) {
            candidate = shorten(name);
            if (used.contains(candidate)) {
                // Shortening collapsed two names; keep the full one instead
                candidate = name;
            }
        } else {
            candidate = name;
        }

        boolean duplicate = false;
        String id = candidate;
        int suffix = 2;
        while (!used.add(id)) {
            duplicate = true;
            id = candidate + "#" + suffix++;
        }
        return new Resolution(id, missing, duplicate);
    }

    static String shorten(String name) {
        String cleaned = name;
        while (cleaned.startsWith("/")) {
            cleaned = cleaned.substring(1);
        }
        // Only the last segment of a qualified name identifies the control
        String last = cleaned.substring(cleaned.lastIndexOf('.') + 1).replaceAll("\\[\\d+]", "");
        Matcher matcher = SHORT_ID.matcher(last);
        if (matcher.find()) {
            return matcher.group(1).toUpperCase(Locale.ROOT);
        }
        return cleaned.isEmpty() ? name : cleaned;
    }

    static final class Resolution {
        final String fieldId;
        final boolean missingName;
        final boolean duplicateName;

        Resolution(String fieldId, boolean missingName, boolean duplicateName) {
            this.fieldId = fieldId;
            this.missingName = missingName;
            this.duplicateName = duplicateName;
        }
    }
}
