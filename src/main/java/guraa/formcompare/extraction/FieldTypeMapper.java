package guraa.formcompare.extraction;

import guraa.formcompare.model.FieldType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps decoder control kinds to {@link FieldType}. Kinds outside the fixed table
 * are bucketed by keyword and never rejected.
 */
public final class FieldTypeMapper {

    private static final Map<String, FieldType> KNOWN_KINDS;

    static {
        Map<String, FieldType> kinds = new HashMap<>();
        kinds.put("Tx", FieldType.TEXT);
        kinds.put("Tx:multiline", FieldType.TEXTAREA);
        kinds.put("Btn:checkbox", FieldType.CHECKBOX);
        kinds.put("Btn:radio", FieldType.RADIOBUTTON);
        kinds.put("Btn:push", FieldType.BUTTON);
        kinds.put("Btn", FieldType.BUTTON);
        kinds.put("Ch", FieldType.SELECT);
        kinds.put("Ch:combo", FieldType.SELECT);
        kinds.put("Ch:list", FieldType.SELECT);
        kinds.put("Sig", FieldType.SIGNATURE);
        KNOWN_KINDS = Collections.unmodifiableMap(kinds);
    }

    private FieldTypeMapper() {
    }

    /**
     * @param kind The decoder kind, may be null
     * @return true if the kind is part of the fixed mapping table
     */
    public static boolean isKnownKind(String kind) {
        return kind != null && KNOWN_KINDS.containsKey(kind);
    }

    /**
     * Normalize a decoder kind.
     *
     * @param kind The decoder kind, may be null
     * @return The normalized field type, BUTTON when nothing closer applies
     */
    public static FieldType map(String kind) {
        if (kind == null) {
            return FieldType.BUTTON;
        }
        FieldType known = KNOWN_KINDS.get(kind);
        if (known != null) {
            return known;
        }

        String lower = kind.toLowerCase(Locale.ROOT);
        if (lower.startsWith("tx") || lower.contains("text") || lower.contains("edit")) {
            return lower.contains("multi") || lower.contains("area") ? FieldType.TEXTAREA : FieldType.TEXT;
        }
        if (lower.contains("radio") || lower.contains("option")) {
            return FieldType.RADIOBUTTON;
        }
        if ((lower.startsWith("ch") && !lower.startsWith("check"))
                || lower.contains("choice") || lower.contains("list")
                || lower.contains("combo") || lower.contains("select")) {
            return FieldType.SELECT;
        }
        if (lower.contains("check") || lower.contains("toggle")) {
            return FieldType.CHECKBOX;
        }
        if (lower.startsWith("sig") || lower.contains("ink") || lower.contains("draw")) {
            return FieldType.SIGNATURE;
        }
        return FieldType.BUTTON;
    }
}
