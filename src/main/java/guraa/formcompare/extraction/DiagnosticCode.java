package guraa.formcompare.extraction;

/**
 * Kinds of per-control problems recorded during extraction.
 */
public enum DiagnosticCode {
    MISSING_BOUNDING_BOX,
    MISSING_FIELD_NAME,
    DUPLICATE_FIELD_NAME,
    MISSING_OPTIONS,
    UNKNOWN_CONTROL_KIND,
    ORPHAN_CONTROL
}
