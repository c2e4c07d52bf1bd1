package guraa.formcompare.comparison;

/**
 * Status of a field identity across two versions. Declaration order is the
 * report order: actionable changes first.
 */
public enum FieldChangeStatus {
    REMOVED,
    ADDED,
    MODIFIED,
    UNCHANGED
}
