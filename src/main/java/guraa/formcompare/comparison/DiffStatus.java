package guraa.formcompare.comparison;

/**
 * Outcome of comparing one attribute of a matched field pair.
 */
public enum DiffStatus {
    EQUAL,
    DIFFERENT,
    /** The attribute does not exist on one side, or on neither. */
    NOT_APPLICABLE;

    public static DiffStatus of(boolean equal) {
        return equal ? EQUAL : DIFFERENT;
    }

    public boolean isDifferent() {
        return this == DIFFERENT;
    }
}
