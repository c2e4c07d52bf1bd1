package guraa.formcompare.model;

/**
 * Normalized kind of an interactive form control.
 */
public enum FieldType {
    TEXT,
    CHECKBOX,
    RADIOBUTTON,
    SELECT,
    TEXTAREA,
    BUTTON,
    SIGNATURE;

    /**
     * Only single-choice groups and option lists expose a fixed choice set.
     *
     * @return true if records of this type carry value options
     */
    public boolean hasValueOptions() {
        return this == SELECT || this == RADIOBUTTON;
    }
}
