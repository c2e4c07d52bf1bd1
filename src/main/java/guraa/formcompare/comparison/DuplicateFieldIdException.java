package guraa.formcompare.comparison;

/**
 * Thrown when one side of a comparison holds two records with the same field id.
 */
public class DuplicateFieldIdException extends IllegalArgumentException {

    private final String fieldId;
    private final String side;

    public DuplicateFieldIdException(String fieldId, String side) {
        super("Duplicate field id '" + fieldId + "' in " + side + " fields");
        this.fieldId = fieldId;
        this.side = side;
    }

    public String getFieldId() {
        return fieldId;
    }

    /**
     * @return "source" or "target"
     */
    public String getSide() {
        return side;
    }
}
