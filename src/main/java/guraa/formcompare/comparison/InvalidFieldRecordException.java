package guraa.formcompare.comparison;

/**
 * Thrown when a comparison input list holds a record that cannot be matched: a null
 * entry or a record without field id.
 */
public class InvalidFieldRecordException extends IllegalArgumentException {

    private final String side;
    private final int index;

    public InvalidFieldRecordException(String side, int index, String problem) {
        super("Invalid " + side + " field at index " + index + ": " + problem);
        this.side = side;
        this.index = index;
    }

    /**
     * @return "source" or "target"
     */
    public String getSide() {
        return side;
    }

    /**
     * @return Position of the record in its input list, from 0
     */
    public int getIndex() {
        return index;
    }
}
