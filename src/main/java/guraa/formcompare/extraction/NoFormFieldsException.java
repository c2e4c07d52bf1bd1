package guraa.formcompare.extraction;

/**
 * Raised by callers that treat a readable document without form controls as an error.
 */
public class NoFormFieldsException extends RuntimeException {

    private final String sourceName;
    private final int pageCount;

    public NoFormFieldsException(String sourceName, int pageCount) {
        super("No AcroForm fields found in " + sourceName + " (" + pageCount + " pages)");
        this.sourceName = sourceName;
        this.pageCount = pageCount;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getPageCount() {
        return pageCount;
    }
}
