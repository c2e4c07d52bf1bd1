package guraa.formcompare.extraction;

import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import lombok.Value;

import java.util.List;

/**
 * Output of one extraction: the field records in reading order, the document
 * metadata and the per-control diagnostics, kept apart from the records.
 */
@Value
public class ExtractionResult {
    String sourceName;
    List<FieldRecord> fields;
    DocumentMetadata metadata;
    List<ExtractionDiagnostic> diagnostics;

    /**
     * A readable document with zero controls is a valid, reportable state.
     *
     * @return true if at least one control was found
     */
    public boolean hasFormFields() {
        return !fields.isEmpty();
    }

    /**
     * Return this result, or fail for callers that cannot proceed with an empty form.
     *
     * @return this result
     * @throws NoFormFieldsException If no controls were found
     */
    public ExtractionResult requireFormFields() {
        if (fields.isEmpty()) {
            throw new NoFormFieldsException(sourceName, metadata.getPageCount());
        }
        return this;
    }
}
