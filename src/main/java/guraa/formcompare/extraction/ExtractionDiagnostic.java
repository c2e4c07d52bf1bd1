package guraa.formcompare.extraction;

import lombok.Value;

/**
 * A problem found on one control. The control itself is still emitted.
 */
@Value
public class ExtractionDiagnostic {
    DiagnosticCode code;
    int pageNumber;
    int pageOrder;
    String fieldId;
    String message;
}
