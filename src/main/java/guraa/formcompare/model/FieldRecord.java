package guraa.formcompare.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One interactive form control of an extracted document version.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldRecord {

    /**
     * Native identifier of the control, unique within one extraction.
     */
    String fieldId;

    FieldType fieldType;

    /**
     * The decoder's control kind, kept for diagnostics.
     */
    String rawType;

    /**
     * 1-based page number.
     */
    int pageNumber;

    /**
     * 0-based rank among the controls of the same page, in decoder order.
     */
    int pageOrder;

    /**
     * Label inferred by the nearest-label heuristic, or null.
     */
    String nearText;

    /**
     * Declared choices for select and radio controls, in declaration order.
     */
    List<String> valueOptions;

    BoundingBox position;
}
