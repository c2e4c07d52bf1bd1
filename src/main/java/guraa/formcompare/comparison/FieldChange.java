package guraa.formcompare.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import guraa.formcompare.model.BoundingBox;
import guraa.formcompare.model.FieldType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Change record for one field identity. Source-side attributes are null for
 * added fields and target-side attributes are null for removed ones.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldChange {

    String fieldId;
    FieldChangeStatus status;

    /**
     * Type on the source side when present, otherwise on the target side.
     */
    FieldType fieldType;

    Integer sourcePageNumber;
    Integer targetPageNumber;
    Integer sourcePageOrder;
    Integer targetPageOrder;

    DiffStatus pageChange;
    DiffStatus nearTextDiff;
    DiffStatus valueOptionsDiff;
    DiffStatus positionChange;

    String sourceNearText;
    String targetNearText;
    List<String> sourceValueOptions;
    List<String> targetValueOptions;
    BoundingBox sourcePosition;
    BoundingBox targetPosition;
}
