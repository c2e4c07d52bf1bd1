package guraa.formcompare.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Comparison of one metadata entry. Values are rendered as strings for display;
 * the status is computed on the typed values.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetadataDifference {
    String key;
    String sourceValue;
    String targetValue;
    DiffStatus status;
}
