package guraa.formcompare.core;

import guraa.formcompare.model.BoundingBox;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A form control as emitted by the decoder, before normalization.
 */
@Value
@Builder
public class NativeControl {

    /**
     * Fully qualified field name, or null when the document does not declare one.
     */
    String name;

    /**
     * Decoder kind such as {@code Tx}, {@code Tx:multiline}, {@code Btn:radio} or {@code Ch:combo}.
     */
    String kind;

    BoundingBox box;

    List<String> options;

    /**
     * Set when the control is not referenced by any page and was attached to the last page.
     */
    boolean orphan;
}
