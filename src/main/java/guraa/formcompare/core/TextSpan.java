package guraa.formcompare.core;

import guraa.formcompare.model.BoundingBox;
import lombok.Value;

/**
 * A run of page text with its position.
 */
@Value
public class TextSpan {
    String text;
    BoundingBox box;
    int pageNumber;

    /**
     * Position of this span in the page's text order, starting at 0.
     */
    int index;
}
