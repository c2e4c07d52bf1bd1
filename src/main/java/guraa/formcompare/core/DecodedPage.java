package guraa.formcompare.core;

import lombok.Value;

import java.util.List;

/**
 * One page of a decoded document. Controls keep the decoder's emission order.
 */
@Value
public class DecodedPage {
    int pageNumber;
    float width;
    float height;
    List<TextSpan> textSpans;
    List<NativeControl> controls;
}
