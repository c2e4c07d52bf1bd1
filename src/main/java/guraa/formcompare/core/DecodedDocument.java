package guraa.formcompare.core;

import guraa.formcompare.model.DocumentMetadata;
import lombok.Value;

import java.util.List;

/**
 * Decoder output consumed by the field extractor. Holds no reference to the
 * underlying PDF, so it stays valid after the source document is closed.
 */
@Value
public class DecodedDocument {
    String sourceName;
    DocumentMetadata metadata;
    List<DecodedPage> pages;

    public int getPageCount() {
        return pages.size();
    }
}
