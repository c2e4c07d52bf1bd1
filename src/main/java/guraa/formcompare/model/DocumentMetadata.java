package guraa.formcompare.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;

/**
 * Document-level information of one decoded version.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentMetadata {
    String title;
    String author;
    String subject;
    OffsetDateTime creationDate;
    OffsetDateTime modificationDate;
    int pageCount;
}
