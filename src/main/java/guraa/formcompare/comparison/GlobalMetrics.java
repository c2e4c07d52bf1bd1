package guraa.formcompare.comparison;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Document-wide figures of a comparison.
 */
@Value
@Builder
public class GlobalMetrics {

    CountComparison pageCount;

    /**
     * Raw record counts of both input lists.
     */
    CountComparison fieldCount;

    /**
     * Title, author, subject, creation and modification date, in that order.
     */
    List<MetadataDifference> metadataDifferences;

    int fieldsAdded;
    int fieldsRemoved;
    int fieldsModified;
    int fieldsUnchanged;

    /**
     * Share of distinct field ids whose status is not UNCHANGED, from 0 to 100.
     */
    double modificationPercentage;
}
