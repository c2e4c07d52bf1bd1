package guraa.formcompare.comparison;

import lombok.Value;

/**
 * A count taken on both versions.
 */
@Value
public class CountComparison {
    int sourceCount;
    int targetCount;

    public static CountComparison of(int sourceCount, int targetCount) {
        return new CountComparison(sourceCount, targetCount);
    }

    public DiffStatus getStatus() {
        return DiffStatus.of(sourceCount == targetCount);
    }

    public boolean isChanged() {
        return sourceCount != targetCount;
    }
}
