package guraa.formcompare.comparison;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of comparing two extracted versions of a form.
 * Field changes are ordered by status (REMOVED, ADDED, MODIFIED, UNCHANGED), then by
 * source page position, or target page position for added fields.
 */
@Value
@Builder
public class ComparisonResult {

    GlobalMetrics globalMetrics;

    List<FieldChange> fieldChanges;

    /**
     * Get the changes with the given status, in report order.
     *
     * @param status The status to filter on
     * @return Matching field changes
     */
    public List<FieldChange> getChangesWithStatus(FieldChangeStatus status) {
        return fieldChanges.stream()
                .filter(change -> change.getStatus() == status)
                .collect(Collectors.toList());
    }

    /**
     * Check if the two versions have the same field structure.
     *
     * @return true if every field is unchanged
     */
    public boolean isStructurallyIdentical() {
        return fieldChanges.stream().allMatch(change -> change.getStatus() == FieldChangeStatus.UNCHANGED);
    }
}
