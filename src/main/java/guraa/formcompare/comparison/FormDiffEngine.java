package guraa.formcompare.comparison;

import guraa.formcompare.model.BoundingBox;
import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Compares the field structure of two versions of a form.
 * <p>
 * Fields are matched on field id only; position and label are expected to drift
 * between versions and only take part in change detection. The engine holds no
 * state besides its settings, so one instance can serve concurrent callers.
 */
@Slf4j
public class FormDiffEngine {

    public static final double DEFAULT_POSITION_TOLERANCE = 1.0;

    private static final Comparator<FieldChange> REPORT_ORDER = Comparator
            .comparing(FieldChange::getStatus)
            .thenComparingInt(FormDiffEngine::sortPageNumber)
            .thenComparingInt(FormDiffEngine::sortPageOrder)
            .thenComparing(FieldChange::getFieldId);

    private final double positionTolerance;
    private final NearTextMatching nearTextMatching;

    public FormDiffEngine(double positionTolerance, NearTextMatching nearTextMatching) {
        if (positionTolerance < 0) {
            throw new IllegalArgumentException("Position tolerance must not be negative: " + positionTolerance);
        }
        this.positionTolerance = positionTolerance;
        this.nearTextMatching = Objects.requireNonNull(nearTextMatching, "nearTextMatching");
    }

    public FormDiffEngine() {
        this(DEFAULT_POSITION_TOLERANCE, NearTextMatching.EXACT);
    }

    /**
     * Compare two extracted field sets.
     *
     * @param sourceFields Fields of the older version
     * @param targetFields Fields of the newer version
     * @param sourceMeta Metadata of the older version
     * @param targetMeta Metadata of the newer version
     * @return The comparison result
     * @throws DuplicateFieldIdException If a field id occurs twice on one side
     * @throws InvalidFieldRecordException If a side holds a null record or one without id
     */
    public ComparisonResult compare(List<FieldRecord> sourceFields, List<FieldRecord> targetFields,
                                    DocumentMetadata sourceMeta, DocumentMetadata targetMeta) {
        Objects.requireNonNull(sourceFields, "sourceFields");
        Objects.requireNonNull(targetFields, "targetFields");
        Objects.requireNonNull(sourceMeta, "sourceMeta");
        Objects.requireNonNull(targetMeta, "targetMeta");

        Map<String, FieldRecord> sourceById = indexById(sourceFields, "source");
        Map<String, FieldRecord> targetById = indexById(targetFields, "target");

        List<FieldChange> changes = new ArrayList<>();
        for (FieldRecord source : sourceById.values()) {
            FieldRecord target = targetById.get(source.getFieldId());
            changes.add(target == null ? removed(source) : compareFields(source, target));
        }
        for (FieldRecord target : targetById.values()) {
            if (!sourceById.containsKey(target.getFieldId())) {
                changes.add(added(target));
            }
        }
        changes.sort(REPORT_ORDER);

        GlobalMetrics metrics = calculateGlobalMetrics(changes, sourceFields, targetFields, sourceMeta, targetMeta);

        log.info("Comparison complete: {} added, {} removed, {} modified, {} unchanged ({}% changed)",
                metrics.getFieldsAdded(), metrics.getFieldsRemoved(), metrics.getFieldsModified(),
                metrics.getFieldsUnchanged(), String.format(Locale.ROOT, "%.2f", metrics.getModificationPercentage()));

        return ComparisonResult.builder()
                .globalMetrics(metrics)
                .fieldChanges(Collections.unmodifiableList(changes))
                .build();
    }

    private Map<String, FieldRecord> indexById(List<FieldRecord> fields, String side) {
        Map<String, FieldRecord> index = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldRecord field = fields.get(i);
            if (field == null) {
                throw new InvalidFieldRecordException(side, i, "record is null");
            }
            if (field.getFieldId() == null) {
                throw new InvalidFieldRecordException(side, i, "record has no field id");
            }
            if (index.putIfAbsent(field.getFieldId(), field) != null) {
                throw new DuplicateFieldIdException(field.getFieldId(), side);
            }
        }
        return index;
    }

    /**
     * Compare the attributes of a matched pair. Any DIFFERENT attribute makes the
     * field MODIFIED.
     *
     * @param source The source record
     * @param target The target record with the same id
     * @return The change record
     */
    private FieldChange compareFields(FieldRecord source, FieldRecord target) {
        DiffStatus pageChange = DiffStatus.of(source.getPageNumber() == target.getPageNumber());
        DiffStatus nearTextDiff = DiffStatus.of(nearTextMatching.matches(source.getNearText(), target.getNearText()));
        DiffStatus valueOptionsDiff = compareValueOptions(source.getValueOptions(), target.getValueOptions());
        DiffStatus positionChange = comparePositions(source.getPosition(), target.getPosition());

        boolean modified = pageChange.isDifferent()
                || nearTextDiff.isDifferent()
                || valueOptionsDiff.isDifferent()
                || positionChange.isDifferent();

        return FieldChange.builder()
                .fieldId(source.getFieldId())
                .status(modified ? FieldChangeStatus.MODIFIED : FieldChangeStatus.UNCHANGED)
                .fieldType(source.getFieldType() != null ? source.getFieldType() : target.getFieldType())
                .sourcePageNumber(source.getPageNumber())
                .targetPageNumber(target.getPageNumber())
                .sourcePageOrder(source.getPageOrder())
                .targetPageOrder(target.getPageOrder())
                .pageChange(pageChange)
                .nearTextDiff(nearTextDiff)
                .valueOptionsDiff(valueOptionsDiff)
                .positionChange(positionChange)
                .sourceNearText(source.getNearText())
                .targetNearText(target.getNearText())
                .sourceValueOptions(source.getValueOptions())
                .targetValueOptions(target.getValueOptions())
                .sourcePosition(source.getPosition())
                .targetPosition(target.getPosition())
                .build();
    }

    private FieldChange added(FieldRecord target) {
        return notApplicable(FieldChange.builder())
                .fieldId(target.getFieldId())
                .status(FieldChangeStatus.ADDED)
                .fieldType(target.getFieldType())
                .targetPageNumber(target.getPageNumber())
                .targetPageOrder(target.getPageOrder())
                .targetNearText(target.getNearText())
                .targetValueOptions(target.getValueOptions())
                .targetPosition(target.getPosition())
                .build();
    }

    private FieldChange removed(FieldRecord source) {
        return notApplicable(FieldChange.builder())
                .fieldId(source.getFieldId())
                .status(FieldChangeStatus.REMOVED)
                .fieldType(source.getFieldType())
                .sourcePageNumber(source.getPageNumber())
                .sourcePageOrder(source.getPageOrder())
                .sourceNearText(source.getNearText())
                .sourceValueOptions(source.getValueOptions())
                .sourcePosition(source.getPosition())
                .build();
    }

    private static FieldChange.FieldChangeBuilder notApplicable(FieldChange.FieldChangeBuilder builder) {
        return builder
                .pageChange(DiffStatus.NOT_APPLICABLE)
                .nearTextDiff(DiffStatus.NOT_APPLICABLE)
                .valueOptionsDiff(DiffStatus.NOT_APPLICABLE)
                .positionChange(DiffStatus.NOT_APPLICABLE);
    }

    /**
     * Options are compared as ordered sequences. Two null lists are equal; null
     * against a list is a difference.
     */
    private DiffStatus compareValueOptions(List<String> source, List<String> target) {
        if (source == null || target == null) {
            return DiffStatus.of(source == null && target == null);
        }
        return DiffStatus.of(source.equals(target));
    }

    private DiffStatus comparePositions(BoundingBox source, BoundingBox target) {
        if (source == null && target == null) {
            return DiffStatus.NOT_APPLICABLE;
        }
        if (source == null || target == null) {
            return DiffStatus.DIFFERENT;
        }
        return DiffStatus.of(source.isWithinTolerance(target, positionTolerance));
    }

    private GlobalMetrics calculateGlobalMetrics(List<FieldChange> changes,
                                                 List<FieldRecord> sourceFields, List<FieldRecord> targetFields,
                                                 DocumentMetadata sourceMeta, DocumentMetadata targetMeta) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        int unchanged = 0;
        for (FieldChange change : changes) {
            switch (change.getStatus()) {
                case ADDED:
                    added++;
                    break;
                case REMOVED:
                    removed++;
                    break;
                case MODIFIED:
                    modified++;
                    break;
                default:
                    unchanged++;
                    break;
            }
        }

        // changes holds exactly one entry per distinct id of the union
        int distinctIds = changes.size();
        double modificationPercentage = distinctIds == 0
                ? 0.0
                : (added + removed + modified) * 100.0 / distinctIds;

        return GlobalMetrics.builder()
                .pageCount(CountComparison.of(sourceMeta.getPageCount(), targetMeta.getPageCount()))
                .fieldCount(CountComparison.of(sourceFields.size(), targetFields.size()))
                .metadataDifferences(compareMetadata(sourceMeta, targetMeta))
                .fieldsAdded(added)
                .fieldsRemoved(removed)
                .fieldsModified(modified)
                .fieldsUnchanged(unchanged)
                .modificationPercentage(modificationPercentage)
                .build();
    }

    /**
     * Compare document metadata entry by entry, using direct equality. Dates are
     * compared at the precision the decoder provided, offset included.
     */
    private List<MetadataDifference> compareMetadata(DocumentMetadata source, DocumentMetadata target) {
        List<MetadataDifference> differences = new ArrayList<>();
        differences.add(metadataEntry("title", source.getTitle(), target.getTitle()));
        differences.add(metadataEntry("author", source.getAuthor(), target.getAuthor()));
        differences.add(metadataEntry("subject", source.getSubject(), target.getSubject()));
        differences.add(metadataEntry("creationDate", source.getCreationDate(), target.getCreationDate()));
        differences.add(metadataEntry("modificationDate", source.getModificationDate(), target.getModificationDate()));
        return Collections.unmodifiableList(differences);
    }

    private MetadataDifference metadataEntry(String key, Object sourceValue, Object targetValue) {
        return new MetadataDifference(key,
                sourceValue != null ? sourceValue.toString() : null,
                targetValue != null ? targetValue.toString() : null,
                DiffStatus.of(Objects.equals(sourceValue, targetValue)));
    }

    private static int sortPageNumber(FieldChange change) {
        Integer page = change.getStatus() == FieldChangeStatus.ADDED
                ? change.getTargetPageNumber()
                : change.getSourcePageNumber();
        return page != null ? page : Integer.MAX_VALUE;
    }

    private static int sortPageOrder(FieldChange change) {
        Integer order = change.getStatus() == FieldChangeStatus.ADDED
                ? change.getTargetPageOrder()
                : change.getSourcePageOrder();
        return order != null ? order : Integer.MAX_VALUE;
    }
}
