package guraa.formcompare.comparison;

import guraa.formcompare.model.BoundingBox;
import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import guraa.formcompare.model.FieldType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class FormDiffEngineTest {

    private static final DocumentMetadata META = DocumentMetadata.builder()
            .title("Form")
            .author("Registry")
            .pageCount(1)
            .build();

    private final FormDiffEngine engine = new FormDiffEngine();

    private static FieldRecord.FieldRecordBuilder field(String id, FieldType type, int page, int order) {
        return FieldRecord.builder()
                .fieldId(id)
                .fieldType(type)
                .pageNumber(page)
                .pageOrder(order)
                .position(BoundingBox.of(100, 100 + order * 40, 200, 120 + order * 40));
    }

    @Test
    void reportsRemovedAddedAndModifiedFields() {
        List<FieldRecord> source = List.of(
                field("A", FieldType.TEXT, 1, 0).nearText("Name").build(),
                field("B", FieldType.RADIOBUTTON, 1, 1).valueOptions(List.of("Yes", "No")).build());
        List<FieldRecord> target = List.of(
                field("A", FieldType.TEXT, 1, 0).nearText("Full name").build(),
                field("C", FieldType.CHECKBOX, 1, 1).build());

        ComparisonResult result = engine.compare(source, target, META, META);

        assertThat(result.getFieldChanges())
                .extracting(FieldChange::getFieldId, FieldChange::getStatus)
                .containsExactly(
                        tuple("B", FieldChangeStatus.REMOVED),
                        tuple("C", FieldChangeStatus.ADDED),
                        tuple("A", FieldChangeStatus.MODIFIED));

        FieldChange modified = result.getFieldChanges().get(2);
        assertThat(modified.getNearTextDiff()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(modified.getPageChange()).isEqualTo(DiffStatus.EQUAL);
        assertThat(modified.getPositionChange()).isEqualTo(DiffStatus.EQUAL);
        assertThat(modified.getValueOptionsDiff()).isEqualTo(DiffStatus.EQUAL);
        assertThat(modified.getSourceNearText()).isEqualTo("Name");
        assertThat(modified.getTargetNearText()).isEqualTo("Full name");

        FieldChange removed = result.getFieldChanges().get(0);
        assertThat(removed.getNearTextDiff()).isEqualTo(DiffStatus.NOT_APPLICABLE);
        assertThat(removed.getSourceValueOptions()).containsExactly("Yes", "No");
        assertThat(removed.getTargetPageNumber()).isNull();

        GlobalMetrics metrics = result.getGlobalMetrics();
        assertThat(metrics.getModificationPercentage()).isEqualTo(100.0);
        assertThat(metrics.getFieldsAdded()).isEqualTo(1);
        assertThat(metrics.getFieldsRemoved()).isEqualTo(1);
        assertThat(metrics.getFieldsModified()).isEqualTo(1);
        assertThat(metrics.getFieldsUnchanged()).isZero();
        assertThat(result.isStructurallyIdentical()).isFalse();
        assertThat(result.getChangesWithStatus(FieldChangeStatus.ADDED))
                .extracting(FieldChange::getFieldId)
                .containsExactly("C");
        assertThat(result.getChangesWithStatus(FieldChangeStatus.UNCHANGED)).isEmpty();
    }

    @Test
    void comparingAVersionWithItselfChangesNothing() {
        List<FieldRecord> fields = List.of(
                field("name", FieldType.TEXT, 1, 0).nearText("Name").build(),
                field("country", FieldType.SELECT, 1, 1).valueOptions(List.of("NO", "SE")).build(),
                field("signature", FieldType.SIGNATURE, 2, 0).position(null).build());

        ComparisonResult result = engine.compare(fields, fields, META, META);

        assertThat(result.getFieldChanges()).allMatch(change -> change.getStatus() == FieldChangeStatus.UNCHANGED);
        assertThat(result.getGlobalMetrics().getModificationPercentage()).isZero();
        assertThat(result.isStructurallyIdentical()).isTrue();
        assertThat(result.getFieldChanges().get(2).getPositionChange()).isEqualTo(DiffStatus.NOT_APPLICABLE);
    }

    @Test
    void optionOrderIsSignificant() {
        List<FieldRecord> source = List.of(
                field("consent", FieldType.RADIOBUTTON, 1, 0).valueOptions(List.of("Yes", "No")).build());
        List<FieldRecord> target = List.of(
                field("consent", FieldType.RADIOBUTTON, 1, 0).valueOptions(List.of("No", "Yes")).build());

        FieldChange change = engine.compare(source, target, META, META).getFieldChanges().get(0);

        assertThat(change.getStatus()).isEqualTo(FieldChangeStatus.MODIFIED);
        assertThat(change.getValueOptionsDiff()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(change.getNearTextDiff()).isEqualTo(DiffStatus.EQUAL);
    }

    @Test
    void missingOptionsOnOneSideIsAChange() {
        List<FieldRecord> source = List.of(field("pick", FieldType.SELECT, 1, 0).build());
        List<FieldRecord> target = List.of(
                field("pick", FieldType.SELECT, 1, 0).valueOptions(List.of("a")).build());

        FieldChange change = engine.compare(source, target, META, META).getFieldChanges().get(0);

        assertThat(change.getValueOptionsDiff()).isEqualTo(DiffStatus.DIFFERENT);
    }

    @Test
    void positionDriftWithinToleranceIsIgnored() {
        List<FieldRecord> source = List.of(
                field("a", FieldType.TEXT, 1, 0).position(BoundingBox.of(100, 100, 200, 120)).build(),
                field("b", FieldType.TEXT, 1, 1).position(BoundingBox.of(100, 200, 200, 220)).build(),
                field("c", FieldType.TEXT, 1, 2).build());
        List<FieldRecord> target = List.of(
                field("a", FieldType.TEXT, 1, 0).position(BoundingBox.of(100.5, 99.2, 201, 120)).build(),
                field("b", FieldType.TEXT, 1, 1).position(BoundingBox.of(100, 230, 200, 250)).build(),
                field("c", FieldType.TEXT, 1, 2).position(null).build());

        List<FieldChange> changes = engine.compare(source, target, META, META).getFieldChanges();

        assertThat(changes).extracting(FieldChange::getFieldId).containsExactly("b", "c", "a");
        assertThat(changes.get(0).getPositionChange()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(changes.get(1).getPositionChange()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(changes.get(2).getStatus()).isEqualTo(FieldChangeStatus.UNCHANGED);
        assertThat(changes.get(2).getPositionChange()).isEqualTo(DiffStatus.EQUAL);
    }

    @Test
    void toleranceAndTextMatchingAreConfigurable() {
        FormDiffEngine lenient = new FormDiffEngine(50.0, NearTextMatching.IGNORE_CASE_AND_WHITESPACE);
        List<FieldRecord> source = List.of(
                field("a", FieldType.TEXT, 1, 0).nearText("First  name").build());
        List<FieldRecord> target = List.of(
                field("a", FieldType.TEXT, 1, 0).nearText(" first name ")
                        .position(BoundingBox.of(110, 120, 210, 140)).build());

        assertThat(lenient.compare(source, target, META, META).getFieldChanges().get(0).getStatus())
                .isEqualTo(FieldChangeStatus.UNCHANGED);
        assertThat(engine.compare(source, target, META, META).getFieldChanges().get(0).getStatus())
                .isEqualTo(FieldChangeStatus.MODIFIED);
        assertThatThrownBy(() -> new FormDiffEngine(-1.0, NearTextMatching.EXACT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pageMoveIsAModification() {
        List<FieldRecord> source = List.of(field("a", FieldType.TEXT, 1, 0).build());
        List<FieldRecord> target = List.of(field("a", FieldType.TEXT, 2, 0).build());

        FieldChange change = engine.compare(source, target, META, META).getFieldChanges().get(0);

        assertThat(change.getPageChange()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(change.getSourcePageNumber()).isEqualTo(1);
        assertThat(change.getTargetPageNumber()).isEqualTo(2);
    }

    @Test
    void everyIdOfTheUnionIsReportedOnce() {
        List<FieldRecord> source = List.of(
                field("a", FieldType.TEXT, 1, 0).build(),
                field("b", FieldType.TEXT, 1, 1).build(),
                field("c", FieldType.TEXT, 2, 0).build());
        List<FieldRecord> target = List.of(
                field("b", FieldType.TEXT, 1, 0).build(),
                field("d", FieldType.TEXT, 1, 1).build(),
                field("e", FieldType.TEXT, 1, 2).build(),
                field("f", FieldType.TEXT, 2, 0).build());

        ComparisonResult result = engine.compare(source, target, META, META);
        GlobalMetrics metrics = result.getGlobalMetrics();

        assertThat(result.getFieldChanges()).extracting(FieldChange::getFieldId)
                .containsExactlyInAnyOrder("a", "b", "c", "d", "e", "f");
        assertThat(metrics.getFieldsAdded() - metrics.getFieldsRemoved()).isEqualTo(target.size() - source.size());
        assertThat(metrics.getFieldCount().getSourceCount()).isEqualTo(3);
        assertThat(metrics.getFieldCount().getTargetCount()).isEqualTo(4);
        assertThat(metrics.getFieldCount().getStatus()).isEqualTo(DiffStatus.DIFFERENT);
        // b keeps its page but its box moves up
        assertThat(metrics.getModificationPercentage()).isEqualTo(100.0);
    }

    @Test
    void ordersReportByStatusThenPagePosition() {
        List<FieldRecord> source = List.of(
                field("z", FieldType.TEXT, 1, 0).build(),
                field("y", FieldType.TEXT, 1, 1).build(),
                field("gone2", FieldType.TEXT, 2, 0).build(),
                field("gone1", FieldType.TEXT, 1, 2).build());
        List<FieldRecord> target = List.of(
                field("z", FieldType.TEXT, 1, 0).build(),
                field("y", FieldType.TEXT, 1, 1).build(),
                field("new2", FieldType.TEXT, 3, 0).build(),
                field("new1", FieldType.TEXT, 1, 2).build());

        List<FieldChange> changes = engine.compare(source, target, META, META).getFieldChanges();

        assertThat(changes).extracting(FieldChange::getFieldId)
                .containsExactly("gone1", "gone2", "new1", "new2", "z", "y");
    }

    @Test
    void emptyInputsYieldEmptyReport() {
        ComparisonResult result = engine.compare(Collections.emptyList(), Collections.emptyList(), META, META);

        assertThat(result.getFieldChanges()).isEmpty();
        assertThat(result.getGlobalMetrics().getModificationPercentage()).isEqualTo(0.0);
        assertThat(result.isStructurallyIdentical()).isTrue();
    }

    @Test
    void rejectsDuplicateIds() {
        List<FieldRecord> duplicated = List.of(
                field("a", FieldType.TEXT, 1, 0).build(),
                field("a", FieldType.TEXT, 1, 1).build());

        assertThatThrownBy(() -> engine.compare(Collections.emptyList(), duplicated, META, META))
                .isInstanceOf(DuplicateFieldIdException.class)
                .hasMessageContaining("'a'")
                .hasMessageContaining("target");
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void summaryLogIgnoresDefaultLocale(CapturedOutput output) {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            List<FieldRecord> source = List.of(
                    field("a", FieldType.TEXT, 1, 0).build(),
                    field("b", FieldType.TEXT, 1, 1).build(),
                    field("c", FieldType.TEXT, 1, 2).build());
            List<FieldRecord> target = List.of(
                    field("a", FieldType.TEXT, 1, 0).build(),
                    field("b", FieldType.TEXT, 1, 1).build());

            engine.compare(source, target, META, META);
        } finally {
            Locale.setDefault(previous);
        }

        assertThat(output.getOut()).contains("(33.33% changed)");
    }

    @Test
    void rejectsRecordsWithoutId() {
        List<FieldRecord> source = Arrays.asList(
                field("a", FieldType.TEXT, 1, 0).build(),
                field(null, FieldType.TEXT, 1, 1).build());

        assertThatThrownBy(() -> engine.compare(source, Collections.emptyList(), META, META))
                .isInstanceOf(InvalidFieldRecordException.class)
                .hasMessageContaining("source")
                .hasMessageContaining("index 1")
                .satisfies(e -> {
                    InvalidFieldRecordException invalid = (InvalidFieldRecordException) e;
                    assertThat(invalid.getSide()).isEqualTo("source");
                    assertThat(invalid.getIndex()).isEqualTo(1);
                });
    }

    @Test
    void rejectsNullRecords() {
        List<FieldRecord> target = Collections.singletonList(null);

        assertThatThrownBy(() -> engine.compare(Collections.emptyList(), target, META, META))
                .isInstanceOf(InvalidFieldRecordException.class)
                .hasMessageContaining("target")
                .hasMessageContaining("index 0");
    }

    @Test
    void metadataDatesKeepTheirOffset() {
        DocumentMetadata source = META.toBuilder()
                .creationDate(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)))
                .build();
        DocumentMetadata target = META.toBuilder()
                .creationDate(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC))
                .build();

        MetadataDifference creation = engine.compare(Collections.emptyList(), Collections.emptyList(), source, target)
                .getGlobalMetrics().getMetadataDifferences().get(3);

        assertThat(creation.getKey()).isEqualTo("creationDate");
        assertThat(creation.getStatus()).isEqualTo(DiffStatus.DIFFERENT);
        assertThat(creation.getSourceValue()).isEqualTo("2024-03-01T12:00+02:00");
    }

    @Test
    void comparesMetadataEntryByEntry() {
        OffsetDateTime created = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        DocumentMetadata source = META.toBuilder().creationDate(created).build();
        DocumentMetadata target = META.toBuilder()
                .title("Form v2")
                .creationDate(created)
                .pageCount(3)
                .build();

        GlobalMetrics metrics = engine.compare(Collections.emptyList(), Collections.emptyList(), source, target)
                .getGlobalMetrics();

        assertThat(metrics.getMetadataDifferences())
                .extracting(MetadataDifference::getKey, MetadataDifference::getStatus)
                .containsExactly(
                        tuple("title", DiffStatus.DIFFERENT),
                        tuple("author", DiffStatus.EQUAL),
                        tuple("subject", DiffStatus.EQUAL),
                        tuple("creationDate", DiffStatus.EQUAL),
                        tuple("modificationDate", DiffStatus.EQUAL));
        assertThat(metrics.getMetadataDifferences().get(0).getTargetValue()).isEqualTo("Form v2");
        assertThat(metrics.getPageCount().isChanged()).isTrue();
        assertThat(metrics.getPageCount().getTargetCount()).isEqualTo(3);
    }
}
