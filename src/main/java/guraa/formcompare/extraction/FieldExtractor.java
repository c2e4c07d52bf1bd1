package guraa.formcompare.extraction;

import guraa.formcompare.core.DecodedDocument;
import guraa.formcompare.core.DecodedPage;
import guraa.formcompare.core.NativeControl;
import guraa.formcompare.core.TextSpan;
import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import guraa.formcompare.model.FieldType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a decoded document into field records for one document version.
 * <p>
 * Records come out in (page number, page order) order, page order being the
 * decoder's emission order. Malformed controls are still emitted, with the
 * problem reported as a diagnostic next to the records.
 */
@Slf4j
public class FieldExtractor {

    private final NearestLabelLocator labelLocator;
    private final boolean shortenFieldIds;

    public FieldExtractor(NearestLabelLocator labelLocator, boolean shortenFieldIds) {
        this.labelLocator = labelLocator;
        this.shortenFieldIds = shortenFieldIds;
    }

    public FieldExtractor() {
        this(new NearestLabelLocator(), false);
    }

    /**
     * Extract the form structure of a decoded document.
     *
     * @param document The decoded document
     * @return Records, metadata and diagnostics
     */
    public ExtractionResult extract(DecodedDocument document) {
        FieldIdResolver idResolver = new FieldIdResolver(shortenFieldIds);
        List<FieldRecord> fields = new ArrayList<>();
        List<ExtractionDiagnostic> diagnostics = new ArrayList<>();

        for (DecodedPage page : document.getPages()) {
            List<NativeControl> controls = page.getControls();
            for (int order = 0; order < controls.size(); order++) {
                fields.add(processControl(controls.get(order), page, order, idResolver, diagnostics));
            }
        }

        DocumentMetadata metadata = checkPageCount(document);

        if (fields.isEmpty()) {
            log.info("No form fields found in {} ({} pages)", document.getSourceName(), metadata.getPageCount());
        } else {
            log.info("Extracted {} form fields from {} ({} pages, {} diagnostics)",
                    fields.size(), document.getSourceName(), metadata.getPageCount(), diagnostics.size());
        }

        return new ExtractionResult(document.getSourceName(),
                Collections.unmodifiableList(fields),
                metadata,
                Collections.unmodifiableList(diagnostics));
    }

    private FieldRecord processControl(NativeControl control, DecodedPage page, int order,
                                       FieldIdResolver idResolver, List<ExtractionDiagnostic> diagnostics) {
        int pageNumber = page.getPageNumber();
        FieldIdResolver.Resolution id = idResolver.resolve(control.getName(), pageNumber, order);
        String fieldId = id.fieldId;
        FieldType fieldType = FieldTypeMapper.map(control.getKind());

        if (id.missingName) {
            diagnostics.add(diagnostic(DiagnosticCode.MISSING_FIELD_NAME, pageNumber, order, fieldId,
                    "Control has no name, assigned fallback id"));
        }
        if (id.duplicateName) {
            diagnostics.add(diagnostic(DiagnosticCode.DUPLICATE_FIELD_NAME, pageNumber, order, fieldId,
                    "Name '" + control.getName() + "' already used in this document"));
        }
        if (!FieldTypeMapper.isKnownKind(control.getKind())) {
            diagnostics.add(diagnostic(DiagnosticCode.UNKNOWN_CONTROL_KIND, pageNumber, order, fieldId,
                    "Control kind '" + control.getKind() + "' mapped to " + fieldType));
        }
        if (control.isOrphan()) {
            diagnostics.add(diagnostic(DiagnosticCode.ORPHAN_CONTROL, pageNumber, order, fieldId,
                    "Control is not placed on any page"));
        }

        String nearText = null;
        if (control.getBox() == null) {
            diagnostics.add(diagnostic(DiagnosticCode.MISSING_BOUNDING_BOX, pageNumber, order, fieldId,
                    "Control has no bounding box, label cannot be located"));
        } else {
            TextSpan label = labelLocator.locate(control.getBox(), page.getTextSpans());
            nearText = label != null ? label.getText() : null;
        }

        List<String> options = null;
        if (fieldType.hasValueOptions()) {
            if (control.getOptions() != null) {
                options = Collections.unmodifiableList(new ArrayList<>(control.getOptions()));
            } else {
                diagnostics.add(diagnostic(DiagnosticCode.MISSING_OPTIONS, pageNumber, order, fieldId,
                        fieldType + " control declares no options"));
            }
        }

        log.debug("Page {} #{}: {} ({}) label='{}'", pageNumber, order, fieldId, fieldType, nearText);

        return FieldRecord.builder()
                .fieldId(fieldId)
                .fieldType(fieldType)
                .rawType(control.getKind())
                .pageNumber(pageNumber)
                .pageOrder(order)
                .nearText(nearText)
                .valueOptions(options)
                .position(control.getBox())
                .build();
    }

    private DocumentMetadata checkPageCount(DecodedDocument document) {
        DocumentMetadata metadata = document.getMetadata();
        int iterated = document.getPageCount();
        if (metadata.getPageCount() != iterated) {
            log.warn("{} declares {} pages but {} were iterated, using the iterated count",
                    document.getSourceName(), metadata.getPageCount(), iterated);
            return metadata.toBuilder().pageCount(iterated).build();
        }
        return metadata;
    }

    private ExtractionDiagnostic diagnostic(DiagnosticCode code, int pageNumber, int pageOrder,
                                            String fieldId, String message) {
        log.warn("Page {} control {} ({}): {}", pageNumber, pageOrder, fieldId, message);
        return new ExtractionDiagnostic(code, pageNumber, pageOrder, fieldId, message);
    }
}
