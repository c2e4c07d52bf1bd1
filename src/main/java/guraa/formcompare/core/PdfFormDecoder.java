package guraa.formcompare.core;

import guraa.formcompare.model.BoundingBox;
import guraa.formcompare.model.DocumentMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceDictionary;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAppearanceEntry;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDCheckBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDChoice;
import org.apache.pdfbox.pdmodel.interactive.form.PDComboBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDListBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDPushButton;
import org.apache.pdfbox.pdmodel.interactive.form.PDRadioButton;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTerminalField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.GregorianCalendar;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes PDF bytes into a {@link DecodedDocument}: metadata, per-page phrase spans
 * and per-page AcroForm controls in annotation order.
 */
@Slf4j
public class PdfFormDecoder {

    private static final byte[] PDF_HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_SEARCH_LIMIT = 1024;
    private static final Pattern OFFSET_PATTERN = Pattern.compile("offset:? (\\d+)");

    private final float phraseGapTolerance;

    public PdfFormDecoder(float phraseGapTolerance) {
        this.phraseGapTolerance = phraseGapTolerance;
    }

    /**
     * Decode a PDF document held in memory.
     *
     * @param content The raw PDF bytes
     * @param sourceName Name used in logs and errors, usually the upload file name
     * @return The decoded document
     * @throws DecodeException If the bytes are not a readable PDF
     */
    public DecodedDocument decode(byte[] content, String sourceName) throws DecodeException {
        if (content == null || content.length == 0) {
            throw new DecodeException(sourceName, "Document is empty", 0L);
        }
        if (findHeader(content) < 0) {
            throw new DecodeException(sourceName, "Missing %PDF- header", 0L);
        }

        try (PDDocument document = PDDocument.load(content)) {
            if (document.getNumberOfPages() == 0) {
                throw new DecodeException(sourceName, "Document has no pages", null);
            }
            return processDocument(document, sourceName);
        } catch (InvalidPasswordException e) {
            throw new DecodeException(sourceName, "Document is encrypted and cannot be opened without a password", null, e);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            log.warn("Failed to decode {}: {}", sourceName, e.getMessage());
            throw new DecodeException(sourceName, "Invalid or corrupted PDF: " + e.getMessage(), parseOffset(e.getMessage()), e);
        }
    }

    private DecodedDocument processDocument(PDDocument document, String sourceName) throws IOException {
        PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
        Map<COSDictionary, PDTerminalField> fieldsByWidget = indexWidgets(acroForm);
        Set<COSDictionary> emitted = Collections.newSetFromMap(new IdentityHashMap<>());

        List<DecodedPage> pages = new ArrayList<>();
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            PDPage page = document.getPage(i);
            pages.add(processPage(document, page, i + 1, fieldsByWidget, emitted));
        }

        List<NativeControl> orphans = collectOrphans(acroForm, emitted);
        if (!orphans.isEmpty()) {
            log.warn("{}: {} form fields are not placed on any page, attaching them to the last page",
                    sourceName, orphans.size());
            DecodedPage last = pages.remove(pages.size() - 1);
            List<NativeControl> controls = new ArrayList<>(last.getControls());
            controls.addAll(orphans);
            pages.add(new DecodedPage(last.getPageNumber(), last.getWidth(), last.getHeight(),
                    last.getTextSpans(), Collections.unmodifiableList(controls)));
        }

        DocumentMetadata metadata = extractMetadata(document);
        log.debug("Decoded {}: {} pages, AcroForm present: {}", sourceName, pages.size(), acroForm != null);
        return new DecodedDocument(sourceName, metadata, Collections.unmodifiableList(pages));
    }

    /**
     * Extract document metadata from the information dictionary.
     *
     * @param document The PDF document
     * @return Metadata with page count and whatever entries are present
     */
    private DocumentMetadata extractMetadata(PDDocument document) {
        DocumentMetadata.DocumentMetadataBuilder builder = DocumentMetadata.builder()
                .pageCount(document.getNumberOfPages());

        PDDocumentInformation info = document.getDocumentInformation();
        if (info != null) {
            builder.title(info.getTitle())
                    .author(info.getAuthor())
                    .subject(info.getSubject())
                    .creationDate(toOffsetDateTime(info.getCreationDate()))
                    .modificationDate(toOffsetDateTime(info.getModificationDate()));
        }
        return builder.build();
    }

    private DecodedPage processPage(PDDocument document, PDPage page, int pageNumber,
                                    Map<COSDictionary, PDTerminalField> fieldsByWidget,
                                    Set<COSDictionary> emitted) throws IOException {
        PDRectangle cropBox = page.getCropBox();

        SpanTextStripper stripper = new SpanTextStripper(phraseGapTolerance);
        List<TextSpan> spans = stripper.extractSpans(document, pageNumber);

        List<NativeControl> controls = new ArrayList<>();
        for (PDAnnotation annotation : page.getAnnotations()) {
            if (!(annotation instanceof PDAnnotationWidget)) {
                continue;
            }
            PDAnnotationWidget widget = (PDAnnotationWidget) annotation;
            PDTerminalField field = fieldsByWidget.get(widget.getCOSObject());

            if (field == null) {
                // Widget without an AcroForm field behind it
                controls.add(NativeControl.builder()
                        .name(widget.getCOSObject().getString(COSName.T))
                        .kind(widget.getCOSObject().getNameAsString(COSName.FT))
                        .box(toDisplayBox(widget.getRectangle(), cropBox))
                        .build());
                continue;
            }
            if (!emitted.add(field.getCOSObject())) {
                // Further widgets of a radio group already emitted
                continue;
            }
            controls.add(NativeControl.builder()
                    .name(field.getFullyQualifiedName())
                    .kind(nativeKind(field))
                    .box(toDisplayBox(widget.getRectangle(), cropBox))
                    .options(extractOptions(field))
                    .build());
        }

        return new DecodedPage(pageNumber, cropBox.getWidth(), cropBox.getHeight(),
                spans, Collections.unmodifiableList(controls));
    }

    private Map<COSDictionary, PDTerminalField> indexWidgets(PDAcroForm acroForm) {
        Map<COSDictionary, PDTerminalField> index = new IdentityHashMap<>();
        if (acroForm == null) {
            return index;
        }
        for (PDField field : acroForm.getFieldTree()) {
            if (field instanceof PDTerminalField) {
                PDTerminalField terminal = (PDTerminalField) field;
                for (PDAnnotationWidget widget : terminal.getWidgets()) {
                    index.put(widget.getCOSObject(), terminal);
                }
            }
        }
        return index;
    }

    private List<NativeControl> collectOrphans(PDAcroForm acroForm, Set<COSDictionary> emitted) {
        List<NativeControl> orphans = new ArrayList<>();
        if (acroForm == null) {
            return orphans;
        }
        for (PDField field : acroForm.getFieldTree()) {
            if (!(field instanceof PDTerminalField) || emitted.contains(field.getCOSObject())) {
                continue;
            }
            PDTerminalField terminal = (PDTerminalField) field;
            orphans.add(NativeControl.builder()
                    .name(terminal.getFullyQualifiedName())
                    .kind(nativeKind(terminal))
                    .options(extractOptions(terminal))
                    .orphan(true)
                    .build());
        }
        return orphans;
    }

    /**
     * Describe the field's kind as the PDF field type plus a qualifier for the
     * subtypes that share one type.
     *
     * @param field The terminal field
     * @return The native kind string
     */
    static String nativeKind(PDTerminalField field) {
        if (field instanceof PDTextField) {
            return ((PDTextField) field).isMultiline() ? "Tx:multiline" : "Tx";
        } else if (field instanceof PDCheckBox) {
            return "Btn:checkbox";
        } else if (field instanceof PDRadioButton) {
            return "Btn:radio";
        } else if (field instanceof PDPushButton) {
            return "Btn:push";
        } else if (field instanceof PDComboBox) {
            return "Ch:combo";
        } else if (field instanceof PDListBox) {
            return "Ch:list";
        } else if (field instanceof PDSignatureField) {
            return "Sig";
        }
        return field.getFieldType();
    }

    private List<String> extractOptions(PDTerminalField field) {
        if (field instanceof PDChoice) {
            List<String> options = ((PDChoice) field).getOptionsDisplayValues();
            return options.isEmpty() ? null : Collections.unmodifiableList(new ArrayList<>(options));
        }
        if (field instanceof PDRadioButton) {
            PDRadioButton radio = (PDRadioButton) field;
            List<String> exportValues = radio.getExportValues();
            if (!exportValues.isEmpty()) {
                return Collections.unmodifiableList(new ArrayList<>(exportValues));
            }
            List<String> states = new ArrayList<>();
            for (PDAnnotationWidget widget : radio.getWidgets()) {
                states.addAll(onStates(widget));
            }
            return states.isEmpty() ? null : Collections.unmodifiableList(states);
        }
        return null;
    }

    private List<String> onStates(PDAnnotationWidget widget) {
        List<String> states = new ArrayList<>();
        PDAppearanceDictionary appearance = widget.getAppearance();
        if (appearance == null) {
            return states;
        }
        PDAppearanceEntry normal = appearance.getNormalAppearance();
        if (normal == null || !normal.isSubDictionary()) {
            return states;
        }
        for (COSName state : normal.getSubDictionary().keySet()) {
            if (!COSName.Off.equals(state)) {
                states.add(state.getName());
            }
        }
        return states;
    }

    /**
     * Convert a PDF rectangle (bottom-left origin) to display space (top-left origin).
     *
     * @param rect The widget rectangle, may be null
     * @param cropBox The page crop box
     * @return The display-space box, or null when the widget has no rectangle
     */
    static BoundingBox toDisplayBox(PDRectangle rect, PDRectangle cropBox) {
        if (rect == null) {
            return null;
        }
        double top = cropBox.getUpperRightY() - rect.getUpperRightY();
        double bottom = cropBox.getUpperRightY() - rect.getLowerLeftY();
        return BoundingBox.of(
                rect.getLowerLeftX() - cropBox.getLowerLeftX(),
                top,
                rect.getUpperRightX() - cropBox.getLowerLeftX(),
                bottom);
    }

    private static OffsetDateTime toOffsetDateTime(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        if (calendar instanceof GregorianCalendar) {
            return ((GregorianCalendar) calendar).toZonedDateTime().toOffsetDateTime();
        }
        return calendar.toInstant().atOffset(ZoneOffset.UTC);
    }

    private static int findHeader(byte[] content) {
        int limit = Math.min(content.length - PDF_HEADER.length, HEADER_SEARCH_LIMIT);
        outer:
        for (int i = 0; i <= limit; i++) {
            for (int j = 0; j < PDF_HEADER.length; j++) {
                if (content[i + j] != PDF_HEADER[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    static Long parseOffset(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = OFFSET_PATTERN.matcher(message);
        return matcher.find() ? Long.valueOf(matcher.group(1)) : null;
    }
}
