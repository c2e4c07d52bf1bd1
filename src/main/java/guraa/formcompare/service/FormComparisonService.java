package guraa.formcompare.service;

import guraa.formcompare.comparison.ComparisonResult;
import guraa.formcompare.comparison.FormDiffEngine;
import guraa.formcompare.extraction.ExtractionResult;
import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Service for comparing two versions of a form.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormComparisonService {

    private final FormAnalysisService analysisService;
    private final FormDiffEngine diffEngine;

    /**
     * Compare two previously extracted field sets.
     */
    public ComparisonResult compare(List<FieldRecord> sourceFields, List<FieldRecord> targetFields,
                                    DocumentMetadata sourceMetadata, DocumentMetadata targetMetadata) {
        return diffEngine.compare(sourceFields, targetFields, sourceMetadata, targetMetadata);
    }

    /**
     * Extract both uploaded versions and compare them. Either version may have no
     * form fields; every field of the other side then shows up as added or removed.
     *
     * @param source The older version
     * @param target The newer version
     * @return The comparison result
     * @throws IOException If either upload is not a decodable PDF
     */
    public ComparisonResult compareFiles(MultipartFile source, MultipartFile target) throws IOException {
        ExtractionResult sourceResult = analysisService.analyze(source);
        ExtractionResult targetResult = analysisService.analyze(target);

        log.info("Comparing {} ({} fields) with {} ({} fields)",
                sourceResult.getSourceName(), sourceResult.getFields().size(),
                targetResult.getSourceName(), targetResult.getFields().size());

        return diffEngine.compare(sourceResult.getFields(), targetResult.getFields(),
                sourceResult.getMetadata(), targetResult.getMetadata());
    }
}
