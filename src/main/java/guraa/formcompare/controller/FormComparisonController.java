package guraa.formcompare.controller;

import guraa.formcompare.comparison.ComparisonResult;
import guraa.formcompare.service.FormComparisonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/comparisons")
@RequiredArgsConstructor
public class FormComparisonController {

    private final FormComparisonService comparisonService;

    /**
     * Compare two extracted field sets.
     *
     * @param request Fields and metadata of both versions
     * @return The comparison result
     */
    @PostMapping("/analyze")
    public ResponseEntity<?> compareFields(@RequestBody ComparisonRequest request) {
        if (request.getSourceMetadata() == null || request.getTargetMetadata() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Source and target metadata are required"));
        }
        if (request.getSourceFields() == null || request.getTargetFields() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Source and target fields are required"));
        }

        ComparisonResult result = comparisonService.compare(request.getSourceFields(), request.getTargetFields(),
                request.getSourceMetadata(), request.getTargetMetadata());
        return ResponseEntity.ok(result);
    }

    /**
     * Extract and compare two uploaded versions of a form.
     *
     * @param source The older version
     * @param target The newer version
     * @return The comparison result
     * @throws IOException If either file is not a decodable PDF
     */
    @PostMapping("/files")
    public ResponseEntity<?> compareFiles(@RequestParam("source") MultipartFile source,
                                          @RequestParam("target") MultipartFile target) throws IOException {
        if (source.isEmpty() || target.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Both files are required"));
        }
        if (!UploadChecks.isPdf(source) || !UploadChecks.isPdf(target)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Only PDF files are allowed"));
        }

        log.info("Comparing {} with {}", source.getOriginalFilename(), target.getOriginalFilename());
        return ResponseEntity.ok(comparisonService.compareFiles(source, target));
    }
}
