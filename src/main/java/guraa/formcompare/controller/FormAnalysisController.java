package guraa.formcompare.controller;

import guraa.formcompare.extraction.ExtractionResult;
import guraa.formcompare.service.FormAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/forms")
@RequiredArgsConstructor
public class FormAnalysisController {

    private final FormAnalysisService analysisService;

    /**
     * Extract the form fields of an uploaded PDF.
     *
     * @param file The PDF to analyze
     * @return The extraction result
     * @throws IOException If the file is not a decodable PDF
     */
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "File is empty"));
        }
        if (!UploadChecks.isPdf(file)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Only PDF files are allowed"));
        }

        log.info("Analyzing form {}", file.getOriginalFilename());
        ExtractionResult result = analysisService.analyze(file);
        result.requireFormFields();
        return ResponseEntity.ok(result);
    }
}
