package guraa.formcompare.service;

import guraa.formcompare.core.DecodeException;
import guraa.formcompare.core.DecodedDocument;
import guraa.formcompare.core.PdfFormDecoder;
import guraa.formcompare.extraction.ExtractionResult;
import guraa.formcompare.extraction.FieldExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Service for extracting the form structure of uploaded PDF documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormAnalysisService {

    private final PdfFormDecoder decoder;
    private final FieldExtractor extractor;

    /**
     * Analyze an uploaded PDF file.
     *
     * @param file The uploaded file
     * @return The extraction result
     * @throws IOException If the upload cannot be read or is not a decodable PDF
     */
    public ExtractionResult analyze(MultipartFile file) throws IOException {
        String sourceName = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        return analyze(file.getBytes(), sourceName);
    }

    /**
     * Analyze PDF content.
     *
     * @param content The raw PDF bytes
     * @param sourceName Name used in logs and errors
     * @return The extraction result
     * @throws DecodeException If the content is not a decodable PDF
     */
    public ExtractionResult analyze(byte[] content, String sourceName) throws DecodeException {
        long start = System.currentTimeMillis();
        DecodedDocument document = decoder.decode(content, sourceName);
        ExtractionResult result = extractor.extract(document);
        log.debug("Analyzed {} in {} ms", sourceName, System.currentTimeMillis() - start);
        return result;
    }
}
