package guraa.formcompare.controller;

import guraa.formcompare.config.AppProperties;
import guraa.formcompare.extraction.ExtractionResult;
import guraa.formcompare.model.BoundingBox;
import guraa.formcompare.model.DocumentMetadata;
import guraa.formcompare.model.FieldRecord;
import guraa.formcompare.model.FieldType;
import guraa.formcompare.service.FormAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {FormAnalysisController.class, HealthController.class})
@Import(AppProperties.class)
class FormAnalysisControllerTest {

    @Autowired MockMvc mvc;
    @MockBean FormAnalysisService analysisService;

    private static final DocumentMetadata METADATA = DocumentMetadata.builder().title("Intake").pageCount(2).build();

    @Test
    void returnsExtractedFields() throws Exception {
        FieldRecord name = FieldRecord.builder()
                .fieldId("name")
                .fieldType(FieldType.TEXT)
                .rawType("Tx")
                .pageNumber(1)
                .pageOrder(0)
                .nearText("Name:")
                .position(BoundingBox.of(120, 12, 320, 32))
                .build();
        when(analysisService.analyze(any(MultipartFile.class)))
                .thenReturn(new ExtractionResult("intake.pdf", List.of(name), METADATA, Collections.emptyList()));

        mvc.perform(multipart("/api/forms/analyze")
                        .file(new MockMultipartFile("file", "intake.pdf", "application/pdf", "%PDF-1.7".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceName").value("intake.pdf"))
                .andExpect(jsonPath("$.fields[0].fieldId").value("name"))
                .andExpect(jsonPath("$.fields[0].nearText").value("Name:"))
                .andExpect(jsonPath("$.fields[0].position.x0").value(120.0))
                .andExpect(jsonPath("$.fields[0].valueOptions").doesNotExist())
                .andExpect(jsonPath("$.metadata.pageCount").value(2));
    }

    @Test
    void formWithoutFieldsIsUnprocessable() throws Exception {
        when(analysisService.analyze(any(MultipartFile.class)))
                .thenReturn(new ExtractionResult("letter.pdf", Collections.emptyList(), METADATA, Collections.emptyList()));

        mvc.perform(multipart("/api/forms/analyze")
                        .file(new MockMultipartFile("file", "letter.pdf", "application/pdf", "%PDF-1.7".getBytes())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.sourceName").value("letter.pdf"))
                .andExpect(jsonPath("$.pageCount").value(2));
    }

    @Test
    void rejectsEmptyAndNonPdfUploads() throws Exception {
        mvc.perform(multipart("/api/forms/analyze")
                        .file(new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("File is empty"));

        mvc.perform(multipart("/api/forms/analyze")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Only PDF files are allowed"));

        verifyNoInteractions(analysisService);
    }

    @Test
    void healthCheckReportsUp() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
