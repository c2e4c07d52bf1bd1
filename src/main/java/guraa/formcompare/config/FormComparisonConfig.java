package guraa.formcompare.config;

import guraa.formcompare.comparison.FormDiffEngine;
import guraa.formcompare.core.PdfFormDecoder;
import guraa.formcompare.extraction.FieldExtractor;
import guraa.formcompare.extraction.NearestLabelLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the extraction and comparison beans
 */
@Slf4j
@Configuration
public class FormComparisonConfig {

    /**
     * Creates the PDF decoder with the configured phrase grouping
     * @param properties The application properties
     * @return The PdfFormDecoder instance
     */
    @Bean
    public PdfFormDecoder pdfFormDecoder(AppProperties properties) {
        return new PdfFormDecoder(properties.getExtraction().getPhraseGapTolerance());
    }

    /**
     * Creates a FieldExtractor bean for dependency injection
     * @param properties The application properties
     * @return The FieldExtractor instance
     */
    @Bean
    public FieldExtractor fieldExtractor(AppProperties properties) {
        return new FieldExtractor(new NearestLabelLocator(), properties.getExtraction().isShortenFieldIds());
    }

    /**
     * Creates a FormDiffEngine bean for dependency injection
     * @param properties The application properties
     * @return The FormDiffEngine instance
     */
    @Bean
    public FormDiffEngine formDiffEngine(AppProperties properties) {
        AppProperties.Comparison comparison = properties.getComparison();
        log.info("Comparison settings: position tolerance {}, near text matching {}",
                comparison.getPositionTolerance(), comparison.getNearTextMatching());
        return new FormDiffEngine(comparison.getPositionTolerance(), comparison.getNearTextMatching());
    }
}
