package guraa.formcompare;

import guraa.formcompare.comparison.NearTextMatching;
import guraa.formcompare.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FormCompareApplicationTests {

    @Autowired AppProperties properties;

    @Test
    void contextLoadsWithDefaults() {
        assertThat(properties.getExtraction().getPhraseGapTolerance()).isEqualTo(5.0f);
        assertThat(properties.getExtraction().isShortenFieldIds()).isFalse();
        assertThat(properties.getComparison().getPositionTolerance()).isEqualTo(1.0);
        assertThat(properties.getComparison().getNearTextMatching()).isEqualTo(NearTextMatching.EXACT);
    }
}
