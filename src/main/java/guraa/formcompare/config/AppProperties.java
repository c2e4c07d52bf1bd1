package guraa.formcompare.config;

import guraa.formcompare.comparison.FormDiffEngine;
import guraa.formcompare.comparison.NearTextMatching;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Extraction extraction = new Extraction();
    private final Comparison comparison = new Comparison();
    private final Cors cors = new Cors();

    public Extraction getExtraction() {
        return extraction;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public Cors getCors() {
        return cors;
    }

    /**
     * Extraction configuration properties
     */
    public static class Extraction {
        /**
         * Largest horizontal gap, in points, between two words of one label phrase.
         */
        private float phraseGapTolerance = 5.0f;

        /**
         * Reduce hierarchical field names to their short code, e.g. A0101.
         */
        private boolean shortenFieldIds = false;

        public float getPhraseGapTolerance() {
            return phraseGapTolerance;
        }

        public void setPhraseGapTolerance(float phraseGapTolerance) {
            this.phraseGapTolerance = phraseGapTolerance;
        }

        public boolean isShortenFieldIds() {
            return shortenFieldIds;
        }

        public void setShortenFieldIds(boolean shortenFieldIds) {
            this.shortenFieldIds = shortenFieldIds;
        }
    }

    /**
     * Comparison configuration properties
     */
    public static class Comparison {
        /**
         * Largest per-edge drift, in points, still treated as the same position.
         */
        private double positionTolerance = FormDiffEngine.DEFAULT_POSITION_TOLERANCE;

        private NearTextMatching nearTextMatching = NearTextMatching.EXACT;

        public double getPositionTolerance() {
            return positionTolerance;
        }

        public void setPositionTolerance(double positionTolerance) {
            this.positionTolerance = positionTolerance;
        }

        public NearTextMatching getNearTextMatching() {
            return nearTextMatching;
        }

        public void setNearTextMatching(NearTextMatching nearTextMatching) {
            this.nearTextMatching = nearTextMatching;
        }
    }

    /**
     * CORS configuration properties
     */
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = new ArrayList<>();
        private Long maxAge = 3600L;

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public List<String> getAllowedMethods() {
            return allowedMethods;
        }

        public void setAllowedMethods(List<String> allowedMethods) {
            this.allowedMethods = allowedMethods;
        }

        public Long getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Long maxAge) {
            this.maxAge = maxAge;
        }
    }
}
