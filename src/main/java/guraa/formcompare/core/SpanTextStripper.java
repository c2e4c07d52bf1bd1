package guraa.formcompare.core;

import guraa.formcompare.model.BoundingBox;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text stripper that collects the words of one page with their boxes and joins
 * neighbouring words of a line into phrase spans.
 * Boxes are reported in display space (top-left origin), which is the space
 * {@link TextPosition#getYDirAdj()} already uses.
 */
class SpanTextStripper extends PDFTextStripper {

    private final float phraseGapTolerance;
    private final List<Word> words = new ArrayList<>();

    SpanTextStripper(float phraseGapTolerance) throws IOException {
        super();
        this.phraseGapTolerance = phraseGapTolerance;
        setSortByPosition(true);
    }

    /**
     * Extract the phrase spans of a single page.
     *
     * @param document The PDF document
     * @param pageNumber The 1-based page number
     * @return Spans in reading order, indexed from 0
     * @throws IOException If the page content cannot be parsed
     */
    List<TextSpan> extractSpans(PDDocument document, int pageNumber) throws IOException {
        words.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        getText(document);
        return groupPhrases(pageNumber);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
        if (text == null || text.trim().isEmpty() || textPositions == null || textPositions.isEmpty()) {
            return;
        }

        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;

        for (TextPosition position : textPositions) {
            if (position == null) continue;
            float top = position.getYDirAdj() - position.getHeightDir();
            minX = Math.min(minX, position.getXDirAdj());
            minY = Math.min(minY, top);
            maxX = Math.max(maxX, position.getXDirAdj() + position.getWidthDirAdj());
            maxY = Math.max(maxY, position.getYDirAdj());
        }

        if (minX == Float.MAX_VALUE) {
            return;
        }
        words.add(new Word(text.trim(), minX, minY, maxX, maxY));
    }

    private List<TextSpan> groupPhrases(int pageNumber) {
        if (words.isEmpty()) {
            return Collections.emptyList();
        }

        List<TextSpan> spans = new ArrayList<>();
        Word phrase = null;

        for (Word word : words) {
            if (phrase != null && continuesPhrase(phrase, word)) {
                phrase = phrase.append(word);
            } else {
                if (phrase != null) {
                    spans.add(phrase.toSpan(pageNumber, spans.size()));
                }
                phrase = word;
            }
        }
        spans.add(phrase.toSpan(pageNumber, spans.size()));

        return spans;
    }

    private boolean continuesPhrase(Word phrase, Word word) {
        // Same baseline within half a line height
        float lineHeight = Math.max(phrase.y1 - phrase.y0, word.y1 - word.y0);
        if (Math.abs(phrase.y1 - word.y1) > lineHeight / 2) {
            return false;
        }
        float gap = word.x0 - phrase.x1;
        return gap >= -phraseGapTolerance && gap <= phraseGapTolerance;
    }

    private static final class Word {
        private final String text;
        private final float x0;
        private final float y0;
        private final float x1;
        private final float y1;

        private Word(String text, float x0, float y0, float x1, float y1) {
            this.text = text;
            this.x0 = x0;
            this.y0 = y0;
            this.x1 = x1;
            this.y1 = y1;
        }

        private Word append(Word next) {
            return new Word(text + " " + next.text,
                    Math.min(x0, next.x0), Math.min(y0, next.y0),
                    Math.max(x1, next.x1), Math.max(y1, next.y1));
        }

        private TextSpan toSpan(int pageNumber, int index) {
            return new TextSpan(text, BoundingBox.of(x0, y0, x1, y1), pageNumber, index);
        }
    }
}
