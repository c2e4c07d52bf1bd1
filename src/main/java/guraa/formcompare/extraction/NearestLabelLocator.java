package guraa.formcompare.extraction;

import guraa.formcompare.core.TextSpan;
import guraa.formcompare.model.BoundingBox;

import java.util.List;

/**
 * Picks the text span most likely to be the caption of a control.
 * <p>
 * Spans on the control's line that start left of its right edge win, ranked by
 * horizontal gap. Without any, the span with the smallest vertical gap strictly
 * above the control is used. Ties go to the smallest center distance, then to the
 * earliest span.
 */
public class NearestLabelLocator {

    /**
     * Find the label span for a control.
     *
     * @param control The control's box, in the same space as the spans
     * @param pageSpans The spans of the control's page
     * @return The chosen span, or null if no span qualifies
     */
    public TextSpan locate(BoundingBox control, List<TextSpan> pageSpans) {
        if (control == null || pageSpans == null || pageSpans.isEmpty()) {
            return null;
        }

        Candidate sameLine = null;
        Candidate above = null;
        double band = Math.abs(control.height());

        for (TextSpan span : pageSpans) {
            BoundingBox box = span.getBox();
            if (box == null || span.getText() == null || span.getText().trim().isEmpty()) {
                continue;
            }

            boolean inBand = Math.abs(box.centerY() - control.centerY()) <= band;
            if (inBand && box.getX0() < control.getX1()) {
                double gap = Math.max(0.0, control.getX0() - box.getX1());
                sameLine = better(sameLine, new Candidate(span, gap, box.centerDistance(control)));
            }
            if (box.getY1() <= control.getY0()) {
                double gap = control.getY0() - box.getY1();
                above = better(above, new Candidate(span, gap, box.centerDistance(control)));
            }
        }

        if (sameLine != null) {
            return sameLine.span;
        }
        return above != null ? above.span : null;
    }

    private static Candidate better(Candidate current, Candidate challenger) {
        if (current == null) {
            return challenger;
        }
        int byGap = Double.compare(challenger.gap, current.gap);
        if (byGap != 0) {
            return byGap < 0 ? challenger : current;
        }
        int byDistance = Double.compare(challenger.centerDistance, current.centerDistance);
        if (byDistance != 0) {
            return byDistance < 0 ? challenger : current;
        }
        return challenger.span.getIndex() < current.span.getIndex() ? challenger : current;
    }

    private static final class Candidate {
        private final TextSpan span;
        private final double gap;
        private final double centerDistance;

        private Candidate(TextSpan span, double gap, double centerDistance) {
            this.span = span;
            this.gap = gap;
            this.centerDistance = centerDistance;
        }
    }
}
