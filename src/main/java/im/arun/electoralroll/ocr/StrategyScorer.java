package im.arun.electoralroll.ocr;

import im.arun.electoralroll.extract.StructuralProbe;
import im.arun.electoralroll.model.RecognitionAttempt;
import im.arun.electoralroll.text.TextNormalizer;

import java.util.List;

/**
 * Ranks recognition attempts. The score is the number of record-shaped lines in the normalized
 * text; ties go to the longer text and then to the earlier strategy.
 */
public class StrategyScorer {

    private final TextNormalizer normalizer;
    private final StructuralProbe probe;

    public StrategyScorer(TextNormalizer normalizer) {
        this(normalizer, new StructuralProbe());
    }

    public StrategyScorer(TextNormalizer normalizer, StructuralProbe probe) {
        this.normalizer = normalizer;
        this.probe = probe;
    }

    public int score(String text) {
        return probe.count(normalizer.normalize(text));
    }

    /**
     * @param attempts scored attempts in strategy order
     * @return index of the best non-blank attempt, or -1 when all are blank
     */
    public int selectBest(List<RecognitionAttempt> attempts) {
        int best = -1;
        for (int i = 0; i < attempts.size(); i++) {
            RecognitionAttempt candidate = attempts.get(i);
            if (candidate.isFailed() || candidate.isBlank()) {
                continue;
            }
            if (best < 0 || isBetter(candidate, attempts.get(best))) {
                best = i;
            }
        }
        return best;
    }

    private static boolean isBetter(RecognitionAttempt candidate, RecognitionAttempt current) {
        if (candidate.getScore() != current.getScore()) {
            return candidate.getScore() > current.getScore();
        }
        // strictly longer only, so the earlier strategy keeps an exact tie
        return candidate.textLength() > current.textLength();
    }
}
