package nl.nfi.djzxcvbn.estimate.scoring;

// 0 (too guessable) up to 4 (very unguessable)
public final class ScoreClassifier {

    public static final int MAX_SCORE = 4;

    private static final double[] THRESHOLDS = {1e3, 1e6, 1e8, 1e10};

    private ScoreClassifier() {
    }

    public static int score(final double guesses) {
        for (int score = 0; score < THRESHOLDS.length; score++) {
            if (guesses < THRESHOLDS[score]) {
                return score;
            }
        }
        return MAX_SCORE;
    }
}
