package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.estimate.feedback.Feedback;
import nl.nfi.djzxcvbn.estimate.feedback.FeedbackText;
import nl.nfi.djzxcvbn.estimate.feedback.Translator;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.time.CrackTimes;

import java.time.Duration;
import java.util.List;

public record EvaluationResult(
        String password,
        double guesses,
        List<Match> sequence,
        int score,
        CrackTimes crackTimes,
        Feedback feedback,
        Duration calcTime
) {

    public EvaluationResult {
        sequence = List.copyOf(sequence);
    }

    public double guessesLog10() {
        return Math.log10(guesses);
    }

    public FeedbackText feedbackText(final Translator translator) {
        return feedback.render(translator);
    }

    // everything except the password and timing, for comparing evaluations
    public boolean sameEstimateAs(final EvaluationResult other) {
        return guesses == other.guesses
                && score == other.score
                && sequence.equals(other.sequence)
                && crackTimes.equals(other.crackTimes)
                && feedback.equals(other.feedback);
    }
}
