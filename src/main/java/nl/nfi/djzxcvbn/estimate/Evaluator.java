package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.common.Timers.TimedResult;
import nl.nfi.djzxcvbn.data.AdjacencyGraphs;
import nl.nfi.djzxcvbn.data.Dictionaries;
import nl.nfi.djzxcvbn.estimate.feedback.FeedbackGenerator;
import nl.nfi.djzxcvbn.estimate.match.MatcherSuite;
import nl.nfi.djzxcvbn.estimate.scoring.OptimalSequence;
import nl.nfi.djzxcvbn.estimate.scoring.SequenceOptimizer;
import nl.nfi.djzxcvbn.estimate.time.TimeEstimator;

import static nl.nfi.djzxcvbn.common.Timers.time;

// password -> candidates -> optimal sequence -> score, crack times and feedback keys
public final class Evaluator {

    private Evaluator() {
    }

    public static EvaluationResult evaluate(final String password, final Dictionaries dictionaries, final AdjacencyGraphs graphs) {
        return evaluate(password, MatcherSuite.forSnapshot(dictionaries, graphs));
    }

    public static EvaluationResult evaluate(final String password, final MatcherSuite matchers) {
        // matching and optimizing is where all of the time goes
        final TimedResult<OptimalSequence> result = time(() -> SequenceOptimizer.optimize(password, matchers.match(password)));
        final OptimalSequence optimal = result.value();
        final int score = optimal.score();

        return new EvaluationResult(
                password,
                optimal.guesses(),
                optimal.sequence(),
                score,
                TimeEstimator.estimate(optimal.guesses()),
                FeedbackGenerator.generate(score, optimal.sequence()),
                result.duration()
        );
    }
}
