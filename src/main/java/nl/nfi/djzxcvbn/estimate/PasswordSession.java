package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.estimate.feedback.FeedbackText;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

// password and latest evaluation of a form edited over time
// changing the user inputs or the language re-evaluates the current password, the estimator is swapped as a whole
public final class PasswordSession {

    private StrengthEstimator estimator;
    private String password;
    private EvaluationResult result;

    public PasswordSession(final StrengthEstimator estimator) {
        this.estimator = estimator;
    }

    public synchronized EvaluationResult setPassword(final String password) {
        // a rejected password leaves the previous one in place
        final EvaluationResult evaluated = estimator.evaluate(password);
        this.password = password;
        this.result = evaluated;
        return evaluated;
    }

    public synchronized Optional<String> password() {
        return Optional.ofNullable(password);
    }

    public synchronized Optional<EvaluationResult> result() {
        return Optional.ofNullable(result);
    }

    public synchronized Optional<FeedbackText> feedbackText() {
        return Optional.ofNullable(result).map(estimator::feedbackText);
    }

    public synchronized void updateUserInputs(final Collection<?> userInputs) {
        estimator = estimator.userInputs(userInputs == null ? List.of() : userInputs);
        reevaluate();
    }

    public synchronized void setLanguage(final String languageTag) {
        estimator = estimator.language(languageTag);
        reevaluate();
    }

    public synchronized StrengthEstimator estimator() {
        return estimator;
    }

    private void reevaluate() {
        if (password != null) {
            result = estimator.evaluate(password);
        }
    }

    @Override
    public synchronized String toString() {
        return "PasswordSession[passwordSet=%s]".formatted(password != null);
    }
}
