package nl.nfi.djzxcvbn.estimate.feedback;

import java.util.List;

// warning is empty when there is nothing to warn about
public record FeedbackText(String warning, List<String> suggestions) {

    public FeedbackText {
        suggestions = List.copyOf(suggestions);
    }
}
