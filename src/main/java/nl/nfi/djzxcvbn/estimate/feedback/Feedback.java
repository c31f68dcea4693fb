package nl.nfi.djzxcvbn.estimate.feedback;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record Feedback(Optional<Warning> warning, List<Suggestion> suggestions) {

    public static final Feedback NONE = new Feedback(Optional.empty(), List.of());

    public Feedback {
        suggestions = List.copyOf(suggestions);
    }

    public static Feedback of(final Warning warning, final Suggestion... suggestions) {
        return new Feedback(Optional.ofNullable(warning), List.of(suggestions));
    }

    public Feedback withLeadingSuggestion(final Suggestion suggestion) {
        final List<Suggestion> prefixed = new ArrayList<>(suggestions.size() + 1);
        prefixed.add(suggestion);
        prefixed.addAll(suggestions);
        return new Feedback(warning, prefixed);
    }

    public FeedbackText render(final Translator translator) {
        return new FeedbackText(
                warning.map(value -> translator.translate(value.key())).orElse(""),
                suggestions.stream().map(suggestion -> translator.translate(suggestion.key())).toList()
        );
    }
}
