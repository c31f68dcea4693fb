package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.estimate.feedback.FeedbackText;
import nl.nfi.djzxcvbn.estimate.feedback.Translator;
import nl.nfi.djzxcvbn.estimate.match.DateMatch;
import nl.nfi.djzxcvbn.estimate.match.DictionaryMatch;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.RegexMatch;
import nl.nfi.djzxcvbn.estimate.match.RepeatMatch;
import nl.nfi.djzxcvbn.estimate.match.SequenceMatch;
import nl.nfi.djzxcvbn.estimate.match.SpatialMatch;
import nl.nfi.djzxcvbn.estimate.time.AttackScenario;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

// snake_case field names, as consumed by existing zxcvbn clients
public final class EvaluationResultJson {

    private EvaluationResultJson() {
    }

    public static JSONObject toJson(final EvaluationResult result, final Translator translator) {
        final JSONObject json = new JSONObject();
        json.put("password", result.password());
        json.put("guesses", result.guesses());
        json.put("guesses_log10", result.guessesLog10());
        json.put("score", result.score());
        json.put("calc_time_ms", result.calcTime().toNanos() / 1_000_000.0);

        final JSONArray sequence = new JSONArray();
        for (final Match match : result.sequence()) {
            sequence.put(toJson(match));
        }
        json.put("sequence", sequence);

        final JSONObject seconds = new JSONObject();
        for (final AttackScenario scenario : AttackScenario.values()) {
            seconds.put(scenario.key(), result.crackTimes().seconds(scenario));
        }
        json.put("crack_times_seconds", seconds);

        final JSONObject display = new JSONObject();
        for (final Map.Entry<String, String> entry : result.crackTimes().render(translator).entrySet()) {
            display.put(entry.getKey(), entry.getValue());
        }
        json.put("crack_times_display", display);

        final FeedbackText text = result.feedbackText(translator);
        final JSONObject feedback = new JSONObject();
        feedback.put("warning", text.warning());
        feedback.put("suggestions", new JSONArray(text.suggestions()));
        json.put("feedback", feedback);
        return json;
    }

    static JSONObject toJson(final Match match) {
        final JSONObject json = new JSONObject();
        json.put("pattern", match.pattern().tag());
        json.put("i", match.i());
        json.put("j", match.j());
        json.put("token", match.token());
        json.put("guesses", match.guesses());
        json.put("guesses_log10", match.guessesLog10());

        if (match instanceof DictionaryMatch dictionary) {
            json.put("matched_word", dictionary.matchedWord());
            json.put("rank", dictionary.rank());
            json.put("dictionary_name", dictionary.dictionaryName());
            json.put("reversed", dictionary.reversed());
            json.put("l33t", dictionary.leet());
            json.put("base_guesses", dictionary.baseGuesses());
            json.put("uppercase_variations", dictionary.uppercaseVariations());
            json.put("l33t_variations", dictionary.leetVariations());
            if (dictionary.leet()) {
                final JSONObject substitutions = new JSONObject();
                dictionary.leetSubstitutions().forEach((leet, letter) -> substitutions.put(String.valueOf(leet), String.valueOf(letter)));
                json.put("sub", substitutions);
                json.put("sub_display", dictionary.substitutionDisplay());
            }
        } else if (match instanceof SpatialMatch spatial) {
            json.put("graph", spatial.graph());
            json.put("turns", spatial.turns());
            json.put("shifted_count", spatial.shiftedCount());
        } else if (match instanceof RepeatMatch repeat) {
            json.put("base_token", repeat.baseToken());
            json.put("base_guesses", repeat.baseGuesses());
            json.put("repeat_count", repeat.repeatCount());
            final JSONArray baseMatches = new JSONArray();
            for (final Match base : repeat.baseMatches()) {
                baseMatches.put(toJson(base));
            }
            json.put("base_matches", baseMatches);
        } else if (match instanceof SequenceMatch sequence) {
            json.put("sequence_name", sequence.sequenceName());
            json.put("sequence_space", sequence.sequenceSpace());
            json.put("ascending", sequence.ascending());
        } else if (match instanceof RegexMatch regex) {
            json.put("regex_name", regex.regexName());
        } else if (match instanceof DateMatch date) {
            json.put("separator", date.separator());
            json.put("year", date.year());
            json.put("month", date.month());
            json.put("day", date.day());
        }
        return json;
    }
}
