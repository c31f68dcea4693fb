package nl.nfi.djzxcvbn.estimate.time;

import nl.nfi.djzxcvbn.estimate.feedback.Translator;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

public record CrackTimes(Map<AttackScenario, Double> seconds, Map<AttackScenario, CrackTimeDisplay> display) {

    public CrackTimes {
        seconds = unmodifiableMap(new EnumMap<>(seconds));
        display = unmodifiableMap(new EnumMap<>(display));
    }

    public double seconds(final AttackScenario scenario) {
        return seconds.get(scenario);
    }

    public CrackTimeDisplay display(final AttackScenario scenario) {
        return display.get(scenario);
    }

    // scenario key -> rendered label, in scenario order
    public Map<String, String> render(final Translator translator) {
        final Map<String, String> rendered = new LinkedHashMap<>();
        for (final AttackScenario scenario : AttackScenario.values()) {
            rendered.put(scenario.key(), display(scenario).render(translator));
        }
        return rendered;
    }
}
