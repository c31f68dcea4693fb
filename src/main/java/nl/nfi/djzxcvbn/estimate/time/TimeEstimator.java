package nl.nfi.djzxcvbn.estimate.time;

import java.util.EnumMap;
import java.util.Map;

public final class TimeEstimator {

    private TimeEstimator() {
    }

    public static CrackTimes estimate(final double guesses) {
        final Map<AttackScenario, Double> seconds = new EnumMap<>(AttackScenario.class);
        final Map<AttackScenario, CrackTimeDisplay> display = new EnumMap<>(AttackScenario.class);
        for (final AttackScenario scenario : AttackScenario.values()) {
            final double secondsToCrack = scenario.secondsToCrack(guesses);
            seconds.put(scenario, secondsToCrack);
            display.put(scenario, CrackTimeDisplay.of(secondsToCrack));
        }
        return new CrackTimes(seconds, display);
    }
}
