package nl.nfi.djzxcvbn.estimate.time;

// attacker throughputs the crack times are reported for
public enum AttackScenario {

    // rate limited login form
    ONLINE_THROTTLED("online_throttled", 100.0 / 3600),
    ONLINE_UNTHROTTLED("online_unthrottled", 10),
    // stolen database, salted and deliberately slow hash such as bcrypt or scrypt
    OFFLINE_SLOW_HASH("offline_slow_hash", 1e4),
    // stolen database, unsalted fast hash, many machines
    OFFLINE_FAST_HASH("offline_fast_hash", 1e10);

    private final String key;
    private final double guessesPerSecond;

    AttackScenario(final String key, final double guessesPerSecond) {
        this.key = key;
        this.guessesPerSecond = guessesPerSecond;
    }

    public String key() {
        return key;
    }

    public double guessesPerSecond() {
        return guessesPerSecond;
    }

    public double secondsToCrack(final double guesses) {
        return guesses / guessesPerSecond;
    }
}
