package nl.nfi.djzxcvbn.estimate.match;

public record RegexMatch(int i, int j, String token, String regexName, double guesses) implements Match {

    @Override
    public PatternType pattern() {
        return PatternType.REGEX;
    }
}
