package nl.nfi.djzxcvbn.estimate.match;

import java.util.ArrayList;
import java.util.List;

import static java.lang.Math.abs;

// runs with a constant step between code points, e.g. abcd, 97531 or xyzab
public final class SequenceMatcher implements PasswordMatcher {

    static final int MAX_DELTA = 5;
    static final int MIN_LENGTH = 3;

    @Override
    public List<SequenceMatch> match(final String password) {
        final List<SequenceMatch> matches = new ArrayList<>();
        final int length = password.length();
        if (length < MIN_LENGTH) {
            return matches;
        }

        int i = 0;
        int lastDelta = delta(password.charAt(0), password.charAt(1));
        for (int k = 2; k < length; k++) {
            final int delta = delta(password.charAt(k - 1), password.charAt(k));
            if (delta == lastDelta) {
                continue;
            }
            // consecutive runs share their boundary character
            final int j = k - 1;
            addRun(password, i, j, lastDelta, matches);
            i = j;
            lastDelta = delta;
        }
        addRun(password, i, length - 1, lastDelta, matches);
        return matches;
    }

    private static void addRun(final String password, final int i, final int j, final int delta, final List<SequenceMatch> matches) {
        if (j - i + 1 < MIN_LENGTH || delta == 0 || abs(delta) > MAX_DELTA) {
            return;
        }
        final String token = password.substring(i, j + 1);
        final SequenceClass sequenceClass = SequenceClass.of(token);
        matches.add(SequenceMatch.of(i, j, token, sequenceClass.sequenceName, sequenceClass.space, delta, password.length()));
    }

    // a step of one across the end of a class wraps around, e.g. z -> a counts as +1
    static int delta(final char previous, final char current) {
        final int delta = current - previous;
        final int classSize = wrapSize(previous, current);
        if (classSize > 0) {
            if (delta == -(classSize - 1)) {
                return 1;
            }
            if (delta == classSize - 1) {
                return -1;
            }
        }
        return delta;
    }

    private static int wrapSize(final char previous, final char current) {
        if (isLower(previous) && isLower(current)) {
            return 26;
        }
        if (isUpper(previous) && isUpper(current)) {
            return 26;
        }
        if (isDigit(previous) && isDigit(current)) {
            return 10;
        }
        return 0;
    }

    private static boolean isLower(final char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isUpper(final char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private enum SequenceClass {
        LOWER("lower", 26),
        UPPER("upper", 26),
        DIGITS("digits", 10),
        UNICODE("unicode", 26);

        private final String sequenceName;
        private final int space;

        SequenceClass(final String sequenceName, final int space) {
            this.sequenceName = sequenceName;
            this.space = space;
        }

        static SequenceClass of(final String token) {
            if (token.chars().allMatch(c -> isLower((char) c))) {
                return LOWER;
            }
            if (token.chars().allMatch(c -> isUpper((char) c))) {
                return UPPER;
            }
            if (token.chars().allMatch(c -> isDigit((char) c))) {
                return DIGITS;
            }
            return UNICODE;
        }
    }
}
