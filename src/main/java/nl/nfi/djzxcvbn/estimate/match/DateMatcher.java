package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.Math.abs;

// day, month and year in any plausible order, with or without separators, e.g. 13071987 or 1987-7-13
public final class DateMatcher implements PasswordMatcher {

    static final int MIN_YEAR = 1000;
    static final int MAX_YEAR = 2050;

    // digits only token length -> where to cut it into three numbers
    private static final Map<Integer, int[][]> SPLITS = Map.of(
            4, new int[][]{{1, 2}, {2, 3}},
            5, new int[][]{{1, 3}, {2, 3}},
            6, new int[][]{{1, 2}, {2, 4}, {4, 5}},
            7, new int[][]{{1, 3}, {2, 3}, {4, 5}, {4, 6}},
            8, new int[][]{{2, 4}, {4, 6}}
    );

    private static final Pattern WITHOUT_SEPARATOR = Pattern.compile("\\d{4,8}");
    private static final Pattern WITH_SEPARATOR = Pattern.compile("(\\d{1,4})([\\s/\\\\_.-])(\\d{1,2})\\2(\\d{1,4})");

    @Override
    public List<DateMatch> match(final String password) {
        final List<DateMatch> matches = new ArrayList<>();
        matchWithoutSeparator(password, matches);
        matchWithSeparator(password, matches);
        final List<DateMatch> filtered = withoutSubmatches(matches);
        filtered.sort(Match.BY_SPAN);
        return filtered;
    }

    private static void matchWithoutSeparator(final String password, final List<DateMatch> matches) {
        final int length = password.length();
        for (int i = 0; i <= length - 4; i++) {
            for (int j = i + 3; j <= i + 7 && j < length; j++) {
                final String token = password.substring(i, j + 1);
                if (!WITHOUT_SEPARATOR.matcher(token).matches()) {
                    continue;
                }

                // of all readings, the one closest to the reference year wins
                DayMonthYear best = null;
                for (final int[] split : SPLITS.get(token.length())) {
                    final Optional<DayMonthYear> candidate = toDayMonthYear(
                            Integer.parseInt(token.substring(0, split[0])),
                            Integer.parseInt(token.substring(split[0], split[1])),
                            Integer.parseInt(token.substring(split[1]))
                    );
                    if (candidate.isPresent() && (best == null || candidate.get().distance() < best.distance())) {
                        best = candidate.get();
                    }
                }
                if (best != null) {
                    matches.add(DateMatch.of(i, j, token, "", best.year(), best.month(), best.day(), length));
                }
            }
        }
    }

    private static void matchWithSeparator(final String password, final List<DateMatch> matches) {
        final int length = password.length();
        for (int i = 0; i <= length - 6; i++) {
            for (int j = i + 5; j <= i + 9 && j < length; j++) {
                final String token = password.substring(i, j + 1);
                final Matcher matcher = WITH_SEPARATOR.matcher(token);
                if (!matcher.matches()) {
                    continue;
                }
                final Optional<DayMonthYear> date = toDayMonthYear(
                        Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(3)),
                        Integer.parseInt(matcher.group(4))
                );
                if (date.isPresent()) {
                    final DayMonthYear value = date.get();
                    matches.add(DateMatch.of(i, j, token, matcher.group(2), value.year(), value.month(), value.day(), length));
                }
            }
        }
    }

    // a date inside a longer date, e.g. 1987 in 13-07-1987, is dropped
    private static List<DateMatch> withoutSubmatches(final List<DateMatch> matches) {
        final List<DateMatch> filtered = new ArrayList<>();
        for (int a = 0; a < matches.size(); a++) {
            final DateMatch match = matches.get(a);
            boolean contained = false;
            for (int b = 0; b < matches.size() && !contained; b++) {
                final DateMatch other = matches.get(b);
                contained = a != b && other.i() <= match.i() && other.j() >= match.j();
            }
            if (!contained) {
                filtered.add(match);
            }
        }
        return filtered;
    }

    static Optional<DayMonthYear> toDayMonthYear(final int first, final int second, final int third) {
        // the middle number is never a year
        if (second > 31 || second <= 0) {
            return Optional.empty();
        }

        int over12 = 0;
        int over31 = 0;
        int under1 = 0;
        for (final int value : new int[]{first, second, third}) {
            if ((value > 99 && value < MIN_YEAR) || value > MAX_YEAR) {
                return Optional.empty();
            }
            if (value > 31) {
                over31++;
            }
            if (value > 12) {
                over12++;
            }
            if (value <= 0) {
                under1++;
            }
        }
        if (over31 >= 2 || over12 == 3 || under1 >= 2) {
            return Optional.empty();
        }

        // year last or year first
        final int[][] yearSplits = {{third, first, second}, {first, second, third}};
        for (final int[] split : yearSplits) {
            if (split[0] >= MIN_YEAR && split[0] <= MAX_YEAR) {
                return toDayMonth(split[1], split[2])
                        .map(dayMonth -> new DayMonthYear(dayMonth[0], dayMonth[1], split[0]));
            }
        }
        for (final int[] split : yearSplits) {
            final Optional<int[]> dayMonth = toDayMonth(split[1], split[2]);
            if (dayMonth.isPresent()) {
                return Optional.of(new DayMonthYear(dayMonth.get()[0], dayMonth.get()[1], toFourDigitYear(split[0])));
            }
        }
        return Optional.empty();
    }

    // {day, month}
    private static Optional<int[]> toDayMonth(final int first, final int second) {
        if (first >= 1 && first <= 31 && second >= 1 && second <= 12) {
            return Optional.of(new int[]{first, second});
        }
        if (second >= 1 && second <= 31 && first >= 1 && first <= 12) {
            return Optional.of(new int[]{second, first});
        }
        return Optional.empty();
    }

    static int toFourDigitYear(final int year) {
        if (year > 99) {
            return year;
        }
        return year > 50 ? year + 1900 : year + 2000;
    }

    record DayMonthYear(int day, int month, int year) {

        int distance() {
            return abs(year - GuessEstimators.REFERENCE_YEAR);
        }
    }
}
