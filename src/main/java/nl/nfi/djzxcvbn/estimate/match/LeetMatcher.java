package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.RankedDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.util.Collections.unmodifiableMap;

// dictionary words disguised by character substitutions, e.g. p4ssw0rd
public final class LeetMatcher implements PasswordMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LeetMatcher.class);

    // every map costs a full dictionary scan, passwords made of many leet characters try only the first ones
    static final int MAX_SUBSTITUTION_MAPS = 256;

    // plain letter -> the characters used in its place
    static final Map<Character, List<Character>> LEET_TABLE = buildLeetTable();

    private final DictionaryMatcher dictionaryMatcher;

    public LeetMatcher(final DictionaryMatcher dictionaryMatcher) {
        this.dictionaryMatcher = dictionaryMatcher;
    }

    @Override
    public List<DictionaryMatch> match(final String password) {
        // a match found through several substitution maps is kept once
        final Set<DictionaryMatch> matches = new LinkedHashSet<>();
        for (final Map<Character, Character> substitutions : substitutionsToTry(password)) {
            final String translated = translate(password, substitutions);
            for (final DictionaryMatch match : dictionaryMatcher.match(translated)) {
                final String token = password.substring(match.i(), match.j() + 1);
                // plain words are already found by the dictionary matcher
                if (RankedDictionary.lowerCase(token).equals(match.matchedWord())) {
                    continue;
                }
                if (token.length() <= 1) {
                    continue;
                }

                final Map<Character, Character> used = new TreeMap<>();
                for (final Map.Entry<Character, Character> substitution : substitutions.entrySet()) {
                    if (token.indexOf(substitution.getKey()) >= 0) {
                        used.put(substitution.getKey(), substitution.getValue());
                    }
                }
                matches.add(DictionaryMatch.of(
                        match.i(), match.j(), token, match.matchedWord(), match.rank(), match.dictionaryName(), false, used, password.length()
                ));
            }
        }

        final List<DictionaryMatch> sorted = new ArrayList<>(matches);
        sorted.sort(Match.BY_SPAN);
        return sorted;
    }

    static List<Map<Character, Character>> substitutionsToTry(final String password) {
        final Map<Character, List<Character>> relevant = relevantSubtable(password);
        if (relevant.isEmpty()) {
            return List.of();
        }
        final List<Map<Character, Character>> substitutions = new ArrayList<>();
        for (final Map<Character, Character> substitution : enumerateSubstitutions(relevant)) {
            if (!substitution.isEmpty()) {
                substitutions.add(substitution);
            }
        }
        if (substitutions.size() > MAX_SUBSTITUTION_MAPS) {
            LOG.debug("Trying {} of {} leet substitution maps", MAX_SUBSTITUTION_MAPS, substitutions.size());
            return substitutions.subList(0, MAX_SUBSTITUTION_MAPS);
        }
        return substitutions;
    }

    // only the substitutions whose leet characters occur in the password
    static Map<Character, List<Character>> relevantSubtable(final String password) {
        final Map<Character, List<Character>> subtable = new LinkedHashMap<>();
        for (final Map.Entry<Character, List<Character>> entry : LEET_TABLE.entrySet()) {
            final List<Character> present = new ArrayList<>();
            for (final char substitute : entry.getValue()) {
                if (password.indexOf(substitute) >= 0) {
                    present.add(substitute);
                }
            }
            if (!present.isEmpty()) {
                subtable.put(entry.getKey(), present);
            }
        }
        return subtable;
    }

    // every consistent leet char -> letter map, where one leet char stands for at most one letter
    static List<Map<Character, Character>> enumerateSubstitutions(final Map<Character, List<Character>> subtable) {
        List<Map<Character, Character>> substitutions = new ArrayList<>();
        substitutions.add(Map.of());

        for (final Map.Entry<Character, List<Character>> entry : subtable.entrySet()) {
            final char letter = entry.getKey();
            final Set<Map<Character, Character>> next = new LinkedHashSet<>();
            for (final Map<Character, Character> substitution : substitutions) {
                for (final char leet : entry.getValue()) {
                    if (substitution.containsKey(leet)) {
                        // leet char already taken by another letter, keep both alternatives
                        next.add(substitution);
                        final Map<Character, Character> alternative = new HashMap<>(substitution);
                        alternative.put(leet, letter);
                        next.add(unmodifiableMap(alternative));
                    } else {
                        final Map<Character, Character> extended = new HashMap<>(substitution);
                        extended.put(leet, letter);
                        next.add(unmodifiableMap(extended));
                    }
                }
            }
            substitutions = new ArrayList<>(next);
        }
        return substitutions;
    }

    private static String translate(final String password, final Map<Character, Character> substitutions) {
        final StringBuilder translated = new StringBuilder(password.length());
        for (int i = 0; i < password.length(); i++) {
            final char c = password.charAt(i);
            translated.append(substitutions.getOrDefault(c, c));
        }
        return translated.toString();
    }

    private static Map<Character, List<Character>> buildLeetTable() {
        final Map<Character, List<Character>> table = new LinkedHashMap<>();
        table.put('a', List.of('4', '@'));
        table.put('b', List.of('8'));
        table.put('c', List.of('(', '{', '[', '<'));
        table.put('e', List.of('3'));
        table.put('g', List.of('6', '9'));
        table.put('i', List.of('1', '!', '|'));
        table.put('l', List.of('1', '|', '7'));
        table.put('o', List.of('0'));
        table.put('s', List.of('$', '5'));
        table.put('t', List.of('+', '7'));
        table.put('x', List.of('%'));
        table.put('z', List.of('2'));
        return unmodifiableMap(table);
    }
}
