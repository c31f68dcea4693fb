package nl.nfi.djzxcvbn.data;

import nl.nfi.djzxcvbn.common.ini.IniConfig;
import nl.nfi.djzxcvbn.common.ini.IniSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.exists;
import static java.nio.file.Files.readAllLines;
import static java.util.Collections.unmodifiableMap;

// immutable snapshot of every ranked dictionary the matchers probe, shared by concurrent evaluations
public final class Dictionaries {

    private static final Logger LOG = LoggerFactory.getLogger(Dictionaries.class);

    public static final String USER_INPUTS = "user_inputs";

    static final String DEFAULT_RESOURCE_DIRECTORY = "/frequency_lists/";
    public static final String CONFIG_FILE_NAME = "config.ini";
    static final String DICTIONARIES_SECTION = "DICTIONARIES";

    private final Map<String, RankedDictionary> dictionaries;

    private Dictionaries(final Map<String, RankedDictionary> dictionaries) {
        this.dictionaries = dictionaries;
    }

    public static Dictionaries of(final RankedDictionary... dictionaries) {
        return of(List.of(dictionaries));
    }

    public static Dictionaries of(final Collection<RankedDictionary> dictionaries) {
        final Map<String, RankedDictionary> byName = new LinkedHashMap<>();
        for (final RankedDictionary dictionary : dictionaries) {
            if (byName.put(dictionary.name(), dictionary) != null) {
                throw new IllegalArgumentException("Duplicate dictionary name: %s".formatted(dictionary.name()));
            }
        }
        return new Dictionaries(unmodifiableMap(byName));
    }

    public static Dictionaries empty() {
        return new Dictionaries(Map.of());
    }

    // frequency lists bundled on the classpath
    public static Dictionaries loadDefault() throws IOException {
        final IniConfig config;
        try (final InputStream input = openResource(DEFAULT_RESOURCE_DIRECTORY + CONFIG_FILE_NAME)) {
            config = IniConfig.loadFrom(input);
        }

        final List<RankedDictionary> dictionaries = new ArrayList<>();
        for (final String fileName : config.getSection(DICTIONARIES_SECTION).getList("filenames")) {
            try (final InputStream input = openResource(DEFAULT_RESOURCE_DIRECTORY + fileName)) {
                dictionaries.add(RankedDictionary.fromWords(dictionaryName(fileName), readWords(input)));
            }
        }

        final Dictionaries loaded = of(dictionaries);
        LOG.info("Loaded {} default dictionaries with {} words in total", dictionaries.size(), loaded.wordCount());
        return loaded;
    }

    // a directory holding a config.ini which lists the frequency list files in rank order, one word per line
    public static Dictionaries loadFrom(final Path basePath) throws IOException {
        if (!exists(basePath)) {
            throw new IllegalArgumentException("Dictionary path does not exist: %s".formatted(basePath));
        }

        final IniConfig config = IniConfig.loadFrom(basePath.resolve(CONFIG_FILE_NAME));
        final IniSection section = config.getSection(DICTIONARIES_SECTION);
        final Path directory = basePath.resolve(section.getString("directory", "."));

        final List<RankedDictionary> dictionaries = new ArrayList<>();
        for (final String fileName : section.getList("filenames")) {
            final Path filePath = directory.resolve(fileName);
            if (!exists(filePath)) {
                throw new IllegalArgumentException("Frequency list does not exist: %s".formatted(filePath));
            }
            dictionaries.add(RankedDictionary.fromWords(dictionaryName(fileName), readAllLines(filePath, UTF_8)));
        }

        final Dictionaries loaded = of(dictionaries);
        LOG.info("Loaded {} dictionaries with {} words in total from {}", dictionaries.size(), loaded.wordCount(), basePath);
        return loaded;
    }

    // copy-on-write: this snapshot is left untouched, the caller publishes the returned one
    public Dictionaries withUserInputs(final Collection<?> userInputs) {
        final List<String> sanitized = new ArrayList<>();
        for (final Object userInput : userInputs) {
            // non-textual inputs are coerced, never rejected, lower-casing happens like for any other word list
            sanitized.add(String.valueOf(userInput));
        }

        final Map<String, RankedDictionary> copy = new LinkedHashMap<>(dictionaries);
        copy.remove(USER_INPUTS);
        if (!sanitized.isEmpty()) {
            copy.put(USER_INPUTS, RankedDictionary.fromWords(USER_INPUTS, sanitized));
        }
        return new Dictionaries(unmodifiableMap(copy));
    }

    public Collection<RankedDictionary> all() {
        return dictionaries.values();
    }

    public Optional<RankedDictionary> get(final String name) {
        return Optional.ofNullable(dictionaries.get(name));
    }

    public int size() {
        return dictionaries.size();
    }

    public long wordCount() {
        return dictionaries.values().stream()
                .mapToLong(RankedDictionary::size)
                .sum();
    }

    private static String dictionaryName(final String fileName) {
        final int extension = fileName.lastIndexOf('.');
        return extension < 0 ? fileName : fileName.substring(0, extension);
    }

    private static List<String> readWords(final InputStream input) throws IOException {
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8))) {
            return reader.lines().toList();
        }
    }

    private static InputStream openResource(final String name) {
        final InputStream input = Dictionaries.class.getResourceAsStream(name);
        if (input == null) {
            throw new IllegalStateException("Missing bundled dictionary resource: %s".formatted(name));
        }
        return input;
    }
}
