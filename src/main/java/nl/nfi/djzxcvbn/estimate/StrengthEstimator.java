package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.common.ini.IniConfig;
import nl.nfi.djzxcvbn.common.ini.IniSection;
import nl.nfi.djzxcvbn.data.AdjacencyGraphs;
import nl.nfi.djzxcvbn.data.Dictionaries;
import nl.nfi.djzxcvbn.estimate.feedback.FeedbackText;
import nl.nfi.djzxcvbn.estimate.feedback.LocaleTranslator;
import nl.nfi.djzxcvbn.estimate.feedback.Translator;
import nl.nfi.djzxcvbn.estimate.match.MatcherSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

import static nl.nfi.djzxcvbn.common.Formatting.toHumanReadableDuration;
import static nl.nfi.djzxcvbn.common.Formatting.toHumanReadableGuesses;

// immutable, every option returns a new estimator sharing the same read-only snapshot
public final class StrengthEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(StrengthEstimator.class);

    public static final int DEFAULT_MAX_LENGTH = 72;

    static final String ESTIMATOR_SECTION = "ESTIMATOR";

    private final Dictionaries dictionaries;
    private final AdjacencyGraphs graphs;
    private final MatcherSuite matchers;
    private final int maxLength;
    private final Translator translator;

    private StrengthEstimator(final Dictionaries dictionaries, final AdjacencyGraphs graphs) {
        this(dictionaries, graphs, DEFAULT_MAX_LENGTH, LocaleTranslator.defaultLanguage());
    }

    private StrengthEstimator(final Dictionaries dictionaries, final AdjacencyGraphs graphs, final int maxLength, final Translator translator) {
        this.dictionaries = dictionaries;
        this.graphs = graphs;
        this.matchers = MatcherSuite.forSnapshot(dictionaries, graphs);
        this.maxLength = maxLength;
        this.translator = translator;
    }

    // bundled frequency lists, loaded once per process
    public static StrengthEstimator withDefaults() {
        return forDictionaries(DefaultDictionaries.INSTANCE);
    }

    // the directory's config.ini may also carry an [ESTIMATOR] section with max_length and language
    public static StrengthEstimator forDictionaryPath(final Path basePath) throws IOException {
        final StrengthEstimator estimator = forDictionaries(Dictionaries.loadFrom(basePath));
        final IniConfig config = IniConfig.loadFrom(basePath.resolve(Dictionaries.CONFIG_FILE_NAME));
        if (!config.hasSection(ESTIMATOR_SECTION)) {
            return estimator;
        }
        final IniSection section = config.getSection(ESTIMATOR_SECTION);
        return estimator
                .maxLength(section.getInt("max_length", DEFAULT_MAX_LENGTH))
                .language(section.getString("language", LocaleTranslator.DEFAULT_LANGUAGE));
    }

    public static StrengthEstimator forDictionaries(final Dictionaries dictionaries) {
        return new StrengthEstimator(dictionaries, AdjacencyGraphs.standard());
    }

    public StrengthEstimator maxLength(final int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("Maximum password length must not be negative: %d".formatted(maxLength));
        }
        return new StrengthEstimator(dictionaries, graphs, maxLength, translator);
    }

    public StrengthEstimator translator(final Translator translator) {
        return new StrengthEstimator(dictionaries, graphs, maxLength, translator);
    }

    public StrengthEstimator language(final String languageTag) {
        return translator(LocaleTranslator.forLanguage(languageTag));
    }

    // replaces earlier user inputs, non-textual inputs are used as their string form
    public StrengthEstimator userInputs(final Collection<?> userInputs) {
        return new StrengthEstimator(dictionaries.withUserInputs(userInputs), graphs, maxLength, translator);
    }

    public Dictionaries dictionaries() {
        return dictionaries;
    }

    public int maxLength() {
        return maxLength;
    }

    public Translator translator() {
        return translator;
    }

    public EvaluationResult evaluate(final String password) {
        checkLength(password);
        return evaluate(password, matchers);
    }

    // user inputs for this call only, this estimator is left untouched
    public EvaluationResult evaluate(final String password, final Collection<?> userInputs) {
        checkLength(password);
        if (userInputs.isEmpty()) {
            return evaluate(password, matchers);
        }
        return evaluate(password, MatcherSuite.forSnapshot(dictionaries.withUserInputs(userInputs), graphs));
    }

    public FeedbackText feedbackText(final EvaluationResult result) {
        return result.feedbackText(translator);
    }

    public Map<String, String> crackTimesText(final EvaluationResult result) {
        return result.crackTimes().render(translator);
    }

    private void checkLength(final String password) {
        if (password.length() > maxLength) {
            throw new PasswordLengthExceededException(password.length(), maxLength);
        }
    }

    private static EvaluationResult evaluate(final String password, final MatcherSuite matchers) {
        final EvaluationResult result = Evaluator.evaluate(password, matchers);
        LOG.debug("Evaluated password of length {}: {} guesses, score {}, took {}",
                password.length(), toHumanReadableGuesses(result.guesses()), result.score(), toHumanReadableDuration(result.calcTime()));
        return result;
    }

    private static final class DefaultDictionaries {

        static final Dictionaries INSTANCE = load();

        private static Dictionaries load() {
            try {
                return Dictionaries.loadDefault();
            }
            catch (final IOException e) {
                throw new UncheckedIOException("Failed to load the bundled frequency lists", e);
            }
        }
    }
}
