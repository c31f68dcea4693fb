package nl.nfi.djzxcvbn.estimate;

import nl.nfi.djzxcvbn.common.logger.LoggerConfigurator;
import nl.nfi.djzxcvbn.estimate.feedback.FeedbackText;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djzxcvbn.common.Formatting.toHumanReadableDuration;
import static nl.nfi.djzxcvbn.common.Formatting.toHumanReadableGuesses;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "zxcvbn", description = "Estimates the strength of passwords")
public class StrengthEstimatorCli implements Callable<Integer> {

    @Option(names = {"--password"}, description = "The password to evaluate, when absent passwords are read from stdin, one per line")
    private String password;

    @Option(names = {"--user_input"}, description = "Word related to the user, e.g. name or email, can be repeated")
    private List<String> userInputs = new ArrayList<>();

    @Option(names = {"--max_length"}, description = "Reject passwords longer than this (default: 72)")
    private Integer maxLength;

    @Option(names = {"--language"}, description = "Language of the feedback, e.g. en or zh_CN (default: en)")
    private String language;

    @Option(names = {"--dictionary_path"}, description = "Directory with a config.ini listing the frequency lists to use instead of the bundled ones")
    private String dictionaryPath;

    @Option(names = {"--json"}, description = "Print the full result as JSON")
    private boolean json = false;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }

        try {
            StrengthEstimator estimator = dictionaryPath != null
                ? StrengthEstimator.forDictionaryPath(Paths.get(dictionaryPath))
                : StrengthEstimator.withDefaults();
            if (maxLength != null) {
                estimator = estimator.maxLength(maxLength);
            }
            if (language != null) {
                estimator = estimator.language(language);
            }
            if (!userInputs.isEmpty()) {
                estimator = estimator.userInputs(userInputs);
            }

            if (password != null) {
                print(estimator, estimator.evaluate(password), System.out);
                return ExitCode.OK;
            }
            // a rejected line is reported and skipped, the remaining lines are still evaluated
            boolean rejected = false;
            try (final BufferedReader input = new BufferedReader(new InputStreamReader(System.in, UTF_8))) {
                String line;
                while ((line = input.readLine()) != null) {
                    try {
                        print(estimator, estimator.evaluate(line), System.out);
                    }
                    catch (final PasswordLengthExceededException e) {
                        System.err.println(e.getMessage());
                        rejected = true;
                    }
                }
            }
            if (rejected) {
                return ExitCode.USAGE;
            }
        }
        catch (final PasswordLengthExceededException e) {
            System.err.println(e.getMessage());
            return ExitCode.USAGE;
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(StrengthEstimatorCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private void print(final StrengthEstimator estimator, final EvaluationResult result, final PrintStream output) {
        if (json) {
            output.println(EvaluationResultJson.toJson(result, estimator.translator()));
            return;
        }

        output.println("score: " + result.score());
        output.println("guesses: " + toHumanReadableGuesses(result.guesses()));
        output.printf(Locale.ROOT, "guesses_log10: %.2f%n", result.guessesLog10());
        for (final Map.Entry<String, String> crackTime : estimator.crackTimesText(result).entrySet()) {
            output.println(crackTime.getKey() + ": " + crackTime.getValue());
        }
        final FeedbackText feedback = estimator.feedbackText(result);
        if (!feedback.warning().isEmpty()) {
            output.println("warning: " + feedback.warning());
        }
        for (final String suggestion : feedback.suggestions()) {
            output.println("suggestion: " + suggestion);
        }
        output.println("calc_time: " + toHumanReadableDuration(result.calcTime()));
        output.println();
    }
}
