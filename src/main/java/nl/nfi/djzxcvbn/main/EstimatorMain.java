package nl.nfi.djzxcvbn.main;

import nl.nfi.djzxcvbn.estimate.StrengthEstimatorCli;
import picocli.CommandLine;

public final class EstimatorMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new StrengthEstimatorCli()).execute(args);
        System.exit(exitCode);
    }
}
