package nl.nfi.djzxcvbn.estimate.match;

import java.util.List;

// scans a password for one kind of pattern, implementations hold only read-only snapshot references
public interface PasswordMatcher {

    List<? extends Match> match(final String password);
}
