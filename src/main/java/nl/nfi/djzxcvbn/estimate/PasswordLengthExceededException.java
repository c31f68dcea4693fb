package nl.nfi.djzxcvbn.estimate;

// raised before any matching starts, the cost of matching grows quadratically with the password length
public final class PasswordLengthExceededException extends IllegalArgumentException {

    private final int length;
    private final int maxLength;

    public PasswordLengthExceededException(final int length, final int maxLength) {
        super("Password length %d exceeds the maximum of %d".formatted(length, maxLength));
        this.length = length;
        this.maxLength = maxLength;
    }

    public int length() {
        return length;
    }

    public int maxLength() {
        return maxLength;
    }
}
