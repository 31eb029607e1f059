package decode;

/**
 * A scoring module failed or returned a value that is not a valid
 * (log-)probability.
 */
public class ScoringException extends DecodeException {
	private static final long serialVersionUID = 1L;

	public ScoringException(String message, int frameIndex) {
		super(message, frameIndex);
	}

	public ScoringException(String message, int frameIndex, Throwable cause) {
		super(message, frameIndex, cause);
	}

}
