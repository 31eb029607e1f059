package decode;

/**
 * The search ran out of hypotheses: no valid expansion or an empty beam.
 */
public class SearchFailureException extends DecodeException {
	private static final long serialVersionUID = 1L;

	public SearchFailureException(String message, int frameIndex) {
		super(message, frameIndex);
	}

}
