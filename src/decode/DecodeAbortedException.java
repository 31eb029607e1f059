package decode;

public class DecodeAbortedException extends DecodeException {
	private static final long serialVersionUID = 1L;

	public DecodeAbortedException(String message, int frameIndex) {
		super(message, frameIndex);
	}

}
