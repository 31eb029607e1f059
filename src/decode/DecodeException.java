package decode;

/**
 * A decode of one piece failed. Carries the frame index at which the
 * failure happened, or -1 when it is not tied to a frame.
 */
public class DecodeException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final int frameIndex;

	public DecodeException(String message, int frameIndex) {
		super(frameIndex < 0 ? message : message+" (frame "+frameIndex+")");
		this.frameIndex = frameIndex;
	}

	public DecodeException(String message, int frameIndex, Throwable cause) {
		super(frameIndex < 0 ? message : message+" (frame "+frameIndex+")", cause);
		this.frameIndex = frameIndex;
	}

	public int getFrameIndex() {
		return frameIndex;
	}

}
