package decode;

import vocab.Key;

public final class KeySegment implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public final int start;
	public final int end;
	public final Key key;

	public KeySegment(int start, int end, Key key) {
		if (start < 0 || end <= start) {
			throw new IllegalArgumentException("Invalid key segment span ["+start+", "+end+")");
		}
		this.start = start;
		this.end = end;
		this.key = key;
	}

	public boolean contains(Segment segment) {
		return start <= segment.start && segment.end <= end;
	}

	public boolean equals(Object other) {
		if (other instanceof KeySegment) {
			KeySegment that = (KeySegment) other;
			return this.start == that.start && this.end == that.end && this.key.equals(that.key);
		}
		return false;
	}

	public int hashCode() {
		return (start * 31 + end) * 31 + key.hashCode();
	}

	public String toString() {
		return "[" + start + ", " + end + ") " + key;
	}

}
