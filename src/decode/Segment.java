package decode;

import vocab.Chord;
import vocab.Key;

/**
 * A run of frames [start, end) labeled with one key and one chord.
 */
public final class Segment implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public final int start;
	public final int end;
	public final Key key;
	public final Chord chord;

	public Segment(int start, int end, Key key, Chord chord) {
		if (start < 0 || end <= start) {
			throw new IllegalArgumentException("Invalid segment span ["+start+", "+end+")");
		}
		this.start = start;
		this.end = end;
		this.key = key;
		this.chord = chord;
	}

	public int length() {
		return end - start;
	}

	public boolean equals(Object other) {
		if (other instanceof Segment) {
			Segment that = (Segment) other;
			return this.start == that.start && this.end == that.end && this.key.equals(that.key) && this.chord.equals(that.chord);
		}
		return false;
	}

	public int hashCode() {
		return ((start * 31 + end) * 31 + key.hashCode()) * 31 + chord.hashCode();
	}

	public String toString() {
		return "[" + start + ", " + end + ") " + key + " " + chord;
	}

}
