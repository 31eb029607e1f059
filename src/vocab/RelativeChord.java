package vocab;

/**
 * A chord spelled relative to the tonic of a key. This is the form in
 * which chord histories are handed to chord sequence models.
 */
public final class RelativeChord implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public final int rootInterval;
	public final ChordType type;
	public final int inversion;

	public RelativeChord(int rootInterval, ChordType type, int inversion) {
		this.rootInterval = PitchClass.mod(rootInterval);
		this.type = type;
		this.inversion = inversion;
	}

	public Chord inKey(Key key) {
		return new Chord(PitchClass.mod(key.tonic + rootInterval), type, inversion);
	}

	public boolean equals(Object other) {
		if (other instanceof RelativeChord) {
			RelativeChord that = (RelativeChord) other;
			return this.rootInterval == that.rootInterval && this.type == that.type && this.inversion == that.inversion;
		}
		return false;
	}

	public int hashCode() {
		return (rootInterval * 31 + type.ordinal()) * 31 + inversion;
	}

	public String toString() {
		return "+"+rootInterval+":"+type.getSymbol()+", inv:"+inversion;
	}

}
