package vocab;

public final class Chord implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public final int root;
	public final ChordType type;
	public final int inversion;

	public Chord(int root, ChordType type, int inversion) {
		if (root < 0 || root >= PitchClass.N_CHROMA) {
			throw new IllegalArgumentException("Root out of range: "+root);
		}
		if (type == null) {
			throw new IllegalArgumentException("Chord type is null");
		}
		if (inversion < 0 || inversion >= type.numInversions()) {
			throw new IllegalArgumentException("Inversion "+inversion+" invalid for "+type.getSymbol());
		}
		this.root = root;
		this.type = type;
		this.inversion = inversion;
	}

	public int bass() {
		return PitchClass.mod(root + type.getIntervals()[inversion]);
	}

	public int[] pitchClasses() {
		int[] intervals = type.getIntervals();
		int[] pitches = new int[intervals.length];
		for (int i=0; i<intervals.length; ++i) {
			pitches[i] = PitchClass.mod(root + intervals[i]);
		}
		return pitches;
	}

	/**
	 * Parses labels of the form "C:M, inv:0". The inversion part may be omitted.
	 */
	public static Chord parse(String label) {
		String chordPart = label.trim();
		int inversion = 0;
		int comma = chordPart.indexOf(',');
		if (comma >= 0) {
			String inversionPart = chordPart.substring(comma+1).trim();
			if (!inversionPart.startsWith("inv:")) {
				throw new IllegalArgumentException("Invalid chord label: "+label);
			}
			inversion = Integer.parseInt(inversionPart.substring(4).trim());
			chordPart = chordPart.substring(0, comma).trim();
		}
		int colon = chordPart.indexOf(':');
		if (colon < 0) {
			throw new IllegalArgumentException("Invalid chord label: "+label);
		}
		return new Chord(PitchClass.parse(chordPart.substring(0, colon)), ChordType.fromSymbol(chordPart.substring(colon+1)), inversion);
	}

	public boolean equals(Object other) {
		if (other instanceof Chord) {
			Chord that = (Chord) other;
			return this.root == that.root && this.type == that.type && this.inversion == that.inversion;
		}
		return false;
	}

	public int hashCode() {
		return (root * 31 + type.ordinal()) * 31 + inversion;
	}

	public String toString() {
		return PitchClass.name(root)+":"+type.getSymbol()+", inv:"+inversion;
	}

}
