package vocab;

public final class Key implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public final int tonic;
	public final KeyMode mode;

	public Key(int tonic, KeyMode mode) {
		if (tonic < 0 || tonic >= PitchClass.N_CHROMA) {
			throw new IllegalArgumentException("Tonic out of range: "+tonic);
		}
		if (mode == null) {
			throw new IllegalArgumentException("Key mode is null");
		}
		this.tonic = tonic;
		this.mode = mode;
	}

	public static Key parse(String label) {
		String[] split = label.trim().split(":");
		if (split.length != 2) {
			throw new IllegalArgumentException("Invalid key label: "+label);
		}
		try {
			return new Key(PitchClass.parse(split[0]), KeyMode.valueOf(split[1]));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid key label: "+label, e);
		}
	}

	public boolean equals(Object other) {
		if (other instanceof Key) {
			Key that = (Key) other;
			return this.tonic == that.tonic && this.mode == that.mode;
		}
		return false;
	}

	public int hashCode() {
		return tonic * 31 + mode.ordinal();
	}

	public String toString() {
		return PitchClass.name(tonic)+":"+mode.name();
	}

}
