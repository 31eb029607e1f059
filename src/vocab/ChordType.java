package vocab;

public enum ChordType {
	MAJOR("M", 4, 7),
	MINOR("m", 3, 7),
	DIMINISHED("o", 3, 6),
	AUGMENTED("+", 4, 8),
	MAJ_MAJ7("MM7", 4, 7, 11),
	MAJ_MIN7("Mm7", 4, 7, 10),
	MIN_MIN7("mm7", 3, 7, 10),
	MIN_MAJ7("mM7", 3, 7, 11),
	HALF_DIM7("%7", 3, 6, 10),
	DIM7("o7", 3, 6, 9);

	private final String symbol;
	private final int[] intervals;

	private ChordType(String symbol, int... intervalsAboveRoot) {
		this.symbol = symbol;
		this.intervals = new int[intervalsAboveRoot.length + 1];
		System.arraycopy(intervalsAboveRoot, 0, intervals, 1, intervalsAboveRoot.length);
	}

	public String getSymbol() {
		return symbol;
	}

	public int numInversions() {
		return intervals.length;
	}

	/**
	 * Intervals of each chord tone above the root, root first.
	 */
	public int[] getIntervals() {
		return intervals.clone();
	}

	public static ChordType fromSymbol(String symbol) {
		for (ChordType type : values()) {
			if (type.symbol.equals(symbol)) return type;
		}
		throw new IllegalArgumentException("Unknown chord type: "+symbol);
	}

}
