package vocab;

public enum KeyMode {
	MAJOR(new int[] {0, 2, 4, 5, 7, 9, 11}),
	// natural, harmonic and melodic minor together
	MINOR(new int[] {0, 2, 3, 5, 7, 8, 9, 10, 11});

	private final boolean[] scale;

	private KeyMode(int[] degrees) {
		this.scale = new boolean[PitchClass.N_CHROMA];
		for (int degree : degrees) {
			scale[degree] = true;
		}
	}

	public boolean containsInterval(int intervalAboveTonic) {
		return scale[PitchClass.mod(intervalAboveTonic)];
	}

}
