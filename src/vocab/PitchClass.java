package vocab;

public class PitchClass {

	public static final int N_CHROMA = 12;

	public static final String[] NAMES = {"C", "C#", "D", "Eb", "E", "F", "F#", "G", "Ab", "A", "Bb", "B"};

	private static final int[] LETTER_PITCHES = {9, 11, 0, 2, 4, 5, 7}; // A..G

	public static String name(int pitchClass) {
		return NAMES[mod(pitchClass)];
	}

	public static int mod(int pitch) {
		return ((pitch % N_CHROMA) + N_CHROMA) % N_CHROMA;
	}

	public static int interval(int from, int to) {
		return mod(to - from);
	}

	/**
	 * Parses a pitch name made of a letter A-G followed by any number of
	 * '#' or 'b' accidentals, e.g. "F#", "Bb", "Cb".
	 */
	public static int parse(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Empty pitch name");
		}
		char letter = Character.toUpperCase(name.charAt(0));
		if (letter < 'A' || letter > 'G') {
			throw new IllegalArgumentException("Invalid pitch name: "+name);
		}
		int pitch = LETTER_PITCHES[letter - 'A'];
		for (int i=1; i<name.length(); ++i) {
			char c = name.charAt(i);
			if (c == '#') {
				pitch++;
			} else if (c == 'b') {
				pitch--;
			} else {
				throw new IllegalArgumentException("Invalid pitch name: "+name);
			}
		}
		return mod(pitch);
	}

}
