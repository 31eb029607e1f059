package vocab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed chord and key label sets, the "chord is valid within key"
 * relation, and key-relative spelling. Immutable once built, so one
 * instance may be shared by concurrent decodes.
 */
public class Vocabulary implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public static enum Validity {DIATONIC, ALL}

	private final Validity validity;
	private final List<Chord> chords;
	private final List<Key> keys;
	private final Map<Chord,Integer> chordIndices;
	private final Map<Key,Integer> keyIndices;
	private final List<List<Chord>> validChords;
	private final boolean[][] valid;

	public Vocabulary(Validity validity) {
		this(validity, allChords(true), allKeys());
	}

	/**
	 * A vocabulary over the given labels only, e.g. a reduced chord set. Label
	 * order defines the label indices.
	 */
	public Vocabulary(Validity validity, List<Chord> chords, List<Key> keys) {
		if (chords.isEmpty() || keys.isEmpty()) {
			throw new IllegalArgumentException("Vocabulary needs at least one chord and one key");
		}
		this.validity = validity;
		this.chords = Collections.unmodifiableList(new ArrayList<Chord>(chords));
		this.keys = Collections.unmodifiableList(new ArrayList<Key>(keys));
		this.chordIndices = new HashMap<Chord,Integer>();
		for (int i=0; i<chords.size(); ++i) {
			if (chordIndices.put(chords.get(i), i) != null) throw new IllegalArgumentException("Duplicate chord "+chords.get(i));
		}
		this.keyIndices = new HashMap<Key,Integer>();
		for (int i=0; i<keys.size(); ++i) {
			if (keyIndices.put(keys.get(i), i) != null) throw new IllegalArgumentException("Duplicate key "+keys.get(i));
		}

		this.validChords = new ArrayList<List<Chord>>();
		this.valid = new boolean[keys.size()][chords.size()];
		for (int k=0; k<keys.size(); ++k) {
			List<Chord> validInKey = new ArrayList<Chord>();
			for (int c=0; c<chords.size(); ++c) {
				valid[k][c] = computeValid(keys.get(k), chords.get(c));
				if (valid[k][c]) validInKey.add(chords.get(c));
			}
			validChords.add(Collections.unmodifiableList(validInKey));
		}
	}

	public static List<Chord> allChords(boolean useInversions) {
		List<Chord> chords = new ArrayList<Chord>();
		for (int root=0; root<PitchClass.N_CHROMA; ++root) {
			for (ChordType type : ChordType.values()) {
				int numInversions = (useInversions ? type.numInversions() : 1);
				for (int inversion=0; inversion<numInversions; ++inversion) {
					chords.add(new Chord(root, type, inversion));
				}
			}
		}
		return chords;
	}

	public static List<Key> allKeys() {
		List<Key> keys = new ArrayList<Key>();
		for (KeyMode mode : KeyMode.values()) {
			for (int tonic=0; tonic<PitchClass.N_CHROMA; ++tonic) {
				keys.add(new Key(tonic, mode));
			}
		}
		return keys;
	}

	public static Vocabulary diatonic() {
		return new Vocabulary(Validity.DIATONIC);
	}

	public static Vocabulary withoutInversions(Validity validity) {
		return new Vocabulary(validity, allChords(false), allKeys());
	}

	public Validity getValidity() {
		return validity;
	}

	public int numChords() {
		return chords.size();
	}

	public int numKeys() {
		return keys.size();
	}

	public List<Chord> getChords() {
		return chords;
	}

	public List<Key> getKeys() {
		return keys;
	}

	public Chord getChord(int index) {
		if (index < 0 || index >= chords.size()) {
			throw new IllegalArgumentException("Chord index out of range: "+index);
		}
		return chords.get(index);
	}

	public Key getKey(int index) {
		if (index < 0 || index >= keys.size()) {
			throw new IllegalArgumentException("Key index out of range: "+index);
		}
		return keys.get(index);
	}

	public int indexOf(Chord chord) {
		Integer index = chordIndices.get(chord);
		if (index == null) {
			throw new IllegalArgumentException("Chord not in vocabulary: "+chord);
		}
		return index;
	}

	public int indexOf(Key key) {
		Integer index = keyIndices.get(key);
		if (index == null) {
			throw new IllegalArgumentException("Key not in vocabulary: "+key);
		}
		return index;
	}

	public boolean isValid(Key key, Chord chord) {
		return valid[indexOf(key)][indexOf(chord)];
	}

	/**
	 * Chords valid within the key, in ascending vocabulary index order.
	 */
	public List<Chord> getValidChords(Key key) {
		return validChords.get(indexOf(key));
	}

	public boolean isKeyChange(Key previous, Key next) {
		indexOf(previous);
		indexOf(next);
		return !previous.equals(next);
	}

	public RelativeChord toRelative(Key key, Chord chord) {
		indexOf(key);
		indexOf(chord);
		return new RelativeChord(PitchClass.interval(key.tonic, chord.root), chord.type, chord.inversion);
	}

	public List<RelativeChord> toRelative(Key key, List<Chord> chords) {
		List<RelativeChord> relative = new ArrayList<RelativeChord>(chords.size());
		for (Chord chord : chords) relative.add(toRelative(key, chord));
		return relative;
	}

	/**
	 * Index of the next key relative to the previous one: the tonic interval
	 * within one mode block, so relative transitions can be tabulated
	 * independently of the absolute tonic.
	 */
	public int relativeKeyIndex(Key previous, Key next) {
		return next.mode.ordinal() * PitchClass.N_CHROMA + PitchClass.interval(previous.tonic, next.tonic);
	}

	public int numRelativeKeys() {
		return KeyMode.values().length * PitchClass.N_CHROMA;
	}

	public Chord parseChord(String label) {
		Chord chord = Chord.parse(label);
		indexOf(chord);
		return chord;
	}

	public Key parseKey(String label) {
		Key key = Key.parse(label);
		indexOf(key);
		return key;
	}

	private boolean computeValid(Key key, Chord chord) {
		if (validity == Validity.ALL) return true;
		for (int pitch : chord.pitchClasses()) {
			if (!key.mode.containsInterval(PitchClass.interval(key.tonic, pitch))) return false;
		}
		return true;
	}

}
