package vocab;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import vocab.Vocabulary.Validity;

class VocabularyTest {

	private static final Vocabulary DIATONIC = Vocabulary.diatonic();

	@Test
	void testSizes() {
		assertEquals(432, DIATONIC.numChords());
		assertEquals(24, DIATONIC.numKeys());
		assertEquals(120, Vocabulary.withoutInversions(Validity.ALL).numChords());
		assertEquals(new HashSet<Chord>(DIATONIC.getChords()).size(), DIATONIC.numChords());
	}

	@Test
	void testDiatonicValidity() {
		Key cMajor = Key.parse("C:MAJOR");
		Key aMinor = Key.parse("A:MINOR");
		assertTrue(DIATONIC.isValid(cMajor, Chord.parse("C:M, inv:0")));
		assertTrue(DIATONIC.isValid(cMajor, Chord.parse("G:Mm7, inv:3")));
		assertTrue(DIATONIC.isValid(cMajor, Chord.parse("B:%7")));
		assertFalse(DIATONIC.isValid(cMajor, Chord.parse("C#:M")));
		assertFalse(DIATONIC.isValid(cMajor, Chord.parse("D:M")));
		// minor admits the raised sixth and seventh degrees
		assertTrue(DIATONIC.isValid(aMinor, Chord.parse("E:M")));
		assertTrue(DIATONIC.isValid(aMinor, Chord.parse("G#:o7")));
		assertTrue(DIATONIC.isValid(aMinor, Chord.parse("C:M")));
		assertFalse(DIATONIC.isValid(aMinor, Chord.parse("Eb:M")));

		Vocabulary all = new Vocabulary(Validity.ALL);
		assertTrue(all.isValid(cMajor, Chord.parse("C#:M")));
		assertEquals(all.numChords(), all.getValidChords(cMajor).size());
	}

	@Test
	void testValidChordsInIndexOrder() {
		Key gMajor = Key.parse("G:MAJOR");
		List<Chord> valid = DIATONIC.getValidChords(gMajor);
		assertFalse(valid.isEmpty());
		for (int i=1; i<valid.size(); ++i) {
			assertTrue(DIATONIC.indexOf(valid.get(i-1)) < DIATONIC.indexOf(valid.get(i)));
		}
		for (Chord chord : valid) assertTrue(DIATONIC.isValid(gMajor, chord));
	}

	@Test
	void testLabelsRoundTripThroughText() {
		for (Chord chord : DIATONIC.getChords()) {
			assertEquals(chord, DIATONIC.parseChord(chord.toString()));
		}
		for (Key key : DIATONIC.getKeys()) {
			assertEquals(key, DIATONIC.parseKey(key.toString()));
		}
		assertEquals("Eb:MINOR", new Key(3, KeyMode.MINOR).toString());
		assertEquals("F#:Mm7, inv:2", new Chord(6, ChordType.MAJ_MIN7, 2).toString());
	}

	@Test
	void testEnharmonicParsing() {
		assertEquals(new Key(1, KeyMode.MAJOR), Key.parse("Db:MAJOR"));
		assertEquals(11, PitchClass.parse("Cb"));
		assertEquals(5, PitchClass.parse("E#"));
		assertEquals(new Chord(10, ChordType.MINOR, 0), Chord.parse("A#:m"));
	}

	@Test
	void testInvalidLabels() {
		assertThrows(IllegalArgumentException.class, () -> Key.parse("H:MAJOR"));
		assertThrows(IllegalArgumentException.class, () -> Key.parse("C:DORIAN"));
		assertThrows(IllegalArgumentException.class, () -> Chord.parse("C:M7"));
		assertThrows(IllegalArgumentException.class, () -> Chord.parse("C:M, inv:3"));
		assertThrows(IllegalArgumentException.class, () -> Chord.parse("C:M, inversion 1"));
		assertThrows(IllegalArgumentException.class, () -> Chord.parse("CM"));
		assertThrows(IllegalArgumentException.class, () -> DIATONIC.getChord(432));
		assertThrows(IllegalArgumentException.class, () -> DIATONIC.getKey(-1));

		Vocabulary small = new Vocabulary(Validity.ALL, Arrays.asList(Chord.parse("C:M")), Arrays.asList(Key.parse("C:MAJOR")));
		assertThrows(IllegalArgumentException.class, () -> small.parseChord("G:M"));
		assertThrows(IllegalArgumentException.class, () -> small.isValid(Key.parse("G:MAJOR"), Chord.parse("C:M")));
		assertThrows(IllegalArgumentException.class, () -> new Vocabulary(Validity.ALL, Arrays.asList(Chord.parse("C:M"), Chord.parse("C:M")), Arrays.asList(Key.parse("C:MAJOR"))));
	}

	@Test
	void testChordTones() {
		Chord firstInversion = Chord.parse("C:M, inv:1");
		assertEquals(4, firstInversion.bass());
		assertArrayEquals(new int[] {0, 4, 7}, firstInversion.pitchClasses());
		assertArrayEquals(new int[] {7, 11, 2, 5}, Chord.parse("G:Mm7, inv:0").pitchClasses());
	}

	@Test
	void testRelativeSpelling() {
		Key gMajor = Key.parse("G:MAJOR");
		RelativeChord dominant = DIATONIC.toRelative(gMajor, Chord.parse("D:M"));
		assertEquals(new RelativeChord(7, ChordType.MAJOR, 0), dominant);
		assertEquals(Chord.parse("G:M"), dominant.inKey(Key.parse("C:MAJOR")));
		assertEquals(dominant, DIATONIC.toRelative(Key.parse("C:MAJOR"), Chord.parse("G:M")));
	}

	@Test
	void testKeyChangeAndRelativeKeys() {
		Key cMajor = Key.parse("C:MAJOR");
		Key gMajor = Key.parse("G:MAJOR");
		Key aMinor = Key.parse("A:MINOR");
		assertFalse(DIATONIC.isKeyChange(cMajor, Key.parse("C:MAJOR")));
		assertTrue(DIATONIC.isKeyChange(cMajor, gMajor));
		assertEquals(7, DIATONIC.relativeKeyIndex(cMajor, gMajor));
		assertEquals(DIATONIC.relativeKeyIndex(cMajor, gMajor), DIATONIC.relativeKeyIndex(Key.parse("F:MAJOR"), cMajor));
		assertEquals(12 + 9, DIATONIC.relativeKeyIndex(cMajor, aMinor));
		assertEquals(24, DIATONIC.numRelativeKeys());
	}

}
