package eval;

import static org.junit.jupiter.api.Assertions.*;

import io.PieceIO.Frame;
import io.PieceIO.Piece;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import decode.Segment;
import eval.Evaluation.ChordMatch;
import eval.Evaluation.EvalSuffStats;
import vocab.Chord;
import vocab.Key;

class EvaluationTest {

	private static final Key C_MAJOR = Key.parse("C:MAJOR");
	private static final Key G_MAJOR = Key.parse("G:MAJOR");

	/**
	 * Four frames with durations 1, 2, 1 and a trailing grace frame.
	 */
	private static Piece piece() {
		double[] durations = {1.0, 2.0, 1.0, 0.0};
		List<Frame> frames = new ArrayList<Frame>();
		double onset = 0.0;
		for (int i=0; i<durations.length; ++i) {
			frames.add(new Frame(i, onset, durations[i], new float[12]));
			onset += durations[i];
		}
		return new Piece("eval", frames);
	}

	private static List<Segment> gold() {
		return Arrays.asList(new Segment(0, 2, C_MAJOR, Chord.parse("C:M")), new Segment(2, 4, C_MAJOR, Chord.parse("G:M")));
	}

	@Test
	void testDurationWeightedAccuracy() {
		List<Segment> guess = Arrays.asList(new Segment(0, 1, C_MAJOR, Chord.parse("C:M")), new Segment(1, 4, C_MAJOR, Chord.parse("G:M, inv:1")));
		EvalSuffStats exact = Evaluation.evaluate(piece(), guess, gold());
		assertEquals(4.0, exact.getTotal(), 0.0);
		assertEquals(0.25, exact.getChordAcc(), 1e-12);
		assertEquals(1.0, exact.getKeyAcc(), 1e-12);
		assertEquals(0.25, exact.getJointAcc(), 1e-12);

		EvalSuffStats ignoringInversion = Evaluation.evaluate(piece(), guess, gold(), ChordMatch.IGNORE_INVERSION, false);
		assertEquals(0.5, ignoringInversion.getChordAcc(), 1e-12);
	}

	@Test
	void testKeyErrorsCountSeparately() {
		List<Segment> guess = Arrays.asList(new Segment(0, 2, C_MAJOR, Chord.parse("C:M")), new Segment(2, 4, G_MAJOR, Chord.parse("G:M")));
		EvalSuffStats stats = Evaluation.evaluate(piece(), guess, gold());
		assertEquals(1.0, stats.getChordAcc(), 1e-12);
		assertEquals(0.75, stats.getKeyAcc(), 1e-12);
		assertEquals(0.75, stats.getJointAcc(), 1e-12);
	}

	@Test
	void testChordMatchLevels() {
		Chord dominantSeventh = Chord.parse("G:Mm7, inv:2");
		Chord dominant = Chord.parse("G:M");
		assertFalse(Evaluation.chordsMatch(dominantSeventh, dominant, ChordMatch.EXACT));
		assertFalse(Evaluation.chordsMatch(dominantSeventh, dominant, ChordMatch.IGNORE_INVERSION));
		assertTrue(Evaluation.chordsMatch(dominantSeventh, dominant, ChordMatch.TRIAD));
		assertTrue(Evaluation.chordsMatch(Chord.parse("B:%7"), Chord.parse("B:o"), ChordMatch.TRIAD));
		assertFalse(Evaluation.chordsMatch(Chord.parse("A:mm7"), Chord.parse("A:M"), ChordMatch.TRIAD));
		assertTrue(Evaluation.chordsMatch(Chord.parse("A:mm7"), Chord.parse("A:M"), ChordMatch.ROOT_ONLY));
	}

	@Test
	void testTonicOnlyKeyMatch() {
		assertFalse(Evaluation.keysMatch(Key.parse("A:MINOR"), Key.parse("A:MAJOR"), false));
		assertTrue(Evaluation.keysMatch(Key.parse("A:MINOR"), Key.parse("A:MAJOR"), true));
	}

	@Test
	void testStatsSumOverPieces() {
		EvalSuffStats total = new EvalSuffStats(0, 0, 0, 0);
		assertEquals(0.0, total.getChordAcc(), 0.0);
		total.increment(new EvalSuffStats(1, 2, 1, 2));
		total.increment(new EvalSuffStats(3, 2, 2, 6));
		assertEquals(0.5, total.getChordAcc(), 1e-12);
		assertEquals(0.5, total.getKeyAcc(), 1e-12);
		assertEquals(0.375, total.getJointAcc(), 1e-12);
		assertEquals(8.0, total.getTotal(), 0.0);
	}

	@Test
	void testSegmentsMustPartitionFrames() {
		List<Segment> gap = Arrays.asList(new Segment(0, 1, C_MAJOR, Chord.parse("C:M")), new Segment(2, 4, C_MAJOR, Chord.parse("G:M")));
		assertThrows(IllegalArgumentException.class, () -> Evaluation.evaluate(piece(), gap, gold()));
		List<Segment> tooShort = Arrays.asList(new Segment(0, 3, C_MAJOR, Chord.parse("C:M")));
		assertThrows(IllegalArgumentException.class, () -> Evaluation.evaluate(piece(), gold(), tooShort));
		List<Segment> tooLong = Arrays.asList(new Segment(0, 5, C_MAJOR, Chord.parse("C:M")));
		assertThrows(IllegalArgumentException.class, () -> Evaluation.labelFrames(tooLong, 4));
	}

}
