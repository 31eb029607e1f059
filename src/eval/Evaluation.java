package eval;

import io.PieceIO.Piece;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import decode.Segment;
import vocab.Chord;
import vocab.ChordType;
import vocab.Key;

public class Evaluation {

	public static enum ChordMatch {EXACT, IGNORE_INVERSION, TRIAD, ROOT_ONLY}

	private static final Map<ChordType,ChordType> TRIAD_REDUCTION = new EnumMap<ChordType,ChordType>(ChordType.class);
	static {
		for (ChordType type : ChordType.values()) TRIAD_REDUCTION.put(type, type);
		TRIAD_REDUCTION.put(ChordType.MAJ_MAJ7, ChordType.MAJOR);
		TRIAD_REDUCTION.put(ChordType.MAJ_MIN7, ChordType.MAJOR);
		TRIAD_REDUCTION.put(ChordType.MIN_MIN7, ChordType.MINOR);
		TRIAD_REDUCTION.put(ChordType.MIN_MAJ7, ChordType.MINOR);
		TRIAD_REDUCTION.put(ChordType.HALF_DIM7, ChordType.DIMINISHED);
		TRIAD_REDUCTION.put(ChordType.DIM7, ChordType.DIMINISHED);
	}

	/**
	 * Duration-weighted counts of correctly labeled time, summable over pieces.
	 */
	public static class EvalSuffStats {
		private double chordCorrect;
		private double keyCorrect;
		private double jointCorrect;
		private double total;

		public EvalSuffStats(double chordCorrect, double keyCorrect, double jointCorrect, double total) {
			this.chordCorrect = chordCorrect;
			this.keyCorrect = keyCorrect;
			this.jointCorrect = jointCorrect;
			this.total = total;
		}

		public void increment(EvalSuffStats other) {
			this.chordCorrect += other.chordCorrect;
			this.keyCorrect += other.keyCorrect;
			this.jointCorrect += other.jointCorrect;
			this.total += other.total;
		}

		public double getChordAcc() {
			return total == 0.0 ? 0.0 : chordCorrect / total;
		}

		public double getKeyAcc() {
			return total == 0.0 ? 0.0 : keyCorrect / total;
		}

		public double getJointAcc() {
			return total == 0.0 ? 0.0 : jointCorrect / total;
		}

		public double getTotal() {
			return total;
		}

		public String toString() {
			return String.format("chord acc: %f, key acc: %f, joint acc: %f, duration: %f", getChordAcc(), getKeyAcc(), getJointAcc(), total);
		}
	}

	public static EvalSuffStats evaluate(Piece piece, List<Segment> guess, List<Segment> gold) {
		return evaluate(piece, guess, gold, ChordMatch.EXACT, false);
	}

	/**
	 * Compares two labelings frame by frame, weighting each frame by its
	 * duration. Zero-duration frames do not count.
	 */
	public static EvalSuffStats evaluate(Piece piece, List<Segment> guess, List<Segment> gold, ChordMatch chordMatch, boolean tonicOnly) {
		Segment[] guessFrames = labelFrames(guess, piece.numFrames());
		Segment[] goldFrames = labelFrames(gold, piece.numFrames());
		double chordCorrect = 0.0, keyCorrect = 0.0, jointCorrect = 0.0, total = 0.0;
		for (int t=0; t<piece.numFrames(); ++t) {
			double duration = piece.getFrame(t).duration;
			if (duration == 0.0) continue;
			boolean chordMatches = chordsMatch(guessFrames[t].chord, goldFrames[t].chord, chordMatch);
			boolean keyMatches = keysMatch(guessFrames[t].key, goldFrames[t].key, tonicOnly);
			if (chordMatches) chordCorrect += duration;
			if (keyMatches) keyCorrect += duration;
			if (chordMatches && keyMatches) jointCorrect += duration;
			total += duration;
		}
		return new EvalSuffStats(chordCorrect, keyCorrect, jointCorrect, total);
	}

	public static boolean chordsMatch(Chord guess, Chord gold, ChordMatch chordMatch) {
		switch (chordMatch) {
			case EXACT: return guess.equals(gold);
			case IGNORE_INVERSION: return guess.root == gold.root && guess.type == gold.type;
			case TRIAD: return guess.root == gold.root && TRIAD_REDUCTION.get(guess.type) == TRIAD_REDUCTION.get(gold.type);
			case ROOT_ONLY: return guess.root == gold.root;
			default: throw new IllegalArgumentException("Unknown chord match: "+chordMatch);
		}
	}

	public static boolean keysMatch(Key guess, Key gold, boolean tonicOnly) {
		return tonicOnly ? guess.tonic == gold.tonic : guess.equals(gold);
	}

	/**
	 * Prints one line per frame where either labeling changes, marking disagreements.
	 */
	public static void printComparison(Piece piece, List<Segment> guess, List<Segment> gold) {
		Segment[] guessFrames = labelFrames(guess, piece.numFrames());
		Segment[] goldFrames = labelFrames(gold, piece.numFrames());
		System.out.println("Comparison for "+piece.name+" (frame, onset, guess | gold):");
		for (int t=0; t<piece.numFrames(); ++t) {
			if (t > 0 && guessFrames[t] == guessFrames[t-1] && goldFrames[t] == goldFrames[t-1]) continue;
			boolean same = guessFrames[t].key.equals(goldFrames[t].key) && guessFrames[t].chord.equals(goldFrames[t].chord);
			System.out.println(String.format("%s %5d %8.3f  %s %s | %s %s", same ? " " : "*", t, piece.getFrame(t).onset,
					guessFrames[t].key, guessFrames[t].chord, goldFrames[t].key, goldFrames[t].chord));
		}
	}

	/**
	 * The segment covering each frame. Segments must partition [0, numFrames).
	 */
	static Segment[] labelFrames(List<Segment> segments, int numFrames) {
		Segment[] frames = new Segment[numFrames];
		int expectedStart = 0;
		for (Segment segment : segments) {
			if (segment.start != expectedStart || segment.end > numFrames) {
				throw new IllegalArgumentException("Segments do not partition "+numFrames+" frames at "+segment);
			}
			for (int t=segment.start; t<segment.end; ++t) frames[t] = segment;
			expectedStart = segment.end;
		}
		if (expectedStart != numFrames) {
			throw new IllegalArgumentException("Segments cover "+expectedStart+" of "+numFrames+" frames");
		}
		return frames;
	}

}
