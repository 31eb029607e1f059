package decode;

import io.PieceIO.Piece;

import java.util.ArrayList;
import java.util.List;

import learning.HarmonyModels;
import vocab.Chord;
import vocab.Key;
import vocab.Vocabulary;

/**
 * Diagnostic baseline: the best chord of every single frame by the chord
 * classifier alone, with runs of equal chords merged. Each run keeps the
 * key of the previous run when the chord is valid there, otherwise the
 * first key in vocabulary order that admits it. The log-probability is the
 * sum of the per-frame classification scores.
 */
public class NaiveDecoder {

	private final HarmonyModels models;

	public NaiveDecoder(HarmonyModels models) {
		if (models == null) throw new IllegalArgumentException("Missing models");
		this.models = models;
	}

	public DecodeResult decode(Piece piece) {
		ScoringAdapter scores = new ScoringAdapter(models, piece);
		try {
			Vocabulary vocabulary = scores.getVocabulary();
			List<Segment> segments = new ArrayList<Segment>();
			double logProb = 0.0;
			int runStart = 0;
			Chord runChord = null;
			Key key = null;
			for (int t=0; t<piece.numFrames(); ++t) {
				Chord best = null;
				double bestScore = Double.NEGATIVE_INFINITY;
				for (Chord chord : vocabulary.getChords()) {
					double score = scores.chordClassificationScore(t, t+1, chord);
					if (score > bestScore) {
						best = chord;
						bestScore = score;
					}
				}
				logProb += bestScore;
				if (runChord != null && !best.equals(runChord)) {
					key = keyFor(vocabulary, key, runChord, runStart);
					segments.add(new Segment(runStart, t, key, runChord));
					runStart = t;
				}
				runChord = best;
			}
			key = keyFor(vocabulary, key, runChord, runStart);
			segments.add(new Segment(runStart, piece.numFrames(), key, runChord));
			return new DecodeResult(piece.name, segments, logProb, piece.numFrames(), 1, scores.getNumQueries(), scores.getNumEvaluations());
		} finally {
			scores.clear();
		}
	}

	private static Key keyFor(Vocabulary vocabulary, Key previous, Chord chord, int frame) {
		if (previous != null && vocabulary.isValid(previous, chord)) return previous;
		for (Key key : vocabulary.getKeys()) {
			if (vocabulary.isValid(key, chord)) return key;
		}
		throw new SearchFailureException("Chord "+chord+" is valid in no key", frame);
	}

}
