package decode;

import io.PieceIO.Piece;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import learning.HarmonyModels;
import vocab.Chord;
import vocab.Key;
import vocab.RelativeChord;
import vocab.Vocabulary;

/**
 * Uniform, memoized access to the scoring modules for the decode of one
 * piece. Every query result is cached by its full argument tuple until
 * {@link #clear()}; an adapter must never be shared between pieces.
 * Safe for concurrent use by the expansion workers of one decode.
 */
public class ScoringAdapter {

	public static final double LOG_PROB_TOLERANCE = 1e-9;

	private final HarmonyModels models;
	private final Vocabulary vocabulary;
	private final Piece piece;
	private final int numFrames;

	private final double[] chordChangeProbs;
	private final double[] noChangePrefixSums;
	private final int[] certainChangePrefixCounts;

	private final ConcurrentMap<Long,double[]> classifications = new ConcurrentHashMap<Long,double[]>();
	private final ConcurrentMap<Chord,Double> initialChordScores = new ConcurrentHashMap<Chord,Double>();
	private final ConcurrentMap<List<Object>,Double> chordSequenceScores = new ConcurrentHashMap<List<Object>,Double>();
	private final ConcurrentMap<List<Object>,Double> keyChangeProbs = new ConcurrentHashMap<List<Object>,Double>();
	private final ConcurrentMap<List<Object>,Double> keySequenceScores = new ConcurrentHashMap<List<Object>,Double>();

	private final AtomicLong numQueries = new AtomicLong();
	private final AtomicLong numEvaluations = new AtomicLong();

	public ScoringAdapter(HarmonyModels models, Piece piece) {
		this.models = models;
		this.vocabulary = models.vocabulary;
		this.piece = piece;
		this.numFrames = piece.numFrames();
		this.chordChangeProbs = computeChordChangeProbs();
		this.noChangePrefixSums = new double[numFrames+1];
		this.certainChangePrefixCounts = new int[numFrames+1];
		for (int i=0; i<numFrames; ++i) {
			double logNoChange = 0.0;
			int certain = 0;
			if (i > 0 && !piece.sharesOnsetWithPrevious(i)) {
				if (chordChangeProbs[i] >= 1.0) {
					certain = 1;
				} else {
					logNoChange = Math.log(1.0 - chordChangeProbs[i]);
				}
			}
			noChangePrefixSums[i+1] = noChangePrefixSums[i] + logNoChange;
			certainChangePrefixCounts[i+1] = certainChangePrefixCounts[i] + certain;
		}
	}

	public Piece getPiece() {
		return piece;
	}

	public Vocabulary getVocabulary() {
		return vocabulary;
	}

	public int numFrames() {
		return numFrames;
	}

	////////////////////////////////////////////////////////////////////////////////////
	// chord level

	/**
	 * Probability that a chord change happens at the start of the frame. For
	 * frames sharing an onset, the first frame of the group carries the
	 * group's maximum.
	 */
	public double chordChangeProb(int frame) {
		return chordChangeProbs[frame];
	}

	public double initialChordScore(Chord chord) {
		numQueries.incrementAndGet();
		Double cached = initialChordScores.get(chord);
		if (cached != null) return cached;
		numEvaluations.incrementAndGet();
		double score;
		try {
			score = models.initialChordModel.getLogPrior(chord);
		} catch (RuntimeException e) {
			throw new ScoringException("Initial chord model failed for "+chord, 0, e);
		}
		score = checkLogProb(score, "initial chord score of "+chord, 0);
		initialChordScores.putIfAbsent(chord, score);
		return score;
	}

	/**
	 * Log-probability that a chord segment starting at start ends exactly at
	 * end: no change at the aligned frames inside the span, and a change at
	 * end unless end is the end of the piece.
	 */
	public double chordTransitionScore(int start, int end) {
		double score = chordContinuationScore(start, end);
		if (end < numFrames) {
			if (piece.sharesOnsetWithPrevious(end)) {
				throw new IllegalArgumentException("No chord boundary possible before frame "+end+": it shares its onset with the previous frame");
			}
			score += checkLogProb(Math.log(chordChangeProbs[end]), "chord change score", end);
		}
		return score;
	}

	/**
	 * Log-probability of no chord change at every aligned frame strictly inside [start, end).
	 */
	public double chordContinuationScore(int start, int end) {
		checkSpan(start, end);
		if (certainChangePrefixCounts[end] - certainChangePrefixCounts[start+1] > 0) {
			throw new ScoringException("Chord span ["+start+", "+end+") crosses a certain chord change", end);
		}
		return noChangePrefixSums[end] - noChangePrefixSums[start+1];
	}

	public double chordClassificationScore(int start, int end, Chord chord) {
		double score = classify(start, end)[vocabulary.indexOf(chord)];
		return checkLogProb(score, "classification of "+chord+" on ["+start+", "+end+")", end);
	}

	/**
	 * Score of an open chord span: its realization plus the no-change terms of its inner boundaries.
	 */
	public double openChordScore(int start, int end, Chord chord) {
		return chordClassificationScore(start, end, chord) + chordContinuationScore(start, end);
	}

	/**
	 * Score committed when a chord span is closed at end.
	 */
	public double closeChordScore(int start, int end, Chord chord) {
		return chordClassificationScore(start, end, chord) + chordTransitionScore(start, end);
	}

	public double chordSequenceScore(Key key, List<Chord> chordsInKey, Chord next) {
		numQueries.incrementAndGet();
		List<Object> query = Arrays.<Object>asList(key, chordsInKey, next);
		Double cached = chordSequenceScores.get(query);
		if (cached != null) return cached;
		numEvaluations.incrementAndGet();
		List<RelativeChord> relativeHistory = Collections.unmodifiableList(vocabulary.toRelative(key, chordsInKey));
		RelativeChord relativeNext = vocabulary.toRelative(key, next);
		double score;
		try {
			score = models.chordSequenceModel.getLogProb(key, relativeHistory, relativeNext);
		} catch (RuntimeException e) {
			throw new ScoringException("Chord sequence model failed for "+next+" in "+key, -1, e);
		}
		score = checkLogProb(score, "chord sequence score of "+next+" in "+key, -1);
		chordSequenceScores.putIfAbsent(new ArrayList<Object>(query), score);
		return score;
	}

	////////////////////////////////////////////////////////////////////////////////////
	// key level

	/**
	 * Probability that the key changes at the boundary after the given chords of the key segment.
	 */
	public double keyChangeProb(Key key, List<Chord> chordsInKey) {
		numQueries.incrementAndGet();
		List<Object> query = Arrays.<Object>asList(key, chordsInKey);
		Double cached = keyChangeProbs.get(query);
		if (cached != null) return cached;
		numEvaluations.incrementAndGet();
		double prob;
		try {
			prob = models.keyTransitionModel.getChangeProb(key, Collections.unmodifiableList(chordsInKey));
		} catch (RuntimeException e) {
			throw new ScoringException("Key transition model failed in "+key, -1, e);
		}
		if (!(prob >= 0.0 && prob <= 1.0)) {
			throw new ScoringException("Key change probability "+prob+" in "+key+" is not a probability", -1);
		}
		keyChangeProbs.putIfAbsent(new ArrayList<Object>(query), prob);
		return prob;
	}

	/**
	 * Log-probability that the key segment ends at the boundary. The end of
	 * the piece closes every key with certainty.
	 */
	public double keyTransitionScore(Key key, List<Chord> chordsInKey, int boundary) {
		if (boundary >= numFrames) return 0.0;
		return checkLogProb(Math.log(keyChangeProb(key, chordsInKey)), "key change score in "+key, boundary);
	}

	public double keyContinuationScore(Key key, List<Chord> chordsInKey, int boundary) {
		return checkLogProb(Math.log(1.0 - keyChangeProb(key, chordsInKey)), "key continuation score in "+key, boundary);
	}

	public double keySequenceScore(List<Key> keyHistory, Key next) {
		numQueries.incrementAndGet();
		List<Object> query = Arrays.<Object>asList(keyHistory, next);
		Double cached = keySequenceScores.get(query);
		if (cached != null) return cached;
		numEvaluations.incrementAndGet();
		double score;
		try {
			score = models.keySequenceModel.getLogProb(Collections.unmodifiableList(keyHistory), next);
		} catch (RuntimeException e) {
			throw new ScoringException("Key sequence model failed for "+next, -1, e);
		}
		score = checkLogProb(score, "key sequence score of "+next, -1);
		keySequenceScores.putIfAbsent(new ArrayList<Object>(query), score);
		return score;
	}

	////////////////////////////////////////////////////////////////////////////////////

	public long getNumQueries() {
		return numQueries.get();
	}

	/**
	 * Number of queries that reached a scoring module.
	 */
	public long getNumEvaluations() {
		return numEvaluations.get();
	}

	public void clear() {
		classifications.clear();
		initialChordScores.clear();
		chordSequenceScores.clear();
		keyChangeProbs.clear();
		keySequenceScores.clear();
	}

	private double[] classify(int start, int end) {
		checkSpan(start, end);
		numQueries.incrementAndGet();
		Long query = Long.valueOf((long) start * (numFrames+1) + end);
		double[] cached = classifications.get(query);
		if (cached != null) return cached;
		numEvaluations.incrementAndGet();
		double[] distribution;
		try {
			distribution = models.chordClassifier.getLogDistribution(piece, start, end);
		} catch (RuntimeException e) {
			throw new ScoringException("Chord classifier failed on ["+start+", "+end+")", end, e);
		}
		if (distribution == null || distribution.length != vocabulary.numChords()) {
			throw new ScoringException("Chord classifier returned "+(distribution == null ? "no" : distribution.length)+" scores for "+vocabulary.numChords()+" chords", end);
		}
		classifications.putIfAbsent(query, distribution);
		return distribution;
	}

	private double[] computeChordChangeProbs() {
		double[] raw;
		try {
			raw = models.chordTransitionModel.getChangeProbs(piece);
		} catch (RuntimeException e) {
			throw new ScoringException("Chord transition model failed", -1, e);
		}
		if (raw == null || raw.length != numFrames) {
			throw new ScoringException("Chord transition model returned "+(raw == null ? "no" : raw.length)+" probabilities for "+numFrames+" frames", -1);
		}
		double[] probs = raw.clone();
		for (int i=1; i<numFrames; ++i) {
			if (!(probs[i] >= 0.0 && probs[i] <= 1.0)) {
				throw new ScoringException("Chord change probability "+probs[i]+" is not a probability", i);
			}
		}
		// the first frame of each onset group takes the group's maximum
		int first = 0;
		for (int i=1; i<numFrames; ++i) {
			if (piece.sharesOnsetWithPrevious(i)) {
				if (first > 0) probs[first] = Math.max(probs[first], probs[i]);
			} else {
				first = i;
			}
		}
		return probs;
	}

	private void checkSpan(int start, int end) {
		if (start < 0 || end <= start || end > numFrames) {
			throw new IllegalArgumentException("Invalid span ["+start+", "+end+") for "+numFrames+" frames");
		}
	}

	private static double checkLogProb(double score, String what, int frameIndex) {
		if (Double.isNaN(score) || Double.isInfinite(score)) {
			throw new ScoringException("Non-finite "+what+": "+score, frameIndex);
		}
		if (score > LOG_PROB_TOLERANCE) {
			throw new ScoringException("Positive log-probability for "+what+": "+score, frameIndex);
		}
		return Math.min(score, 0.0);
	}

}
