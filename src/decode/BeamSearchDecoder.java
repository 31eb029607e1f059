package decode;

import io.PieceIO.Piece;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import learning.HarmonyModels;
import vocab.Chord;
import vocab.Key;
import vocab.Vocabulary;

/**
 * Frame-synchronous beam search over (key, chord) segmentations of a piece.
 *
 * After round t every hypothesis in the beam labels frames [0, t+1) and
 * holds one open chord segment inside one open key segment. Round t offers
 * each hypothesis three kinds of children: the open chord absorbs frame t,
 * the chord closes at t and a different chord opens in the same key, or
 * both chord and key close at t and a chord of a different key opens. All
 * children of a round are collected before the pruner builds the next beam.
 * After the last frame every hypothesis is closed and the best one wins.
 *
 * A decoder holds no per-piece state, so one instance may decode several
 * pieces concurrently.
 */
public class BeamSearchDecoder {

	private final HarmonyModels models;
	private final DecoderConfig config;
	private final SegmentationPolicy policy;
	private final BeamPruner pruner;

	public BeamSearchDecoder(HarmonyModels models, DecoderConfig config) {
		this(models, config, new DefaultSegmentationPolicy(config), new BeamWidthPruner(config));
	}

	public BeamSearchDecoder(HarmonyModels models, DecoderConfig config, SegmentationPolicy policy, BeamPruner pruner) {
		if (models == null) throw new IllegalArgumentException("Missing models");
		if (policy == null) throw new IllegalArgumentException("Missing segmentation policy");
		if (pruner == null) throw new IllegalArgumentException("Missing beam pruner");
		this.models = models;
		this.config = config.validate();
		this.policy = policy;
		this.pruner = pruner;
	}

	public DecoderConfig getConfig() {
		return config;
	}

	public DecodeResult decode(Piece piece) {
		if (piece == null) throw new IllegalArgumentException("Missing piece");
		long startTime = System.currentTimeMillis();
		long deadline = (config.maxDecodeMillis > 0 ? startTime + config.maxDecodeMillis : Long.MAX_VALUE);
		ScoringAdapter scores = new ScoringAdapter(models, piece);
		ExecutorService executor = (config.numThreads > 1 ? Executors.newFixedThreadPool(config.numThreads) : null);
		try {
			int numFrames = piece.numFrames();
			List<Hypothesis> beam = pruner.prune(initialHypotheses(scores));
			if (beam.isEmpty()) {
				throw new SearchFailureException("No valid opening (key, chord) pair", 0);
			}
			int peakBeamSize = beam.size();
			int numRounds = 1;
			printRound(0, beam, beam.size());

			for (int t=1; t<numFrames; ++t) {
				checkBudget(deadline, t);
				List<Hypothesis> children = expandAll(beam, t, scores, executor);
				if (children.isEmpty()) {
					throw new SearchFailureException("No valid expansion of "+beam.size()+" hypotheses", t);
				}
				beam = pruner.prune(children);
				if (beam.isEmpty()) {
					throw new SearchFailureException("Beam empty after pruning "+children.size()+" children", t);
				}
				peakBeamSize = Math.max(peakBeamSize, beam.size());
				numRounds++;
				printRound(t, beam, children.size());
			}

			checkBudget(deadline, numFrames);
			List<Hypothesis> complete = new ArrayList<Hypothesis>(beam.size());
			for (Hypothesis hypothesis : beam) {
				if (!policy.canFinish(hypothesis, numFrames, scores)) continue;
				double closing = scores.closeChordScore(hypothesis.getChordStart(), numFrames, hypothesis.getChord());
				complete.add(hypothesis.finish(numFrames, closing));
			}
			if (complete.isEmpty()) {
				throw new SearchFailureException("No hypothesis can be completed", numFrames);
			}
			Collections.sort(complete, Hypothesis.BEST_FIRST);
			Hypothesis best = complete.get(0);
			List<Segment> segments = PathReconstruction.chordSegments(best);
			if (config.verbose) {
				System.out.println(String.format("Decoded %s: %d segments, logProb %.4f, %d score queries, %d evaluations, %dms", piece.name, segments.size(), best.getLogProb(), scores.getNumQueries(), scores.getNumEvaluations(), System.currentTimeMillis() - startTime));
			}
			return new DecodeResult(piece.name, segments, best.getLogProb(), numRounds, peakBeamSize, scores.getNumQueries(), scores.getNumEvaluations());
		} finally {
			scores.clear();
			if (executor != null) executor.shutdownNow();
		}
	}

	/**
	 * Every (key, chord valid in key) pair opened at frame 0.
	 */
	List<Hypothesis> initialHypotheses(ScoringAdapter scores) {
		Vocabulary vocabulary = scores.getVocabulary();
		List<Key> noKeys = Collections.emptyList();
		List<Hypothesis> result = new ArrayList<Hypothesis>();
		for (Key key : vocabulary.getKeys()) {
			double keyScore = scores.keySequenceScore(noKeys, key);
			for (Chord chord : vocabulary.getValidChords(key)) {
				double opening = keyScore + scores.initialChordScore(chord);
				result.add(Hypothesis.start(key, chord, opening, scores.openChordScore(0, 1, chord)));
			}
		}
		return result;
	}

	/**
	 * Children of one hypothesis for frame t, in a fixed order: continuation,
	 * chord changes in vocabulary order, then key changes in key order.
	 */
	List<Hypothesis> expand(Hypothesis hypothesis, int t, ScoringAdapter scores) {
		Vocabulary vocabulary = scores.getVocabulary();
		List<Hypothesis> children = new ArrayList<Hypothesis>();
		Key key = hypothesis.getKey();
		Chord chord = hypothesis.getChord();
		int chordStart = hypothesis.getChordStart();

		if (policy.canContinueChord(hypothesis, t, scores)) {
			children.add(hypothesis.extend(scores.openChordScore(chordStart, t+1, chord)));
		}

		if (!policy.canCloseChord(hypothesis, t, scores)) return children;
		double closing = scores.closeChordScore(chordStart, t, chord);
		List<Chord> chordsInKey = hypothesis.getChordsInKeyWithCurrent();

		if (policy.canContinueKey(hypothesis, t, scores)) {
			double keyContinuation = scores.keyContinuationScore(key, chordsInKey, t);
			for (Chord next : vocabulary.getValidChords(key)) {
				if (next.equals(chord)) continue;
				double added = closing + keyContinuation + scores.chordSequenceScore(key, chordsInKey, next);
				children.add(hypothesis.closeChord(t, next, added, scores.openChordScore(t, t+1, next)));
			}
		}

		if (policy.canCloseKey(hypothesis, t, scores)) {
			double keyTransition = scores.keyTransitionScore(key, chordsInKey, t);
			List<Key> keyHistory = hypothesis.getKeyHistoryWithCurrent();
			List<Chord> noChords = Collections.emptyList();
			for (Key nextKey : vocabulary.getKeys()) {
				if (!vocabulary.isKeyChange(key, nextKey)) continue;
				double keyScore = closing + keyTransition + scores.keySequenceScore(keyHistory, nextKey);
				for (Chord next : vocabulary.getValidChords(nextKey)) {
					double added = keyScore + scores.chordSequenceScore(nextKey, noChords, next);
					children.add(hypothesis.closeKey(t, nextKey, next, added, scores.openChordScore(t, t+1, next)));
				}
			}
		}
		return children;
	}

	/**
	 * Expands the whole beam for frame t. With several threads the beam is
	 * split into contiguous chunks whose children are concatenated in beam
	 * order, so the result does not depend on the number of threads.
	 */
	private List<Hypothesis> expandAll(final List<Hypothesis> beam, final int t, final ScoringAdapter scores, ExecutorService executor) {
		if (executor == null || beam.size() < 2) {
			List<Hypothesis> children = new ArrayList<Hypothesis>();
			for (Hypothesis hypothesis : beam) children.addAll(expand(hypothesis, t, scores));
			return children;
		}
		int numChunks = Math.min(config.numThreads, beam.size());
		int chunkSize = (beam.size() + numChunks - 1) / numChunks;
		List<Future<List<Hypothesis>>> futures = new ArrayList<Future<List<Hypothesis>>>();
		for (int start=0; start<beam.size(); start+=chunkSize) {
			final List<Hypothesis> chunk = beam.subList(start, Math.min(beam.size(), start+chunkSize));
			futures.add(executor.submit(new Callable<List<Hypothesis>>() {
				public List<Hypothesis> call() {
					List<Hypothesis> children = new ArrayList<Hypothesis>();
					for (Hypothesis hypothesis : chunk) children.addAll(expand(hypothesis, t, scores));
					return children;
				}
			}));
		}
		List<Hypothesis> children = new ArrayList<Hypothesis>();
		for (Future<List<Hypothesis>> future : futures) {
			try {
				children.addAll(future.get());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new DecodeAbortedException("Interrupted while expanding the beam", t);
			} catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException) throw (RuntimeException) cause;
				if (cause instanceof Error) throw (Error) cause;
				throw new DecodeException("Expansion failed", t, cause);
			}
		}
		return children;
	}

	private void checkBudget(long deadline, int t) {
		if (Thread.currentThread().isInterrupted()) {
			throw new DecodeAbortedException("Decode interrupted", t);
		}
		if (System.currentTimeMillis() > deadline) {
			throw new DecodeAbortedException("Decode exceeded its budget of "+config.maxDecodeMillis+"ms", t);
		}
	}

	private void printRound(int t, List<Hypothesis> beam, int numChildren) {
		if (!config.verbose) return;
		System.out.println(String.format("Frame %d: %d children, beam %d, best %.4f, worst %.4f", t, numChildren, beam.size(), beam.get(0).getLogProb(), beam.get(beam.size()-1).getLogProb()));
	}

}
