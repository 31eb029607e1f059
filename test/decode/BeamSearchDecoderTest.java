package decode;

import static decode.ScriptedModels.chord;
import static decode.ScriptedModels.key;
import static org.junit.jupiter.api.Assertions.*;

import io.PieceIO.Piece;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import learning.KeySequenceModel;
import learning.ChordSequenceModel;
import vocab.Chord;
import vocab.Key;
import vocab.RelativeChord;
import vocab.Vocabulary;
import vocab.Vocabulary.Validity;

class BeamSearchDecoderTest {

	private static final Vocabulary THREE_CHORDS_TWO_KEYS = ScriptedModels.vocabulary(Validity.ALL,
			new String[] {"C:M", "G:M", "A:m"}, new String[] {"C:MAJOR", "G:MAJOR"});

	@Test
	void testSingleSegmentTakesBestKeyAndChord() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.0, 0.0, 0.0);
		models.initialScores.put(chord("C:M"), -0.1);
		models.initialScores.put(chord("G:M"), -0.05);
		models.keySequence = new KeySequenceModel() {
			public double getLogProb(List<Key> history, Key next) {
				return next.equals(key("G:MAJOR")) ? 0.0 : -1.0;
			}
		};
		DecodeResult result = new BeamSearchDecoder(models.build(), DecoderConfig.defaults()).decode(ScriptedModels.piece(4));

		assertEquals(Arrays.asList(new Segment(0, 4, key("G:MAJOR"), chord("A:m"))), result.chordSegments);
		assertEquals(Arrays.asList(new KeySegment(0, 4, key("G:MAJOR"))), result.keySegments);
		assertEquals(0.0, result.logProb, 1e-12);
	}

	@Test
	void testSingleSegmentTieGoesToFirstGenerated() {
		// every opening except C:M scores 0: the first one in key, then vocabulary order wins
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.0, 0.0, 0.0);
		models.initialScores.put(chord("C:M"), -0.1);
		DecodeResult result = new BeamSearchDecoder(models.build(), DecoderConfig.defaults()).decode(ScriptedModels.piece(4));

		assertEquals(Arrays.asList(new Segment(0, 4, key("C:MAJOR"), chord("G:M"))), result.chordSegments);
		assertEquals(1, result.keySegments.size());
	}

	@Test
	void testForcedKeyChange() {
		Vocabulary vocabulary = ScriptedModels.vocabulary(Validity.ALL,
				new String[] {"C:M", "G:M", "A:m"}, new String[] {"C:MAJOR", "A:MINOR"});
		ScriptedModels models = new ScriptedModels(vocabulary, 1.0, 0.0, 0.5, 0.0);
		final Chord[] truth = {chord("C:M"), chord("C:M"), chord("A:m"), chord("A:m")};
		models.classification = new ScriptedModels.SpanScores() {
			public double score(int start, int end, Chord chord) {
				for (int t=start; t<end; ++t) {
					if (!truth[t].equals(chord)) return -5.0;
				}
				return 0.0;
			}
		};
		// staying in a key after its first chord is expensive, opening a key is free
		models.chordSequence = new ChordSequenceModel() {
			public double getLogProb(Key key, List<RelativeChord> history, RelativeChord next) {
				return history.isEmpty() ? 0.0 : -10.0;
			}
		};
		models.keySequence = new KeySequenceModel() {
			public double getLogProb(List<Key> history, Key next) {
				return (history.isEmpty() && !next.equals(key("C:MAJOR"))) ? -1.0 : 0.0;
			}
		};
		DecodeResult result = new BeamSearchDecoder(models.build(), DecoderConfig.defaults()).decode(ScriptedModels.piece(4));

		assertEquals(Arrays.asList(new KeySegment(0, 2, key("C:MAJOR")), new KeySegment(2, 4, key("A:MINOR"))), result.keySegments);
		assertEquals(Arrays.asList(new Segment(0, 2, key("C:MAJOR"), chord("C:M")), new Segment(2, 4, key("A:MINOR"), chord("A:m"))), result.chordSegments);
		assertEquals(2 * Math.log(0.5), result.logProb, 1e-9);
	}

	/**
	 * G:M over both frames is best overall, but C:M is better on frame 0
	 * alone, so a beam of one keeps C:M and never recovers.
	 */
	private static ScriptedModels locallyAttractiveScenario() {
		Vocabulary vocabulary = ScriptedModels.vocabulary(Validity.ALL, new String[] {"C:M", "G:M", "A:m"}, new String[] {"C:MAJOR"});
		ScriptedModels models = new ScriptedModels(vocabulary, 1.0, 0.2);
		models.keyChangeProb = 0.0;
		models.classification = new ScriptedModels.SpanScores() {
			public double score(int start, int end, Chord chord) {
				if (start == 0 && end == 1) {
					if (chord.equals(chord("C:M"))) return 0.0;
					if (chord.equals(chord("G:M"))) return -0.5;
					return -5.0;
				}
				return chord.equals(chord("G:M")) ? 0.0 : -5.0;
			}
		};
		return models;
	}

	@Test
	void testBeamOfOneDropsGloballyBestBranch() {
		ScriptedModels models = locallyAttractiveScenario();
		Piece piece = ScriptedModels.piece(2);

		DecodeResult narrow = new BeamSearchDecoder(models.build(), DecoderConfig.builder().beamSize(1).build()).decode(piece);
		assertEquals(Arrays.asList(new Segment(0, 1, ScriptedModels.C_MAJOR, chord("C:M")), new Segment(1, 2, ScriptedModels.C_MAJOR, chord("G:M"))), narrow.chordSegments);
		assertEquals(Math.log(0.2), narrow.logProb, 1e-9);
		assertEquals(1, narrow.peakBeamSize);

		DecodeResult wide = new BeamSearchDecoder(models.build(), DecoderConfig.builder().beamSize(2).build()).decode(piece);
		assertEquals(Arrays.asList(new Segment(0, 2, ScriptedModels.C_MAJOR, chord("G:M"))), wide.chordSegments);
		assertEquals(Math.log(0.8), wide.logProb, 1e-9);
		assertTrue(wide.logProb > narrow.logProb);
	}

	@Test
	void testRelativeMarginPrunesLikeNarrowBeam() {
		ScriptedModels models = locallyAttractiveScenario();
		// G:M opens 0.5 below C:M, so a margin of 0.4 drops it after frame 0
		DecoderConfig config = DecoderConfig.builder().relativeMargin(0.4).build();
		DecodeResult result = new BeamSearchDecoder(models.build(), config).decode(ScriptedModels.piece(2));
		assertEquals(Math.log(0.2), result.logProb, 1e-9);
	}

	@Test
	void testSingleFramePiece() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0);
		models.initialScores.put(chord("C:M"), -0.3);
		models.initialScores.put(chord("G:M"), -0.2);
		DecodeResult result = new BeamSearchDecoder(models.build(), DecoderConfig.defaults()).decode(ScriptedModels.piece(1));
		assertEquals(Arrays.asList(new Segment(0, 1, key("C:MAJOR"), chord("A:m"))), result.chordSegments);
		assertEquals(1, result.numRounds);
	}

	@Test
	void testNoValidExpansionFailsWithFrameIndex() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		SegmentationPolicy stuck = new DefaultSegmentationPolicy(DecoderConfig.defaults()) {
			public boolean canContinueChord(Hypothesis hypothesis, int frame, ScoringAdapter scores) {
				return false;
			}
			public boolean canCloseChord(Hypothesis hypothesis, int boundary, ScoringAdapter scores) {
				return false;
			}
		};
		BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.defaults(), stuck, new BeamWidthPruner(DecoderConfig.defaults()));
		SearchFailureException e = assertThrows(SearchFailureException.class, () -> decoder.decode(ScriptedModels.piece(3)));
		assertEquals(1, e.getFrameIndex());
	}

	@Test
	void testScoringFailureIsPropagated() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		models.classification = new ScriptedModels.SpanScores() {
			public double score(int start, int end, Chord chord) {
				if (end == 3) throw new IllegalStateException("model crashed");
				return -1.0;
			}
		};
		for (int numThreads : new int[] {1, 3}) {
			BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.builder().numThreads(numThreads).build());
			ScoringException e = assertThrows(ScoringException.class, () -> decoder.decode(ScriptedModels.piece(3)));
			assertTrue(e.getCause() instanceof IllegalStateException);
		}
	}

	@Test
	void testNonFiniteScoreIsFatal() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		models.classification = new ScriptedModels.SpanScores() {
			public double score(int start, int end, Chord chord) {
				return end == 2 ? Double.NaN : -1.0;
			}
		};
		BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.defaults());
		assertThrows(ScoringException.class, () -> decoder.decode(ScriptedModels.piece(3)));
	}

	@Test
	void testInterruptAbortsBetweenRounds() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.defaults());
		Thread.currentThread().interrupt();
		try {
			DecodeAbortedException e = assertThrows(DecodeAbortedException.class, () -> decoder.decode(ScriptedModels.piece(3)));
			assertEquals(1, e.getFrameIndex());
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	void testTimeBudgetAbortsDecode() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		models.classification = new ScriptedModels.SpanScores() {
			public double score(int start, int end, Chord chord) {
				try {
					Thread.sleep(5);
				} catch (InterruptedException e) {
					throw new IllegalStateException(e);
				}
				return -1.0;
			}
		};
		BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.builder().maxDecodeMillis(1).build());
		assertThrows(DecodeAbortedException.class, () -> decoder.decode(ScriptedModels.piece(3)));
	}

	@Test
	void testInvalidConfigRejectedBeforeDecode() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0);
		assertThrows(IllegalArgumentException.class, () -> new BeamSearchDecoder(models.build(), DecoderConfig.builder().beamSize(0).build()));
	}

	@Test
	void testCachesClearedAfterDecode() {
		ScriptedModels models = new ScriptedModels(THREE_CHORDS_TWO_KEYS, 1.0, 0.5, 0.5);
		BeamSearchDecoder decoder = new BeamSearchDecoder(models.build(), DecoderConfig.defaults());
		Piece piece = ScriptedModels.piece(3);
		decoder.decode(piece);
		int calls = models.numClassifierCalls;
		assertTrue(calls > 0);
		// spans [s, e) with 0 <= s < e <= 3: nothing is classified twice within a decode
		assertTrue(calls <= 6);
		decoder.decode(piece);
		assertEquals(2 * calls, models.numClassifierCalls);
	}

}
