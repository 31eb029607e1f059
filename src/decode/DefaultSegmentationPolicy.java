package decode;

import io.PieceIO.Piece;

/**
 * Boundaries only between frames with different onsets, minimum chord and
 * key lengths in frames, a maximum chord duration, and the change
 * probability thresholds: a chord may change only where its change
 * probability exceeds minChangeProb and must change where it exceeds
 * maxNoChangeProb. Probabilities of exactly 0 or 1 are hard constraints.
 * The final segments of a piece are exempt from the minimum lengths, and
 * a frame inside an onset group always joins the open chord, even past the
 * maximum duration.
 */
public class DefaultSegmentationPolicy implements SegmentationPolicy {

	final int minChordLength;
	final int minKeyLength;
	final double maxChordDuration;
	final double minChangeProb;
	final double maxNoChangeProb;

	public DefaultSegmentationPolicy(DecoderConfig config) {
		config.validate();
		this.minChordLength = config.minChordLength;
		this.minKeyLength = config.minKeyLength;
		this.maxChordDuration = config.maxChordDuration;
		this.minChangeProb = config.minChangeProb;
		this.maxNoChangeProb = config.maxNoChangeProb;
	}

	public boolean canContinueChord(Hypothesis hypothesis, int frame, ScoringAdapter scores) {
		Piece piece = scores.getPiece();
		// no boundary fits inside an onset group, so the span must take the frame
		if (piece.sharesOnsetWithPrevious(frame)) return true;
		if (piece.duration(hypothesis.getChordStart(), frame+1) > maxChordDuration) return false;
		double changeProb = scores.chordChangeProb(frame);
		return changeProb <= maxNoChangeProb && changeProb < 1.0;
	}

	public boolean canCloseChord(Hypothesis hypothesis, int boundary, ScoringAdapter scores) {
		if (scores.getPiece().sharesOnsetWithPrevious(boundary)) return false;
		if (boundary - hypothesis.getChordStart() < Math.max(1, minChordLength)) return false;
		double changeProb = scores.chordChangeProb(boundary);
		return changeProb > minChangeProb && changeProb > 0.0;
	}

	public boolean canContinueKey(Hypothesis hypothesis, int boundary, ScoringAdapter scores) {
		return scores.keyChangeProb(hypothesis.getKey(), hypothesis.getChordsInKeyWithCurrent()) < 1.0;
	}

	public boolean canCloseKey(Hypothesis hypothesis, int boundary, ScoringAdapter scores) {
		if (boundary - hypothesis.getKeyStart() < Math.max(1, minKeyLength)) return false;
		return scores.keyChangeProb(hypothesis.getKey(), hypothesis.getChordsInKeyWithCurrent()) > 0.0;
	}

	public boolean canFinish(Hypothesis hypothesis, int numFrames, ScoringAdapter scores) {
		return true;
	}

}
