package decode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges hypotheses in the same (key, chord, open chord start) state,
 * keeping the best one, then drops everything more than relativeMargin
 * below the best score and keeps at most beamSize hypotheses.
 *
 * Merging is an approximation: merged hypotheses may differ in the key and
 * chord histories that later sequence scores depend on.
 */
public class BeamWidthPruner implements BeamPruner {

	final int beamSize;
	final double relativeMargin;

	public BeamWidthPruner(int beamSize, double relativeMargin) {
		if (beamSize <= 0) throw new IllegalArgumentException("Beam size must be positive: "+beamSize);
		if (Double.isNaN(relativeMargin) || relativeMargin < 0.0) throw new IllegalArgumentException("Relative margin must be non-negative: "+relativeMargin);
		this.beamSize = beamSize;
		this.relativeMargin = relativeMargin;
	}

	public BeamWidthPruner(DecoderConfig config) {
		this(config.beamSize, config.relativeMargin);
	}

	public List<Hypothesis> prune(List<Hypothesis> candidates) {
		List<Hypothesis> sorted = new ArrayList<Hypothesis>(candidates);
		Collections.sort(sorted, Hypothesis.BEST_FIRST);
		List<Hypothesis> beam = new ArrayList<Hypothesis>(Math.min(beamSize, sorted.size()));
		if (sorted.isEmpty()) return beam;
		double threshold = sorted.get(0).getLogProb() - relativeMargin;
		Set<List<Object>> seenStates = new HashSet<List<Object>>();
		for (Hypothesis hypothesis : sorted) {
			if (beam.size() >= beamSize) break;
			if (hypothesis.getLogProb() < threshold) break;
			if (!seenStates.add(state(hypothesis))) continue;
			beam.add(hypothesis);
		}
		return beam;
	}

	static List<Object> state(Hypothesis hypothesis) {
		return Arrays.<Object>asList(hypothesis.getKey(), hypothesis.getChord(), hypothesis.getChordStart());
	}

}
