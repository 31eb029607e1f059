package decode;

import java.util.Collections;
import java.util.List;

public class DecodeResult {

	public final String pieceName;
	public final List<Segment> chordSegments;
	public final List<KeySegment> keySegments;
	public final double logProb;
	public final int numRounds;
	public final int peakBeamSize;
	public final long numScoreQueries;
	public final long numScoreEvaluations;

	public DecodeResult(String pieceName, List<Segment> chordSegments, double logProb, int numRounds, int peakBeamSize, long numScoreQueries, long numScoreEvaluations) {
		this.pieceName = pieceName;
		this.chordSegments = Collections.unmodifiableList(chordSegments);
		this.keySegments = Collections.unmodifiableList(PathReconstruction.keySegments(chordSegments));
		this.logProb = logProb;
		this.numRounds = numRounds;
		this.peakBeamSize = peakBeamSize;
		this.numScoreQueries = numScoreQueries;
		this.numScoreEvaluations = numScoreEvaluations;
	}

	public String toString() {
		return String.format("%s: %d chord segments, %d key segments, logProb %.4f", pieceName, chordSegments.size(), keySegments.size(), logProb);
	}

}
