package decode;

/**
 * Musical constraints on where segments may end, consulted by the decoder
 * before it offers an expansion. Frame t is the frame being added to the
 * hypotheses; a boundary at t means a new segment starts at frame t.
 */
public interface SegmentationPolicy {

	public boolean canContinueChord(Hypothesis hypothesis, int frame, ScoringAdapter scores);

	public boolean canCloseChord(Hypothesis hypothesis, int boundary, ScoringAdapter scores);

	/**
	 * Asked only when the chord closes at boundary: may the key stay the same.
	 */
	public boolean canContinueKey(Hypothesis hypothesis, int boundary, ScoringAdapter scores);

	/**
	 * Asked only when the chord closes at boundary: may the key change there.
	 */
	public boolean canCloseKey(Hypothesis hypothesis, int boundary, ScoringAdapter scores);

	public boolean canFinish(Hypothesis hypothesis, int numFrames, ScoringAdapter scores);

}
