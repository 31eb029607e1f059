package learning;

import java.util.List;

import vocab.Chord;
import vocab.Key;

/**
 * Probability that the key changes at the chord boundary following the
 * given chords of the current key segment.
 */
public interface KeyTransitionModel {

	public double getChangeProb(Key key, List<Chord> chordsInKey);

	public static class FixedKeyTransitionModel implements KeyTransitionModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final double changeProb;
		public FixedKeyTransitionModel(double changeProb) {
			if (!(changeProb >= 0.0 && changeProb <= 1.0)) {
				throw new IllegalArgumentException("Change probability out of range: "+changeProb);
			}
			this.changeProb = changeProb;
		}
		public double getChangeProb(Key key, List<Chord> chordsInKey) {
			return changeProb;
		}
	}

}
