package learning;

import io.PieceIO.Frame;
import io.PieceIO.Piece;

import org.apache.commons.math3.util.MathArrays;

/**
 * Per-frame chord change probabilities: entry i is the probability that a
 * new chord starts at frame i. Entry 0 is ignored by the decoder.
 */
public interface ChordTransitionModel {

	public double[] getChangeProbs(Piece piece);

	public static class FixedChordTransitionModel implements ChordTransitionModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final double changeProb;
		public FixedChordTransitionModel(double changeProb) {
			if (!(changeProb >= 0.0 && changeProb <= 1.0)) {
				throw new IllegalArgumentException("Change probability out of range: "+changeProb);
			}
			this.changeProb = changeProb;
		}
		public double[] getChangeProbs(Piece piece) {
			double[] changeProbs = new double[piece.numFrames()];
			java.util.Arrays.fill(changeProbs, changeProb);
			changeProbs[0] = 1.0;
			return changeProbs;
		}
	}

	/**
	 * Logistic in the cosine distance between the chroma vectors of adjacent
	 * frames: a large change in pitch content suggests a chord change.
	 */
	public static class ChromaChordTransitionModel implements ChordTransitionModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		public static final double DEFAULT_BIAS = -2.0;
		public static final double DEFAULT_SLOPE = 6.0;
		public static final double MIN_PROB = 1e-4;
		final double bias;
		final double slope;
		public ChromaChordTransitionModel() {
			this(DEFAULT_BIAS, DEFAULT_SLOPE);
		}
		public ChromaChordTransitionModel(double bias, double slope) {
			this.bias = bias;
			this.slope = slope;
		}
		public double[] getChangeProbs(Piece piece) {
			double[] changeProbs = new double[piece.numFrames()];
			changeProbs[0] = 1.0;
			for (int i=1; i<piece.numFrames(); ++i) {
				double distance = 1.0 - cosine(piece.getFrame(i-1), piece.getFrame(i));
				double prob = 1.0 / (1.0 + Math.exp(-(bias + slope * distance)));
				changeProbs[i] = Math.min(1.0 - MIN_PROB, Math.max(MIN_PROB, prob));
			}
			return changeProbs;
		}
		private static double cosine(Frame prev, Frame next) {
			double[] a = ChromaUtil.toDouble(prev.getFeatures());
			double[] b = ChromaUtil.toDouble(next.getFeatures());
			double norms = MathArrays.safeNorm(a) * MathArrays.safeNorm(b);
			if (norms == 0.0) return 1.0;
			return MathArrays.linearCombination(a, b) / norms;
		}
	}

}
