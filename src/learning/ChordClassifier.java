package learning;

import io.PieceIO.Piece;
import vocab.Chord;
import vocab.PitchClass;
import vocab.Vocabulary;

import org.apache.commons.math3.util.MathArrays;

/**
 * Scores how well a span of frames realizes each chord of the vocabulary.
 */
public interface ChordClassifier {

	/**
	 * Log-likelihoods over the whole chord vocabulary (indexed as in the
	 * vocabulary) for the frames in [start, end).
	 */
	public double[] getLogDistribution(Piece piece, int start, int end);

	public static class TemplateChordClassifier implements ChordClassifier, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		public static final double DEFAULT_TEMPERATURE = 0.1;
		public static final double BASS_WEIGHT = 1.5;
		final double temperature;
		final double[][] templates;

		public TemplateChordClassifier(Vocabulary vocabulary) {
			this(vocabulary, DEFAULT_TEMPERATURE);
		}

		public TemplateChordClassifier(Vocabulary vocabulary, double temperature) {
			if (!(temperature > 0.0)) {
				throw new IllegalArgumentException("Temperature must be positive: "+temperature);
			}
			this.temperature = temperature;
			this.templates = new double[vocabulary.numChords()][];
			for (int c=0; c<vocabulary.numChords(); ++c) {
				Chord chord = vocabulary.getChord(c);
				double[] template = new double[PitchClass.N_CHROMA];
				for (int pitch : chord.pitchClasses()) {
					template[pitch] = 1.0;
				}
				template[chord.bass()] = BASS_WEIGHT;
				templates[c] = MathArrays.normalizeArray(template, 1.0);
			}
		}

		public double[] getLogDistribution(Piece piece, int start, int end) {
			double[] chroma = ChromaUtil.spanChroma(piece, start, end);
			double norm = MathArrays.safeNorm(chroma);
			double[] logits = new double[templates.length];
			for (int c=0; c<templates.length; ++c) {
				double similarity = (norm == 0.0 ? 0.0 : MathArrays.linearCombination(chroma, templates[c]) / (norm * MathArrays.safeNorm(templates[c])));
				logits[c] = similarity / temperature;
			}
			return logNormalize(logits);
		}

		static double[] logNormalize(double[] logits) {
			double max = Double.NEGATIVE_INFINITY;
			for (double logit : logits) max = Math.max(max, logit);
			double sum = 0.0;
			for (double logit : logits) sum += Math.exp(logit - max);
			double logZ = max + Math.log(sum);
			double[] result = new double[logits.length];
			for (int i=0; i<logits.length; ++i) {
				result[i] = Math.min(0.0, logits[i] - logZ);
			}
			return result;
		}
	}

}
