package learning;

import org.jblas.DoubleMatrix;

import vocab.Chord;
import vocab.Vocabulary;

/**
 * Prior over the chord that opens a piece.
 */
public interface InitialChordModel {

	public double getLogPrior(Chord chord);

	public static class UniformInitialChordModel implements InitialChordModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final double logPrior;
		public UniformInitialChordModel(Vocabulary vocabulary) {
			this.logPrior = -Math.log(vocabulary.numChords());
		}
		public double getLogPrior(Chord chord) {
			return logPrior;
		}
	}

	public static class TabularInitialChordModel implements InitialChordModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final Vocabulary vocabulary;
		final DoubleMatrix logPriors;
		public TabularInitialChordModel(Vocabulary vocabulary, double[] counts, double smoothing) {
			if (counts.length != vocabulary.numChords()) {
				throw new IllegalArgumentException("Expected "+vocabulary.numChords()+" chord counts, found "+counts.length);
			}
			this.vocabulary = vocabulary;
			this.logPriors = TableUtil.logNormalizeRows(new DoubleMatrix(new double[][] {counts}), smoothing);
		}
		public double getLogPrior(Chord chord) {
			return logPriors.get(vocabulary.indexOf(chord));
		}
	}

}
