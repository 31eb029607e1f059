package learning;

import java.util.List;

import org.jblas.DoubleMatrix;

import vocab.Chord;
import vocab.Key;
import vocab.KeyMode;
import vocab.RelativeChord;
import vocab.Vocabulary;

/**
 * Probability of the next chord given the key and the chords already
 * heard in that key, all spelled relative to the tonic.
 */
public interface ChordSequenceModel {

	public double getLogProb(Key key, List<RelativeChord> history, RelativeChord next);

	public static class UniformChordSequenceModel implements ChordSequenceModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final Vocabulary vocabulary;
		public UniformChordSequenceModel(Vocabulary vocabulary) {
			this.vocabulary = vocabulary;
		}
		public double getLogProb(Key key, List<RelativeChord> history, RelativeChord next) {
			return -Math.log(vocabulary.getValidChords(key).size());
		}
	}

	/**
	 * Relative chord bigrams, one table per key mode. Row 0 holds the
	 * distribution of the first chord in a key, row 1+i the distribution
	 * following relative chord i.
	 */
	public static class TabularChordSequenceModel implements ChordSequenceModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final Vocabulary vocabulary;
		final DoubleMatrix[] logProbs;

		public TabularChordSequenceModel(Vocabulary vocabulary, DoubleMatrix[] logProbs) {
			if (logProbs.length != KeyMode.values().length) {
				throw new IllegalArgumentException("Expected one table per key mode, found "+logProbs.length);
			}
			for (DoubleMatrix table : logProbs) {
				if (table.rows != vocabulary.numChords()+1 || table.columns != vocabulary.numChords()) {
					throw new IllegalArgumentException("Chord bigram table has shape "+table.rows+"x"+table.columns);
				}
			}
			this.vocabulary = vocabulary;
			this.logProbs = logProbs;
		}

		/**
		 * Builds the tables from bigram counts with add-smoothing. Counts are
		 * indexed [mode][1+prev or 0][next].
		 */
		public static TabularChordSequenceModel fromCounts(Vocabulary vocabulary, double[][][] counts, double smoothing) {
			DoubleMatrix[] logProbs = new DoubleMatrix[KeyMode.values().length];
			for (int m=0; m<logProbs.length; ++m) {
				logProbs[m] = TableUtil.logNormalizeRows(new DoubleMatrix(counts[m]), smoothing);
			}
			return new TabularChordSequenceModel(vocabulary, logProbs);
		}

		public double getLogProb(Key key, List<RelativeChord> history, RelativeChord next) {
			int row = (history.isEmpty() ? 0 : 1 + index(history.get(history.size()-1)));
			return logProbs[key.mode.ordinal()].get(row, index(next));
		}

		private int index(RelativeChord chord) {
			return vocabulary.indexOf(new Chord(chord.rootInterval, chord.type, chord.inversion));
		}
	}

}
