package learning;

import java.util.List;

import org.jblas.DoubleMatrix;

import vocab.Key;
import vocab.KeyMode;
import vocab.Vocabulary;

/**
 * Probability of the next key given the keys so far. An empty history asks
 * for the key the piece opens in.
 */
public interface KeySequenceModel {

	public double getLogProb(List<Key> history, Key next);

	public static class UniformKeySequenceModel implements KeySequenceModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final int numKeys;
		public UniformKeySequenceModel(Vocabulary vocabulary) {
			this.numKeys = vocabulary.numKeys();
		}
		public double getLogProb(List<Key> history, Key next) {
			// a change always moves to one of the other keys
			return -Math.log(history.isEmpty() ? numKeys : numKeys - 1);
		}
	}

	/**
	 * A prior over opening keys and, per mode of the previous key, a
	 * distribution over the next key relative to the previous tonic.
	 */
	public static class TabularKeySequenceModel implements KeySequenceModel, java.io.Serializable {
		private static final long serialVersionUID = 1L;
		final Vocabulary vocabulary;
		final DoubleMatrix logPrior;
		final DoubleMatrix logTransitions;

		public TabularKeySequenceModel(Vocabulary vocabulary, DoubleMatrix logPrior, DoubleMatrix logTransitions) {
			if (logPrior.length != vocabulary.numKeys()) {
				throw new IllegalArgumentException("Key prior has "+logPrior.length+" entries");
			}
			if (logTransitions.rows != KeyMode.values().length || logTransitions.columns != vocabulary.numRelativeKeys()) {
				throw new IllegalArgumentException("Key transition table has shape "+logTransitions.rows+"x"+logTransitions.columns);
			}
			this.vocabulary = vocabulary;
			this.logPrior = logPrior;
			this.logTransitions = logTransitions;
		}

		/**
		 * Builds the tables from counts with add-smoothing. Transition counts are
		 * indexed [previous mode][relative key index]; the entry meaning "same
		 * key" is excluded from normalization, since a change always moves away.
		 */
		public static TabularKeySequenceModel fromCounts(Vocabulary vocabulary, double[] priorCounts, double[][] transitionCounts, double smoothing) {
			DoubleMatrix logPrior = TableUtil.logNormalizeRows(new DoubleMatrix(new double[][] {priorCounts}), smoothing);
			int[] selfColumns = new int[KeyMode.values().length];
			for (KeyMode mode : KeyMode.values()) {
				Key key = new Key(0, mode);
				selfColumns[mode.ordinal()] = vocabulary.relativeKeyIndex(key, key);
			}
			DoubleMatrix logTransitions = TableUtil.logNormalizeRows(new DoubleMatrix(transitionCounts), smoothing, selfColumns);
			return new TabularKeySequenceModel(vocabulary, logPrior, logTransitions);
		}

		public double getLogProb(List<Key> history, Key next) {
			if (history.isEmpty()) {
				return logPrior.get(vocabulary.indexOf(next));
			}
			Key previous = history.get(history.size()-1);
			return logTransitions.get(previous.mode.ordinal(), vocabulary.relativeKeyIndex(previous, next));
		}
	}

}
