package learning;

import learning.ChordClassifier.TemplateChordClassifier;
import learning.ChordSequenceModel.UniformChordSequenceModel;
import learning.ChordTransitionModel.ChromaChordTransitionModel;
import learning.InitialChordModel.UniformInitialChordModel;
import learning.KeySequenceModel.UniformKeySequenceModel;
import learning.KeyTransitionModel.FixedKeyTransitionModel;
import vocab.Vocabulary;

/**
 * The six scoring modules the decoder combines, together with the
 * vocabulary they were built for. Modules are treated as read-only, so one
 * bundle may serve concurrent decodes.
 */
public class HarmonyModels implements java.io.Serializable {
	private static final long serialVersionUID = 1L;

	public static final double DEFAULT_KEY_CHANGE_PROB = 0.05;

	public final Vocabulary vocabulary;
	public final InitialChordModel initialChordModel;
	public final ChordTransitionModel chordTransitionModel;
	public final ChordClassifier chordClassifier;
	public final ChordSequenceModel chordSequenceModel;
	public final KeyTransitionModel keyTransitionModel;
	public final KeySequenceModel keySequenceModel;

	public HarmonyModels(Vocabulary vocabulary, InitialChordModel initialChordModel, ChordTransitionModel chordTransitionModel, ChordClassifier chordClassifier, ChordSequenceModel chordSequenceModel, KeyTransitionModel keyTransitionModel, KeySequenceModel keySequenceModel) {
		checkNotNull(vocabulary, "vocabulary");
		checkNotNull(initialChordModel, "initial chord model");
		checkNotNull(chordTransitionModel, "chord transition model");
		checkNotNull(chordClassifier, "chord classifier");
		checkNotNull(chordSequenceModel, "chord sequence model");
		checkNotNull(keyTransitionModel, "key transition model");
		checkNotNull(keySequenceModel, "key sequence model");
		this.vocabulary = vocabulary;
		this.initialChordModel = initialChordModel;
		this.chordTransitionModel = chordTransitionModel;
		this.chordClassifier = chordClassifier;
		this.chordSequenceModel = chordSequenceModel;
		this.keyTransitionModel = keyTransitionModel;
		this.keySequenceModel = keySequenceModel;
	}

	/**
	 * Untrained heuristic modules: chroma templates and chroma change for the
	 * chord level, uniform sequence models and a fixed key change rate.
	 */
	public static HarmonyModels heuristic(Vocabulary vocabulary) {
		return new HarmonyModels(vocabulary,
				new UniformInitialChordModel(vocabulary),
				new ChromaChordTransitionModel(),
				new TemplateChordClassifier(vocabulary),
				new UniformChordSequenceModel(vocabulary),
				new FixedKeyTransitionModel(DEFAULT_KEY_CHANGE_PROB),
				new UniformKeySequenceModel(vocabulary));
	}

	private static void checkNotNull(Object module, String name) {
		if (module == null) {
			throw new IllegalArgumentException("Missing "+name);
		}
	}

}
