package decode;

import java.util.List;

/**
 * Turns all children generated for one frame into the next beam. Called
 * once per frame with the complete set of children.
 */
public interface BeamPruner {

	/**
	 * @return the surviving hypotheses, best first
	 */
	public List<Hypothesis> prune(List<Hypothesis> candidates);

}
