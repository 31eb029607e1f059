package decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every hypothesis. Exact but exponential; for small inputs and as a
 * reference for the approximate pruners.
 */
public class ExhaustivePruner implements BeamPruner {

	public List<Hypothesis> prune(List<Hypothesis> candidates) {
		List<Hypothesis> sorted = new ArrayList<Hypothesis>(candidates);
		Collections.sort(sorted, Hypothesis.BEST_FIRST);
		return sorted;
	}

}
