package decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PathReconstruction {

	/**
	 * Chord segments of a complete hypothesis, in frame order.
	 */
	public static List<Segment> chordSegments(Hypothesis hypothesis) {
		if (hypothesis == null) {
			throw new SearchFailureException("No hypothesis to reconstruct", -1);
		}
		if (!hypothesis.isComplete()) {
			throw new IllegalArgumentException("Hypothesis is not complete: "+hypothesis);
		}
		List<Segment> segments = new ArrayList<Segment>(hypothesis.getNumSegments());
		for (Hypothesis.Link link = hypothesis.getLastSegment(); link != null; link = link.previous) {
			segments.add(link.segment);
		}
		Collections.reverse(segments);
		return segments;
	}

	/**
	 * Groups consecutive chord segments sharing a key. Adjacent key segments
	 * always differ in key, since a key change requires a different key.
	 */
	public static List<KeySegment> keySegments(List<Segment> chordSegments) {
		List<KeySegment> keySegments = new ArrayList<KeySegment>();
		int i = 0;
		while (i < chordSegments.size()) {
			Segment first = chordSegments.get(i);
			int j = i;
			while (j+1 < chordSegments.size() && chordSegments.get(j+1).key.equals(first.key)) j++;
			keySegments.add(new KeySegment(first.start, chordSegments.get(j).end, first.key));
			i = j+1;
		}
		return keySegments;
	}

}
