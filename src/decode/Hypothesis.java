package decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import vocab.Chord;
import vocab.Key;

/**
 * One candidate labeling of the frames seen so far. Immutable: every
 * extension returns a new hypothesis that shares the closed segments of its
 * parent through a chain of links.
 *
 * At any time a hypothesis has exactly one open chord segment, starting at
 * {@link #getChordStart()}, inside exactly one open key segment, starting at
 * {@link #getKeyStart()}.
 */
public final class Hypothesis {

	/**
	 * Best first: higher score, then fewer closed segments. Ties beyond that
	 * are left to a stable sort, which keeps generation order.
	 */
	public static final Comparator<Hypothesis> BEST_FIRST = new Comparator<Hypothesis>() {
		public int compare(Hypothesis h1, Hypothesis h2) {
			int byScore = Double.compare(h2.getLogProb(), h1.getLogProb());
			if (byScore != 0) return byScore;
			return Integer.compare(h1.numSegments, h2.numSegments);
		}
	};

	/**
	 * A closed segment and the link of the segment before it.
	 */
	public static final class Link {
		public final Segment segment;
		public final Link previous;
		Link(Segment segment, Link previous) {
			this.segment = segment;
			this.previous = previous;
		}
	}

	private final Link lastSegment;
	private final int numSegments;
	private final Key key;
	private final Chord chord;
	private final int keyStart;
	private final int chordStart;
	private final List<Key> keyHistory;
	private final List<Chord> chordsInKey;
	private final double committedLogProb;
	private final double openLogProb;
	private final boolean complete;

	private Hypothesis(Link lastSegment, int numSegments, Key key, Chord chord, int keyStart, int chordStart, List<Key> keyHistory, List<Chord> chordsInKey, double committedLogProb, double openLogProb, boolean complete) {
		this.lastSegment = lastSegment;
		this.numSegments = numSegments;
		this.key = key;
		this.chord = chord;
		this.keyStart = keyStart;
		this.chordStart = chordStart;
		this.keyHistory = keyHistory;
		this.chordsInKey = chordsInKey;
		this.committedLogProb = committedLogProb;
		this.openLogProb = openLogProb;
		this.complete = complete;
	}

	/**
	 * A hypothesis opening the piece with the given key and chord at frame 0.
	 */
	public static Hypothesis start(Key key, Chord chord, double openingLogProb, double openLogProb) {
		return new Hypothesis(null, 0, key, chord, 0, 0, Collections.<Key>emptyList(), Collections.<Chord>emptyList(), openingLogProb, openLogProb, false);
	}

	/**
	 * The open chord span grows by one frame; its provisional score is replaced.
	 */
	public Hypothesis extend(double newOpenLogProb) {
		checkOpen();
		return new Hypothesis(lastSegment, numSegments, key, chord, keyStart, chordStart, keyHistory, chordsInKey, committedLogProb, newOpenLogProb, false);
	}

	/**
	 * Closes the open chord at boundary and opens nextChord in the same key.
	 */
	public Hypothesis closeChord(int boundary, Chord nextChord, double addedLogProb, double newOpenLogProb) {
		checkOpen();
		if (nextChord.equals(chord)) {
			throw new IllegalArgumentException("Chord "+chord+" cannot follow itself within "+key);
		}
		Link link = new Link(new Segment(chordStart, boundary, key, chord), lastSegment);
		return new Hypothesis(link, numSegments+1, key, nextChord, keyStart, boundary, keyHistory, append(chordsInKey, chord), committedLogProb + addedLogProb, newOpenLogProb, false);
	}

	/**
	 * Closes both the open chord and the open key at boundary, opening nextKey with nextChord.
	 */
	public Hypothesis closeKey(int boundary, Key nextKey, Chord nextChord, double addedLogProb, double newOpenLogProb) {
		checkOpen();
		if (nextKey.equals(key)) {
			throw new IllegalArgumentException("Key "+key+" cannot follow itself");
		}
		Link link = new Link(new Segment(chordStart, boundary, key, chord), lastSegment);
		return new Hypothesis(link, numSegments+1, nextKey, nextChord, boundary, boundary, append(keyHistory, key), Collections.<Chord>emptyList(), committedLogProb + addedLogProb, newOpenLogProb, false);
	}

	/**
	 * Closes the open chord and key at the end of the piece.
	 */
	public Hypothesis finish(int end, double addedLogProb) {
		checkOpen();
		Link link = new Link(new Segment(chordStart, end, key, chord), lastSegment);
		return new Hypothesis(link, numSegments+1, key, chord, keyStart, end, keyHistory, chordsInKey, committedLogProb + addedLogProb, 0.0, true);
	}

	public double getLogProb() {
		return committedLogProb + openLogProb;
	}

	public double getCommittedLogProb() {
		return committedLogProb;
	}

	public double getOpenLogProb() {
		return openLogProb;
	}

	public Key getKey() {
		return key;
	}

	public Chord getChord() {
		return chord;
	}

	public int getKeyStart() {
		return keyStart;
	}

	public int getChordStart() {
		return chordStart;
	}

	public int getNumSegments() {
		return numSegments;
	}

	public boolean isComplete() {
		return complete;
	}

	public Link getLastSegment() {
		return lastSegment;
	}

	/**
	 * Keys of the closed key segments, oldest first.
	 */
	public List<Key> getKeyHistory() {
		return keyHistory;
	}

	/**
	 * Closed chords of the open key segment, oldest first.
	 */
	public List<Chord> getChordsInKey() {
		return chordsInKey;
	}

	public List<Key> getKeyHistoryWithCurrent() {
		return append(keyHistory, key);
	}

	public List<Chord> getChordsInKeyWithCurrent() {
		return append(chordsInKey, chord);
	}

	public String toString() {
		return String.format("Hypothesis(%s %s from %d/%d, %d segments, logProb %.4f%s)", key, chord, keyStart, chordStart, numSegments, getLogProb(), complete ? ", complete" : "");
	}

	private void checkOpen() {
		if (complete) {
			throw new IllegalStateException("Hypothesis is already complete");
		}
	}

	private static <T> List<T> append(List<T> list, T item) {
		List<T> result = new ArrayList<T>(list.size()+1);
		result.addAll(list);
		result.add(item);
		return Collections.unmodifiableList(result);
	}

}
