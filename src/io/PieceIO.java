package io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import vocab.PitchClass;

public class PieceIO {

	public static final String PIECE_FILE_SUFFIX = ".tsv";

	public static class Frame implements java.io.Serializable {
		private static final long serialVersionUID = 1L;
		public final int index;
		public final double onset;
		public final double duration;
		private final float[] features;
		public Frame(int index, double onset, double duration, float[] features) {
			this.index = index;
			this.onset = onset;
			this.duration = duration;
			this.features = (features == null ? null : features.clone());
		}
		/**
		 * Opaque payload for the scoring modules; a copy.
		 */
		public float[] getFeatures() {
			return (features == null ? null : features.clone());
		}
		public String toString() {
			return "Frame(" + index + ", " + onset + "+" + duration + ")";
		}
	}

	public static class Piece implements java.io.Serializable {
		private static final long serialVersionUID = 1L;
		public final String name;
		private final List<Frame> frames;
		private final double[] durationPrefixSums;
		public Piece(String name, List<Frame> frames) {
			if (frames == null || frames.isEmpty()) {
				throw new IllegalArgumentException("Piece "+name+" has no frames");
			}
			double[] prefix = new double[frames.size()+1];
			for (int i=0; i<frames.size(); ++i) {
				Frame frame = frames.get(i);
				if (frame == null) {
					throw new IllegalArgumentException("Piece "+name+": frame "+i+" is null");
				}
				if (frame.index != i) {
					throw new IllegalArgumentException("Piece "+name+": frame at position "+i+" has index "+frame.index);
				}
				if (Double.isNaN(frame.duration) || Double.isInfinite(frame.duration) || frame.duration < 0) {
					throw new IllegalArgumentException("Piece "+name+": frame "+i+" has invalid duration "+frame.duration);
				}
				if (Double.isNaN(frame.onset) || Double.isInfinite(frame.onset)) {
					throw new IllegalArgumentException("Piece "+name+": frame "+i+" has invalid onset "+frame.onset);
				}
				if (i > 0 && frame.onset < frames.get(i-1).onset) {
					throw new IllegalArgumentException("Piece "+name+": frame "+i+" starts before frame "+(i-1));
				}
				prefix[i+1] = prefix[i] + frame.duration;
			}
			this.name = name;
			this.frames = Collections.unmodifiableList(new ArrayList<Frame>(frames));
			this.durationPrefixSums = prefix;
		}
		public int numFrames() {
			return frames.size();
		}
		public Frame getFrame(int index) {
			return frames.get(index);
		}
		public List<Frame> getFrames() {
			return frames;
		}
		public List<Frame> getFrames(int start, int end) {
			return frames.subList(start, end);
		}
		/**
		 * Total duration of the frames in [start, end).
		 */
		public double duration(int start, int end) {
			return durationPrefixSums[end] - durationPrefixSums[start];
		}
		/**
		 * True when the frame shares its onset with the preceding frame, so no
		 * segment boundary may be placed in front of it.
		 */
		public boolean sharesOnsetWithPrevious(int index) {
			return index > 0 && frames.get(index).onset == frames.get(index-1).onset;
		}
		public String toString() {
			return "Piece(" + name + ", " + frames.size() + " frames)";
		}
	}

	/**
	 * Reads a piece from a whitespace separated file, one frame per line:
	 * onset, duration and {@link PitchClass#N_CHROMA} chroma weights.
	 * Blank lines and lines starting with '#' are skipped.
	 */
	public static Piece readPiece(String path) throws IOException {
		File file = new File(path);
		List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
		List<Frame> frames = new ArrayList<Frame>();
		int lineNum = 0;
		for (String line : lines) {
			lineNum++;
			if (line.trim().equals("") || line.trim().startsWith("#")) continue;
			String[] split = line.trim().split("\\s+");
			if (split.length != 2 + PitchClass.N_CHROMA) {
				throw new IOException(path+":"+lineNum+": expected "+(2 + PitchClass.N_CHROMA)+" fields, found "+split.length);
			}
			try {
				double onset = Double.parseDouble(split[0]);
				double duration = Double.parseDouble(split[1]);
				float[] chroma = new float[PitchClass.N_CHROMA];
				for (int p=0; p<PitchClass.N_CHROMA; ++p) {
					chroma[p] = Float.parseFloat(split[2+p]);
				}
				frames.add(new Frame(frames.size(), onset, duration, chroma));
			} catch (NumberFormatException e) {
				throw new IOException(path+":"+lineNum+": "+e.getMessage(), e);
			}
		}
		return new Piece(baseName(file), frames);
	}

	public static void writePiece(Piece piece, String path) throws IOException {
		List<String> lines = new ArrayList<String>();
		for (Frame frame : piece.getFrames()) {
			StringBuilder buf = new StringBuilder();
			buf.append(frame.onset).append('\t').append(frame.duration);
			float[] features = frame.getFeatures();
			if (features == null) features = new float[PitchClass.N_CHROMA];
			for (float f : Arrays.copyOf(features, PitchClass.N_CHROMA)) {
				buf.append('\t').append(f);
			}
			lines.add(buf.toString());
		}
		Files.write(new File(path).toPath(), lines, StandardCharsets.UTF_8);
	}

	public static List<String> getPiecePaths(String path) {
		File file = new File(path);
		List<String> paths = new ArrayList<String>();
		if (file.isDirectory()) {
			File[] children = file.listFiles();
			if (children != null) {
				Arrays.sort(children);
				for (File child : children) {
					if (child.getName().endsWith(PIECE_FILE_SUFFIX)) paths.add(child.getPath());
				}
			}
		} else {
			paths.add(path);
		}
		return paths;
	}

	public static String baseName(File file) {
		String fileName = file.getName();
		return fileName.endsWith(PIECE_FILE_SUFFIX) ? fileName.substring(0, fileName.length()-PIECE_FILE_SUFFIX.length()) : fileName;
	}

}
