package io;

import io.PieceIO.Piece;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import decode.Segment;
import vocab.Chord;
import vocab.Key;

/**
 * Tab separated segment annotations, one segment per line: start frame,
 * end frame (exclusive), onset of the start frame, key label, chord label.
 */
public class AnnotationIO {

	public static final String ANNOTATION_FILE_SUFFIX = ".lab";
	public static final String HEADER = "#start\tend\tonset\tkey\tchord";

	public static void writeAnnotation(Piece piece, List<Segment> segments, String path) throws IOException {
		List<String> lines = new ArrayList<String>(segments.size()+1);
		lines.add(HEADER);
		for (Segment segment : segments) {
			if (segment.end > piece.numFrames()) {
				throw new IllegalArgumentException("Segment "+segment+" ends after the "+piece.numFrames()+" frames of "+piece.name);
			}
			lines.add(segment.start+"\t"+segment.end+"\t"+piece.getFrame(segment.start).onset+"\t"+segment.key+"\t"+segment.chord);
		}
		Files.write(new File(path).toPath(), lines, StandardCharsets.UTF_8);
	}

	public static List<Segment> readAnnotation(String path) throws IOException {
		List<String> lines = Files.readAllLines(new File(path).toPath(), StandardCharsets.UTF_8);
		List<Segment> segments = new ArrayList<Segment>();
		int lineNum = 0;
		for (String line : lines) {
			lineNum++;
			if (line.trim().equals("") || line.trim().startsWith("#")) continue;
			String[] split = line.split("\t");
			if (split.length != 5) {
				throw new IOException(path+":"+lineNum+": expected 5 tab separated fields, found "+split.length);
			}
			try {
				int start = Integer.parseInt(split[0].trim());
				int end = Integer.parseInt(split[1].trim());
				Key key = Key.parse(split[3].trim());
				Chord chord = Chord.parse(split[4].trim());
				segments.add(new Segment(start, end, key, chord));
			} catch (IllegalArgumentException e) {
				throw new IOException(path+":"+lineNum+": "+e.getMessage(), e);
			}
		}
		return segments;
	}

	/**
	 * The annotation file for a piece in the given directory.
	 */
	public static String annotationPath(String dir, Piece piece) {
		return new File(dir, piece.name+ANNOTATION_FILE_SUFFIX).getPath();
	}

}
