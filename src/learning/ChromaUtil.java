package learning;

import io.PieceIO.Frame;
import io.PieceIO.Piece;
import vocab.PitchClass;

public class ChromaUtil {

	public static double[] toDouble(float[] features) {
		double[] result = new double[PitchClass.N_CHROMA];
		if (features == null) return result;
		for (int p=0; p<Math.min(features.length, PitchClass.N_CHROMA); ++p) {
			result[p] = features[p];
		}
		return result;
	}

	/**
	 * Duration weighted chroma of the frames in [start, end). Frames with zero
	 * duration (grace notes) get a unit weight so they are not lost.
	 */
	public static double[] spanChroma(Piece piece, int start, int end) {
		double[] chroma = new double[PitchClass.N_CHROMA];
		for (int i=start; i<end; ++i) {
			Frame frame = piece.getFrame(i);
			double weight = (frame.duration > 0.0 ? frame.duration : 1.0);
			double[] frameChroma = toDouble(frame.getFeatures());
			for (int p=0; p<PitchClass.N_CHROMA; ++p) {
				chroma[p] += weight * frameChroma[p];
			}
		}
		return chroma;
	}

}
