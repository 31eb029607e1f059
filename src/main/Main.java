package main;

import io.AnnotationIO;
import io.ModelIO;
import io.PieceIO;
import io.PieceIO.Piece;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import decode.BeamSearchDecoder;
import decode.DecodeException;
import decode.DecodeResult;
import decode.DecoderConfig;
import decode.NaiveDecoder;
import decode.Segment;
import eval.Evaluation;
import eval.Evaluation.ChordMatch;
import eval.Evaluation.EvalSuffStats;
import learning.HarmonyModels;
import vocab.Vocabulary;
import vocab.Vocabulary.Validity;

public class Main implements Runnable {

	public static String inputPath = "./pieces/";
	public static String outputDir = "./output/";
	public static String models = null;
	public static String saveModels = null;
	public static String gold = null;
	public static boolean allChordsInKey = false;
	public static boolean noInversions = false;
	public static boolean naive = false;
	public static boolean printComparison = false;

	public static int beamSize = DecoderConfig.DEFAULT_BEAM_SIZE;
	public static double relativeMargin = Double.POSITIVE_INFINITY;
	public static int minChordLength = 0;
	public static int minKeyLength = 0;
	public static double maxChordDuration = Double.POSITIVE_INFINITY;
	public static double minChangeProb = 0.0;
	public static double maxNoChangeProb = 1.0;
	public static int numThreads = 1;
	public static int pieceThreads = 1;
	public static long maxDecodeMillis = 0;
	public static boolean verbose = false;

	public void run() {
		HarmonyModels harmonyModels;
		try {
			harmonyModels = loadModels();
		} catch (IOException e) {
			System.err.println("Unable to read models from "+models+": "+e.getMessage());
			return;
		}
		final DecoderConfig config = buildConfig();
		final BeamSearchDecoder decoder = new BeamSearchDecoder(harmonyModels, config);
		final NaiveDecoder naiveDecoder = new NaiveDecoder(harmonyModels);
		System.out.println("Decoder config: "+config);

		(new File(outputDir)).mkdirs();
		final List<String> piecePaths = PieceIO.getPiecePaths(inputPath);
		System.out.println("Num pieces: "+piecePaths.size());

		final EvalSuffStats[] resultArray = new EvalSuffStats[piecePaths.size()];
		final EvalSuffStats[] naiveResultArray = new EvalSuffStats[piecePaths.size()];
		ExecutorService executor = Executors.newFixedThreadPool(pieceThreads);
		long start = System.currentTimeMillis();
		for (int i=0; i<piecePaths.size(); ++i) {
			final int index = i;
			executor.execute(new Runnable() {
				public void run() {
					String piecePath = piecePaths.get(index);
					try {
						Piece piece = PieceIO.readPiece(piecePath);
						System.out.println("Decoding piece "+piece.name+" ("+piece.numFrames()+" frames)..");
						DecodeResult result = decoder.decode(piece);
						System.out.println(result);
						AnnotationIO.writeAnnotation(piece, result.chordSegments, AnnotationIO.annotationPath(outputDir, piece));
						List<Segment> goldSegments = readGold(piece);
						if (goldSegments != null) {
							resultArray[index] = Evaluation.evaluate(piece, result.chordSegments, goldSegments);
							System.out.println(piece.name+" eval: "+resultArray[index]);
							if (printComparison) Evaluation.printComparison(piece, result.chordSegments, goldSegments);
						}
						if (naive) {
							DecodeResult naiveResult = naiveDecoder.decode(piece);
							System.out.println("Naive: "+naiveResult);
							if (goldSegments != null) {
								naiveResultArray[index] = Evaluation.evaluate(piece, naiveResult.chordSegments, goldSegments);
								System.out.println(piece.name+" naive eval: "+naiveResultArray[index]);
							}
						}
					} catch (IOException e) {
						System.err.println("Failed on "+piecePath+": "+e.getMessage());
					} catch (DecodeException e) {
						System.err.println("Decode failed on "+piecePath+": "+e.getMessage());
					} catch (IllegalArgumentException e) {
						System.err.println("Invalid input "+piecePath+": "+e.getMessage());
					}
				}
			});
		}
		executor.shutdown();
		try {
			executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executor.shutdownNow();
			System.err.println("Interrupted");
			return;
		}
		System.out.println("Compute time: "+String.format("%.1f", (System.currentTimeMillis() - start) / 1e3)+"s");

		if (gold != null) {
			System.out.println("Total eval: "+total(resultArray));
			if (naive) System.out.println("Total naive eval: "+total(naiveResultArray));
		}
	}

	private HarmonyModels loadModels() throws IOException {
		HarmonyModels result;
		if (models != null) {
			result = ModelIO.readModels(models);
			System.out.println("Read models from "+models);
		} else {
			Validity validity = (allChordsInKey ? Validity.ALL : Validity.DIATONIC);
			Vocabulary vocabulary = (noInversions ? Vocabulary.withoutInversions(validity) : new Vocabulary(validity));
			result = HarmonyModels.heuristic(vocabulary);
			System.out.println("Using heuristic models, "+vocabulary.numChords()+" chords, "+vocabulary.numKeys()+" keys");
		}
		if (saveModels != null) {
			ModelIO.writeModels(result, saveModels);
			System.out.println("Wrote models to "+saveModels);
		}
		return result;
	}

	private static DecoderConfig buildConfig() {
		return DecoderConfig.builder()
				.beamSize(beamSize)
				.relativeMargin(relativeMargin)
				.minChordLength(minChordLength)
				.minKeyLength(minKeyLength)
				.maxChordDuration(maxChordDuration)
				.minChangeProb(minChangeProb)
				.maxNoChangeProb(maxNoChangeProb)
				.numThreads(numThreads)
				.maxDecodeMillis(maxDecodeMillis)
				.verbose(verbose)
				.build()
				.validate();
	}

	private static List<Segment> readGold(Piece piece) throws IOException {
		if (gold == null) return null;
		String path = AnnotationIO.annotationPath(gold, piece);
		if (!new File(path).exists()) {
			System.out.println("No gold annotation for "+piece.name);
			return null;
		}
		return AnnotationIO.readAnnotation(path);
	}

	private static EvalSuffStats total(EvalSuffStats[] results) {
		EvalSuffStats total = new EvalSuffStats(0, 0, 0, 0);
		for (EvalSuffStats result : results) {
			if (result != null) total.increment(result);
		}
		return total;
	}

	static Options buildOptions() {
		Options options = new Options();
		options.addOption("h", "help", false, "Display this help and exit");
		options.addOption(null, "input", true, "Piece file or directory of "+PieceIO.PIECE_FILE_SUFFIX+" pieces (Default: "+inputPath+")");
		options.addOption(null, "outputDir", true, "Directory for the "+AnnotationIO.ANNOTATION_FILE_SUFFIX+" annotations (Default: "+outputDir+")");
		options.addOption(null, "models", true, "Serialized models; heuristic models when absent");
		options.addOption(null, "saveModels", true, "Write the models in use to this file");
		options.addOption(null, "gold", true, "Directory of gold annotations to evaluate against");
		options.addOption(null, "allChordsInKey", false, "Every chord is valid in every key (heuristic models only)");
		options.addOption(null, "noInversions", false, "Root position chords only (heuristic models only)");
		options.addOption(null, "naive", false, "Also run the per-frame baseline");
		options.addOption(null, "printComparison", false, "Print guess and gold side by side");
		options.addOption(null, "beamSize", true, "Beam size (Default: "+beamSize+")");
		options.addOption(null, "relativeMargin", true, "Relative pruning margin in log-probability (Default: off)");
		options.addOption(null, "minChordLength", true, "Minimum chord length in frames (Default: "+minChordLength+")");
		options.addOption(null, "minKeyLength", true, "Minimum key length in frames (Default: "+minKeyLength+")");
		options.addOption(null, "maxChordDuration", true, "Maximum chord duration (Default: off)");
		options.addOption(null, "minChangeProb", true, "Chord changes only above this probability (Default: "+minChangeProb+")");
		options.addOption(null, "maxNoChangeProb", true, "Chord changes always above this probability (Default: "+maxNoChangeProb+")");
		options.addOption(null, "numThreads", true, "Expansion threads per piece (Default: "+numThreads+")");
		options.addOption(null, "pieceThreads", true, "Pieces decoded in parallel (Default: "+pieceThreads+")");
		options.addOption(null, "maxDecodeMillis", true, "Time budget per piece in ms, 0 for none (Default: "+maxDecodeMillis+")");
		options.addOption(null, "verbose", false, "Print beam statistics for every frame");
		return options;
	}

	static void parseOptions(CommandLine cmd) {
		inputPath = cmd.getOptionValue("input", inputPath);
		outputDir = cmd.getOptionValue("outputDir", outputDir);
		models = cmd.getOptionValue("models", models);
		saveModels = cmd.getOptionValue("saveModels", saveModels);
		gold = cmd.getOptionValue("gold", gold);
		allChordsInKey = cmd.hasOption("allChordsInKey");
		noInversions = cmd.hasOption("noInversions");
		naive = cmd.hasOption("naive");
		printComparison = cmd.hasOption("printComparison");
		beamSize = Integer.parseInt(cmd.getOptionValue("beamSize", Integer.toString(beamSize)));
		relativeMargin = Double.parseDouble(cmd.getOptionValue("relativeMargin", Double.toString(relativeMargin)));
		minChordLength = Integer.parseInt(cmd.getOptionValue("minChordLength", Integer.toString(minChordLength)));
		minKeyLength = Integer.parseInt(cmd.getOptionValue("minKeyLength", Integer.toString(minKeyLength)));
		maxChordDuration = Double.parseDouble(cmd.getOptionValue("maxChordDuration", Double.toString(maxChordDuration)));
		minChangeProb = Double.parseDouble(cmd.getOptionValue("minChangeProb", Double.toString(minChangeProb)));
		maxNoChangeProb = Double.parseDouble(cmd.getOptionValue("maxNoChangeProb", Double.toString(maxNoChangeProb)));
		numThreads = Integer.parseInt(cmd.getOptionValue("numThreads", Integer.toString(numThreads)));
		pieceThreads = Integer.parseInt(cmd.getOptionValue("pieceThreads", Integer.toString(pieceThreads)));
		maxDecodeMillis = Long.parseLong(cmd.getOptionValue("maxDecodeMillis", Long.toString(maxDecodeMillis)));
		verbose = cmd.hasOption("verbose");
		if (pieceThreads < 1) throw new IllegalArgumentException("Number of piece threads must be positive: "+pieceThreads);
	}

	public static void main(String[] args) {
		Options options = buildOptions();
		try {
			CommandLine cmd = new DefaultParser().parse(options, args);
			if (cmd.hasOption("help")) {
				new HelpFormatter().printHelp("harmony-decoder", options);
				return;
			}
			parseOptions(cmd);
			buildConfig();
		} catch (ParseException e) {
			System.err.println(e.getMessage());
			new HelpFormatter().printHelp("harmony-decoder", options);
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.exit(1);
		}
		new Main().run();
	}

}
