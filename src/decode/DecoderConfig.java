package decode;

/**
 * Search settings. Build with {@link #builder()}; {@link #validate()} rejects
 * out-of-range values before a decode starts.
 */
public final class DecoderConfig {

	public static final int DEFAULT_BEAM_SIZE = 500;

	public final int beamSize;
	public final double relativeMargin;
	public final int minChordLength;
	public final int minKeyLength;
	public final double maxChordDuration;
	public final double minChangeProb;
	public final double maxNoChangeProb;
	public final int numThreads;
	public final long maxDecodeMillis;
	public final boolean verbose;

	private DecoderConfig(Builder builder) {
		this.beamSize = builder.beamSize;
		this.relativeMargin = builder.relativeMargin;
		this.minChordLength = builder.minChordLength;
		this.minKeyLength = builder.minKeyLength;
		this.maxChordDuration = builder.maxChordDuration;
		this.minChangeProb = builder.minChangeProb;
		this.maxNoChangeProb = builder.maxNoChangeProb;
		this.numThreads = builder.numThreads;
		this.maxDecodeMillis = builder.maxDecodeMillis;
		this.verbose = builder.verbose;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static DecoderConfig defaults() {
		return builder().build();
	}

	public DecoderConfig validate() {
		if (beamSize <= 0) throw new IllegalArgumentException("Beam size must be positive: "+beamSize);
		if (Double.isNaN(relativeMargin) || relativeMargin < 0.0) throw new IllegalArgumentException("Relative margin must be non-negative: "+relativeMargin);
		if (minChordLength < 0) throw new IllegalArgumentException("Minimum chord length must be non-negative: "+minChordLength);
		if (minKeyLength < 0) throw new IllegalArgumentException("Minimum key length must be non-negative: "+minKeyLength);
		if (Double.isNaN(maxChordDuration) || maxChordDuration <= 0.0) throw new IllegalArgumentException("Maximum chord duration must be positive: "+maxChordDuration);
		if (!(minChangeProb >= 0.0 && minChangeProb <= 1.0)) throw new IllegalArgumentException("Minimum change probability out of range: "+minChangeProb);
		if (!(maxNoChangeProb >= 0.0 && maxNoChangeProb <= 1.0)) throw new IllegalArgumentException("Maximum no-change probability out of range: "+maxNoChangeProb);
		if (minChangeProb > maxNoChangeProb) throw new IllegalArgumentException("Undefined chord change behavior on probability range ("+maxNoChangeProb+", "+minChangeProb+")");
		if (numThreads < 1) throw new IllegalArgumentException("Number of threads must be positive: "+numThreads);
		if (maxDecodeMillis < 0) throw new IllegalArgumentException("Decode time budget must be non-negative: "+maxDecodeMillis);
		return this;
	}

	public Builder toBuilder() {
		return new Builder()
			.beamSize(beamSize)
			.relativeMargin(relativeMargin)
			.minChordLength(minChordLength)
			.minKeyLength(minKeyLength)
			.maxChordDuration(maxChordDuration)
			.minChangeProb(minChangeProb)
			.maxNoChangeProb(maxNoChangeProb)
			.numThreads(numThreads)
			.maxDecodeMillis(maxDecodeMillis)
			.verbose(verbose);
	}

	public String toString() {
		return String.format("beamSize: %d, relativeMargin: %f, minChordLength: %d, minKeyLength: %d, maxChordDuration: %f, minChangeProb: %f, maxNoChangeProb: %f, numThreads: %d",
				beamSize, relativeMargin, minChordLength, minKeyLength, maxChordDuration, minChangeProb, maxNoChangeProb, numThreads);
	}

	public static class Builder {
		private int beamSize = DEFAULT_BEAM_SIZE;
		private double relativeMargin = Double.POSITIVE_INFINITY;
		private int minChordLength = 0;
		private int minKeyLength = 0;
		private double maxChordDuration = Double.POSITIVE_INFINITY;
		private double minChangeProb = 0.0;
		private double maxNoChangeProb = 1.0;
		private int numThreads = 1;
		private long maxDecodeMillis = 0;
		private boolean verbose = false;

		public Builder beamSize(int beamSize) {
			this.beamSize = beamSize;
			return this;
		}
		/**
		 * Hypotheses scoring more than this below the best one are dropped.
		 * Infinity disables the cutoff.
		 */
		public Builder relativeMargin(double relativeMargin) {
			this.relativeMargin = relativeMargin;
			return this;
		}
		public Builder minChordLength(int minChordLength) {
			this.minChordLength = minChordLength;
			return this;
		}
		public Builder minKeyLength(int minKeyLength) {
			this.minKeyLength = minKeyLength;
			return this;
		}
		public Builder maxChordDuration(double maxChordDuration) {
			this.maxChordDuration = maxChordDuration;
			return this;
		}
		public Builder minChangeProb(double minChangeProb) {
			this.minChangeProb = minChangeProb;
			return this;
		}
		public Builder maxNoChangeProb(double maxNoChangeProb) {
			this.maxNoChangeProb = maxNoChangeProb;
			return this;
		}
		public Builder numThreads(int numThreads) {
			this.numThreads = numThreads;
			return this;
		}
		/**
		 * Wall-clock budget for one decode; 0 means unlimited.
		 */
		public Builder maxDecodeMillis(long maxDecodeMillis) {
			this.maxDecodeMillis = maxDecodeMillis;
			return this;
		}
		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}
		public DecoderConfig build() {
			return new DecoderConfig(this);
		}
	}

}
