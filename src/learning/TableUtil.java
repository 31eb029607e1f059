package learning;

import org.jblas.DoubleMatrix;

class TableUtil {

	static DoubleMatrix logNormalizeRows(DoubleMatrix counts, double smoothing) {
		return logNormalizeRows(counts, smoothing, null);
	}

	/**
	 * Row-wise add-smoothed log relative frequencies. If given, excludedColumns[r]
	 * names a column of row r that gets no mass (log-probability -infinity).
	 */
	static DoubleMatrix logNormalizeRows(DoubleMatrix counts, double smoothing, int[] excludedColumns) {
		if (smoothing < 0.0) throw new IllegalArgumentException("Negative smoothing: "+smoothing);
		DoubleMatrix result = new DoubleMatrix(counts.rows, counts.columns);
		for (int r=0; r<counts.rows; ++r) {
			int excluded = (excludedColumns == null ? -1 : excludedColumns[r]);
			double total = 0.0;
			int numColumns = 0;
			for (int c=0; c<counts.columns; ++c) {
				double count = counts.get(r, c);
				if (count < 0.0) throw new IllegalArgumentException("Negative count at ("+r+", "+c+")");
				if (c == excluded) continue;
				total += count + smoothing;
				numColumns++;
			}
			for (int c=0; c<counts.columns; ++c) {
				if (c == excluded) {
					result.put(r, c, Double.NEGATIVE_INFINITY);
				} else if (total == 0.0) {
					result.put(r, c, -Math.log(numColumns));
				} else {
					result.put(r, c, Math.log((counts.get(r, c) + smoothing) / total));
				}
			}
		}
		return result;
	}

}
