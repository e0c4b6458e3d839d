package tw.gc.quant.engine.statistics;

import java.util.List;
import java.util.Objects;

/**
 * Johansen cointegration test specialised to two series.
 *
 * <p>Fits a VECM with one lag and an unrestricted constant: both {@code ΔY[t]} and
 * {@code Y[t-1]} are demeaned, the residual moment matrices S00, S01, S11 are formed, and the
 * eigenvalues of {@code S11^-1 S10 S00^-1 S01} are obtained in closed form. The rank is the
 * first hypothesis the trace statistic fails to reject at the 5% level; the max-eigenvalue
 * statistics give a second rank through the same sequential procedure.
 */
public final class JohansenCointegration {

    public static final int MIN_OBSERVATIONS = 40;

    // Osterwald-Lenum 5% critical values, two variables, constant
    static final double TRACE_CRITICAL_R0 = 15.41;
    static final double TRACE_CRITICAL_R1 = 3.76;
    static final double MAX_EIGEN_CRITICAL_R0 = 14.07;
    static final double MAX_EIGEN_CRITICAL_R1 = 3.76;

    private static final double SINGULAR_TOLERANCE = 1e-10;
    private static final double MAX_EIGENVALUE = 1.0 - 1e-12;

    private JohansenCointegration() {
        throw new AssertionError("Utility class");
    }

    public static JohansenResult test(double[] seriesA, double[] seriesB) {
        Objects.requireNonNull(seriesA, "seriesA");
        Objects.requireNonNull(seriesB, "seriesB");
        int n = Math.min(seriesA.length, seriesB.length);
        if (n < MIN_OBSERVATIONS) {
            return JohansenResult.notTestable("Insufficient data: " + n + " < " + MIN_OBSERVATIONS + " observations");
        }
        double[] a = TimeSeriesStatistics.tail(seriesA, n);
        double[] b = TimeSeriesStatistics.tail(seriesB, n);

        int t = n - 1;
        double[][] r0 = new double[t][2];
        double[][] r1 = new double[t][2];
        for (int i = 1; i < n; i++) {
            r0[i - 1][0] = a[i] - a[i - 1];
            r0[i - 1][1] = b[i] - b[i - 1];
            r1[i - 1][0] = a[i - 1];
            r1[i - 1][1] = b[i - 1];
        }
        demeanColumns(r0);
        demeanColumns(r1);

        double[][] s00 = moment(r0, r0, t);
        double[][] s11 = moment(r1, r1, t);
        double[][] s01 = moment(r0, r1, t);
        double[][] s10 = transpose(s01);

        double[][] s00Inverse = invert(s00);
        double[][] s11Inverse = invert(s11);
        if (s00Inverse == null || s11Inverse == null) {
            return JohansenResult.notTestable("Singular moment matrix");
        }

        double[][] m = multiply(multiply(multiply(s11Inverse, s10), s00Inverse), s01);
        double trace = m[0][0] + m[1][1];
        double det = m[0][0] * m[1][1] - m[0][1] * m[1][0];
        double discriminant = Math.max(trace * trace - 4.0 * det, 0.0);
        double root = Math.sqrt(discriminant);
        double lambda1 = clampEigenvalue((trace + root) / 2.0);
        double lambda2 = clampEigenvalue((trace - root) / 2.0);

        double maxEigen0 = -t * Math.log(1.0 - lambda1);
        double maxEigen1 = -t * Math.log(1.0 - lambda2);
        double trace0 = maxEigen0 + maxEigen1;
        double trace1 = maxEigen1;

        int rank = traceRank(trace0, trace1);

        return new JohansenResult(
                rank,
                maxEigenRank(maxEigen0, maxEigen1),
                List.of(trace0, trace1),
                List.of(maxEigen0, maxEigen1),
                List.of(lambda1, lambda2),
                rank >= 1,
                null
        );
    }

    static int traceRank(double trace0, double trace1) {
        return sequentialRank(trace0, TRACE_CRITICAL_R0, trace1, TRACE_CRITICAL_R1);
    }

    static int maxEigenRank(double maxEigen0, double maxEigen1) {
        return sequentialRank(maxEigen0, MAX_EIGEN_CRITICAL_R0, maxEigen1, MAX_EIGEN_CRITICAL_R1);
    }

    private static int sequentialRank(double stat0, double critical0, double stat1, double critical1) {
        if (stat0 <= critical0) {
            return 0;
        }
        return stat1 > critical1 ? 2 : 1;
    }

    private static double clampEigenvalue(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, MAX_EIGENVALUE);
    }

    private static void demeanColumns(double[][] rows) {
        for (int col = 0; col < 2; col++) {
            double sum = 0.0;
            for (double[] row : rows) {
                sum += row[col];
            }
            double mean = sum / rows.length;
            for (double[] row : rows) {
                row[col] -= mean;
            }
        }
    }

    private static double[][] moment(double[][] left, double[][] right, int t) {
        double[][] result = new double[2][2];
        for (int i = 0; i < left.length; i++) {
            for (int r = 0; r < 2; r++) {
                for (int c = 0; c < 2; c++) {
                    result[r][c] += left[i][r] * right[i][c];
                }
            }
        }
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                result[r][c] /= t;
            }
        }
        return result;
    }

    private static double[][] invert(double[][] matrix) {
        double det = matrix[0][0] * matrix[1][1] - matrix[0][1] * matrix[1][0];
        double scale = Math.abs(matrix[0][0] * matrix[1][1]);
        if (scale == 0.0 || Math.abs(det) <= SINGULAR_TOLERANCE * scale) {
            return null;
        }
        return new double[][]{
                {matrix[1][1] / det, -matrix[0][1] / det},
                {-matrix[1][0] / det, matrix[0][0] / det}
        };
    }

    private static double[][] transpose(double[][] matrix) {
        return new double[][]{
                {matrix[0][0], matrix[1][0]},
                {matrix[0][1], matrix[1][1]}
        };
    }

    private static double[][] multiply(double[][] left, double[][] right) {
        double[][] result = new double[2][2];
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                result[r][c] = left[r][0] * right[0][c] + left[r][1] * right[1][c];
            }
        }
        return result;
    }
}
