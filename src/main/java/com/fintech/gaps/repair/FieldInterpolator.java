package com.fintech.gaps.repair;

import com.fintech.gaps.domain.Column;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Per-column fill operations used by {@link RepairEngine}.
 *
 * <p>Every operation computes the complete result before writing anything back,
 * so a failure part-way leaves the column exactly as it was.
 *
 * <p>Interpolation conventions:
 * <ul>
 *   <li>only null cells are written; known values are never changed</li>
 *   <li>nulls before the first known value stay null</li>
 *   <li>nulls after the last known value hold the last known value</li>
 * </ul>
 */
public final class FieldInterpolator {

    /** Known points a natural cubic spline needs. */
    public static final int MIN_SPLINE_POINTS = 4;

    /** Known points linear interpolation needs. */
    public static final int MIN_LINEAR_POINTS = 2;

    private FieldInterpolator() {
    }

    public static int knownCount(Column column) {
        return column.size() - (int) column.nullCount();
    }

    /** Linear interpolation of null cells against {@code x}. */
    public static void linear(Column column, double[] x) {
        interpolate(column, x, new LinearInterpolator());
    }

    /** Natural cubic spline interpolation of null cells against {@code x}. */
    public static void spline(Column column, double[] x) {
        interpolate(column, x, new SplineInterpolator());
    }

    /** Linear interpolation of null cells against row position. */
    public static void byPosition(Column column) {
        double[] x = new double[column.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        linear(column, x);
    }

    /**
     * Replaces nulls with the previous known value.
     *
     * @param limit maximum consecutive nulls filled after each known value
     */
    public static void forwardFill(Column column, int limit) {
        Object[] filled = column.values().toArray();
        Object last = null;
        int run = 0;
        for (int i = 0; i < filled.length; i++) {
            if (filled[i] != null) {
                last = filled[i];
                run = 0;
            } else if (last != null && run < limit) {
                filled[i] = last;
                run++;
            }
        }
        writeBack(column, filled);
    }

    /**
     * Replaces nulls with the next known value.
     *
     * @param limit maximum consecutive nulls filled before each known value
     */
    public static void backwardFill(Column column, int limit) {
        Object[] filled = column.values().toArray();
        Object next = null;
        int run = 0;
        for (int i = filled.length - 1; i >= 0; i--) {
            if (filled[i] != null) {
                next = filled[i];
                run = 0;
            } else if (next != null && run < limit) {
                filled[i] = next;
                run++;
            }
        }
        writeBack(column, filled);
    }

    /**
     * Fills nulls with a centered rolling mean over known values, at least one
     * known value per window. Nulls whose window holds no known value stay null.
     */
    public static void rollingMean(Column column, int window) {
        double[] values = column.toDoubleArray();
        double[] filled = values.clone();
        // even windows lean left of the centre
        int before = window / 2;
        int after = window - 1 - before;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                continue;
            }
            double sum = 0;
            int count = 0;
            for (int j = Math.max(0, i - before); j <= Math.min(values.length - 1, i + after); j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            if (count > 0) {
                filled[i] = sum / count;
            }
        }
        writeBack(column, filled);
    }

    /** Fills every null cell with one value. */
    public static void constant(Column column, double value) {
        double[] filled = column.toDoubleArray();
        for (int i = 0; i < filled.length; i++) {
            if (Double.isNaN(filled[i])) {
                filled[i] = value;
            }
        }
        writeBack(column, filled);
    }

    /** Mean of the known values, NaN if there are none. */
    public static double mean(Column column) {
        double[] known = knownValues(column);
        return known.length == 0 ? Double.NaN : new Mean().evaluate(known);
    }

    /** Median of the known values, NaN if there are none. */
    public static double median(Column column) {
        double[] known = knownValues(column);
        return known.length == 0
            ? Double.NaN
            : new Percentile(50d).withEstimationType(EstimationType.R_7).evaluate(known);
    }

    private static void interpolate(Column column, double[] x, UnivariateInterpolator interpolator) {
        double[] values = column.toDoubleArray();
        int known = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                known++;
            }
        }
        if (known == values.length || known == 0) {
            return;
        }

        double[] knownX = new double[known];
        double[] knownY = new double[known];
        int k = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                knownX[k] = x[i];
                knownY[k] = values[i];
                k++;
            }
        }

        UnivariateFunction function = interpolator.interpolate(knownX, knownY);
        double firstX = knownX[0];
        double lastX = knownX[known - 1];
        double lastY = knownY[known - 1];

        double[] filled = values.clone();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i]) || x[i] < firstX) {
                continue;
            }
            filled[i] = x[i] >= lastX ? lastY : function.value(x[i]);
        }
        writeBack(column, filled);
    }

    private static double[] knownValues(Column column) {
        return Arrays.stream(column.toDoubleArray())
            .filter(v -> !Double.isNaN(v))
            .toArray();
    }

    private static void writeBack(Column column, double[] filled) {
        for (int i = 0; i < filled.length; i++) {
            if (column.isNull(i) && !Double.isNaN(filled[i])) {
                column.setDouble(i, filled[i]);
            }
        }
    }

    private static void writeBack(Column column, Object[] filled) {
        for (int i = 0; i < filled.length; i++) {
            if (column.isNull(i) && filled[i] != null) {
                column.set(i, filled[i]);
            }
        }
    }
}
