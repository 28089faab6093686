package com.di.featurenova.pipeline.drift;

import com.di.featurenova.pipeline.error.DriftComputationException;
import com.di.featurenova.pipeline.table.ColumnKind;
import com.di.featurenova.pipeline.table.FeatureTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-sample Kolmogorov-Smirnov drift test between the train and test
 * partitions, one entry per column present in both (train column order).
 *
 * <p>A column's test failure is recorded as a not-applicable entry; it never
 * fails the whole report.
 */
@Slf4j
public class DriftDetector {

    private final double alpha;

    public DriftDetector(double alpha) {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1), got " + alpha);
        }
        this.alpha = alpha;
    }

    public double alpha() {
        return alpha;
    }

    public DriftReport detect(FeatureTable train, FeatureTable test) {
        List<ColumnDrift> entries = new ArrayList<>();
        for (String column : train.columns()) {
            if (!test.hasColumn(column)) {
                continue;
            }
            if (train.kind(column) != ColumnKind.NUMERIC || test.kind(column) != ColumnKind.NUMERIC) {
                entries.add(ColumnDrift.notApplicable(column, "non-numeric column",
                        train.rowCount(), test.rowCount()));
                continue;
            }
            double[] a = train.observedNumeric(column);
            double[] b = test.observedNumeric(column);
            try {
                entries.add(test(column, a, b));
            } catch (DriftComputationException e) {
                log.warn("[DRIFT] {}", e.getMessage());
                entries.add(ColumnDrift.notApplicable(column, e.getMessage(), a.length, b.length));
            }
        }
        DriftReport report = new DriftReport(alpha, entries);
        log.info("[DRIFT] {} columns tested, drifted={}", entries.size(), report.driftedColumns());
        return report;
    }

    ColumnDrift test(String column, double[] train, double[] test) {
        if (train.length < 2 || test.length < 2) {
            throw new DriftComputationException(column, "need at least 2 observed values per partition (train="
                    + train.length + ", test=" + test.length + ")", null);
        }
        try {
            KolmogorovSmirnovTest ks = new KolmogorovSmirnovTest();
            double statistic = ks.kolmogorovSmirnovStatistic(train, test);
            double pValue    = ks.kolmogorovSmirnovTest(train, test);
            if (Double.isNaN(statistic) || Double.isNaN(pValue)) {
                throw new DriftComputationException(column, "test returned NaN", null);
            }
            return ColumnDrift.tested(column, statistic, pValue, alpha, train.length, test.length);
        } catch (MathIllegalArgumentException | MathIllegalStateException | ArithmeticException e) {
            throw new DriftComputationException(column, e.getMessage(), e);
        }
    }
}
