package com.di.featurenova.pipeline.split;

import com.di.featurenova.pipeline.table.CellValues;
import com.di.featurenova.pipeline.table.FeatureTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Seeded train/test split stratified by the target column.
 *
 * <p>{@code nTest = ceil(testFraction * n)}. Each class gets
 * {@code floor(n_c * nTest / n)} test rows; the rows left over go to the
 * classes with the largest remainders (ties: larger class, then label order).
 * Each class's rows are shuffled with a generator seeded once per split, and
 * the first quota rows go to test. Both partitions keep source row order.
 */
@Slf4j
public class StratifiedSplitter {

    private final double testFraction;
    private final long   seed;

    public StratifiedSplitter(double testFraction, long seed) {
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("testFraction must be in (0, 1), got " + testFraction);
        }
        this.testFraction = testFraction;
        this.seed         = seed;
    }

    /**
     * @throws IllegalArgumentException if the target has missing values, a
     *         class has fewer than two rows, or either partition would be
     *         smaller than the number of classes
     */
    public SplitResult split(FeatureTable table, String targetColumn) {
        int n = table.rowCount();
        int t = table.columnIndex(targetColumn);

        Map<Object, List<Integer>> byClass = new TreeMap<>(LABEL_ORDER);
        for (int r = 0; r < n; r++) {
            Object label = table.value(r, t);
            if (label == null) {
                throw new IllegalArgumentException("Target column '" + targetColumn + "' is missing at row " + r);
            }
            byClass.computeIfAbsent(label, k -> new ArrayList<>()).add(r);
        }
        for (Map.Entry<Object, List<Integer>> e : byClass.entrySet()) {
            if (e.getValue().size() < 2) {
                throw new IllegalArgumentException("Class '" + CellValues.toText(e.getKey())
                        + "' of target '" + targetColumn + "' has " + e.getValue().size()
                        + " row(s); at least 2 are needed to stratify");
            }
        }

        int nTest  = (int) Math.ceil(testFraction * n);
        int nTrain = n - nTest;
        int k      = byClass.size();
        if (nTest < k || nTrain < k) {
            throw new IllegalArgumentException("Cannot stratify " + n + " rows over " + k
                    + " classes with testFraction=" + testFraction + " (train=" + nTrain + ", test=" + nTest + ")");
        }

        List<Object> labels = new ArrayList<>(byClass.keySet());
        int[] quotas = quotas(labels, byClass, n, nTest);

        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        boolean[] inTest = new boolean[n];
        Map<String, Integer> trainCounts = new LinkedHashMap<>();
        Map<String, Integer> testCounts  = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            List<Integer> rows = byClass.get(labels.get(i));
            int[] order = new int[rows.size()];
            for (int j = 0; j < order.length; j++) {
                order[j] = j;
            }
            PermutationSampler.shuffle(rng, order);
            for (int j = 0; j < quotas[i]; j++) {
                inTest[rows.get(order[j])] = true;
            }
            String key = CellValues.toText(labels.get(i));
            testCounts.put(key, quotas[i]);
            trainCounts.put(key, rows.size() - quotas[i]);
        }

        int[] trainRows = new int[nTrain];
        int[] testRows  = new int[nTest];
        int tr = 0, te = 0;
        for (int r = 0; r < n; r++) {
            if (inTest[r]) {
                testRows[te++] = r;
            } else {
                trainRows[tr++] = r;
            }
        }
        log.info("[SPLIT] {} rows -> train={} {} / test={} {} (fraction={}, seed={})",
                n, nTrain, trainCounts, nTest, testCounts, testFraction, seed);
        return new SplitResult(table.select(trainRows), table.select(testRows), trainCounts, testCounts);
    }

    /** Largest-remainder apportionment of {@code nTest} across classes. */
    private static int[] quotas(List<Object> labels, Map<Object, List<Integer>> byClass, int n, int nTest) {
        int k = labels.size();
        int[]  quotas     = new int[k];
        long[] remainders = new long[k];
        int assigned = 0;
        for (int i = 0; i < k; i++) {
            long scaled = (long) byClass.get(labels.get(i)).size() * nTest;
            quotas[i]     = (int) (scaled / n);
            remainders[i] = scaled % n;
            assigned += quotas[i];
        }
        Integer[] order = new Integer[k];
        for (int i = 0; i < k; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator
                .comparingLong((Integer i) -> remainders[i]).reversed()
                .thenComparing(Comparator.comparingInt((Integer i) -> byClass.get(labels.get(i)).size()).reversed())
                .thenComparingInt(i -> i));
        for (int j = 0; assigned < nTest; j = (j + 1) % k) {
            quotas[order[j]]++;
            assigned++;
        }
        return quotas;
    }

    /** Numeric labels compare numerically and sort before text labels. */
    private static final Comparator<Object> LABEL_ORDER = (a, b) -> {
        if (a instanceof Double x && b instanceof Double y) {
            return Double.compare(x, y);
        }
        if (a instanceof Double) {
            return -1;
        }
        if (b instanceof Double) {
            return 1;
        }
        return a.toString().compareTo(b.toString());
    };
}
