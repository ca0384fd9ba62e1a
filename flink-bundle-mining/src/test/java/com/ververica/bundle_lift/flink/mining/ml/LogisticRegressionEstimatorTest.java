package com.ververica.bundle_lift.flink.mining.ml;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LogisticRegressionEstimatorTest {

    /** Outcome 1 exactly when the first feature is above 5; second feature is noise-free constant. */
    private static double[][] features() {
        double[][] x = new double[40][];
        for (int i = 0; i < 40; i++) {
            x[i] = new double[] {i % 10, 3.0};
        }
        return x;
    }

    private static int[] outcomes() {
        int[] y = new int[40];
        for (int i = 0; i < 40; i++) {
            y[i] = (i % 10) > 5 ? 1 : 0;
        }
        return y;
    }

    @Test
    public void separatesClassesTest() {
        LogisticRegressionEstimator estimator = new LogisticRegressionEstimator();
        estimator.fit(features(), outcomes());

        double low = estimator.predictProbability(new double[] {1.0, 3.0});
        double high = estimator.predictProbability(new double[] {9.0, 3.0});

        assertTrue(low < 0.3, "low=" + low);
        assertTrue(high > 0.7, "high=" + high);
        assertTrue(estimator.getFeatureImportance().get(0) > estimator.getFeatureImportance().get(1));
    }

    @Test
    public void deterministicTest() {
        LogisticRegressionEstimator first = new LogisticRegressionEstimator();
        LogisticRegressionEstimator second = new LogisticRegressionEstimator();
        first.fit(features(), outcomes());
        second.fit(features(), outcomes());

        double[] sample = {4.0, 3.0};
        assertEquals(first.predictProbability(sample), second.predictProbability(sample));
    }

    @Test
    public void concurrentTrainingStaysDeterministicTest() throws Exception {
        LogisticRegressionEstimator reference = new LogisticRegressionEstimator();
        reference.fit(features(), outcomes());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Double>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    LogisticRegressionEstimator estimator = new LogisticRegressionEstimator();
                    estimator.fit(features(), outcomes());
                    return estimator.predictProbability(new double[] {4.0, 3.0});
                }));
            }
            for (Future<Double> future : futures) {
                assertEquals(reference.predictProbability(new double[] {4.0, 3.0}), future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void singleClassTest() {
        double[][] x = {{1.0}, {2.0}, {3.0}};
        int[] y = {1, 1, 1};
        LogisticRegressionEstimator estimator = new LogisticRegressionEstimator();
        estimator.fit(x, y);

        double p = estimator.predictProbability(new double[] {2.0});
        assertTrue(p > 0.5 && p <= 1.0);
    }

    @Test
    public void invalidUseTest() {
        LogisticRegressionEstimator estimator = new LogisticRegressionEstimator();

        assertThrows(IllegalStateException.class, () -> estimator.predictProbability(new double[] {1.0}));
        assertThrows(IllegalArgumentException.class, () -> estimator.fit(new double[0][], new int[0]));
        assertThrows(IllegalArgumentException.class, () -> estimator.fit(new double[][] {{1.0}}, new int[] {1, 0}));
        assertThrows(IllegalArgumentException.class, () -> new LogisticRegressionEstimator(0, 0.1f, 0.0f, 1L));
        assertThrows(IllegalArgumentException.class, () -> new LogisticRegressionEstimator(10, 1.5f, 0.0f, 1L));
    }
}
