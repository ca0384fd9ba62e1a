package com.ververica.bundle_lift.flink.mining.ml;

import deepnetts.data.TabularDataSet;
import deepnetts.net.FeedForwardNetwork;
import deepnetts.net.layers.activation.ActivationType;
import deepnetts.net.loss.LossType;
import deepnetts.net.train.BackpropagationTrainer;
import deepnetts.net.train.opt.OptimizerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Logistic regression as a DeepNetts feed-forward network.
 *
 * ARCHITECTURE:
 * <pre>
 * input (n z-scored features) → output (1 unit, SIGMOID)
 * P(outcome = 1) = σ(b + w₁x₁ + ... + wₙxₙ)
 * </pre>
 *
 * Trained by the network's {@link BackpropagationTrainer} with cross-entropy
 * loss, plain SGD and L2 regularization. Weights are initialized from a fixed
 * seed, the training set is never shuffled and the trainer always runs the
 * full number of epochs, so the same input always yields the same model.
 *
 * Feature means and standard deviations are taken from the training set and
 * applied again at prediction time.
 */
public class LogisticRegressionEstimator implements OutcomeEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(LogisticRegressionEstimator.class);

    public static final int DEFAULT_EPOCHS = 200;
    public static final float DEFAULT_LEARNING_RATE = 0.05f;
    public static final float DEFAULT_L2 = 0.001f;
    public static final long DEFAULT_SEED = 42L;

    // DeepNetts seeds one process-wide generator; building must not interleave
    private static final Object NETWORK_INIT_LOCK = new Object();

    private final int epochs;
    private final float learningRate;
    private final float l2;
    private final long seed;

    private FeedForwardNetwork network;
    private double[] featureMeans;
    private double[] featureStdDevs;

    public LogisticRegressionEstimator() {
        this(DEFAULT_EPOCHS, DEFAULT_LEARNING_RATE, DEFAULT_L2, DEFAULT_SEED);
    }

    public LogisticRegressionEstimator(int epochs, float learningRate, float l2, long seed) {
        if (epochs < 1 || learningRate <= 0.0f || learningRate > 1.0f || l2 < 0.0f) {
            throw new IllegalArgumentException(String.format(
                "Invalid hyper-parameters: epochs=%d, learningRate=%f, l2=%f", epochs, learningRate, l2));
        }
        this.epochs = epochs;
        this.learningRate = learningRate;
        this.l2 = l2;
        this.seed = seed;
    }

    @Override
    public void fit(double[][] features, int[] outcomes) {
        if (features.length == 0 || features.length != outcomes.length) {
            throw new IllegalArgumentException(String.format(
                "Need matching non-empty samples, got %d feature rows and %d outcomes",
                features.length, outcomes.length));
        }
        int width = features[0].length;
        for (int i = 0; i < features.length; i++) {
            if (features[i].length != width) {
                throw new IllegalArgumentException("Row " + i + " has width " + features[i].length + ", expected " + width);
            }
        }

        computeNormalization(features, width);

        TabularDataSet<TabularDataSet.Item> trainingSet = new TabularDataSet<>(width, 1);
        for (int i = 0; i < features.length; i++) {
            trainingSet.add(new TabularDataSet.Item(
                normalizeFeatures(features[i]),
                new float[] {outcomes[i] == 1 ? 1.0f : 0.0f}));
        }

        FeedForwardNetwork model = buildNetwork(width);
        BackpropagationTrainer trainer = model.getTrainer();
        trainer.setMaxEpochs(epochs);
        trainer.setMaxError(0.0f);
        trainer.setLearningRate(learningRate);
        trainer.setL2Regularization(l2);
        trainer.setOptimizer(OptimizerType.SGD);
        trainer.setShuffle(false);
        trainer.setEarlyStopping(false);

        model.train(trainingSet);
        this.network = model;

        LOG.debug("Trained outcome network on {} samples, {} features, loss={}",
            features.length, width, trainer.getTrainingLoss());
    }

    private FeedForwardNetwork buildNetwork(int width) {
        synchronized (NETWORK_INIT_LOCK) {
            return FeedForwardNetwork.builder()
                .addInputLayer(width)
                .addOutputLayer(1, ActivationType.SIGMOID)
                .lossFunction(LossType.CROSS_ENTROPY)
                .randomSeed(seed)
                .build();
        }
    }

    @Override
    public double predictProbability(double[] features) {
        if (network == null) {
            throw new IllegalStateException("Estimator has not been fitted");
        }
        float p = network.predict(normalizeFeatures(features))[0];
        return Math.max(0.0, Math.min(1.0, p));
    }

    private void computeNormalization(double[][] features, int width) {
        featureMeans = new double[width];
        featureStdDevs = new double[width];
        int n = features.length;
        for (double[] row : features) {
            for (int j = 0; j < width; j++) {
                featureMeans[j] += row[j] / n;
            }
        }
        for (double[] row : features) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - featureMeans[j];
                featureStdDevs[j] += d * d / n;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(featureStdDevs[j]);
            // constant feature: leave it centered at 0
            featureStdDevs[j] = std > 0.0 ? std : 1.0;
        }
    }

    private float[] normalizeFeatures(double[] features) {
        float[] normalized = new float[features.length];
        for (int i = 0; i < features.length; i++) {
            normalized[i] = (float) ((features[i] - featureMeans[i]) / featureStdDevs[i]);
        }
        return normalized;
    }

    /**
     * Sensitivity of the predicted probability to each feature, measured as
     * the change between -1 and +1 standard deviation with the others at their mean.
     */
    public Map<Integer, Double> getFeatureImportance() {
        Map<Integer, Double> importance = new HashMap<>();
        if (network == null) {
            return importance;
        }
        for (int i = 0; i < featureMeans.length; i++) {
            float[] low = new float[featureMeans.length];
            float[] high = new float[featureMeans.length];
            low[i] = -1.0f;
            high[i] = 1.0f;
            importance.put(i, (double) Math.abs(network.predict(high)[0] - network.predict(low)[0]));
        }
        return importance;
    }
}
