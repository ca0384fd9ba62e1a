package com.ververica.bundle_lift.flink.mining.shared.config;

import org.apache.flink.api.java.utils.ParameterTool;

import java.io.IOException;
import java.io.Serializable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the bundle mining pipeline and the Flink mining job.
 *
 * PATTERN: Configuration Management
 * Centralized, immutable configuration with a validating builder, environment
 * variable support and Flink {@link ParameterTool} arguments.
 *
 * Example usage:
 * <pre>{@code
 * // From command line: --min-support 0.02 --weight-profit 0.5 ...
 * BundleMiningConfig config = BundleMiningConfig.fromArgs(args);
 *
 * // Custom configuration
 * BundleMiningConfig config = BundleMiningConfig.builder()
 *     .withMinSupport(0.02)
 *     .withMinContextTransactions(50)
 *     .withWeights(new ScoringWeights(0.25, 0.45, 0.15, 0.15))
 *     .build();
 * }</pre>
 *
 * Invalid values raise {@link ConfigurationException} from {@link Builder#build()}.
 */
public class BundleMiningConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // Mining thresholds
    private final double minSupport;
    private final double minConfidence;
    private final double minLift;

    // Segmentation
    private final int minContextTransactions;
    private final int maxContextDepth;

    // Scoring
    private final ScoringWeights weights;
    private final double defaultMarginPct;
    private final Map<String, Double> categoryMargins;

    // Causal uplift
    private final int upliftTopK;
    private final int minUpliftGroupSize;
    private final double minIncrementalAttachRate;
    private final int bootstrapIterations;
    private final long runSeed;

    // Execution
    private final int parallelism;
    private final int contextRetries;
    private final boolean validationMinerEnabled;
    private final double validationTolerance;

    // Job settings
    private final String jobName;
    private final String storePath;

    private BundleMiningConfig(Builder builder) {
        this.minSupport = builder.minSupport;
        this.minConfidence = builder.minConfidence;
        this.minLift = builder.minLift;
        this.minContextTransactions = builder.minContextTransactions;
        this.maxContextDepth = builder.maxContextDepth;
        this.weights = builder.weights;
        this.defaultMarginPct = builder.defaultMarginPct;
        this.categoryMargins = new HashMap<>(builder.categoryMargins);
        this.upliftTopK = builder.upliftTopK;
        this.minUpliftGroupSize = builder.minUpliftGroupSize;
        this.minIncrementalAttachRate = builder.minIncrementalAttachRate;
        this.bootstrapIterations = builder.bootstrapIterations;
        this.runSeed = builder.runSeed;
        this.parallelism = builder.parallelism;
        this.contextRetries = builder.contextRetries;
        this.validationMinerEnabled = builder.validationMinerEnabled;
        this.validationTolerance = builder.validationTolerance;
        this.jobName = builder.jobName;
        this.storePath = builder.storePath;
    }

    /**
     * Creates a new builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static BundleMiningConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a config from command line arguments. A {@code --config <file>}
     * properties file is loaded first and the arguments override it.
     */
    public static BundleMiningConfig fromArgs(String[] args) throws IOException {
        return fromParameters(mergedParameters(args));
    }

    /**
     * Command line arguments on top of the {@code --config <file>} properties,
     * if given. Job-level options not part of the config are read from here too.
     */
    public static ParameterTool mergedParameters(String[] args) throws IOException {
        ParameterTool params = ParameterTool.fromArgs(args);
        if (params.has("config")) {
            params = ParameterTool.fromPropertiesFile(params.get("config")).mergeWith(params);
        }
        return params;
    }

    /**
     * Creates a config from environment variables.
     *
     * Every parameter key maps to the upper snake case variable, e.g.
     * {@code min-support} → {@code MIN_SUPPORT}, {@code weight-lift} → {@code WEIGHT_LIFT}.
     */
    public static BundleMiningConfig fromEnvironment() {
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, String> env : System.getenv().entrySet()) {
            values.put(env.getKey().toLowerCase(Locale.ROOT).replace('_', '-'), env.getValue());
        }
        return fromParameters(ParameterTool.fromMap(values));
    }

    public static BundleMiningConfig fromParameters(ParameterTool params) {
        Builder defaults = new Builder();
        ScoringWeights w = defaults.weights;

        Builder builder = builder()
            .withMinSupport(params.getDouble("min-support", defaults.minSupport))
            .withMinConfidence(params.getDouble("min-confidence", defaults.minConfidence))
            .withMinLift(params.getDouble("min-lift", defaults.minLift))
            .withMinContextTransactions(params.getInt("min-context-transactions", defaults.minContextTransactions))
            .withMaxContextDepth(params.getInt("max-context-depth", defaults.maxContextDepth))
            .withWeights(new ScoringWeights(
                params.getDouble("weight-lift", w.getLift()),
                params.getDouble("weight-profit", w.getProfit()),
                params.getDouble("weight-diversity", w.getDiversity()),
                params.getDouble("weight-confidence", w.getConfidence())))
            .withDefaultMarginPct(params.getDouble("default-margin-pct", defaults.defaultMarginPct))
            .withUpliftTopK(params.getInt("uplift-top-k", defaults.upliftTopK))
            .withMinUpliftGroupSize(params.getInt("min-uplift-group-size", defaults.minUpliftGroupSize))
            .withMinIncrementalAttachRate(params.getDouble("min-incremental-attach-rate", defaults.minIncrementalAttachRate))
            .withBootstrapIterations(params.getInt("bootstrap-iterations", defaults.bootstrapIterations))
            .withRunSeed(params.getLong("run-seed", defaults.runSeed))
            .withParallelism(params.getInt("parallelism", defaults.parallelism))
            .withContextRetries(params.getInt("context-retries", defaults.contextRetries))
            .withValidationMiner(params.getBoolean("validation-miner", defaults.validationMinerEnabled))
            .withValidationTolerance(params.getDouble("validation-tolerance", defaults.validationTolerance))
            .withJobName(params.get("job-name", defaults.jobName))
            .withStorePath(params.get("store-path", defaults.storePath));

        // category-margin.<category>=<fraction>
        for (Map.Entry<String, String> entry : params.toMap().entrySet()) {
            if (entry.getKey().startsWith("category-margin.")) {
                String category = entry.getKey().substring("category-margin.".length());
                builder.withCategoryMargin(category, parseDouble(entry.getKey(), entry.getValue()));
            }
        }
        return builder.build();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not a number for " + key + ": " + value, e);
        }
    }

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException if configuration is invalid
     */
    public void validate() {
        if (!(minSupport > 0.0 && minSupport <= 1.0)) {
            throw new ConfigurationException("min-support must be in (0,1]: " + minSupport);
        }
        if (!(minConfidence > 0.0 && minConfidence <= 1.0)) {
            throw new ConfigurationException("min-confidence must be in (0,1]: " + minConfidence);
        }
        if (minLift < 0.0 || Double.isNaN(minLift)) {
            throw new ConfigurationException("min-lift must be non-negative: " + minLift);
        }
        if (minContextTransactions <= 0) {
            throw new ConfigurationException("min-context-transactions must be positive: " + minContextTransactions);
        }
        if (maxContextDepth < 0 || maxContextDepth > 2) {
            throw new ConfigurationException("max-context-depth must be 0, 1 or 2: " + maxContextDepth);
        }
        if (weights == null) {
            throw new ConfigurationException("Scoring weights are required");
        }
        checkMargin("default-margin-pct", defaultMarginPct);
        for (Map.Entry<String, Double> entry : categoryMargins.entrySet()) {
            checkMargin("category-margin." + entry.getKey(), entry.getValue());
        }
        if (upliftTopK < 1) {
            throw new ConfigurationException("uplift-top-k must be at least 1: " + upliftTopK);
        }
        if (minUpliftGroupSize < 2) {
            throw new ConfigurationException("min-uplift-group-size must be at least 2: " + minUpliftGroupSize);
        }
        if (Double.isNaN(minIncrementalAttachRate) || Math.abs(minIncrementalAttachRate) > 1.0) {
            throw new ConfigurationException(
                "min-incremental-attach-rate must be in [-1,1]: " + minIncrementalAttachRate);
        }
        if (bootstrapIterations < 0) {
            throw new ConfigurationException("bootstrap-iterations must be non-negative: " + bootstrapIterations);
        }
        if (parallelism <= 0) {
            throw new ConfigurationException("parallelism must be positive: " + parallelism);
        }
        if (contextRetries < 0) {
            throw new ConfigurationException("context-retries must be non-negative: " + contextRetries);
        }
        if (validationTolerance < 0.0 || Double.isNaN(validationTolerance)) {
            throw new ConfigurationException("validation-tolerance must be non-negative: " + validationTolerance);
        }
    }

    private static void checkMargin(String key, double margin) {
        if (margin < 0.0 || margin > 1.0 || Double.isNaN(margin)) {
            throw new ConfigurationException(key + " must be a fraction in [0,1]: " + margin);
        }
    }

    // Getters
    public double getMinSupport() {
        return minSupport;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getMinLift() {
        return minLift;
    }

    public int getMinContextTransactions() {
        return minContextTransactions;
    }

    public int getMaxContextDepth() {
        return maxContextDepth;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public double getDefaultMarginPct() {
        return defaultMarginPct;
    }

    public Map<String, Double> getCategoryMargins() {
        return new HashMap<>(categoryMargins);
    }

    public int getUpliftTopK() {
        return upliftTopK;
    }

    public int getMinUpliftGroupSize() {
        return minUpliftGroupSize;
    }

    public double getMinIncrementalAttachRate() {
        return minIncrementalAttachRate;
    }

    public int getBootstrapIterations() {
        return bootstrapIterations;
    }

    public long getRunSeed() {
        return runSeed;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getContextRetries() {
        return contextRetries;
    }

    public boolean isValidationMinerEnabled() {
        return validationMinerEnabled;
    }

    public double getValidationTolerance() {
        return validationTolerance;
    }

    public String getJobName() {
        return jobName;
    }

    public String getStorePath() {
        return storePath;
    }

    @Override
    public String toString() {
        return "BundleMiningConfig{" +
               "minSupport=" + minSupport +
               ", minConfidence=" + minConfidence +
               ", minLift=" + minLift +
               ", minContextTransactions=" + minContextTransactions +
               ", maxContextDepth=" + maxContextDepth +
               ", weights=" + weights +
               ", upliftTopK=" + upliftTopK +
               ", runSeed=" + runSeed +
               ", parallelism=" + parallelism +
               ", storePath='" + storePath + '\'' +
               '}';
    }

    /**
     * Builder for BundleMiningConfig with fluent API.
     */
    public static class Builder {
        // Defaults
        private double minSupport = 0.01;
        private double minConfidence = 0.3;
        private double minLift = 0.0;

        private int minContextTransactions = 100;
        private int maxContextDepth = 2;

        private ScoringWeights weights = ScoringWeights.DEFAULT;
        private double defaultMarginPct = 0.25;
        private final Map<String, Double> categoryMargins = new HashMap<>();

        private int upliftTopK = 20;
        private int minUpliftGroupSize = 20;
        private double minIncrementalAttachRate = 0.05;
        private int bootstrapIterations = 20;
        private long runSeed = 42L;

        private int parallelism = 4;
        private int contextRetries = 1;
        private boolean validationMinerEnabled = false;
        private double validationTolerance = 1e-9;

        private String jobName = "Bundle Mining Job";
        private String storePath = "/tmp/bundle-lift/store.json";

        private Builder() {}

        public Builder withMinSupport(double minSupport) {
            this.minSupport = minSupport;
            return this;
        }

        public Builder withMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder withMinLift(double minLift) {
            this.minLift = minLift;
            return this;
        }

        public Builder withMinContextTransactions(int minContextTransactions) {
            this.minContextTransactions = minContextTransactions;
            return this;
        }

        public Builder withMaxContextDepth(int maxContextDepth) {
            this.maxContextDepth = maxContextDepth;
            return this;
        }

        public Builder withWeights(ScoringWeights weights) {
            this.weights = Objects.requireNonNull(weights);
            return this;
        }

        public Builder withDefaultMarginPct(double defaultMarginPct) {
            this.defaultMarginPct = defaultMarginPct;
            return this;
        }

        public Builder withCategoryMargin(String category, double marginPct) {
            this.categoryMargins.put(Objects.requireNonNull(category), marginPct);
            return this;
        }

        public Builder withUpliftTopK(int upliftTopK) {
            this.upliftTopK = upliftTopK;
            return this;
        }

        public Builder withMinUpliftGroupSize(int minUpliftGroupSize) {
            this.minUpliftGroupSize = minUpliftGroupSize;
            return this;
        }

        public Builder withMinIncrementalAttachRate(double minIncrementalAttachRate) {
            this.minIncrementalAttachRate = minIncrementalAttachRate;
            return this;
        }

        public Builder withBootstrapIterations(int bootstrapIterations) {
            this.bootstrapIterations = bootstrapIterations;
            return this;
        }

        public Builder withRunSeed(long runSeed) {
            this.runSeed = runSeed;
            return this;
        }

        public Builder withParallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder withContextRetries(int contextRetries) {
            this.contextRetries = contextRetries;
            return this;
        }

        public Builder withValidationMiner(boolean enabled) {
            this.validationMinerEnabled = enabled;
            return this;
        }

        public Builder withValidationTolerance(double validationTolerance) {
            this.validationTolerance = validationTolerance;
            return this;
        }

        public Builder withJobName(String jobName) {
            this.jobName = Objects.requireNonNull(jobName);
            return this;
        }

        public Builder withStorePath(String storePath) {
            this.storePath = Objects.requireNonNull(storePath);
            return this;
        }

        public BundleMiningConfig build() {
            BundleMiningConfig config = new BundleMiningConfig(this);
            config.validate();
            return config;
        }
    }
}
