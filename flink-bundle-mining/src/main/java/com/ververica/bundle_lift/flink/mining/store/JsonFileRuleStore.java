package com.ververica.bundle_lift.flink.mining.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rule store backed by a single JSON file.
 *
 * The file is loaded when the store is opened and rewritten after every
 * mutation: the snapshot goes to a temp file in the same directory which
 * is then moved over the target, so readers never see a half-written file.
 *
 * Any I/O failure surfaces as {@link RuleStoreException}. A mutation whose
 * write fails is rolled back, so memory always matches the last file written.
 */
public class JsonFileRuleStore implements RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileRuleStore.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final InMemoryRuleStore state = new InMemoryRuleStore();

    private JsonFileRuleStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Opens the store at path, loading its content if the file exists.
     */
    public static JsonFileRuleStore open(Path path) {
        JsonFileRuleStore store = new JsonFileRuleStore(path);
        store.load();
        return store;
    }

    private void load() {
        if (!Files.exists(path)) {
            LOG.info("No rule store at {}, starting empty", path);
            return;
        }
        try {
            StoreSnapshot snapshot = mapper.readValue(path.toFile(), StoreSnapshot.class);
            state.restore(snapshot);
            LOG.info("Loaded rule store from {}: {} contexts, {} uplift results",
                path, snapshot.contexts.size(), snapshot.uplifts.size());
        } catch (IOException e) {
            throw new RuleStoreException("Failed to read rule store " + path, e);
        }
    }

    private synchronized void persist() {
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                mapper.writeValue(temp.toFile(), state.snapshot());
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            LOG.error("Failed to write rule store {}: {}", path, e.getMessage());
            throw new RuleStoreException("Failed to write rule store " + path, e);
        }
    }

    /**
     * Applies a change to memory and writes it out, restoring the previous
     * content if either step fails.
     */
    private synchronized void mutate(Runnable change) {
        StoreSnapshot before = state.snapshot();
        try {
            change.run();
            persist();
        } catch (RuntimeException e) {
            state.restore(before);
            throw e;
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, replacing non-atomically", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public synchronized void replaceContext(Context context, List<ContextualRule> rules) {
        mutate(() -> state.replaceContext(context, rules));
    }

    @Override
    public synchronized void replaceAll(Map<Context, List<ContextualRule>> rulesByContext) {
        mutate(() -> state.replaceAll(rulesByContext));
    }

    @Override
    public List<Context> contexts() {
        return state.contexts();
    }

    @Override
    public List<ContextualRule> allRules() {
        return state.allRules();
    }

    @Override
    public List<ContextualRule> query(RuleQuery query) {
        return state.query(query);
    }

    @Override
    public Optional<ContextualRule> findRule(String ruleId) {
        return state.findRule(ruleId);
    }

    @Override
    public synchronized void putUplift(UpliftResult result) {
        mutate(() -> state.putUplift(result));
    }

    @Override
    public synchronized boolean cancelEstimation(String ruleId) {
        if (!state.uplift(ruleId).map(r -> r.getStatus() == UpliftStatus.ESTIMATING).orElse(false)) {
            return false;
        }
        mutate(() -> state.cancelEstimation(ruleId));
        return true;
    }

    @Override
    public Optional<UpliftResult> uplift(String ruleId) {
        return state.uplift(ruleId);
    }

    @Override
    public Map<String, UpliftResult> uplifts() {
        return state.uplifts();
    }

    @Override
    public Map<String, UpliftResult> orphanedUplifts() {
        return state.orphanedUplifts();
    }

    @Override
    public synchronized void clear() {
        mutate(() -> state.clear());
    }

    public Path getPath() {
        return path;
    }
}
