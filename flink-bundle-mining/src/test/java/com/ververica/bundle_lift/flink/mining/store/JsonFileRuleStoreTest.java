package com.ververica.bundle_lift.flink.mining.store;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;

import static com.ververica.bundle_lift.flink.mining.TestData.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonFileRuleStoreTest {

    @TempDir
    Path tempDir;

    private static final Context S1_MORNING = Context.overall().withStoreId("S1").withTimeBin("morning");

    @Test
    public void missingFileStartsEmptyTest() {
        JsonFileRuleStore store = JsonFileRuleStore.open(tempDir.resolve("rules.json"));

        assertTrue(store.contexts().isEmpty());
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    public void contentSurvivesReopenTest() {
        Path path = tempDir.resolve("nested").resolve("rules.json");
        ContextualRule breadButter = rule(Arrays.asList("bread"), Arrays.asList("butter"), 0.75, 1.5, S1_MORNING);
        breadButter.setProfitScore(4.5);
        breadButter.setDiversityScore(1.0);
        breadButter.setOverallScore(0.8);

        JsonFileRuleStore store = JsonFileRuleStore.open(path);
        store.replaceContext(S1_MORNING, Arrays.asList(breadButter));
        UpliftResult result = new UpliftResult();
        result.setRuleId(breadButter.getRuleId());
        result.setStatus(UpliftStatus.ESTIMATED);
        result.setIncrementalAttachRate(0.12);
        result.setCiLower(0.05);
        result.setCiUpper(0.2);
        result.setActionable(true);
        store.putUplift(result);

        assertTrue(Files.exists(path));

        JsonFileRuleStore reopened = JsonFileRuleStore.open(path);
        assertEquals(Arrays.asList(S1_MORNING), reopened.contexts());
        ContextualRule loaded = reopened.findRule(breadButter.getRuleId()).orElseThrow();
        assertEquals(breadButter, loaded);
        assertEquals(0.75, loaded.getConfidence(), 1e-9);
        assertEquals(0.8, loaded.getOverallScore(), 1e-9);
        UpliftResult loadedUplift = reopened.uplift(breadButter.getRuleId()).orElseThrow();
        assertEquals(UpliftStatus.ESTIMATED, loadedUplift.getStatus());
        assertEquals(0.12, loadedUplift.getIncrementalAttachRate(), 1e-9);
        assertTrue(loadedUplift.isActionable());
    }

    @Test
    public void orphanedUpliftsPersistedTest() {
        Path path = tempDir.resolve("rules.json");
        Context s2 = Context.overall().withStoreId("S2");
        ContextualRule chipsSoda = rule("chips", "soda", s2);

        JsonFileRuleStore store = JsonFileRuleStore.open(path);
        store.replaceContext(s2, Arrays.asList(chipsSoda));
        store.putUplift(UpliftResult.insufficientData(chipsSoda.getRuleId(), 4, 4));
        store.replaceContext(s2, Arrays.asList(rule("tea", "sugar", s2)));

        JsonFileRuleStore reopened = JsonFileRuleStore.open(path);
        assertTrue(reopened.orphanedUplifts().containsKey(chipsSoda.getRuleId()));
        assertTrue(reopened.uplifts().isEmpty());
    }

    @Test
    public void unwritableLocationFailsTest() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        JsonFileRuleStore store = JsonFileRuleStore.open(blocker.resolve("rules.json"));

        assertThrows(RuleStoreException.class,
            () -> store.replaceContext(S1_MORNING, Arrays.asList(rule("bread", "butter", S1_MORNING))));
    }

    @Test
    public void failedWriteKeepsMemoryUnchangedTest() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        JsonFileRuleStore empty = JsonFileRuleStore.open(blocker.resolve("rules.json"));

        assertThrows(RuleStoreException.class,
            () -> empty.replaceContext(S1_MORNING, Arrays.asList(rule("bread", "butter", S1_MORNING))));
        assertTrue(empty.contexts().isEmpty());
        assertTrue(empty.allRules().isEmpty());
        assertFalse(Files.exists(empty.getPath()));

        Path dir = tempDir.resolve("store");
        JsonFileRuleStore store = JsonFileRuleStore.open(dir.resolve("rules.json"));
        ContextualRule breadButter = rule("bread", "butter", S1_MORNING);
        store.replaceContext(S1_MORNING, Arrays.asList(breadButter));
        UpliftResult estimated = new UpliftResult();
        estimated.setRuleId(breadButter.getRuleId());
        estimated.setStatus(UpliftStatus.ESTIMATED);
        store.putUplift(estimated);

        // a regular file where the store directory was makes every write fail
        Files.delete(store.getPath());
        Files.delete(dir);
        Files.createFile(dir);

        UpliftResult pending = new UpliftResult();
        pending.setRuleId(breadButter.getRuleId());
        pending.setStatus(UpliftStatus.ESTIMATING);
        assertThrows(RuleStoreException.class, () -> store.putUplift(pending));
        assertEquals(UpliftStatus.ESTIMATED, store.uplift(breadButter.getRuleId()).orElseThrow().getStatus());

        assertThrows(RuleStoreException.class, store::clear);
        assertEquals(Arrays.asList(breadButter), store.allRules());
        assertEquals(1, store.uplifts().size());

        assertThrows(RuleStoreException.class, () -> store.replaceAll(new HashMap<>()));
        assertEquals(Arrays.asList(S1_MORNING), store.contexts());
        assertTrue(store.orphanedUplifts().isEmpty());
    }

    @Test
    public void corruptFileFailsOnOpenTest() throws IOException {
        Path path = Files.writeString(tempDir.resolve("rules.json"), "{not json");

        assertThrows(RuleStoreException.class, () -> JsonFileRuleStore.open(path));
    }
}
