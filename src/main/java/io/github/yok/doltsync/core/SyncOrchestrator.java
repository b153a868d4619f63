package io.github.yok.doltsync.core;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.google.common.hash.HashCode;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.dolt.VersionControl;
import io.github.yok.doltsync.exception.ApplyException;
import io.github.yok.doltsync.exception.SyncConnectionException;
import io.github.yok.doltsync.exception.SyncException;
import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.CommitWalk;
import io.github.yok.doltsync.model.CursorKey;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.SyncCursor;
import io.github.yok.doltsync.model.SyncDirection;
import io.github.yok.doltsync.model.SyncPhase;
import io.github.yok.doltsync.model.SyncResult;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.state.SyncStateStore;
import io.github.yok.doltsync.util.CloseableIterator;
import io.github.yok.doltsync.util.JdbcConnections;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one table through the sync pipeline.
 *
 * <p>
 * Each invocation walks the states {@code INIT → RESOLVE_RANGE → EXTRACT → BATCH_APPLY →
 * ADVANCE_CURSOR → DONE}. A failure while extracting or applying leads to {@code FAILED}: the open
 * transaction is rolled back, the cursor keeps its last committed value and the exception is
 * rethrown with the progress made so far. An interrupted thread stops between batches with
 * {@code CANCELLED}.
 * </p>
 *
 * <p>
 * <strong>Forward</strong> (Dolt → RDBMS): the commit range {@code (cursor, to]} is split into
 * steps, one per commit or a single step for {@link CommitWalk#RANGE}. Without a cursor the table
 * is copied from a snapshot at {@code to}. Every batch is applied and the cursor moved in the same
 * target transaction. When a step needs several batches, the cursor records the step and the number
 * of records already applied so that an interrupted run resumes inside the step.
 * </p>
 *
 * <p>
 * <strong>Reverse</strong> (RDBMS → Dolt): the RDBMS table is compared with the Dolt table at
 * {@code HEAD}; each batch of differences is written to Dolt and recorded with a Dolt commit. A ref
 * other than {@code HEAD} names the Dolt branch to write to, which is created from {@code HEAD}
 * when missing. A Dolt table that does not exist yet counts as empty and is created before the
 * first batch. Rows that also changed in Dolt since the cursor commit are conflicts:
 * {@link OnConflictPolicy#IGNORE} keeps the Dolt version, {@link OnConflictPolicy#UPDATE}
 * overwrites it. While ignored conflicts remain, the cursor is not moved, so they are detected
 * again on the next run.
 * </p>
 */
@Slf4j
public class SyncOrchestrator {

    private final SyncSession session;
    private final String doltId;
    private final DiffExtractor extractor;
    private final SnapshotDiffer differ;

    /**
     * Creates an orchestrator for one session.
     *
     * @param session job resources
     * @param doltId identifier of the Dolt database, stored as the source of forward cursors
     */
    public SyncOrchestrator(SyncSession session, String doltId) {
        this.session = session;
        this.doltId = doltId;
        this.extractor = new DiffExtractor(session.getVersionControl());
        this.differ = new SnapshotDiffer();
    }

    /**
     * Synchronizes one table.
     *
     * @param request sync parameters
     * @return outcome with phase {@link SyncPhase#DONE} or {@link SyncPhase#CANCELLED}
     * @throws SyncException on failure, carrying rows applied and the cursor commit
     */
    public SyncResult sync(SyncRequest request) {
        if (request.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batch size must be positive: "
                    + request.getBatchSize());
        }
        CursorKey key = new CursorKey(request.getMapping().getSourceTable(),
                request.getTargetId(), request.getDirection());
        Run run = new Run(key);
        try {
            if (request.getDirection() == SyncDirection.FORWARD) {
                return forward(request, run);
            }
            return reverse(request, run);
        } catch (SyncException e) {
            run.enter(SyncPhase.FAILED);
            log.error("[{}] Sync failed after {} row(s); cursor at {}: {}", key, run.rowsApplied,
                    run.cursorCommit, e.getMessage());
            throw e.attachProgress(run.rowsApplied, run.cursorCommit);
        } catch (RuntimeException e) {
            run.enter(SyncPhase.FAILED);
            log.error("[{}] Sync failed after {} row(s); cursor at {}: {}", key, run.rowsApplied,
                    run.cursorCommit, e.getMessage());
            throw e;
        }
    }

    // ---------------------------------------------------------------------------------------
    // Forward: Dolt -> RDBMS
    // ---------------------------------------------------------------------------------------

    private SyncResult forward(SyncRequest request, Run run) {
        SyncStateStore store = session.getStateStore();
        VersionControl vc = session.getVersionControl();

        run.enter(SyncPhase.INIT);
        store.ensureTable();
        Optional<SyncCursor> cursor = store.get(run.key);
        run.cursorCommit = cursor.map(SyncCursor::getLastCommit).orElse(null);

        run.enter(SyncPhase.RESOLVE_RANGE);
        String to = vc.resolveCommit(request.getToRef());
        List<Step> steps = planSteps(cursor, to, request.getCommitWalk(), run.key);
        log.info("[{}] Range resolved: cursor={}, to={}, steps={}", run.key, run.cursorCommit, to,
                steps.size());

        for (Step step : steps) {
            if (!runStep(request, run, step)) {
                return run.result(to, SyncPhase.CANCELLED);
            }
        }
        run.enter(SyncPhase.DONE);
        log.info("[{}] Sync completed: {} row(s) in {} batch(es), cursor at {}", run.key,
                run.rowsApplied, run.batchesApplied, run.cursorCommit);
        return run.result(to, SyncPhase.DONE);
    }

    /**
     * Splits the range between the cursor and {@code to} into commit steps.
     *
     * @param cursor current cursor
     * @param to resolved target commit
     * @param walk commit walk mode
     * @param key cursor key for logging
     * @return steps in application order; empty when the cursor is already at {@code to}
     */
    List<Step> planSteps(Optional<SyncCursor> cursor, String to, CommitWalk walk,
            CursorKey key) {
        List<Step> steps = new ArrayList<>();
        String last = cursor.map(SyncCursor::getLastCommit).orElse(null);
        if (cursor.isPresent() && cursor.get().hasInFlightStep()) {
            SyncCursor c = cursor.get();
            String pending = session.getVersionControl().resolveCommit(c.getInFlightCommit());
            log.info("[{}] Resuming step {} -> {} at offset {}", key, last, pending,
                    c.getInFlightOffset());
            steps.add(new Step(last, pending, c.getInFlightOffset()));
            last = pending;
        } else if (last == null) {
            steps.add(new Step(null, to, 0));
            return steps;
        }
        if (last.equals(to)) {
            return steps;
        }
        List<String> commits = session.getVersionControl().listCommits(last, to);
        if (commits.isEmpty()) {
            log.warn("[{}] {} is not ahead of {}; nothing to apply", key, to, last);
            return steps;
        }
        if (walk == CommitWalk.RANGE) {
            steps.add(new Step(last, to, 0));
            return steps;
        }
        String previous = last;
        for (String commit : commits) {
            steps.add(new Step(previous, commit, 0));
            previous = commit;
        }
        return steps;
    }

    /**
     * Applies one commit step in batches.
     *
     * @return {@code false} if the thread was interrupted
     */
    private boolean runStep(SyncRequest request, Run run, Step step) {
        TableMapping mapping = request.getMapping();
        run.enter(SyncPhase.EXTRACT);
        try (CloseableIterator<ChangeRecord> records = step.from == null
                ? extractor.snapshot(mapping, step.to)
                : extractor.diff(mapping, step.from, step.to)) {
            PeekingIterator<ChangeRecord> it = Iterators.peekingIterator(records);
            long skipped = 0;
            while (skipped < step.offset && it.hasNext()) {
                it.next();
                skipped++;
            }
            if (skipped < step.offset) {
                log.warn("[{}] Step {} -> {} has only {} record(s), offset was {}", run.key,
                        step.from, step.to, skipped, step.offset);
            }
            long offset = skipped;
            do {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("[{}] Cancelled before batch {}; cursor at {}", run.key,
                            run.batchesApplied + 1, run.cursorCommit);
                    run.enter(SyncPhase.CANCELLED);
                    return false;
                }
                List<ChangeRecord> chunk = new ArrayList<>();
                while (it.hasNext() && chunk.size() < request.getBatchSize()) {
                    chunk.add(it.next());
                }
                Batch batch = new Batch(chunk, step.to, offset, step.from == null);
                applyForward(request, run, step, batch, it.hasNext());
                offset += batch.size();
            } while (it.hasNext());
        }
        return true;
    }

    private void applyForward(SyncRequest request, Run run, Step step, Batch batch,
            boolean stepContinues) {
        TableMapping mapping = request.getMapping();
        Connection target = session.getTargetConnection();
        DialectAdapter adapter = session.getTargetAdapter();
        SyncStateStore store = session.getStateStore();
        run.enter(SyncPhase.BATCH_APPLY);
        try {
            if (!batch.isEmpty()) {
                if (request.isCreateIfNotExists() && !run.tableReady) {
                    if (adapter.createIfNotExists(target, mapping, batch)) {
                        log.info("[{}] Created target table {}", run.key,
                                mapping.getTargetTable());
                    }
                    run.tableReady = true;
                }
                adapter.apply(target, batch, mapping, request.getOnConflict());
            }
            run.enter(SyncPhase.ADVANCE_CURSOR);
            if (stepContinues) {
                store.markInFlight(run.key, doltId, step.from, step.to,
                        batch.getStepOffset() + batch.size());
            } else {
                store.advance(run.key, doltId, step.to);
            }
            target.commit();
        } catch (SQLException e) {
            JdbcConnections.rollbackQuietly(target, run.key.toString());
            throw commitFailure(e);
        } catch (RuntimeException e) {
            JdbcConnections.rollbackQuietly(target, run.key.toString());
            throw e;
        }
        run.committed(batch.size(), stepContinues ? step.from : step.to);
        log.info("[{}] Batch {} applied: {} record(s) of step {} (offset {}), cursor at {}{}",
                run.key, run.batchesApplied, batch.size(), step.to, batch.getStepOffset(),
                run.cursorCommit, stepContinues ? " (step in flight)" : "");
    }

    // ---------------------------------------------------------------------------------------
    // Reverse: RDBMS -> Dolt
    // ---------------------------------------------------------------------------------------

    private SyncResult reverse(SyncRequest request, Run run) {
        TableMapping mapping = request.getMapping();
        SyncStateStore store = session.getStateStore();
        VersionControl vc = session.getVersionControl();
        Connection target = session.getTargetConnection();

        run.enter(SyncPhase.INIT);
        store.ensureTable();
        Optional<SyncCursor> cursor = store.get(run.key);
        run.cursorCommit = cursor.map(SyncCursor::getLastCommit).orElse(null);

        run.enter(SyncPhase.RESOLVE_RANGE);
        if (!"HEAD".equals(request.getToRef())) {
            vc.checkoutBranch(request.getToRef());
            log.info("[{}] Writing to Dolt branch {}", run.key, request.getToRef());
        }
        String head = vc.resolveCommit("HEAD");
        run.tableReady = vc.tableColumns(mapping.getSourceTable(), head).isPresent();
        if (!run.tableReady && !request.isCreateIfNotExists()) {
            extractor.checkColumns(mapping, head, true);
        }

        run.enter(SyncPhase.EXTRACT);
        Set<HashCode> changedInDolt = run.tableReady
                ? changedSince(mapping, run.cursorCommit, head)
                : new HashSet<>();
        List<ChangeRecord> changes = extractReverse(mapping, head, run.tableReady);
        List<ChangeRecord> accepted = new ArrayList<>(changes.size());
        int ignoredConflicts = 0;
        for (ChangeRecord change : changes) {
            if (!changedInDolt.contains(change.getFingerprint())) {
                accepted.add(change);
            } else if (request.getOnConflict() == OnConflictPolicy.IGNORE) {
                ignoredConflicts++;
                log.debug("[{}] Conflict kept Dolt version: {}", run.key, change);
            } else {
                log.debug("[{}] Conflict overwritten in Dolt: {}", run.key, change);
                accepted.add(change);
            }
        }
        if (ignoredConflicts > 0) {
            log.warn("[{}] {} conflicting row(s) kept their Dolt version; cursor stays at {}",
                    run.key, ignoredConflicts, run.cursorCommit);
        }
        log.info("[{}] {} change(s) to write into Dolt at {}", run.key, accepted.size(), head);

        String lastCommit = head;
        TableMapping doltMapping = mapping.reversed();
        for (int start = 0; start < accepted.size(); start += request.getBatchSize()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[{}] Cancelled before batch {}", run.key, run.batchesApplied + 1);
                run.enter(SyncPhase.CANCELLED);
                return run.result(lastCommit, SyncPhase.CANCELLED);
            }
            int end = Math.min(start + request.getBatchSize(), accepted.size());
            Batch batch = new Batch(accepted.subList(start, end), null, start);
            lastCommit = applyReverse(request, run, doltMapping, batch, ignoredConflicts == 0);
        }

        run.enter(SyncPhase.ADVANCE_CURSOR);
        if (ignoredConflicts == 0 && !lastCommit.equals(run.cursorCommit)) {
            try {
                store.advance(run.key, request.getTargetId(), lastCommit);
                target.commit();
            } catch (SQLException e) {
                JdbcConnections.rollbackQuietly(target, run.key.toString());
                throw commitFailure(e);
            }
            run.cursorCommit = lastCommit;
        }
        run.enter(SyncPhase.DONE);
        log.info("[{}] Reverse sync completed: {} row(s) in {} Dolt commit(s), cursor at {}",
                run.key, run.rowsApplied, run.batchesApplied, run.cursorCommit);
        return run.result(lastCommit, SyncPhase.DONE);
    }

    /**
     * Returns the fingerprints of rows changed in Dolt since the cursor commit.
     */
    private Set<HashCode> changedSince(TableMapping mapping, String cursorCommit, String head) {
        Set<HashCode> changed = new HashSet<>();
        if (cursorCommit == null || cursorCommit.equals(head)) {
            return changed;
        }
        try (CloseableIterator<ChangeRecord> diff = extractor.diff(mapping, cursorCommit, head)) {
            diff.forEachRemaining(record -> changed.add(record.getFingerprint()));
        }
        return changed;
    }

    private List<ChangeRecord> extractReverse(TableMapping mapping, String head,
            boolean doltTableExists) {
        DialectAdapter doltAdapter = session.getDoltAdapter();
        Connection target = session.getTargetConnection();
        try (CloseableIterator<ChangeRecord> dolt = doltTableExists
                ? extractor.snapshot(mapping, head)
                : CloseableIterator.<ChangeRecord>of(List.of());
                CloseableIterator<Map<String, Object>> source =
                        differ.readTable(target, session.getTargetAdapter(), mapping)) {
            Iterator<Map<String, Object>> doltRows = Iterators.transform(dolt,
                    record -> SnapshotDiffer.decodeRow(doltAdapter, mapping, record.getNewRow()));
            List<ChangeRecord> changes = differ.diff(mapping, doltRows, source);
            target.commit();
            return changes;
        } catch (SQLException e) {
            JdbcConnections.rollbackQuietly(target, mapping.getTargetTable());
            if (SyncConnectionException.isConnectionFailure(e)) {
                throw new SyncConnectionException("Connection lost reading "
                        + mapping.getTargetTable(), e);
            }
            throw new IllegalStateException("Failed to read " + mapping.getTargetTable() + ": "
                    + e.getMessage(), e);
        }
    }

    private String applyReverse(SyncRequest request, Run run, TableMapping doltMapping,
            Batch batch, boolean advanceCursor) {
        Connection dolt = session.getDoltConnection();
        Connection target = session.getTargetConnection();
        run.enter(SyncPhase.BATCH_APPLY);
        String commit;
        try {
            if (!run.tableReady) {
                if (session.getDoltAdapter().createIfNotExists(dolt, doltMapping, batch)) {
                    log.info("[{}] Created Dolt table {}", run.key, doltMapping.getTargetTable());
                }
                run.tableReady = true;
            }
            session.getDoltAdapter().apply(dolt, batch, doltMapping, OnConflictPolicy.UPDATE);
            commit = session.getVersionControl().commitChanges(
                    "Sync " + doltMapping.getTargetTable() + " from " + request.getTargetId()
                            + " (" + batch.size() + " row(s))",
                    List.of(doltMapping.getTargetTable()));
            dolt.commit();
        } catch (SQLException e) {
            JdbcConnections.rollbackQuietly(dolt, run.key.toString());
            throw commitFailure(e);
        } catch (RuntimeException e) {
            JdbcConnections.rollbackQuietly(dolt, run.key.toString());
            throw e;
        }
        String cursorCommit = run.cursorCommit;
        if (advanceCursor) {
            run.enter(SyncPhase.ADVANCE_CURSOR);
            try {
                session.getStateStore().advance(run.key, request.getTargetId(), commit);
                target.commit();
            } catch (SQLException e) {
                JdbcConnections.rollbackQuietly(target, run.key.toString());
                throw commitFailure(e);
            }
            cursorCommit = commit;
        }
        run.committed(batch.size(), cursorCommit);
        log.info("[{}] Batch {} written to Dolt as commit {}: {} record(s)", run.key,
                run.batchesApplied, commit, batch.size());
        return commit;
    }

    private static SyncException commitFailure(SQLException e) {
        if (SyncConnectionException.isConnectionFailure(e)) {
            return new SyncConnectionException("Connection lost while committing batch", e);
        }
        return new ApplyException("Failed to commit batch: " + e.getMessage(), -1, null, e);
    }

    /**
     * One pair of consecutive commits; {@code from == null} means a full snapshot of {@code to}.
     */
    static final class Step {
        final String from;
        final String to;
        // Records of this step applied by an earlier run
        final long offset;

        Step(String from, String to, long offset) {
            this.from = from;
            this.to = to;
            this.offset = offset;
        }

        @Override
        public String toString() {
            return from + " -> " + to + (offset > 0 ? " @" + offset : "");
        }
    }

    /**
     * Mutable progress of one invocation.
     */
    private static final class Run {
        private final CursorKey key;
        private SyncPhase phase;
        private long rowsApplied;
        private int batchesApplied;
        private String cursorCommit;
        private boolean tableReady;

        private Run(CursorKey key) {
            this.key = key;
        }

        private void enter(SyncPhase next) {
            if (phase != next) {
                log.debug("[{}] {} -> {}", key, phase, next);
                phase = next;
            }
        }

        private void committed(int rows, String cursor) {
            rowsApplied += rows;
            batchesApplied++;
            cursorCommit = cursor;
        }

        private SyncResult result(String finalCommit, SyncPhase finalPhase) {
            return SyncResult.builder().key(key).rowsApplied(rowsApplied)
                    .batchesApplied(batchesApplied).finalCommit(finalCommit)
                    .cursorAdvancedTo(cursorCommit).phase(finalPhase).build();
        }
    }
}
