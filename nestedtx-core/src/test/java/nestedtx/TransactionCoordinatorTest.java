package nestedtx;

import nestedtx.RecordingTransactionSource.RecordingTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionCoordinatorTest {

    private RecordingTransactionSource source;
    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        source = new RecordingTransactionSource();
        coordinator = new TransactionCoordinator(source);
    }

    @Test
    void constructorRejectsNullSource() {
        assertThrows(NullPointerException.class, () -> new TransactionCoordinator(null));
    }

    @Test
    void startBeginsRealTransaction() {
        TxScope scope = coordinator.start(TxScope.empty());

        assertTrue(coordinator.isActive(scope));
        assertEquals(0, coordinator.depth(scope));
        assertSame(source.transactions.get(0), coordinator.getActive(scope));
        assertEquals(List.of("BEGIN"), source.statements);
        assertFalse(coordinator.isActive(TxScope.empty()));
    }

    @Test
    void nestedStartCreatesSavepointOnSameScope() {
        TxScope outer = coordinator.start(TxScope.empty());
        TxScope inner = coordinator.start(outer);

        assertSame(outer, inner);
        assertEquals(1, coordinator.depth(outer));
        assertEquals(1, source.transactions.size());
        assertEquals(List.of("BEGIN", "SAVEPOINT SP1"), source.statements);
    }

    @Test
    void depthFollowsNestedStartsAndCommits() {
        TxScope scope = coordinator.start(TxScope.empty());
        for (int i = 1; i <= 5; i++) {
            coordinator.start(scope);
            assertEquals(i, coordinator.depth(scope));
        }
        for (int i = 4; i >= 0; i--) {
            scope = coordinator.commit(scope);
            assertEquals(i, coordinator.depth(scope));
        }

        TxScope finished = coordinator.commit(scope);

        assertFalse(coordinator.isActive(finished));
        assertEquals("RELEASE SAVEPOINT SP5", source.statements.get(6));
        assertEquals("RELEASE SAVEPOINT SP1", source.statements.get(10));
        assertEquals("COMMIT", source.statements.get(11));
    }

    @Test
    void innerRollbackThenOuterCommit() {
        TxScope scope = coordinator.start(TxScope.empty());
        coordinator.start(scope);
        coordinator.rollback(scope);
        coordinator.commit(scope);

        assertEquals(List.of("BEGIN", "SAVEPOINT SP1", "ROLLBACK TO SAVEPOINT SP1", "COMMIT"),
                source.statements);
    }

    @Test
    void savepointNumbersAreNeverReused() {
        TxScope scope = coordinator.start(TxScope.empty());
        coordinator.start(scope);
        coordinator.commit(scope);
        coordinator.start(scope);
        coordinator.start(scope);
        coordinator.rollback(scope);
        coordinator.commit(scope);
        coordinator.commit(scope);

        assertEquals(List.of(
                "BEGIN",
                "SAVEPOINT SP1",
                "RELEASE SAVEPOINT SP1",
                "SAVEPOINT SP2",
                "SAVEPOINT SP3",
                "ROLLBACK TO SAVEPOINT SP3",
                "RELEASE SAVEPOINT SP2",
                "COMMIT"), source.statements);
    }

    @Test
    void finalCommitClearsBindingAndReleasesTransaction() {
        TxScope scope = coordinator.start(TxScope.empty());

        TxScope finished = coordinator.commit(scope);

        assertNotSame(scope, finished);
        assertTrue(finished.isEmpty());
        assertEquals(1, source.transactions.get(0).releases.get());
    }

    @Test
    void finalRollbackClearsBindingAndReleasesTransaction() {
        TxScope scope = coordinator.start(TxScope.empty());

        TxScope finished = coordinator.rollback(scope);

        assertFalse(coordinator.isActive(finished));
        assertEquals(List.of("BEGIN", "ROLLBACK"), source.statements);
        assertEquals(1, source.transactions.get(0).releases.get());
    }

    @Test
    void operationsWithoutTransactionFail() {
        TxScope empty = TxScope.empty();

        assertThrows(NoActiveTransactionException.class, () -> coordinator.commit(empty));
        assertThrows(NoActiveTransactionException.class, () -> coordinator.rollback(empty));
        assertThrows(NoActiveTransactionException.class, () -> coordinator.depth(empty));
        assertNull(coordinator.getActive(empty));
        assertTrue(source.statements.isEmpty());
    }

    @Test
    void staleScopeBehavesAsIfNoTransactionWasStarted() {
        TxScope scope = coordinator.start(TxScope.empty());
        coordinator.commit(scope);

        // scope still references the finalized transaction
        assertFalse(coordinator.isActive(scope));
        assertNull(coordinator.getActive(scope));
        assertThrows(NoActiveTransactionException.class, () -> coordinator.commit(scope));
        assertThrows(NoActiveTransactionException.class, () -> coordinator.rollback(scope));

        TxScope restarted = coordinator.start(scope);

        assertTrue(coordinator.isActive(restarted));
        assertEquals(0, coordinator.depth(restarted));
        assertEquals(List.of("BEGIN", "COMMIT", "BEGIN"), source.statements);
        assertEquals(1, source.transactions.get(0).releases.get());
    }

    @Test
    void beginFailureLeavesScopeUntouched() {
        source.failOn("BEGIN");
        TxScope empty = TxScope.empty();

        TransactionException ex = assertThrows(TransactionException.class, () -> coordinator.start(empty));

        assertInstanceOf(SQLException.class, ex.getCause());
        assertFalse(coordinator.isActive(empty));
    }

    @Test
    void failedSavepointDoesNotAdvanceDepth() {
        TxScope scope = coordinator.start(TxScope.empty());
        source.failOn("SAVEPOINT SP1");

        assertThrows(TransactionException.class, () -> coordinator.start(scope));
        assertEquals(0, coordinator.depth(scope));

        source.recover("SAVEPOINT SP1");
        coordinator.start(scope);
        coordinator.commit(scope);
        coordinator.commit(scope);

        assertEquals(List.of("BEGIN", "SAVEPOINT SP1", "RELEASE SAVEPOINT SP1", "COMMIT"), source.statements);
    }

    @Test
    void failedReleaseKeepsSavepointOpen() {
        TxScope scope = coordinator.start(TxScope.empty());
        coordinator.start(scope);
        source.failOn("RELEASE SAVEPOINT SP1");

        assertThrows(TransactionException.class, () -> coordinator.commit(scope));
        assertEquals(1, coordinator.depth(scope));

        coordinator.rollback(scope);
        assertEquals(0, coordinator.depth(scope));
    }

    @Test
    void failedCommitKeepsTransactionActiveForRollback() {
        TxScope scope = coordinator.start(TxScope.empty());
        source.failOn("COMMIT");

        assertThrows(TransactionException.class, () -> coordinator.commit(scope));
        assertTrue(coordinator.isActive(scope));
        assertEquals(0, source.transactions.get(0).releases.get());

        TxScope finished = coordinator.rollback(scope);

        assertFalse(coordinator.isActive(finished));
        assertEquals(1, source.transactions.get(0).releases.get());
    }

    @Test
    void failedRollbackStillFinalizes() {
        TxScope scope = coordinator.start(TxScope.empty());
        source.failOn("ROLLBACK");

        assertThrows(TransactionException.class, () -> coordinator.rollback(scope));

        assertFalse(coordinator.isActive(scope));
        assertEquals(1, source.transactions.get(0).releases.get());
    }

    @Test
    void adoptRejectsMissingTransaction() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> coordinator.adopt(TxScope.empty(), null));
        assertEquals("No transaction provided", ex.getMessage());
    }

    @Test
    void adoptTwiceFails() {
        TxScope adopted = coordinator.adopt(TxScope.empty(), source.externalTransaction());

        assertThrows(TransactionAlreadyActiveException.class,
                () -> coordinator.adopt(adopted, source.externalTransaction()));
    }

    @Test
    void adoptAfterStartFails() {
        TxScope scope = coordinator.start(TxScope.empty());

        assertThrows(TransactionAlreadyActiveException.class,
                () -> coordinator.adopt(scope, source.externalTransaction()));
    }

    @Test
    void adoptedTransactionIsRootOfNestedScopes() {
        RecordingTransaction external = source.externalTransaction();
        TxScope scope = coordinator.adopt(TxScope.empty(), external);

        assertSame(external, coordinator.getActive(scope));
        assertEquals(0, coordinator.depth(scope));

        coordinator.start(scope);
        assertSame(external, coordinator.getActive(scope));
        coordinator.commit(scope);
        TxScope finished = coordinator.commit(scope);

        assertFalse(coordinator.isActive(finished));
        assertEquals(List.of("SAVEPOINT SP1", "RELEASE SAVEPOINT SP1", "COMMIT"), source.statements);
        assertEquals(1, external.releases.get());
    }

    @Test
    void adoptIsAllowedAgainAfterFinalization() {
        TxScope scope = coordinator.adopt(TxScope.empty(), source.externalTransaction());
        coordinator.rollback(scope);

        TxScope readopted = coordinator.adopt(scope, source.externalTransaction());

        assertTrue(coordinator.isActive(readopted));
    }

    @Test
    void coordinatorsKeepIndependentBindings() {
        RecordingTransactionSource otherSource = new RecordingTransactionSource();
        TransactionCoordinator other = new TransactionCoordinator(otherSource);

        TxScope scope = coordinator.start(TxScope.empty());
        scope = other.start(scope);
        coordinator.start(scope);

        assertEquals(1, coordinator.depth(scope));
        assertEquals(0, other.depth(scope));
        assertEquals(List.of("BEGIN"), otherSource.statements);

        coordinator.commit(scope);
        scope = coordinator.commit(scope);

        assertFalse(coordinator.isActive(scope));
        assertTrue(other.isActive(scope));
        assertFalse(scope.isEmpty());

        scope = other.commit(scope);
        assertTrue(scope.isEmpty());
    }

    @Test
    void getActiveDoesNotChangeDepth() {
        TxScope scope = coordinator.start(TxScope.empty());
        coordinator.start(scope);

        coordinator.getActive(scope);
        coordinator.getActive(scope);

        assertEquals(1, coordinator.depth(scope));
        assertEquals(List.of("BEGIN", "SAVEPOINT SP1"), source.statements);
    }
}
