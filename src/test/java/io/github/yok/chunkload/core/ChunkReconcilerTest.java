package io.github.yok.chunkload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import io.github.yok.chunkload.util.ProcessIdentity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");

    private ChunkLedger ledger;
    private ChunkReconciler reconciler;
    private ProcessIdentity identity;

    @BeforeEach
    void setUp() {
        ledger = mock(ChunkLedger.class);
        identity = new ProcessIdentity(ProcessHandle.current().pid(), "testhost");
        ChunkLoadConfig config = new ChunkLoadConfig();
        config.setStaleAfter(Duration.ofMinutes(30));
        reconciler = new ChunkReconciler(ledger, identity, config,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(ledger.requeue(anyString(), anyString(), anyInt(), anyString(), eq(NOW)))
                .thenReturn(true);
    }

    private static ChunkRecord processing(int number, String owner, Instant updatedAt) {
        return ChunkRecord.builder().tableName("people").datasetDate("d1").chunkNumber(number)
                .status(ChunkStatus.PROCESSING).ownerId(owner).startedAt(updatedAt)
                .updatedAt(updatedAt).build();
    }

    @Test
    void reconcile_正常ケース_processingが無い_何も戻さないこと() {
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(List.of(
                ChunkRecord.builder().chunkNumber(1).status(ChunkStatus.COMPLETED).build()));

        assertEquals(0, reconciler.reconcile("people", "d1"));
        verify(ledger, never()).requeue(anyString(), anyString(), anyInt(), anyString(),
                eq(NOW));
    }

    @Test
    void reconcile_正常ケース_同一ホストの終了済みプロセスが所有する_pendingへ戻されること() {
        when(ledger.findByTableAndDate("people", "d1"))
                .thenReturn(List.of(processing(2, "2147483646@testhost", NOW)));

        assertEquals(1, reconciler.reconcile("people", "d1"));
        verify(ledger).requeue(eq("people"), eq("d1"), eq(2),
                contains("no longer running"), eq(NOW));
    }

    @Test
    void reconcile_正常ケース_所有者が記録されていない_pendingへ戻されること() {
        when(ledger.findByTableAndDate("people", "d1"))
                .thenReturn(List.of(processing(1, null, NOW)));

        assertEquals(1, reconciler.reconcile("people", "d1"));
    }

    @Test
    void reconcile_正常ケース_別ホストで更新が途絶えている_pendingへ戻されること() {
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(
                List.of(processing(3, "100@otherhost", NOW.minus(Duration.ofMinutes(31)))));

        assertEquals(1, reconciler.reconcile("people", "d1"));
        verify(ledger).requeue(eq("people"), eq("d1"), eq(3), contains("otherhost"), eq(NOW));
    }

    @Test
    void reconcile_異常ケース_別ホストで最近更新されている_IllegalStateExceptionが送出されること() {
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(
                List.of(processing(3, "100@otherhost", NOW.minus(Duration.ofMinutes(5)))));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> reconciler.reconcile("people", "d1"));
        assertTrue(ex.getMessage().contains("chunk 3"));
        verify(ledger, never()).requeue(anyString(), anyString(), anyInt(), anyString(),
                eq(NOW));
    }

    @Test
    void reconcile_異常ケース_実行中の自プロセスが所有する_IllegalStateExceptionが送出されること() {
        when(ledger.findByTableAndDate("people", "d1"))
                .thenReturn(List.of(processing(1, identity.ownerId(), NOW)));

        assertThrows(IllegalStateException.class, () -> reconciler.reconcile("people", "d1"));
    }

    @Test
    void reconcile_異常ケース_終了済みと実行中が混在する_終了済みは戻され例外が送出されること() {
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(List.of(
                processing(1, "2147483646@testhost", NOW),
                processing(2, "100@otherhost", NOW)));

        assertThrows(IllegalStateException.class, () -> reconciler.reconcile("people", "d1"));
        verify(ledger).requeue(eq("people"), eq("d1"), eq(1), anyString(), eq(NOW));
    }
}
