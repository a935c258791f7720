package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.replaysafe.datapipeline.api.contracts.Checkpoint;
import org.replaysafe.datapipeline.api.resources.database.ICheckpointStore;
import org.replaysafe.datapipeline.api.resources.database.StorageUnavailableException;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CheckpointManagerTest {

    @Mock
    private ICheckpointStore store;

    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        manager = new CheckpointManager(store, "pipe");
    }

    @Test
    void recover_onFirstStart_isEmpty() throws Exception {
        when(store.load("pipe")).thenReturn(Checkpoint.empty());

        Checkpoint checkpoint = manager.recover();

        assertThat(checkpoint.isEmpty()).isTrue();
        assertThat(manager.getCommittedOffsets()).isEmpty();
        assertThat(manager.getLastCommittedBatchId()).isZero();
    }

    @Test
    void recover_restoresOffsetsAndBatchId() throws Exception {
        when(store.load("pipe")).thenReturn(new Checkpoint(Map.of(0, 41L, 1, 7L), 12L, Instant.now()));

        manager.recover();

        assertThat(manager.getCommittedOffsets()).containsExactlyInAnyOrderEntriesOf(Map.of(0, 41L, 1, 7L));
        assertThat(manager.getLastCommittedBatchId()).isEqualTo(12L);
    }

    @Test
    void commit_afterMerge_persistsAndAdvances() throws Exception {
        when(store.load("pipe")).thenReturn(Checkpoint.empty());
        manager.recover();

        manager.recordMergeCommitted(1L);
        manager.commit(1L, Map.of(0, 9L));

        InOrder order = inOrder(store);
        order.verify(store).load("pipe");
        order.verify(store).commit("pipe", 1L, Map.of(0, 9L));
        assertThat(manager.getCommittedOffsets()).containsEntry(0, 9L);
        assertThat(manager.getLastCommittedBatchId()).isEqualTo(1L);
    }

    @Test
    void commit_withoutRecordedMerge_isRefused() throws Exception {
        assertThatThrownBy(() -> manager.commit(1L, Map.of(0, 1L)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("before its merge committed");
        verify(store, never()).commit(anyString(), anyLong(), any());
    }

    @Test
    void commit_forDifferentBatchThanMerged_isRefused() {
        manager.recordMergeCommitted(2L);

        assertThatThrownBy(() -> manager.commit(3L, Map.of(0, 1L)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void commit_movingOffsetBackwards_isRefused() throws Exception {
        when(store.load("pipe")).thenReturn(new Checkpoint(Map.of(0, 50L), 4L, Instant.now()));
        manager.recover();
        manager.recordMergeCommitted(5L);

        assertThatThrownBy(() -> manager.commit(5L, Map.of(0, 49L)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("backwards");
        verify(store, never()).commit(anyString(), anyLong(), any());
    }

    @Test
    void recordMerge_forOldBatch_isRefused() throws Exception {
        when(store.load("pipe")).thenReturn(new Checkpoint(Map.of(0, 50L), 4L, Instant.now()));
        manager.recover();

        assertThatThrownBy(() -> manager.recordMergeCommitted(4L)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedCommit_leavesStateUnchanged() throws Exception {
        when(store.load("pipe")).thenReturn(new Checkpoint(Map.of(0, 10L), 1L, Instant.now()));
        manager.recover();
        manager.recordMergeCommitted(2L);
        doThrow(new StorageUnavailableException("down", null)).when(store).commit("pipe", 2L, Map.of(0, 20L));

        assertThatThrownBy(() -> manager.commit(2L, Map.of(0, 20L))).isInstanceOf(StorageUnavailableException.class);

        assertThat(manager.getCommittedOffsets()).containsEntry(0, 10L);
        assertThat(manager.getLastCommittedBatchId()).isEqualTo(1L);
    }

    @Test
    void blankPipelineId_isRejected() {
        assertThatThrownBy(() -> new CheckpointManager(store, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
