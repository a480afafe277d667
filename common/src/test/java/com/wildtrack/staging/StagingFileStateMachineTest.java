package com.wildtrack.staging;

import com.wildtrack.state.GroupStore;
import com.wildtrack.state.InMemoryGroupStore;
import com.wildtrack.storage.BlobNotFoundException;
import com.wildtrack.storage.FileStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StagingFileStateMachineTest {

    private static final String INTEGRATION = "779ff3ab-5589-4f4c-9e0a-ae8d6c9edff0";
    private static final String FILE = "test_file.xml";

    @Mock
    private FileStorage fileStorage;

    private InMemoryGroupStore groupStore;
    private StagingFileStateMachine stateMachine;
    private StagingGroups groups;

    @BeforeEach
    void setUp() {
        lenient().when(fileStorage.updateMetadata(anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(null));
        groupStore = new InMemoryGroupStore();
        stateMachine = new StagingFileStateMachine(groupStore, fileStorage, "ats");
        groups = stateMachine.groups(INTEGRATION);
    }

    // ── Status queries ───────────────────────────────────────────────────

    @Test
    void registeredFileIsPending() {
        stateMachine.register(INTEGRATION, FILE).join();

        FileStatusResult status = stateMachine.getStatus(INTEGRATION, FILE).join();

        assertEquals(Map.of("file_status", "pending"), status.toResponse());
    }

    @Test
    void unknownFileIsNotFound() {
        FileStatusResult status = stateMachine.getStatus(INTEGRATION, "unknown.xml").join();

        assertEquals(Map.of("file_status", "Not found"), status.toResponse());
    }

    @Test
    void locateStopsAtFirstMatchingGroup() {
        GroupStore store = mock(GroupStore.class);
        when(store.isMember(eq(groups.pending()), eq(FILE))).thenReturn(CompletableFuture.completedFuture(true));
        StagingFileStateMachine machine = new StagingFileStateMachine(store, fileStorage, "ats");

        assertEquals(FileStatus.PENDING, machine.locate(INTEGRATION, FILE).join().orElseThrow());
        verify(store, never()).isMember(eq(groups.inProgress()), anyString());
        verify(store, never()).isMember(eq(groups.processed()), anyString());
    }

    // ── setStatus ────────────────────────────────────────────────────────

    @Test
    void setStatusMovesTrackedFile() {
        stateMachine.register(INTEGRATION, FILE).join();

        FileStatusResult result = stateMachine.setStatus(INTEGRATION, FILE, FileStatus.IN_PROGRESS).join();

        assertEquals("in_progress", result.getFileStatus());
        assertEquals("File status for 'test_file.xml' in integration '" + INTEGRATION
                + "' set to 'in_progress'.", result.getMessage());
        assertFalse(groupStore.isMember(groups.pending(), FILE).join());
        assertTrue(groupStore.isMember(groups.inProgress(), FILE).join());
        verify(fileStorage).updateMetadata(INTEGRATION, FILE, Map.of("status", "in_progress"));
    }

    @Test
    void setStatusOnUntrackedFileRegistersItAsPending() {
        FileStatusResult result = stateMachine.setStatus(INTEGRATION, "non_existent_file.xml", FileStatus.PROCESSED)
                .join();

        assertEquals("Not found", result.getFileStatus());
        assertEquals("File 'non_existent_file.xml' not found in any group. Moving file to PENDING status.",
                result.getMessage());
        assertTrue(groupStore.isMember(groups.pending(), "non_existent_file.xml").join());
        assertFalse(groupStore.isMember(groups.processed(), "non_existent_file.xml").join());
        verify(fileStorage).updateMetadata(INTEGRATION, "non_existent_file.xml", Map.of("status", "pending"));
    }

    @Test
    void setStatusReportsPendingWhenMoveFails() {
        GroupStore store = mock(GroupStore.class);
        when(store.isMember(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(true));
        when(store.move(anyString(), anyString(), anyCollection()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("Test exception")));
        StagingFileStateMachine machine = new StagingFileStateMachine(store, fileStorage, "ats");

        FileStatusResult result = machine.setStatus(INTEGRATION, FILE, FileStatus.PROCESSED).join();

        assertEquals(Map.of("file_status", "pending", "message", "Error setting file status"), result.toResponse());
        verify(fileStorage, never()).updateMetadata(anyString(), anyString(), anyMap());
    }

    @Test
    void setStatusSurvivesSynchronousStoreFailure() {
        GroupStore store = mock(GroupStore.class);
        when(store.isMember(anyString(), anyString())).thenThrow(new IllegalStateException("connection reset"));
        StagingFileStateMachine machine = new StagingFileStateMachine(store, fileStorage, "ats");

        FileStatusResult result = machine.setStatus(INTEGRATION, FILE, FileStatus.PROCESSED).join();

        assertEquals("pending", result.getFileStatus());
        assertEquals(StagingFileStateMachine.SET_STATUS_ERROR_MESSAGE, result.getMessage());
    }

    @Test
    void metadataFailureDoesNotFailTransition() {
        when(fileStorage.updateMetadata(anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new BlobNotFoundException(INTEGRATION, FILE)));
        stateMachine.register(INTEGRATION, FILE).join();

        TransitionResult result = stateMachine.transition(INTEGRATION, FILE, FileStatus.PROCESSED).join();

        assertTrue(result.isMoved());
        assertEquals(FileStatus.PENDING, result.getPreviousStatus());
        assertTrue(groupStore.isMember(groups.processed(), FILE).join());
    }

    // ── transition ───────────────────────────────────────────────────────

    @Test
    void transitionReportsFailureInsteadOfThrowing() {
        GroupStore store = mock(GroupStore.class);
        when(store.isMember(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(true));
        RuntimeException failure = new RuntimeException("Test exception");
        when(store.move(anyString(), anyString(), anyCollection())).thenReturn(CompletableFuture.failedFuture(failure));
        StagingFileStateMachine machine = new StagingFileStateMachine(store, fileStorage, "ats");

        TransitionResult result = machine.transition(INTEGRATION, FILE, FileStatus.IN_PROGRESS).join();

        assertTrue(result.isFailed());
        assertSame(failure, result.getError());
        assertEquals(FileStatus.PENDING, result.getStatus());
    }

    @Test
    void fileIsInExactlyOneGroupAfterEveryTransition() {
        stateMachine.register(INTEGRATION, FILE).join();

        for (FileStatus target : List.of(FileStatus.IN_PROGRESS, FileStatus.PROCESSED, FileStatus.PENDING,
                FileStatus.PROCESSED, FileStatus.IN_PROGRESS)) {
            stateMachine.transition(INTEGRATION, FILE, target).join();
            assertEquals(1, membershipCount(FILE));
            assertEquals(target, stateMachine.locate(INTEGRATION, FILE).join().orElseThrow());
        }
    }

    @Test
    void concurrentTransitionsOfOneFileKeepSingleMembership() {
        stateMachine.register(INTEGRATION, FILE).join();
        FileStatus[] targets = FileStatus.values();

        List<CompletableFuture<TransitionResult>> results = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            FileStatus target = targets[i % targets.length];
            results.add(CompletableFuture.supplyAsync(() -> target)
                    .thenCompose(t -> stateMachine.transition(INTEGRATION, FILE, t)));
        }
        CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).join();

        assertTrue(results.stream().map(CompletableFuture::join).allMatch(TransitionResult::isMoved));
        assertEquals(1, membershipCount(FILE));
    }

    @Test
    void pendingFilesListsRegisteredFiles() {
        stateMachine.register(INTEGRATION, "a.xml").join();
        stateMachine.register(INTEGRATION, "b.xml").join();
        stateMachine.transition(INTEGRATION, "a.xml", FileStatus.PROCESSED).join();

        assertEquals(List.of("b.xml"), List.copyOf(stateMachine.pendingFiles(INTEGRATION).join()));
        verify(fileStorage, never()).updateMetadata(eq(INTEGRATION), eq("b.xml"), any());
    }

    private int membershipCount(String filename) {
        int count = 0;
        for (FileStatus status : FileStatus.values()) {
            if (groupStore.isMember(groups.groupFor(status), filename).join()) {
                count++;
            }
        }
        return count;
    }
}
