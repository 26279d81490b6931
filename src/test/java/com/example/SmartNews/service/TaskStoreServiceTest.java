package com.example.SmartNews.service;

import com.example.SmartNews.dto.TaskUpdate;
import com.example.SmartNews.dto.TaskUpdateResult;
import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.TaskStatus;
import com.example.SmartNews.repository.LearningTaskRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(TaskStoreService.class)
class TaskStoreServiceTest {

    @Autowired
    private TaskStoreService taskStore;

    @Autowired
    private LearningTaskRepository repository;

    @TempDir
    Path tempDir;

    private LearningTask newTask(String userId) {
        return taskStore.createTask(userId, "bbc", "vid1", "https://example.com/watch?v=vid1",
                "Morning news", ProcessingMode.WITH_SUBTITLE);
    }

    @Test
    void createTaskStartsPending() {
        LearningTask task = taskStore.createTask("alice", "bbc", "vid1", "https://example.com/v",
                "Title", ProcessingMode.SLOW, Map.of(LearningTask.METADATA_VIDEO_FORMAT, "480p"));

        LearningTask stored = taskStore.getTask(task.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.getProgress()).isZero();
        assertThat(stored.getCompletedAt()).isNull();
        assertThat(stored.getCreatedAt()).isEqualTo(stored.getUpdatedAt());
        assertThat(stored.getMetadata()).containsEntry(LearningTask.METADATA_VIDEO_FORMAT, "480p");
    }

    @Test
    void createTaskValidatesInput() {
        assertThatThrownBy(() -> taskStore.createTask("", "bbc", "v", "https://x", "t", ProcessingMode.ORIGINAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> taskStore.createTask("alice", "bbc", "v", " ", "t", ProcessingMode.ORIGINAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> taskStore.createTask("alice", "bbc", "v", "https://x", "t", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getUnknownTaskIsEmpty() {
        assertThat(taskStore.getTask("no-such-task")).isEmpty();
        assertThat(taskStore.updateTask("no-such-task", TaskUpdate.progress(10))).isEmpty();
        assertThat(taskStore.updateTaskConditionally("no-such-task", TaskUpdate.progress(10)).getOutcome())
                .isEqualTo(TaskUpdateResult.Outcome.NOT_FOUND);
    }

    @Test
    void partialUpdateLeavesOtherFieldsUntouched() {
        LearningTask task = newTask("alice");
        taskStore.updateTask(task.getId(), TaskUpdate.builder().status(TaskStatus.DOWNLOADING).progress(10).build());

        LearningTask updated = taskStore.updateTask(task.getId(), TaskUpdate.builder()
                .metadata(Map.of("note", "x"))
                .build()).orElseThrow();

        assertThat(updated.getStatus()).isEqualTo(TaskStatus.DOWNLOADING);
        assertThat(updated.getProgress()).isEqualTo(10);
        assertThat(updated.getVideoTitle()).isEqualTo("Morning news");
        assertThat(updated.getMetadata()).containsEntry("note", "x");
    }

    @Test
    void terminalStatusStampsCompletedAtOnce() {
        LearningTask task = newTask("alice");

        LearningTask completed = taskStore.updateTask(task.getId(), TaskUpdate.builder()
                .status(TaskStatus.COMPLETED).progress(100).build()).orElseThrow();
        LocalDateTime stamped = completed.getCompletedAt();
        assertThat(stamped).isNotNull();

        LearningTask again = taskStore.updateTask(task.getId(), TaskUpdate.builder()
                .status(TaskStatus.COMPLETED).build()).orElseThrow();
        assertThat(again.getCompletedAt()).isEqualTo(stamped);
    }

    @Test
    void progressIsClampedAndNeverRegressesWhileActive() {
        LearningTask task = newTask("alice");
        taskStore.updateTask(task.getId(), TaskUpdate.builder().status(TaskStatus.PROCESSING).progress(60).build());

        assertThat(taskStore.updateTask(task.getId(), TaskUpdate.progress(40)).orElseThrow().getProgress())
                .isEqualTo(60);
        assertThat(taskStore.updateTask(task.getId(), TaskUpdate.progress(150)).orElseThrow().getProgress())
                .isEqualTo(100);
    }

    @Test
    void conditionalUpdateRejectedWhenStatusDiffers() {
        LearningTask task = newTask("alice");
        taskStore.cancelTask(task.getId());

        TaskUpdateResult result = taskStore.updateTaskConditionally(task.getId(), TaskUpdate.builder()
                .status(TaskStatus.COMPLETED)
                .progress(100)
                .outputFile("/tmp/out.mp4")
                .build()
                .expecting(TaskStatus.PROCESSING));

        assertThat(result.getOutcome()).isEqualTo(TaskUpdateResult.Outcome.REJECTED);
        LearningTask stored = taskStore.getTask(task.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(stored.getOutputFile()).isNull();
    }

    @Test
    void terminalTaskCannotChangeStatus() {
        LearningTask task = newTask("alice");
        taskStore.updateTask(task.getId(), TaskUpdate.builder().status(TaskStatus.FAILED).errorMessage("boom").build());

        TaskUpdateResult result = taskStore.updateTaskConditionally(task.getId(),
                TaskUpdate.builder().status(TaskStatus.COMPLETED).build());

        assertThat(result.isApplied()).isFalse();
        assertThat(taskStore.getTask(task.getId()).orElseThrow().getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void cancelOnlyAppliesToActiveTasks() {
        LearningTask task = newTask("alice");

        TaskUpdateResult first = taskStore.cancelTask(task.getId());
        TaskUpdateResult second = taskStore.cancelTask(task.getId());

        assertThat(first.isApplied()).isTrue();
        assertThat(first.getTask().getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(first.getTask().getCompletedAt()).isNotNull();
        assertThat(second.getOutcome()).isEqualTo(TaskUpdateResult.Outcome.REJECTED);
    }

    @Test
    void listUserTasksFiltersByOwnerAndStatusNewestFirst() {
        LearningTask first = newTask("alice");
        LearningTask second = newTask("alice");
        newTask("bob");
        // distinct timestamps regardless of clock resolution
        LearningTask older = repository.findById(first.getId()).orElseThrow();
        older.setCreatedAt(LocalDateTime.now().minusMinutes(5));
        repository.save(older);
        taskStore.cancelTask(second.getId());

        List<LearningTask> all = taskStore.listUserTasks("alice", null, 20);
        List<LearningTask> cancelled = taskStore.listUserTasks("alice", TaskStatus.CANCELLED, 20);

        assertThat(all).extracting(LearningTask::getId).containsExactly(second.getId(), first.getId());
        assertThat(cancelled).extracting(LearningTask::getId).containsExactly(second.getId());
        assertThat(taskStore.listUserTasks("alice", null, 1)).hasSize(1);
    }

    @Test
    void listLimitOutsideRangeIsRejected() {
        assertThatThrownBy(() -> taskStore.listUserTasks("alice", null, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> taskStore.listUserTasks("alice", null, 101))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteTaskRemovesOutputFiles() throws Exception {
        LearningTask task = newTask("alice");
        Path output = Files.writeString(tempDir.resolve(task.getId() + "_processed.mp4"), "video");
        Path subtitle = Files.writeString(tempDir.resolve(task.getId() + "_processed.srt"), "1");
        taskStore.updateTask(task.getId(), TaskUpdate.builder()
                .status(TaskStatus.COMPLETED)
                .outputFile(output.toString())
                .subtitleFile(subtitle.toString())
                .build());

        assertThat(taskStore.deleteTask(task.getId())).isTrue();
        assertThat(taskStore.getTask(task.getId())).isEmpty();
        assertThat(output).doesNotExist();
        assertThat(subtitle).doesNotExist();
        assertThat(taskStore.deleteTask(task.getId())).isFalse();
    }

    @Test
    void cleanupRemovesOnlyOldTerminalTasks() {
        LearningTask oldDone = newTask("alice");
        LearningTask oldCancelled = newTask("alice");
        LearningTask recentDone = newTask("alice");
        LearningTask active = newTask("alice");
        taskStore.updateTask(oldDone.getId(), TaskUpdate.builder().status(TaskStatus.COMPLETED).build());
        taskStore.cancelTask(oldCancelled.getId());
        taskStore.updateTask(recentDone.getId(), TaskUpdate.builder().status(TaskStatus.COMPLETED).build());
        taskStore.updateTask(active.getId(), TaskUpdate.builder().status(TaskStatus.PROCESSING).build());
        for (String id : List.of(oldDone.getId(), oldCancelled.getId())) {
            LearningTask stored = repository.findById(id).orElseThrow();
            stored.setCompletedAt(LocalDateTime.now().minusHours(48));
            repository.save(stored);
        }

        int removed = taskStore.cleanupOlderThan(Duration.ofHours(24));

        assertThat(removed).isEqualTo(2);
        assertThat(taskStore.getTask(oldDone.getId())).isEmpty();
        assertThat(taskStore.getTask(oldCancelled.getId())).isEmpty();
        assertThat(taskStore.getTask(recentDone.getId())).isPresent();
        assertThat(taskStore.getTask(active.getId())).isPresent();
    }

    @Test
    void interruptedTasksAreFailed() {
        LearningTask pending = newTask("alice");
        LearningTask processing = newTask("alice");
        LearningTask done = newTask("alice");
        taskStore.updateTask(processing.getId(), TaskUpdate.builder().status(TaskStatus.PROCESSING).build());
        taskStore.updateTask(done.getId(), TaskUpdate.builder().status(TaskStatus.COMPLETED).build());

        assertThat(taskStore.countActiveTasks()).isEqualTo(2);
        assertThat(taskStore.failInterruptedTasks()).isEqualTo(2);

        assertThat(taskStore.getTask(pending.getId()).orElseThrow().getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(taskStore.getTask(processing.getId()).orElseThrow().getErrorMessage())
                .isEqualTo("Interrupted by server restart");
        assertThat(taskStore.getTask(done.getId()).orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(taskStore.countActiveTasks()).isZero();
    }
}
