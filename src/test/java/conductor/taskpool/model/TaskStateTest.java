package conductor.taskpool.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void onlyForwardTransitionsAreAllowed() {
        assertTrue(TaskState.PENDING.canMoveTo(TaskState.RUNNING));
        assertTrue(TaskState.RUNNING.canMoveTo(TaskState.SUCCEEDED));
        assertTrue(TaskState.RUNNING.canMoveTo(TaskState.FAILED));

        assertFalse(TaskState.PENDING.canMoveTo(TaskState.SUCCEEDED));
        assertFalse(TaskState.RUNNING.canMoveTo(TaskState.PENDING));
        assertFalse(TaskState.FAILED.canMoveTo(TaskState.PENDING));
        assertFalse(TaskState.SUCCEEDED.canMoveTo(TaskState.FAILED));
    }

    @Test
    void isTerminal() {
        assertFalse(TaskState.PENDING.isTerminal());
        assertFalse(TaskState.RUNNING.isTerminal());
        assertTrue(TaskState.SUCCEEDED.isTerminal());
        assertTrue(TaskState.FAILED.isTerminal());
    }
}
