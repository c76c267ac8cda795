package conductor.taskpool.service;

import conductor.taskpool.model.TaskBody;
import conductor.taskpool.model.TaskContext;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskNamesTest {

    static final class ImportOrders implements TaskBody {
        @Override
        public Object run(TaskContext context) {
            return null;
        }
    }

    @Test
    void disambiguateKeepsFreeBaseName() {
        assertEquals("x", TaskNames.disambiguate("x", Set.of()::contains));
    }

    @Test
    void disambiguateAppendsFirstFreeSuffix() {
        assertEquals("x-2", TaskNames.disambiguate("x", Set.of("x")::contains));
        assertEquals("x-4", TaskNames.disambiguate("x", Set.of("x", "x-2", "x-3")::contains));
        // gaps are filled
        assertEquals("x-2", TaskNames.disambiguate("x", Set.of("x", "x-3")::contains));
    }

    @Test
    void namedClassUsesItsSimpleName() {
        assertEquals("ImportOrders", TaskNames.deriveBaseName(new ImportOrders()));
    }

    @Test
    void lambdaFallsBackToEnclosingClass() {
        TaskBody lambda = ctx -> "x";
        assertEquals("TaskNamesTest", TaskNames.deriveBaseName(lambda));
    }

    @Test
    void anonymousClassFallsBackToEnclosingClass() {
        TaskBody anonymous = new TaskBody() {
            @Override
            public Object run(TaskContext context) {
                return null;
            }
        };
        assertEquals("TaskNamesTest", TaskNames.deriveBaseName(anonymous));
    }

    @Test
    void nullBodyUsesDefault() {
        assertEquals(TaskNames.DEFAULT_BASE, TaskNames.deriveBaseName(null));
    }

    @Test
    void newIdsAreUnique() {
        assertNotEquals(TaskNames.newId(), TaskNames.newId());
        assertTrue(TaskNames.newId().startsWith("task-"));
    }
}
