package conductor.taskpool.service;

import conductor.taskpool.model.TaskBody;

import java.util.UUID;
import java.util.function.Predicate;

/**
 * Name derivation and disambiguation shared by submission and retry.
 */
public final class TaskNames {

    static final String DEFAULT_BASE = "task";

    private TaskNames() {
    }

    /**
     * Derive a readable base name from a body's class.
     * Lambdas and anonymous classes fall back to their enclosing class.
     */
    public static String deriveBaseName(TaskBody body) {
        if (body == null) {
            return DEFAULT_BASE;
        }
        String name = body.getClass().getName();
        int lambda = name.indexOf("$$Lambda");
        if (lambda >= 0) {
            name = name.substring(0, lambda);
        }
        name = name.substring(name.lastIndexOf('.') + 1);
        // Foo$Bar -> Bar, Foo$1 -> Foo
        String[] parts = name.split("\\$");
        for (int i = parts.length - 1; i >= 0; i--) {
            String part = parts[i];
            if (!part.isEmpty() && !Character.isDigit(part.charAt(0))) {
                return part;
            }
        }
        return DEFAULT_BASE;
    }

    /**
     * First of {@code base}, {@code base-2}, {@code base-3}, ... that is not
     * taken. Callers must hold whatever lock makes {@code taken} stable.
     */
    public static String disambiguate(String base, Predicate<String> taken) {
        if (!taken.test(base)) {
            return base;
        }
        int i = 2;
        while (taken.test(base + "-" + i)) {
            i++;
        }
        return base + "-" + i;
    }

    /** Generate a new record ID */
    public static String newId() {
        return "task-" + UUID.randomUUID();
    }
}
