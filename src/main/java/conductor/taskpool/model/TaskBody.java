package conductor.taskpool.model;

/**
 * Unit of work executed by the pool.
 * The pool never introspects a body; it only invokes it once per record.
 */
@FunctionalInterface
public interface TaskBody {

    /**
     * Execute the work.
     *
     * @param context arguments, progress reporting and the cancellation signal
     * @return result stored on the record (may be null)
     * @throws Exception any failure; it is recorded on the task and never
     *                   propagated to the pool
     */
    Object run(TaskContext context) throws Exception;
}
