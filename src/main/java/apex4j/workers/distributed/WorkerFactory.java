package apex4j.workers.distributed;

/**
 * Creates the worker of a given rank.
 */
public interface WorkerFactory {
    public Worker create(int rank);
}
