package apex4j.workers.env;

/**
 * Creates one environment instance per worker.
 */
public interface EnvironmentFactory {
    public Environment createInstance();
}
