package apex4j.workers.comm;

import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Worker end of the worker/learner link.
 */
public interface WorkerChannel {
    /**
     * Hand experience to the consumer, blocking while its intake is full.
     */
    public void emit(Experience experience) throws InterruptedException;

    /**
     * Non-blocking poll for a new parameter set.
     * @return the most recent parameters published since the last poll, or null
     */
    public List<INDArray> pollParameters();
}
