package apex4j.workers.env;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Environment driven by a worker. Implementations are free to throw from
 * {@link #reset()} and {@link #step(INDArray)}; workers never mask those errors.
 * Observations are stored in the data type the environment returns them in,
 * the Q-network reads them as float.
 */
public interface Environment {
    public INDArray reset();
    public StepResult step(INDArray action);
    public void seed(long seed);
    public ActionSpace getActionSpace();
    public int getObservationSize();
}
