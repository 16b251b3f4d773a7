package apex4j.workers.distributed;

import apex4j.workers.env.StepResult;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Capability of interacting with an environment.
 */
public interface EnvironmentDriver {
    public INDArray selectAction(INDArray state);
    public StepResult step(INDArray action);
}
