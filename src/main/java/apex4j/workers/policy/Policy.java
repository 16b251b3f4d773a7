package apex4j.workers.policy;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * General interface for action selection policies
 */
public interface Policy {
    public INDArray chooseAction(INDArray state);
}
