package apex4j.workers.loss;

import apex4j.workers.memory.TransitionBatch;
import apex4j.workers.network.HeadConfig;
import apex4j.workers.network.PolicyNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Per-transition loss used to derive replay priorities. Implementations must be
 * side-effect free: same networks and batch give the same result.
 */
public interface LossFunction {
    /**
     * @return element-wise loss as a column [n, 1]
     */
    public INDArray elementWise(PolicyNetwork policy, PolicyNetwork target, TransitionBatch batch, double gamma, HeadConfig head);
}
