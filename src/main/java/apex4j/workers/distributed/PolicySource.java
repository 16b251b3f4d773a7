package apex4j.workers.distributed;

import apex4j.workers.network.PolicyNetwork;
import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Capability of holding a policy whose parameters are overwritten by the learner.
 */
public interface PolicySource {
    public PolicyNetwork getPolicyNetwork();

    /**
     * Replace the policy parameters, in the network's enumeration order.
     */
    public void synchronize(List<INDArray> newParams);
}
