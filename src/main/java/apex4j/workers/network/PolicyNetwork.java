package apex4j.workers.network;

import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Decision function evaluated by workers. {@link #parameters()} enumerates the
 * parameter arrays in a fixed order; the arrays are live views, so writing into
 * them changes the network in place.
 */
public interface PolicyNetwork {
    /**
     * Action values for a batch of states [n, stateSize] (a single state vector is accepted).
     * @return [n, outputSize]
     */
    public INDArray output(INDArray states);
    public int greedyAction(INDArray state);
    public List<INDArray> parameters();
    public long numParameters();
    public PolicyNetwork copy();
}
