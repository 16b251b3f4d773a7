package apex4j.workers.distributed;

import apex4j.workers.network.PolicyNetwork;
import java.util.Arrays;
import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Copies a parameter set received from the learner into a network, in place.
 * Sender and receiver must agree on the number, order and shapes of the arrays;
 * on any mismatch nothing is copied.
 */
public class ParameterSynchronizer {

    private ParameterSynchronizer() {
    }

    public static void synchronize(PolicyNetwork network, List<INDArray> newParams){
        copy(network.parameters(), newParams);
    }

    public static void copy(List<INDArray> params, List<INDArray> newParams){
        if(newParams == null)
            throw new IllegalArgumentException("New parameter set is null");
        if(params.size() != newParams.size())
            throw new IllegalArgumentException(String.format(
                    "Parameter count mismatch: network has %d arrays, received %d", params.size(), newParams.size()));
        for(int i=0;i<params.size();i++){
            long[] expected = params.get(i).shape();
            long[] received = newParams.get(i).shape();
            if(!Arrays.equals(expected, received))
                throw new IllegalArgumentException(String.format(
                        "Parameter %d shape mismatch: expected %s, received %s",
                        i, Arrays.toString(expected), Arrays.toString(received)));
        }
        for(int i=0;i<params.size();i++)
            params.get(i).assign(newParams.get(i));
    }
}
