package apex4j.workers.utils;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.indexing.BooleanIndexing;
import org.nd4j.linalg.indexing.conditions.Conditions;

/**
 * Small numeric helpers shared by losses and n-step folding.
 */
public class AgentUtils {

    public static INDArray clamp(INDArray input, double min, double max){
        BooleanIndexing.replaceWhere(input, min, Conditions.lessThan(min));
        BooleanIndexing.replaceWhere(input, max, Conditions.greaterThan(max));
        return input;
    }

    /**
     * Geometrically discounted sum: sum_i gamma^i * rewards[i].
     */
    public static double discountedSum(double[] rewards, double gamma){
        double sum = 0D;
        double discount = 1D;
        for(int i=0;i<rewards.length;i++){
            sum += discount * rewards[i];
            discount *= gamma;
        }
        return sum;
    }
}
