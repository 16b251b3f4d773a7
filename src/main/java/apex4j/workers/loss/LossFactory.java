package apex4j.workers.loss;

/**
 * Builds a loss function from its configured type name.
 */
public class LossFactory {
    public static final String DQN_LOSS = "DQNLoss";
    public static final String SQUARED_TD_LOSS = "SquaredTDLoss";

    private LossFactory() {
    }

    public static LossFunction build(String type){
        if(DQN_LOSS.equals(type))
            return new DQNLoss();
        if(SQUARED_TD_LOSS.equals(type))
            return new SquaredTDLoss();
        throw new IllegalArgumentException("Unknown loss type: " + type);
    }
}
