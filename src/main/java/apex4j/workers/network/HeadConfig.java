package apex4j.workers.network;

/**
 * Shape of the value head: input size, number of outputs (actions) and hidden width.
 */
public class HeadConfig {
    private final int stateSize;
    private final int outputSize;
    private final int hiddenSize;

    public HeadConfig(int stateSize, int outputSize, int hiddenSize) {
        if(stateSize < 1 || outputSize < 1 || hiddenSize < 1)
            throw new IllegalArgumentException(String.format(
                    "Invalid head sizes: state=%d, output=%d, hidden=%d", stateSize, outputSize, hiddenSize));
        this.stateSize = stateSize;
        this.outputSize = outputSize;
        this.hiddenSize = hiddenSize;
    }

    public int getStateSize() {
        return stateSize;
    }

    public int getOutputSize() {
        return outputSize;
    }

    public int getHiddenSize() {
        return hiddenSize;
    }

    @Override
    public String toString() {
        return "HeadConfig{" + "stateSize=" + stateSize + ", outputSize=" + outputSize + ", hiddenSize=" + hiddenSize + '}';
    }
}
