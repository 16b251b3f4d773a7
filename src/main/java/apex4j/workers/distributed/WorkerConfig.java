package apex4j.workers.distributed;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Worker hyper-parameters, read from a parameter map.
 */
public class WorkerConfig {
    private final double discountFactor;
    private final int nStep;
    private final double maxEpsilon;
    private final double minEpsilon;
    private final double epsilonDecay;
    private final int localBufferMaxSize;
    private final double perEps;
    private final String lossType;
    private final String device;
    private final int hiddenSize;
    private final boolean debug;

    public WorkerConfig() {
        this(Collections.<String, Object>emptyMap());
    }

    public WorkerConfig(Map<String,Object> params) {
        this.discountFactor = number(params, "DISCOUNT_RATE", 0.99D).doubleValue();
        this.nStep = number(params, "N_STEP", 1).intValue();
        this.maxEpsilon = number(params, "MAX_EPSILON", 1D).doubleValue();
        this.minEpsilon = number(params, "MIN_EPSILON", 0.01D).doubleValue();
        this.epsilonDecay = number(params, "EPSILON_DECAY", 1e-4).doubleValue();
        this.localBufferMaxSize = number(params, "LOCAL_BUFFER_MAX_SIZE", 1000).intValue();
        this.perEps = number(params, "PER_EPS", 1e-6).doubleValue();
        this.lossType = string(params, "LOSS_TYPE", "DQNLoss");
        this.device = string(params, "DEVICE", "cpu");
        this.hiddenSize = number(params, "HIDDEN_SIZE", 64).intValue();
        this.debug = flag(params, "DEBUG", false);
        validate();
    }

    private static Number number(Map<String,Object> params, String key, Number def){
        Object v = params.getOrDefault(key, def);
        if(!(v instanceof Number))
            throw new IllegalArgumentException("Parameter " + key + " must be numeric, got " + v);
        return (Number) v;
    }

    private static String string(Map<String,Object> params, String key, String def){
        Object v = params.getOrDefault(key, def);
        if(!(v instanceof String))
            throw new IllegalArgumentException("Parameter " + key + " must be a string, got " + v);
        return (String) v;
    }

    private static boolean flag(Map<String,Object> params, String key, boolean def){
        Object v = params.getOrDefault(key, def);
        if(!(v instanceof Boolean))
            throw new IllegalArgumentException("Parameter " + key + " must be a boolean, got " + v);
        return (Boolean) v;
    }

    private void validate(){
        if(nStep < 1)
            throw new IllegalArgumentException("N_STEP must be >= 1, got " + nStep);
        if(!(perEps > 0D))
            throw new IllegalArgumentException("PER_EPS must be > 0, got " + perEps);
        if(minEpsilon < 0D || minEpsilon > maxEpsilon || maxEpsilon > 1D)
            throw new IllegalArgumentException(String.format(
                    "Expected 0 <= MIN_EPSILON <= MAX_EPSILON <= 1, got min=%s, max=%s", minEpsilon, maxEpsilon));
        if(epsilonDecay < 0D)
            throw new IllegalArgumentException("EPSILON_DECAY must be >= 0, got " + epsilonDecay);
        if(localBufferMaxSize < 1)
            throw new IllegalArgumentException("LOCAL_BUFFER_MAX_SIZE must be >= 1, got " + localBufferMaxSize);
        if(discountFactor < 0D || discountFactor > 1D)
            throw new IllegalArgumentException("DISCOUNT_RATE must be in [0, 1], got " + discountFactor);
        if(hiddenSize < 1)
            throw new IllegalArgumentException("HIDDEN_SIZE must be >= 1, got " + hiddenSize);
    }

    public double getDiscountFactor() {
        return discountFactor;
    }

    public int getNStep() {
        return nStep;
    }

    public boolean useNStep() {
        return nStep > 1;
    }

    public double getMaxEpsilon() {
        return maxEpsilon;
    }

    public double getMinEpsilon() {
        return minEpsilon;
    }

    public double getEpsilonDecay() {
        return epsilonDecay;
    }

    public int getLocalBufferMaxSize() {
        return localBufferMaxSize;
    }

    public double getPerEps() {
        return perEps;
    }

    public String getLossType() {
        return lossType;
    }

    public String getDevice() {
        return device;
    }

    public int getHiddenSize() {
        return hiddenSize;
    }

    public boolean isDebug() {
        return debug;
    }

    public Map<String,Object> toMap(){
        Map<String,Object> params = new HashMap<>();
        params.put("DISCOUNT_RATE", discountFactor);
        params.put("N_STEP", nStep);
        params.put("MAX_EPSILON", maxEpsilon);
        params.put("MIN_EPSILON", minEpsilon);
        params.put("EPSILON_DECAY", epsilonDecay);
        params.put("LOCAL_BUFFER_MAX_SIZE", localBufferMaxSize);
        params.put("PER_EPS", perEps);
        params.put("LOSS_TYPE", lossType);
        params.put("DEVICE", device);
        params.put("HIDDEN_SIZE", hiddenSize);
        params.put("DEBUG", debug);
        return params;
    }

    @Override
    public String toString() {
        return "WorkerConfig" + toMap();
    }
}
