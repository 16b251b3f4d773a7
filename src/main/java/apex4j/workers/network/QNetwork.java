package apex4j.workers.network;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.deeplearning4j.core.storage.StatsStorage;
import org.deeplearning4j.nn.api.OptimizationAlgorithm;
import org.deeplearning4j.nn.conf.ComputationGraphConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.deeplearning4j.nn.weights.WeightInit;
import org.deeplearning4j.ui.model.stats.StatsListener;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.learning.config.Adam;

/**
 * Feed forward Q-value network: in -> h1 -> h2 -> q.
 */
public class QNetwork implements PolicyNetwork {
    private final HeadConfig head;
    private final ComputationGraph model;

    public QNetwork(HeadConfig head, long seed) {
        this(head, seed, 1e-4, null);
    }

    public QNetwork(HeadConfig head, long seed, double learningRate, StatsStorage statsStorage) {
        ComputationGraphConfiguration conf = new NeuralNetConfiguration.Builder()
            .seed(seed)
            .optimizationAlgo(OptimizationAlgorithm.STOCHASTIC_GRADIENT_DESCENT)
            .updater(new Adam(learningRate))
            .weightInit(WeightInit.XAVIER)
            .graphBuilder()
            .addInputs("in")
            .addLayer("h1", new DenseLayer.Builder().nIn(head.getStateSize()).nOut(head.getHiddenSize()).activation(Activation.RELU).build(), "in")
            .addLayer("h2", new DenseLayer.Builder().nIn(head.getHiddenSize()).nOut(head.getHiddenSize()).activation(Activation.RELU).build(), "h1")
            .addLayer("q", new DenseLayer.Builder().nIn(head.getHiddenSize()).nOut(head.getOutputSize()).activation(Activation.IDENTITY).build(), "h2")
            .setOutputs("q")
            .build();

        this.model = new ComputationGraph(conf);
        this.model.init();
        if(statsStorage!=null) {
            this.model.setListeners(new StatsListener(statsStorage));
        }
        this.head = head;
    }

    public QNetwork(HeadConfig head, ComputationGraph model) {
        this.head = head;
        this.model = model;
    }

    @Override
    public INDArray output(INDArray states) {
        INDArray in = states.castTo(DataType.FLOAT);
        if(in.rank() == 1)
            in = in.reshape(1, in.length());
        return model.output(in)[0];
    }

    @Override
    public int greedyAction(INDArray state) {
        INDArray qsa = output(state);
        return qsa.argMax(1).getInt(0);
    }

    @Override
    public List<INDArray> parameters() {
        return new ArrayList<>(model.paramTable().values());
    }

    @Override
    public long numParameters() {
        return model.numParams();
    }

    @Override
    public QNetwork copy() {
        return new QNetwork(head, model.clone());
    }

    public HeadConfig getHead() {
        return head;
    }

    public ComputationGraph getModel() {
        return model;
    }

    public void saveModel(String path) throws IOException {
        File file = new File(path);
        this.model.save(file, true);
    }

    /**
     * Load weights saved by {@link #saveModel(String)}. Values are copied into the
     * existing parameter arrays so references to this network stay valid.
     */
    public void loadModel(String path) throws IOException {
        File file = new File(path);
        ComputationGraph loaded = ComputationGraph.load(file, true);
        INDArray params = loaded.params();
        if(!Arrays.equals(params.shape(), model.params().shape()))
            throw new IOException(String.format("Model at %s has %d parameters, expected %d",
                    path, params.length(), model.params().length()));
        model.params().assign(params);
    }
}
