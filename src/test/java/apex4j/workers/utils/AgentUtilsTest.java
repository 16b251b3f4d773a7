package apex4j.workers.utils;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class AgentUtilsTest {

    @Test
    void clamp() {
        INDArray x = Nd4j.create(new double[]{-2D, 0.5D, 3D});
        AgentUtils.clamp(x, 0D, 1D);
        assertArrayEquals(new double[]{0D, 0.5D, 1D}, x.toDoubleVector(), 1e-12);
    }

    @Test
    void discountedSum() {
        assertEquals(1D + 0.5D*2D + 0.25D*4D, AgentUtils.discountedSum(new double[]{1D, 2D, 4D}, 0.5D), 1e-12);
        assertEquals(3D, AgentUtils.discountedSum(new double[]{3D, 5D}, 0D), 1e-12);
        assertEquals(0D, AgentUtils.discountedSum(new double[0], 0.9D), 1e-12);
    }
}
