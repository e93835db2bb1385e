package org.janelia.calibration.spec;

import java.util.function.UnaryOperator;

/**
 * Regularization parameter for Wiener deconvolution (trade-off between sharpness and smoothness).
 *
 * @author Eric Trautman
 */
public class DeconvolutionBalance
        implements CalibrationPayload {

    private final double balance;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DeconvolutionBalance() {
        this(0.0);
    }

    public DeconvolutionBalance(final double balance) {
        this.balance = balance;
    }

    public double getBalance() {
        return balance;
    }

    @Override
    public DeconvolutionBalance mapArrays(final UnaryOperator<CoefficientArray> operator) {
        return this;
    }

    @Override
    public String describe() {
        return String.valueOf(balance);
    }
}
