package io.tasktree.adapter.langchain4j;

/// Price of a model per thousand tokens.
///
/// @param inputPer1k price of 1,000 prompt tokens
/// @param outputPer1k price of 1,000 completion tokens
public record ModelPricing(double inputPer1k, double outputPer1k) {

    public ModelPricing {
        if (inputPer1k < 0 || outputPer1k < 0) {
            throw new IllegalArgumentException("Prices must not be negative");
        }
    }

    /// @param promptTokens prompt token count
    /// @param completionTokens completion token count
    /// @return the cost of the call
    public double cost(int promptTokens, int completionTokens) {
        return promptTokens / 1000.0 * inputPer1k + completionTokens / 1000.0 * outputPer1k;
    }
}
