package com.example.healthrag;

/**
 * Sampling hints for one generation call. Backends that cannot honour them ignore them.
 */
public final class GenerationOptions {

    public static final GenerationOptions INSIGHT = new GenerationOptions(0.2, 300);
    public static final GenerationOptions TREND = new GenerationOptions(0.1, 300);

    private final double temperature;
    private final int maxOutputTokens;

    public GenerationOptions(double temperature, int maxOutputTokens) {
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    public double getTemperature() { return temperature; }
    public int getMaxOutputTokens() { return maxOutputTokens; }

    @Override
    public String toString() {
        return "temperature=" + temperature + ", maxOutputTokens=" + maxOutputTokens;
    }
}
