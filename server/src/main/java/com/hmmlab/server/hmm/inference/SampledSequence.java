package com.hmmlab.server.hmm.inference;

public class SampledSequence {
    private final int[] states;
    private final int[] symbols;

    public SampledSequence(int[] states, int[] symbols) {
        this.states = states;
        this.symbols = symbols;
    }

    public int[] getStates() {
        return states;
    }

    public int[] getSymbols() {
        return symbols;
    }

    public int length() {
        return states.length;
    }
}
