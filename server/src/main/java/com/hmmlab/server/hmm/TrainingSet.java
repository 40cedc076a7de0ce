package com.hmmlab.server.hmm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of K >= 1 observation sequences over symbols [0, M).
 * Sequences are validated on construction and never modified afterwards.
 */
public class TrainingSet {
    private final int numSymbols;
    private final List<int[]> sequences;

    public TrainingSet(int numSymbols, List<int[]> sequences) {
        if (numSymbols < 1) {
            throw new HmmValidationException("Symbol count M must be >= 1, got " + numSymbols);
        }
        if (sequences == null || sequences.isEmpty()) {
            throw new HmmValidationException("Sequence count K must be >= 1, got 0");
        }
        List<int[]> copies = new ArrayList<>(sequences.size());
        for (int k = 0; k < sequences.size(); k++) {
            int[] seq = sequences.get(k);
            if (seq == null || seq.length == 0) {
                throw new HmmValidationException("Sequence " + k + " is empty; length T must be >= 1");
            }
            for (int t = 0; t < seq.length; t++) {
                if (seq[t] < 0 || seq[t] >= numSymbols) {
                    throw new HmmValidationException("Symbol index " + seq[t] + " at position " + t + " of sequence "
                            + k + " outside [0, " + numSymbols + ")");
                }
            }
            copies.add(seq.clone());
        }
        this.numSymbols = numSymbols;
        this.sequences = Collections.unmodifiableList(copies);
    }

    public static TrainingSet of(int numSymbols, int[]... sequences) {
        return new TrainingSet(numSymbols, List.of(sequences));
    }

    public int getNumSymbols() {
        return numSymbols;
    }

    public int size() {
        return sequences.size();
    }

    public int[] get(int k) {
        return sequences.get(k);
    }

    public List<int[]> getSequences() {
        return sequences;
    }

    public long totalLength() {
        long total = 0;
        for (int[] seq : sequences) {
            total += seq.length;
        }
        return total;
    }
}
