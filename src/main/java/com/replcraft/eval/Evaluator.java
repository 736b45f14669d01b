package com.replcraft.eval;

import com.replcraft.input.ReadResult;

/**
 * Consumer of complete units, typically a parser followed by an interpreter.
 */
public interface Evaluator {
    void evaluate(ReadResult unit);
}
