package com.replcraft.eval;

import com.replcraft.input.ReadResult;

import java.io.PrintStream;

/** Prints the code of each unit back, without the leading comments. */
public final class EchoEvaluator implements Evaluator {
    private final PrintStream out;

    public EchoEvaluator(PrintStream out) {
        this.out = out;
    }

    @Override
    public void evaluate(ReadResult unit) {
        String code = unit.code();
        if (code.isEmpty()) return;
        out.print(code);
        if (!code.endsWith("\n")) out.print('\n');
        out.flush();
    }
}
