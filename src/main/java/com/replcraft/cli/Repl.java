package com.replcraft.cli;

import com.replcraft.eval.Evaluator;
import com.replcraft.input.InvalidLiteralCharacterException;
import com.replcraft.input.MultilineReader;
import com.replcraft.input.ReadException;
import com.replcraft.input.ReadOption;
import com.replcraft.input.ReadResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.EnumSet;
import java.util.Set;

public final class Repl {
    private static final Logger logger = LoggerFactory.getLogger(Repl.class);

    private final MultilineReader reader;
    private final Evaluator evaluator;
    private final Set<ReadOption> opts;
    private final String prompt;
    private final PrintStream err;

    public Repl(MultilineReader reader, Evaluator evaluator, Set<ReadOption> opts, String prompt, PrintStream err) {
        this.reader = reader;
        this.evaluator = evaluator;
        this.opts = opts.isEmpty() ? EnumSet.noneOf(ReadOption.class) : EnumSet.copyOf(opts);
        this.prompt = prompt;
        this.err = err;
    }

    /** Reads and evaluates units until the input ends. Returns the exit status. */
    public int run() {
        int units = 0;
        try {
            while (true) {
                ReadResult unit;
                try {
                    unit = reader.read(opts, prompt);
                } catch (InvalidLiteralCharacterException e) {
                    // the rest of the line is dropped, start over
                    err.println(e.getMessage());
                    continue;
                }
                if (unit.hasCode()) {
                    units++;
                    handle(unit);
                }
                if (unit.eof()) break;
            }
        } catch (ReadException e) {
            logger.debug("Read failed after {} unit(s), partial input: {}", units, e.partialText(), e);
            err.println(e.getMessage());
            return 1;
        }
        logger.debug("End of input after {} unit(s)", units);
        return 0;
    }

    private void handle(ReadResult unit) {
        try {
            evaluator.evaluate(unit);
        } catch (RuntimeException e) {
            logger.debug("Evaluation failed", e);
            String msg = e.getMessage();
            if (msg != null && !msg.isEmpty()) err.println(msg);
        }
    }
}
