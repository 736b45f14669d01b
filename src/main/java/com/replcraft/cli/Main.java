package com.replcraft.cli;

import com.replcraft.env.Env;
import com.replcraft.eval.EchoEvaluator;
import com.replcraft.input.LineSource;
import com.replcraft.input.MultilineReader;
import com.replcraft.input.ReadOption;
import com.replcraft.scan.GoKeywords;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.EnumSet;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Env env = Env.system();

        EnumSet<ReadOption> opts = EnumSet.of(ReadOption.SHOW_PROMPT);
        if (env.collectAllComments()) opts.add(ReadOption.COLLECT_ALL_COMMENTS);
        boolean trace = env.trace();
        String file = null;

        for (String arg : args) {
            if ("--no-prompt".equals(arg)) opts.remove(ReadOption.SHOW_PROMPT);
            else if ("--all-comments".equals(arg)) opts.add(ReadOption.COLLECT_ALL_COMMENTS);
            else if ("--trace".equals(arg)) trace = true;
            else if (arg.startsWith("--")) {
                System.err.println("unknown option: " + arg);
                System.exit(2);
            } else file = arg;
        }
        // scripts are read without prompts
        if (file != null) opts.remove(ReadOption.SHOW_PROMPT);

        Logger traceLogger = trace ? traceLogger() : NOPLogger.NOP_LOGGER;

        int status;
        try (InputStream in = file == null ? System.in : Files.newInputStream(Paths.get(file))) {
            MultilineReader reader = new MultilineReader(
                    new LineSource(in), System.out, new GoKeywords(env.extraKeywords()), traceLogger);
            status = new Repl(reader, new EchoEvaluator(System.out), opts, env.prompt(), System.err).run();
        } catch (IOException e) {
            System.err.println("Fatal I/O Error: " + e.getMessage());
            status = 1;
        }
        System.exit(status);
    }

    private static Logger traceLogger() {
        Logger log = LoggerFactory.getLogger(MultilineReader.class);
        if (log instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) log).setLevel(ch.qos.logback.classic.Level.DEBUG);
        } else {
            logger.warn("Tracing needs the logback binding, got {}", log.getClass().getName());
        }
        return log;
    }
}
