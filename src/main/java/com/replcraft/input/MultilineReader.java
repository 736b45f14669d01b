package com.replcraft.input;

import com.replcraft.scan.Continuation;
import com.replcraft.scan.KeywordTable;
import com.replcraft.scan.KeywordTail;
import com.replcraft.scan.ScanState;
import com.replcraft.scan.Step;
import com.replcraft.scan.Transitions;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Set;

/**
 * Reads lines until they form one complete unit: brackets balanced, no
 * literal or block comment open, no trailing operator or clause keyword.
 * Each {@link #read} call is one episode with fresh scanner state; the
 * line source is shared between episodes.
 */
public final class MultilineReader {
    // U+2029 PARAGRAPH SEPARATOR, pasted from rich text
    private static final byte[] PARAGRAPH_SEPARATOR = { (byte) 0xe2, (byte) 0x80, (byte) 0xa9 };

    private final LineSource in;
    private final PrintStream out;
    private final KeywordTail keywordTail;
    private final Logger trace;

    public MultilineReader(LineSource in, PrintStream out, KeywordTable keywords) {
        this(in, out, keywords, NOPLogger.NOP_LOGGER);
    }

    public MultilineReader(LineSource in, PrintStream out, KeywordTable keywords, Logger trace) {
        this.in = in;
        this.out = out;
        this.keywordTail = new KeywordTail(keywords);
        this.trace = trace;
    }

    /**
     * Reads one unit.
     *
     * @throws InvalidLiteralCharacterException on a control byte inside a rune or string literal
     * @throws UnexpectedEndOfInputException when the input ends inside brackets
     * @throws ReadException when the input fails; the cause is the original error
     */
    public ReadResult read(Set<ReadOption> opts, String prompt) throws ReadException {
        boolean showPrompt = opts.contains(ReadOption.SHOW_PROMPT);
        boolean allComments = opts.contains(ReadOption.COLLECT_ALL_COMMENTS);
        ScanState st = new ScanState();

        if (showPrompt) {
            out.print(prompt);
            out.flush();
        }

        Line line;
        while (true) {
            line = in.next();
            byte[] bytes = replaceParagraphSeparators(line.bytes());
            int lineStart = st.length();

            scanLine(st, bytes);
            st.endLine(bytes);

            if (line.last()) break;

            if (Continuation.lineComplete(st, allComments)) {
                if (st.hasFirstToken() && keywordTail.forcesContinuation(bytes, st.lastToken() - lineStart)) {
                    trace.debug("line ends with a clause keyword, reading on");
                    st.suppressCompletion(true);
                } else {
                    break;
                }
            }
            if (trace.isDebugEnabled()) {
                trace.debug("continuing\tmode={}\tparen={} ignorenl={}", st.mode(), st.parenDepth(), st.suppressCompletion());
            }
            if (showPrompt) ContinuationPrompt.print(out, ContinuationPrompt.width(st.parenDepth()));
        }

        if (st.unmatchedClosers() > 0) {
            trace.debug("ignored {} unmatched closing bracket(s)", st.unmatchedClosers());
        }
        if (line.error() != null) {
            throw new ReadException(line.error().getMessage(), line.error(), st.bytes(), st.firstToken());
        }
        if (line.eof() && st.parenDepth() > 0) {
            throw new UnexpectedEndOfInputException(st.bytes(), st.firstToken());
        }

        ReadResult result = new ReadResult(st.bytes(), st.firstToken(), line.eof());
        if (trace.isDebugEnabled()) {
            trace.debug("read {} bytes, firstToken at {}", st.length(), st.firstToken());
            trace.debug("comments: {}", quote(result.comments()));
            trace.debug("tokens: {}", quote(result.code()));
        }
        return result;
    }

    private void scanLine(ScanState st, byte[] line) throws InvalidLiteralCharacterException {
        for (int i = 0; i < line.length; i++) {
            int ch = line[i] & 0xff;
            if (trace.isDebugEnabled()) {
                trace.debug("found {}\tmode={}\tparen={} ignorenl={}",
                        InvalidLiteralCharacterException.quote(ch), st.mode(), st.parenDepth(), st.suppressCompletion());
            }

            Step s = Transitions.step(st.mode(), ch, st.parenDepth());
            if (s.isInvalid()) {
                byte[] partial = concat(st.bytes(), line, i + 1);
                throw new InvalidLiteralCharacterException(ch, s.invalidLiteral(), partial, st.firstToken());
            }
            if (s.shebang()) {
                line[i - 1] = '/';
                line[i] = '/';
            }

            boolean hadFirst = st.hasFirstToken();
            st.apply(s, i);
            if (!hadFirst && st.hasFirstToken() && trace.isDebugEnabled()) {
                trace.debug("setting firstToken to {}, line up to it = {}", st.firstToken().getAsInt(),
                        quote(new String(line, 0, st.firstToken().getAsInt() - st.length(), StandardCharsets.UTF_8)));
            }
        }
    }

    static byte[] replaceParagraphSeparators(byte[] line) {
        if (indexOf(line, 0) < 0) return line;

        ByteArrayOutputStream out = new ByteArrayOutputStream(line.length);
        int from = 0;
        int at;
        while ((at = indexOf(line, from)) >= 0) {
            out.write(line, from, at - from);
            out.write('\n');
            from = at + PARAGRAPH_SEPARATOR.length;
        }
        out.write(line, from, line.length - from);
        return out.toByteArray();
    }

    private static int indexOf(byte[] line, int from) {
        outer:
        for (int i = from; i <= line.length - PARAGRAPH_SEPARATOR.length; i++) {
            for (int j = 0; j < PARAGRAPH_SEPARATOR.length; j++) {
                if (line[i + j] != PARAGRAPH_SEPARATOR[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static byte[] concat(byte[] head, byte[] tail, int tailLen) {
        byte[] all = Arrays.copyOf(head, head.length + tailLen);
        System.arraycopy(tail, 0, all, head.length, tailLen);
        return all;
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t") + "\"";
    }
}
