package com.forge.script.host;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/** HostIO over a reader/writer pair, stdin/stdout by default. Output is flushed per call. */
public class StdHostIO implements HostIO {
    private final BufferedReader in;
    private final Writer out;

    public StdHostIO() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    public StdHostIO(Reader in, Writer out) {
        this.in = (in instanceof BufferedReader) ? (BufferedReader) in : new BufferedReader(in);
        this.out = out;
    }

    @Override
    public void print(String text) {
        try {
            out.write(text);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("write to host output failed", e);
        }
    }

    @Override
    public String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("read from host input failed", e);
        }
    }
}
