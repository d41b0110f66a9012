package com.example.filesearch.testutils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Process stand-in: canned stdout and exit code, records whatever is written to stdin.
 */
public class CapturingProcess extends Process {
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final ByteArrayInputStream stdout;
    private final ByteArrayInputStream stderr;
    private final int exitCode;
    private final boolean finishes;

    public CapturingProcess(byte[] stdoutBytes, byte[] stderrBytes, int exitCode) {
        this(stdoutBytes, stderrBytes, exitCode, true);
    }

    public CapturingProcess(byte[] stdoutBytes, byte[] stderrBytes, int exitCode, boolean finishes) {
        this.stdout = new ByteArrayInputStream(stdoutBytes == null ? new byte[0] : stdoutBytes);
        this.stderr = new ByteArrayInputStream(stderrBytes == null ? new byte[0] : stderrBytes);
        this.exitCode = exitCode;
        this.finishes = finishes;
    }

    public static CapturingProcess printing(String stdoutText) {
        return new CapturingProcess(stdoutText.getBytes(StandardCharsets.UTF_8), new byte[0], 0);
    }

    @Override
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                stdin.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                stdin.write(b, off, len);
            }
        };
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() {
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) {
        return finishes;
    }

    @Override
    public int exitValue() {
        return exitCode;
    }

    @Override
    public void destroy() {
        // no-op
    }

    @Override
    public Process destroyForcibly() {
        return this;
    }

    @Override
    public boolean isAlive() {
        return !finishes;
    }

    public String getCapturedStdin() {
        return stdin.toString(StandardCharsets.UTF_8);
    }
}
