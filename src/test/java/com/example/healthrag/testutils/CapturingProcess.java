package com.example.healthrag.testutils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Fake process with canned stdout/stderr that records what was written to stdin.
 */
public class CapturingProcess extends Process {
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final ByteArrayInputStream stdout;
    private final ByteArrayInputStream stderr;
    private final int exitCode;
    private final boolean finishes;
    private boolean destroyed;

    public CapturingProcess(String stdoutText, String stderrText, int exitCode) {
        this(stdoutText, stderrText, exitCode, true);
    }

    public CapturingProcess(String stdoutText, String stderrText, int exitCode, boolean finishes) {
        this.stdout = new ByteArrayInputStream(bytes(stdoutText));
        this.stderr = new ByteArrayInputStream(bytes(stderrText));
        this.exitCode = exitCode;
        this.finishes = finishes;
    }

    private static byte[] bytes(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
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
        destroyed = true;
    }

    @Override
    public Process destroyForcibly() {
        destroyed = true;
        return this;
    }

    @Override
    public boolean isAlive() {
        return !finishes && !destroyed;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public String getCapturedStdin() {
        return new String(stdin.toByteArray(), StandardCharsets.UTF_8);
    }
}
