package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code ollama run <model>} with the prompt on stdin and returns trimmed stdout.
 * The CLI takes no sampling flags, so {@link GenerationOptions} are only logged.
 */
@Service
public class OllamaTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OllamaTextGenerator.class);

    private final String command;
    private final String model;
    private final long timeoutSeconds;
    private final ProcessRunner processRunner;

    public OllamaTextGenerator(Environment env, ProcessRunner processRunner) {
        this.command = env.getProperty("ollama.command", "ollama");
        this.model = env.getProperty("ollama.model", "llama3.1:8b-instruct");
        this.timeoutSeconds = Long.parseLong(env.getProperty("ollama.timeout-seconds", "180"));
        this.processRunner = processRunner;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("run");
        cmd.add(model);

        log.info("Running {} [prompt length={}, {}]", String.join(" ", cmd), prompt.length(), options);
        log.debug("Prompt (truncated 1000 chars):\n{}", prompt.length() > 1000 ? prompt.substring(0, 1000) + "..." : prompt);

        Process proc;
        try {
            proc = processRunner.start(cmd);
        } catch (IOException e) {
            throw new GenerationUnavailableException("could not start " + String.join(" ", cmd), e);
        }

        try (OutputStream os = proc.getOutputStream()) {
            os.write(prompt.getBytes(StandardCharsets.UTF_8));
            os.flush();
        } catch (IOException io) {
            log.error("Error writing prompt to ollama stdin", io);
        }

        StringBuilder resp = new StringBuilder();
        StringBuilder err = new StringBuilder();
        Thread outReader = reader(proc, false, resp, "ollama-stdout-reader");
        Thread errReader = reader(proc, true, err, "ollama-stderr-reader");
        outReader.start();
        errReader.start();

        boolean finished;
        try {
            finished = proc.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            outReader.join(2000);
            errReader.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
            throw new GenerationUnavailableException("interrupted while waiting for ollama", e);
        }
        if (!finished) {
            log.warn("ollama did not finish within {}s, destroying", timeoutSeconds);
            proc.destroyForcibly();
            throw new GenerationUnavailableException("ollama timed out after " + timeoutSeconds + "s");
        }
        log.info("ollama exited with code {}", proc.exitValue());
        if (err.length() > 0) {
            log.warn("Stderr from ollama:\n{}", err.toString().trim());
        }

        String answer;
        synchronized (resp) {
            answer = resp.toString().trim();
        }
        if (answer.isEmpty()) {
            throw new GenerationUnavailableException("ollama returned no output; check that the model " + model + " is available");
        }
        return answer;
    }

    private static Thread reader(Process proc, boolean stderr, StringBuilder sink, String name) {
        return new Thread(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(
                    stderr ? proc.getErrorStream() : proc.getInputStream(), StandardCharsets.UTF_8))) {
                String l;
                while ((l = r.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(l).append("\n");
                    }
                }
            } catch (IOException io) {
                log.error("Error reading ollama {}", stderr ? "stderr" : "stdout", io);
            }
        }, name);
    }
}
