package com.example.healthrag;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * EmbeddingService that shells out to a configured command (default: `ollama embed <model>`),
 * writes the text to stdin and parses stdout as either a JSON array of floats or
 * whitespace/comma separated floats.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "true", matchIfMissing = false)
public class CommandLineEmbeddingService implements EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(CommandLineEmbeddingService.class);

    private final String command;
    private final String model;
    private final long timeoutSeconds;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public CommandLineEmbeddingService(Environment env, ProcessRunner runner) {
        this.command = env.getProperty("embedding.command", "ollama");
        this.model = env.getProperty("embedding.model", "all-minilm");
        this.timeoutSeconds = Long.parseLong(env.getProperty("embedding.timeout-seconds", "30"));
        this.runner = runner;
    }

    @Override
    public float[] embed(String text) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("embed");
        cmd.add(model);
        String resp;
        try {
            Process p = runner.start(cmd);

            try (OutputStream os = p.getOutputStream()) {
                os.write(text.getBytes(StandardCharsets.UTF_8));
                os.flush();
            }

            StringBuilder out = new StringBuilder();
            try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String l;
                while ((l = r.readLine()) != null) { out.append(l).append('\n'); }
            }

            if (!p.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                throw new EmbeddingUnavailableException("embedding command timed out after " + timeoutSeconds + "s: " + String.join(" ", cmd));
            }
            resp = out.toString().trim();
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("interrupted while waiting for embedding command", e);
        } catch (Exception e) {
            log.warn("Embedding command failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("embedding command failed: " + String.join(" ", cmd), e);
        }

        if (resp.isEmpty()) {
            throw new EmbeddingUnavailableException("embedding command returned no output: " + String.join(" ", cmd));
        }
        return parse(resp);
    }

    float[] parse(String resp) {
        if (resp.startsWith("[")) {
            try {
                return mapper.readValue(resp, float[].class);
            } catch (Exception e) {
                log.debug("Embedding output is not a JSON float array, trying plain format: {}", e.getMessage());
            }
        }
        String cleaned = resp.replaceAll("[\\[\\],\\s]+", " ").trim();
        String[] parts = cleaned.split(" ");
        float[] outv = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) outv[i] = Float.parseFloat(parts[i]);
        } catch (NumberFormatException e) {
            throw new EmbeddingUnavailableException("unparseable embedding output", e);
        }
        return outv;
    }
}
