package com.example.filesearch;

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
 * EmbeddingProvider that shells out to a configured command (default: {@code ollama embed <model>}),
 * writes the text to stdin and parses stdout as either a JSON array of floats or
 * whitespace/comma separated floats.
 * <p>
 * Any failure, including a vector of the wrong length, yields a zero vector of the configured dimension.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "true")
public class CommandLineEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(CommandLineEmbeddingProvider.class);

    private final String command;
    private final String model;
    private final int dimension;
    private final long timeoutSeconds;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public CommandLineEmbeddingProvider(Environment env, ProcessRunner runner) {
        this.command = env.getProperty("embedding.command", "ollama");
        this.model = env.getProperty("embedding.model", "nomic-embed-text");
        this.dimension = Integer.parseInt(env.getProperty("embedding.dimension", "384"));
        this.timeoutSeconds = Long.parseLong(env.getProperty("embedding.timeout.seconds", "60"));
        this.runner = runner;
    }

    @Override
    public float[] embed(String text) {
        try {
            List<String> cmd = new ArrayList<>();
            cmd.add(command);
            cmd.add("embed");
            cmd.add(model);

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
                log.warn("Embedding command did not finish within {}s; using zero vector", timeoutSeconds);
                return new float[dimension];
            }

            float[] parsed = parse(out.toString().trim());
            if (parsed.length != dimension) {
                log.warn("Embedding command returned {} values, expected {}; using zero vector", parsed.length, dimension);
                return new float[dimension];
            }
            return parsed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for embedding command; using zero vector");
            return new float[dimension];
        } catch (Exception e) {
            log.warn("Embedding failed: {}; using zero vector", e.getMessage());
            return new float[dimension];
        }
    }

    private float[] parse(String resp) throws Exception {
        if (resp.isEmpty()) return new float[0];
        if (resp.startsWith("[")) {
            return mapper.readValue(resp, float[].class);
        }
        String[] parts = resp.replaceAll("[,\\s]+", " ").trim().split(" ");
        float[] v = new float[parts.length];
        for (int i = 0; i < parts.length; i++) v[i] = Float.parseFloat(parts[i]);
        return v;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
