package com.example.filesearch;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
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
 * Query rewriting through a local LLM: runs {@code ollama run <model>} with the rewrite prompt on stdin
 * and takes the first non-empty line of stdout as the new query.
 */
@Service
@ConditionalOnProperty(prefix = "query.optimizer", name = "enabled", havingValue = "true")
public class OllamaQueryOptimizer implements QueryOptimizer {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(OllamaQueryOptimizer.class);

    private final String command;
    private final String model;
    private final long timeoutSeconds;
    private final QueryRewritePromptBuilder promptBuilder;
    private final ProcessRunner processRunner;

    public OllamaQueryOptimizer(Environment env, QueryRewritePromptBuilder promptBuilder, ProcessRunner processRunner) {
        this.command = env.getProperty("query.optimizer.command", "ollama");
        this.model = env.getProperty("query.optimizer.model", "llama3.2");
        this.timeoutSeconds = Long.parseLong(env.getProperty("query.optimizer.timeout.seconds", "30"));
        this.promptBuilder = promptBuilder;
        this.processRunner = processRunner;
    }

    @Override
    public String optimize(String query) {
        try {
            String raw = run(promptBuilder.build(query));
            String rewritten = firstLine(raw.replace("Output:", ""));
            if (rewritten.isEmpty()) {
                log.warn("Query optimizer returned no text; keeping original query");
                return query;
            }
            log.info("Optimized query '{}' -> '{}'", query, rewritten);
            return rewritten;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return query;
        } catch (Exception e) {
            log.warn("Error in query optimization: {}", e.getMessage());
            return query;
        }
    }

    private String run(String prompt) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("run");
        cmd.add(model);
        log.debug("Running command: {} [prompt length={}]", String.join(" ", cmd), prompt.length());

        Process proc = processRunner.start(cmd);
        try (OutputStream os = proc.getOutputStream()) {
            os.write(prompt.getBytes(StandardCharsets.UTF_8));
            os.flush();
        }

        StringBuilder resp = new StringBuilder();
        Thread outReader = new Thread(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
                String l;
                while ((l = r.readLine()) != null) {
                    synchronized (resp) { resp.append(l).append('\n'); }
                }
            } catch (IOException io) {
                log.warn("Error reading optimizer stdout: {}", io.getMessage());
            }
        }, "optimizer-stdout-reader");
        outReader.start();

        boolean finished = proc.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        outReader.join(2000);
        if (!finished) {
            proc.destroyForcibly();
            throw new IOException("optimizer did not finish within " + timeoutSeconds + "s");
        }
        if (proc.exitValue() != 0) {
            throw new IOException("optimizer exited with code " + proc.exitValue());
        }
        synchronized (resp) {
            return resp.toString();
        }
    }

    private static String firstLine(String text) {
        for (String line : text.split("\\R")) {
            String t = line.trim();
            if (!t.isEmpty()) return t;
        }
        return "";
    }
}
