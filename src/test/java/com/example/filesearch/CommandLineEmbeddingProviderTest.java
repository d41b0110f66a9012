package com.example.filesearch;

import com.example.filesearch.testutils.CapturingProcess;
import com.example.filesearch.testutils.TestProcessRunner;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandLineEmbeddingProviderTest {

    private final MockEnvironment env = new MockEnvironment()
            .withProperty("embedding.dimension", "3")
            .withProperty("embedding.model", "embed-model:x");

    @Test
    public void writesTextToStdinAndParsesJsonArray() {
        CapturingProcess cp = CapturingProcess.printing("[0.1, 0.2, 0.3]\n");
        TestProcessRunner runner = new TestProcessRunner(cp);

        float[] v = new CommandLineEmbeddingProvider(env, runner).embed("hello text");

        assertThat(v).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(cp.getCapturedStdin()).isEqualTo("hello text");
        assertThat(runner.getCommands()).containsExactly(List.of("ollama", "embed", "embed-model:x"));
    }

    @Test
    public void parsesWhitespaceSeparatedOutput() {
        TestProcessRunner runner = new TestProcessRunner(CapturingProcess.printing("1.0 2.0\n3.0"));

        assertThat(new CommandLineEmbeddingProvider(env, runner).embed("x")).containsExactly(1f, 2f, 3f);
    }

    @Test
    public void wrongLengthFallsBackToZeroVector() {
        TestProcessRunner runner = new TestProcessRunner(CapturingProcess.printing("[1.0, 2.0]"));

        assertThat(new CommandLineEmbeddingProvider(env, runner).embed("x")).containsExactly(0f, 0f, 0f);
    }

    @Test
    public void failureToStartFallsBackToZeroVector() {
        TestProcessRunner runner = TestProcessRunner.failingWith(new IOException("no such command"));

        CommandLineEmbeddingProvider provider = new CommandLineEmbeddingProvider(env, runner);

        assertThat(provider.embed("x")).containsExactly(0f, 0f, 0f);
        assertThat(provider.dimension()).isEqualTo(3);
    }

    @Test
    public void timeoutFallsBackToZeroVector() {
        CapturingProcess hung = new CapturingProcess("[1,2,3]".getBytes(), new byte[0], 0, false);

        assertThat(new CommandLineEmbeddingProvider(env, new TestProcessRunner(hung)).embed("x")).containsOnly(0f);
    }
}
