package com.example.filesearch.testutils;

import com.example.filesearch.ProcessRunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class TestProcessRunner implements ProcessRunner {
    private final CapturingProcess process;
    private final List<List<String>> commands = new ArrayList<>();
    private IOException failure;

    public TestProcessRunner(CapturingProcess process) {
        this.process = process;
    }

    public static TestProcessRunner failingWith(IOException failure) {
        TestProcessRunner runner = new TestProcessRunner(null);
        runner.failure = failure;
        return runner;
    }

    @Override
    public Process start(List<String> command) throws IOException {
        commands.add(List.copyOf(command));
        if (failure != null) throw failure;
        return process;
    }

    public List<List<String>> getCommands() {
        return commands;
    }
}
