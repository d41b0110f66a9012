package com.example.filesearch;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class IndexBootstrapRunnerTest {

    private final FileScanner scanner = Mockito.mock(FileScanner.class);
    private final ChangeMonitor monitor = Mockito.mock(ChangeMonitor.class);
    private final ScanLogWriter logWriter = Mockito.mock(ScanLogWriter.class);

    @Test
    public void scansLogsThenStartsMonitor() throws Exception {
        ScanResult result = new ScanResult(List.of(), Instant.now(), List.of("/a", "/b"), List.of());
        when(scanner.scanDirectories(any())).thenReturn(result);

        IndexBootstrapRunner runner = new IndexBootstrapRunner(scanner, monitor, logWriter, ProgressListener.NONE, " /a , /b ", true);
        runner.run();

        List<Path> roots = List.of(Path.of("/a"), Path.of("/b"));
        assertThat(runner.getRoots()).isEqualTo(roots);
        org.mockito.InOrder order = Mockito.inOrder(scanner, logWriter, monitor);
        order.verify(scanner).scanDirectories(roots);
        order.verify(logWriter).write(result);
        order.verify(monitor).start(roots);
    }

    @Test
    public void noRootsMeansNothingToDo() throws Exception {
        new IndexBootstrapRunner(scanner, monitor, logWriter, ProgressListener.NONE, "", true).run();

        verify(scanner, never()).scanDirectories(any());
        verify(monitor, never()).start(any());
    }

    @Test
    public void monitorDisabledStillScans() throws Exception {
        when(scanner.scanDirectories(any())).thenReturn(new ScanResult(List.of(), Instant.now(), List.of("/a"), List.of()));

        new IndexBootstrapRunner(scanner, monitor, logWriter, ProgressListener.NONE, "/a", false).run();

        verify(scanner).scanDirectories(List.of(Path.of("/a")));
        verify(monitor, never()).start(any());
    }
}
