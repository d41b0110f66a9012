package com.example.filesearch;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

public class ScanJobServiceTest {

    @Test
    public void runsScanInBackgroundAndReportsStatus() throws Exception {
        FileScanner mockScanner = Mockito.mock(FileScanner.class);
        ScanLogWriter logWriter = Mockito.mock(ScanLogWriter.class);
        CountDownLatch release = new CountDownLatch(1);
        ScanResult result = new ScanResult(List.of(), Instant.now(), List.of("/a"), List.of("/a/x.txt: boom"));
        Mockito.when(mockScanner.scanDirectories(any())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return result;
        });

        ScanJobService svc = new ScanJobService(mockScanner, logWriter);
        try {
            String jobId = svc.startJob(List.of(Path.of("/a")));
            assertThat(jobId).isNotNull();
            // a second start while running hands back the same job
            assertThat(svc.startJob(List.of(Path.of("/b")))).isEqualTo(jobId);
            assertThat(svc.status().get("running")).isEqualTo(true);

            release.countDown();
            verify(logWriter, timeout(2000)).write(result);
            TimeUnit.MILLISECONDS.sleep(100);

            Map<String, Object> st = svc.status();
            assertThat(st.get("jobId")).isEqualTo(jobId);
            assertThat(st.get("running")).isEqualTo(false);
            assertThat(st.get("errors")).isEqualTo(List.of("/a/x.txt: boom"));
            assertThat(st.get("roots")).isEqualTo(List.of(Path.of("/a").toString()));
            assertThat(st.get("finishedAt")).isNotNull();
        } finally {
            svc.shutdown();
        }
    }

    @Test
    public void cancelWithoutJobReportsNoJob() {
        ScanJobService svc = new ScanJobService(Mockito.mock(FileScanner.class), Mockito.mock(ScanLogWriter.class));
        try {
            assertThat(svc.cancel()).isFalse();
            assertThat(svc.status().get("running")).isEqualTo(false);
        } finally {
            svc.shutdown();
        }
    }

    @Test
    public void cancelInterruptsRunningJob() throws Exception {
        FileScanner mockScanner = Mockito.mock(FileScanner.class);
        CountDownLatch started = new CountDownLatch(1);
        Mockito.when(mockScanner.scanDirectories(any())).thenAnswer(inv -> {
            started.countDown();
            Thread.sleep(10_000);
            return new ScanResult(List.of(), Instant.now(), List.of(), List.of());
        });
        ScanJobService svc = new ScanJobService(mockScanner, Mockito.mock(ScanLogWriter.class));
        try {
            svc.startJob(List.of(Path.of("/slow")));
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            assertThat(svc.cancel()).isTrue();

            assertThat(svc.status().get("cancelled")).isEqualTo(true);
            assertThat(svc.isRunning()).isFalse();
        } finally {
            svc.shutdown();
        }
    }
}
