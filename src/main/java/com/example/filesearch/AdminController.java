package com.example.filesearch;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/index")
public class AdminController {

    @Autowired
    private VectorIndex vectorIndex;

    @Autowired
    private ChangeMonitor changeMonitor;

    @Autowired
    private ScanJobService scanJobService;

    @Autowired
    private FileScanner fileScanner;

    @Autowired
    private RecentActivityListener activity;

    @GetMapping("/status")
    public Object status() {
        try {
            Map<String, Object> out = new HashMap<>();
            out.put("count", vectorIndex.count());
            out.put("dimension", vectorIndex.dimension());
            out.put("roots", changeMonitor.getRoots().stream().map(Path::toString).sorted().collect(Collectors.toList()));
            out.put("monitorRunning", changeMonitor.isRunning());
            out.put("extensions", fileScanner.getExtensions().stream().sorted().collect(Collectors.toList()));
            return out;
        } catch (Exception e) {
            return Collections.singletonMap("error", e.getMessage());
        }
    }

    /**
     * Adds a monitored root and indexes it with a background scan job.
     */
    @PostMapping("/roots")
    public Object addRoot(@RequestParam(name = "path") String path) {
        try {
            Path root = changeMonitor.addRoot(Path.of(path));
            String jobId = scanJobService.startJob(List.of(root));
            Map<String, Object> out = new HashMap<>();
            out.put("root", root.toString());
            out.put("jobId", jobId);
            return out;
        } catch (Exception e) {
            return "add root failed: " + e.getMessage();
        }
    }

    @DeleteMapping("/roots")
    public String removeRoot(@RequestParam(name = "path") String path) {
        try {
            int removed = changeMonitor.removeRoot(Path.of(path));
            return "removed=" + removed;
        } catch (PartialRemovalException e) {
            return "removed=" + e.getRemoved() + ", errors=" + e.getErrors().size();
        } catch (Exception e) {
            return "remove root failed: " + e.getMessage();
        }
    }

    @PostMapping("/scan/start")
    public Object startScan() {
        try {
            List<Path> roots = changeMonitor.getRoots().stream().sorted().collect(Collectors.toList());
            if (roots.isEmpty()) return "no roots configured";
            String jobId = scanJobService.startJob(roots);
            return Collections.singletonMap("jobId", jobId);
        } catch (Exception e) {
            return "start failed: " + e.getMessage();
        }
    }

    @PostMapping("/scan/cancel")
    public String cancelScan() {
        try {
            boolean ok = scanJobService.cancel();
            return ok ? "cancelled" : "no-job";
        } catch (Exception e) {
            return "cancel failed: " + e.getMessage();
        }
    }

    @GetMapping("/scan/status")
    public Object scanStatus() {
        try {
            return scanJobService.status();
        } catch (Exception e) {
            return Collections.singletonMap("error", e.getMessage());
        }
    }

    @GetMapping("/activity")
    public List<String> recentActivity() {
        return activity.recent();
    }
}
