package com.example.filesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Recursive directory watch on top of the JDK {@link WatchService}. Emits {@link ChangeEvent}s onto a queue
 * and knows nothing about indexing.
 * <p>
 * The JDK reports a rename as a delete of the old name plus a create of the new one, so no
 * {@link ChangeKind#MOVED} events come from here. Directories created after registration are registered on
 * the fly, and files already inside them are reported as created.
 */
public class DirectoryWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final WatchService watchService;
    private final BlockingQueue<ChangeEvent> events;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final Set<Path> roots = ConcurrentHashMap.newKeySet();
    private volatile Thread thread;

    public DirectoryWatcher(BlockingQueue<ChangeEvent> events) throws IOException {
        this.watchService = FileSystems.getDefault().newWatchService();
        this.events = events;
    }

    /**
     * Watches {@code root} and every directory below it.
     */
    public synchronized void register(Path root) throws IOException {
        registerTree(root);
        roots.add(root);
    }

    private void registerTree(Path top) throws IOException {
        Files.walkFileTree(top, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                registerOne(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot watch '{}': {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerOne(Path dir) throws IOException {
        WatchKey key = dir.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
        keys.put(key, dir);
    }

    /**
     * Stops watching {@code root} and everything below it, except directories that another registered
     * root still covers.
     */
    public synchronized void unregister(Path root) {
        roots.remove(root);
        keys.entrySet().removeIf(e -> {
            Path dir = e.getValue();
            if (dir.startsWith(root) && roots.stream().noneMatch(dir::startsWith)) {
                e.getKey().cancel();
                return true;
            }
            return false;
        });
    }

    public int watchedDirectoryCount() {
        return keys.size();
    }

    public synchronized void start() {
        if (thread != null) return;
        thread = new Thread(this::loop, "directory-watcher");
        thread.setDaemon(true);
        thread.start();
    }

    private void loop() {
        while (true) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed; watcher loop exits");
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            Path dir = keys.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch events overflowed for {}; some changes were lost until the next scan", dir);
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
                    if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                        onDirectoryCreated(child);
                    } else {
                        events.offer(ChangeEvent.of(child, ChangeKind.CREATED));
                    }
                } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
                    events.offer(ChangeEvent.of(child, ChangeKind.MODIFIED));
                } else if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
                    events.offer(ChangeEvent.of(child, ChangeKind.DELETED));
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void onDirectoryCreated(Path dir) {
        try {
            registerTree(dir);
            try (Stream<Path> files = Files.walk(dir)) {
                files.filter(Files::isRegularFile).forEach(f -> events.offer(ChangeEvent.of(f, ChangeKind.CREATED)));
            }
        } catch (IOException e) {
            log.warn("Failed to watch new directory '{}': {}", dir, e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        watchService.close();
        Thread t = thread;
        if (t != null) {
            try {
                t.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        keys.clear();
        roots.clear();
    }
}
