package org.ascenoria.content.reload;

import org.ascenoria.content.decode.DataFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Watches directory trees with a {@link WatchService}.
 * <p>
 * All directories below the roots are registered, including directories created later.
 * Only content files, directories and deletions are reported, so editor swap files do not
 * trigger reloads. Roots that do not exist when watching starts are ignored.
 */
public class FileSystemChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemChangeSource.class);

    private final List<Path> roots;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private Thread watcherThread;

    public FileSystemChangeSource(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    @Override
    public synchronized void start(Consumer<ChangeEvent> sink) throws IOException {
        if (watchService != null) {
            throw new IllegalStateException("Change source already started");
        }
        watchService = FileSystems.getDefault().newWatchService();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                registerTree(root);
            } else {
                log.debug("Not watching {}: no such directory", root);
            }
        }
        watcherThread = new Thread(() -> watch(sink), "content-watcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
        log.debug("Watching {} director(ies) under {}", directories.size(), roots);
    }

    private void registerTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                directories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void watch(Consumer<ChangeEvent> sink) {
        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            final Path directory = directories.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW || directory == null) {
                    sink.accept(ChangeEvent.overflow(directory));
                    continue;
                }
                final Path changed = directory.resolve((Path) event.context());
                final boolean isDirectory = Files.isDirectory(changed);
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && isDirectory) {
                    try {
                        registerTree(changed);
                    } catch (IOException e) {
                        log.warn("Cannot watch new directory {}: {}", changed, e.getMessage());
                    }
                }
                if (isDirectory || DataFormat.isContentFile(changed)
                        || event.kind() == StandardWatchEventKinds.ENTRY_DELETE) {
                    log.trace("{} {}", event.kind().name(), changed);
                    sink.accept(ChangeEvent.fileChanged(changed));
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (watcherThread != null) {
            watcherThread.interrupt();
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
        }
        directories.clear();
    }
}
