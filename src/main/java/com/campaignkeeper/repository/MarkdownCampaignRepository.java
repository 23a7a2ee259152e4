package com.campaignkeeper.repository;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.CampaignState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Keeps campaign saves as Markdown documents in a single directory.
 */
public class MarkdownCampaignRepository implements CampaignRepository, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarkdownCampaignRepository.class);

    private final Path savesDirectory;
    private final SaveFileWriter writer;
    private final SaveFileParser parser;
    private final Clock clock;
    private final ExecutorService saveExecutor;

    public MarkdownCampaignRepository(Path savesDirectory, Clock clock) {
        this.savesDirectory = savesDirectory;
        this.writer = new SaveFileWriter();
        this.parser = new SaveFileParser();
        this.clock = clock;
        this.saveExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "campaign-saver");
            thread.setDaemon(true);
            return thread;
        });
    }

    public Path getSavesDirectory() {
        return savesDirectory;
    }

    @Override
    public Path save(CampaignState state) {
        String document = writer.render(state);
        Path target = savesDirectory.resolve(SaveFileNames.fileName(state.getName(), clock.instant()));
        Path temp = null;
        try {
            Files.createDirectories(savesDirectory);
            temp = Files.createTempFile(savesDirectory, ".saving-", ".tmp");
            Files.writeString(temp, document, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", savesDirectory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            // the newest save must win resume even when several are written within one clock tick
            Files.setLastModifiedTime(target, FileTime.from(clock.instant()));
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CampaignException(CampaignErrorCode.PERSISTENCE_FAILED,
                "Could not save campaign '" + state.getName() + "': " + e.getMessage(), e);
        }
        log.info("Saved campaign '{}' to {}", state.getName(), target.getFileName());
        return target;
    }

    @Override
    public CompletableFuture<Path> saveAsync(CampaignState snapshot) {
        CompletableFuture<Path> future = CompletableFuture.supplyAsync(() -> save(snapshot), saveExecutor);
        future.whenComplete((path, error) -> {
            if (error != null) {
                log.error("Background save of '{}' failed", snapshot.getName(), error);
            }
        });
        return future;
    }

    @Override
    public CampaignState load(Path path) {
        String document;
        try {
            document = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CampaignException(CampaignErrorCode.PERSISTENCE_FAILED,
                "Could not read save " + path + ": " + e.getMessage(), e);
        }
        CampaignState state = parser.parse(document, path.getFileName().toString());
        log.info("Loaded campaign '{}' from {}", state.getName(), path.getFileName());
        return state;
    }

    @Override
    public ResumeResult resume(String campaignSlug) {
        return latest(listSaves().stream().filter(path -> campaignSlug.equals(SaveFileNames.slugOf(path))));
    }

    @Override
    public ResumeResult resumeLatest() {
        return latest(listSaves().stream());
    }

    @Override
    public List<Path> listSaves() {
        if (!Files.isDirectory(savesDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(savesDirectory)) {
            return files.filter(Files::isRegularFile)
                .filter(SaveFileNames::isSaveFile)
                .sorted(Comparator.comparing(MarkdownCampaignRepository::modifiedTime).reversed())
                .toList();
        } catch (IOException e) {
            throw new CampaignException(CampaignErrorCode.PERSISTENCE_FAILED,
                "Could not list saves in " + savesDirectory + ": " + e.getMessage(), e);
        }
    }

    private ResumeResult latest(Stream<Path> candidates) {
        Optional<Path> newest = candidates.findFirst();
        if (newest.isEmpty()) {
            log.info("No save found in {}", savesDirectory);
            return ResumeResult.noSaveFound();
        }
        return ResumeResult.restored(load(newest.get()), newest.get());
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary save {}: {}", path, e.getMessage());
        }
    }

    /**
     * Waits for queued saves to finish.
     */
    @Override
    public void close() {
        saveExecutor.shutdown();
        try {
            if (!saveExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Pending saves did not finish in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
