package com.findawise.pointers.infrastructure.persistence;

import com.findawise.pointers.application.port.MetricsPort;
import com.findawise.pointers.application.port.PointerStorePort;
import com.findawise.pointers.domain.pointer.ContentPointer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PointerStorePort} keeping one JSON document per pointer under a
 * directory.
 *
 * <p><strong>Durability:</strong> each save writes a sibling temp file and moves it over the target,
 * atomically where the filesystem supports it, so readers never observe a half-written document.
 *
 * <p><strong>Recovery:</strong> unreadable documents are logged, counted as
 * {@code pointer.store.corrupt} and skipped by {@link #loadAll()}.
 */
public final class JsonFilePointerStore implements PointerStorePort {
  private static final Logger log = LoggerFactory.getLogger(JsonFilePointerStore.class);
  private static final String SUFFIX = ".json";

  private final Path directory;
  private final PointerJsonCodec codec = new PointerJsonCodec();
  private final MetricsPort metrics;

  /**
   * Opens (and creates when missing) the store directory.
   *
   * @param directory store root
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IOException when the directory cannot be created
   */
  public JsonFilePointerStore(Path directory, MetricsPort metrics) throws IOException {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    Files.createDirectories(this.directory);
  }

  public Path directory() {
    return directory;
  }

  @Override
  public void save(ContentPointer pointer) throws IOException {
    Path target = fileFor(pointer.id());
    Path temp = directory.resolve(target.getFileName() + ".tmp");
    Files.write(temp, codec.encode(pointer));
    try {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  @Override
  public void delete(String pointerId) throws IOException {
    Files.deleteIfExists(fileFor(pointerId));
  }

  @Override
  public List<ContentPointer> loadAll() throws IOException {
    List<ContentPointer> loaded = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : files) {
        try {
          loaded.add(codec.decode(Files.readAllBytes(file)));
        } catch (IOException | RuntimeException ex) {
          metrics.increment("pointer.store.corrupt");
          log.warn("Skipping unreadable pointer document {}", file.getFileName(), ex);
        }
      }
    }
    loaded.sort(Comparator.comparing(ContentPointer::createdAt).thenComparing(ContentPointer::id));
    return List.copyOf(loaded);
  }

  Path fileFor(String pointerId) {
    return directory.resolve(fileName(pointerId));
  }

  /** Ids outside {@code [A-Za-z0-9_-]} are hex-escaped so every id maps to one flat file name. */
  static String fileName(String pointerId) {
    Objects.requireNonNull(pointerId, "pointerId");
    if (pointerId.isBlank()) {
      throw new IllegalArgumentException("pointerId must not be blank");
    }
    StringBuilder name = new StringBuilder(pointerId.length() + SUFFIX.length());
    for (byte b : pointerId.getBytes(StandardCharsets.UTF_8)) {
      char c = (char) (b & 0xFF);
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-' || c == '_') {
        name.append(c);
      } else {
        name.append('%').append(String.format("%02X", b & 0xFF));
      }
    }
    return name.append(SUFFIX).toString();
  }
}
