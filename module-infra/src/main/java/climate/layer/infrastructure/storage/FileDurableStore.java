package climate.layer.infrastructure.storage;

import climate.layer.application.port.DurableStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 파일 시스템 기반 DurableStore
 *
 * <p>키마다 {@code sha256(key).bin} 파일 하나를 사용합니다. 쓰기는 임시 파일에 기록한 뒤 원자적 이동(ATOMIC_MOVE)으로 교체하므로
 * 읽는 쪽은 이전 값 또는 새 값만 보게 됩니다.
 */
@Slf4j
public class FileDurableStore implements DurableStore {

  private static final String SUFFIX = ".bin";
  private static final String TMP_SUFFIX = ".tmp";

  private final Path directory;

  public FileDurableStore(Path directory) throws IOException {
    this.directory = Files.createDirectories(directory);
  }

  @Override
  public Optional<byte[]> read(String key) throws IOException {
    try {
      return Optional.of(Files.readAllBytes(fileFor(key)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
  }

  @Override
  public void write(String key, byte[] value) throws IOException {
    Path target = fileFor(key);
    Path tmp = Files.createTempFile(directory, target.getFileName().toString(), TMP_SUFFIX);
    try {
      Files.write(tmp, value);
      moveAtomically(tmp, target);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  @Override
  public void delete(String key) throws IOException {
    Files.deleteIfExists(fileFor(key));
  }

  @Override
  public void clear() throws IOException {
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : files) {
        Files.deleteIfExists(file);
      }
    }
  }

  public Path getDirectory() {
    return directory;
  }

  private void moveAtomically(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("[DurableStore] ATOMIC_MOVE 미지원 파일시스템, 일반 교체로 대체: {}", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private Path fileFor(String key) {
    return directory.resolve(sha256Hex(key) + SUFFIX);
  }

  private static String sha256Hex(String key) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
