package climate.layer.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable key/value byte storage that survives process restarts.
 *
 * <p>Each instance owns a namespace; {@link #clear()} removes only that namespace's entries.
 * Writes are atomic per key: a reader sees either the previous value or the new one, never a
 * partial write.
 */
public interface DurableStore {

  Optional<byte[]> read(String key) throws IOException;

  void write(String key, byte[] value) throws IOException;

  void delete(String key) throws IOException;

  void clear() throws IOException;
}
