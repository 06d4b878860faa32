package climate.layer.infrastructure.storage;

import climate.layer.application.port.DurableStore;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** 프로세스 메모리 기반 DurableStore (영속 디렉터리를 지정하지 않은 경우 및 테스트용) */
public class InMemoryDurableStore implements DurableStore {

  private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> read(String key) {
    byte[] value = entries.get(key);
    return value == null ? Optional.empty() : Optional.of(Arrays.copyOf(value, value.length));
  }

  @Override
  public void write(String key, byte[] value) {
    entries.put(key, Arrays.copyOf(value, value.length));
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  @Override
  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }
}
