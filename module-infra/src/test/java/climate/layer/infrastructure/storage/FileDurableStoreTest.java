package climate.layer.infrastructure.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
@DisplayName("FileDurableStore 테스트")
class FileDurableStoreTest {

  @TempDir Path dir;

  @Test
  @DisplayName("쓰기 후 읽기, 덮어쓰기는 새 값만 보인다")
  void writeReadOverwrite() throws Exception {
    FileDurableStore store = new FileDurableStore(dir);

    store.write("temperature:{\"year\":2050}", bytes("v1"));
    store.write("temperature:{\"year\":2050}", bytes("v2"));

    assertThat(store.read("temperature:{\"year\":2050}"))
        .hasValueSatisfying(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo("v2"));
  }

  @Test
  @DisplayName("없는 키는 empty")
  void missingKey() throws Exception {
    assertThat(new FileDurableStore(dir).read("nope")).isEmpty();
  }

  @Test
  @DisplayName("재시작(새 인스턴스) 후에도 값이 남아 있다")
  void survivesNewInstance() throws Exception {
    new FileDurableStore(dir).write("k", bytes("persisted"));

    assertThat(new FileDurableStore(dir).read("k")).isPresent();
  }

  @Test
  @DisplayName("clear 는 엔트리 파일을 모두 지우고 임시 파일을 남기지 않는다")
  void clearRemovesEntries() throws Exception {
    FileDurableStore store = new FileDurableStore(dir);
    store.write("a", bytes("1"));
    store.write("b", bytes("2"));

    store.clear();

    try (Stream<Path> files = Files.list(dir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  @DisplayName("delete 는 없는 키에도 실패하지 않는다")
  void deleteIsIdempotent() throws Exception {
    FileDurableStore store = new FileDurableStore(dir);
    store.write("a", bytes("1"));

    store.delete("a");
    store.delete("a");

    assertThat(store.read("a")).isEmpty();
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
