package climate.layer.infrastructure.session;

import climate.layer.application.port.DurableStore;
import climate.layer.domain.model.session.EnabledLayer;
import climate.layer.domain.model.session.SessionPreferences;
import climate.layer.domain.model.session.SessionSnapshot;
import climate.layer.error.exception.InvalidSnapshotException;
import climate.layer.error.exception.SnapshotCorruptionException;
import climate.layer.infrastructure.executor.LogicExecutor;
import climate.layer.infrastructure.executor.TaskContext;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * 세션 메모리 (사용자 레이어/뷰포트/환경설정의 영속화)
 *
 * <h4>쓰기 모델</h4>
 *
 * <ul>
 *   <li>{@link #save}: 메모리 사본에 mutator 를 적용하고 debounce 후 한 번에 기록 (연속 저장은 하나로 합쳐짐)
 *   <li>{@link #flush}: 대기 중인 쓰기를 즉시 수행. 종료 시 {@link #close} 에서 호출됨
 *   <li>쓰기 실패는 WARN 로그만 남기고 메모리 상태는 유지 (다음 flush 에서 재시도)
 * </ul>
 *
 * <h4>읽기 모델</h4>
 *
 * <p>{@link #load} 는 시작 시 한 번 동기적으로 수행되며, 손상된 스냅샷은 기본값으로 대체됩니다. autoRestore 가 꺼져 있으면 환경설정만
 * 복원하고 레이어/뷰포트는 비웁니다.
 */
@Slf4j
public class SessionMemory implements AutoCloseable {

  private static final String COMPONENT = "SessionMemory";

  private final DurableStore store;
  private final String storageKey;
  private final SessionSnapshotCodec codec;
  private final TaskScheduler scheduler;
  private final Duration debounce;
  private final LogicExecutor executor;
  private final Clock clock;

  private final Object lock = new Object();
  private final Object flushLock = new Object();
  private SessionSnapshot current = SessionSnapshot.defaults();
  private ScheduledFuture<?> pendingFlush;
  private boolean dirty;

  public SessionMemory(
      DurableStore store,
      String storageKey,
      SessionSnapshotCodec codec,
      TaskScheduler scheduler,
      Duration debounce,
      LogicExecutor executor,
      Clock clock) {
    this.store = store;
    this.storageKey = storageKey;
    this.codec = codec;
    this.scheduler = scheduler;
    this.debounce = debounce;
    this.executor = executor;
    this.clock = clock;
  }

  /** 저장된 스냅샷을 읽어 현재 상태로 설정하고 사본을 반환 */
  public SessionSnapshot load() {
    SessionSnapshot loaded = readStored().orElseGet(SessionSnapshot::defaults);
    if (!loaded.getPreferences().autoRestore()) {
      log.info("[SessionMemory] autoRestore 비활성, 환경설정만 복원합니다");
      SessionSnapshot prefsOnly = SessionSnapshot.defaults();
      prefsOnly.setPreferences(loaded.getPreferences());
      loaded = prefsOnly;
    }
    synchronized (lock) {
      current = loaded;
      return current.copy();
    }
  }

  private Optional<SessionSnapshot> readStored() {
    Optional<byte[]> bytes =
        executor.executeOrDefault(
            () -> store.read(storageKey),
            Optional.empty(),
            TaskContext.of(COMPONENT, "Read", storageKey));
    if (bytes.isEmpty()) {
      return Optional.empty();
    }
    try {
      SessionSnapshot snapshot = codec.decode(bytes.get());
      log.info(
          "[SessionMemory] 스냅샷 로드 완료 (layers: {}, contexts: {})",
          snapshot.getEnabledLayers().size(),
          snapshot.getViewportByContext().size());
      return Optional.of(snapshot);
    } catch (IOException | IllegalArgumentException e) {
      log.warn(
          "[SessionMemory] 손상된 스냅샷, 기본값으로 시작합니다",
          new SnapshotCorruptionException(storageKey, e));
      return Optional.empty();
    }
  }

  /**
   * mutator 를 메모리 사본에 적용하고 debounce 된 쓰기를 예약
   *
   * <p>mutator 가 예외를 던지면 현재 상태는 변경되지 않습니다.
   */
  public void save(Consumer<SessionSnapshot> mutator) {
    synchronized (lock) {
      SessionSnapshot working = current.copy();
      mutator.accept(working);
      current = working;
      dirty = true;
      scheduleFlushLocked();
    }
  }

  private void scheduleFlushLocked() {
    if (pendingFlush != null) {
      pendingFlush.cancel(false);
    }
    pendingFlush = scheduler.schedule(this::flush, clock.instant().plus(debounce));
  }

  /** 대기 중인 변경을 즉시 기록 */
  public void flush() {
    synchronized (flushLock) {
      SessionSnapshot snapshot;
      synchronized (lock) {
        if (pendingFlush != null) {
          pendingFlush.cancel(false);
          pendingFlush = null;
        }
        if (!dirty) {
          return;
        }
        snapshot = current.copy();
        dirty = false;
      }
      boolean written =
          executor.executeOrDefault(
              () -> write(snapshot), Boolean.FALSE, TaskContext.of(COMPONENT, "Flush", storageKey));
      if (!written) {
        synchronized (lock) {
          dirty = true;
        }
      }
    }
  }

  private Boolean write(SessionSnapshot snapshot) throws IOException {
    store.write(storageKey, codec.encode(snapshot));
    log.debug("[SessionMemory] 스냅샷 저장 완료 (layers: {})", snapshot.getEnabledLayers().size());
    return Boolean.TRUE;
  }

  public SessionSnapshot current() {
    synchronized (lock) {
      return current.copy();
    }
  }

  public List<EnabledLayer> getEnabledLayers() {
    synchronized (lock) {
      return List.copyOf(current.getEnabledLayers());
    }
  }

  public SessionPreferences getPreferences() {
    synchronized (lock) {
      return current.getPreferences();
    }
  }

  public void updatePreferences(SessionPreferences preferences) {
    save(snapshot -> snapshot.setPreferences(preferences));
  }

  /** 영속화와 동일한 스키마의 JSON 바이트 */
  public byte[] exportSnapshot() {
    SessionSnapshot snapshot = current();
    return executor.execute(() -> codec.encode(snapshot), TaskContext.of(COMPONENT, "Export"));
  }

  /**
   * 내보낸 스냅샷으로 현재 상태를 교체하고 즉시 기록
   *
   * @throws InvalidSnapshotException 해석할 수 없는 바이트인 경우 (현재 상태는 유지)
   */
  public SessionSnapshot importSnapshot(byte[] bytes) {
    SessionSnapshot imported;
    try {
      imported = codec.decode(bytes);
    } catch (IOException | IllegalArgumentException e) {
      throw new InvalidSnapshotException(e.getMessage(), e);
    }
    synchronized (lock) {
      current = imported;
      dirty = true;
    }
    flush();
    log.info("[SessionMemory] 스냅샷 가져오기 완료 (layers: {})", imported.getEnabledLayers().size());
    return imported.copy();
  }

  /** 메모리 상태를 기본값으로 되돌리고 저장된 스냅샷을 삭제 */
  public void clear() {
    synchronized (flushLock) {
      synchronized (lock) {
        if (pendingFlush != null) {
          pendingFlush.cancel(false);
          pendingFlush = null;
        }
        current = SessionSnapshot.defaults();
        dirty = false;
      }
      executor.executeOrDefault(
          () -> {
            store.delete(storageKey);
            return Boolean.TRUE;
          },
          Boolean.FALSE,
          TaskContext.of(COMPONENT, "Delete", storageKey));
    }
    log.info("[SessionMemory] 세션 메모리 초기화");
  }

  @Override
  public void close() {
    flush();
  }
}
