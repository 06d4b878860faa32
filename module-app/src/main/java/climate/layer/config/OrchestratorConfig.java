package climate.layer.config;

import climate.layer.application.port.DurableStore;
import climate.layer.infrastructure.cache.CacheEntryCodec;
import climate.layer.infrastructure.cache.CacheKeyFactory;
import climate.layer.infrastructure.cache.TieredLayerCache;
import climate.layer.infrastructure.concurrency.RequestCoordinator;
import climate.layer.infrastructure.executor.DefaultLogicExecutor;
import climate.layer.infrastructure.executor.LogicExecutor;
import climate.layer.infrastructure.external.WebClientUpstreamClient;
import climate.layer.infrastructure.resilience.ReliabilityGate;
import climate.layer.infrastructure.resilience.ReliabilityProperties;
import climate.layer.infrastructure.session.SessionMemory;
import climate.layer.infrastructure.session.SessionSnapshotCodec;
import climate.layer.infrastructure.storage.FileDurableStore;
import climate.layer.infrastructure.storage.InMemoryDurableStore;
import climate.layer.service.health.UpstreamHealthMonitor;
import climate.layer.service.layer.DataSourceClassifier;
import climate.layer.service.layer.LayerCatalog;
import climate.layer.service.layer.LayerOrchestrator;
import climate.layer.service.layer.LayerOrchestrator.UpstreamResult;
import climate.layer.service.layer.LayerStateMachine;
import climate.layer.service.layer.ViewportChangePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

/**
 * 오케스트레이터 빈 구성
 *
 * <p>infra 모듈의 구성 요소는 스프링에 의존하지 않는 일반 클래스이므로 여기서 설정값과 함께 조립합니다. 캐시와 세션은 서로 다른 DurableStore
 * 네임스페이스(디렉터리)를 사용합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
  LayerCatalogProperties.class,
  CacheProperties.class,
  SessionProperties.class,
  UpstreamApiProperties.class,
  ViewportProperties.class,
  ReliabilityProperties.class
})
public class OrchestratorConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry);
  }

  // ==================== CacheStore ====================

  @Bean
  public CacheKeyFactory cacheKeyFactory(ObjectMapper objectMapper) {
    return new CacheKeyFactory(objectMapper);
  }

  @Bean
  public TieredLayerCache layerCache(
      CacheProperties properties,
      ObjectMapper objectMapper,
      LogicExecutor logicExecutor,
      Clock clock,
      MeterRegistry meterRegistry)
      throws IOException {
    DurableStore durable =
        properties.hasDurableDirectory()
            ? new FileDurableStore(Path.of(properties.durableDirectory()))
            : new InMemoryDurableStore();
    log.info("[CacheStore] L2 저장소: {}", describe(durable, properties.durableDirectory()));
    return new TieredLayerCache(
        properties.memoryMaxEntries(),
        durable,
        new CacheEntryCodec(objectMapper),
        logicExecutor,
        clock,
        meterRegistry);
  }

  // ==================== ReliabilityGate / RequestCoordinator ====================

  @Bean
  public ReliabilityGate reliabilityGate(
      ReliabilityProperties properties,
      Clock clock,
      @Qualifier("upstreamAttemptExecutor") Executor upstreamAttemptExecutor,
      MeterRegistry meterRegistry) {
    return new ReliabilityGate(properties, clock, upstreamAttemptExecutor, meterRegistry);
  }

  @Bean
  public RequestCoordinator<UpstreamResult> requestCoordinator(
      @Qualifier("layerFetchExecutor") Executor layerFetchExecutor, MeterRegistry meterRegistry) {
    return new RequestCoordinator<>(layerFetchExecutor, meterRegistry);
  }

  // ==================== SessionMemory ====================

  @Bean
  public SessionMemory sessionMemory(
      SessionProperties properties,
      ObjectMapper objectMapper,
      TaskScheduler taskScheduler,
      LogicExecutor logicExecutor,
      Clock clock)
      throws IOException {
    DurableStore store =
        properties.hasDirectory()
            ? new FileDurableStore(Path.of(properties.directory()))
            : new InMemoryDurableStore();
    log.info("[SessionMemory] 저장소: {}", describe(store, properties.directory()));
    return new SessionMemory(
        store,
        properties.storageKey(),
        new SessionSnapshotCodec(objectMapper),
        taskScheduler,
        properties.debounce(),
        logicExecutor,
        clock);
  }

  // ==================== Layer services ====================

  @Bean
  public LayerCatalog layerCatalog(
      LayerCatalogProperties catalogProperties,
      CacheProperties cacheProperties,
      ReliabilityProperties reliabilityProperties) {
    return new LayerCatalog(
        catalogProperties,
        cacheProperties.defaultTtl(),
        reliabilityProperties.defaultAttemptTimeout());
  }

  @Bean
  public LayerStateMachine layerStateMachine(Clock clock) {
    return new LayerStateMachine(clock);
  }

  @Bean
  public DataSourceClassifier dataSourceClassifier(ObjectMapper objectMapper) {
    return new DataSourceClassifier(objectMapper);
  }

  @Bean
  public LayerOrchestrator layerOrchestrator(
      LayerCatalog catalog,
      CacheKeyFactory cacheKeyFactory,
      TieredLayerCache layerCache,
      RequestCoordinator<UpstreamResult> requestCoordinator,
      ReliabilityGate reliabilityGate,
      WebClientUpstreamClient upstreamClient,
      DataSourceClassifier dataSourceClassifier,
      LayerStateMachine layerStateMachine,
      SessionMemory sessionMemory,
      ViewportProperties viewportProperties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new LayerOrchestrator(
        catalog,
        cacheKeyFactory,
        layerCache,
        requestCoordinator,
        reliabilityGate,
        upstreamClient,
        dataSourceClassifier,
        layerStateMachine,
        sessionMemory,
        new ViewportChangePolicy(viewportProperties),
        clock,
        meterRegistry);
  }

  @Bean
  public UpstreamHealthMonitor upstreamHealthMonitor(
      WebClientUpstreamClient upstreamClient,
      UpstreamApiProperties properties,
      LogicExecutor logicExecutor,
      Clock clock) {
    return new UpstreamHealthMonitor(
        upstreamClient,
        logicExecutor,
        clock,
        properties.healthTimeout(),
        properties.healthStaleAfter());
  }

  private static String describe(DurableStore store, String directory) {
    return store instanceof FileDurableStore ? "file (" + directory + ")" : "in-memory";
  }
}
