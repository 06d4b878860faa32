package climate.layer.infrastructure.external;

import climate.layer.application.port.ComputeRequest;
import climate.layer.application.port.UpstreamComputePort;
import climate.layer.application.port.UpstreamHealthPort;
import climate.layer.error.exception.TransientNetworkException;
import climate.layer.error.exception.UpstreamErrorException;
import climate.layer.error.exception.base.BaseException;
import climate.layer.infrastructure.resilience.UpstreamFailures;
import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * WebClient 기반 업스트림 계산 클라이언트
 *
 * <p>레이어 파라미터는 쿼리 스트링으로 전달합니다 (컬렉션은 같은 이름으로 반복). 모든 실패는 타입 예외로 변환됩니다:
 *
 * <ul>
 *   <li>HTTP 오류 응답 → UpstreamValidation (4xx) / UpstreamError (5xx, 408, 429)
 *   <li>연결 실패 → TransientNetwork
 *   <li>데드라인 초과 → UpstreamTimeout
 * </ul>
 *
 * <p>재시도와 서킷은 이 클래스가 아니라 ReliabilityGate 가 담당합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientUpstreamClient implements UpstreamComputePort, UpstreamHealthPort {

  private final WebClient upstreamWebClient;
  private final String healthPath;

  @Override
  public String compute(ComputeRequest request) {
    log.debug("[Upstream] {} 계산 요청: {}", request.layerId(), request.route());
    Mono<String> body =
        upstreamWebClient
            .get()
            .uri(builder -> buildUri(builder, request.route(), request.params()))
            .retrieve()
            .onStatus(HttpStatusCode::isError, WebClientUpstreamClient::toStatusError)
            .bodyToMono(String.class)
            .defaultIfEmpty("{}");
    return block(body, request.layerId(), request.deadline());
  }

  @Override
  public void ping(Duration timeout) {
    Mono<String> body =
        upstreamWebClient
            .get()
            .uri(healthPath)
            .retrieve()
            .onStatus(HttpStatusCode::isError, WebClientUpstreamClient::toStatusError)
            .bodyToMono(String.class)
            .defaultIfEmpty("");
    block(body, "health", timeout);
  }

  private String block(Mono<String> body, String endpoint, Duration deadline) {
    try {
      return deadline != null ? body.timeout(deadline).block() : body.block();
    } catch (RuntimeException e) {
      throw translate(endpoint, deadline, e);
    }
  }

  private static BaseException translate(String endpoint, Duration deadline, RuntimeException e) {
    Throwable cause = Exceptions.unwrap(e);
    if (cause instanceof WebClientRequestException) {
      return new TransientNetworkException(endpoint, cause);
    }
    return UpstreamFailures.normalize(endpoint, deadline, cause);
  }

  private static Mono<? extends Throwable> toStatusError(ClientResponse response) {
    int status = response.statusCode().value();
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> (Throwable) UpstreamFailures.fromStatus(status, body))
        .onErrorResume(e -> Mono.just(new UpstreamErrorException(status, "", e)));
  }

  /** 값은 URI 변수로 바인딩하여 인코딩하고, 중괄호 등이 템플릿으로 해석되지 않게 합니다. */
  private static URI buildUri(UriBuilder builder, String route, Map<String, Object> params) {
    builder.path(route);
    Map<String, Object> variables = new HashMap<>();
    params.forEach(
        (name, value) -> {
          if (value instanceof Collection<?> values) {
            values.forEach(v -> bind(builder, variables, name, v));
          } else if (value != null) {
            bind(builder, variables, name, value);
          }
        });
    return builder.build(variables);
  }

  private static void bind(
      UriBuilder builder, Map<String, Object> variables, String name, Object value) {
    String variable = "p" + variables.size();
    variables.put(variable, String.valueOf(value));
    builder.queryParam(name, "{" + variable + "}");
  }
}
