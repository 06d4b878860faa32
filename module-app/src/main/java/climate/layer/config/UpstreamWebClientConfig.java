package climate.layer.config;

import climate.layer.infrastructure.external.WebClientUpstreamClient;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;
import reactor.netty.http.client.HttpClient;

/**
 * 업스트림 계산 서비스 WebClient 설정
 *
 * <p>연결 타임아웃만 HttpClient 에 두고, 응답 데드라인은 요청마다 레이어의 attempt-timeout 으로 적용합니다.
 *
 * @see UpstreamApiProperties
 */
@Configuration
public class UpstreamWebClientConfig {

  private final UpstreamApiProperties properties;

  public UpstreamWebClientConfig(UpstreamApiProperties properties) {
    this.properties = properties;
  }

  @Bean("upstreamWebClient")
  public WebClient upstreamWebClient() {
    // 파라미터 값만 인코딩 (경로는 카탈로그가 정의한 그대로)
    DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory(properties.baseUrl());
    factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.VALUES_ONLY);

    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) properties.connectTimeout().toMillis())
            .compress(true);

    return WebClient.builder()
        .uriBuilderFactory(factory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }

  @Bean
  public WebClientUpstreamClient upstreamClient(WebClient upstreamWebClient) {
    return new WebClientUpstreamClient(upstreamWebClient, properties.healthPath());
  }
}
