package climate.layer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class LayerOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LayerOrchestratorApplication.class, args);
  }
}
