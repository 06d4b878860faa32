package climate.layer.domain.event;

@FunctionalInterface
public interface LayerStatusListener {
  void onStatusChange(LayerStatusEvent event);
}
