package climate.layer.domain.event;

/** Handle returned by a subscribe call. Unsubscribing more than once has no effect. */
@FunctionalInterface
public interface Subscription {
  void unsubscribe();
}
