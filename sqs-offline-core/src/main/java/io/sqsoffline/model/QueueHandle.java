package io.sqsoffline.model;

import java.util.Map;
import java.util.Objects;

/**
 * Resolved reference to a queue on the backend.
 *
 * <p>Handles are created once per queue by the provisioner (or resolved lazily by the
 * delivery engine) and cached by name in {@link io.sqsoffline.provision.QueueRegistry}.
 *
 * @param name       the queue name
 * @param url        the backend URL used for all subsequent operations
 * @param attributes queue attributes known at resolution time
 */
public record QueueHandle(String name, String url, Map<String, String> attributes) {

  public QueueHandle {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(url, "url");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public QueueHandle(String name, String url) {
    this(name, url, Map.of());
  }
}
