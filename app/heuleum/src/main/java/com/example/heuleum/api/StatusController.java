/*
 * Where: heuleum API
 * What: Root health text and a snapshot of the subscriber loop
 * Why: Operators can see whether the consumer is pulling, draining or stopped
 */
package com.example.heuleum.api;

import com.example.heuleum.worker.SubscriberLoop;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  private final ObjectProvider<SubscriberLoop> subscriberLoop;

  public StatusController(ObjectProvider<SubscriberLoop> subscriberLoop) {
    this.subscriberLoop = subscriberLoop;
  }

  @GetMapping("/")
  public String home() {
    return "heuleum: ok";
  }

  @GetMapping("/subscriber/status")
  public SubscriberStatusResponse subscriberStatus() {
    final SubscriberLoop loop = subscriberLoop.getIfAvailable();
    if (loop == null) {
      return new SubscriberStatusResponse(false, "DISABLED", 0, 0L);
    }
    return new SubscriberStatusResponse(
        true, loop.state().name(), loop.inFlightCount(), loop.trackedMessageCount());
  }
}
