package io.shogun.api.shipping;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-logs/shipping")
public class ShippingStatusController {

  private final LogShippingQueue shippingQueue;

  public ShippingStatusController(LogShippingQueue shippingQueue) {
    this.shippingQueue = shippingQueue;
  }

  @GetMapping("/status")
  public ResponseEntity<ShippingStatus> getStatus() {
    return ResponseEntity.ok(shippingQueue.getStatus());
  }
}
