package com.example.hotelops.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Plain-text liveness line for load balancers that do not speak actuator. */
@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }
}
