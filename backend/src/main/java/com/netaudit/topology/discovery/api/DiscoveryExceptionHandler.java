package com.netaudit.topology.discovery.api;

import com.netaudit.topology.discovery.service.ActiveDiscoveryRunException;
import com.netaudit.topology.discovery.service.DiscoveryPreflightException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(ActiveDiscoveryRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveDiscoveryRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_discovery_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(DiscoveryPreflightException.class)
  public ResponseEntity<Map<String, String>> handlePreflight(DiscoveryPreflightException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "preflight_failed", "message", ex.getMessage()));
  }
}
