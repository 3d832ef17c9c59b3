package com.ospicorp.heartrate.web;

import com.ospicorp.heartrate.query.TimeSeriesQueryService;
import com.ospicorp.heartrate.query.UserSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Service")
public class RootController {

  private final TimeSeriesQueryService queryService;
  private final Clock clock;

  public RootController(TimeSeriesQueryService queryService, Clock clock) {
    this.queryService = queryService;
    this.clock = clock;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "service", "heart-rate-timeseries",
        "status", "ok",
        "endpoints", List.of("/timeseries", "/multi-user/timeseries", "/users", "/health"));
  }

  @GetMapping("/health")
  @Operation(summary = "Database connectivity check")
  public ResponseEntity<HealthResponse> health() {
    boolean reachable = queryService.databaseReachable();
    HealthResponse body = new HealthResponse(
        reachable ? "healthy" : "unhealthy",
        reachable ? "connected" : "unreachable",
        OffsetDateTime.now(clock));
    return ResponseEntity.status(reachable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  @GetMapping("/users")
  @Operation(summary = "List users with heart rate data")
  public UsersResponse users() {
    List<UserSummary> users = queryService.listUsers();
    return new UsersResponse(users, users.size());
  }
}
