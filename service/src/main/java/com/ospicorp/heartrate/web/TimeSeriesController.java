package com.ospicorp.heartrate.web;

import com.ospicorp.heartrate.query.FanoutQueryExecutor;
import com.ospicorp.heartrate.query.MultiEntityResult;
import com.ospicorp.heartrate.query.OutputInterval;
import com.ospicorp.heartrate.query.QueryWindow;
import com.ospicorp.heartrate.query.TimeSeriesQueryService;
import com.ospicorp.heartrate.query.TimeSeriesResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Heart rate")
public class TimeSeriesController {
  private static final String USER_ID_REGEX = "^[A-Za-z0-9_.@-]{1,64}$";
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";
  static final int MAX_SINGLE_RANGE_DAYS = 365;
  static final int MAX_MULTI_RANGE_DAYS = 180;
  static final int MAX_USERS = 5;
  static final Duration DEFAULT_WINDOW = Duration.ofDays(7);
  private static final java.util.regex.Pattern DATE_TIME_SPACE =
      java.util.regex.Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) ");
  // a '+' sent unencoded in a query string arrives as a space
  private static final java.util.regex.Pattern UNENCODED_OFFSET =
      java.util.regex.Pattern.compile("(T\\d{2}:\\d{2}(?::\\d{2}(?:\\.\\d+)?)?) (\\d{2}(?::?\\d{2})?)$");

  private final TimeSeriesQueryService queryService;
  private final FanoutQueryExecutor fanout;
  private final Clock clock;
  private final ZoneOffset zoneOffset;
  private final List<String> defaultUsers;

  public TimeSeriesController(TimeSeriesQueryService queryService,
      FanoutQueryExecutor fanout,
      Clock clock,
      @Value("${timeseries.zone-offset:Z}") ZoneOffset zoneOffset,
      @Value("${query.default-users:user1,user2}") List<String> defaultUsers) {
    this.queryService = queryService;
    this.fanout = fanout;
    this.clock = clock;
    this.zoneOffset = zoneOffset;
    this.defaultUsers = List.copyOf(defaultUsers);
  }

  @GetMapping("/timeseries")
  @Operation(summary = "Get heart rate time series",
      description = "Heart rate for one user. The storage granularity follows the requested span; "
          + "an explicit interval re-aggregates the rows into buckets of that width.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Time-series points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = TimeSeriesResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> timeSeries(
      @RequestParam(name = "start_date", required = false)
      @Parameter(description = "Start of the range, ISO-8601 date or date-time", example = "2024-01-01T00:00:00Z") String startDate,
      @RequestParam(name = "end_date", required = false)
      @Parameter(description = "End of the range, ISO-8601 date or date-time", example = "2024-01-02T00:00:00Z") String endDate,
      @RequestParam(name = "user_id", required = false) @Pattern(regexp = USER_ID_REGEX)
      @Parameter(description = "User identifier; defaults to the first user with data", example = "user1") String userId,
      @RequestParam(required = false)
      @Parameter(description = "Output interval: 1s, 1m, 1h or 1d") String interval,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    MediaType mediaType = selectMediaType(format, accept);
    QueryWindow window = parseWindow(startDate, endDate, interval, MAX_SINGLE_RANGE_DAYS);
    String user = StringUtils.hasText(userId) ? userId : queryService.defaultUserId();

    TimeSeriesResult result = queryService.getTimeSeries(window, user);
    if (CsvHttpMessageConverter.TEXT_CSV.equals(mediaType)) {
      return ResponseEntity.ok()
          .contentType(CsvHttpMessageConverter.TEXT_CSV)
          .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=heart_rate_" + user + ".csv")
          .body(result.points());
    }
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(new TimeSeriesResponse(result.points(), new ResponseMetadata(result.queryInfo())));
  }

  @GetMapping("/multi-user/timeseries")
  @Operation(summary = "Get heart rate for several users",
      description = "Queries each user concurrently. A user whose query fails is returned with no data.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "One series per user",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = MultiUserResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public MultiUserResponse multiUserTimeSeries(
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(name = "user_ids", required = false)
      @Parameter(description = "Comma-separated user identifiers, at most 5", example = "user1,user2") String userIds,
      @RequestParam(required = false) String interval) {

    List<String> users = parseUsers(userIds);
    QueryWindow window = parseWindow(startDate, endDate, interval, MAX_MULTI_RANGE_DAYS);
    MultiEntityResult result = fanout.run(users, window);
    return new MultiUserResponse(result.series(), new ResponseMetadata(result.queryInfo()));
  }

  private QueryWindow parseWindow(String startDate, String endDate, String interval, int maxRangeDays) {
    OffsetDateTime end = StringUtils.hasText(endDate)
        ? parseDateTime(endDate, "end_date")
        : OffsetDateTime.now(clock).withOffsetSameInstant(zoneOffset);
    OffsetDateTime start = StringUtils.hasText(startDate)
        ? parseDateTime(startDate, "start_date")
        : end.minus(DEFAULT_WINDOW);
    if (!start.isBefore(end)) {
      throw invalidParameter("start_date must be before end_date", 2002);
    }
    if (Duration.between(start, end).toDays() > maxRangeDays) {
      throw invalidParameter("Date range cannot exceed " + maxRangeDays + " days", 2003);
    }
    return new QueryWindow(start, end, parseInterval(interval));
  }

  private OffsetDateTime parseDateTime(String value, String name) {
    String text = UNENCODED_OFFSET.matcher(DATE_TIME_SPACE.matcher(value.trim()).replaceFirst("$1T"))
        .replaceFirst("$1+$2");
    try {
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime;
      }
      return ((LocalDateTime) parsed).atOffset(zoneOffset);
    } catch (DateTimeParseException ex) {
      try {
        return LocalDate.parse(text).atStartOfDay().atOffset(zoneOffset);
      } catch (DateTimeParseException dateEx) {
        throw invalidParameter("Invalid " + name + " '" + value + "'. Use an ISO-8601 date or date-time"
            + " and URL-encode '+' in offsets as %2B.", 2001);
      }
    }
  }

  private static OutputInterval parseInterval(String interval) {
    if (!StringUtils.hasText(interval)) {
      return null;
    }
    return OutputInterval.fromToken(interval)
        .orElseThrow(() -> invalidParameter("Invalid interval value. Supported values: 1s,1m,1h,1d.", 2004));
  }

  private List<String> parseUsers(String userIds) {
    if (userIds == null) {
      return defaultUsers;
    }
    List<String> users = List.copyOf(new LinkedHashSet<>(Arrays.stream(userIds.split(","))
        .map(String::trim)
        .filter(StringUtils::hasText)
        .toList()));
    if (users.isEmpty()) {
      throw invalidParameter("user_ids must contain at least one user", 2007);
    }
    if (users.size() > MAX_USERS) {
      throw invalidParameter("Maximum " + MAX_USERS + " users allowed", 2006);
    }
    for (String user : users) {
      if (!user.matches(USER_ID_REGEX)) {
        throw invalidParameter("Invalid user id '" + user + "'", 2008);
      }
    }
    return users;
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 2005);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
